package org.gjslint;

import java.util.Set;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.google.common.collect.ImmutableSet;

/**
 * Immutable settings of a lint run. Instances are passed explicitly to the runner, the checker and the rules.
 */
public final class LintConfig {
	public static final int DEFAULT_MAX_LINE_LENGTH = 80;
	public static final Set<String> DEFAULT_LIMITED_DOC_FILES = ImmutableSet.of("dummy.js", "externs.js");

	private static final LintConfig DEFAULT = builder().build();

	private final int maxLineLength;
	private final boolean jsdoc;
	private final boolean strict;
	private final Set<Integer> disabledErrors;
	private final Set<String> limitedDocFiles;

	private LintConfig(Builder builder) {
		this.maxLineLength = builder.maxLineLength;
		this.jsdoc = builder.jsdoc;
		this.strict = builder.strict;
		this.disabledErrors = builder.disabledErrors.build();
		this.limitedDocFiles = builder.limitedDocFiles != null ? builder.limitedDocFiles.build()
			: DEFAULT_LIMITED_DOC_FILES;
	}

	public static LintConfig defaults() {
		return DEFAULT;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads configuration from a JSON object, e.g.
	 * <pre>
	 * { "maxLineLength": 100, "jsdoc": false, "disable": [110, 300], "limitedDocFiles": ["externs.js"] }
	 * </pre>
	 * Unknown keys are ignored.
	 *
	 * @throws GJSLintException if the text is not a JSON object or a known key has a value of the wrong type.
	 */
	public static LintConfig fromJson(String json) {
		JsonValue value;
		try {
			value = Json.parse(json);
		} catch (ParseException e) {
			throw new GJSLintException("Configuration is not valid JSON: " + e.getMessage(), e);
		}

		if (!value.isObject()) {
			throw new GJSLintException("Configuration must be a JSON object");
		}

		JsonObject object = value.asObject();
		Builder builder = builder();

		JsonValue maxLineLength = object.get("maxLineLength");
		if (maxLineLength != null) {
			builder.maxLineLength(asInt("maxLineLength", maxLineLength));
		}

		JsonValue jsdoc = object.get("jsdoc");
		if (jsdoc != null) {
			builder.jsdoc(asBoolean("jsdoc", jsdoc));
		}

		JsonValue strict = object.get("strict");
		if (strict != null) {
			builder.strict(asBoolean("strict", strict));
		}

		JsonValue disable = object.get("disable");
		if (disable != null) {
			for (JsonValue code : asArray("disable", disable)) {
				builder.disableError(asInt("disable", code));
			}
		}

		JsonValue limitedDocFiles = object.get("limitedDocFiles");
		if (limitedDocFiles != null) {
			builder.clearLimitedDocFiles();
			for (JsonValue file : asArray("limitedDocFiles", limitedDocFiles)) {
				if (!file.isString()) {
					throw wrongType("limitedDocFiles", "an array of strings");
				}
				builder.limitedDocFile(file.asString());
			}
		}

		return builder.build();
	}

	private static int asInt(String name, JsonValue value) {
		if (!value.isNumber()) {
			throw wrongType(name, "a number");
		}
		try {
			return value.asInt();
		} catch (NumberFormatException e) {
			throw new GJSLintException("Option '" + name + "' must be an integer, got " + value, e);
		}
	}

	private static boolean asBoolean(String name, JsonValue value) {
		if (!value.isBoolean()) {
			throw wrongType(name, "a boolean");
		}
		return value.asBoolean();
	}

	private static Iterable<JsonValue> asArray(String name, JsonValue value) {
		if (!value.isArray()) {
			throw wrongType(name, "an array");
		}
		return value.asArray();
	}

	private static GJSLintException wrongType(String name, String expected) {
		return new GJSLintException("Option '" + name + "' must be " + expected);
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	/**
	 * Whether errors about missing documentation are reported.
	 */
	public boolean isJsdoc() {
		return jsdoc;
	}

	public boolean isStrict() {
		return strict;
	}

	public Set<Integer> getDisabledErrors() {
		return disabledErrors;
	}

	public Set<String> getLimitedDocFiles() {
		return limitedDocFiles;
	}

	/**
	 * Whether documentation checks are relaxed for the file. Only the last path segment is compared.
	 */
	public boolean isLimitedDocFile(String filename) {
		if (filename == null) {
			return false;
		}
		String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
		return limitedDocFiles.contains(name);
	}

	public boolean shouldReportError(ErrorCode code) {
		if (disabledErrors.contains(code.getNumber())) {
			return false;
		}
		return jsdoc || !ErrorCode.MISSING_DOCUMENTATION.contains(code);
	}

	@Override
	public String toString() {
		return "LintConfig{maxLineLength=" + maxLineLength + ", jsdoc=" + jsdoc + ", strict=" + strict
			+ ", disabledErrors=" + disabledErrors + ", limitedDocFiles=" + limitedDocFiles + "}";
	}

	public static final class Builder {
		private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
		private boolean jsdoc = true;
		private boolean strict = false;
		private final ImmutableSet.Builder<Integer> disabledErrors = ImmutableSet.builder();
		private ImmutableSet.Builder<String> limitedDocFiles = null;

		private Builder() {
		}

		public Builder maxLineLength(int maxLineLength) {
			if (maxLineLength <= 0) {
				throw new GJSLintException("Maximum line length must be positive, got " + maxLineLength);
			}
			this.maxLineLength = maxLineLength;
			return this;
		}

		public Builder jsdoc(boolean jsdoc) {
			this.jsdoc = jsdoc;
			return this;
		}

		public Builder strict(boolean strict) {
			this.strict = strict;
			return this;
		}

		public Builder disableError(int code) {
			disabledErrors.add(code);
			return this;
		}

		public Builder disableError(ErrorCode code) {
			return disableError(code.getNumber());
		}

		public Builder limitedDocFile(String filename) {
			if (limitedDocFiles == null) {
				limitedDocFiles = ImmutableSet.builder();
			}
			limitedDocFiles.add(filename);
			return this;
		}

		// An empty list in the configuration means no file is limited.
		private Builder clearLimitedDocFiles() {
			limitedDocFiles = ImmutableSet.builder();
			return this;
		}

		public LintConfig build() {
			return new LintConfig(this);
		}
	}
}
