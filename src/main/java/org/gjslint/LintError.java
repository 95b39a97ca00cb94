package org.gjslint;

import java.util.Comparator;

import org.apache.commons.lang3.StringUtils;

/**
 * A single finding: error code, message and the place in the file it refers to.
 */
public class LintError
{
	/**
	 * Orders errors by line, then by position in the line.
	 */
	public static final Comparator<LintError> ORDER = Comparator.comparingInt(LintError::getLineNumber)
		.thenComparingInt(LintError::getStartIndex);

	private final ErrorCode code;
	private final String message;
	private final Token token;
	private final Position position;
	private final Object fixData;
	private final int startIndex;

	public LintError(ErrorCode code, String message)
	{
		this(code, message, null, null, null);
	}

	public LintError(ErrorCode code, String message, Token token)
	{
		this(code, message, token, null, null);
	}

	/**
	 * @param code error code.
	 * @param message message for humans.
	 * @param token offending token, may be {@code null} for file level errors.
	 * @param position part of the token the error is about, may be {@code null}.
	 * @param fixData additional data for automatic fixing, may be {@code null}.
	 */
	public LintError(ErrorCode code, String message, Token token, Position position, Object fixData)
	{
		this.code = code;
		this.message = StringUtils.defaultString(message);
		this.token = token;
		this.position = position;
		this.fixData = fixData;
		this.startIndex = (token != null ? token.getStartIndex() : 0) + (position != null ? position.getStart() : 0);
	}

	public ErrorCode getCode()
	{
		return code;
	}

	public String getMessage()
	{
		return message;
	}

	public Token getToken()
	{
		return token;
	}

	public Position getPosition()
	{
		return position;
	}

	public Object getFixData()
	{
		return fixData;
	}

	public int getStartIndex()
	{
		return startIndex;
	}

	public int getLineNumber()
	{
		return token != null ? token.getLineNumber() : 0;
	}

	@Override
	public String toString()
	{
		return "Line " + getLineNumber() + ", E:" + String.format("%04d", code.getNumber()) + ": " + message;
	}
}
