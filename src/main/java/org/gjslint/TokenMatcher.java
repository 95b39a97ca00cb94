package org.gjslint;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

/**
 * Pattern that produces one token of a given type and optionally switches lexer into another mode.
 */
public final class TokenMatcher
{
	private final Pattern pattern;
	private final TokenType type;
	private final LexerMode resultMode;
	private final boolean lineStart;
	private final List<String> groupNames;

	public TokenMatcher(Pattern pattern, TokenType type)
	{
		this(pattern, type, null, false);
	}

	public TokenMatcher(Pattern pattern, TokenType type, LexerMode resultMode)
	{
		this(pattern, type, resultMode, false);
	}

	/**
	 * @param pattern pattern to match at the current position.
	 * @param type type of the produced token.
	 * @param resultMode mode to switch to after a match, {@code null} keeps the current one.
	 * @param lineStart whether the pattern may only match at the beginning of a line.
	 * @param groupNames named groups of the pattern that are copied into token values.
	 */
	public TokenMatcher(Pattern pattern, TokenType type, LexerMode resultMode, boolean lineStart, String... groupNames)
	{
		this.pattern = pattern;
		this.type = type;
		this.resultMode = resultMode;
		this.lineStart = lineStart;
		this.groupNames = ImmutableList.copyOf(groupNames);
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public TokenType getType()
	{
		return type;
	}

	public LexerMode getResultMode()
	{
		return resultMode;
	}

	public boolean isLineStart()
	{
		return lineStart;
	}

	public List<String> getGroupNames()
	{
		return groupNames;
	}

	/**
	 * Tries to match pattern exactly at the given index of the line. Text before the index stays visible for
	 * look-behind, but {@code ^} only matches at the real beginning of the line.
	 *
	 * @return matcher positioned on a non-empty match, or {@code null}.
	 */
	Matcher matchAt(String line, int index)
	{
		if (lineStart && index > 0)
		{
			return null;
		}

		Matcher m = pattern.matcher(line);
		m.useAnchoringBounds(false);
		m.useTransparentBounds(true);
		m.region(index, line.length());

		if (m.lookingAt() && m.end() > index)
		{
			return m;
		}
		return null;
	}
}
