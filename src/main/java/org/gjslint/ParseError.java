package org.gjslint;

import org.apache.commons.lang3.StringUtils;

/**
 * Structural error found by {@link MetadataPass}. It is returned, not thrown: a file with a parse error is
 * analyzed up to the offending token only.
 */
public final class ParseError
{
	private final Token token;
	private final String message;
	private final boolean endOfFile;

	public ParseError(Token token, String message)
	{
		this(token, message, false);
	}

	private ParseError(Token token, String message, boolean endOfFile)
	{
		this.token = token;
		this.message = StringUtils.defaultString(message);
		this.endOfFile = endOfFile;
	}

	/**
	 * Terminal variant produced when the root context is popped at the end of input.
	 */
	static ParseError endOfFile(Token lastToken)
	{
		return new ParseError(lastToken, "Reached end of file", true);
	}

	public Token getToken()
	{
		return token;
	}

	public String getMessage()
	{
		return message;
	}

	public boolean isEndOfFile()
	{
		return endOfFile;
	}

	@Override
	public String toString()
	{
		return "ParseError(" + message + (token != null ? ", line " + token.getLineNumber() : "") + ")";
	}
}
