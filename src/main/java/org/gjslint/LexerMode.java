package org.gjslint;

public enum LexerMode
{
	TEXT("text"),
	SINGLE_QUOTE_STRING("single_quote_string"),
	DOUBLE_QUOTE_STRING("double_quote_string"),
	BLOCK_COMMENT("block_comment"),
	DOC_COMMENT("doc_comment", TokenType.COMMENT),
	DOC_COMMENT_LEX_SPACES("doc_comment_spaces", TokenType.COMMENT),
	LINE_COMMENT("line_comment"),
	PARAMETER("parameter"),
	FUNCTION("function");

	private final String value;
	private final TokenType defaultType;

	LexerMode(String value)
	{
		this(value, TokenType.NORMAL);
	}

	LexerMode(String value, TokenType defaultType)
	{
		this.value = value;
		this.defaultType = defaultType;
	}

	/**
	 * Type given to text that no matcher of this mode recognizes.
	 */
	public TokenType getDefaultType()
	{
		return defaultType;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
