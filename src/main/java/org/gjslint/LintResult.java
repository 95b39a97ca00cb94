package org.gjslint;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Everything one lint run produced for a file.
 */
public final class LintResult
{
	private final String filename;
	private final TokenChain tokens;
	private final LexerMode finalMode;
	private final ContextTree contextTree;
	private final ParseError parseError;
	private final List<LintError> errors;

	LintResult(String filename, TokenChain tokens, LexerMode finalMode, ContextTree contextTree, ParseError parseError,
		List<LintError> errors)
	{
		this.filename = filename;
		this.tokens = tokens;
		this.finalMode = finalMode;
		this.contextTree = contextTree;
		this.parseError = parseError;
		this.errors = ImmutableList.copyOf(errors);
	}

	public String getFilename()
	{
		return filename;
	}

	public TokenChain getTokens()
	{
		return tokens;
	}

	/**
	 * Lexer mode at the end of the file, {@link LexerMode#TEXT} unless the file ended inside a string or a
	 * comment.
	 */
	public LexerMode getFinalMode()
	{
		return finalMode;
	}

	public ContextTree getContextTree()
	{
		return contextTree;
	}

	/**
	 * Structural error which stopped the analysis, or {@code null}.
	 */
	public ParseError getParseError()
	{
		return parseError;
	}

	/**
	 * Reported errors in order of their position.
	 */
	public List<LintError> getErrors()
	{
		return errors;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean hasError(ErrorCode code)
	{
		return errors.stream().anyMatch(error -> error.getCode() == code);
	}
}
