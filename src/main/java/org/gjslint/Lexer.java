package org.gjslint;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Regular expression based lexer. Every mode owns an ordered list of matchers, the first matcher that
 * matches at the current position wins and may switch the mode. Text that nothing matches is collected
 * into a token of the mode's default type, so lexing never fails.
 */
public class Lexer
{
	private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

	private static final List<TokenMatcher> COMMON_DOC_MATCHERS = ImmutableList.of(
		// Find the end of the comment.
		new TokenMatcher(Reg.END_BLOCK_COMMENT, TokenType.END_DOC_COMMENT, LexerMode.TEXT),

		// Documented flags like @private.
		new TokenMatcher(Reg.DOC_INLINE_FLAG, TokenType.DOC_INLINE_FLAG, null, false, "name"),
		new TokenMatcher(Reg.DOC_FLAG_LEX_SPACES, TokenType.DOC_FLAG, LexerMode.DOC_COMMENT_LEX_SPACES, false, "name"),

		// Any other doc flag leaves lex spaces mode.
		new TokenMatcher(Reg.DOC_FLAG, TokenType.DOC_FLAG, LexerMode.DOC_COMMENT, false, "name"),

		// Braces are tokenized so that types can be found.
		new TokenMatcher(Reg.START_BLOCK, TokenType.DOC_START_BRACE),
		new TokenMatcher(Reg.END_BLOCK, TokenType.DOC_END_BRACE),
		new TokenMatcher(Reg.DOC_PREFIX, TokenType.DOC_PREFIX, null, true)
	);

	private static final Map<LexerMode, List<TokenMatcher>> MATCHERS = Maps.immutableEnumMap(createMatchers());

	private LexerMode mode = LexerMode.TEXT;
	private TokenChain chain = null;
	private int lineNumber = 0;
	private int startIndex = 0;

	private static Map<LexerMode, List<TokenMatcher>> createMatchers()
	{
		Map<LexerMode, List<TokenMatcher>> matchers = new EnumMap<>(LexerMode.class);

		// Strings, comments and regular expressions come first since they may contain each other:
		// 'string with /regex/', /regex with 'string'/, /* comment with /regex/ and string */.
		matchers.put(LexerMode.TEXT, ImmutableList.of(
			new TokenMatcher(Reg.START_DOC_COMMENT, TokenType.START_DOC_COMMENT, LexerMode.DOC_COMMENT),
			new TokenMatcher(Reg.START_BLOCK_COMMENT, TokenType.START_BLOCK_COMMENT, LexerMode.BLOCK_COMMENT),
			new TokenMatcher(Reg.END_OF_LINE_SINGLE_LINE_COMMENT, TokenType.START_SINGLE_LINE_COMMENT),
			new TokenMatcher(Reg.START_SINGLE_LINE_COMMENT, TokenType.START_SINGLE_LINE_COMMENT, LexerMode.LINE_COMMENT),
			new TokenMatcher(Reg.SINGLE_QUOTE, TokenType.SINGLE_QUOTE_STRING_START, LexerMode.SINGLE_QUOTE_STRING),
			new TokenMatcher(Reg.DOUBLE_QUOTE, TokenType.DOUBLE_QUOTE_STRING_START, LexerMode.DOUBLE_QUOTE_STRING),
			new TokenMatcher(Reg.REGEX, TokenType.REGEX),

			new TokenMatcher(Reg.START_BLOCK, TokenType.START_BLOCK),
			new TokenMatcher(Reg.END_BLOCK, TokenType.END_BLOCK),

			new TokenMatcher(Reg.FUNCTION_DECLARATION, TokenType.FUNCTION_DECLARATION, LexerMode.FUNCTION),

			new TokenMatcher(Reg.OPENING_PAREN, TokenType.START_PAREN),
			new TokenMatcher(Reg.CLOSING_PAREN, TokenType.END_PAREN),
			new TokenMatcher(Reg.OPENING_BRACKET, TokenType.START_BRACKET),
			new TokenMatcher(Reg.CLOSING_BRACKET, TokenType.END_BRACKET),

			// Numbers go before operators, exponents may contain + and -.
			new TokenMatcher(Reg.NUMBER, TokenType.NUMBER),

			new TokenMatcher(Reg.SIMPLE_LVALUE, TokenType.SIMPLE_LVALUE, null, false, "identifier"),
			new TokenMatcher(Reg.OPERATOR, TokenType.OPERATOR),

			new TokenMatcher(Reg.KEYWORD, TokenType.KEYWORD),
			new TokenMatcher(Reg.WHITESPACE, TokenType.WHITESPACE),
			new TokenMatcher(Reg.IDENTIFIER, TokenType.IDENTIFIER),
			new TokenMatcher(Reg.SEMICOLON, TokenType.SEMICOLON)
		));

		matchers.put(LexerMode.SINGLE_QUOTE_STRING, ImmutableList.of(
			new TokenMatcher(Reg.SINGLE_QUOTE_TEXT, TokenType.STRING_TEXT),
			new TokenMatcher(Reg.SINGLE_QUOTE, TokenType.SINGLE_QUOTE_STRING_END, LexerMode.TEXT)
		));

		matchers.put(LexerMode.DOUBLE_QUOTE_STRING, ImmutableList.of(
			new TokenMatcher(Reg.DOUBLE_QUOTE_TEXT, TokenType.STRING_TEXT),
			new TokenMatcher(Reg.DOUBLE_QUOTE, TokenType.DOUBLE_QUOTE_STRING_END, LexerMode.TEXT)
		));

		matchers.put(LexerMode.BLOCK_COMMENT, ImmutableList.of(
			new TokenMatcher(Reg.END_BLOCK_COMMENT, TokenType.END_BLOCK_COMMENT, LexerMode.TEXT),
			new TokenMatcher(Reg.BLOCK_COMMENT_TEXT, TokenType.COMMENT)
		));

		matchers.put(LexerMode.DOC_COMMENT, ImmutableList.<TokenMatcher>builder()
			.addAll(COMMON_DOC_MATCHERS)
			.add(new TokenMatcher(Reg.DOC_COMMENT_TEXT, TokenType.COMMENT))
			.build());

		matchers.put(LexerMode.DOC_COMMENT_LEX_SPACES, ImmutableList.<TokenMatcher>builder()
			.addAll(COMMON_DOC_MATCHERS)
			.add(new TokenMatcher(Reg.WHITESPACE, TokenType.COMMENT))
			.add(new TokenMatcher(Reg.DOC_COMMENT_NO_SPACES_TEXT, TokenType.COMMENT))
			.build());

		// Line comment takes the rest of the line.
		matchers.put(LexerMode.LINE_COMMENT, ImmutableList.of(
			new TokenMatcher(Reg.ANYTHING, TokenType.COMMENT, LexerMode.TEXT)
		));

		// Opening paren must be matched first, otherwise the parameters are lexed as code.
		matchers.put(LexerMode.FUNCTION, ImmutableList.of(
			new TokenMatcher(Reg.OPENING_PAREN, TokenType.START_PARAMETERS, LexerMode.PARAMETER),
			new TokenMatcher(Reg.WHITESPACE, TokenType.WHITESPACE),
			new TokenMatcher(Reg.IDENTIFIER, TokenType.FUNCTION_NAME)
		));

		matchers.put(LexerMode.PARAMETER, ImmutableList.of(
			new TokenMatcher(Reg.CLOSING_PAREN_WITH_SPACE, TokenType.END_PARAMETERS, LexerMode.TEXT),
			new TokenMatcher(Reg.PARAMETERS, TokenType.PARAMETERS, LexerMode.PARAMETER)
		));

		return matchers;
	}

	/**
	 * Tokenizes the whole source. Lines are separated by '\n', trailing '\r' and '\f' are not part of any token.
	 *
	 * @param source source text.
	 * @return chain of all tokens, every line contributes at least one token.
	 */
	public TokenChain tokenize(String source)
	{
		mode = LexerMode.TEXT;
		chain = new TokenChain();
		lineNumber = 0;

		String[] lines = StringUtils.splitPreserveAllTokens(StringUtils.defaultString(source), '\n');
		if (ArrayUtils.isEmpty(lines))
		{
			lines = new String[] { "" };
		}

		for (String line : lines)
		{
			lineNumber++;
			tokenizeLine(line);
		}

		LOG.debug("Tokenized {} lines into {} tokens, final mode is {}", lineNumber, chain.size(), mode);
		return chain;
	}

	/**
	 * Mode the lexer ended in. Anything other than {@link LexerMode#TEXT} after {@link #tokenize(String)}
	 * means that the source ended inside a string, a comment or a parameter list.
	 */
	public LexerMode getMode()
	{
		return mode;
	}

	private void tokenizeLine(String line)
	{
		String string = StringUtils.stripEnd(line, "\n\r\f");
		startIndex = 0;

		if (string.isEmpty())
		{
			addToken(new Token("", TokenType.BLANK_LINE, line, lineNumber, null));
			return;
		}

		StringBuilder normalToken = new StringBuilder();
		int index = 0;
		while (index < string.length())
		{
			boolean matched = false;
			for (TokenMatcher matcher : MATCHERS.get(mode))
			{
				Matcher m = matcher.matchAt(string, index);
				if (m == null)
				{
					continue;
				}

				if (normalToken.length() > 0)
				{
					addToken(new Token(normalToken.toString(), mode.getDefaultType(), line, lineNumber, null));
					normalToken.setLength(0);
				}

				addToken(new Token(m.group(), matcher.getType(), line, lineNumber, getValues(matcher, m)));

				if (matcher.getResultMode() != null)
				{
					mode = matcher.getResultMode();
				}

				index = m.end();
				matched = true;
				break;
			}

			// Unmatched characters are collected into a token of the default type of the mode.
			if (!matched)
			{
				normalToken.append(string.charAt(index));
				index++;
			}
		}

		if (normalToken.length() > 0)
		{
			addToken(new Token(normalToken.toString(), mode.getDefaultType(), line, lineNumber, null));
		}
	}

	private Map<String, String> getValues(TokenMatcher matcher, Matcher m)
	{
		if (matcher.getGroupNames().isEmpty())
		{
			return null;
		}

		Map<String, String> values = new HashMap<>();
		for (String name : matcher.getGroupNames())
		{
			String value = m.group(name);
			if (value != null)
			{
				values.put(name, value);
			}
		}
		return values;
	}

	private void addToken(Token token)
	{
		token.setStartIndex(startIndex);
		startIndex += token.getLength();
		chain.add(token);
	}
}
