package org.gjslint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.gjslint.utils.TokenUtil;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Documentation comment: its start and end tokens and the flags it declares.
 */
public class DocComment
{
	private final Token startToken;
	private Token endToken = null;
	private final List<DocFlag> flags = new ArrayList<>();
	private final Map<String, Token> suppressions = new LinkedHashMap<>();
	private boolean invalidated = false;

	public DocComment(Token startToken)
	{
		this.startToken = startToken;
	}

	public Token getStartToken()
	{
		return startToken;
	}

	public Token getEndToken()
	{
		return endToken;
	}

	void setEndToken(Token endToken)
	{
		this.endToken = endToken;
	}

	/**
	 * Names of documented parameters in order of appearance.
	 */
	public List<String> getOrderedParams()
	{
		List<String> params = new ArrayList<>();
		for (DocFlag flag : flags)
		{
			if (flag.getFlagType().equals("param") && flag.getName() != null)
			{
				params.add(flag.getName());
			}
		}
		return params;
	}

	/**
	 * Marks the comment as well-formed but not understood, checks based on it must not report anything.
	 */
	public void invalidate()
	{
		invalidated = true;
	}

	public boolean isInvalidated()
	{
		return invalidated;
	}

	/**
	 * Adds suppressions listed in the braces after a {@code @suppress} flag, e.g. {@code @suppress {visibility|with}}.
	 */
	void addSuppression(Token token)
	{
		Token brace = TokenUtil.searchUntil(token, ImmutableSet.of(TokenType.DOC_START_BRACE),
			ImmutableSet.of(TokenType.DOC_FLAG), TokenUtil.UNBOUNDED, false);
		if (brace != null)
		{
			String contents = DocFlag.getMatchingEndBraceAndContents(brace).contents;
			for (String suppression : Splitter.on('|').trimResults().omitEmptyStrings().split(contents))
			{
				suppressions.put(suppression, token);
			}
		}
	}

	public Map<String, Token> getSuppressions()
	{
		return Collections.unmodifiableMap(suppressions);
	}

	public boolean hasSuppression(String suppression)
	{
		return suppressions.containsKey(suppression);
	}

	/**
	 * Whether the comment contains nothing but suppression flags.
	 */
	public boolean isSuppressionOnly()
	{
		if (flags.isEmpty())
		{
			return false;
		}
		return flags.stream().allMatch(flag -> flag.getFlagType().equals("suppress"));
	}

	void addFlag(DocFlag flag)
	{
		flags.add(flag);
	}

	public List<DocFlag> getFlags()
	{
		return Collections.unmodifiableList(flags);
	}

	/**
	 * Whether documentation may be taken from the super class.
	 */
	public boolean inheritsDocumentation()
	{
		return hasFlag("inheritDoc") || hasFlag("override");
	}

	public boolean hasFlag(String flagType)
	{
		return flags.stream().anyMatch(flag -> flag.getFlagType().equals(flagType));
	}

	/**
	 * Returns the last flag of the given type, or {@code null}.
	 */
	public DocFlag getFlag(String flagType)
	{
		for (DocFlag flag : Lists.reverse(flags))
		{
			if (flag.getFlagType().equals(flagType))
			{
				return flag;
			}
		}
		return null;
	}

	/**
	 * Free text of the comment before its first flag.
	 */
	public String getDescription()
	{
		List<Token> tokens = new ArrayList<>();
		for (Token token = startToken.getNext(); token != null && token != endToken; token = token.getNext())
		{
			if (token.isType(TokenType.DOC_FLAG) || !token.isComment())
			{
				break;
			}
			if (!token.isAnyType(TokenType.START_DOC_COMMENT, TokenType.END_DOC_COMMENT, TokenType.DOC_PREFIX))
			{
				tokens.add(token);
			}
		}
		return TokenUtil.tokensToString(tokens).trim();
	}

	/**
	 * Returns the full identifier the comment documents, even when it is split by whitespace or comments.
	 */
	public String getTargetIdentifier()
	{
		Token token = getTargetToken();
		return token != null ? TokenUtil.getIdentifierForToken(token) : null;
	}

	/**
	 * Returns the token this comment documents: the name of a var declaration, of a function or the target of
	 * an assignment. File overviews have no target.
	 */
	public Token getTargetToken()
	{
		if (hasFlag("fileoverview") || endToken == null)
		{
			return null;
		}

		for (Token token = endToken.getNext(); token != null; token = token.getNext())
		{
			if (token.isAnyType(TokenType.FUNCTION_NAME, TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE))
			{
				return token;
			}

			// var foo = ...
			if (token.isAnyKeyword("var", "let", "const"))
			{
				Token nextCode = TokenUtil.getNextCodeToken(token);
				return nextCode != null && nextCode.isType(TokenType.SIMPLE_LVALUE) ? nextCode : null;
			}

			// function foo() {}
			if (token.isType(TokenType.FUNCTION_DECLARATION))
			{
				Token nextCode = TokenUtil.getNextCodeToken(token);
				return nextCode != null && nextCode.isType(TokenType.FUNCTION_NAME) ? nextCode : null;
			}

			// Whitespace, blank lines, opening parens and plain comments are skipped, anything else ends the search.
			boolean plainComment = token.isAnyType(TokenType.START_SINGLE_LINE_COMMENT, TokenType.START_BLOCK_COMMENT,
				TokenType.END_BLOCK_COMMENT, TokenType.COMMENT);
			if (!token.isAnyType(TokenType.WHITESPACE, TokenType.BLANK_LINE, TokenType.START_PAREN) && !plainComment)
			{
				return null;
			}
		}
		return null;
	}

	@Override
	public String toString()
	{
		return "<DocComment: " + getOrderedParams() + ", " + flags + ">";
	}
}
