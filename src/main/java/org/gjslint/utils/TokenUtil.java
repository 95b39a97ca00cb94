package org.gjslint.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import org.apache.commons.lang3.StringUtils;
import org.gjslint.Token;
import org.gjslint.TokenType;

/**
 * Side-effect free queries over a token chain.
 */
public final class TokenUtil
{
	/**
	 * Distance value which means that search continues up to the end (or the start) of the chain.
	 */
	public static final int UNBOUNDED = -1;

	private TokenUtil()
	{
	}

	/**
	 * Compares position of two tokens in the chain.
	 *
	 * @return negative value, zero or positive value as the first token is before, at the same place, or
	 *         after the second one.
	 */
	public static int compare(Token token1, Token token2)
	{
		if (token1.getLineNumber() != token2.getLineNumber())
		{
			return token1.getLineNumber() - token2.getLineNumber();
		}
		return token1.getStartIndex() - token2.getStartIndex();
	}

	/**
	 * Returns the first token after (or before) the start token for which {@code func} holds.
	 *
	 * @param startToken token to start from, it is never tested itself.
	 * @param func predicate of the wanted token.
	 * @param endFunc predicate which aborts the search, may be {@code null}.
	 * @param distance maximum number of tokens to look through, or {@link #UNBOUNDED}.
	 * @param reverse search backwards if {@code true}.
	 * @return found token or {@code null}.
	 */
	public static Token customSearch(Token startToken, Predicate<Token> func, Predicate<Token> endFunc, int distance,
		boolean reverse)
	{
		Token token = startToken;
		while (token != null && (distance == UNBOUNDED || distance > 0))
		{
			Token next = reverse ? token.getPrevious() : token.getNext();
			if (next != null)
			{
				if (func.test(next))
				{
					return next;
				}
				if (endFunc != null && endFunc.test(next))
				{
					return null;
				}
			}

			token = next;
			if (distance != UNBOUNDED)
			{
				distance--;
			}
		}
		return null;
	}

	public static Token search(Token startToken, Collection<TokenType> types, int distance, boolean reverse)
	{
		return customSearch(startToken, t -> t.isAnyType(types), null, distance, reverse);
	}

	public static Token search(Token startToken, TokenType type)
	{
		return customSearch(startToken, t -> t.isType(type), null, UNBOUNDED, false);
	}

	/**
	 * Returns the first token whose type is not one of {@code types}.
	 */
	public static Token searchExcept(Token startToken, Collection<TokenType> types, int distance, boolean reverse)
	{
		return customSearch(startToken, t -> !t.isAnyType(types), null, distance, reverse);
	}

	/**
	 * Returns the first token of one of {@code types}, unless a token of one of {@code endTypes} comes first.
	 */
	public static Token searchUntil(Token startToken, Collection<TokenType> types, Collection<TokenType> endTypes,
		int distance, boolean reverse)
	{
		return customSearch(startToken, t -> t.isAnyType(types), t -> t.isAnyType(endTypes), distance, reverse);
	}

	public static Token getPreviousCodeToken(Token token)
	{
		return customSearch(token, Token::isCode, null, UNBOUNDED, true);
	}

	public static Token getNextCodeToken(Token token)
	{
		return customSearch(token, Token::isCode, null, UNBOUNDED, false);
	}

	/**
	 * Returns tokens from start to end inclusive, or {@code null} if end is not reachable from start.
	 */
	public static List<Token> getTokenRange(Token start, Token end)
	{
		if (start.getChain() != end.getChain() || start.getIndex() > end.getIndex())
		{
			return null;
		}

		List<Token> tokens = new ArrayList<>();
		for (int i = start.getIndex(); i <= end.getIndex(); i++)
		{
			tokens.add(start.getChain().get(i));
		}
		return Collections.unmodifiableList(tokens);
	}

	/**
	 * Joins texts of the tokens, tokens on different lines are separated with '\n'.
	 */
	public static String tokensToString(List<Token> tokens)
	{
		StringBuilder sb = new StringBuilder();
		Token last = null;
		for (Token token : tokens)
		{
			if (last != null && last.getLineNumber() != token.getLineNumber())
			{
				sb.append('\n');
			}
			sb.append(token.getString());
			last = token;
		}
		return sb.toString();
	}

	public static boolean isDot(Token token)
	{
		return token != null && token.isType(TokenType.NORMAL) && token.getString().equals(".");
	}

	/**
	 * Returns the {@code goog.scope} token if the start block token opens the body of a goog.scope wrapper:
	 * <pre>
	 * goog.scope(function() {
	 *      5    4    3    21 ^
	 * </pre>
	 *
	 * @return the goog.scope token or {@code null}.
	 */
	public static Token getGoogScopeFromStartBlock(Token startBlock)
	{
		if (startBlock == null || !startBlock.isType(TokenType.START_BLOCK))
		{
			return null;
		}

		Token maybeGoogScope = startBlock;
		for (int i = 0; i < 5 && maybeGoogScope != null; i++)
		{
			maybeGoogScope = getPreviousCodeToken(maybeGoogScope);
		}

		return maybeGoogScope != null && maybeGoogScope.getString().equals("goog.scope") ? maybeGoogScope : null;
	}

	/**
	 * Rebuilds a dotted identifier which starts at the given token and may be split by whitespace or comments,
	 * e.g. {@code goog.foo.\n bar} is {@code goog.foo.bar}.
	 *
	 * @return identifier, or {@code null} if the token does not start an identifier.
	 */
	public static String getIdentifierForToken(Token token)
	{
		if (token == null || !token.isAnyType(TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE))
		{
			return null;
		}

		Token previousCode = getPreviousCodeToken(token);
		if (previousCode != null && (isDot(previousCode)
			|| (previousCode.isType(TokenType.IDENTIFIER) && previousCode.getString().endsWith("."))))
		{
			return null;
		}

		StringBuilder identifier = new StringBuilder();
		boolean expectName = true;
		for (Token t = token; t != null; t = t.getNext())
		{
			if (!t.isCode())
			{
				continue;
			}

			if (expectName && t.isAnyType(TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE))
			{
				identifier.append(t.getString());
				expectName = t.getString().endsWith(".");
			}
			else if (!expectName && isDot(t))
			{
				identifier.append('.');
				expectName = true;
			}
			else
			{
				break;
			}
		}

		return StringUtils.defaultIfEmpty(identifier.toString(), null);
	}
}
