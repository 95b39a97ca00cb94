package org.gjslint;

import java.util.ArrayDeque;
import java.util.Deque;

import org.gjslint.utils.TokenUtil;

/**
 * State tracker for JavaScript. Functions wrapped in {@code goog.scope(function() {...})} only alias names, so
 * their bodies still count as top level and are not reported as being inside a function.
 */
public class JavaScriptStateTracker extends StateTracker
{
	private int scopeDepth;
	private Deque<Token> blockStack;

	public JavaScriptStateTracker()
	{
		scopeDepth = 0;
		blockStack = new ArrayDeque<>();
	}

	@Override
	public void reset()
	{
		scopeDepth = 0;
		blockStack = new ArrayDeque<>();
		super.reset();
	}

	/**
	 * Top level is outside of any parentheses except those of goog.scope wrappers.
	 */
	@Override
	public boolean inTopLevel()
	{
		return scopeDepth == getParenthesesDepth();
	}

	/**
	 * goog.scope wrapper functions are not counted.
	 */
	@Override
	public boolean inFunction()
	{
		return scopeDepth != getFunctionDepth();
	}

	public boolean inNonScopeBlock()
	{
		return scopeDepth != getBlockDepth();
	}

	public int getScopeDepth()
	{
		return scopeDepth;
	}

	/**
	 * A block after ')', the end of a parameter list or a keyword other than return is code, anything else
	 * opens an object literal.
	 */
	@Override
	public BlockType getBlockType(Token token)
	{
		Token lastCode = TokenUtil.getPreviousCodeToken(token);
		if (lastCode != null && lastCode.isAnyType(TokenType.END_PARAMETERS, TokenType.END_PAREN, TokenType.KEYWORD)
			&& !lastCode.isKeyword("return"))
		{
			return BlockType.CODE;
		}
		return BlockType.OBJECT_LITERAL;
	}

	/**
	 * Start token of the innermost open block, or {@code null}.
	 */
	public Token getCurrentBlockStart()
	{
		return blockStack.peek();
	}

	@Override
	public void handleToken(Token token, Token lastNonSpaceToken)
	{
		if (token.isType(TokenType.START_BLOCK))
		{
			blockStack.push(token);
		}
		if (token.isType(TokenType.IDENTIFIER) && token.getString().equals("goog.scope"))
		{
			scopeDepth++;
		}
		if (token.isType(TokenType.END_BLOCK))
		{
			Token startToken = blockStack.poll();
			if (startToken != null && TokenUtil.getGoogScopeFromStartBlock(startToken) != null)
			{
				scopeDepth--;
			}
		}

		super.handleToken(token, lastNonSpaceToken);
	}
}
