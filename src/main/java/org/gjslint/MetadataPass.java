package org.gjslint;

import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.gjslint.Context.Type;
import org.gjslint.utils.TokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

/**
 * Walks the token chain once and builds the context tree, attaching {@link TokenMetadata} to every token.
 * Statement ends without a semicolon and one line blocks without braces are inferred from the layout.
 */
public class MetadataPass
{
	private static final Logger LOG = LoggerFactory.getLogger(MetadataPass.class);

	private static final Set<String> IMPLIED_BLOCK_KEYWORDS = ImmutableSet.of("if", "for", "while");

	private static final Set<Type> COMMA_STOP_TYPES = EnumSet.of(
		Type.VAR, Type.ARRAY_LITERAL, Type.OBJECT_LITERAL, Type.STATEMENT, Type.PARAMETERS, Type.GROUP);

	private ContextTree tree = null;
	private Context context = null;
	private Token token = null;
	private Token lastCode = null;
	private ParseError error = null;
	private ParseError endOfFile = null;
	private boolean atEndOfInput = false;

	public MetadataPass()
	{
		reset();
	}

	/**
	 * Prepares the pass for the next file.
	 */
	public void reset()
	{
		tree = new ContextTree();
		token = null;
		context = null;
		lastCode = null;
		error = null;
		endOfFile = null;
		atEndOfInput = false;
		addContext(Type.ROOT);
	}

	public ContextTree getContextTree()
	{
		return tree;
	}

	/**
	 * The swallowed terminal error of the last {@link #process(TokenChain)}, it is set when the pass reached
	 * the end of input and closed the root context.
	 */
	public ParseError getEndOfFile()
	{
		return endOfFile;
	}

	/**
	 * Processes the whole chain.
	 *
	 * @return structural error, or {@code null} if the chain was processed up to its end. Tokens after the
	 *         error token have no metadata.
	 */
	public ParseError process(TokenChain chain)
	{
		reset();
		tree.getRoot().setStartToken(chain.getFirst());

		for (Token t : chain)
		{
			token = t;
			processToken();

			if (error != null)
			{
				LOG.warn("Structural error at line {}: {}", t.getLineNumber(), error.getMessage());
				return error;
			}

			if (token.isCode())
			{
				lastCode = token;
			}
		}

		// Contexts still open at the end of input end with the last token, popping the root ends the pass.
		token = chain.getLast();
		atEndOfInput = true;
		popContextType(Type.ROOT);
		if (error != null && error.isEndOfFile())
		{
			endOfFile = error;
			error = null;
		}

		LOG.debug("Built {} contexts for {} tokens", tree.size(), chain.size());
		return error;
	}

	private void addContext(Type type)
	{
		context = tree.create(type, token, context);
	}

	/**
	 * Moves up one level in the context stack.
	 *
	 * @return the former context, or {@code null} if it was the root one.
	 */
	private Context popContext()
	{
		Context top = context;
		top.setEndToken(token);

		Context parent = top.getParent();
		if (parent == null)
		{
			error = atEndOfInput ? ParseError.endOfFile(token)
				: new ParseError(token, "Unexpected " + token.getString() + ", no context left to close");
			return null;
		}

		context = parent;
		return top;
	}

	/**
	 * Pops the context stack until a context of one of the given types is popped.
	 *
	 * @return the popped context of a stop type, or {@code null} on error.
	 */
	private Context popContextType(Type... stopTypes)
	{
		Set<Type> types = stopTypes.length > 0 ? EnumSet.of(stopTypes[0], stopTypes) : EnumSet.noneOf(Type.class);
		Context last = null;
		while (last == null || !types.contains(last.getType()))
		{
			last = popContext();
			if (last == null)
			{
				return null;
			}
		}
		return last;
	}

	/**
	 * Ends the current statement. A statement that is the single statement of an implied block also closes
	 * that block.
	 */
	private void endStatement()
	{
		if (popContextType(Type.STATEMENT) == null)
		{
			return;
		}

		if (context.isType(Type.IMPLIED_BLOCK))
		{
			token.getMetadata().setImpliedBlockClose(true);
			popContext();
		}
	}

	private void processToken()
	{
		TokenMetadata metadata = new TokenMetadata();
		token.setMetadata(metadata);
		metadata.setLastCode(lastCode);

		Context result = processContext();
		metadata.setContext(result != null ? result : context);
		if (error != null)
		{
			return;
		}

		if (token.isType(TokenType.OPERATOR))
		{
			metadata.setOperatorType(getOperatorType(token));
		}

		if (!token.isType(TokenType.SEMICOLON) && isImpliedSemicolon())
		{
			metadata.setImpliedSemicolon(true);
			endStatement();
		}
	}

	/**
	 * Updates the context stack for the current token.
	 *
	 * @return the context the token belongs to, or {@code null} if it is the current one after processing.
	 */
	private Context processContext()
	{
		TokenType tokenType = token.getType();

		// A code token in a block starts a statement. Switch bodies only contain case and default sections,
		// array literals contain elements.
		if (Context.BLOCK_TYPES.contains(context.getType()) && token.isCode()
			&& !token.isType(TokenType.END_BLOCK))
		{
			Context parent = context.getParent();
			if (parent == null || !parent.isType(Type.SWITCH))
			{
				addContext(Type.STATEMENT);
			}
		}
		else if (context.isType(Type.ARRAY_LITERAL) && token.isCode() && !token.isType(TokenType.END_BRACKET))
		{
			addContext(Type.LITERAL_ELEMENT);
		}

		if (tokenType == TokenType.START_PAREN)
		{
			// For loops contain several statements in their group, unlike if, while and switch.
			if (lastCode != null && lastCode.isKeyword("for"))
			{
				addContext(Type.FOR_GROUP_BLOCK);
			}
			else
			{
				addContext(Type.GROUP);
			}
		}
		else if (tokenType == TokenType.END_PAREN)
		{
			Context result = popContextType(Type.GROUP, Type.FOR_GROUP_BLOCK);
			if (result == null)
			{
				return null;
			}

			// There is no keyword if the open paren starts the file.
			Token keywordToken = result.getStartToken().getMetadata().getLastCode();
			if (keywordToken != null && IMPLIED_BLOCK_KEYWORDS.contains(keywordToken.getString()))
			{
				Token nextCode = TokenUtil.searchExcept(token, TokenType.NON_CODE_TYPES, TokenUtil.UNBOUNDED, false);
				if ((nextCode == null || !nextCode.isType(TokenType.START_BLOCK)) && !isDoWhile(keywordToken))
				{
					addContext(Type.IMPLIED_BLOCK);
					token.getMetadata().setImpliedBlock(true);
				}
			}
			return result;
		}
		else if (token.isKeyword("else"))
		{
			// else with no open brace after it starts an implied block, unless it is else if.
			Token nextCode = TokenUtil.searchExcept(token, TokenType.NON_CODE_TYPES, TokenUtil.UNBOUNDED, false);
			if (nextCode == null || (!nextCode.isType(TokenType.START_BLOCK) && !nextCode.isKeyword("if")))
			{
				addContext(Type.IMPLIED_BLOCK);
				token.getMetadata().setImpliedBlock(true);
			}
		}
		else if (tokenType == TokenType.START_PARAMETERS)
		{
			addContext(Type.PARAMETERS);
		}
		else if (tokenType == TokenType.END_PARAMETERS)
		{
			return popContextType(Type.PARAMETERS);
		}
		else if (tokenType == TokenType.START_BRACKET)
		{
			if (lastCode != null && lastCode.isAnyType(TokenType.EXPRESSION_ENDER_TYPES))
			{
				addContext(Type.INDEX);
			}
			else
			{
				addContext(Type.ARRAY_LITERAL);
			}
		}
		else if (tokenType == TokenType.END_BRACKET)
		{
			return popContextType(Type.INDEX, Type.ARRAY_LITERAL);
		}
		else if (tokenType == TokenType.START_BLOCK)
		{
			if (isBlockStart())
			{
				addContext(Type.BLOCK);
			}
			else
			{
				addContext(Type.OBJECT_LITERAL);
			}
		}
		else if (tokenType == TokenType.END_BLOCK)
		{
			Context result = popContextType(Type.BLOCK, Type.OBJECT_LITERAL);
			// The body of a switch is its only block.
			if (result != null && context.isType(Type.SWITCH))
			{
				return popContext();
			}
			return result;
		}
		else if (token.isKeyword("switch"))
		{
			addContext(Type.SWITCH);
		}
		else if (token.isAnyKeyword("case", "default") && !context.isType(Type.OBJECT_LITERAL))
		{
			// Pop up to but not including the switch block.
			while (true)
			{
				Context parent = context.getParent();
				if (parent == null)
				{
					error = new ParseError(token, "Encountered case/default statement without switch statement");
					return null;
				}
				if (parent.isType(Type.SWITCH))
				{
					break;
				}
				popContext();
			}
		}
		else if (token.isOperator("?"))
		{
			addContext(Type.TERNARY_TRUE);
		}
		else if (token.isOperator(":"))
		{
			processColon();
		}
		else if (token.isAnyKeyword("var", "let", "const"))
		{
			addContext(Type.VAR);
		}
		else if (token.isOperator(","))
		{
			while (!COMMA_STOP_TYPES.contains(context.getType()))
			{
				if (popContext() == null)
				{
					return null;
				}
			}
		}
		else if (tokenType == TokenType.SEMICOLON)
		{
			endStatement();
		}

		return null;
	}

	private void processColon()
	{
		Context parent = context.getParent();

		if (context.isType(Type.OBJECT_LITERAL))
		{
			addContext(Type.LITERAL_ELEMENT);
		}
		else if (context.isType(Type.TERNARY_TRUE))
		{
			popContext();
			addContext(Type.TERNARY_FALSE);
		}
		// Nested ternary like foo = bar ? baz ? 1 : 2 : 3, the second ':' is reached inside
		// ternary_false > ternary_true > statement > root.
		else if (context.isType(Type.TERNARY_FALSE) && parent != null && parent.isType(Type.TERNARY_TRUE))
		{
			popContext();
			popContext();
			addContext(Type.TERNARY_FALSE);
		}
		else if (parent != null && parent.isType(Type.SWITCH))
		{
			addContext(Type.CASE_BLOCK);
		}
	}

	/**
	 * Whether a '{' opens a block rather than an object literal. else, do, try and finally may have no ()
	 * before '{', and case 10: {...} is a block too.
	 */
	private boolean isBlockStart()
	{
		if (lastCode == null)
		{
			return false;
		}

		return lastCode.isAnyType(TokenType.END_PAREN, TokenType.END_PARAMETERS)
			|| lastCode.isAnyKeyword("else", "do", "try", "finally")
			|| (lastCode.isOperator(":") && lastCode.getMetadata().getContext().isType(Type.CASE_BLOCK));
	}

	/**
	 * Whether the keyword is the while of do {...} while (...).
	 */
	private boolean isDoWhile(Token keywordToken)
	{
		Token preKeywordToken = keywordToken.getMetadata().getLastCode();
		if (preKeywordToken == null || !preKeywordToken.isType(TokenType.END_BLOCK))
		{
			return false;
		}

		Token blockStart = preKeywordToken.getMetadata().getContext().getStartToken();
		Token beforeBlock = blockStart != null ? blockStart.getMetadata().getLastCode() : null;
		return beforeBlock != null && beforeBlock.getString().equals("do");
	}

	private boolean isImpliedSemicolon()
	{
		if (!token.isCode())
		{
			return false;
		}

		Token nextCode = TokenUtil.searchExcept(token, TokenType.NON_CODE_TYPES, TokenUtil.UNBOUNDED, false);
		boolean isLastCodeInLine = nextCode == null || nextCode.getLineNumber() != token.getLineNumber();
		if (!isLastCodeInLine || !statementCouldEndInContext())
		{
			return false;
		}

		// Line ends in the middle of a multi-line string.
		if (token.isType(TokenType.STRING_TEXT))
		{
			return false;
		}
		// Closing brace of a block is handled by popping the block.
		if (token.isType(TokenType.END_BLOCK) && !token.getMetadata().getContext().isType(Type.OBJECT_LITERAL))
		{
			return false;
		}
		// var
		//     a = 1;
		if (token.isAnyKeyword("var", "let", "const") && nextCode != null
			&& nextCode.isAnyType(TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE)
			&& token.getLineNumber() < nextCode.getLineNumber())
		{
			return false;
		}
		if (token.isType(TokenType.IDENTIFIER) && StringUtils.endsWith(token.getString(), "."))
		{
			return false;
		}
		if (token.isType(TokenType.OPERATOR) && !token.getMetadata().isUnaryPostOperator())
		{
			return false;
		}
		if (token.getString().equals("."))
		{
			return false;
		}
		if (nextCode != null && (nextCode.getString().equals(".") || nextCode.isType(TokenType.OPERATOR)))
		{
			return false;
		}
		// A statement like if (x) does not need a semicolon after it.
		if (context.isType(Type.IMPLIED_BLOCK))
		{
			return false;
		}
		return nextCode == null || !nextCode.isType(TokenType.START_BLOCK);
	}

	/**
	 * Whether the current statement, if any, may end in the current context.
	 */
	private boolean statementCouldEndInContext()
	{
		if (context.isType(Type.STATEMENT) || context.isType(Type.VAR))
		{
			return true;
		}

		// End of a ternary false branch can end the statement too:
		// var x = foo ? foo.bar() : null
		// where the stack is ternary_false > var > statement > root.
		Context parent = context.getParent();
		return context.isType(Type.TERNARY_FALSE) && parent != null
			&& (parent.isType(Type.STATEMENT) || parent.isType(Type.VAR));
	}

	/**
	 * Returns arity of the operator token.
	 */
	OperatorType getOperatorType(Token operator)
	{
		String string = operator.getString();
		if (string.equals("?"))
		{
			return OperatorType.TERNARY;
		}
		if (TokenType.UNARY_OPERATORS.contains(string))
		{
			return OperatorType.UNARY;
		}

		Token last = operator.getMetadata().getLastCode();
		if (last == null || last.isType(TokenType.END_BLOCK))
		{
			return OperatorType.UNARY;
		}

		if (TokenType.UNARY_POST_OPERATORS.contains(string) && last.isAnyType(TokenType.EXPRESSION_ENDER_TYPES))
		{
			return OperatorType.UNARY_POST;
		}

		if (TokenType.UNARY_OK_OPERATORS.contains(string) && !last.isAnyType(TokenType.EXPRESSION_ENDER_TYPES)
			&& !TokenType.UNARY_POST_OPERATORS.contains(last.getString()))
		{
			return OperatorType.UNARY;
		}

		return OperatorType.BINARY;
	}
}
