package org.gjslint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.gjslint.utils.TokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

/**
 * Tracks block, parenthesis and function nesting, variables in scope and documentation comments while the
 * checker walks the tokens. Reset once per file, then fed every token with {@link #handleToken(Token, Token)}
 * before the rules look at it and {@link #handleAfterToken(Token)} after.
 *
 * <p>
 * What counts as top level and how a block is classified depends on the language dialect, subclasses supply
 * {@link #inTopLevel()} and {@link #getBlockType(Token)}.
 */
public abstract class StateTracker
{
	private static final Logger LOG = LoggerFactory.getLogger(StateTracker.class);

	// Marks the start of the variables declared by one function in the scope stack.
	private static final String SCOPE_DELIMITER = "";

	private int blockDepth = 0;
	private boolean isBlockClose = false;
	private int parenDepth = 0;
	private Deque<JsFunction> functionStack = new ArrayDeque<>();
	private Map<String, JsFunction> functionsByName = new HashMap<>();
	private String lastComment = null;
	private DocComment docComment = null;
	private String cumulativeParams = null;
	private Deque<BlockType> blockTypes = new ArrayDeque<>();
	private Token lastNonSpaceToken = null;
	private String lastLine = null;
	private Token firstToken = null;
	private List<String> documentedIdentifiers = new ArrayList<>();
	private List<String> variablesInScope = new ArrayList<>();

	/**
	 * Prepares the tracker for a new file.
	 */
	public void reset()
	{
		blockDepth = 0;
		isBlockClose = false;
		parenDepth = 0;
		functionStack = new ArrayDeque<>();
		functionsByName = new HashMap<>();
		lastComment = null;
		docComment = null;
		cumulativeParams = null;
		blockTypes = new ArrayDeque<>();
		lastNonSpaceToken = null;
		lastLine = null;
		firstToken = null;
		documentedIdentifiers = new ArrayList<>();
		variablesInScope = new ArrayList<>();
	}

	/**
	 * Whether the current token is top level: not nested in a function, or nested only in constructs the dialect
	 * does not count.
	 */
	public abstract boolean inTopLevel();

	/**
	 * Classifies the block opened by the given start block token.
	 */
	public abstract BlockType getBlockType(Token token);

	public boolean inFunction()
	{
		return !functionStack.isEmpty();
	}

	public boolean inConstructor()
	{
		return inFunction() && getFunction() != null && getFunction().isConstructor();
	}

	/**
	 * Whether the current function is a method of an interface, either documented as one or declared on the
	 * prototype of a function documented with {@code @interface}.
	 */
	public boolean inInterfaceMethod()
	{
		JsFunction function = getFunction();
		if (!inFunction() || function == null)
		{
			return false;
		}

		if (function.isInterface())
		{
			return true;
		}

		int prototypeIndex = function.getName().indexOf(".prototype.");
		if (prototypeIndex != -1)
		{
			JsFunction classFunction = functionsByName.get(function.getName().substring(0, prototypeIndex));
			return classFunction != null && classFunction.isInterface();
		}
		return false;
	}

	public boolean inTopLevelFunction()
	{
		return functionStack.size() == 1 && inTopLevel();
	}

	public boolean inAssignedFunction()
	{
		return inFunction() && getFunction() != null && getFunction().isAssigned();
	}

	/**
	 * Whether the current token opens the body of the current function.
	 */
	public boolean isFunctionOpen()
	{
		return !functionStack.isEmpty() && functionStack.peek().getBlockDepth() == blockDepth - 1;
	}

	/**
	 * Whether the current token closes the body of the current function.
	 */
	public boolean isFunctionClose()
	{
		return !functionStack.isEmpty() && functionStack.peek().getBlockDepth() == blockDepth;
	}

	public boolean inBlock()
	{
		return blockDepth > 0;
	}

	public boolean isBlockClose()
	{
		return isBlockClose;
	}

	public boolean inObjectLiteral()
	{
		return blockDepth > 0 && blockTypes.peek() == BlockType.OBJECT_LITERAL;
	}

	public boolean inObjectLiteralDescendant()
	{
		return blockTypes.contains(BlockType.OBJECT_LITERAL);
	}

	public boolean inParentheses()
	{
		return parenDepth > 0;
	}

	public int getParenthesesDepth()
	{
		return parenDepth;
	}

	public int getBlockDepth()
	{
		return blockDepth;
	}

	public int getFunctionDepth()
	{
		return functionStack.size();
	}

	/**
	 * Parameter names accumulated since the last parameter list started, with {@code name:Type} reduced to
	 * the name.
	 */
	public List<String> getParams()
	{
		List<String> params = new ArrayList<>();
		if (cumulativeParams != null)
		{
			String stripped = CharMatcher.whitespace().removeFrom(cumulativeParams);
			for (String param : Splitter.on(',').omitEmptyStrings().split(stripped))
			{
				params.add(Splitter.on(':').split(param).iterator().next());
			}
		}
		return params;
	}

	public String getLastComment()
	{
		return lastComment;
	}

	public DocComment getDocComment()
	{
		return docComment;
	}

	public boolean hasDocComment(String identifier)
	{
		return documentedIdentifiers.contains(identifier);
	}

	public boolean inDocComment()
	{
		return docComment != null && docComment.getEndToken() == null;
	}

	/**
	 * Whether the token is inside the braces of the type of a doc flag.
	 */
	public boolean isTypeToken(Token token)
	{
		if (inDocComment() && !token.isAnyType(TokenType.START_DOC_COMMENT, TokenType.DOC_FLAG,
			TokenType.DOC_INLINE_FLAG, TokenType.DOC_PREFIX))
		{
			Token finalToken = TokenUtil.searchUntil(token, ImmutableSet.of(TokenType.DOC_FLAG),
				ImmutableSet.of(TokenType.START_DOC_COMMENT), TokenUtil.UNBOUNDED, true);
			if (finalToken != null && finalToken.getAttachedObject() instanceof DocFlag)
			{
				DocFlag flag = (DocFlag) finalToken.getAttachedObject();
				Token typeEnd = flag.getTypeEndToken();
				if (flag.getTypeStartToken() != null && typeEnd != null)
				{
					// The closing brace is not a part of the type.
					int endComparison = TokenUtil.compare(token, typeEnd);
					return TokenUtil.compare(token, flag.getTypeStartToken()) > 0
						&& (typeEnd.isType(TokenType.DOC_END_BRACE) ? endComparison < 0 : endComparison <= 0);
				}
			}
		}
		return false;
	}

	/**
	 * Innermost open function, or {@code null}.
	 */
	public JsFunction getFunction()
	{
		return functionStack.peek();
	}

	public JsFunction getFunctionByName(String name)
	{
		return functionsByName.get(name);
	}

	public Token getLastNonSpaceToken()
	{
		return lastNonSpaceToken;
	}

	public String getLastLine()
	{
		return lastLine;
	}

	public Token getFirstToken()
	{
		return firstToken;
	}

	/**
	 * Whether the name, or the object it is a property of, is a variable or parameter of an open function.
	 */
	public boolean isVariableInScope(String tokenString)
	{
		for (String variable : variablesInScope)
		{
			if (!variable.isEmpty() && (tokenString.equals(variable) || tokenString.startsWith(variable + ".")))
			{
				return true;
			}
		}
		return false;
	}

	public List<String> getVariablesInScope()
	{
		List<String> variables = new ArrayList<>(variablesInScope);
		variables.removeIf(String::isEmpty);
		return Collections.unmodifiableList(variables);
	}

	/**
	 * Whether no function, block or parenthesis is left open.
	 */
	public boolean isBalanced()
	{
		return functionStack.isEmpty() && blockDepth == 0 && parenDepth == 0;
	}

	/**
	 * Updates the state for a token before the rules check it.
	 */
	public void handleToken(Token token, Token lastNonSpaceToken)
	{
		isBlockClose = false;

		if (firstToken == null)
		{
			firstToken = token;
		}

		switch (token.getType())
		{
		case START_BLOCK:
			blockDepth++;
			blockTypes.push(getBlockType(token));

			// Entering a function body, its parameters are complete.
			if (inFunction())
			{
				JsFunction function = getFunction();
				if (function != null && blockDepth == function.getBlockDepth() + 1)
				{
					function.setParameters(getParams());
				}
			}
			break;

		case END_BLOCK:
			isBlockClose = !inObjectLiteral();
			blockDepth--;
			blockTypes.poll();
			break;

		case START_PAREN:
			parenDepth++;
			break;

		case END_PAREN:
			parenDepth--;
			break;

		case COMMENT:
			lastComment = token.getString();
			break;

		case START_DOC_COMMENT:
			lastComment = null;
			docComment = new DocComment(token);
			break;

		case END_DOC_COMMENT:
			if (docComment != null)
			{
				docComment.setEndToken(token);
			}
			break;

		case DOC_FLAG:
		case DOC_INLINE_FLAG:
			handleDocFlag(token);
			break;

		case FUNCTION_DECLARATION:
			handleFunctionDeclaration(token);
			break;

		case START_PARAMETERS:
			cumulativeParams = "";
			break;

		case PARAMETERS:
			cumulativeParams = (cumulativeParams != null ? cumulativeParams : "") + token.getString();
			addParamsToScope();
			break;

		case KEYWORD:
			handleKeyword(token);
			break;

		case SIMPLE_LVALUE:
			String identifier = token.getValue("identifier");
			if (getDocComment() != null)
			{
				documentedIdentifiers.add(identifier);
			}
			handleIdentifier(identifier);
			break;

		case IDENTIFIER:
			handleIdentifier(token.getString());

			// Documented non-assignments, e.g. a property declared as "/** @type {number} */ foo.bar;".
			Token nextToken = TokenUtil.getNextCodeToken(token);
			if (nextToken != null && nextToken.isType(TokenType.SEMICOLON) && lastNonSpaceToken != null
				&& lastNonSpaceToken.isType(TokenType.END_DOC_COMMENT))
			{
				documentedIdentifiers.add(token.getString());
			}
			break;

		default:
			break;
		}
	}

	private void handleDocFlag(Token token)
	{
		DocFlag flag = new DocFlag(token);
		token.setAttachedObject(flag);

		if (docComment == null)
		{
			return;
		}

		docComment.addFlag(flag);
		if (flag.isMalformedType())
		{
			LOG.debug("Doc comment at line {} has an unterminated type, checks of it are disabled",
				docComment.getStartToken().getLineNumber());
			docComment.invalidate();
		}

		if (flag.getFlagType().equals("suppress"))
		{
			docComment.addSuppression(token);
		}
	}

	private void handleFunctionDeclaration(Token token)
	{
		Token lastCode = TokenUtil.getPreviousCodeToken(token);

		// Only functions outside of parentheses are eligible for documentation.
		DocComment doc = parenDepth == 0 ? docComment : null;

		boolean isAssigned = lastCode != null && (lastCode.isOperator("=") || lastCode.isOperator("||")
			|| lastCode.isOperator("&&") || (lastCode.isOperator(":") && !inObjectLiteral()));

		StringBuilder name = new StringBuilder();
		if (isAssigned)
		{
			// Line-wrapped names like
			// my.function.foo.
			//     bar = function() ...
			Token identifier = TokenUtil.search(lastCode, ImmutableSet.of(TokenType.SIMPLE_LVALUE), TokenUtil.UNBOUNDED,
				true);
			while (identifier != null && identifier.isAnyType(TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE))
			{
				name.insert(0, identifier.getString());

				Token previous = TokenUtil.getPreviousCodeToken(identifier);
				identifier = (previous != null && previous.getString().endsWith(".")) ? previous : null;
			}
		}
		else
		{
			Token nextToken = TokenUtil.getNextCodeToken(token);
			while (nextToken != null && nextToken.isType(TokenType.FUNCTION_NAME))
			{
				name.append(nextToken.getString());
				nextToken = TokenUtil.search(nextToken, ImmutableSet.of(TokenType.FUNCTION_NAME), 2, false);
			}
		}

		JsFunction function = new JsFunction(blockDepth, isAssigned, doc, name.toString());
		function.setStartToken(token);

		functionStack.push(function);
		functionsByName.put(function.getName(), function);

		// Variables declared from now on belong to this function until it is closed.
		variablesInScope.add(SCOPE_DELIMITER);

		LOG.trace("Function '{}' opened at line {}", function.getName(), token.getLineNumber());
	}

	private void addParamsToScope()
	{
		int scopeStart = variablesInScope.lastIndexOf(SCOPE_DELIMITER);
		List<String> current = variablesInScope.subList(scopeStart + 1, variablesInScope.size());
		for (String param : getParams())
		{
			if (!current.contains(param))
			{
				variablesInScope.add(param);
				current = variablesInScope.subList(scopeStart + 1, variablesInScope.size());
			}
		}
	}

	private void handleKeyword(Token token)
	{
		JsFunction function = getFunction();

		if (token.isKeyword("return"))
		{
			Token nextToken = TokenUtil.getNextCodeToken(token);
			if (function != null && nextToken != null && !nextToken.isType(TokenType.SEMICOLON))
			{
				function.setHasReturn(true);
			}
		}
		else if (token.isKeyword("throw"))
		{
			if (function != null)
			{
				function.setHasThrow(true);
			}
		}
		else if (token.isAnyKeyword("var", "let", "const"))
		{
			Token nextToken = TokenUtil.search(token, ImmutableSet.of(TokenType.IDENTIFIER, TokenType.SIMPLE_LVALUE),
				TokenUtil.UNBOUNDED, false);
			if (nextToken != null)
			{
				variablesInScope.add(nextToken.isType(TokenType.SIMPLE_LVALUE) ? nextToken.getValue("identifier")
					: nextToken.getString());
			}
		}
	}

	private void handleIdentifier(String identifier)
	{
		if (identifier.equals("this") || identifier.startsWith("this."))
		{
			JsFunction function = getFunction();
			if (function != null)
			{
				function.setHasThis(true);
			}
		}
	}

	/**
	 * Updates the state after the rules checked the token.
	 */
	public void handleAfterToken(Token token)
	{
		TokenType type = token.getType();
		if (type == TokenType.SEMICOLON || type == TokenType.END_PAREN || (type == TokenType.END_BRACKET
			&& (lastNonSpaceToken == null || !lastNonSpaceToken.isAnyType(TokenType.SINGLE_QUOTE_STRING_END,
				TokenType.DOUBLE_QUOTE_STRING_END))))
		{
			// Numeric array indexes end the doc comment, string ones keep it so that manually exported
			// identifiers are picked up.
			docComment = null;
			lastComment = null;
		}
		else if (type == TokenType.END_BLOCK)
		{
			docComment = null;
			lastComment = null;

			if (inFunction() && isFunctionClose())
			{
				JsFunction function = functionStack.pop();
				function.setEndToken(token);

				// Variables of the closed function go out of scope.
				while (!variablesInScope.isEmpty() && !variablesInScope.get(variablesInScope.size() - 1).isEmpty())
				{
					variablesInScope.remove(variablesInScope.size() - 1);
				}
				if (!variablesInScope.isEmpty())
				{
					variablesInScope.remove(variablesInScope.size() - 1);
				}

				LOG.trace("Function '{}' closed at line {}", function.getName(), token.getLineNumber());
			}
		}
		else if (type == TokenType.END_PARAMETERS && docComment != null)
		{
			docComment = null;
			lastComment = null;
		}

		if (!token.isAnyType(TokenType.WHITESPACE, TokenType.BLANK_LINE))
		{
			lastNonSpaceToken = token;
		}

		lastLine = token.getLine();
	}
}
