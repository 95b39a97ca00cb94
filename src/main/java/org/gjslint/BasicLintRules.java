package org.gjslint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Small set of checks built on the structure recovered by the metadata pass and the state tracker: semicolons,
 * line length, parameter documentation and the final new line. Braces around doc types are only checked in
 * strict mode.
 */
public class BasicLintRules implements LintRules
{
	private static final Set<String> LONG_LINE_IGNORE;
	static
	{
		ImmutableSet.Builder<String> ignore = ImmutableSet.<String>builder().add("*", "//", "@see");
		for (String flag : DocFlag.HAS_TYPE)
		{
			ignore.add("@" + flag);
		}
		LONG_LINE_IGNORE = ignore.build();
	}

	private static final List<Pattern> LONG_LINE_EXCEPTIONS = ImmutableList.of(
		Pattern.compile("goog\\.require\\(.+\\);?\\s*$"),
		Pattern.compile("goog\\.provide\\(.+\\);?\\s*$"),
		Pattern.compile("[\\s/*]*@visibility\\s*\\{.*\\}[\\s*/]*$"));

	private static final Pattern ANY_CHAR = Pattern.compile(".");

	private StyleChecker checker = null;
	private boolean limitedDocChecks = false;

	@Override
	public void initialize(StyleChecker checker, boolean limitedDocChecks)
	{
		this.checker = checker;
		this.limitedDocChecks = limitedDocChecks;
	}

	@Override
	public void checkToken(Token token, StateTracker state)
	{
		if (checker == null)
		{
			throw new GJSLintException("Rules must be initialized before checking tokens");
		}

		if (token.isLastInLine())
		{
			checkLineLength(token, state);
		}

		if (token.isType(TokenType.END_BLOCK))
		{
			checkFunctionEnd(token, state);
		}
		else if (token.isType(TokenType.END_PARAMETERS))
		{
			checkParameterDocs(token, state);
		}
		else if (token.isType(TokenType.DOC_FLAG) && checker.getConfig().isStrict())
		{
			checkTypeBraces(token);
		}

		TokenMetadata metadata = token.getMetadata();
		if (metadata != null && metadata.isImpliedSemicolon())
		{
			checker.handleError(ErrorCode.MISSING_SEMICOLON, "Missing semicolon at end of line", token);
		}
	}

	private void checkLineLength(Token lastToken, StateTracker state)
	{
		// Spaces mark the places where the line could be wrapped.
		StringBuilder line = new StringBuilder();
		for (Token token = lastToken; token != null && token.getLineNumber() == lastToken.getLineNumber();
			token = token.getPrevious())
		{
			if (state.isTypeToken(token))
			{
				line.insert(0, ANY_CHAR.matcher(token.getString()).replaceAll("x"));
			}
			else if (token.isAnyType(TokenType.IDENTIFIER, TokenType.NORMAL))
			{
				line.insert(0, token.getString().replace('.', ' '));
			}
			else
			{
				line.insert(0, token.getString());
			}
		}

		String text = StringUtils.stripEnd(line.toString(), "\n\r\f");
		if (text.length() <= checker.getConfig().getMaxLineLength())
		{
			return;
		}

		for (Pattern exception : LONG_LINE_EXCEPTIONS)
		{
			if (exception.matcher(lastToken.getLine()).find())
			{
				return;
			}
		}

		// A line of a single word, not counting ignorable ones, cannot be wrapped.
		Set<String> parts = ImmutableSet.copyOf(Splitter.onPattern("\\s").omitEmptyStrings().split(text));
		int maxParts = parts.contains("@param") ? 2 : 1;
		long words = parts.stream().filter(part -> !LONG_LINE_IGNORE.contains(part)).count();
		if (words > maxParts)
		{
			checker.handleError(ErrorCode.LINE_TOO_LONG, "Line too long (" + text.length() + " characters).",
				lastToken);
		}
	}

	private void checkTypeBraces(Token token)
	{
		if (!(token.getAttachedObject() instanceof DocFlag))
		{
			return;
		}

		DocFlag flag = (DocFlag) token.getAttachedObject();
		if (StringUtils.isBlank(flag.getType()))
		{
			return;
		}

		Token start = flag.getTypeStartToken();
		Token end = flag.getTypeEndToken();
		if (start == null || !start.isType(TokenType.DOC_START_BRACE) || end == null
			|| !end.isType(TokenType.DOC_END_BRACE))
		{
			checker.handleError(ErrorCode.MISSING_BRACES_AROUND_TYPE,
				"Type must always be surrounded by curly braces.", token);
		}
	}

	private void checkFunctionEnd(Token token, StateTracker state)
	{
		if (!state.inFunction() || !state.isFunctionClose() || !state.inAssignedFunction())
		{
			return;
		}

		// Function expressions which are not called right away end a statement.
		Token next = token.getNext();
		boolean immediatelyCalled = next != null && next.isType(TokenType.START_PAREN);
		if (!immediatelyCalled && (token.isLastInLine() || next == null || !next.isType(TokenType.SEMICOLON)))
		{
			checker.handleError(ErrorCode.MISSING_SEMICOLON_AFTER_FUNCTION,
				"Missing semicolon after function assigned to a variable", token, Position.atEnd(token.getString()),
				null);
		}
	}

	private void checkParameterDocs(Token token, StateTracker state)
	{
		JsFunction function = state.getFunction();
		DocComment doc = state.getDocComment();
		if (function == null || function.isInterface() || doc == null || !state.inTopLevel()
			|| doc.hasFlag("see") || doc.inheritsDocumentation() || state.inObjectLiteralDescendant()
			|| doc.isInvalidated())
		{
			return;
		}

		List<String> params = state.getParams();
		List<String> documented = doc.getOrderedParams();

		if (!limitedDocChecks)
		{
			for (String param : params)
			{
				if (!documented.contains(param))
				{
					checker.handleError(ErrorCode.MISSING_PARAMETER_DOCUMENTATION,
						"Missing docs for parameter: \"" + param + "\"", token);
				}
			}
		}

		List<String> extra = new ArrayList<>(documented);
		extra.removeAll(params);
		for (String param : extra)
		{
			checker.handleError(ErrorCode.EXTRA_PARAMETER_DOCUMENTATION,
				"Found docs for non-existing parameter: \"" + param + "\"", token);
		}
	}

	@Override
	public void finalize(StateTracker state)
	{
		String lastLine = state.getLastLine();
		if (lastLine != null && !lastLine.trim().isEmpty() && StringUtils.stripEnd(lastLine, "\n\r\f").equals(lastLine))
		{
			checker.handleError(ErrorCode.FILE_MISSING_NEWLINE,
				"File does not end with new line.  (" + lastLine + ")", state.getLastNonSpaceToken());
		}

		if (!state.isBalanced())
		{
			checker.handleError(ErrorCode.FILE_DOES_NOT_PARSE, "File ended with unclosed blocks or parentheses",
				state.getLastNonSpaceToken());
		}
	}
}
