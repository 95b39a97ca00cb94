package org.gjslint.test.unit;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.gjslint.LexerMode;
import org.gjslint.Token;
import org.gjslint.TokenChain;
import org.gjslint.TokenType;
import org.gjslint.test.helpers.TestHelper;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Joiner;

/**
 * Tests for the tokenizer
 */
public class TestLexer extends Assert
{
	private TestHelper th = new TestHelper();

	@BeforeMethod
	private void setupBeforeMethod()
	{
		th.newTest();
	}

	private static List<TokenType> types(TokenChain chain)
	{
		return chain.getTokens().stream().map(Token::getType).collect(Collectors.toList());
	}

	private static List<String> strings(TokenChain chain)
	{
		return chain.getTokens().stream().map(Token::getString).collect(Collectors.toList());
	}

	/**
	 * Joins texts of the tokens line by line.
	 */
	private static String rebuild(TokenChain chain)
	{
		List<String> lines = new ArrayList<>();
		StringBuilder line = new StringBuilder();
		int lineNumber = 1;
		for (Token token : chain)
		{
			while (token.getLineNumber() > lineNumber)
			{
				lines.add(line.toString());
				line.setLength(0);
				lineNumber++;
			}
			line.append(token.getString());
		}
		lines.add(line.toString());
		return Joiner.on('\n').join(lines);
	}

	@Test
	public void testSimpleStatement()
	{
		TokenChain chain = th.tokenize("var a = 1;");

		assertEquals(types(chain), List.of(TokenType.KEYWORD, TokenType.WHITESPACE, TokenType.SIMPLE_LVALUE,
			TokenType.WHITESPACE, TokenType.OPERATOR, TokenType.WHITESPACE, TokenType.NUMBER, TokenType.SEMICOLON));
		assertEquals(chain.get(2).getValue("identifier"), "a");
		assertEquals(th.getLexer().getMode(), LexerMode.TEXT);
	}

	@Test
	public void testStartIndexes()
	{
		TokenChain chain = th.tokenize("foo(bar);");

		assertEquals(strings(chain), List.of("foo", "(", "bar", ")", ";"));
		assertEquals(chain.get(0).getStartIndex(), 0);
		assertEquals(chain.get(2).getStartIndex(), 4);
		assertEquals(chain.get(4).getStartIndex(), 8);
	}

	@Test
	public void testBlankLines()
	{
		TokenChain chain = th.tokenize("a;", "", "b;", "");

		assertEquals(chain.get(2).getType(), TokenType.BLANK_LINE);
		assertEquals(chain.get(2).getLineNumber(), 2);
		assertEquals(chain.getLast().getType(), TokenType.BLANK_LINE);
		assertEquals(chain.getLast().getLineNumber(), 4);
	}

	@Test
	public void testEmptySource()
	{
		TokenChain chain = th.tokenize("");

		assertEquals(chain.size(), 1);
		assertEquals(chain.getFirst().getType(), TokenType.BLANK_LINE);
	}

	@Test
	public void testCoverage()
	{
		String source = Joiner.on('\n').join(
			"/**",
			" * Adds numbers, see {@link Math}.",
			" * @param {number} a First one.",
			" * @return {number} The sum.",
			" */",
			"var add = function(a, b) {",
			"  // Plain comment.",
			"  var re = /ab+c/gi, s = 'it\\'s', t = \"q\";",
			"  return a + b / 2 >>> 1;  /* trailing */",
			"};",
			"");

		TokenChain chain = th.tokenize(source);

		assertEquals(rebuild(chain), source);
		assertEquals(th.getLexer().getMode(), LexerMode.TEXT);
	}

	@Test
	public void testCarriageReturnsAreNotTokenized()
	{
		TokenChain chain = th.tokenize("a = 1;\r", "b = 2;\r", "");

		assertEquals(rebuild(chain), "a = 1;\nb = 2;\n");
		assertEquals(chain.getFirst().getLine(), "a = 1;\r");
	}

	@Test
	public void testKeywordPrefixIsIdentifier()
	{
		TokenChain chain = th.tokenize("doSomething(); do {} while (x);");

		assertEquals(chain.get(0).getType(), TokenType.IDENTIFIER);
		assertEquals(chain.get(0).getString(), "doSomething");
		assertTrue(th.findToken(chain, "do").isKeyword("do"));
		assertTrue(th.findToken(chain, "while").isKeyword("while"));
	}

	@Test
	public void testLetAndConstAreKeywords()
	{
		TokenChain chain = th.tokenize("let a = 1; const b = 2;");

		assertTrue(th.findToken(chain, "let").isKeyword("let"));
		assertTrue(th.findToken(chain, "const").isKeyword("const"));
	}

	@Test
	public void testNumbers()
	{
		TokenChain chain = th.tokenize("x = [0x1F, 1.5e10, 3., .5, 42];");

		List<String> numbers = chain.getTokens().stream().filter(t -> t.isType(TokenType.NUMBER))
			.map(Token::getString).collect(Collectors.toList());
		assertEquals(numbers, List.of("0x1F", "1.5e10", "3.", ".5", "42"));
	}

	@Test
	public void testOperatorsLongestFirst()
	{
		TokenChain chain = th.tokenize("a >>>= b === c !== d;");

		List<String> operators = chain.getTokens().stream().filter(t -> t.isType(TokenType.OPERATOR))
			.map(Token::getString).collect(Collectors.toList());
		assertEquals(operators, List.of(">>>=", "===", "!=="));
	}

	@Test
	public void testWordOperators()
	{
		TokenChain chain = th.tokenize("x = typeof y; z = new Foo(); w = newValue;");

		assertTrue(th.findToken(chain, "typeof").isOperator("typeof"));
		assertTrue(th.findToken(chain, "new").isOperator("new"));
		assertEquals(th.findToken(chain, "newValue").getType(), TokenType.IDENTIFIER);
	}

	@Test
	public void testRegexLiteral()
	{
		TokenChain chain = th.tokenize("var r = /ab+c/g;");

		Token regex = th.findToken(chain, "/ab+c/g");
		assertEquals(regex.getType(), TokenType.REGEX);
	}

	@Test
	public void testDivisionIsNotRegex()
	{
		TokenChain chain = th.tokenize("x = a / b / c;");

		assertTrue(chain.getTokens().stream().noneMatch(t -> t.isType(TokenType.REGEX)));
		assertTrue(th.findToken(chain, "/", 0).isOperator("/"));
		assertTrue(th.findToken(chain, "/", 1).isOperator("/"));
	}

	@Test
	public void testDivisionBeforeLineBreakIsReadAsRegex()
	{
		// Known false classification: the follow-token lookahead accepts a line end after the second slash.
		TokenChain chain = th.tokenize("half = a / 2 + b /", "    2;");

		assertEquals(th.findToken(chain, "/ 2 + b /").getType(), TokenType.REGEX);
	}

	@Test
	public void testStrings()
	{
		TokenChain chain = th.tokenize("s = 'it\\'s' + \"a\";");

		assertEquals(types(chain).subList(4, 7), List.of(TokenType.SINGLE_QUOTE_STRING_START, TokenType.STRING_TEXT,
			TokenType.SINGLE_QUOTE_STRING_END));
		assertEquals(chain.get(5).getString(), "it\\'s");
		assertEquals(th.findToken(chain, "a").getType(), TokenType.STRING_TEXT);
	}

	@Test
	public void testEmptyString()
	{
		TokenChain chain = th.tokenize("s = '';");

		assertEquals(types(chain).subList(4, 6), List.of(TokenType.SINGLE_QUOTE_STRING_START,
			TokenType.SINGLE_QUOTE_STRING_END));
	}

	@Test
	public void testMultiLineString()
	{
		TokenChain chain = th.tokenize("var s = 'abc\\", "def';");

		Token first = th.findToken(chain, "abc\\");
		assertEquals(first.getType(), TokenType.STRING_TEXT);
		Token second = th.findToken(chain, "def");
		assertEquals(second.getType(), TokenType.STRING_TEXT);
		assertEquals(second.getLineNumber(), 2);
		assertEquals(th.getLexer().getMode(), LexerMode.TEXT);
	}

	@Test
	public void testLongStringLine()
	{
		String text = StringUtils.repeat("ab\\'c ", 2000);
		TokenChain chain = th.tokenize("s = '" + text + "';");

		assertEquals(th.findToken(chain, text).getType(), TokenType.STRING_TEXT);
	}

	@Test
	public void testUnterminatedString()
	{
		th.tokenize("var s = 'abc");

		assertEquals(th.getLexer().getMode(), LexerMode.SINGLE_QUOTE_STRING);
	}

	@Test
	public void testUnterminatedBlockComment()
	{
		TokenChain chain = th.tokenize("/* unterminated");

		assertEquals(types(chain), List.of(TokenType.START_BLOCK_COMMENT, TokenType.COMMENT));
		assertEquals(th.getLexer().getMode(), LexerMode.BLOCK_COMMENT);
	}

	@Test
	public void testLineComment()
	{
		TokenChain chain = th.tokenize("a; // note 'x' /* y", "b;");

		assertEquals(th.findToken(chain, "//").getType(), TokenType.START_SINGLE_LINE_COMMENT);
		assertEquals(th.findToken(chain, " note 'x' /* y").getType(), TokenType.COMMENT);
		assertEquals(th.findToken(chain, "b").getType(), TokenType.IDENTIFIER);
	}

	@Test
	public void testEmptyLineComment()
	{
		TokenChain chain = th.tokenize("a; //", "b;");

		assertEquals(th.findToken(chain, "//").getType(), TokenType.START_SINGLE_LINE_COMMENT);
		assertEquals(th.findToken(chain, "b").getType(), TokenType.IDENTIFIER);
		assertEquals(th.getLexer().getMode(), LexerMode.TEXT);
	}

	@Test
	public void testBlockCommentAcrossLines()
	{
		TokenChain chain = th.tokenize("/* one", " * two */ a;");

		assertEquals(types(chain), List.of(TokenType.START_BLOCK_COMMENT, TokenType.COMMENT, TokenType.COMMENT,
			TokenType.END_BLOCK_COMMENT, TokenType.WHITESPACE, TokenType.IDENTIFIER, TokenType.SEMICOLON));
	}

	@Test
	public void testDocComment()
	{
		TokenChain chain = th.tokenize("/** @private */");

		assertEquals(types(chain), List.of(TokenType.START_DOC_COMMENT, TokenType.COMMENT, TokenType.DOC_FLAG,
			TokenType.COMMENT, TokenType.END_DOC_COMMENT));
		assertEquals(chain.get(2).getValue("name"), "private");
	}

	@Test
	public void testDocCommentPrefixAndParam()
	{
		TokenChain chain = th.tokenize("/**", " * @param {string} name The name.", " */");

		assertEquals(th.findToken(chain, " * ").getType(), TokenType.DOC_PREFIX);
		assertEquals(th.findToken(chain, "@param").getType(), TokenType.DOC_FLAG);
		assertEquals(th.findToken(chain, "{").getType(), TokenType.DOC_START_BRACE);
		assertEquals(th.findToken(chain, "}").getType(), TokenType.DOC_END_BRACE);

		// Spaces are separate tokens after @param, so the name is a token of its own.
		assertEquals(th.findToken(chain, "name").getType(), TokenType.COMMENT);
		assertEquals(th.findToken(chain, "*/").getType(), TokenType.END_DOC_COMMENT);
		assertEquals(th.getLexer().getMode(), LexerMode.TEXT);
	}

	@Test
	public void testDocInlineFlag()
	{
		TokenChain chain = th.tokenize("/** See {@link Foo}. */");

		Token inline = th.findToken(chain, "@link");
		assertEquals(inline.getType(), TokenType.DOC_INLINE_FLAG);
		assertEquals(inline.getValue("name"), "link");
	}

	@Test
	public void testEmailIsNotFlag()
	{
		TokenChain chain = th.tokenize("/** Ask someone@example.com about it. */");

		assertTrue(chain.getTokens().stream().noneMatch(t -> t.isType(TokenType.DOC_FLAG)));
	}

	@Test
	public void testFunctionDeclaration()
	{
		TokenChain chain = th.tokenize("function foo(a, b) {", "}");

		assertEquals(types(chain), List.of(TokenType.FUNCTION_DECLARATION, TokenType.WHITESPACE,
			TokenType.FUNCTION_NAME, TokenType.START_PARAMETERS, TokenType.PARAMETERS, TokenType.END_PARAMETERS,
			TokenType.START_BLOCK, TokenType.END_BLOCK));
		assertEquals(chain.get(4).getString(), "a, b");
		assertEquals(chain.get(5).getString(), ") ");
	}

	@Test
	public void testFunctionWithoutParameters()
	{
		TokenChain chain = th.tokenize("var f = function() {};");

		assertEquals(th.findToken(chain, "(").getType(), TokenType.START_PARAMETERS);
		assertEquals(th.findToken(chain, ") ").getType(), TokenType.END_PARAMETERS);
		assertEquals(th.findToken(chain, "{").getType(), TokenType.START_BLOCK);
	}

	@Test
	public void testSimpleLvalue()
	{
		TokenChain chain = th.tokenize("foo.bar = 1; x == y;");

		Token lvalue = th.findToken(chain, "foo.bar");
		assertEquals(lvalue.getType(), TokenType.SIMPLE_LVALUE);
		assertEquals(lvalue.getValue("identifier"), "foo.bar");
		assertEquals(th.findToken(chain, "x").getType(), TokenType.IDENTIFIER);
	}

	@Test
	public void testChainNavigation()
	{
		TokenChain chain = th.tokenize("a;", "b;");

		Token first = chain.getFirst();
		assertNull(first.getPrevious());
		assertEquals(first.getNext().getString(), ";");
		assertTrue(first.isFirstInLine());
		assertTrue(first.getNext().isLastInLine());
		assertNull(chain.getLast().getNext());
		assertEquals(chain.getLast().getIndex(), chain.size() - 1);
	}

	@Test
	public void testTokenQueries()
	{
		TokenChain chain = th.tokenize("a += 1; b === c; d <<= 2; // done");

		assertTrue(th.findToken(chain, "+=").isAssignment());
		assertTrue(th.findToken(chain, "<<=").isAssignment());
		assertFalse(th.findToken(chain, "===").isAssignment());
		assertTrue(th.findToken(chain, "+=").isAnyOperator(List.of("+=", "-=")));
		assertFalse(th.findToken(chain, "===").isAnyOperator(List.of("+=", "-=")));

		Token comment = th.findToken(chain, "//");
		assertTrue(comment.isComment());
		assertFalse(comment.isCode());
		assertFalse(th.findToken(chain, " ").isCode());
		assertTrue(th.findToken(chain, "a").isCode());
	}
}
