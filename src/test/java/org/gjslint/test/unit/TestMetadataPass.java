package org.gjslint.test.unit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

import org.gjslint.Context;
import org.gjslint.Context.Type;
import org.gjslint.LexerMode;
import org.gjslint.OperatorType;
import org.gjslint.ParseError;
import org.gjslint.Token;
import org.gjslint.TokenChain;
import org.gjslint.TokenType;
import org.gjslint.test.helpers.TestHelper;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableSet;

/**
 * Tests for the context tree builder
 */
public class TestMetadataPass extends Assert
{
	private static final String[] SAMPLE = {
		"/**",
		" * @fileoverview Sample.",
		" */",
		"goog.scope(function() {",
		"var x = 1, y = [1, 2, {a: 3}];",
		"if (x) foo(); else bar();",
		"for (var i = 0; i < 10; i++) {",
		"  y[i] = i ? i : -i;",
		"}",
		"switch (x) {",
		"  case 1:",
		"    break;",
		"  default:",
		"    x = {b: function(c) { return c; }};",
		"}",
		"do {",
		"  x--;",
		"} while (x > 0);",
		"var f = function(a, b) {",
		"  return a + b",
		"};",
		"});",
		""
	};

	private TestHelper th = new TestHelper();

	@BeforeMethod
	private void setupBeforeMethod()
	{
		th.newTest();
	}

	private List<Token> impliedSemicolons(TokenChain chain)
	{
		return chain.getTokens().stream().filter(t -> t.getMetadata().isImpliedSemicolon()).collect(Collectors.toList());
	}

	@Test
	public void testImpliedSemicolons()
	{
		TokenChain chain = th.process("a=1", "b=2", "");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()), "root[statement, statement]");

		Token one = th.findToken(chain, "1");
		Token two = th.findToken(chain, "2");
		assertTrue(one.getMetadata().isImpliedSemicolon());
		assertTrue(two.getMetadata().isImpliedSemicolon());

		List<Context> statements = th.getRoot().getChildren();
		assertSame(statements.get(0).getEndToken(), one);
		assertSame(statements.get(1).getEndToken(), two);
	}

	@Test
	public void testImpliedBlock()
	{
		TokenChain chain = th.process("if (x) foo();");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[group, implied_block[statement[group]]]]");

		Token closeParen = th.findToken(chain, ")", 0);
		Token semicolon = th.findToken(chain, ";");
		assertTrue(closeParen.getMetadata().isImpliedBlock());
		assertTrue(semicolon.getMetadata().isImpliedBlockClose());
		assertFalse(semicolon.getMetadata().isImpliedSemicolon());

		Context impliedBlock = th.getMetadataPass().getContextTree().getContexts(Type.IMPLIED_BLOCK).get(0);
		assertSame(impliedBlock.getStartToken(), closeParen);
		assertSame(impliedBlock.getEndToken(), semicolon);
		assertEquals(impliedBlock.getChildren().size(), 1);
	}

	@Test
	public void testImpliedBlockClosedByImpliedSemicolon()
	{
		TokenChain chain = th.process("if (x)", "  foo()", "");

		Token lastParen = th.findToken(chain, ")", 1);
		assertTrue(th.findToken(chain, ")", 0).getMetadata().isImpliedBlock());
		assertFalse(th.findToken(chain, ")", 0).getMetadata().isImpliedSemicolon());
		assertTrue(lastParen.getMetadata().isImpliedSemicolon());
		assertTrue(lastParen.getMetadata().isImpliedBlockClose());
	}

	@Test
	public void testElseImpliedBlock()
	{
		TokenChain chain = th.process("if (a) b();", "else c();", "");

		assertNull(th.getParseError());
		assertTrue(th.findToken(chain, "else").getMetadata().isImpliedBlock());
		assertEquals(th.getMetadataPass().getContextTree().getContexts(Type.IMPLIED_BLOCK).size(), 2);
	}

	@Test
	public void testElseIf()
	{
		TokenChain chain = th.process("if (a) {", "} else if (b) {", "}", "");

		assertNull(th.getParseError());
		assertFalse(th.findToken(chain, "else").getMetadata().isImpliedBlock());
		assertTrue(th.getMetadataPass().getContextTree().getContexts(Type.IMPLIED_BLOCK).isEmpty());
		assertEquals(th.getMetadataPass().getContextTree().getContexts(Type.BLOCK).size(), 2);
	}

	@Test
	public void testObjectLiteral()
	{
		th.process("var a = {b: 1, c: 2};");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[var[object_literal[literal_element, literal_element]]]]");
	}

	@Test
	public void testNestedTernary()
	{
		TokenChain chain = th.process("x = a ? b ? 1 : 2 : 3;");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[ternary_true[ternary_true, ternary_false], ternary_false]]");

		Context outerFalse = th.findToken(chain, ":", 1).getMetadata().getContext();
		assertEquals(outerFalse.getType(), Type.TERNARY_FALSE);
		assertEquals(outerFalse.getParent().getType(), Type.STATEMENT);
		assertSame(th.findToken(chain, "3").getMetadata().getContext(), outerFalse);
	}

	@Test
	public void testEndOfFileInsideComment()
	{
		TokenChain chain = th.process("/* unterminated");

		assertEquals(th.getLexer().getMode(), LexerMode.BLOCK_COMMENT);
		assertNull(th.getParseError());

		ParseError endOfFile = th.getMetadataPass().getEndOfFile();
		assertNotNull(endOfFile);
		assertTrue(endOfFile.isEndOfFile());

		for (Token token : chain)
		{
			assertSame(token.getMetadata().getContext(), th.getRoot());
		}
	}

	@Test
	public void testStrayCloseParen()
	{
		TokenChain chain = th.process("foo();", ")", "bar();");

		ParseError error = th.getParseError();
		assertNotNull(error);
		assertFalse(error.isEndOfFile());
		assertEquals(error.getToken().getString(), ")");
		assertEquals(error.getToken().getLineNumber(), 2);

		// Analysis stops at the error token.
		assertNotNull(th.findToken(chain, "foo").getMetadata());
		assertNull(th.findToken(chain, "bar").getMetadata());
	}

	@Test
	public void testCaseWithoutSwitch()
	{
		th.process("case 1:");

		ParseError error = th.getParseError();
		assertNotNull(error);
		assertTrue(error.getMessage().contains("switch"));
		assertEquals(error.getToken().getString(), "case");
	}

	@Test
	public void testSwitch()
	{
		th.process(
			"switch (x) {",
			"  case 1:",
			"    a();",
			"    break;",
			"  default:",
			"    b();",
			"}",
			"");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[switch[group, block[case_block[statement, statement], case_block[statement]]]]]");
	}

	@Test
	public void testDoWhile()
	{
		TokenChain chain = th.process("do {", "  a();", "} while (x);", "");

		assertNull(th.getParseError());
		assertFalse(th.findToken(chain, ")", 1).getMetadata().isImpliedBlock());
		assertTrue(th.getMetadataPass().getContextTree().getContexts(Type.IMPLIED_BLOCK).isEmpty());
	}

	@Test
	public void testForGroupBlock()
	{
		th.process("for (var i = 0; i < n; i++) {", "}", "");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[for_block[statement[var], statement, statement], block]]");
	}

	@Test
	public void testArrayLiteralAndIndex()
	{
		th.process("x = [1, [2, 3]];", "y = x[0];", "");

		assertNull(th.getParseError());
		assertEquals(TestHelper.treeToString(th.getRoot()),
			"root[statement[array_literal[literal_element, literal_element[array_literal[literal_element, "
				+ "literal_element]]]], statement[index]]");
	}

	@Test
	public void testFunctionBody()
	{
		TokenChain chain = th.process("function f(a) {", "  a();", "  b();", "}", "");

		assertNull(th.getParseError());
		Context block = th.findToken(chain, "{").getMetadata().getContext();
		assertEquals(block.getType(), Type.BLOCK);
		assertEquals(block.getChildren().size(), 2);
		assertEquals(th.findToken(chain, "a").getMetadata().getContext().getType(), Type.PARAMETERS);
	}

	@Test
	public void testContinuedLines()
	{
		TokenChain chain = th.process(
			"var a = 1,",
			"    b = 2;",
			"var",
			"    c = 3;",
			"x = a",
			"  + b;",
			"y = foo.",
			"  bar;",
			"");

		assertNull(th.getParseError());
		assertTrue(impliedSemicolons(chain).isEmpty());
		assertEquals(th.getRoot().getChildren().size(), 4);
	}

	@Test
	public void testImpliedSemicolonIdempotence()
	{
		TokenChain withoutSemicolons = th.process("var a = 1", "foo(a)", "x = a ? b : c", "i++", "");
		String implied = TestHelper.treeToString(th.getRoot());
		assertEquals(impliedSemicolons(withoutSemicolons).size(), 4);

		th.process("var a = 1;", "foo(a);", "x = a ? b : c;", "i++;", "");
		String explicit = TestHelper.treeToString(th.getRoot());

		assertEquals(implied, explicit);
		assertEquals(explicit, "root[statement[var], statement[group], statement[ternary_true, ternary_false], statement]");
	}

	@Test
	public void testImpliedSemicolonIdempotenceWithImpliedBlock()
	{
		TokenChain withoutSemicolons = th.process("if (a)", "  b()", "c()", "");
		String implied = TestHelper.treeToString(th.getRoot());
		assertFalse(impliedSemicolons(withoutSemicolons).isEmpty());

		th.process("if (a)", "  b();", "c();", "");
		String explicit = TestHelper.treeToString(th.getRoot());

		assertEquals(implied, explicit);
		assertEquals(explicit, "root[statement[group, implied_block[statement[group]], group]]");
	}

	@Test
	public void testImpliedSemicolonIdempotenceAfterObjectLiteral()
	{
		TokenChain withoutSemicolons = th.process("var o = {", "  a: 1", "}", "var l = [1, 2]", "");
		String implied = TestHelper.treeToString(th.getRoot());
		assertTrue(impliedSemicolons(withoutSemicolons).contains(th.findToken(withoutSemicolons, "}")));

		th.process("var o = {", "  a: 1", "};", "var l = [1, 2];", "");
		String explicit = TestHelper.treeToString(th.getRoot());

		assertNull(th.getParseError());
		assertEquals(implied, explicit);
	}

	@Test
	public void testOperatorTypes()
	{
		TokenChain chain = th.process("x = -y;", "z = a - b;", "i++;", "++j;", "t = !a ? typeof b : c;", "");

		assertEquals(th.findToken(chain, "-", 0).getMetadata().getOperatorType(), OperatorType.UNARY);
		assertEquals(th.findToken(chain, "-", 1).getMetadata().getOperatorType(), OperatorType.BINARY);
		assertEquals(th.findToken(chain, "++", 0).getMetadata().getOperatorType(), OperatorType.UNARY_POST);
		assertEquals(th.findToken(chain, "++", 1).getMetadata().getOperatorType(), OperatorType.UNARY);
		assertEquals(th.findToken(chain, "!").getMetadata().getOperatorType(), OperatorType.UNARY);
		assertEquals(th.findToken(chain, "?").getMetadata().getOperatorType(), OperatorType.TERNARY);
		assertEquals(th.findToken(chain, "typeof").getMetadata().getOperatorType(), OperatorType.UNARY);
		assertEquals(th.findToken(chain, ":").getMetadata().getOperatorType(), OperatorType.BINARY);
		assertEquals(th.findToken(chain, "=").getMetadata().getOperatorType(), OperatorType.BINARY);

		assertTrue(th.findToken(chain, "++", 0).getMetadata().isUnaryOperator());
		assertTrue(th.findToken(chain, "++", 0).getMetadata().isUnaryPostOperator());
		assertNull(th.findToken(chain, "x").getMetadata().getOperatorType());
	}

	@Test
	public void testLastCode()
	{
		TokenChain chain = th.process("a = b; // note", "c;");

		Token b = th.findToken(chain, "b");
		assertSame(th.findToken(chain, ";").getMetadata().getLastCode(), b);
		assertSame(th.findToken(chain, "c").getMetadata().getLastCode(), th.findToken(chain, ";", 0));
		assertNull(chain.getFirst().getMetadata().getLastCode());
	}

	@Test
	public void testEveryTokenHasMetadata()
	{
		TokenChain chain = th.process(SAMPLE);

		assertNull(th.getParseError());
		for (Token token : chain)
		{
			assertNotNull(token.getMetadata(), token.toString());
			assertNotNull(token.getMetadata().getContext(), token.toString());
		}
	}

	@Test
	public void testTreeIsWellFormed()
	{
		th.process(SAMPLE);

		assertNull(th.getParseError());
		assertEquals(th.getMetadataPass().getContextTree().getContexts(Type.ROOT).size(), 1);

		for (Context context : th.getMetadataPass().getContextTree().getContexts())
		{
			assertNotNull(context.getStartToken(), context.toString());
			assertNotNull(context.getEndToken(), context.toString());
			assertTrue(context.getStartToken().getIndex() <= context.getEndToken().getIndex(), context.toString());

			Context parent = context.getParent();
			if (context.isType(Type.ROOT))
			{
				assertNull(parent);
				continue;
			}

			assertNotNull(parent, context.toString());
			assertTrue(parent.getChildren().contains(context), context.toString());
			assertTrue(parent.getStartToken().getIndex() <= context.getStartToken().getIndex(), context.toString());
			assertTrue(context.getEndToken().getIndex() <= parent.getEndToken().getIndex(), context.toString());

			List<Context> siblings = parent.getChildren();
			int position = siblings.indexOf(context);
			if (position > 0)
			{
				Context previous = siblings.get(position - 1);
				assertTrue(previous.getEndToken().getIndex() <= context.getStartToken().getIndex(), context.toString());
			}
		}
	}

	@Test
	public void testStackBalance()
	{
		TokenChain chain = th.process(SAMPLE);

		assertNull(th.getParseError());

		ImmutableSet<TokenType> openers = ImmutableSet.of(TokenType.START_PAREN, TokenType.START_BRACKET,
			TokenType.START_BLOCK, TokenType.START_PARAMETERS);
		ImmutableSet<TokenType> closers = ImmutableSet.of(TokenType.END_PAREN, TokenType.END_BRACKET,
			TokenType.END_BLOCK, TokenType.END_PARAMETERS);

		Deque<Token> open = new ArrayDeque<>();
		int checked = 0;
		for (Token token : chain)
		{
			if (token.isAnyType(openers))
			{
				open.push(token);
			}
			else if (token.isAnyType(closers))
			{
				Token expected = open.pop();
				Context closed = token.getMetadata().getContext();

				// The body block of a switch is closed together with the switch.
				if (closed.isType(Type.SWITCH))
				{
					List<Context> children = closed.getChildren();
					closed = children.get(children.size() - 1);
				}

				assertSame(closed.getStartToken(), expected, token.toString());
				checked++;
			}
		}

		assertTrue(open.isEmpty());
		assertTrue(checked > 10);
	}

	@Test
	public void testReset()
	{
		th.process("a = 1;");
		int first = th.getMetadataPass().getContextTree().size();

		th.getMetadataPass().reset();
		assertEquals(th.getMetadataPass().getContextTree().size(), 1);
		assertNull(th.getMetadataPass().getEndOfFile());
		assertTrue(first > 1);
	}
}
