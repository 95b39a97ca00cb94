package org.gjslint;

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

public enum TokenType
{
	// Kinds shared by every tokenizer.
	NORMAL("normal"),
	WHITESPACE("whitespace"),
	BLANK_LINE("blank line"),

	NUMBER("number"),
	START_SINGLE_LINE_COMMENT("//"),
	START_BLOCK_COMMENT("/*"),
	START_DOC_COMMENT("/**"),
	END_BLOCK_COMMENT("*/"),
	END_DOC_COMMENT("doc */"),
	COMMENT("comment"),
	SINGLE_QUOTE_STRING_START("'string"),
	SINGLE_QUOTE_STRING_END("string'"),
	DOUBLE_QUOTE_STRING_START("\"string"),
	DOUBLE_QUOTE_STRING_END("string\""),
	STRING_TEXT("string"),
	START_BLOCK("{"),
	END_BLOCK("}"),
	START_PAREN("("),
	END_PAREN(")"),
	START_BRACKET("["),
	END_BRACKET("]"),
	REGEX("/regex/"),
	FUNCTION_DECLARATION("function(...)"),
	FUNCTION_NAME("function functionName(...)"),
	START_PARAMETERS("startparams("),
	PARAMETERS("pa,ra,ms"),
	END_PARAMETERS(")endparams"),
	SEMICOLON(";"),
	DOC_FLAG("@flag"),
	DOC_INLINE_FLAG("{@flag ...}"),
	DOC_START_BRACE("doc {"),
	DOC_END_BRACE("doc }"),
	DOC_PREFIX("comment prefix: * "),
	SIMPLE_LVALUE("lvalue="),
	KEYWORD("keyword"),
	OPERATOR("operator"),
	IDENTIFIER("identifier");

	public static final Set<TokenType> STRING_TYPES = ImmutableSet.of(
		SINGLE_QUOTE_STRING_START,
		SINGLE_QUOTE_STRING_END,
		DOUBLE_QUOTE_STRING_START,
		DOUBLE_QUOTE_STRING_END,
		STRING_TEXT);

	public static final Set<TokenType> COMMENT_TYPES = ImmutableSet.of(
		START_SINGLE_LINE_COMMENT,
		COMMENT,
		START_BLOCK_COMMENT,
		START_DOC_COMMENT,
		END_BLOCK_COMMENT,
		END_DOC_COMMENT,
		DOC_START_BRACE,
		DOC_END_BRACE,
		DOC_FLAG,
		DOC_INLINE_FLAG,
		DOC_PREFIX);

	public static final Set<TokenType> FLAG_DESCRIPTION_TYPES = ImmutableSet.of(
		DOC_INLINE_FLAG,
		COMMENT,
		DOC_START_BRACE,
		DOC_END_BRACE);

	public static final Set<TokenType> FLAG_ENDING_TYPES = ImmutableSet.of(
		DOC_FLAG,
		END_DOC_COMMENT);

	public static final Set<TokenType> NON_CODE_TYPES = ImmutableSet.copyOf(
		Sets.union(COMMENT_TYPES, ImmutableSet.of(WHITESPACE, BLANK_LINE)));

	// An expression ender is any token that can end an object - i.e. we could have,
	// x.y or [1, 2], or (10 + 9) or {a: 10}.
	public static final Set<TokenType> EXPRESSION_ENDER_TYPES = ImmutableSet.of(
		NORMAL,
		IDENTIFIER,
		NUMBER,
		SIMPLE_LVALUE,
		END_BRACKET,
		END_PAREN,
		END_BLOCK,
		SINGLE_QUOTE_STRING_END,
		DOUBLE_QUOTE_STRING_END);

	public static final Set<String> UNARY_OPERATORS = ImmutableSet.of("!", "new", "delete", "typeof", "void");

	public static final Set<String> UNARY_OK_OPERATORS = ImmutableSet.<String>builder()
		.add("--", "++", "-", "+")
		.addAll(UNARY_OPERATORS)
		.build();

	public static final Set<String> UNARY_POST_OPERATORS = ImmutableSet.of("--", "++");

	private final String value;

	TokenType(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
