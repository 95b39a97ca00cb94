package org.gjslint;

import java.util.regex.Pattern;

import com.google.common.base.Joiner;

/**
 * Regular expressions used to tokenize JavaScript and to read doc comments.
 */
public class Reg
{
	private Reg()
	{
	}

	static final String IDENTIFIER_CHAR = "A-Za-z0-9_$.";

	// Technically identifiers can't contain '.', but a chain of nested identifiers is treated as a single one.
	static final String NESTED_IDENTIFIER = "[a-zA-Z_$][" + IDENTIFIER_CHAR + "]*";

	// Number patterns based on:
	// http://www.mozilla.org/js/language/js20-2000-07/formal/lexer-grammar.html
	static final String MANTISSA = "(\\d+(?!\\.))|(\\d+\\.(?!\\d))|(\\d*\\.\\d+)";
	static final String DECIMAL_LITERAL = "(" + MANTISSA + ")([eE][-+]?\\d+)?";
	static final String HEX_LITERAL = "0[xX][0-9a-fA-F]+";
	public static final Pattern NUMBER = Pattern.compile("((" + HEX_LITERAL + ")|(" + DECIMAL_LITERAL + "))");

	// Strings are matched in three parts: opening quote, text, closing quote. Text is anything but a quote
	// or a backslash, or a backslash followed by any character or by the end of a line (multi-line strings).
	public static final Pattern SINGLE_QUOTE = Pattern.compile("'");
	public static final Pattern SINGLE_QUOTE_TEXT = Pattern.compile("[^'\\\\]*+(?:\\\\(?:.|$)[^'\\\\]*+)*+");
	public static final Pattern DOUBLE_QUOTE = Pattern.compile("\"");
	public static final Pattern DOUBLE_QUOTE_TEXT = Pattern.compile("[^\"\\\\]*+(?:\\\\(?:.|$)[^\"\\\\]*+)*+");

	public static final Pattern START_SINGLE_LINE_COMMENT = Pattern.compile("//");
	public static final Pattern END_OF_LINE_SINGLE_LINE_COMMENT = Pattern.compile("//$");

	public static final Pattern START_DOC_COMMENT = Pattern.compile("/\\*\\*");
	public static final Pattern START_BLOCK_COMMENT = Pattern.compile("/\\*");
	public static final Pattern END_BLOCK_COMMENT = Pattern.compile("\\*/");
	public static final Pattern BLOCK_COMMENT_TEXT = Pattern.compile("[^*]*+(?:\\*(?!/)[^*]*+)*+");

	// Doc comment text is anything that is not going to be parsed into another special token like flags or
	// end of comment. '[^*{}\s]@' must come first so that an '@' inside a word (an e-mail address) is text.
	public static final Pattern DOC_COMMENT_TEXT = Pattern.compile("([^*{}\\s]@|[^*{}@]|\\*(?!/))+");
	public static final Pattern DOC_COMMENT_NO_SPACES_TEXT = Pattern.compile("([^*{}\\s]@|[^*{}@\\s]|\\*(?!/))+");

	// The ' * ' prefix of every doc comment line, but not the '*' of '*/'.
	public static final Pattern DOC_PREFIX = Pattern.compile("\\s*\\*(\\s+|(?!/))");

	public static final Pattern START_BLOCK = Pattern.compile("\\{");
	public static final Pattern END_BLOCK = Pattern.compile("\\}");

	static final String REGEX_CHARACTER_CLASS = "\\[([^\\]\\\\]|\\\\.)*\\]";

	// A regular expression literal must be followed by one of these, otherwise x / y / z would be read as
	// x REGEX(/ y /) z.
	static final String[] POST_REGEX_LIST = { ";", ",", "\\.", "\\)", "\\]", "$", "//", "/\\*", ":", "\\}" };

	public static final Pattern REGEX = Pattern.compile(
		"/" +                                        // opening slash
		"(?!\\*)" +                                  // not the start of a comment
		"(\\\\.|[^\\[/\\\\]|" + REGEX_CHARACTER_CLASS + ")*" +
		"/" +                                        // closing slash
		"[gimsx]*" +                                 // modifiers
		"(?=\\s*(" + Joiner.on('|').join(POST_REGEX_LIST) + "))");

	public static final Pattern ANYTHING = Pattern.compile(".*", Pattern.DOTALL);
	public static final Pattern PARAMETERS = Pattern.compile("[^)]+");
	public static final Pattern CLOSING_PAREN_WITH_SPACE = Pattern.compile("\\)\\s*");

	public static final Pattern FUNCTION_DECLARATION = Pattern.compile("\\bfunction\\b");

	public static final Pattern OPENING_PAREN = Pattern.compile("\\(");
	public static final Pattern CLOSING_PAREN = Pattern.compile("\\)");
	public static final Pattern OPENING_BRACKET = Pattern.compile("\\[");
	public static final Pattern CLOSING_BRACKET = Pattern.compile("\\]");

	// Left out on purpose: 'function' (function declarations), 'delete', 'in', 'instanceof', 'new', 'typeof'
	// and 'void' (operators), 'this' (identifier).
	static final String[] KEYWORD_LIST = { "break", "case", "catch", "const", "continue", "default", "do", "else",
		"finally", "for", "if", "let", "return", "switch", "throw", "try", "var", "while", "with" };

	// Keyword followed by a non-identifier character, so that doSomething is not do + Something.
	public static final Pattern KEYWORD = Pattern.compile(
		"(" + Joiner.on('|').join(KEYWORD_LIST) + ")((?=[^" + IDENTIFIER_CHAR + "])|$)");

	// Operators that are prefixes of longer ones come later, e.g. '>>' after '>>>'. The comma behaves much
	// like an operator and is listed here as well.
	static final String[] OPERATOR_LIST = { ",", "\\+\\+", "===", "!==", ">>>=", ">>>", "==", ">=", "<=", "!=",
		"<<=", ">>=", "<<", ">>", ">", "<", "\\+=", "\\+", "--", "\\^=", "-=", "-", "/=", "/", "\\*=", "\\*",
		"%=", "%", "&&", "\\|\\|", "&=", "&", "\\|=", "\\|", "=", "!", ":", "\\?", "\\^", "\\bdelete\\b",
		"\\bin\\b", "\\binstanceof\\b", "\\bnew\\b", "\\btypeof\\b", "\\bvoid\\b" };

	public static final Pattern OPERATOR = Pattern.compile(Joiner.on('|').join(OPERATOR_LIST));

	public static final Pattern WHITESPACE = Pattern.compile("\\s+");
	public static final Pattern SEMICOLON = Pattern.compile(";");

	public static final Pattern IDENTIFIER = Pattern.compile(NESTED_IDENTIFIER);

	// Identifier followed by '=' which is not part of '=='.
	public static final Pattern SIMPLE_LVALUE = Pattern.compile(
		"(?<identifier>" + NESTED_IDENTIFIER + ")(?=\\s*=(?!=))");

	// A doc flag is '@' followed by letters at the beginning of a line or after whitespace. The look-behind
	// keeps someone@example.com from being a flag.
	public static final Pattern DOC_FLAG = Pattern.compile("(^|(?<=\\s))@(?<name>[a-zA-Z]+)");

	// @param switches into a mode that tokenizes whitespace, so that the parameter name becomes a token.
	public static final Pattern DOC_FLAG_LEX_SPACES = Pattern.compile("(^|(?<=\\s))@(?<name>param)\\b");

	public static final Pattern DOC_INLINE_FLAG = Pattern.compile("(?<=\\{)@(?<name>[a-zA-Z]+)");

	// Doc comment line with nothing but an optional star.
	public static final Pattern EMPTY_COMMENT_LINE = Pattern.compile("^\\s*\\*?\\s*$");
}
