package org.gjslint;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;

/**
 * Lexical unit produced by {@link Lexer}. Neighbours are resolved through the owning {@link TokenChain}
 * by index, so a token never holds references to other tokens.
 */
public final class Token
{
	private TokenType type = null;
	private String string = "";
	private String line = "";
	private int lineNumber = 0;
	private int startIndex = 0;
	private Map<String, String> values = Collections.emptyMap();

	private TokenChain chain = null;
	private int index = -1;

	private TokenMetadata metadata = null;
	private Object attachedObject = null;

	Token(String string, TokenType type, String line, int lineNumber, Map<String, String> values)
	{
		this.string = StringUtils.defaultString(string);
		this.type = type;
		this.line = StringUtils.defaultString(line);
		this.lineNumber = lineNumber;
		if (values != null)
		{
			this.values = ImmutableMap.copyOf(values);
		}
	}

	public TokenType getType()
	{
		return type;
	}

	public String getString()
	{
		return string;
	}

	public int getLength()
	{
		return string.length();
	}

	public String getLine()
	{
		return line;
	}

	public int getLineNumber()
	{
		return lineNumber;
	}

	public int getStartIndex()
	{
		return startIndex;
	}

	void setStartIndex(int startIndex)
	{
		this.startIndex = startIndex;
	}

	public Map<String, String> getValues()
	{
		return values;
	}

	/**
	 * Returns named sub-match of the pattern that produced this token, or empty string if there is none.
	 */
	public String getValue(String name)
	{
		return StringUtils.defaultString(values.get(name));
	}

	public TokenChain getChain()
	{
		return chain;
	}

	public int getIndex()
	{
		return index;
	}

	void attach(TokenChain chain, int index)
	{
		this.chain = chain;
		this.index = index;
	}

	public Token getPrevious()
	{
		return chain != null ? chain.previous(index) : null;
	}

	public Token getNext()
	{
		return chain != null ? chain.next(index) : null;
	}

	public TokenMetadata getMetadata()
	{
		return metadata;
	}

	void setMetadata(TokenMetadata metadata)
	{
		this.metadata = metadata;
	}

	public Object getAttachedObject()
	{
		return attachedObject;
	}

	public void setAttachedObject(Object attachedObject)
	{
		this.attachedObject = attachedObject;
	}

	public boolean isType(TokenType type)
	{
		return this.type == type;
	}

	public boolean isAnyType(TokenType... types)
	{
		return ArrayUtils.contains(types, type);
	}

	public boolean isAnyType(Collection<TokenType> types)
	{
		return types.contains(type);
	}

	public boolean isKeyword(String keyword)
	{
		return type == TokenType.KEYWORD && string.equals(keyword);
	}

	public boolean isAnyKeyword(String... keywords)
	{
		return type == TokenType.KEYWORD && ArrayUtils.contains(keywords, string);
	}

	public boolean isOperator(String operator)
	{
		return type == TokenType.OPERATOR && string.equals(operator);
	}

	public boolean isAnyOperator(Collection<String> operators)
	{
		return type == TokenType.OPERATOR && operators.contains(string);
	}

	/**
	 * Tests if this token is an assignment operator.
	 */
	public boolean isAssignment()
	{
		return type == TokenType.OPERATOR && string.endsWith("=")
			&& !StringUtils.equalsAny(string, "==", "!=", ">=", "<=", "===", "!==");
	}

	public boolean isComment()
	{
		return TokenType.COMMENT_TYPES.contains(type);
	}

	public boolean isCode()
	{
		return !TokenType.NON_CODE_TYPES.contains(type);
	}

	public boolean isFirstInLine()
	{
		Token previous = getPrevious();
		return previous == null || previous.lineNumber != lineNumber;
	}

	public boolean isLastInLine()
	{
		Token next = getNext();
		return next == null || next.lineNumber != lineNumber;
	}

	@Override
	public String toString()
	{
		return "<Token: " + type + ", \"" + string + "\", " + values + ", " + lineNumber + ", " + startIndex + ">";
	}
}
