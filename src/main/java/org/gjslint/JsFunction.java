package org.gjslint;

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Function seen by the state tracker, from its declaration up to its closing brace.
 */
public class JsFunction
{
	private final int blockDepth;
	private final boolean isAssigned;
	private final DocComment doc;
	private final String name;
	private final boolean isConstructor;
	private final boolean isInterface;

	private boolean hasReturn = false;
	private boolean hasThrow = false;
	private boolean hasThis = false;

	private Token startToken = null;
	private Token endToken = null;
	private List<String> parameters = null;

	/**
	 * @param blockDepth block depth the function began at.
	 * @param isAssigned whether the function is part of an assignment.
	 * @param doc doc comment of the function, may be {@code null}.
	 * @param name name given after the function keyword or the lvalue the function is assigned to.
	 */
	public JsFunction(int blockDepth, boolean isAssigned, DocComment doc, String name)
	{
		this.blockDepth = blockDepth;
		this.isAssigned = isAssigned;
		this.doc = doc;
		this.name = StringUtils.defaultString(name);
		this.isConstructor = doc != null && doc.hasFlag("constructor");
		this.isInterface = doc != null && doc.hasFlag("interface");
	}

	public int getBlockDepth()
	{
		return blockDepth;
	}

	public boolean isAssigned()
	{
		return isAssigned;
	}

	public DocComment getDoc()
	{
		return doc;
	}

	public String getName()
	{
		return name;
	}

	public boolean isConstructor()
	{
		return isConstructor;
	}

	public boolean isInterface()
	{
		return isInterface;
	}

	public boolean hasReturn()
	{
		return hasReturn;
	}

	void setHasReturn(boolean hasReturn)
	{
		this.hasReturn = hasReturn;
	}

	public boolean hasThrow()
	{
		return hasThrow;
	}

	void setHasThrow(boolean hasThrow)
	{
		this.hasThrow = hasThrow;
	}

	public boolean hasThis()
	{
		return hasThis;
	}

	void setHasThis(boolean hasThis)
	{
		this.hasThis = hasThis;
	}

	public Token getStartToken()
	{
		return startToken;
	}

	void setStartToken(Token startToken)
	{
		this.startToken = startToken;
	}

	public Token getEndToken()
	{
		return endToken;
	}

	void setEndToken(Token endToken)
	{
		this.endToken = endToken;
	}

	/**
	 * Declared parameter names, known once the body of the function is opened.
	 */
	public List<String> getParameters()
	{
		return parameters != null ? parameters : Collections.emptyList();
	}

	void setParameters(List<String> parameters)
	{
		this.parameters = ImmutableList.copyOf(parameters);
	}

	@Override
	public String toString()
	{
		return "<JsFunction: " + name + ", depth " + blockDepth + ">";
	}
}
