package org.gjslint;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Structural information attached to every token by {@link MetadataPass}.
 */
public final class TokenMetadata
{
	private Context context = null;
	private Token lastCode = null;
	private OperatorType operatorType = null;
	private boolean isImpliedSemicolon = false;
	private boolean isImpliedBlock = false;
	private boolean isImpliedBlockClose = false;

	TokenMetadata()
	{

	}

	/**
	 * Context the token appears in.
	 */
	public Context getContext()
	{
		return context;
	}

	void setContext(Context context)
	{
		this.context = context;
	}

	/**
	 * The last code token before this one.
	 */
	public Token getLastCode()
	{
		return lastCode;
	}

	void setLastCode(Token lastCode)
	{
		this.lastCode = lastCode;
	}

	public OperatorType getOperatorType()
	{
		return operatorType;
	}

	void setOperatorType(OperatorType operatorType)
	{
		this.operatorType = operatorType;
	}

	public boolean isUnaryOperator()
	{
		return operatorType == OperatorType.UNARY || operatorType == OperatorType.UNARY_POST;
	}

	public boolean isUnaryPostOperator()
	{
		return operatorType == OperatorType.UNARY_POST;
	}

	public boolean isImpliedSemicolon()
	{
		return isImpliedSemicolon;
	}

	void setImpliedSemicolon(boolean isImpliedSemicolon)
	{
		this.isImpliedSemicolon = isImpliedSemicolon;
	}

	public boolean isImpliedBlock()
	{
		return isImpliedBlock;
	}

	void setImpliedBlock(boolean isImpliedBlock)
	{
		this.isImpliedBlock = isImpliedBlock;
	}

	public boolean isImpliedBlockClose()
	{
		return isImpliedBlockClose;
	}

	void setImpliedBlockClose(boolean isImpliedBlockClose)
	{
		this.isImpliedBlockClose = isImpliedBlockClose;
	}

	@Override
	public String toString()
	{
		List<Object> parts = new ArrayList<>();
		parts.add(context);
		if (operatorType != null)
		{
			parts.add("optype: " + operatorType);
		}
		if (isImpliedSemicolon)
		{
			parts.add("implied;");
		}
		return "MetaData(" + Joiner.on(", ").useForNull("null").join(parts) + ")";
	}
}
