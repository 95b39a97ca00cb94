package org.gjslint;

public enum OperatorType
{
	UNARY("unary"),
	UNARY_POST("unary_post"),
	BINARY("binary"),
	TERNARY("ternary");

	private final String value;

	OperatorType(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
