package org.gjslint;

/**
 * Kind of a brace delimited block as seen by the state tracker.
 */
public enum BlockType
{
	CODE("c"),
	OBJECT_LITERAL("o");

	private final String value;

	BlockType(String value)
	{
		this.value = value;
	}

	@Override
	public String toString()
	{
		return value;
	}
}
