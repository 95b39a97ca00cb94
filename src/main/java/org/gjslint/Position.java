package org.gjslint;

/**
 * Sub-range of a token's text that an error refers to.
 */
public final class Position
{
	private final int start;
	private final int length;

	public Position(int start, int length)
	{
		this.start = start;
		this.length = length;
	}

	public int getStart()
	{
		return start;
	}

	public int getLength()
	{
		return length;
	}

	/**
	 * Returns the part of the string this position covers.
	 */
	public String get(String string)
	{
		return string.substring(start, Math.min(string.length(), start + length));
	}

	/**
	 * Replaces the part of the target this position covers with the source.
	 */
	public String set(String target, String source)
	{
		return target.substring(0, start) + source + target.substring(Math.min(target.length(), start + length));
	}

	public boolean isAtEnd(String string)
	{
		return start == string.length() && length == 0;
	}

	public boolean isAtBeginning()
	{
		return start == 0 && length == 0;
	}

	public static Position atEnd(String string)
	{
		return new Position(string.length(), 0);
	}

	public static Position atBeginning()
	{
		return new Position(0, 0);
	}

	public static Position all(String string)
	{
		return new Position(0, string.length());
	}

	public static Position index(int index)
	{
		return new Position(index, 1);
	}

	@Override
	public String toString()
	{
		return "Position(" + start + ", " + length + ")";
	}
}
