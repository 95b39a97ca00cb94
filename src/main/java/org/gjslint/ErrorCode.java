package org.gjslint;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Numbered error codes. Numbers are stable, they are what users list to disable an error.
 */
public enum ErrorCode
{
	MISSING_SEMICOLON(10),
	MISSING_SEMICOLON_AFTER_FUNCTION(11),

	LINE_TOO_LONG(110),

	MISSING_PARAMETER_DOCUMENTATION(210),
	EXTRA_PARAMETER_DOCUMENTATION(212),
	MISSING_BRACES_AROUND_TYPE(219),

	FILE_MISSING_NEWLINE(300),

	FILE_NOT_FOUND(1000),
	FILE_DOES_NOT_PARSE(1001),
	FILE_IN_BLOCK(1002);

	/**
	 * Errors about missing documentation, only reported when documentation checks are on.
	 */
	public static final Set<ErrorCode> MISSING_DOCUMENTATION = ImmutableSet.of(MISSING_PARAMETER_DOCUMENTATION);

	private final int number;

	ErrorCode(int number)
	{
		this.number = number;
	}

	public int getNumber()
	{
		return number;
	}

	public static ErrorCode fromNumber(int number)
	{
		for (ErrorCode code : ErrorCode.values())
		{
			if (code.number == number)
			{
				return code;
			}
		}

		throw new IllegalArgumentException("No error code was found, which corresponds to number " + number);
	}
}
