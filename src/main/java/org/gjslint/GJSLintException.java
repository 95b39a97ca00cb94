package org.gjslint;

import org.apache.commons.lang3.StringUtils;

/**
 * Signals a programming or configuration error. Problems found in linted files are reported as
 * {@link LintError}s instead.
 */
public class GJSLintException extends RuntimeException
{
	private static final long serialVersionUID = 5173025546201874417L;

	private String message;

	public GJSLintException(String message)
	{
		this(message, null);
	}

	public GJSLintException(String message, Throwable cause)
	{
		super(cause);
		this.message = StringUtils.defaultString(message);
	}

	@Override
	public String getMessage()
	{
		return message;
	}
}
