package org.gjslint.reporters;

import org.gjslint.LintError;

public class ErrorRecord
{
	private String file;
	private LintError error;

	public ErrorRecord(String file, LintError error)
	{
		this.file = file;
		this.error = error;
	}

	public String getFile()
	{
		return file;
	}

	public LintError getError()
	{
		return error;
	}

	@Override
	public String toString()
	{
		return file + ":" + error.getLineNumber() + ":(" + error.getCode().getNumber() + ") " + error.getMessage();
	}
}
