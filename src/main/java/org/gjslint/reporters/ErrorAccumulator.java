package org.gjslint.reporters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.gjslint.LintError;
import org.gjslint.Token;

/**
 * Error handler that keeps every error in memory.
 */
public class ErrorAccumulator implements ErrorHandler
{
	private final List<ErrorRecord> errors = new ArrayList<>();
	private String filename = null;

	@Override
	public void handleFile(String filename, Token firstToken)
	{
		this.filename = filename;
	}

	@Override
	public void handleError(LintError error)
	{
		errors.add(new ErrorRecord(filename, error));
	}

	@Override
	public void finishFile()
	{
		filename = null;
	}

	public List<ErrorRecord> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	/**
	 * Errors of one file in order of their position.
	 */
	public List<LintError> getErrors(String file)
	{
		return errors.stream()
			.filter(r -> Objects.equals(file, r.getFile()))
			.map(ErrorRecord::getError)
			.sorted(LintError.ORDER)
			.collect(Collectors.toList());
	}

	public int getErrorCount()
	{
		return errors.size();
	}
}
