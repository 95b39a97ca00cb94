package org.gjslint.reporters;

import org.gjslint.LintError;
import org.gjslint.Token;

/**
 * Receives the errors found while checking files.
 */
public interface ErrorHandler
{
	/**
	 * Called before the first error of a file.
	 *
	 * @param filename name of the file.
	 * @param firstToken first token of the file, {@code null} if it could not be read.
	 */
	public void handleFile(String filename, Token firstToken);

	public void handleError(LintError error);

	/**
	 * Called after the last error of the current file.
	 */
	public void finishFile();
}
