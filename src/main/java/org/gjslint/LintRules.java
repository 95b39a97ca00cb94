package org.gjslint;

/**
 * Set of checks run by a {@link StyleChecker} over every token of a file.
 */
public interface LintRules
{
	/**
	 * Prepares the rules for a new file.
	 *
	 * @param checker checker the rules report to.
	 * @param limitedDocChecks whether documentation checks are relaxed for the file.
	 */
	public void initialize(StyleChecker checker, boolean limitedDocChecks);

	/**
	 * Checks a token. The state already reflects the token.
	 */
	public void checkToken(Token token, StateTracker state);

	/**
	 * Runs the checks that need the whole file, only called when every token was checked.
	 */
	public void finalize(StateTracker state);
}
