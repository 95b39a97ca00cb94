package org.gjslint;

import org.gjslint.reporters.ErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds the tokens of a file to the state tracker and the lint rules, and forwards the findings to an error
 * handler.
 */
public class StyleChecker
{
	private static final Logger LOG = LoggerFactory.getLogger(StyleChecker.class);

	private final ErrorHandler errorHandler;
	private final LintRules lintRules;
	private final StateTracker stateTracker;
	private final LintConfig config;

	private boolean hasErrors = false;

	public StyleChecker(ErrorHandler errorHandler, LintRules lintRules, StateTracker stateTracker, LintConfig config)
	{
		this.errorHandler = errorHandler;
		this.lintRules = lintRules;
		this.stateTracker = stateTracker;
		this.config = config;
	}

	public LintConfig getConfig()
	{
		return config;
	}

	public StateTracker getStateTracker()
	{
		return stateTracker;
	}

	/**
	 * Reports an error unless the configuration disables it.
	 *
	 * @param code error code.
	 * @param message message for humans.
	 * @param token token where the error occurred, or {@code null} for file wide errors.
	 * @param position part of the token, may be {@code null}.
	 * @param fixData data for automatic fixing, may be {@code null}.
	 */
	public void handleError(ErrorCode code, String message, Token token, Position position, Object fixData)
	{
		if (!config.shouldReportError(code))
		{
			return;
		}

		hasErrors = true;
		errorHandler.handleError(new LintError(code, message, token, position, fixData));
	}

	public void handleError(ErrorCode code, String message, Token token)
	{
		handleError(code, message, token, null, null);
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * Checks a token chain.
	 *
	 * @param chain tokens of the file, metadata must be already attached.
	 * @param limitedDocChecks whether documentation checks are relaxed.
	 * @param stopToken if not {@code null}, checking stops before this token and whole file checks are skipped.
	 */
	public void check(TokenChain chain, boolean limitedDocChecks, Token stopToken)
	{
		lintRules.initialize(this, limitedDocChecks);
		stateTracker.reset();

		for (Token token : chain)
		{
			if (token == stopToken)
			{
				LOG.debug("Check stopped at line {}", token.getLineNumber());
				return;
			}

			stateTracker.handleToken(token, stateTracker.getLastNonSpaceToken());
			lintRules.checkToken(token, stateTracker);
			stateTracker.handleAfterToken(token);
		}

		lintRules.finalize(stateTracker);
	}
}
