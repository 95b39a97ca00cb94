package org.gjslint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.gjslint.reporters.ErrorAccumulator;
import org.gjslint.reporters.ErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lints files: tokenizes the source, builds the context tree and runs the style checker. Every run uses its own
 * lexer, metadata pass and state tracker, so one runner may serve several threads.
 */
public class Runner
{
	private static final Logger LOG = LoggerFactory.getLogger(Runner.class);

	private final LintConfig config;

	public Runner()
	{
		this(LintConfig.defaults());
	}

	public Runner(LintConfig config)
	{
		this.config = config;
	}

	public LintConfig getConfig()
	{
		return config;
	}

	/**
	 * Lints a file read from disk as UTF-8 text. A file which cannot be read is reported as
	 * {@link ErrorCode#FILE_NOT_FOUND}.
	 */
	public void run(Path path, ErrorHandler errorHandler)
	{
		String source;
		try
		{
			source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			LOG.warn("Unable to read file {}", path, e);
			errorHandler.handleFile(path.toString(), null);
			errorHandler.handleError(new LintError(ErrorCode.FILE_NOT_FOUND, "File not found."));
			errorHandler.finishFile();
			return;
		}

		run(path.toString(), source, errorHandler);
	}

	public void run(String filename, String source, ErrorHandler errorHandler)
	{
		process(filename, source, errorHandler);
	}

	/**
	 * Lints the source and collects everything the run produced.
	 */
	public LintResult lint(String filename, String source)
	{
		ErrorAccumulator accumulator = new ErrorAccumulator();
		return process(filename, source, accumulator);
	}

	private LintResult process(String filename, String source, ErrorHandler errorHandler)
	{
		LOG.debug("Checking {}", filename);

		ErrorAccumulator fileErrors = new ErrorAccumulator();
		ErrorHandler handler = new ForwardingHandler(errorHandler, fileErrors);

		Lexer lexer = new Lexer();
		TokenChain chain = lexer.tokenize(source);
		handler.handleFile(filename, chain.getFirst());

		// Ending in any other mode means an unterminated string, comment or parameter list.
		if (lexer.getMode() != LexerMode.TEXT)
		{
			handler.handleError(new LintError(ErrorCode.FILE_IN_BLOCK,
				"File ended in mode \"" + lexer.getMode() + "\".", getLastNonWhitespaceToken(chain)));
		}

		MetadataPass metadataPass = new MetadataPass();
		ParseError parseError = metadataPass.process(chain);
		Token stopToken = null;
		if (parseError != null)
		{
			stopToken = parseError.getToken();
			handler.handleError(new LintError(ErrorCode.FILE_DOES_NOT_PARSE,
				"Error parsing file at token \"" + (stopToken != null ? stopToken.getString() : "") + "\". "
					+ "Unable to check the rest of file.\nError \"" + parseError.getMessage() + "\"",
				stopToken));
		}

		StyleChecker checker = new StyleChecker(handler, new BasicLintRules(), new JavaScriptStateTracker(), config);
		checker.check(chain, config.isLimitedDocFile(filename), stopToken);

		handler.finishFile();

		LOG.debug("Finished {} with {} errors", filename, fileErrors.getErrorCount());
		return new LintResult(filename, chain, lexer.getMode(), metadataPass.getContextTree(), parseError,
			fileErrors.getErrors(filename));
	}

	private static Token getLastNonWhitespaceToken(TokenChain chain)
	{
		for (int i = chain.size() - 1; i >= 0; i--)
		{
			Token token = chain.get(i);
			if (!token.isAnyType(TokenType.WHITESPACE, TokenType.BLANK_LINE))
			{
				return token;
			}
		}
		return chain.getLast();
	}

	// Passes every call to the caller's handler and keeps a copy of the errors for the result.
	private static final class ForwardingHandler implements ErrorHandler
	{
		private final ErrorHandler delegate;
		private final ErrorAccumulator copy;

		ForwardingHandler(ErrorHandler delegate, ErrorAccumulator copy)
		{
			this.delegate = delegate;
			this.copy = copy;
		}

		@Override
		public void handleFile(String filename, Token firstToken)
		{
			delegate.handleFile(filename, firstToken);
			copy.handleFile(filename, firstToken);
		}

		@Override
		public void handleError(LintError error)
		{
			delegate.handleError(error);
			copy.handleError(error);
		}

		@Override
		public void finishFile()
		{
			delegate.finishFile();
		}
	}
}
