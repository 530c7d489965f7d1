package org.cinder.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Routes lexer errors for one source line into the {@link ErrorHandler}. Lines are lexed one
 * at a time, so ANTLR's own line number is replaced by the physical source line.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorHandler errorHandler;
	private final int sourceLine;

	public SyntaxErrorListener(ErrorHandler errorHandler, int sourceLine)
	{
		this.errorHandler = errorHandler;
		this.sourceLine = sourceLine;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		errorHandler.logError(sourceLine, String.format("column %d - %s", charPositionInLine + 1, msg));
	}
}
