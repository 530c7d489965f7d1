package org.cinder.frontend;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.WritableToken;
import org.cinder.parser.CinderLexer;
import org.cinder.util.ErrorHandler;
import org.cinder.util.SyntaxErrorListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexes one significant line into keyword, identifier, literal and punctuation tokens.
 * A trailing {@code ;} is dropped so C-style line endings are accepted everywhere.
 * Outside {@code for} headers, {@code in} and {@code to} come back as identifiers.
 */
public class LineTokenizer
{
	private final ErrorHandler errorHandler;

	public LineTokenizer(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	public List<Token> tokenize(SourceLine line)
	{
		CinderLexer lexer = new CinderLexer(CharStreams.fromString(line.text()));
		lexer.removeErrorListeners();
		lexer.addErrorListener(new SyntaxErrorListener(errorHandler, line.number()));

		List<Token> tokens = new ArrayList<>(lexer.getAllTokens());
		while (!tokens.isEmpty() && ";".equals(tokens.get(tokens.size() - 1).getText()))
		{
			tokens.remove(tokens.size() - 1);
		}
		if (!tokens.isEmpty() && tokens.get(0).getType() != CinderLexer.FOR)
		{
			releaseLoopKeywords(tokens);
		}
		return tokens;
	}

	/**
	 * {@code in} and {@code to} are only keywords inside a {@code for} header; anywhere else
	 * they are ordinary names.
	 */
	private static void releaseLoopKeywords(List<Token> tokens)
	{
		for (Token token : tokens)
		{
			int type = token.getType();
			if ((type == CinderLexer.IN || type == CinderLexer.TO) && token instanceof WritableToken writable)
			{
				writable.setType(CinderLexer.IDENTIFIER);
			}
		}
	}
}
