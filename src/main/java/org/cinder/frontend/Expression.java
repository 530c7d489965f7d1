package org.cinder.frontend;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.List;

import static org.cinder.parser.CinderLexer.*;

/**
 * A run of tokens from one source line. The surface text is sliced out of the line, so
 * spacing inside the expression is kept exactly as written. An expression without tokens is
 * a literal substituted by the parser (for example the fallback condition of an incomplete
 * {@code if}).
 */
public final class Expression
{
	private static final Expression EMPTY = new Expression("", List.of());

	private final String source;
	private final List<Token> tokens;

	private Expression(String source, List<Token> tokens)
	{
		this.source = source;
		this.tokens = List.copyOf(tokens);
	}

	public static Expression of(String source, List<Token> tokens)
	{
		return tokens.isEmpty() ? EMPTY : new Expression(source, tokens);
	}

	public static Expression literal(String text)
	{
		return new Expression(text, List.of());
	}

	public static Expression empty()
	{
		return EMPTY;
	}

	public String source()
	{
		return source;
	}

	public List<Token> tokens()
	{
		return tokens;
	}

	public boolean isEmpty()
	{
		return text().isEmpty();
	}

	public String text()
	{
		if (tokens.isEmpty())
		{
			return source;
		}
		Interval span = Interval.of(tokens.get(0).getStartIndex(), tokens.get(tokens.size() - 1).getStopIndex());
		return source.substring(span.a, span.b + 1);
	}

	public Expression sub(int from, int to)
	{
		return of(source, tokens.subList(from, to));
	}

	public boolean isSingle(int tokenType)
	{
		return tokens.size() == 1 && tokens.get(0).getType() == tokenType;
	}

	/**
	 * Returns {@code true} if the expression starts with {@code open} and the matching
	 * {@code close} is its last token, as in {@code [1, 2]} but not {@code (a) + (b)}.
	 */
	public boolean isEnclosedBy(int open, int close)
	{
		if (tokens.size() < 2 || tokens.get(0).getType() != open || tokens.get(tokens.size() - 1).getType() != close)
		{
			return false;
		}
		return matchingClose(0) == tokens.size() - 1;
	}

	/**
	 * Drops the first and last token.
	 */
	public Expression inner()
	{
		return tokens.size() < 2 ? EMPTY : sub(1, tokens.size() - 1);
	}

	/**
	 * Index of the token closing the bracket opened at {@code openIndex}, or -1.
	 */
	public int matchingClose(int openIndex)
	{
		int depth = 0;
		for (int i = openIndex; i < tokens.size(); i++)
		{
			int type = tokens.get(i).getType();
			if (isOpening(type))
			{
				depth++;
			}
			else if (isClosing(type))
			{
				depth--;
				if (depth == 0)
				{
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Index of the first token of {@code tokenType} outside any bracket, or -1.
	 */
	public int indexOfTopLevel(int tokenType)
	{
		int depth = 0;
		for (int i = 0; i < tokens.size(); i++)
		{
			int type = tokens.get(i).getType();
			if (depth == 0 && type == tokenType)
			{
				return i;
			}
			if (isOpening(type))
			{
				depth++;
			}
			else if (isClosing(type))
			{
				depth = Math.max(0, depth - 1);
			}
		}
		return -1;
	}

	/**
	 * Splits on top-level separators; empty pieces are dropped.
	 */
	public List<Expression> split(int separatorType)
	{
		List<Expression> parts = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < tokens.size(); i++)
		{
			int type = tokens.get(i).getType();
			if (isOpening(type))
			{
				depth++;
			}
			else if (isClosing(type))
			{
				depth = Math.max(0, depth - 1);
			}
			else if (depth == 0 && type == separatorType)
			{
				if (i > start)
				{
					parts.add(sub(start, i));
				}
				start = i + 1;
			}
		}
		if (start < tokens.size())
		{
			parts.add(sub(start, tokens.size()));
		}
		return parts;
	}

	private static boolean isOpening(int type)
	{
		return type == LPAREN || type == LBRACK || type == LBRACE;
	}

	private static boolean isClosing(int type)
	{
		return type == RPAREN || type == RBRACK || type == RBRACE;
	}

	@Override
	public String toString()
	{
		return text();
	}
}
