package org.cinder.codegen;

import org.antlr.v4.runtime.Token;
import org.cinder.frontend.Expression;
import org.cinder.semantic.SymbolTable;
import org.cinder.semantic.type.ValueType;

import java.util.List;
import java.util.Optional;

import static org.cinder.parser.CinderLexer.*;

/**
 * Turns source expression text into C expression text. Works on tokens, so string and
 * character literals pass through untouched:
 * <ul>
 *     <li>{@code xs[i]} on a list or tuple variable becomes {@code xs.data[i]};</li>
 *     <li>{@code time.now()}, {@code date.now()} and {@code clock.now()} become their
 *     {@code <time.h>} equivalents (see {@link TimeFunction}).</li>
 * </ul>
 * Whitespace between tokens is kept as written.
 */
public class ExpressionRewriter
{
	private static final String STORAGE_ACCESSOR = ".data";
	// time . now ( )
	private static final int TIME_CALL_LENGTH = 5;

	private final SymbolTable symbols;

	public ExpressionRewriter(SymbolTable symbols)
	{
		this.symbols = symbols;
	}

	public String rewrite(Expression expression)
	{
		List<Token> tokens = expression.tokens();
		if (tokens.isEmpty())
		{
			return expression.text();
		}

		String source = expression.source();
		StringBuilder out = new StringBuilder();
		int previousStop = tokens.get(0).getStartIndex() - 1;
		int i = 0;
		while (i < tokens.size())
		{
			Token token = tokens.get(i);
			out.append(source, previousStop + 1, token.getStartIndex());

			Optional<TimeFunction> timeCall = timeCallAt(tokens, i);
			if (timeCall.isPresent())
			{
				out.append(timeCall.get().getReplacement());
				previousStop = tokens.get(i + TIME_CALL_LENGTH - 1).getStopIndex();
				i += TIME_CALL_LENGTH;
				continue;
			}

			out.append(token.getText());
			if (needsStorageAccessor(tokens, i))
			{
				out.append(STORAGE_ACCESSOR);
			}
			previousStop = token.getStopIndex();
			i++;
		}
		return out.toString();
	}

	private boolean needsStorageAccessor(List<Token> tokens, int i)
	{
		Token token = tokens.get(i);
		if (token.getType() != IDENTIFIER || i + 1 >= tokens.size())
		{
			return false;
		}
		Token next = tokens.get(i + 1);
		boolean indexed = next.getType() == LBRACK && adjacent(token, next);
		boolean member = i > 0 && tokens.get(i - 1).getType() == DOT;
		if (!indexed || member)
		{
			return false;
		}
		ValueType type = symbols.lookup(token.getText());
		return type.hasIndexedStorage();
	}

	private static Optional<TimeFunction> timeCallAt(List<Token> tokens, int i)
	{
		if (i + TIME_CALL_LENGTH > tokens.size() || tokens.get(i).getType() != IDENTIFIER)
		{
			return Optional.empty();
		}
		Token dot = tokens.get(i + 1);
		Token method = tokens.get(i + 2);
		Token open = tokens.get(i + 3);
		Token close = tokens.get(i + 4);
		boolean shape = dot.getType() == DOT
				&& method.getType() == IDENTIFIER && TimeFunction.METHOD.equals(method.getText())
				&& open.getType() == LPAREN
				&& close.getType() == RPAREN;
		if (!shape)
		{
			return Optional.empty();
		}
		for (int k = i; k < i + TIME_CALL_LENGTH - 1; k++)
		{
			if (!adjacent(tokens.get(k), tokens.get(k + 1)))
			{
				return Optional.empty();
			}
		}
		return TimeFunction.fromReceiver(tokens.get(i).getText());
	}

	private static boolean adjacent(Token left, Token right)
	{
		return left.getStopIndex() + 1 == right.getStartIndex();
	}
}
