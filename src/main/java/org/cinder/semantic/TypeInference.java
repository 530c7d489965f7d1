package org.cinder.semantic;

import org.cinder.semantic.type.ValueType;

/**
 * Best-effort type of an untyped expression, judged from its surface text and the symbol
 * table. The rules run in a fixed order and the first match wins; later rules rely on the
 * earlier ones having ruled out literals.
 */
public class TypeInference
{
	private final SymbolTable symbols;

	public TypeInference(SymbolTable symbols)
	{
		this.symbols = symbols;
	}

	public ValueType infer(String expression)
	{
		String expr = expression.trim();

		if (expr.startsWith("\""))
		{
			return ValueType.STRING;
		}
		if (expr.equals("true") || expr.equals("false"))
		{
			return ValueType.BOOL;
		}
		if (expr.startsWith("(") && expr.contains(","))
		{
			return ValueType.TUPLE;
		}
		if (expr.startsWith("["))
		{
			return ValueType.LIST;
		}
		if (expr.startsWith("{"))
		{
			return ValueType.DICT;
		}
		if (expr.contains(".") && isFloatLiteral(expr))
		{
			return ValueType.FLOAT;
		}
		if (isIntLiteral(expr))
		{
			return ValueType.INT;
		}

		String identifier = leadingIdentifier(expr);
		boolean indexed = expr.startsWith("[", identifier.length());
		if (!identifier.isEmpty() && !indexed)
		{
			ValueType known = symbols.lookup(identifier);
			if (known != ValueType.UNKNOWN)
			{
				return known;
			}
		}

		int bracket = expr.indexOf('[');
		if (bracket > 0)
		{
			ValueType base = symbols.lookup(expr.substring(0, bracket).trim());
			if (base == ValueType.LIST || base == ValueType.TUPLE || base == ValueType.STRING)
			{
				// Strings index to their character code.
				return ValueType.INT;
			}
		}

		return ValueType.INT;
	}

	private static boolean isFloatLiteral(String expr)
	{
		String digits = expr.startsWith("-") ? expr.substring(1) : expr;
		for (int i = 0; i < digits.length(); i++)
		{
			char c = digits.charAt(i);
			if (!Character.isDigit(c) && c != '.')
			{
				return false;
			}
		}
		return true;
	}

	private static boolean isIntLiteral(String expr)
	{
		for (int i = 0; i < expr.length(); i++)
		{
			char c = expr.charAt(i);
			if (!Character.isDigit(c) && !(c == '-' && i == 0))
			{
				return false;
			}
		}
		return true;
	}

	static String leadingIdentifier(String expr)
	{
		int end = 0;
		while (end < expr.length() && (Character.isLetterOrDigit(expr.charAt(end)) || expr.charAt(end) == '_'))
		{
			end++;
		}
		return expr.substring(0, end);
	}
}
