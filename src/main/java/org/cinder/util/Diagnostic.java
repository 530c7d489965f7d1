package org.cinder.util;

/**
 * A single problem found while transpiling. Line {@code 0} means the problem is not tied to a
 * source line (for example, a failure of the downstream C toolchain).
 */
public record Diagnostic(String message, int line, Severity severity)
{
	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	public String format()
	{
		if (line > 0)
		{
			return String.format("[%s] line %d - %s", severity.getLabel(), line, message);
		}
		return String.format("[%s] %s", severity.getLabel(), message);
	}
}
