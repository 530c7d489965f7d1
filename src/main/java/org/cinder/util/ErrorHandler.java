package org.cinder.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates errors and warnings for one compilation. Nothing here stops processing; the
 * caller decides what to do once the pass is over. Recording silently stops once the
 * configured capacity is reached.
 */
public class ErrorHandler
{
	private final int capacity;
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private boolean hasErrors = false;

	public ErrorHandler(int capacity)
	{
		this.capacity = capacity;
	}

	public ErrorHandler()
	{
		this(CompilerConfig.DEFAULT_MAX_DIAGNOSTICS);
	}

	public void logError(int line, String msg)
	{
		record(new Diagnostic(msg, line, Severity.ERROR));
	}

	public void logWarning(int line, String msg)
	{
		record(new Diagnostic(msg, line, Severity.WARNING));
	}

	private void record(Diagnostic diagnostic)
	{
		if (diagnostic.isError())
		{
			hasErrors = true;
		}
		if (diagnostics.size() >= capacity)
		{
			return;
		}
		diagnostics.add(diagnostic);
		Debug.logDebug("diagnostic " + diagnostic.format());
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getErrors()
	{
		return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
	}

	public List<Diagnostic> getWarnings()
	{
		return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
	}

	/**
	 * Prints the summary followed by errors, then warnings, each in discovery order.
	 */
	public void printReport()
	{
		List<Diagnostic> errors = getErrors();
		List<Diagnostic> warnings = getWarnings();
		if (errors.isEmpty() && warnings.isEmpty())
		{
			return;
		}

		Debug.log(String.format("%n--- Build report: %d error(s), %d warning(s) ---", errors.size(), warnings.size()));
		for (Diagnostic error : errors)
		{
			Debug.logError(error.format());
		}
		for (Diagnostic warning : warnings)
		{
			Debug.logWarning(warning.format());
		}
	}
}
