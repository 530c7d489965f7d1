package org.cinder.util;

import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class ErrorHandlerTest
{
	@Test
	public void warningsDoNotCountAsErrors()
	{
		ErrorHandler handler = new ErrorHandler();
		handler.logWarning(3, "Block opened with '{' at line 1 closed with 'end'");

		assertThat(handler.hasErrors(), is(false));
		assertThat(handler.getWarnings(), hasSize(1));
		assertThat(handler.getErrors(), is(empty()));
	}

	@Test
	public void keepsDiscoveryOrderWithinEachSeverity()
	{
		ErrorHandler handler = new ErrorHandler();
		handler.logError(5, "second-line error");
		handler.logWarning(1, "a warning");
		handler.logError(2, "later error");

		List<String> errors = handler.getErrors().stream().map(Diagnostic::message).collect(Collectors.toList());
		assertThat(errors, contains("second-line error", "later error"));
		assertThat(handler.getDiagnostics(), hasSize(3));
	}

	@Test
	public void stopsRecordingSilentlyAtCapacity()
	{
		ErrorHandler handler = new ErrorHandler(2);
		handler.logWarning(1, "one");
		handler.logWarning(2, "two");
		handler.logError(3, "three");

		assertThat(handler.getDiagnostics(), hasSize(2));
		// The dropped error still gates emission.
		assertThat(handler.hasErrors(), is(true));
	}

	@Test
	public void formatsLineAndSeverity()
	{
		assertThat(new Diagnostic("Unmatched '}'", 7, Severity.ERROR).format(), is("[Error] line 7 - Unmatched '}'"));
		assertThat(new Diagnostic("gcc failed", 0, Severity.ERROR).format(), is("[Error] gcc failed"));
		assertThat(new Diagnostic("careful", 2, Severity.WARNING).format(), is("[Warning] line 2 - careful"));
	}
}
