package org.cinder.codegen;

import java.util.Arrays;
import java.util.Optional;

/**
 * The {@code RECEIVER.now()} calls replaced by their C equivalents from {@code <time.h>}.
 */
public enum TimeFunction
{
	TIME("time", "(int)time(NULL)"),
	DATE("date", "(int)time(NULL)"),
	CLOCK("clock", "((double)clock()/CLOCKS_PER_SEC)");

	public static final String METHOD = "now";

	private final String receiver;
	private final String replacement;

	TimeFunction(String receiver, String replacement)
	{
		this.receiver = receiver;
		this.replacement = replacement;
	}

	public static Optional<TimeFunction> fromReceiver(String receiver)
	{
		return Arrays.stream(values())
				.filter(function -> function.receiver.equals(receiver))
				.findFirst();
	}

	public String getReplacement()
	{
		return replacement;
	}
}
