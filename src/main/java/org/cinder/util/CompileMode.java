package org.cinder.util;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Operating modes selected on the command line. Raw modes disable auto-close by indentation,
 * so every block needs an explicit closer. Debug modes trace every event and run the program
 * after a successful build.
 */
public enum CompileMode
{
	OPTIMIZED("optimized", true, false, List.of("-Ofast", "-w")),
	RAW("raw", false, false, List.of("-O0")),
	DEBUG("debug", true, true, List.of("-Ofast", "-g")),
	DEBUG_OPT("debug_opt", true, true, List.of("-Ofast", "-g")),
	DEBUG_RAW("debug_raw", false, true, List.of("-O0", "-g"));

	private final String keyword;
	private final boolean autoClose;
	private final boolean debug;
	private final List<String> compilerFlags;

	CompileMode(String keyword, boolean autoClose, boolean debug, List<String> compilerFlags)
	{
		this.keyword = keyword;
		this.autoClose = autoClose;
		this.debug = debug;
		this.compilerFlags = compilerFlags;
	}

	public static Optional<CompileMode> fromKeyword(String keyword)
	{
		return Arrays.stream(values())
				.filter(mode -> mode.keyword.equals(keyword))
				.findFirst();
	}

	public String getKeyword()
	{
		return keyword;
	}

	public boolean isAutoClose()
	{
		return autoClose;
	}

	public boolean isRaw()
	{
		return !autoClose;
	}

	public boolean isTracing()
	{
		return debug;
	}

	public boolean isAutoRun()
	{
		return debug;
	}

	public List<String> getCompilerFlags()
	{
		return compilerFlags;
	}
}
