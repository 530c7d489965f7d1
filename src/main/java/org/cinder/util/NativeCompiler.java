package org.cinder.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.cinder.util.ProcessUtils.executeCommand;

/**
 * Hands the generated C translation unit to the native toolchain and, for debug modes,
 * runs the produced executable. Toolchain failures are folded into the same
 * {@link ErrorHandler} that collected the transpiler's diagnostics.
 */
public class NativeCompiler
{
	private final CompilerConfig config;
	private final ErrorHandler errorHandler;

	public NativeCompiler(CompilerConfig config, ErrorHandler errorHandler)
	{
		this.config = config;
		this.errorHandler = errorHandler;
	}

	public List<String> buildCompileCommand(Path cFile, Path executable, CompileMode mode)
	{
		List<String> command = new ArrayList<>();
		command.add(config.getCCompilerPath());
		command.addAll(mode.getCompilerFlags());
		command.add(cFile.toAbsolutePath().toString());
		command.add("-o");
		command.add(executable.toAbsolutePath().toString());
		command.add("-lm");
		return command;
	}

	/**
	 * Compiles and links {@code cFile} into {@code executable}.
	 *
	 * @return {@code true} if the toolchain succeeded
	 */
	public boolean compile(Path cFile, Path executable, CompileMode mode)
	{
		List<String> command = buildCompileCommand(cFile, executable, mode);
		Debug.logDebug("Compiling: " + String.join(" ", command));
		try
		{
			executeCommand(new ProcessBuilder(command));
			return true;
		}
		catch (IOException e)
		{
			errorHandler.logError(0, "Could not start C compiler '" + config.getCCompilerPath() + "': " + e.getMessage());
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			errorHandler.logError(0, "C compilation was interrupted.");
		}
		catch (RuntimeException e)
		{
			errorHandler.logError(0, "C compilation failed: " + e.getMessage());
		}
		return false;
	}

	/**
	 * Runs the produced executable with inherited standard streams.
	 *
	 * @return the program's exit code, or {@code -1} if it could not be started
	 */
	public int run(Path executable)
	{
		try
		{
			return ProcessUtils.runInteractive(new ProcessBuilder(executable.toAbsolutePath().toString()));
		}
		catch (IOException e)
		{
			Debug.logError("Could not run " + executable + ": " + e.getMessage());
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			Debug.logError("Program run was interrupted.");
		}
		return -1;
	}
}
