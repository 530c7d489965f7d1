package org.cinder;

import org.cinder.codegen.CompilationResult;
import org.cinder.codegen.Transpiler;
import org.cinder.dto.ReportDTO;
import org.cinder.util.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Command-line entry point: reads one source file, transpiles it to C, gates on the
 * collected diagnostics, then hands the C file to the native toolchain.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		int exitCode = run(args);
		if (exitCode != 0)
		{
			System.exit(exitCode);
		}
	}

	/**
	 * Runs the whole pipeline.
	 *
	 * @return the process exit code
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return args.length == 0 || isHelpRequest(args) ? 0 : 1;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("cinderc (Cinder to C transpiler) version " + VERSION);
				return 0;
			}
			if (arguments.getInputFile() == null)
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}
			arguments.validateFile();

			CompileMode mode = arguments.getMode();
			Debug.ENABLE_DEBUG = mode.isTracing() || arguments.isVerboseFlag();

			CompilerConfig config = loadConfig();
			if (arguments.getCCompilerPath() != null)
			{
				config = config.withCCompilerPath(arguments.getCCompilerPath());
			}

			Path inputFile = arguments.getInputFile();
			if (!Files.exists(inputFile))
			{
				Debug.logError("The specified file does not exist: " + inputFile);
				return 1;
			}

			return build(arguments, config, mode, inputFile);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Transpiler initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
		return 1;
	}

	private static int build(CompilerArguments args, CompilerConfig config, CompileMode mode, Path inputFile) throws IOException
	{
		Debug.logDebug("Starting build of " + inputFile + " in " + mode.getKeyword() + " mode...");
		ErrorHandler errorHandler = new ErrorHandler(config.getMaxDiagnostics());

		String source = FileUtils.load(inputFile);
		Transpiler transpiler = new Transpiler(config, mode, errorHandler);
		CompilationResult result = transpiler.transpile(source);

		if (errorHandler.hasErrors())
		{
			errorHandler.printReport();
			writeReport(args, inputFile, result, errorHandler);
			Debug.logError("Transpilation failed. Nothing was written.");
			return 1;
		}

		if (args.isCheckOnly())
		{
			errorHandler.printReport();
			writeReport(args, inputFile, result, errorHandler);
			Debug.logInfo("Check passed. No output generated (-k flag).");
			return 0;
		}

		Path executable = getExecutablePath(args, inputFile);
		Path cFile = FileUtils.replaceExtension(executable, ".c");
		FileUtils.save(cFile, result.getCSource());
		Debug.logDebug("C source written to " + cFile);

		NativeCompiler nativeCompiler = new NativeCompiler(config, errorHandler);
		boolean compiled = nativeCompiler.compile(cFile, executable, mode);

		errorHandler.printReport();
		writeReport(args, inputFile, result, errorHandler);
		if (!compiled)
		{
			Debug.logError("C compilation failed.");
			return 1;
		}

		Debug.logInfo("Compilation successful.");
		Debug.logInfo("Executable created at: " + executable);

		if (mode.isAutoRun())
		{
			Debug.log("--- Running " + executable.getFileName() + " ---");
			int exitCode = nativeCompiler.run(executable);
			Debug.log("--- Program exited with code " + exitCode + " ---");
		}
		return 0;
	}

	/**
	 * The executable goes to {@code -o} if given, otherwise next to the source without its
	 * extension. The C file always sits beside the executable.
	 */
	static Path getExecutablePath(CompilerArguments args, Path inputFile)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return FileUtils.replaceExtension(inputFile, "");
	}

	private static void writeReport(CompilerArguments args, Path inputFile, CompilationResult result, ErrorHandler errorHandler) throws IOException
	{
		if (args.getReportPath() == null)
		{
			return;
		}
		ReportDTO report = ReportDTOConverter.toReport(inputFile, result, errorHandler);
		ReportDTOConverter.write(report, args.getReportPath());
	}

	private static boolean isHelpRequest(String[] args)
	{
		for (String arg : args)
		{
			if (arg.equals("-h") || arg.equals("--help"))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Loads {@code ~/.config/cinder/cinder.conf} if present; missing keys fall back to the
	 * defaults in {@link CompilerConfig}.
	 */
	private static CompilerConfig loadConfig()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "cinder", "cinder.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = Files.newInputStream(configPath))
			{
				props.load(input);
				Debug.logDebug("Loaded configuration from: " + configPath);
			}
			catch (IOException e)
			{
				Debug.logWarning("Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		else
		{
			Debug.logDebug("No config file found at " + configPath + ". Using default settings.");
		}
		return new CompilerConfig(props);
	}
}
