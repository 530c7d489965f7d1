package org.cinder.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds all command-line arguments for the Cinder transpiler.
 * The first positional argument is the source file, the optional second one is the mode.
 */
public class CompilerArguments
{
	public static final String IGNORE_EXTENSIONS_FLAG = "--ignore-file-extensions";
	public static final String SOURCE_EXTENSION = ".cin";

	private Path inputFile = null;
	private CompileMode mode = CompileMode.OPTIMIZED;
	private Path outputPath = null;
	private Path reportPath = null;
	private String cCompilerPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean ignoreExtension = false;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			boolean modeSeen = false;
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals(IGNORE_EXTENSIONS_FLAG))
				{
					parsedArgs.ignoreExtension = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-r") || arg.equals("--report"))
				{
					parsedArgs.reportPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--cc"))
				{
					parsedArgs.cCompilerPath = getNextArg(args, ++i, arg);
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// --- Positional: source file, then mode ---
				if (parsedArgs.inputFile == null)
				{
					parsedArgs.inputFile = Paths.get(arg);
				}
				else if (!modeSeen)
				{
					parsedArgs.mode = CompileMode.fromKeyword(arg)
							.orElseThrow(() -> new IllegalArgumentException("Unknown mode: " + arg + " (expected optimized, raw, debug, debug_opt or debug_raw)"));
					modeSeen = true;
				}
				else
				{
					throw new IllegalArgumentException("Unexpected argument: " + arg);
				}
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Transpiler from the Cinder scripting language to C.");
		System.out.println("\nUSAGE: cinderc [options] <file" + SOURCE_EXTENSION + "> [mode]");
		System.out.println("\nMODES:");
		System.out.println("  optimized                 Auto-close blocks by indentation (default).");
		System.out.println("  raw                       Every block needs an explicit 'end' or '}'.");
		System.out.println("  debug, debug_opt          As optimized, with tracing; runs the program after building.");
		System.out.println("  debug_raw                 As raw, with tracing; runs the program after building.");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show transpiler version and exit.");
		System.out.println("  -v, --verbose             Enable trace logging in any mode.");
		System.out.println("  -o, --output <file>       Specify the executable name; the C file is written beside it.");
		System.out.println("  -k, --check               Check the source only; do not write or compile anything.");
		System.out.println("  -r, --report <file>       Write a JSON build report.");
		System.out.println("  --cc <path>               Use this C compiler instead of the configured one.");
		System.out.println("  " + IGNORE_EXTENSIONS_FLAG + "  Accept source files without the " + SOURCE_EXTENSION + " extension.");
	}

	/**
	 * Rejects input files that do not look like Cinder sources, unless told otherwise.
	 */
	public void validateFile()
	{
		if (inputFile == null || ignoreExtension)
		{
			return;
		}
		String fileExtension = FileUtils.getFileExtension(inputFile);
		if (!SOURCE_EXTENSION.equals(fileExtension))
		{
			Debug.logWarning("The file doesn't seem to be a Cinder source file.");
			Debug.logWarning("Expected extension: " + SOURCE_EXTENSION);
			Debug.logWarning("To load anyways, use the " + IGNORE_EXTENSIONS_FLAG + " flag.");
			throw new IllegalArgumentException("Invalid file extension.");
		}
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public CompileMode getMode()
	{
		return mode;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getReportPath()
	{
		return reportPath;
	}

	public String getCCompilerPath()
	{
		return cCompilerPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean shouldIgnoreExtension()
	{
		return ignoreExtension;
	}
}
