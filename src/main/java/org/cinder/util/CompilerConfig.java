package org.cinder.util;

import java.util.Properties;

/**
 * Holds configuration settings for the Cinder transpiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final int DEFAULT_MAX_VARIABLES = 512;
	public static final int DEFAULT_MAX_DEPTH = 128;
	public static final int DEFAULT_MAX_FUNCTIONS = 256;
	public static final int DEFAULT_MAX_DIAGNOSTICS = 1000;
	public static final int DEFAULT_MAX_FRAGMENTS = 65536;

	private final String cCompilerPath;
	private final int maxVariables;
	private final int maxDepth;
	private final int maxFunctions;
	private final int maxDiagnostics;
	private final int maxFragments;

	public CompilerConfig(Properties props)
	{
		this.cCompilerPath = props.getProperty("compiler.c_path", "gcc");
		this.maxVariables = readLimit(props, "limits.max_variables", DEFAULT_MAX_VARIABLES);
		this.maxDepth = readLimit(props, "limits.max_depth", DEFAULT_MAX_DEPTH);
		this.maxFunctions = readLimit(props, "limits.max_functions", DEFAULT_MAX_FUNCTIONS);
		this.maxDiagnostics = readLimit(props, "limits.max_diagnostics", DEFAULT_MAX_DIAGNOSTICS);
		this.maxFragments = readLimit(props, "limits.max_fragments", DEFAULT_MAX_FRAGMENTS);
	}

	public CompilerConfig()
	{
		this(new Properties());
	}

	private static int readLimit(Properties props, String key, int fallback)
	{
		String value = props.getProperty(key);
		if (value == null)
		{
			return fallback;
		}
		try
		{
			int parsed = Integer.parseInt(value.trim());
			if (parsed <= 0)
			{
				throw new IllegalArgumentException("Configuration value '" + key + "' must be positive, got " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Configuration value '" + key + "' is not a number: " + value, e);
		}
	}

	/**
	 * Returns a copy of this configuration with the C compiler replaced.
	 */
	public CompilerConfig withCCompilerPath(String path)
	{
		Properties props = toProperties();
		props.setProperty("compiler.c_path", path);
		return new CompilerConfig(props);
	}

	public Properties toProperties()
	{
		Properties props = new Properties();
		props.setProperty("compiler.c_path", cCompilerPath);
		props.setProperty("limits.max_variables", Integer.toString(maxVariables));
		props.setProperty("limits.max_depth", Integer.toString(maxDepth));
		props.setProperty("limits.max_functions", Integer.toString(maxFunctions));
		props.setProperty("limits.max_diagnostics", Integer.toString(maxDiagnostics));
		props.setProperty("limits.max_fragments", Integer.toString(maxFragments));
		return props;
	}

	public String getCCompilerPath()
	{
		return cCompilerPath;
	}

	public int getMaxVariables()
	{
		return maxVariables;
	}

	public int getMaxDepth()
	{
		return maxDepth;
	}

	public int getMaxFunctions()
	{
		return maxFunctions;
	}

	public int getMaxDiagnostics()
	{
		return maxDiagnostics;
	}

	public int getMaxFragments()
	{
		return maxFragments;
	}
}
