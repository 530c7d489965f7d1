package org.cinder.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class ProcessUtils
{
	/**
	 * Runs a command to completion, tracing its stdout and reporting its stderr.
	 *
	 * @throws RuntimeException if the command exits with a non-zero code
	 */
	public static void executeCommand(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		pb.redirectErrorStream(true);
		Process process = pb.start();

		try (BufferedReader output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)))
		{
			String s;
			while ((s = output.readLine()) != null)
			{
				Debug.logError(s);
			}
		}

		int exitCode = process.waitFor();
		if (exitCode != 0)
		{
			throw new RuntimeException("Command failed with exit code " + exitCode + " for: " + String.join(" ", pb.command()));
		}
	}

	/**
	 * Runs a command attached to this process's console and returns its exit code.
	 */
	public static int runInteractive(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Running: " + String.join(" ", pb.command()));
		Process process = pb.inheritIO().start();
		return process.waitFor();
	}
}
