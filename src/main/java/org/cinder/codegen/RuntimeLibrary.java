package org.cinder.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The fixed C preamble every translation unit starts with, plus the names of the runtime
 * functions generated code calls into.
 */
public class RuntimeLibrary
{
	public static final String RESOURCE = "/runtime/prelude.c";

	public static final String NEW_LIST = "new_list";
	public static final String APPEND = "append";
	public static final String PRINT_LIST = "print_list";
	public static final String NEW_TUPLE = "new_tuple";
	public static final String TUPLE_PUSH = "tuple_push";
	public static final String PRINT_TUPLE = "print_tuple";
	public static final String NEW_DICT = "new_dict";
	public static final String DSET = "dset";
	public static final String PRINT_DICT = "print_dict";

	private final String preamble;

	private RuntimeLibrary(String preamble)
	{
		this.preamble = preamble;
	}

	/**
	 * Reads the preamble from the classpath.
	 *
	 * @throws UncheckedIOException if the resource is missing or unreadable
	 */
	public static RuntimeLibrary load()
	{
		try (InputStream in = RuntimeLibrary.class.getResourceAsStream(RESOURCE))
		{
			if (in == null)
			{
				throw new UncheckedIOException(new IOException("Runtime preamble not found on classpath: " + RESOURCE));
			}
			return new RuntimeLibrary(new String(in.readAllBytes(), StandardCharsets.UTF_8));
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Failed to read runtime preamble " + RESOURCE, e);
		}
	}

	public String getPreamble()
	{
		return preamble;
	}
}
