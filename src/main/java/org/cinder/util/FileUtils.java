package org.cinder.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class FileUtils
{
	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	public static void save(Path filePath, String content) throws IOException
	{
		Path parent = filePath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(filePath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logDebug("Saved: " + filePath);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Replaces the extension of {@code path} (if any) with {@code newExtension}, which may be empty.
	 */
	public static Path replaceExtension(Path path, String newExtension)
	{
		String baseName = path.getFileName().toString().replaceFirst("[.][^.]+$", "");
		return path.resolveSibling(baseName + newExtension);
	}
}
