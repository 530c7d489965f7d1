package org.cinder.frontend;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Turns raw source text into the significant lines the transpiler works on. Blank and
 * comment-only lines are skipped but still counted, so line numbers always match the file.
 */
public final class LineReader
{
	private static final int TAB_WIDTH = 4;

	private LineReader()
	{
	}

	public static List<String> split(String source)
	{
		return Arrays.asList(source.split("\n", -1));
	}

	/**
	 * Returns a lazy view over {@code rawLines}; each call to {@code iterator()} starts again
	 * from the first line.
	 */
	public static Iterable<SourceLine> read(List<String> rawLines)
	{
		return () -> new SignificantLineIterator(rawLines);
	}

	public static Iterable<SourceLine> read(String source)
	{
		return read(split(source));
	}

	static String stripComment(String line)
	{
		char quote = 0;
		for (int i = 0; i < line.length(); i++)
		{
			char c = line.charAt(i);
			if (quote != 0)
			{
				if (c == '\\')
				{
					i++;
				}
				else if (c == quote)
				{
					quote = 0;
				}
			}
			else if (c == '"' || c == '\'')
			{
				quote = c;
			}
			else if (c == '#')
			{
				return line.substring(0, i);
			}
		}
		return line;
	}

	static int indentation(String line)
	{
		int count = 0;
		for (int i = 0; i < line.length(); i++)
		{
			char c = line.charAt(i);
			if (c == ' ')
			{
				count++;
			}
			else if (c == '\t')
			{
				count += TAB_WIDTH;
			}
			else
			{
				break;
			}
		}
		return count;
	}

	private static final class SignificantLineIterator implements Iterator<SourceLine>
	{
		private final List<String> rawLines;
		private int position = 0;
		private SourceLine next;

		private SignificantLineIterator(List<String> rawLines)
		{
			this.rawLines = rawLines;
		}

		@Override
		public boolean hasNext()
		{
			while (next == null && position < rawLines.size())
			{
				String raw = rawLines.get(position++);
				String code = stripComment(raw).stripTrailing();
				String text = code.strip();
				if (!text.isEmpty())
				{
					next = new SourceLine(position, indentation(code), text);
				}
			}
			return next != null;
		}

		@Override
		public SourceLine next()
		{
			if (!hasNext())
			{
				throw new NoSuchElementException();
			}
			SourceLine line = next;
			next = null;
			return line;
		}
	}
}
