package org.cinder.semantic.block;

/**
 * How a block gets closed, fixed when the block is opened.
 */
public enum Discipline
{
	/** Opened with {@code :}; closes on dedent, or explicitly. */
	INDENT(":"),
	/** Opened with {@code :} in a raw mode; only {@code end} or {@code }} closes it. */
	EXPLICIT_END(":"),
	/** Opened with a trailing {@code {}; closed by a lone {@code }}. */
	BRACE("{");

	private final String opener;

	Discipline(String opener)
	{
		this.opener = opener;
	}

	public static Discipline forOpener(boolean opensBrace, boolean autoClose)
	{
		if (opensBrace)
		{
			return BRACE;
		}
		return autoClose ? INDENT : EXPLICIT_END;
	}

	public boolean canAutoClose()
	{
		return this == INDENT;
	}

	public String getOpener()
	{
		return opener;
	}
}
