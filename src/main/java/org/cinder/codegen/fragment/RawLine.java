package org.cinder.codegen.fragment;

/**
 * A statement copied through from the source, without its terminating {@code ;}.
 */
public record RawLine(String code) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitRawLine(this);
	}
}
