package org.cinder.codegen.fragment;

/**
 * Inclusive counted loop from {@code start} to {@code end}. A descending loop compares with
 * {@code >=}.
 */
public record OpenCountedFor(String variable, String start, String end, String step, boolean descending) implements Fragment
{
	public boolean isUnitStep()
	{
		return "1".equals(step);
	}

	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenCountedFor(this);
	}
}
