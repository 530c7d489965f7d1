package org.cinder.codegen.fragment;

/**
 * {@code else if (COND) {}. When {@code closesPrevious} is set the branch before it is still
 * open and this fragment also closes it ({@code } else if ...}); otherwise the previous
 * branch was already closed explicitly.
 */
public record OpenElseIf(String condition, boolean closesPrevious) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenElseIf(this);
	}
}
