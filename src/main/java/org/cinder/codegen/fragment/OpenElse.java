package org.cinder.codegen.fragment;

/**
 * @see OpenElseIf
 */
public record OpenElse(boolean closesPrevious) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenElse(this);
	}
}
