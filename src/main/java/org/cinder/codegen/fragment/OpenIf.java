package org.cinder.codegen.fragment;

public record OpenIf(String condition) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenIf(this);
	}
}
