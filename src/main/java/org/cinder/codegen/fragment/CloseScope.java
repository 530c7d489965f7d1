package org.cinder.codegen.fragment;

public record CloseScope() implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitCloseScope(this);
	}
}
