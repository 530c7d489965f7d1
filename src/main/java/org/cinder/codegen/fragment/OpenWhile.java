package org.cinder.codegen.fragment;

public record OpenWhile(String condition) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenWhile(this);
	}
}
