package org.cinder.codegen.fragment;

public record PrintCall(PrintFormat format, String expression) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitPrintCall(this);
	}
}
