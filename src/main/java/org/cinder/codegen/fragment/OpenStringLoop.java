package org.cinder.codegen.fragment;

/**
 * Character loop over a string. Opens two scopes: an outer one holding the string in
 * {@code holder}, and the loop itself, which binds {@code variable} to each character code.
 */
public record OpenStringLoop(String holder, String index, String variable, String iterable) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenStringLoop(this);
	}
}
