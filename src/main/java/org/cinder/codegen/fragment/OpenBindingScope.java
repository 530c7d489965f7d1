package org.cinder.codegen.fragment;

/**
 * Opens a bare C scope whose first statement declares {@code name}. Used to materialise a
 * container literal before it is iterated or printed.
 */
public record OpenBindingScope(String cType, String name, String initializer) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenBindingScope(this);
	}
}
