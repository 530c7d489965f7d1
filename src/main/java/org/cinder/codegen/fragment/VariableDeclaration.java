package org.cinder.codegen.fragment;

/**
 * {@code [const] TYPE NAME [= INIT];}. A {@code null} initializer leaves the variable
 * uninitialized.
 */
public record VariableDeclaration(String cType, boolean isConst, String name, String initializer) implements Fragment
{
	public boolean hasInitializer()
	{
		return initializer != null;
	}

	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}
}
