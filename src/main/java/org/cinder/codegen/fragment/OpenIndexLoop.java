package org.cinder.codegen.fragment;

/**
 * Index loop over a runtime container, binding {@code variable} to
 * {@code iterable.field[index]} on every pass ({@code data} for lists and tuples, {@code keys}
 * for dictionaries).
 */
public record OpenIndexLoop(String index, String variable, String elementType, String iterable, String field) implements Fragment
{
	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitOpenIndexLoop(this);
	}
}
