package org.cinder.codegen.fragment;

import java.util.List;

/**
 * A call into the runtime used as a statement, e.g. {@code append(&xs, 3);}.
 */
public record FunctionCall(String function, List<String> arguments) implements Fragment
{
	public FunctionCall
	{
		arguments = List.copyOf(arguments);
	}

	@Override
	public <R> R accept(FragmentVisitor<R> visitor)
	{
		return visitor.visitFunctionCall(this);
	}
}
