package org.cinder.codegen;

import java.util.List;

/**
 * Builds the final translation unit: runtime preamble, forward declarations, function
 * bodies, then {@code main}. Everything is emitted in declaration order.
 */
public class OutputAssembler
{
	private final RuntimeLibrary runtime;

	public OutputAssembler(RuntimeLibrary runtime)
	{
		this.runtime = runtime;
	}

	public String assemble(List<FunctionDefinition> functions, FragmentStream mainStream)
	{
		StringBuilder out = new StringBuilder(runtime.getPreamble());
		if (!runtime.getPreamble().endsWith("\n"))
		{
			out.append('\n');
		}

		if (!functions.isEmpty())
		{
			out.append('\n');
			for (FunctionDefinition function : functions)
			{
				out.append("void ").append(function.getName()).append("();\n");
			}
			for (FunctionDefinition function : functions)
			{
				out.append('\n')
						.append("void ").append(function.getName()).append("() {\n")
						.append(new CRenderer(1).render(function.getBody().getFragments()))
						.append("}\n");
			}
		}

		out.append('\n')
				.append("int main() {\n")
				.append(new CRenderer(1).render(mainStream.getFragments()))
				.append("    return 0;\n")
				.append("}\n");
		return out.toString();
	}
}
