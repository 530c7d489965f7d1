package org.cinder.codegen;

public class FunctionDefinition
{
	private final String name;
	private final int declaredAtLine;
	private final FragmentStream body;

	public FunctionDefinition(String name, int declaredAtLine, FragmentStream body)
	{
		this.name = name;
		this.declaredAtLine = declaredAtLine;
		this.body = body;
	}

	public String getName()
	{
		return name;
	}

	public int getDeclaredAtLine()
	{
		return declaredAtLine;
	}

	public FragmentStream getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		return "func " + name + "@" + declaredAtLine;
	}
}
