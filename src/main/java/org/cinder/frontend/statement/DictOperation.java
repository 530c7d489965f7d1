package org.cinder.frontend.statement;

public enum DictOperation
{
	DSET("dset", 3),
	DGET("dget", 2);

	private final String function;
	private final int arity;

	DictOperation(String function, int arity)
	{
		this.function = function;
		this.arity = arity;
	}

	public String getFunction()
	{
		return function;
	}

	public int getArity()
	{
		return arity;
	}
}
