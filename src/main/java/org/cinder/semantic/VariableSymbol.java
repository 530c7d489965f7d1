package org.cinder.semantic;

import org.cinder.semantic.type.ValueType;

public class VariableSymbol
{
	private final String name;
	private ValueType type;
	private boolean isConst;

	public VariableSymbol(String name, ValueType type, boolean isConst)
	{
		this.name = name;
		this.type = type;
		this.isConst = isConst;
	}

	public String getName()
	{
		return name;
	}

	public ValueType getType()
	{
		return type;
	}

	public void setType(ValueType type)
	{
		this.type = type;
	}

	public boolean isConst()
	{
		return isConst;
	}

	public void setConst(boolean isConst)
	{
		this.isConst = isConst;
	}
}
