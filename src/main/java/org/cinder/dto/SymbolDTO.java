package org.cinder.dto;

public class SymbolDTO
{
	public String name;
	public String type;
	public boolean isConst = false;
}
