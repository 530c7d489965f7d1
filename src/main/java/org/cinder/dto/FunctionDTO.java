package org.cinder.dto;

public class FunctionDTO
{
	public String name;
	public int line;
	public int statements;
}
