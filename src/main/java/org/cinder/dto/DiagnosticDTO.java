package org.cinder.dto;

public class DiagnosticDTO
{
	public String severity;
	public int line;
	public String message;
}
