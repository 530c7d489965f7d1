package org.cinder.dto;

import java.util.ArrayList;
import java.util.List;

public class ReportDTO
{
	public String source;
	public String mode;
	public boolean success;
	public int errorCount;
	public int warningCount;
	public List<DiagnosticDTO> diagnostics = new ArrayList<>();
	public List<FunctionDTO> functions = new ArrayList<>();
	public List<SymbolDTO> symbols = new ArrayList<>();
}
