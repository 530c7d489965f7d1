package org.cinder.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.cinder.codegen.CompilationResult;
import org.cinder.codegen.FunctionDefinition;
import org.cinder.dto.DiagnosticDTO;
import org.cinder.dto.FunctionDTO;
import org.cinder.dto.ReportDTO;
import org.cinder.dto.SymbolDTO;
import org.cinder.semantic.VariableSymbol;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Flattens a compilation into the JSON build report.
 */
public class ReportDTOConverter
{
	public static ReportDTO toReport(Path source, CompilationResult result, ErrorHandler errorHandler)
	{
		ReportDTO report = new ReportDTO();
		report.source = source != null ? source.toString() : null;
		report.mode = result.getMode().getKeyword();
		report.success = !errorHandler.hasErrors();
		report.errorCount = errorHandler.getErrors().size();
		report.warningCount = errorHandler.getWarnings().size();

		for (Diagnostic diagnostic : errorHandler.getDiagnostics())
		{
			DiagnosticDTO dto = new DiagnosticDTO();
			dto.severity = diagnostic.severity().getLabel();
			dto.line = diagnostic.line();
			dto.message = diagnostic.message();
			report.diagnostics.add(dto);
		}

		for (FunctionDefinition function : result.getFunctions())
		{
			FunctionDTO dto = new FunctionDTO();
			dto.name = function.getName();
			dto.line = function.getDeclaredAtLine();
			dto.statements = function.getBody().size();
			report.functions.add(dto);
		}

		for (VariableSymbol symbol : result.getSymbols())
		{
			SymbolDTO dto = new SymbolDTO();
			dto.name = symbol.getName();
			dto.type = symbol.getType().getKeyword();
			dto.isConst = symbol.isConst();
			report.symbols.add(dto);
		}
		return report;
	}

	public static String toJson(ReportDTO report)
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		return gson.toJson(report);
	}

	public static void write(ReportDTO report, Path outPath) throws IOException
	{
		FileUtils.save(outPath, toJson(report));
		Debug.logInfo("Wrote build report to: " + outPath);
	}
}
