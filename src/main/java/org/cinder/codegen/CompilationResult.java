package org.cinder.codegen;

import org.cinder.codegen.fragment.Fragment;
import org.cinder.semantic.VariableSymbol;
import org.cinder.util.CompileMode;
import org.cinder.util.Diagnostic;

import java.util.Collection;
import java.util.List;

/**
 * Outcome of one transpilation. The C source is always assembled, even when errors were
 * reported; callers must check {@link #hasErrors()} before writing it out.
 */
public class CompilationResult
{
	private final String cSource;
	private final CompileMode mode;
	private final List<FunctionDefinition> functions;
	private final List<Fragment> mainFragments;
	private final Collection<VariableSymbol> symbols;
	private final List<Diagnostic> diagnostics;
	private final boolean hasErrors;
	private final int openBlocksAtEnd;

	public CompilationResult(String cSource, CompilationContext context, int openBlocksAtEnd)
	{
		this.cSource = cSource;
		this.mode = context.getMode();
		this.functions = context.getFunctions().getDefinitions();
		this.mainFragments = context.getMainStream().getFragments();
		this.symbols = context.getSymbols().getSymbols();
		this.diagnostics = context.getErrorHandler().getDiagnostics();
		this.hasErrors = context.getErrorHandler().hasErrors();
		this.openBlocksAtEnd = openBlocksAtEnd;
	}

	public String getCSource()
	{
		return cSource;
	}

	public CompileMode getMode()
	{
		return mode;
	}

	public List<FunctionDefinition> getFunctions()
	{
		return functions;
	}

	/**
	 * The statements of the program entry point, before rendering.
	 */
	public List<Fragment> getMainFragments()
	{
		return mainFragments;
	}

	public Collection<VariableSymbol> getSymbols()
	{
		return symbols;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * Number of blocks that were still open when input ended and had to be flushed.
	 */
	public int getOpenBlocksAtEnd()
	{
		return openBlocksAtEnd;
	}
}
