package org.cinder.codegen;

import org.cinder.semantic.SymbolTable;
import org.cinder.semantic.TypeInference;
import org.cinder.semantic.block.BlockTracker;
import org.cinder.util.CompileMode;
import org.cinder.util.CompilerConfig;
import org.cinder.util.ErrorHandler;

/**
 * Everything one compilation reads and mutates, sized from the configuration.
 */
public class CompilationContext
{
	private final CompilerConfig config;
	private final CompileMode mode;
	private final ErrorHandler errorHandler;
	private final SymbolTable symbols;
	private final BlockTracker blocks;
	private final FunctionTable functions;
	private final FragmentStream mainStream;
	private final TypeInference inference;
	private final ExpressionRewriter rewriter;

	public CompilationContext(CompilerConfig config, CompileMode mode, ErrorHandler errorHandler)
	{
		this.config = config;
		this.mode = mode;
		this.errorHandler = errorHandler;
		this.symbols = new SymbolTable(config.getMaxVariables());
		this.blocks = new BlockTracker(config.getMaxDepth());
		this.functions = new FunctionTable(config.getMaxFunctions());
		this.mainStream = new FragmentStream(config.getMaxFragments());
		this.inference = new TypeInference(symbols);
		this.rewriter = new ExpressionRewriter(symbols);
	}

	/**
	 * The stream new fragments go to: the body of the innermost open function, or the main
	 * program.
	 */
	public FragmentStream activeStream()
	{
		return blocks.activeFunction().map(FunctionDefinition::getBody).orElse(mainStream);
	}

	public CompilerConfig getConfig()
	{
		return config;
	}

	public CompileMode getMode()
	{
		return mode;
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}

	public SymbolTable getSymbols()
	{
		return symbols;
	}

	public BlockTracker getBlocks()
	{
		return blocks;
	}

	public FunctionTable getFunctions()
	{
		return functions;
	}

	public FragmentStream getMainStream()
	{
		return mainStream;
	}

	public TypeInference getInference()
	{
		return inference;
	}

	public ExpressionRewriter getRewriter()
	{
		return rewriter;
	}
}
