package org.cinder.codegen;

import org.antlr.v4.runtime.Token;
import org.cinder.codegen.fragment.*;
import org.cinder.frontend.Expression;
import org.cinder.frontend.LineReader;
import org.cinder.frontend.LineTokenizer;
import org.cinder.frontend.SourceLine;
import org.cinder.frontend.StatementParser;
import org.cinder.frontend.statement.*;
import org.cinder.semantic.SymbolTable;
import org.cinder.semantic.block.Block;
import org.cinder.semantic.block.BlockKind;
import org.cinder.semantic.block.BlockTracker;
import org.cinder.semantic.block.Discipline;
import org.cinder.semantic.type.ValueType;
import org.cinder.util.CompileMode;
import org.cinder.util.CompilerConfig;
import org.cinder.util.Debug;
import org.cinder.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.cinder.parser.CinderLexer.*;

/**
 * Single pass from source lines to C. For every significant line it handles explicit
 * closers, runs the indentation auto-close step, parses one statement and emits the
 * matching fragments into the active output stream. Problems are reported to the
 * {@link ErrorHandler} and never stop the pass.
 */
public class Transpiler implements StatementVisitor<Void>
{
	private final CompilerConfig config;
	private final CompileMode mode;
	private final ErrorHandler errorHandler;
	private final OutputAssembler assembler;
	private final LineTokenizer tokenizer;
	private final StatementParser parser;

	private CompilationContext context;
	private SourceLine currentLine;
	// An if/elif closed explicitly on the previous line; an elif/else on this line continues it.
	private Block closedChain;
	private Block chainForLine;
	private boolean symbolOverflowReported;
	private boolean fragmentOverflowReported;

	public Transpiler(CompilerConfig config, CompileMode mode, ErrorHandler errorHandler)
	{
		this(config, mode, errorHandler, RuntimeLibrary.load());
	}

	public Transpiler(CompilerConfig config, CompileMode mode, ErrorHandler errorHandler, RuntimeLibrary runtime)
	{
		this.config = config;
		this.mode = mode;
		this.errorHandler = errorHandler;
		this.assembler = new OutputAssembler(runtime);
		this.tokenizer = new LineTokenizer(errorHandler);
		this.parser = new StatementParser(errorHandler);
	}

	public CompilationResult transpile(String source)
	{
		return transpile(LineReader.read(source));
	}

	public CompilationResult transpile(Iterable<SourceLine> lines)
	{
		context = new CompilationContext(config, mode, errorHandler);
		currentLine = null;
		closedChain = null;
		chainForLine = null;
		symbolOverflowReported = false;
		fragmentOverflowReported = false;

		Debug.logDebug("transpiling in " + mode.getKeyword() + " mode");
		for (SourceLine line : lines)
		{
			processLine(line);
		}
		int flushed = flushOpenBlocks();

		String cSource = assembler.assemble(context.getFunctions().getDefinitions(), context.getMainStream());
		Debug.logDebug("assembled " + context.getFunctions().size() + " function(s) and " + context.getMainStream().size() + " main statement(s)");
		return new CompilationResult(cSource, context, flushed);
	}

	// --- Per-line driver ---

	private void processLine(SourceLine line)
	{
		currentLine = line;
		chainForLine = closedChain;
		closedChain = null;
		Debug.logDebug("line " + line.number() + " [indent " + line.indent() + "]: " + line.text());

		List<Token> tokens = tokenizer.tokenize(line);
		if (tokens.isEmpty())
		{
			return;
		}

		int first = tokens.get(0).getType();
		if (tokens.size() == 1 && first == RBRACE)
		{
			closeExplicitly(line, true);
			return;
		}
		if (tokens.size() == 1 && first == END)
		{
			closeExplicitly(line, false);
			return;
		}
		if (first == RBRACE)
		{
			boolean closedAny = closeExplicitly(line, true);
			int next = tokens.get(1).getType();
			if (next != ELSE && next != ELIF)
			{
				closedChain = null;
				errorHandler.logError(line.number(), "Only 'else' or 'elif' may follow '}' on the same line");
				return;
			}
			if (closedChain == null)
			{
				// The brace closed some other block; the branch must not attach to an outer 'if'.
				if (closedAny)
				{
					errorHandler.logError(line.number(), "'" + tokens.get(1).getText() + "' without matching 'if'");
				}
				return;
			}
			chainForLine = closedChain;
			closedChain = null;
			dispatch(line, tokens.subList(1, tokens.size()));
			return;
		}

		if (mode.isAutoClose())
		{
			boolean continuation = first == ELIF || first == ELSE;
			context.getBlocks().autoClose(line.indent(), continuation, this::closeBlock);
		}
		dispatch(line, tokens);
	}

	private void dispatch(SourceLine line, List<Token> tokens)
	{
		parser.parse(line, tokens).ifPresent(statement -> statement.accept(this));
	}

	// --- Block handling ---

	/**
	 * Pops one block for an explicit closer.
	 *
	 * @return {@code false} if nothing was open
	 */
	private boolean closeExplicitly(SourceLine line, boolean brace)
	{
		Optional<Block> popped = context.getBlocks().pop();
		if (popped.isEmpty())
		{
			errorHandler.logError(line.number(), brace ? "Unmatched '}'" : "'end' has no matching block");
			return false;
		}

		Block block = popped.get();
		if (brace && block.getDiscipline() != Discipline.BRACE)
		{
			errorHandler.logWarning(line.number(), "Block opened with '" + block.getDiscipline().getOpener() + "' at line " + block.getOpenedAtLine() + " closed with '}'");
		}
		else if (!brace && block.getDiscipline() == Discipline.BRACE)
		{
			errorHandler.logWarning(line.number(), "Block opened with '" + block.getDiscipline().getOpener() + "' at line " + block.getOpenedAtLine() + " closed with 'end'");
		}
		closeBlock(block);

		if (block.getKind().acceptsContinuation())
		{
			closedChain = block;
		}
		return true;
	}

	/**
	 * Emits the closers of a block that has just been popped. Function blocks emit nothing;
	 * popping them already switched the output back to the enclosing stream.
	 */
	private void closeBlock(Block block)
	{
		if (block.getKind() == BlockKind.FUNC)
		{
			Debug.logDebug("end of " + block.describe());
			return;
		}
		emit(new CloseScope());
		if (block.needsExtraCloser())
		{
			emit(new CloseScope());
		}
	}

	private boolean openBlock(Block block, Fragment... openers)
	{
		BlockTracker blocks = context.getBlocks();
		if (blocks.isFull())
		{
			errorHandler.logError(block.getOpenedAtLine(), "Block nesting too deep: more than " + blocks.getMaxDepth() + " open blocks");
			return false;
		}
		for (Fragment opener : openers)
		{
			emit(opener);
		}
		blocks.push(block);
		return true;
	}

	private int flushOpenBlocks()
	{
		List<Block> remaining = context.getBlocks().drain(block ->
		{
			if (mode.isRaw() || !block.getDiscipline().canAutoClose())
			{
				errorHandler.logError(block.getOpenedAtLine(), "Unclosed '" + block.getKind().getKeyword() + "' block opened at line " + block.getOpenedAtLine());
			}
			closeBlock(block);
		});
		return remaining.size();
	}

	private Discipline discipline(boolean opensBrace)
	{
		return Discipline.forOpener(opensBrace, mode.isAutoClose());
	}

	private int indent()
	{
		return currentLine.indent();
	}

	// --- Statements ---

	@Override
	public Void visitDeclaration(DeclarationStatement statement)
	{
		ValueType type = statement.type();
		switch (type)
		{
			case LIST, TUPLE, DICT -> declareContainer(statement);
			case INT, FLOAT, BOOL, STRING, UNKNOWN ->
			{
				Expression initializer = statement.initializer();
				String value = initializer.isEmpty() ? zeroValue(type) : rewrite(initializer);
				emit(new VariableDeclaration(type.getCType(), statement.isConst(), statement.name(), value));
			}
		}
		registerSymbol(statement.line(), statement.name(), type, statement.isConst());
		return null;
	}

	/**
	 * A container literal becomes a constructor call followed by one push per element (one
	 * {@code dset} per pair); anything else is assigned as written. Containers are passed by
	 * pointer to the runtime, so {@code const} is not carried over.
	 */
	private void declareContainer(DeclarationStatement statement)
	{
		String name = statement.name();
		ValueType type = statement.type();
		Expression initializer = statement.initializer();
		if (!initializer.isEmpty() && !isContainerLiteral(type, initializer))
		{
			emit(new VariableDeclaration(type.getCType(), false, name, rewrite(initializer)));
			return;
		}
		emit(new VariableDeclaration(type.getCType(), false, name, constructorCall(type)));
		literalPushes(statement.line(), type, name, initializer).forEach(this::emit);
	}

	private static boolean isContainerLiteral(ValueType type, Expression expression)
	{
		return switch (type)
		{
			case LIST -> expression.isEnclosedBy(LBRACK, RBRACK);
			case TUPLE -> expression.isEnclosedBy(LPAREN, RPAREN);
			case DICT -> expression.isEnclosedBy(LBRACE, RBRACE);
			case INT, FLOAT, BOOL, STRING, UNKNOWN -> false;
		};
	}

	private static String constructorCall(ValueType type)
	{
		return switch (type)
		{
			case TUPLE -> RuntimeLibrary.NEW_TUPLE + "()";
			case DICT -> RuntimeLibrary.NEW_DICT + "()";
			default -> RuntimeLibrary.NEW_LIST + "()";
		};
	}

	/**
	 * The runtime calls filling {@code target} from the elements of {@code literal}. An empty
	 * literal yields nothing.
	 */
	private List<Fragment> literalPushes(int line, ValueType type, String target, Expression literal)
	{
		List<Fragment> pushes = new ArrayList<>();
		String address = "&" + target;
		for (Expression element : literal.inner().split(COMMA))
		{
			if (type != ValueType.DICT)
			{
				String push = type == ValueType.TUPLE ? RuntimeLibrary.TUPLE_PUSH : RuntimeLibrary.APPEND;
				pushes.add(new FunctionCall(push, List.of(address, rewrite(element))));
				continue;
			}
			int colon = element.indexOfTopLevel(COLON);
			if (colon <= 0 || colon == element.tokens().size() - 1)
			{
				errorHandler.logError(line, "Expected 'key: value' in dict literal, got '" + element.text() + "'");
				continue;
			}
			String key = rewrite(element.sub(0, colon));
			String value = rewrite(element.sub(colon + 1, element.tokens().size()));
			pushes.add(new FunctionCall(RuntimeLibrary.DSET, List.of(address, key, value)));
		}
		return pushes;
	}

	private static String zeroValue(ValueType type)
	{
		return switch (type)
		{
			case INT, UNKNOWN -> "0";
			case STRING -> "NULL";
			case FLOAT, BOOL, LIST, DICT, TUPLE -> null;
		};
	}

	@Override
	public Void visitPrint(PrintStatement statement)
	{
		Expression expression = statement.expression();
		ValueType type = context.getInference().infer(expression.text());
		PrintFormat format = PrintFormat.forType(type);
		if (!isContainerLiteral(type, expression))
		{
			emit(new PrintCall(format, rewrite(expression)));
			return null;
		}

		// The runtime printers take a variable, so a literal is built in a scope of its own first.
		String holder = "_p_" + statement.line();
		emit(new OpenBindingScope(type.getCType(), holder, constructorCall(type)));
		literalPushes(statement.line(), type, holder, expression).forEach(this::emit);
		emit(new PrintCall(format, holder));
		emit(new CloseScope());
		return null;
	}

	@Override
	public Void visitIf(IfStatement statement)
	{
		Block block = Block.of(BlockKind.IF, indent(), statement.line(), discipline(statement.opensBrace()));
		openBlock(block, new OpenIf(rewrite(statement.condition())));
		return null;
	}

	@Override
	public Void visitElif(ElifStatement statement)
	{
		String condition = rewrite(statement.condition());
		if (chainForLine != null)
		{
			Block block = Block.of(BlockKind.ELIF, indent(), statement.line(), discipline(statement.opensBrace()));
			openBlock(block, new OpenElseIf(condition, false));
			return null;
		}

		Optional<Block> top = context.getBlocks().peek();
		if (top.isPresent() && top.get().getKind().acceptsContinuation())
		{
			emit(new OpenElseIf(condition, true));
			top.get().continueAs(BlockKind.ELIF, statement.line());
		}
		else if (top.isPresent() && top.get().getKind() == BlockKind.ELSE)
		{
			errorHandler.logError(statement.line(), "'elif' cannot follow the 'else' at line " + top.get().getBranchLine());
		}
		else
		{
			errorHandler.logError(statement.line(), "'elif' without matching 'if'");
		}
		return null;
	}

	@Override
	public Void visitElse(ElseStatement statement)
	{
		if (chainForLine != null)
		{
			Block block = Block.of(BlockKind.ELSE, indent(), statement.line(), discipline(statement.opensBrace()));
			openBlock(block, new OpenElse(false));
			return null;
		}

		Optional<Block> top = context.getBlocks().peek();
		if (top.isPresent() && top.get().getKind().acceptsContinuation())
		{
			emit(new OpenElse(true));
			top.get().continueAs(BlockKind.ELSE, statement.line());
		}
		else
		{
			errorHandler.logError(statement.line(), "'else' without matching 'if'");
		}
		return null;
	}

	@Override
	public Void visitWhile(WhileStatement statement)
	{
		Block block = Block.of(BlockKind.WHILE, indent(), statement.line(), discipline(statement.opensBrace()));
		openBlock(block, new OpenWhile(rewrite(statement.condition())));
		return null;
	}

	@Override
	public Void visitForRange(ForRangeStatement statement)
	{
		String step = rewrite(statement.step());
		Fragment opener = new OpenCountedFor(statement.variable(), rewrite(statement.start()), rewrite(statement.end()), step, step.startsWith("-"));
		registerSymbol(statement.line(), statement.variable(), ValueType.INT, false);
		openBlock(Block.of(BlockKind.FOR, indent(), statement.line(), discipline(statement.opensBrace())), opener);
		return null;
	}

	@Override
	public Void visitForIn(ForInStatement statement)
	{
		String variable = statement.variable();
		Expression iterable = statement.iterable();
		ValueType iterableType = iterable.isSingle(STRING_LITERAL) ? ValueType.STRING : context.getInference().infer(iterable.text());
		int line = statement.line();
		Debug.logDebug("for-in over " + iterableType.getKeyword() + " '" + iterable.text() + "'");

		switch (iterableType)
		{
			case LIST, TUPLE ->
			{
				registerSymbol(line, variable, ValueType.INT, false);
				openContainerLoop(statement, iterableType, ValueType.INT, "data");
			}
			case DICT ->
			{
				registerSymbol(line, variable, ValueType.STRING, false);
				openContainerLoop(statement, iterableType, ValueType.STRING, "keys");
			}
			case STRING, INT, FLOAT, BOOL, UNKNOWN ->
			{
				registerSymbol(line, variable, ValueType.INT, false);
				openBlock(Block.withExtraCloser(BlockKind.FOR_IN, indent(), line, discipline(statement.opensBrace())),
						new OpenStringLoop("_s_" + variable, "_i_" + variable, variable, rewrite(iterable)));
			}
		}
		return null;
	}

	/**
	 * Index loop over a list, tuple or dict. A literal iterable is first bound to
	 * {@code _l_VAR} in a scope of its own, so the block then needs a second closer.
	 */
	private void openContainerLoop(ForInStatement statement, ValueType iterableType, ValueType elementType, String field)
	{
		String variable = statement.variable();
		Expression iterable = statement.iterable();
		int line = statement.line();
		Discipline discipline = discipline(statement.opensBrace());
		String index = "_i_" + variable;

		if (!isContainerLiteral(iterableType, iterable))
		{
			openBlock(Block.of(BlockKind.FOR_IN, indent(), line, discipline),
					new OpenIndexLoop(index, variable, elementType.getCType(), rewrite(iterable), field));
			return;
		}

		String holder = "_l_" + variable;
		List<Fragment> openers = new ArrayList<>();
		openers.add(new OpenBindingScope(iterableType.getCType(), holder, constructorCall(iterableType)));
		openers.addAll(literalPushes(line, iterableType, holder, iterable));
		openers.add(new OpenIndexLoop(index, variable, elementType.getCType(), holder, field));
		openBlock(Block.withExtraCloser(BlockKind.FOR_IN, indent(), line, discipline), openers.toArray(new Fragment[0]));
	}

	@Override
	public Void visitFunc(FuncStatement statement)
	{
		String name = statement.name();
		int line = statement.line();
		Discipline discipline = discipline(statement.opensBrace());
		BlockTracker blocks = context.getBlocks();

		if ("main".equals(name))
		{
			errorHandler.logWarning(line, "'func main' is implicit; its body is placed in the program entry point");
			openBlock(Block.inlineFunction(indent(), line, discipline));
			return null;
		}

		Optional<Block> enclosing = blocks.innermost(BlockKind.FUNC);
		if (enclosing.isPresent())
		{
			errorHandler.logError(line, "Function '" + name + "' cannot be defined inside " + enclosing.get().describe()
					+ " (opened at line " + enclosing.get().getOpenedAtLine() + ")");
			openBlock(Block.inlineFunction(indent(), line, discipline));
			return null;
		}

		FunctionTable functions = context.getFunctions();
		functions.find(name).ifPresent(first -> errorHandler.logError(line,
				"Duplicate function definition '" + name + "' (first defined at line " + first.getDeclaredAtLine() + ")"));

		if (blocks.isFull())
		{
			// Reported by openBlock; no function is created for a body that cannot be tracked.
			openBlock(Block.inlineFunction(indent(), line, discipline));
			return null;
		}

		Optional<FunctionDefinition> definition = functions.define(name, line, context.getConfig().getMaxFragments());
		if (definition.isEmpty())
		{
			errorHandler.logError(line, "Function table overflow: more than " + functions.getCapacity() + " functions");
			openBlock(Block.inlineFunction(indent(), line, discipline));
			return null;
		}
		Debug.logDebug("function '" + name + "' defined at line " + line);
		openBlock(Block.function(definition.get(), indent(), line, discipline));
		return null;
	}

	@Override
	public Void visitAppend(AppendStatement statement)
	{
		checkContainerArgument(statement.line(), statement.list(), RuntimeLibrary.APPEND, ValueType.LIST);
		emit(new FunctionCall(RuntimeLibrary.APPEND, List.of("&" + rewrite(statement.list()), rewrite(statement.value()))));
		return null;
	}

	@Override
	public Void visitDictCall(DictCallStatement statement)
	{
		DictOperation operation = statement.operation();
		List<Expression> arguments = statement.arguments();
		checkContainerArgument(statement.line(), arguments.get(0), operation.getFunction(), ValueType.DICT);

		List<String> rendered = new ArrayList<>();
		for (Expression argument : arguments)
		{
			rendered.add(rewrite(argument));
		}
		// dget reads the dictionary by value; only dset needs its address.
		if (operation == DictOperation.DSET)
		{
			rendered.set(0, "&" + rendered.get(0));
		}
		emit(new FunctionCall(operation.getFunction(), rendered));
		return null;
	}

	@Override
	public Void visitRaw(RawStatement statement)
	{
		emit(new RawLine(rewrite(statement.code())));
		return null;
	}

	// --- Helpers ---

	/**
	 * Checks the container argument of a runtime call when it is a plain variable name.
	 * Unknown names pass, since they may be declared in C code the transpiler does not see.
	 */
	private void checkContainerArgument(int line, Expression argument, String function, ValueType expected)
	{
		if (!argument.isSingle(IDENTIFIER))
		{
			return;
		}
		ValueType actual = context.getSymbols().lookup(argument.text());
		if (actual != expected && actual != ValueType.UNKNOWN)
		{
			errorHandler.logError(line, function + "() expects a " + expected.getKeyword() + ", but '" + argument.text() + "' is declared as " + actual.getKeyword());
		}
	}

	private void registerSymbol(int line, String name, ValueType type, boolean isConst)
	{
		SymbolTable symbols = context.getSymbols();
		if (!symbols.register(name, type, isConst) && !symbolOverflowReported)
		{
			symbolOverflowReported = true;
			errorHandler.logError(line, "Symbol table overflow: more than " + symbols.getCapacity() + " variables");
		}
	}

	private String rewrite(Expression expression)
	{
		return context.getRewriter().rewrite(expression);
	}

	private void emit(Fragment fragment)
	{
		FragmentStream stream = context.activeStream();
		if (!stream.add(fragment))
		{
			if (!fragmentOverflowReported)
			{
				fragmentOverflowReported = true;
				int line = currentLine != null ? currentLine.number() : 0;
				errorHandler.logError(line, "Output overflow: more than " + stream.getCapacity() + " statements in one body");
			}
			return;
		}
		Debug.logDebug("emit " + fragment);
	}
}
