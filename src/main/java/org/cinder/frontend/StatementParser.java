package org.cinder.frontend;

import org.antlr.v4.runtime.Token;
import org.cinder.frontend.statement.*;
import org.cinder.semantic.type.ValueType;
import org.cinder.util.Debug;
import org.cinder.util.ErrorHandler;

import java.util.List;
import java.util.Optional;

import static org.cinder.parser.CinderLexer.*;

/**
 * Small recursive-descent parser producing exactly one {@link Statement} per line.
 * The leading token picks the statement kind; anything unclaimed is a raw statement.
 * Missing pieces are reported and replaced with safe defaults wherever a statement can
 * still be generated, so one run surfaces as many problems as possible.
 * <p>
 * Block closers ({@code end} and a lone {@code }}) are handled by the transpiler before
 * this parser is consulted.
 */
public class StatementParser
{
	public static final String DEFAULT_LOOP_VARIABLE = "_i";

	private final ErrorHandler errorHandler;

	public StatementParser(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	public Optional<Statement> parse(SourceLine line, List<Token> tokens)
	{
		if (tokens.isEmpty())
		{
			return Optional.empty();
		}

		Expression all = Expression.of(line.text(), tokens);
		int lineNumber = line.number();
		int first = tokens.get(0).getType();

		Optional<Statement> statement = switch (first)
		{
			case CONST -> parseDeclaration(lineNumber, all, true);
			case INT_TYPE, FLOAT_TYPE, BOOL_TYPE, STRING_TYPE, LIST_TYPE, DICT_TYPE, TUPLE_TYPE -> parseDeclaration(lineNumber, all, false);
			case PRINT -> parsePrint(lineNumber, all);
			case IF -> Optional.of(parseIf(lineNumber, all));
			case ELIF -> Optional.of(parseElif(lineNumber, all));
			case ELSE -> Optional.of(parseElse(lineNumber, all));
			case WHILE -> Optional.of(parseWhile(lineNumber, all));
			case FOR -> Optional.of(parseFor(lineNumber, all));
			case FUNC -> Optional.of(parseFunc(lineNumber, all));
			case APPEND -> parseAppend(lineNumber, all);
			case DSET -> parseDictCall(lineNumber, all, DictOperation.DSET);
			case DGET -> parseDictCall(lineNumber, all, DictOperation.DGET);
			case END ->
			{
				errorHandler.logError(lineNumber, "'end' must stand alone on its line");
				yield Optional.empty();
			}
			default -> Optional.of(new RawStatement(lineNumber, all));
		};

		statement.ifPresent(s -> Debug.logDebug("parse line " + lineNumber + ": " + s.getClass().getSimpleName()));
		return statement;
	}

	// --- Declarations ---

	private Optional<Statement> parseDeclaration(int line, Expression all, boolean isConst)
	{
		List<Token> tokens = all.tokens();
		int typeIndex = isConst ? 1 : 0;
		if (typeIndex >= tokens.size() || !ValueType.isTypeToken(tokens.get(typeIndex).getType()))
		{
			errorHandler.logError(line, "Expected a type (int, float, bool, string, list, dict, tuple) after 'const'");
			return Optional.empty();
		}
		ValueType type = ValueType.fromTypeToken(tokens.get(typeIndex).getType()).orElseThrow();

		int nameIndex = typeIndex + 1;
		if (nameIndex >= tokens.size() || tokens.get(nameIndex).getType() != IDENTIFIER)
		{
			errorHandler.logError(line, "Missing variable name in " + type.getKeyword() + " declaration");
			return Optional.empty();
		}
		String name = tokens.get(nameIndex).getText();

		Expression initializer = Expression.empty();
		int assignIndex = nameIndex + 1;
		if (assignIndex < tokens.size())
		{
			if (tokens.get(assignIndex).getType() != ASSIGN)
			{
				errorHandler.logError(line, "Expected '=' after variable name '" + name + "'");
			}
			else if (assignIndex + 1 >= tokens.size())
			{
				errorHandler.logError(line, "Missing value after '=' in declaration of '" + name + "'");
			}
			else
			{
				initializer = all.sub(assignIndex + 1, tokens.size());
			}
		}

		return Optional.of(new DeclarationStatement(line, isConst, type, name, initializer));
	}

	// --- print(EXPR) ---

	private Optional<Statement> parsePrint(int line, Expression all)
	{
		List<Token> tokens = all.tokens();
		if (tokens.size() < 2 || tokens.get(1).getType() != LPAREN)
		{
			errorHandler.logError(line, "Expected '(' after 'print'");
			return Optional.empty();
		}
		if (tokens.get(tokens.size() - 1).getType() != RPAREN || all.matchingClose(1) != tokens.size() - 1)
		{
			errorHandler.logError(line, "Missing ')' to close 'print('");
			return Optional.empty();
		}
		Expression expression = all.sub(2, tokens.size() - 1);
		if (expression.isEmpty())
		{
			errorHandler.logError(line, "print() requires an expression");
			return Optional.empty();
		}
		return Optional.of(new PrintStatement(line, expression));
	}

	// --- Block openers ---

	private Statement parseIf(int line, Expression all)
	{
		BlockHeader header = parseHeader(line, all, "if");
		return new IfStatement(line, condition(line, header, "if", "1"), header.opensBrace());
	}

	private Statement parseElif(int line, Expression all)
	{
		BlockHeader header = parseHeader(line, all, "elif");
		return new ElifStatement(line, condition(line, header, "elif", "1"), header.opensBrace());
	}

	private Statement parseWhile(int line, Expression all)
	{
		BlockHeader header = parseHeader(line, all, "while");
		return new WhileStatement(line, condition(line, header, "while", "0"), header.opensBrace());
	}

	private Statement parseElse(int line, Expression all)
	{
		List<Token> tokens = all.tokens();
		int last = tokens.get(tokens.size() - 1).getType();
		boolean opensBrace = tokens.size() > 1 && last == LBRACE;
		boolean hasOpener = tokens.size() > 1 && (last == LBRACE || last == COLON);
		int expectedSize = hasOpener ? 2 : 1;
		if (tokens.size() > expectedSize)
		{
			String hint = tokens.get(1).getType() == IF ? " (use 'elif' for else-if)" : "";
			errorHandler.logError(line, "Unexpected tokens after 'else'" + hint);
		}
		return new ElseStatement(line, opensBrace);
	}

	private Statement parseFor(int line, Expression all)
	{
		BlockHeader header = parseHeader(line, all, "for");
		Expression body = header.body();
		int inIndex = body.indexOfTopLevel(IN);
		if (inIndex >= 0)
		{
			return parseForIn(line, header, inIndex);
		}
		return parseForRange(line, header);
	}

	private Statement parseForIn(int line, BlockHeader header, int inIndex)
	{
		Expression body = header.body();
		String variable = loopVariable(line, body.sub(0, inIndex));
		Expression iterable = body.sub(inIndex + 1, body.tokens().size());
		if (iterable.isEmpty())
		{
			errorHandler.logError(line, "Missing iterable after 'in'");
			iterable = Expression.literal("\"\"");
		}
		return new ForInStatement(line, variable, iterable, header.opensBrace());
	}

	private Statement parseForRange(int line, BlockHeader header)
	{
		Expression body = header.body();
		int assignIndex = body.indexOfTopLevel(ASSIGN);
		if (assignIndex < 0)
		{
			errorHandler.logError(line, "Missing '=' in for loop (expected 'for VAR = START to END:')");
			Expression target = body.tokens().isEmpty() ? Expression.empty() : body.sub(0, 1);
			return new ForRangeStatement(line, loopVariable(line, target), Expression.literal("0"), Expression.literal("0"), Expression.literal("1"), header.opensBrace());
		}

		String variable = loopVariable(line, body.sub(0, assignIndex));
		Expression bounds = body.sub(assignIndex + 1, body.tokens().size());
		int toIndex = bounds.indexOfTopLevel(TO);

		Expression start;
		Expression end;
		Expression step = Expression.literal("1");
		if (toIndex < 0)
		{
			errorHandler.logError(line, "Missing 'to' in for loop");
			start = bounds;
			end = Expression.empty();
		}
		else
		{
			start = bounds.sub(0, toIndex);
			end = bounds.sub(toIndex + 1, bounds.tokens().size());
			int stepOpen = stepGroupStart(end);
			if (stepOpen >= 0)
			{
				Expression stepExpression = end.sub(stepOpen, end.tokens().size()).inner();
				end = end.sub(0, stepOpen);
				if (stepExpression.isEmpty())
				{
					errorHandler.logError(line, "Missing step value in for loop");
				}
				else
				{
					step = stepExpression;
				}
			}
		}

		if (start.isEmpty())
		{
			errorHandler.logError(line, "Missing start value in for loop");
			start = Expression.literal("0");
		}
		if (end.isEmpty())
		{
			if (toIndex >= 0)
			{
				errorHandler.logError(line, "Missing end value in for loop");
			}
			end = Expression.literal("0");
		}
		return new ForRangeStatement(line, variable, start, end, step, header.opensBrace());
	}

	/**
	 * Finds a trailing {@code (STEP)} group in the end bound. A parenthesised group directly
	 * attached to a name, as in {@code len(xs)}, is a call and not a step.
	 */
	private static int stepGroupStart(Expression end)
	{
		List<Token> tokens = end.tokens();
		if (tokens.size() < 3 || tokens.get(tokens.size() - 1).getType() != RPAREN)
		{
			return -1;
		}
		for (int open = tokens.size() - 2; open > 0; open--)
		{
			if (tokens.get(open).getType() == LPAREN && end.matchingClose(open) == tokens.size() - 1)
			{
				Token before = tokens.get(open - 1);
				boolean attached = before.getStopIndex() + 1 == tokens.get(open).getStartIndex();
				boolean callable = before.getType() == IDENTIFIER || before.getType() == RPAREN || before.getType() == RBRACK;
				return attached && callable ? -1 : open;
			}
		}
		return -1;
	}

	private String loopVariable(int line, Expression target)
	{
		if (target.isSingle(IDENTIFIER))
		{
			return target.text();
		}
		errorHandler.logError(line, target.isEmpty() ? "Missing loop variable in for loop" : "Invalid loop variable '" + target.text() + "'");
		return DEFAULT_LOOP_VARIABLE;
	}

	private Statement parseFunc(int line, Expression all)
	{
		BlockHeader header = parseHeader(line, all, "func");
		List<Token> tokens = header.body().tokens();
		if (tokens.isEmpty() || tokens.get(0).getType() != IDENTIFIER)
		{
			errorHandler.logError(line, "Missing function name after 'func'");
			return new FuncStatement(line, "_unnamed_" + line, header.opensBrace());
		}
		String name = tokens.get(0).getText();
		boolean emptyParameters = tokens.size() == 3 && tokens.get(1).getType() == LPAREN && tokens.get(2).getType() == RPAREN;
		if (tokens.size() > 1 && !emptyParameters)
		{
			errorHandler.logError(line, "Unexpected tokens after function name '" + name + "' (functions take no parameters)");
		}
		return new FuncStatement(line, name, header.opensBrace());
	}

	// --- Intrinsics ---

	private Optional<Statement> parseAppend(int line, Expression all)
	{
		Optional<List<Expression>> arguments = callArguments(line, all, "append", 2);
		return arguments.map(args -> new AppendStatement(line, args.get(0), args.get(1)));
	}

	private Optional<Statement> parseDictCall(int line, Expression all, DictOperation operation)
	{
		Optional<List<Expression>> arguments = callArguments(line, all, operation.getFunction(), operation.getArity());
		return arguments.map(args -> new DictCallStatement(line, operation, args));
	}

	private Optional<List<Expression>> callArguments(int line, Expression all, String function, int arity)
	{
		List<Token> tokens = all.tokens();
		if (tokens.size() < 2 || tokens.get(1).getType() != LPAREN)
		{
			errorHandler.logError(line, "Expected '(' after '" + function + "'");
			return Optional.empty();
		}
		if (all.matchingClose(1) != tokens.size() - 1)
		{
			errorHandler.logError(line, "Missing ')' to close '" + function + "('");
			return Optional.empty();
		}
		List<Expression> arguments = all.sub(2, tokens.size() - 1).split(COMMA);
		if (arguments.size() != arity)
		{
			errorHandler.logError(line, function + "() expects " + arity + " arguments but got " + arguments.size());
			return Optional.empty();
		}
		return Optional.of(arguments);
	}

	// --- Shared helpers ---

	/**
	 * Splits {@code KEYWORD BODY (':' | '{')} into its body and opener. A missing opener is
	 * reported and the block is treated as indentation-delimited.
	 */
	private BlockHeader parseHeader(int line, Expression all, String keyword)
	{
		List<Token> tokens = all.tokens();
		int last = tokens.get(tokens.size() - 1).getType();
		if (tokens.size() > 1 && (last == COLON || last == LBRACE))
		{
			return new BlockHeader(all.sub(1, tokens.size() - 1), last == LBRACE);
		}
		errorHandler.logError(line, "Missing ':' or '{' at the end of the '" + keyword + "' line");
		return new BlockHeader(all.sub(1, tokens.size()), false);
	}

	private Expression condition(int line, BlockHeader header, String keyword, String fallback)
	{
		if (header.body().isEmpty())
		{
			errorHandler.logError(line, "Missing condition in '" + keyword + "'");
			return Expression.literal(fallback);
		}
		return header.body();
	}

	private record BlockHeader(Expression body, boolean opensBrace)
	{
	}
}
