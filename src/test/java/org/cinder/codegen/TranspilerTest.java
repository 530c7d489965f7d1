package org.cinder.codegen;

import org.cinder.codegen.fragment.*;
import org.cinder.util.CompileMode;
import org.cinder.util.CompilerConfig;
import org.cinder.util.Diagnostic;
import org.cinder.util.ErrorHandler;
import org.cinder.util.Severity;
import org.junit.Test;

import java.util.List;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class TranspilerTest
{
	private ErrorHandler errors = new ErrorHandler();

	private CompilationResult transpile(CompileMode mode, String... lines)
	{
		return transpile(new CompilerConfig(), mode, lines);
	}

	private CompilationResult transpile(CompilerConfig config, CompileMode mode, String... lines)
	{
		errors = new ErrorHandler();
		return new Transpiler(config, mode, errors).transpile(String.join("\n", lines));
	}

	private CompilationResult transpile(String... lines)
	{
		return transpile(CompileMode.OPTIMIZED, lines);
	}

	private static CompilerConfig configWith(String key, String value)
	{
		Properties props = new Properties();
		props.setProperty(key, value);
		return new CompilerConfig(props);
	}

	private static Fragment declare(String cType, String name, String initializer)
	{
		return new VariableDeclaration(cType, false, name, initializer);
	}

	// --- Blocks and auto-close ---

	@Test
	public void indentationChainRendersAsOneIfElse()
	{
		CompilationResult result = transpile(
				"int n = 3",
				"while n > 0:",
				"    if n == 2:",
				"        print(\"two\")",
				"    else:",
				"        print(n)",
				"    n -= 1");

		assertThat(result.hasErrors(), is(false));
		assertThat(result.getMainFragments(), contains(
				declare("int", "n", "3"),
				new OpenWhile("n > 0"),
				new OpenIf("n == 2"),
				new PrintCall(PrintFormat.STRING, "\"two\""),
				new OpenElse(true),
				new PrintCall(PrintFormat.INT, "n"),
				new CloseScope(),
				new RawLine("n -= 1"),
				new CloseScope()));
		assertThat(result.getCSource(), containsString(
				"    while (n > 0) {\n"
						+ "        if (n == 2) {\n"
						+ "            printf(\"%s\\n\", \"two\");\n"
						+ "        } else {\n"
						+ "            printf(\"%d\\n\", (int)(n));\n"
						+ "        }\n"
						+ "        n -= 1;\n"
						+ "    }\n"
						+ "    return 0;\n"));
	}

	@Test
	public void elifChainKeepsOneScope()
	{
		CompilationResult result = transpile(
				"int x = 2",
				"if x == 1:",
				"    print(1)",
				"elif x == 2:",
				"    print(2)",
				"else:",
				"    print(3)");

		assertThat(result.hasErrors(), is(false));
		assertThat(result.getMainFragments(), contains(
				declare("int", "x", "2"),
				new OpenIf("x == 1"),
				new PrintCall(PrintFormat.INT, "1"),
				new OpenElseIf("x == 2", true),
				new PrintCall(PrintFormat.INT, "2"),
				new OpenElse(true),
				new PrintCall(PrintFormat.INT, "3"),
				new CloseScope()));
	}

	@Test
	public void braceChainOnTheClosingLine()
	{
		CompilationResult result = transpile(
				"int x = 1",
				"if x > 0 {",
				"    print(x)",
				"} else {",
				"    print(0)",
				"}");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				declare("int", "x", "1"),
				new OpenIf("x > 0"),
				new PrintCall(PrintFormat.INT, "x"),
				new CloseScope(),
				new OpenElse(false),
				new PrintCall(PrintFormat.INT, "0"),
				new CloseScope()));
		assertThat(result.getOpenBlocksAtEnd(), is(0));
	}

	@Test
	public void braceChainOnTheNextLine()
	{
		CompilationResult result = transpile(
				"int x = 1",
				"if x > 0 {",
				"    print(x)",
				"}",
				"elif x < 0 {",
				"    print(0)",
				"}");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), hasItem(new OpenElseIf("x < 0", false)));
		assertThat(result.getCSource(), containsString("    }\n    else if (x < 0) {\n"));
	}

	@Test
	public void braceBlocksIgnoreIndentation()
	{
		CompilationResult result = transpile(
				"while 1 {",
				"print(1)",
				"}",
				"print(2)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenWhile("1"),
				new PrintCall(PrintFormat.INT, "1"),
				new CloseScope(),
				new PrintCall(PrintFormat.INT, "2")));
	}

	@Test
	public void closingBraceBlockWithEndIsAWarning()
	{
		CompilationResult result = transpile(
				"int x = 1",
				"if x > 0 {",
				"    print(x)",
				"end");

		assertThat(errors.getErrors(), is(empty()));
		assertThat(errors.getWarnings(), contains(new Diagnostic("Block opened with '{' at line 2 closed with 'end'", 4, Severity.WARNING)));
		assertThat(result.getOpenBlocksAtEnd(), is(0));
	}

	@Test
	public void closingColonBlockWithBraceIsAWarning()
	{
		transpile(
				"while 1:",
				"    print(1)",
				"}");

		assertThat(errors.getErrors(), is(empty()));
		assertThat(errors.getWarnings().get(0).message(), is("Block opened with ':' at line 1 closed with '}'"));
	}

	@Test
	public void strayClosersAreErrors()
	{
		transpile("}", "end");

		assertThat(errors.getErrors().get(0).message(), is("Unmatched '}'"));
		assertThat(errors.getErrors().get(1).message(), is("'end' has no matching block"));
	}

	@Test
	public void onlyChainKeywordsMayFollowAClosingBrace()
	{
		transpile(
				"if 1 {",
				"} print(1)");

		assertThat(errors.getErrors().get(0).message(), is("Only 'else' or 'elif' may follow '}' on the same line"));
	}

	@Test
	public void braceChainAfterANonIfBlockIsRejected()
	{
		CompilationResult result = transpile(
				"int a = 0",
				"if a > 0 {",
				"    while a < 3 {",
				"        a += 1",
				"    } else {",
				"        print(a)",
				"    }",
				"}");

		assertThat(errors.getErrors(), hasSize(2));
		assertThat(errors.getErrors().get(0), is(new Diagnostic("'else' without matching 'if'", 5, Severity.ERROR)));
		assertThat(errors.getErrors().get(1), is(new Diagnostic("Unmatched '}'", 8, Severity.ERROR)));
		// The else branch is not attached to the enclosing if.
		assertThat(result.getMainFragments(), contains(
				declare("int", "a", "0"),
				new OpenIf("a > 0"),
				new OpenWhile("a < 3"),
				new RawLine("a += 1"),
				new CloseScope(),
				new PrintCall(PrintFormat.INT, "a"),
				new CloseScope()));
	}

	@Test
	public void braceElifAfterANonIfBlockIsRejected()
	{
		transpile(
				"if 1 {",
				"    for i = 1 to 2 {",
				"    } elif 0 {",
				"    }",
				"}");

		assertThat(errors.getErrors().get(0), is(new Diagnostic("'elif' without matching 'if'", 3, Severity.ERROR)));
	}

	@Test
	public void orphanChainKeywordsAreErrors()
	{
		CompilationResult result = transpile(
				"elif x:",
				"else:",
				"print(1)");

		assertThat(errors.getErrors().get(0).message(), is("'elif' without matching 'if'"));
		assertThat(errors.getErrors().get(1).message(), is("'else' without matching 'if'"));
		assertThat(result.getMainFragments(), contains(new PrintCall(PrintFormat.INT, "1")));
	}

	@Test
	public void elifAfterElseNamesTheElseLine()
	{
		transpile(CompileMode.RAW,
				"if 1:",
				"    print(1)",
				"else:",
				"    print(2)",
				"elif 0:",
				"end");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("'elif' cannot follow the 'else' at line 3"));
	}

	@Test
	public void rawModeReportsEveryUnclosedBlockInnermostFirst()
	{
		CompilationResult result = transpile(CompileMode.RAW,
				"int x = 0",
				"while x < 3:",
				"    if x == 1:",
				"        print(x)");

		List<Diagnostic> reported = errors.getErrors();
		assertThat(reported, hasSize(2));
		assertThat(reported.get(0).line(), is(3));
		assertThat(reported.get(0).message(), is("Unclosed 'if' block opened at line 3"));
		assertThat(reported.get(1).line(), is(2));
		assertThat(reported.get(1).message(), is("Unclosed 'while' block opened at line 2"));
		assertThat(result.getOpenBlocksAtEnd(), is(2));
		// Closers are still emitted so the C output stays balanced.
		assertThat(result.getCSource(), containsString("        }\n    }\n    return 0;\n"));
	}

	@Test
	public void rawModeDoesNotCloseOnDedent()
	{
		CompilationResult result = transpile(CompileMode.RAW,
				"while 1:",
				"    print(1)",
				"print(2)",
				"end");

		assertThat(errors.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenWhile("1"),
				new PrintCall(PrintFormat.INT, "1"),
				new PrintCall(PrintFormat.INT, "2"),
				new CloseScope()));
	}

	@Test
	public void unclosedBraceBlockIsAnErrorEvenWhenIndentationCloses()
	{
		CompilationResult result = transpile(
				"while 1 {",
				"    print(1)");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Unclosed 'while' block opened at line 1"));
		assertThat(result.getOpenBlocksAtEnd(), is(1));
	}

	@Test
	public void nestingDepthIsBounded()
	{
		CompilationResult result = transpile(configWith("limits.max_depth", "1"), CompileMode.OPTIMIZED,
				"if 1:",
				"    if 2:",
				"        print(1)");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Block nesting too deep: more than 1 open blocks"));
		assertThat(result.getMainFragments(), contains(
				new OpenIf("1"),
				new PrintCall(PrintFormat.INT, "1"),
				new CloseScope()));
	}

	// --- Loops ---

	@Test
	public void stringLoopClosedByEndEmitsTwoClosers()
	{
		CompilationResult result = transpile(
				"for c in \"ab\":",
				"    print(c)",
				"end");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenStringLoop("_s_c", "_i_c", "c", "\"ab\""),
				new PrintCall(PrintFormat.INT, "c"),
				new CloseScope(),
				new CloseScope()));
	}

	@Test
	public void stringLoopClosedByIndentationEmitsTwoClosers()
	{
		CompilationResult result = transpile(
				"string s = \"hey\"",
				"for c in s:",
				"    print(c)",
				"print(\"done\")");

		assertThat(result.getMainFragments(), contains(
				declare("char*", "s", "\"hey\""),
				new OpenStringLoop("_s_c", "_i_c", "c", "s"),
				new PrintCall(PrintFormat.INT, "c"),
				new CloseScope(),
				new CloseScope(),
				new PrintCall(PrintFormat.STRING, "\"done\"")));
	}

	@Test
	public void countedLoops()
	{
		CompilationResult result = transpile(
				"for i = 1 to 5:",
				"    print(i)",
				"for j = 10 to 0 (-2):",
				"    print(j)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenCountedFor("i", "1", "5", "1", false),
				new PrintCall(PrintFormat.INT, "i"),
				new CloseScope(),
				new OpenCountedFor("j", "10", "0", "-2", true),
				new PrintCall(PrintFormat.INT, "j"),
				new CloseScope()));
		assertThat(result.getCSource(), containsString("for (int j = 10; j >= 0; j += -2) {"));
	}

	// --- Containers ---

	@Test
	public void listLiteralAndIndexing()
	{
		CompilationResult result = transpile(
				"list xs = [1, 2]",
				"append(xs, 3)",
				"print(xs[0])",
				"print(xs)",
				"for v in xs:",
				"    print(v)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				declare("List", "xs", "new_list()"),
				new FunctionCall("append", List.of("&xs", "1")),
				new FunctionCall("append", List.of("&xs", "2")),
				new FunctionCall("append", List.of("&xs", "3")),
				new PrintCall(PrintFormat.INT, "xs.data[0]"),
				new PrintCall(PrintFormat.LIST, "xs"),
				new OpenIndexLoop("_i_v", "v", "int", "xs", "data"),
				new PrintCall(PrintFormat.INT, "v"),
				new CloseScope()));
	}

	@Test
	public void literalIterableIsBoundBeforeTheLoop()
	{
		CompilationResult result = transpile(
				"for x in [1, 2]:",
				"    print(x)",
				"print(0)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenBindingScope("List", "_l_x", "new_list()"),
				new FunctionCall("append", List.of("&_l_x", "1")),
				new FunctionCall("append", List.of("&_l_x", "2")),
				new OpenIndexLoop("_i_x", "x", "int", "_l_x", "data"),
				new PrintCall(PrintFormat.INT, "x"),
				new CloseScope(),
				new CloseScope(),
				new PrintCall(PrintFormat.INT, "0")));
		assertThat(result.getCSource(), containsString(
				"    { List _l_x = new_list();\n"
						+ "        append(&_l_x, 1);\n"
						+ "        append(&_l_x, 2);\n"
						+ "        for (int _i_x = 0; _i_x < _l_x.size; _i_x++) { int x = _l_x.data[_i_x];\n"
						+ "            printf(\"%d\\n\", (int)(x));\n"
						+ "        }\n"
						+ "    }\n"));
	}

	@Test
	public void literalDictIterableClosedByEnd()
	{
		CompilationResult result = transpile(
				"for k in {\"a\": 1}:",
				"    print(k)",
				"end");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenBindingScope("Dict", "_l_k", "new_dict()"),
				new FunctionCall("dset", List.of("&_l_k", "\"a\"", "1")),
				new OpenIndexLoop("_i_k", "k", "char*", "_l_k", "keys"),
				new PrintCall(PrintFormat.STRING, "k"),
				new CloseScope(),
				new CloseScope()));
	}

	@Test
	public void printedLiteralsAreBoundFirst()
	{
		CompilationResult result = transpile(
				"print([1, 2])",
				"print((3, 4))");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				new OpenBindingScope("List", "_p_1", "new_list()"),
				new FunctionCall("append", List.of("&_p_1", "1")),
				new FunctionCall("append", List.of("&_p_1", "2")),
				new PrintCall(PrintFormat.LIST, "_p_1"),
				new CloseScope(),
				new OpenBindingScope("Tuple", "_p_2", "new_tuple()"),
				new FunctionCall("tuple_push", List.of("&_p_2", "3")),
				new FunctionCall("tuple_push", List.of("&_p_2", "4")),
				new PrintCall(PrintFormat.TUPLE, "_p_2"),
				new CloseScope()));
		assertThat(result.getCSource(), not(containsString("print_list([")));
	}

	@Test
	public void emptyListLiteral()
	{
		CompilationResult result = transpile("list xs = []", "list ys");

		assertThat(result.getMainFragments(), contains(
				declare("List", "xs", "new_list()"),
				declare("List", "ys", "new_list()")));
	}

	@Test
	public void constIsDroppedForContainers()
	{
		CompilationResult result = transpile("const list xs = [7]");

		assertThat(result.getMainFragments().get(0), is(declare("List", "xs", "new_list()")));
	}

	@Test
	public void tupleLiteral()
	{
		CompilationResult result = transpile(
				"tuple t = (1, 2)",
				"print(t[1])",
				"print(t)");

		assertThat(result.getMainFragments(), contains(
				declare("Tuple", "t", "new_tuple()"),
				new FunctionCall("tuple_push", List.of("&t", "1")),
				new FunctionCall("tuple_push", List.of("&t", "2")),
				new PrintCall(PrintFormat.INT, "t.data[1]"),
				new PrintCall(PrintFormat.TUPLE, "t")));
	}

	@Test
	public void dictLiteralAndOperations()
	{
		CompilationResult result = transpile(
				"dict ages = {\"ann\": 31}",
				"dset(ages, \"bob\", 40)",
				"int a = dget(ages, \"ann\")",
				"print(ages)",
				"for k in ages:",
				"    print(k)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				declare("Dict", "ages", "new_dict()"),
				new FunctionCall("dset", List.of("&ages", "\"ann\"", "31")),
				new FunctionCall("dset", List.of("&ages", "\"bob\"", "40")),
				declare("int", "a", "dget(ages, \"ann\")"),
				new PrintCall(PrintFormat.DICT, "ages"),
				new OpenIndexLoop("_i_k", "k", "char*", "ages", "keys"),
				new PrintCall(PrintFormat.STRING, "k"),
				new CloseScope()));
	}

	@Test
	public void malformedDictPairIsReported()
	{
		transpile("dict d = {\"a\": 1, \"b\"}");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Expected 'key: value' in dict literal, got '\"b\"'"));
	}

	@Test
	public void containerCallsCheckTheDeclaredType()
	{
		CompilationResult result = transpile(
				"int n = 0",
				"append(n, 1)",
				"dset(n, \"k\", 1)",
				"append(other, 1)");

		assertThat(errors.getErrors(), hasSize(2));
		assertThat(errors.getErrors().get(0).message(), is("append() expects a list, but 'n' is declared as int"));
		assertThat(errors.getErrors().get(1).message(), is("dset() expects a dict, but 'n' is declared as int"));
		assertThat(result.getMainFragments(), hasItem(new FunctionCall("append", List.of("&other", "1"))));
	}

	// --- Scalars, printing and rewriting ---

	@Test
	public void scalarDeclarations()
	{
		CompilationResult result = transpile(
				"int count",
				"string name",
				"float ratio",
				"bool b = true",
				"const float pi = 3.14",
				"print(b)",
				"print(pi * 2)",
				"print(\"n=\" + name)");

		assertThat(result.getMainFragments(), contains(
				declare("int", "count", "0"),
				declare("char*", "name", "NULL"),
				declare("float", "ratio", null),
				declare("bool", "b", "true"),
				new VariableDeclaration("float", true, "pi", "3.14"),
				new PrintCall(PrintFormat.BOOL, "b"),
				new PrintCall(PrintFormat.FLOAT, "pi * 2"),
				new PrintCall(PrintFormat.STRING, "\"n=\" + name")));
		assertThat(result.getSymbols(), hasSize(5));
	}

	@Test
	public void timeCallsAreRewrittenOutsideLiterals()
	{
		CompilationResult result = transpile(
				"int t = time.now()",
				"float c = clock.now()",
				"print(\"time.now()\")");

		assertThat(result.getMainFragments(), contains(
				declare("int", "t", "(int)time(NULL)"),
				declare("float", "c", "((double)clock()/CLOCKS_PER_SEC)"),
				new PrintCall(PrintFormat.STRING, "\"time.now()\"")));
	}

	@Test
	public void unrecognisedLinesPassThroughAsC()
	{
		CompilationResult result = transpile(
				"list xs = []",
				"xs[0] = 5",
				"x += 1;");

		assertThat(result.getMainFragments(), hasItem(new RawLine("xs.data[0] = 5")));
		assertThat(result.getMainFragments(), hasItem(new RawLine("x += 1")));
		assertThat(result.getCSource(), containsString("    x += 1;\n"));
	}

	@Test
	public void loopKeywordsCanNameVariables()
	{
		CompilationResult result = transpile(
				"int to = 5",
				"print(to + 1)");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getMainFragments(), contains(
				declare("int", "to", "5"),
				new PrintCall(PrintFormat.INT, "to + 1")));
	}

	@Test
	public void symbolOverflowIsReportedOnce()
	{
		CompilationResult result = transpile(configWith("limits.max_variables", "2"), CompileMode.OPTIMIZED,
				"int a = 1",
				"int b = 2",
				"int c = 3",
				"int d = 4");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Symbol table overflow: more than 2 variables"));
		assertThat(errors.getErrors().get(0).line(), is(3));
		assertThat(result.getSymbols(), hasSize(2));
		// Code is still generated for the unregistered variables.
		assertThat(result.getMainFragments(), hasSize(4));
	}

	// --- Functions ---

	@Test
	public void functionBodiesGoToTheirOwnStream()
	{
		CompilationResult result = transpile(
				"func greet:",
				"    print(\"hi\")",
				"greet()");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getFunctions(), hasSize(1));
		assertThat(result.getFunctions().get(0).getBody().getFragments(), contains(new PrintCall(PrintFormat.STRING, "\"hi\"")));
		assertThat(result.getMainFragments(), contains(new RawLine("greet()")));
		assertThat(result.getCSource(), containsString("void greet();\n"));
		assertThat(result.getCSource(), containsString("void greet() {\n    printf(\"%s\\n\", \"hi\");\n}\n"));
	}

	@Test
	public void blockInsideFunctionClosesIntoTheFunctionBody()
	{
		CompilationResult result = transpile(
				"func count:",
				"    for i = 1 to 3:",
				"        print(i)",
				"count()");

		assertThat(result.getFunctions().get(0).getBody().getFragments(), contains(
				new OpenCountedFor("i", "1", "3", "1", false),
				new PrintCall(PrintFormat.INT, "i"),
				new CloseScope()));
		assertThat(result.getMainFragments(), contains(new RawLine("count()")));
	}

	@Test
	public void duplicateFunctionsAreReportedAndBothKept()
	{
		CompilationResult result = transpile(
				"func greet:",
				"    print(\"hi\")",
				"func greet:",
				"    print(\"again\")");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Duplicate function definition 'greet' (first defined at line 1)"));
		assertThat(result.getFunctions(), hasSize(2));
		String c = result.getCSource();
		assertThat(c.indexOf("void greet() {"), is(not(c.lastIndexOf("void greet() {"))));
	}

	@Test
	public void funcMainIsPlacedInTheEntryPoint()
	{
		CompilationResult result = transpile(
				"func main:",
				"    print(1)");

		assertThat(errors.getErrors(), is(empty()));
		assertThat(errors.getWarnings(), hasSize(1));
		assertThat(result.getFunctions(), is(empty()));
		assertThat(result.getMainFragments(), contains(new PrintCall(PrintFormat.INT, "1")));
	}

	@Test
	public void nestedFunctionsAreRejected()
	{
		CompilationResult result = transpile(
				"func outer:",
				"    func inner:",
				"        print(1)");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Function 'inner' cannot be defined inside function 'outer' (opened at line 1)"));
		assertThat(result.getFunctions(), hasSize(1));
		assertThat(result.getFunctions().get(0).getBody().getFragments(), contains(new PrintCall(PrintFormat.INT, "1")));
	}

	@Test
	public void functionTableIsBounded()
	{
		CompilationResult result = transpile(configWith("limits.max_functions", "1"), CompileMode.OPTIMIZED,
				"func a:",
				"    print(1)",
				"func b:",
				"    print(2)");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Function table overflow: more than 1 functions"));
		assertThat(result.getFunctions(), hasSize(1));
		assertThat(result.getMainFragments(), contains(new PrintCall(PrintFormat.INT, "2")));
	}

	@Test
	public void outputOfOneBodyIsBounded()
	{
		CompilationResult result = transpile(configWith("limits.max_fragments", "2"), CompileMode.OPTIMIZED,
				"print(1)",
				"print(2)",
				"print(3)",
				"print(4)");

		assertThat(errors.getErrors(), hasSize(1));
		assertThat(errors.getErrors().get(0).message(), is("Output overflow: more than 2 statements in one body"));
		assertThat(result.getMainFragments(), hasSize(2));
	}

	@Test
	public void emptySourceStillProducesAProgram()
	{
		CompilationResult result = transpile("", "# nothing here");

		assertThat(result.getDiagnostics(), is(empty()));
		assertThat(result.getCSource(), endsWith("int main() {\n    return 0;\n}\n"));
	}
}
