package org.cinder.codegen;

import org.cinder.codegen.fragment.*;

import java.util.List;

/**
 * Lays out fragments as indented C text, one statement per line. Scope openers raise the
 * indentation for the lines after them and {@link CloseScope} lowers it again.
 */
public class CRenderer implements FragmentVisitor<String>
{
	private static final String INDENT = "    ";

	private final int baseDepth;
	private int depth;

	public CRenderer(int baseDepth)
	{
		this.baseDepth = baseDepth;
		this.depth = baseDepth;
	}

	public String render(List<Fragment> fragments)
	{
		StringBuilder out = new StringBuilder();
		for (Fragment fragment : fragments)
		{
			out.append(fragment.accept(this)).append('\n');
		}
		return out.toString();
	}

	public int getDepth()
	{
		return depth;
	}

	@Override
	public String visitVariableDeclaration(VariableDeclaration fragment)
	{
		String qualifier = fragment.isConst() ? "const " : "";
		String declaration = qualifier + fragment.cType() + " " + fragment.name();
		if (fragment.hasInitializer())
		{
			declaration += " = " + fragment.initializer();
		}
		return line(declaration + ";");
	}

	@Override
	public String visitPrintCall(PrintCall fragment)
	{
		String e = fragment.expression();
		String call = switch (fragment.format())
		{
			case STRING -> "printf(\"%s\\n\", " + e + ");";
			case BOOL -> "printf(\"%s\\n\", (" + e + ") ? \"true\" : \"false\");";
			case FLOAT -> "printf(\"%f\\n\", " + e + ");";
			case LIST -> RuntimeLibrary.PRINT_LIST + "(" + e + ");";
			case TUPLE -> RuntimeLibrary.PRINT_TUPLE + "(" + e + ");";
			case DICT -> RuntimeLibrary.PRINT_DICT + "(" + e + ");";
			case INT -> "printf(\"%d\\n\", (int)(" + e + "));";
		};
		return line(call);
	}

	@Override
	public String visitFunctionCall(FunctionCall fragment)
	{
		return line(fragment.function() + "(" + String.join(", ", fragment.arguments()) + ");");
	}

	@Override
	public String visitOpenIf(OpenIf fragment)
	{
		return open("if (" + fragment.condition() + ") {");
	}

	@Override
	public String visitOpenElseIf(OpenElseIf fragment)
	{
		return continueChain("else if (" + fragment.condition() + ") {", fragment.closesPrevious());
	}

	@Override
	public String visitOpenElse(OpenElse fragment)
	{
		return continueChain("else {", fragment.closesPrevious());
	}

	@Override
	public String visitOpenWhile(OpenWhile fragment)
	{
		return open("while (" + fragment.condition() + ") {");
	}

	@Override
	public String visitOpenCountedFor(OpenCountedFor fragment)
	{
		String v = fragment.variable();
		String comparison = fragment.descending() ? " >= " : " <= ";
		String increment = fragment.isUnitStep() ? v + "++" : v + " += " + fragment.step();
		return open("for (int " + v + " = " + fragment.start() + "; " + v + comparison + fragment.end() + "; " + increment + ") {");
	}

	@Override
	public String visitOpenStringLoop(OpenStringLoop fragment)
	{
		String holder = fragment.holder();
		String i = fragment.index();
		String outer = open("{ char* " + holder + " = " + fragment.iterable() + ";");
		String loop = open("for (int " + i + " = 0; " + holder + "[" + i + "] != '\\0'; " + i + "++) { int "
				+ fragment.variable() + " = " + holder + "[" + i + "];");
		return outer + "\n" + loop;
	}

	@Override
	public String visitOpenIndexLoop(OpenIndexLoop fragment)
	{
		String i = fragment.index();
		String iterable = fragment.iterable();
		return open("for (int " + i + " = 0; " + i + " < " + iterable + ".size; " + i + "++) { "
				+ fragment.elementType() + " " + fragment.variable() + " = " + iterable + "." + fragment.field() + "[" + i + "];");
	}

	@Override
	public String visitOpenBindingScope(OpenBindingScope fragment)
	{
		return open("{ " + fragment.cType() + " " + fragment.name() + " = " + fragment.initializer() + ";");
	}

	@Override
	public String visitCloseScope(CloseScope fragment)
	{
		depth = Math.max(baseDepth, depth - 1);
		return line("}");
	}

	@Override
	public String visitRawLine(RawLine fragment)
	{
		return line(fragment.code() + ";");
	}

	private String open(String text)
	{
		String rendered = line(text);
		depth++;
		return rendered;
	}

	private String continueChain(String text, boolean closesPrevious)
	{
		if (!closesPrevious)
		{
			return open(text);
		}
		// Same depth as the branch being closed, which stays open under a new header.
		return INDENT.repeat(Math.max(baseDepth, depth - 1)) + "} " + text;
	}

	private String line(String text)
	{
		return INDENT.repeat(depth) + text;
	}
}
