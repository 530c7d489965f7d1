package org.cinder.codegen.fragment;

public interface FragmentVisitor<R>
{
	R visitVariableDeclaration(VariableDeclaration fragment);

	R visitPrintCall(PrintCall fragment);

	R visitFunctionCall(FunctionCall fragment);

	R visitOpenIf(OpenIf fragment);

	R visitOpenElseIf(OpenElseIf fragment);

	R visitOpenElse(OpenElse fragment);

	R visitOpenWhile(OpenWhile fragment);

	R visitOpenCountedFor(OpenCountedFor fragment);

	R visitOpenStringLoop(OpenStringLoop fragment);

	R visitOpenIndexLoop(OpenIndexLoop fragment);

	R visitOpenBindingScope(OpenBindingScope fragment);

	R visitCloseScope(CloseScope fragment);

	R visitRawLine(RawLine fragment);
}
