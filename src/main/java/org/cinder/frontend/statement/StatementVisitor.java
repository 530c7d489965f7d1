package org.cinder.frontend.statement;

public interface StatementVisitor<R>
{
	R visitDeclaration(DeclarationStatement statement);

	R visitPrint(PrintStatement statement);

	R visitIf(IfStatement statement);

	R visitElif(ElifStatement statement);

	R visitElse(ElseStatement statement);

	R visitWhile(WhileStatement statement);

	R visitForRange(ForRangeStatement statement);

	R visitForIn(ForInStatement statement);

	R visitFunc(FuncStatement statement);

	R visitAppend(AppendStatement statement);

	R visitDictCall(DictCallStatement statement);

	R visitRaw(RawStatement statement);
}
