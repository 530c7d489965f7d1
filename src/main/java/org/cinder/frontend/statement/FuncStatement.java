package org.cinder.frontend.statement;

public record FuncStatement(int line, String name, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitFunc(this);
	}
}
