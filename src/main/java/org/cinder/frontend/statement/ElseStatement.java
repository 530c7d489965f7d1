package org.cinder.frontend.statement;

public record ElseStatement(int line, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitElse(this);
	}
}
