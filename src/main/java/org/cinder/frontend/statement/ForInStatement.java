package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

public record ForInStatement(int line, String variable, Expression iterable, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitForIn(this);
	}
}
