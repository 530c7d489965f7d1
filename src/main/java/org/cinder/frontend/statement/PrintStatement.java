package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

public record PrintStatement(int line, Expression expression) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitPrint(this);
	}
}
