package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

public record WhileStatement(int line, Expression condition, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitWhile(this);
	}
}
