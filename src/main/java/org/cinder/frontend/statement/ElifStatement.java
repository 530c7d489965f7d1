package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

public record ElifStatement(int line, Expression condition, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitElif(this);
	}
}
