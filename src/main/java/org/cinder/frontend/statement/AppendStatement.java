package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

public record AppendStatement(int line, Expression list, Expression value) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitAppend(this);
	}
}
