package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

import java.util.List;

public record DictCallStatement(int line, DictOperation operation, List<Expression> arguments) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDictCall(this);
	}
}
