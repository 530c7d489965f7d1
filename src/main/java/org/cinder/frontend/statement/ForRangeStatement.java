package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

/**
 * {@code for VAR = START to END [(STEP)]:}
 */
public record ForRangeStatement(int line, String variable, Expression start, Expression end, Expression step, boolean opensBrace) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitForRange(this);
	}
}
