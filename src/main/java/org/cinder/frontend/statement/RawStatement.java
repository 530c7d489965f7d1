package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;

/**
 * Any line no other statement claims; it is copied through as a C statement.
 */
public record RawStatement(int line, Expression code) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitRaw(this);
	}
}
