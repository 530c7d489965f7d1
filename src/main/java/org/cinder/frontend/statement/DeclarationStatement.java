package org.cinder.frontend.statement;

import org.cinder.frontend.Expression;
import org.cinder.semantic.type.ValueType;

/**
 * {@code [const] TYPE NAME [= EXPR]}. The initializer is empty when absent.
 */
public record DeclarationStatement(int line, boolean isConst, ValueType type, String name, Expression initializer) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDeclaration(this);
	}
}
