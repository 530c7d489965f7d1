package org.cinder.frontend.statement;

/**
 * One parsed source line.
 */
public interface Statement
{
	int line();

	<R> R accept(StatementVisitor<R> visitor);
}
