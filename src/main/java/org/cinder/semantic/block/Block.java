package org.cinder.semantic.block;

import org.cinder.codegen.FunctionDefinition;

/**
 * An open block on the tracker's stack. Only the kind and branch line change after the block
 * is pushed ({@code if} becomes {@code elif}, then {@code else}, as the chain continues).
 */
public class Block
{
	private final int indent;
	private final int openedAtLine;
	private final Discipline discipline;
	private final boolean needsExtraCloser;
	private final FunctionDefinition function;
	private final boolean inline;
	private BlockKind kind;
	private int branchLine;

	private Block(BlockKind kind, int indent, int openedAtLine, Discipline discipline, boolean needsExtraCloser, FunctionDefinition function, boolean inline)
	{
		this.kind = kind;
		this.indent = indent;
		this.openedAtLine = openedAtLine;
		this.branchLine = openedAtLine;
		this.discipline = discipline;
		this.needsExtraCloser = needsExtraCloser;
		this.function = function;
		this.inline = inline;
	}

	public static Block of(BlockKind kind, int indent, int openedAtLine, Discipline discipline)
	{
		return new Block(kind, indent, openedAtLine, discipline, false, null, false);
	}

	/**
	 * A loop that wraps its body in a second C scope, so every close must emit two braces.
	 */
	public static Block withExtraCloser(BlockKind kind, int indent, int openedAtLine, Discipline discipline)
	{
		return new Block(kind, indent, openedAtLine, discipline, true, null, false);
	}

	public static Block function(FunctionDefinition function, int indent, int openedAtLine, Discipline discipline)
	{
		return new Block(BlockKind.FUNC, indent, openedAtLine, discipline, false, function, false);
	}

	/**
	 * A function block whose body stays in the enclosing stream and that emits nothing when
	 * it closes (used for {@code func main}).
	 */
	public static Block inlineFunction(int indent, int openedAtLine, Discipline discipline)
	{
		return new Block(BlockKind.FUNC, indent, openedAtLine, discipline, false, null, true);
	}

	public BlockKind getKind()
	{
		return kind;
	}

	/**
	 * Moves an {@code if} chain on to its next branch, which starts at {@code line}.
	 */
	public void continueAs(BlockKind kind, int line)
	{
		this.kind = kind;
		this.branchLine = line;
	}

	public int getIndent()
	{
		return indent;
	}

	public int getOpenedAtLine()
	{
		return openedAtLine;
	}

	/**
	 * Line of the current branch header; equals {@link #getOpenedAtLine()} until the chain
	 * continues.
	 */
	public int getBranchLine()
	{
		return branchLine;
	}

	public Discipline getDiscipline()
	{
		return discipline;
	}

	public boolean needsExtraCloser()
	{
		return needsExtraCloser;
	}

	public FunctionDefinition getFunction()
	{
		return function;
	}

	public boolean isInline()
	{
		return inline;
	}

	/**
	 * Human-readable description for diagnostics, e.g. {@code 'while' block} or
	 * {@code function 'greet'}.
	 */
	public String describe()
	{
		if (kind == BlockKind.FUNC)
		{
			return "function '" + (function != null ? function.getName() : "main") + "'";
		}
		return "'" + kind.getKeyword() + "' block";
	}

	@Override
	public String toString()
	{
		return kind.getKeyword() + "@" + openedAtLine + "[indent=" + indent + ", " + discipline + "]";
	}
}
