package org.cinder.semantic.block;

public enum BlockKind
{
	IF("if"),
	ELIF("elif"),
	ELSE("else"),
	WHILE("while"),
	FOR("for"),
	FOR_IN("for-in"),
	FUNC("func");

	private final String keyword;

	BlockKind(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	/**
	 * Whether an {@code elif} or {@code else} may continue this block.
	 */
	public boolean acceptsContinuation()
	{
		return switch (this)
		{
			case IF, ELIF -> true;
			case ELSE, WHILE, FOR, FOR_IN, FUNC -> false;
		};
	}
}
