package org.cinder.semantic.block;

import org.cinder.codegen.FunctionDefinition;
import org.cinder.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The stack of open blocks. Pushing is capacity-checked; popping is driven either by an
 * explicit closer or by {@link #autoClose(int, boolean)} when indentation drops.
 */
public class BlockTracker
{
	private final int maxDepth;
	private final Deque<Block> stack = new ArrayDeque<>();

	public BlockTracker(int maxDepth)
	{
		this.maxDepth = maxDepth;
	}

	/**
	 * @return {@code false} if the stack is already at its maximum depth
	 */
	public boolean push(Block block)
	{
		if (isFull())
		{
			return false;
		}
		stack.push(block);
		Debug.logDebug("block open " + block + " (depth " + stack.size() + ")");
		return true;
	}

	public Optional<Block> pop()
	{
		Block block = stack.poll();
		if (block != null)
		{
			Debug.logDebug("block close " + block + " (depth " + stack.size() + ")");
		}
		return Optional.ofNullable(block);
	}

	public Optional<Block> peek()
	{
		return Optional.ofNullable(stack.peek());
	}

	public boolean isEmpty()
	{
		return stack.isEmpty();
	}

	public boolean isFull()
	{
		return stack.size() >= maxDepth;
	}

	public int depth()
	{
		return stack.size();
	}

	public int getMaxDepth()
	{
		return maxDepth;
	}

	/**
	 * The function whose body is currently being written: the innermost open function block
	 * that is not inline, if any.
	 */
	public Optional<FunctionDefinition> activeFunction()
	{
		for (Block block : stack)
		{
			if (block.getKind() == BlockKind.FUNC && !block.isInline())
			{
				return Optional.of(block.getFunction());
			}
		}
		return Optional.empty();
	}

	/**
	 * Finds the innermost open block of {@code kind}.
	 */
	public Optional<Block> innermost(BlockKind kind)
	{
		return stack.stream().filter(block -> block.getKind() == kind).findFirst();
	}

	public List<Block> autoClose(int newIndent, boolean isContinuation)
	{
		return autoClose(newIndent, isContinuation, block ->
		{
		});
	}

	/**
	 * Closes the indentation-delimited blocks that a line at {@code newIndent} no longer
	 * nests inside. The pass stops at the first brace or explicit-end block, and a function
	 * block is always the last one considered. A continuation line ({@code elif}/{@code else})
	 * keeps an {@code if}/{@code elif} block at exactly its own indentation open.
	 * <p>
	 * {@code onClose} runs right after each pop, while the rest of the stack is still in
	 * place.
	 *
	 * @return the closed blocks, innermost first
	 */
	public List<Block> autoClose(int newIndent, boolean isContinuation, Consumer<Block> onClose)
	{
		List<Block> closed = new ArrayList<>();
		while (!stack.isEmpty())
		{
			Block top = stack.peek();
			if (!top.getDiscipline().canAutoClose())
			{
				break;
			}

			if (top.getKind() == BlockKind.FUNC)
			{
				if (newIndent <= top.getIndent())
				{
					closed.add(popAndNotify(onClose));
				}
				break;
			}

			boolean dedented = newIndent < top.getIndent();
			boolean sameLevel = newIndent == top.getIndent();
			boolean continuesChain = isContinuation && top.getKind().acceptsContinuation();
			if (dedented || (sameLevel && !continuesChain))
			{
				closed.add(popAndNotify(onClose));
			}
			else
			{
				break;
			}
		}
		return closed;
	}

	/**
	 * Pops everything still open at end of input, innermost first.
	 */
	public List<Block> drain(Consumer<Block> onClose)
	{
		List<Block> remaining = new ArrayList<>();
		while (!stack.isEmpty())
		{
			remaining.add(popAndNotify(onClose));
		}
		return remaining;
	}

	private Block popAndNotify(Consumer<Block> onClose)
	{
		Block block = pop().orElseThrow();
		onClose.accept(block);
		return block;
	}
}
