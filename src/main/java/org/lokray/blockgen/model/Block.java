package org.lokray.blockgen.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A node of the visual program, as seen by the generator. Implementations
 * are owned by the editor; the generator only reads them, apart from the
 * {@link #onChange()} settle hook that runs before emission.
 */
public interface Block
{
	String getId();

	/**
	 * The type tag used to look up this block's generator.
	 */
	String getType();

	List<Input> getInputs();

	/**
	 * The block below this one in its statement chain, or null.
	 */
	Block getNextBlock();

	/**
	 * The block this one is attached to (through its output or previous
	 * connection), or null for a top-level block.
	 */
	Block getParent();

	/**
	 * Whether this block produces a value rather than a statement.
	 */
	boolean hasOutput();

	/**
	 * Whether this block's output is plugged into a parent value slot.
	 */
	default boolean isOutputConnected()
	{
		return hasOutput() && getParent() != null;
	}

	/**
	 * The logical types this block's output promises, or null when it has
	 * no output or accepts anything.
	 */
	List<String> getOutputCheck();

	/**
	 * Free text attached to the block, or null.
	 */
	String getCommentText();

	String getFieldValue(String name);

	default boolean isEnabled()
	{
		return true;
	}

	/**
	 * Variables this block declares for the blocks nested inside it
	 * (procedure parameters, loop counters).
	 */
	default Collection<String> getLocalVariableNames()
	{
		return List.of();
	}

	/**
	 * Lets a block with change-reactive state settle before code is generated.
	 */
	default void onChange()
	{
	}

	default Input getInput(String name)
	{
		for (Input input : getInputs())
		{
			if (input.getName().equals(name))
			{
				return input;
			}
		}
		return null;
	}

	default Block getInputTargetBlock(String name)
	{
		Input input = getInput(name);
		return input != null ? input.getTargetBlock() : null;
	}

	/**
	 * This block followed by everything reachable through its inputs and its
	 * next link, depth first.
	 */
	default List<Block> getDescendants()
	{
		List<Block> blocks = new ArrayList<>();
		blocks.add(this);
		for (Input input : getInputs())
		{
			Block child = input.getTargetBlock();
			if (child != null)
			{
				blocks.addAll(child.getDescendants());
			}
		}
		Block next = getNextBlock();
		if (next != null)
		{
			blocks.addAll(next.getDescendants());
		}
		return blocks;
	}
}
