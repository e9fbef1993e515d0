package org.lokray.blockgen.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a visual program: its top-level chains and the variables they share.
 */
public interface Workspace
{
	List<Block> getTopBlocks();

	List<VariableEntry> getVariables();

	/**
	 * The application title configured in the editor, or null.
	 */
	default String getTitle()
	{
		return null;
	}

	default List<Block> getAllBlocks()
	{
		List<Block> blocks = new ArrayList<>();
		for (Block top : getTopBlocks())
		{
			blocks.addAll(top.getDescendants());
		}
		return blocks;
	}
}
