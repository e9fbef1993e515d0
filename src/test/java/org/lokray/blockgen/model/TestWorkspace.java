package org.lokray.blockgen.model;

import java.util.ArrayList;
import java.util.List;

public class TestWorkspace implements Workspace
{
	private final List<Block> topBlocks = new ArrayList<>();
	private final List<VariableEntry> variables = new ArrayList<>();
	private String title;

	public TestWorkspace add(Block top)
	{
		topBlocks.add(top);
		return this;
	}

	public TestWorkspace variable(VariableEntry variable)
	{
		variables.add(variable);
		return this;
	}

	public TestWorkspace title(String title)
	{
		this.title = title;
		return this;
	}

	@Override
	public List<Block> getTopBlocks()
	{
		return topBlocks;
	}

	@Override
	public List<VariableEntry> getVariables()
	{
		return variables;
	}

	@Override
	public String getTitle()
	{
		return title;
	}
}
