package org.lokray.blockgen.codegen;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Lookup table from block type tag to its {@link BlockGenerator}. A block
 * type may also declare the Java class that represents its values, which
 * lets its tag be used as a logical type.
 */
public class GeneratorRegistry
{
	private final Map<String, BlockGenerator> generators = new HashMap<>();
	private final Map<String, String> blockClasses = new HashMap<>();

	public GeneratorRegistry register(String type, BlockGenerator generator)
	{
		if (generator == null)
		{
			throw new CodeGenerationException("No generator given for block type '" + type + "'");
		}
		generators.put(type, generator);
		return this;
	}

	public GeneratorRegistry registerBlockClass(String type, String javaClass)
	{
		blockClasses.put(type, javaClass);
		return this;
	}

	public BlockGenerator get(String type)
	{
		return generators.get(type);
	}

	public boolean has(String type)
	{
		return generators.containsKey(type);
	}

	public Map<String, String> getBlockClasses()
	{
		return Collections.unmodifiableMap(blockClasses);
	}
}
