package org.lokray.blockgen.codegen;

import java.util.List;
import java.util.function.Supplier;

/**
 * Source lines of a helper definition, either given up front or built on
 * first request.
 */
public interface HelperBody
{
	List<String> materialize();

	static HelperBody eager(List<String> lines)
	{
		return new Eager(lines);
	}

	static HelperBody lazy(Supplier<List<String>> factory)
	{
		return new Lazy(factory);
	}

	record Eager(List<String> lines) implements HelperBody
	{
		public Eager
		{
			lines = List.copyOf(lines);
		}

		@Override
		public List<String> materialize()
		{
			return lines;
		}
	}

	record Lazy(Supplier<List<String>> factory) implements HelperBody
	{
		public Lazy
		{
			if (factory == null)
			{
				throw new CodeGenerationException("Lazy helper body needs a factory");
			}
		}

		@Override
		public List<String> materialize()
		{
			List<String> lines = factory.get();
			return lines == null ? List.of() : lines;
		}
	}
}
