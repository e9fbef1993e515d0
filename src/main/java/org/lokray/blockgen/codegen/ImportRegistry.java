package org.lokray.blockgen.codegen;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * The imports requested while generating one compilation unit. Adding is
 * idempotent and the listing is always sorted, so the same set of requests
 * gives the same import block whatever order they arrived in.
 */
public class ImportRegistry
{
	private final TreeSet<String> imports = new TreeSet<>();

	public void addImport(String name)
	{
		if (name != null && !name.isBlank())
		{
			imports.add(name.trim());
		}
	}

	public void addAll(Collection<String> names)
	{
		if (names != null)
		{
			names.forEach(this::addImport);
		}
	}

	/**
	 * The collected imports merged with {@code extraImports}, sorted.
	 */
	public List<String> getImports(Collection<String> extraImports)
	{
		addAll(extraImports);
		return new ArrayList<>(imports);
	}

	public List<String> getImports()
	{
		return getImports(null);
	}

	/**
	 * The import block as source lines, one {@code import x;} per entry.
	 */
	public String render(Collection<String> extraImports)
	{
		StringBuilder out = new StringBuilder();
		for (String name : getImports(extraImports))
		{
			out.append("import ").append(name).append(";\n");
		}
		return out.toString();
	}

	public void reset()
	{
		imports.clear();
	}
}
