package org.lokray.blockgen.model;

import java.util.Set;

/**
 * A variable visible to the workspace, with every logical type observed
 * flowing into it. The types are resolved to one during the init pass.
 */
public record VariableEntry(
		String name,
		Set<String> candidateTypes,
		StorageClass storage
)
{
	public enum StorageClass
	{
		GLOBAL,
		LOCAL
	}

	public VariableEntry
	{
		candidateTypes = candidateTypes == null ? Set.of() : Set.copyOf(candidateTypes);
		storage = storage == null ? StorageClass.GLOBAL : storage;
	}

	public static VariableEntry global(String name, String... types)
	{
		return new VariableEntry(name, Set.of(types), StorageClass.GLOBAL);
	}
}
