package org.lokray.blockgen.codegen;

import org.lokray.blockgen.semantic.NameCategory;
import org.lokray.blockgen.semantic.NameRegistry;
import org.lokray.blockgen.util.Debug;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Helper definitions requested during one run. The first request for a
 * logical name records the definition and issues its method name; every
 * later request gets that same name back and records nothing, so a helper
 * appears once in the output however many blocks use it.
 */
public class HelperRegistry
{
	/**
	 * Written in a helper body wherever the helper's own emitted name belongs.
	 */
	public static final String FUNCTION_NAME_PLACEHOLDER = "{%FUNCTION_NAME%}";

	private final NameRegistry names;
	private final Map<String, HelperDefinition> definitions = new LinkedHashMap<>();

	public HelperRegistry(NameRegistry names)
	{
		this.names = names;
	}

	public String provideFunction(String logicalName, List<String> lines)
	{
		return provideFunction(logicalName, HelperBody.eager(lines), null);
	}

	public String provideFunction(String logicalName, Supplier<List<String>> factory)
	{
		return provideFunction(logicalName, HelperBody.lazy(factory), null);
	}

	/**
	 * Records a helper method under {@code logicalName} unless one is
	 * already recorded, and returns its emitted name. A lazy body is
	 * materialized here, once. When {@code signature} is null it is read
	 * from the declaration line of the body.
	 */
	public String provideFunction(String logicalName, HelperBody body, HelperSignature signature)
	{
		HelperDefinition existing = definitions.get(logicalName);
		if (existing != null)
		{
			return existing.getEmittedName();
		}

		String emittedName = names.getDistinctName(logicalName, NameCategory.PROCEDURE);
		String code = String.join("\n", body.materialize()).replace(FUNCTION_NAME_PLACEHOLDER, emittedName);
		HelperSignature resolved = signature != null ? signature : HelperSignature.parse(code).orElse(null);

		definitions.put(logicalName, new HelperDefinition(logicalName, emittedName, code, resolved));
		Debug.logDebug("HelperRegistry: provided '" + logicalName + "' as " + emittedName);
		return emittedName;
	}

	/**
	 * Records a member under a fixed key without issuing a name (a field, a
	 * nested class, a method whose name the block already chose). The first
	 * definition under a key wins.
	 */
	public void define(String key, String code)
	{
		if (!definitions.containsKey(key))
		{
			names.reserve(key);
			definitions.put(key, new HelperDefinition(key, key, code, HelperSignature.parse(code).orElse(null)));
		}
	}

	public boolean contains(String logicalName)
	{
		return definitions.containsKey(logicalName);
	}

	/**
	 * All definitions in layout order: static ones first, then instance
	 * ones, each group sorted by logical name.
	 */
	public List<HelperDefinition> getOrderedDefinitions()
	{
		List<HelperDefinition> ordered = new ArrayList<>(definitions.values());
		ordered.sort(Comparator.comparing((HelperDefinition d) -> !d.isStatic())
				.thenComparing(HelperDefinition::getLogicalName));
		return ordered;
	}

	public void reset()
	{
		definitions.clear();
	}
}
