package org.lokray.blockgen.semantic;

import org.lokray.blockgen.util.Debug;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces the logical types flowing into a slot to the single logical
 * type the slot is declared with.
 */
public class TypeResolver
{
	/**
	 * Logical type used when nothing more specific can be decided.
	 */
	public static final String UNKNOWN = "Object";

	private final TypeEquivalence equivalence;

	public TypeResolver(TypeEquivalence equivalence)
	{
		this.equivalence = equivalence;
	}

	/**
	 * Canonicalizes and deduplicates the candidates, keeps the most specific
	 * form of nested types (so {@code Array} and {@code Array:Number} give
	 * {@code Array:Number}), and returns the one type left. Anything else
	 * (no candidates, or several unrelated ones) resolves to {@link #UNKNOWN}.
	 */
	public String resolve(Collection<String> candidates)
	{
		if (candidates == null || candidates.isEmpty())
		{
			return UNKNOWN;
		}

		Set<String> types = new LinkedHashSet<>();
		for (String candidate : candidates)
		{
			if (candidate != null && !candidate.isBlank())
			{
				types.add(equivalence.canonicalize(candidate));
			}
		}

		List<String> mostSpecific = new ArrayList<>();
		for (String type : types)
		{
			boolean refined = types.stream().anyMatch(other -> other.startsWith(type + ":"));
			if (!refined)
			{
				mostSpecific.add(type);
			}
		}

		if (mostSpecific.size() == 1)
		{
			return mostSpecific.get(0);
		}
		if (mostSpecific.size() > 1)
		{
			Debug.logDebug("TypeResolver: conflicting types " + mostSpecific + ", using " + UNKNOWN);
		}
		return UNKNOWN;
	}
}
