package org.lokray.blockgen.semantic;

import org.lokray.blockgen.util.Debug;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps logical names (variables, procedures, classes) to the identifiers
 * written into generated source. Names are stable for the life of one run
 * and unique across every category: two distinct logical names never share
 * an identifier, and a reserved word is never issued.
 */
public class NameRegistry
{
	private final Set<String> reservedWords;
	private final Map<String, String> bindings = new HashMap<>();
	private final Set<String> issued = new HashSet<>();

	public NameRegistry(Collection<String> reservedWords)
	{
		this.reservedWords = Set.copyOf(reservedWords);
	}

	public NameRegistry()
	{
		this(ReservedWords.java());
	}

	/**
	 * Forgets every binding; names issued before the reset are no longer reserved.
	 */
	public void reset()
	{
		bindings.clear();
		issued.clear();
	}

	/**
	 * Returns the identifier bound to {@code logicalName} in the given
	 * category, issuing a new one on first request.
	 */
	public String getName(String logicalName, NameCategory category)
	{
		String key = category.name() + ":" + logicalName;
		String existing = bindings.get(key);
		if (existing != null)
		{
			return existing;
		}

		String name = getDistinctName(logicalName, category);
		bindings.put(key, name);
		return name;
	}

	/**
	 * Marks {@code name} as taken, so no logical name is later issued as it.
	 */
	public void reserve(String name)
	{
		issued.add(name);
	}

	/**
	 * Issues an identifier that has not been handed out yet in this run,
	 * without binding it. Block generators use this for temporaries.
	 */
	public String getDistinctName(String logicalName, NameCategory category)
	{
		String safeName = safeName(logicalName);
		String candidate = safeName;
		int suffix = 1;
		while (issued.contains(candidate) || reservedWords.contains(candidate))
		{
			suffix++;
			candidate = safeName + suffix;
		}
		issued.add(candidate);

		if (!candidate.equals(logicalName))
		{
			Debug.logDebug("NameRegistry: " + category + " '" + logicalName + "' emitted as '" + candidate + "'");
		}
		return candidate;
	}

	/**
	 * Turns an arbitrary string into a legal Java identifier. Spaces and any
	 * character Java does not accept become underscores; a leading digit
	 * gets a {@code my_} prefix.
	 */
	public static String safeName(String name)
	{
		if (name == null || name.isEmpty())
		{
			return "unnamed";
		}

		StringBuilder out = new StringBuilder(name.length());
		for (int i = 0; i < name.length(); i++)
		{
			char c = name.charAt(i);
			out.append(Character.isJavaIdentifierPart(c) && !Character.isIdentifierIgnorable(c) ? c : '_');
		}

		if (!Character.isJavaIdentifierStart(out.charAt(0)))
		{
			out.insert(0, "my_");
		}
		return out.toString();
	}
}
