package org.lokray.blockgen.semantic;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Equivalence classes over logical types. A type registered here is
 * replaced by its canonical type before resolution, so a slot fed by both
 * a colour and a string resolves to a single string type.
 */
public class TypeEquivalence
{
	private final Map<String, String> canonical = new LinkedHashMap<>();

	public TypeEquivalence()
	{
		register("Colour", "String");
	}

	public void register(String type, String canonicalType)
	{
		canonical.put(type, canonicalType);
	}

	public boolean isKnown(String type)
	{
		return canonical.containsKey(type) || canonical.containsValue(type);
	}

	public String canonicalToken(String token)
	{
		String target = canonical.get(token);
		return target != null ? target : token;
	}

	/**
	 * Canonicalizes every token of a colon-delimited type chain, so that
	 * {@code Array:Colour} becomes {@code Array:String}.
	 */
	public String canonicalize(String type)
	{
		return Arrays.stream(type.split(":"))
				.map(String::trim)
				.map(this::canonicalToken)
				.collect(Collectors.joining(":"));
	}
}
