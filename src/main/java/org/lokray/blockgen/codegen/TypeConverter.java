package org.lokray.blockgen.codegen;

import org.lokray.blockgen.semantic.TypeEquivalence;
import org.lokray.blockgen.semantic.TypeResolver;
import org.lokray.blockgen.util.Debug;
import org.lokray.blockgen.util.ErrorHandler;

import java.util.Collection;
import java.util.Map;

/**
 * Converts logical types to Java declarations.
 * <p>
 * A logical type may be a colon-delimited chain such as {@code Array:Number},
 * in which case the head is the container and the rest is its element type.
 * Elements are looked up in a second table because Java generics need the
 * boxed form ({@code YailList<Double>}, not {@code YailList<double>}).
 */
public class TypeConverter
{
	public static final String UNKNOWN_TYPE = "Object";

	/**
	 * Logical (and Java) name of the runtime's dynamic value wrapper.
	 */
	public static final String VAR_TYPE = "Var";

	private static final Map<String, String> TYPE_MAPPING = Map.of(
			"Object", "Object",
			"Array", "YailList",
			"Map", "HashMap",
			"Boolean", "boolean",
			"String", "String",
			"Colour", "String",
			"Number", "double",
			"Var", "Var"
	);

	private static final Map<String, String> SUBTYPE_MAPPING = Map.of(
			"Object", "Object",
			"Array", "YailList",
			"Map", "HashMap",
			"Boolean", "Boolean",
			"String", "String",
			"Colour", "String",
			"Number", "Double",
			"Var", "Var"
	);

	private final Map<String, String> blockClasses;
	private final TypeEquivalence equivalence;
	private final ErrorHandler errorHandler;

	public TypeConverter(Map<String, String> blockClasses, TypeEquivalence equivalence, ErrorHandler errorHandler)
	{
		this.blockClasses = blockClasses;
		this.equivalence = equivalence;
		this.errorHandler = errorHandler;
	}

	/**
	 * Maps a logical type (possibly a nested chain) to a Java declaration.
	 * Unknown or empty types become {@link #UNKNOWN_TYPE} with a diagnostic.
	 */
	public String mapType(String logicalType)
	{
		String[] chain = logicalType == null || logicalType.isBlank()
				? new String[0]
				: logicalType.split(":");
		return mapChain(TYPE_MAPPING, chain, 0);
	}

	private String mapChain(Map<String, String> table, String[] chain, int index)
	{
		if (index >= chain.length)
		{
			errorHandler.logWarning("Empty type. Using " + UNKNOWN_TYPE);
			return UNKNOWN_TYPE;
		}

		String key = chain[index].trim();
		String type;
		if (table.containsKey(key))
		{
			type = table.get(key);
		}
		else if (blockClasses.containsKey(key))
		{
			type = blockClasses.get(key);
		}
		else if (equivalence.isKnown(key))
		{
			// A declared equivalence type is already a Java name
			type = key;
		}
		else
		{
			errorHandler.logWarning("Unknown type for " + key + " using " + UNKNOWN_TYPE);
			type = UNKNOWN_TYPE;
		}

		if (index + 1 < chain.length)
		{
			type += "<" + mapChain(SUBTYPE_MAPPING, chain, index + 1) + ">";
		}
		Debug.logDebug("TypeConverter: " + key + " -> " + type);
		return type;
	}

	/**
	 * Resolves the candidate logical types of a slot and maps the result.
	 */
	public String computeJavaType(TypeResolver resolver, Collection<String> candidates)
	{
		return mapType(resolver.resolve(candidates));
	}
}
