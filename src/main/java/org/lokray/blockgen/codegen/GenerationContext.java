package org.lokray.blockgen.codegen;

import org.lokray.blockgen.model.Block;
import org.lokray.blockgen.model.VariableEntry;
import org.lokray.blockgen.semantic.NameCategory;
import org.lokray.blockgen.semantic.NameRegistry;
import org.lokray.blockgen.semantic.TypeEquivalence;
import org.lokray.blockgen.semantic.TypeResolver;
import org.lokray.blockgen.util.Debug;
import org.lokray.blockgen.util.ErrorHandler;
import org.lokray.blockgen.util.GeneratorSettings;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Everything one generation run accumulates: issued names, resolved
 * variable types, imports, helpers and globals. A context is created for a
 * single run and handed to every block generator; nothing in it is shared
 * with another run.
 */
public class GenerationContext
{
	/**
	 * Type tag of the block that reads a variable.
	 */
	public static final String VARIABLES_GET = "variables_get";

	private static final List<String> TO_STRING_HELPER = List.of(
			"public static String " + HelperRegistry.FUNCTION_NAME_PLACEHOLDER + "(Object object) {",
			"    String result;",
			"    if (object instanceof String) {",
			"        result = (String) object;",
			"    } else if (object instanceof Number) {",
			"        NumberFormat formatter = new DecimalFormat(\"#.#####\");",
			"        result = formatter.format(((Number) object).doubleValue());",
			"    } else {",
			"        result = \"UNKNOWN\";",
			"    }",
			"    return result;",
			"}"
	);

	private final GeneratorSettings settings;
	private final ErrorHandler errorHandler;
	private final NameRegistry names = new NameRegistry();
	private final ImportRegistry imports = new ImportRegistry();
	private final HelperRegistry helpers = new HelperRegistry(names);
	private final TypeEquivalence equivalence = new TypeEquivalence();
	private final TypeResolver typeResolver = new TypeResolver(equivalence);
	private final TypeConverter typeConverter;
	private final BlockEmitter emitter;

	private final Map<String, String> logicalTypes = new HashMap<>();
	private final Map<String, String> variableTypes = new HashMap<>();
	private final Map<String, String> globals = new LinkedHashMap<>();
	private String targetType;

	public GenerationContext(GeneratorSettings settings, GeneratorRegistry registry, ErrorHandler errorHandler)
	{
		this.settings = settings;
		this.errorHandler = errorHandler;
		this.typeConverter = new TypeConverter(registry.getBlockClasses(), equivalence, errorHandler);
		this.emitter = new BlockEmitter(registry, errorHandler);
		this.emitter.attach(this);
	}

	/**
	 * Clears every registry and cache. A fresh context is already clean;
	 * this exists so one context can be reused for a later run.
	 */
	public void reset()
	{
		names.reset();
		imports.reset();
		helpers.reset();
		logicalTypes.clear();
		variableTypes.clear();
		globals.clear();
		targetType = null;
	}

	/**
	 * Resolves the declared type of every workspace variable. Emission looks
	 * the types up by name, so this must run before any block is emitted.
	 * Global variables also get a field declaration.
	 */
	public void init(Collection<VariableEntry> variables)
	{
		for (VariableEntry variable : variables)
		{
			String logical = typeResolver.resolve(variable.candidateTypes());
			logicalTypes.put(variable.name(), logical);
			variableTypes.put(variable.name(), typeConverter.mapType(logical));
			if (variable.storage() == VariableEntry.StorageClass.GLOBAL)
			{
				globals.putIfAbsent(variable.name(), null);
			}
		}
		Debug.logDebug("GenerationContext: resolved " + variableTypes.size() + " variable types");
	}

	// --- Emission ---

	public String blockToCode(Block block)
	{
		return emitter.blockToCode(block);
	}

	public String valueToCode(Block block, String name, Order outerOrder)
	{
		return emitter.valueToCode(block, name, outerOrder);
	}

	public String statementToCode(Block block, String name)
	{
		return emitter.statementToCode(block, name);
	}

	CodeFragment emit(Block block)
	{
		return emitter.emit(block);
	}

	/**
	 * Appends {@code postfix} after the statements chained below the block
	 * being generated. Consumed by that block alone, so call it last.
	 */
	public void setPostfix(String postfix)
	{
		emitter.setPostfix(postfix);
	}

	/**
	 * Indents the statements chained below the block being generated.
	 * Consumed by that block alone, so call it last.
	 */
	public void setExtraIndent(String extraIndent)
	{
		emitter.setExtraIndent(extraIndent);
	}

	/**
	 * Code that yields the value in input {@code name} as a String. Quoted
	 * literals pass through, bare numbers are quoted, dynamic {@code Var}
	 * values call {@code toString()}, and anything else goes through the
	 * runtime conversion helper.
	 */
	public String toStringCode(Block block, String name)
	{
		Block target = block.getInputTargetBlock(name);
		if (target == null)
		{
			return "";
		}

		String item = valueToCode(block, name, Order.NONE).trim();
		if (item.isEmpty() || item.charAt(0) == '"')
		{
			return item;
		}

		if (isDynamicValue(target))
		{
			return item + ".toString()";
		}
		if (JavaLiterals.isNumber(item))
		{
			return "\"" + item + "\"";
		}

		addImport("java.text.DecimalFormat");
		addImport("java.text.NumberFormat");
		String functionName = provideFunction("blocklyToString", TO_STRING_HELPER);
		return functionName + "(" + item + ")";
	}

	private boolean isDynamicValue(Block target)
	{
		if (VARIABLES_GET.equals(target.getType()))
		{
			return TypeConverter.VAR_TYPE.equals(getVariableType(target.getFieldValue("VAR")));
		}
		List<String> check = target.getOutputCheck();
		return check != null && check.contains(TypeConverter.VAR_TYPE);
	}

	// --- Names ---

	public String getVariableName(String name)
	{
		return names.getName(name, NameCategory.VARIABLE);
	}

	public String getProcedureName(String name)
	{
		return names.getName(name, NameCategory.PROCEDURE);
	}

	public String getClassName(String name)
	{
		return names.getName(name, NameCategory.CLASS);
	}

	public String getDistinctName(String name, NameCategory category)
	{
		return names.getDistinctName(name, category);
	}

	public NameRegistry getNameRegistry()
	{
		return names;
	}

	// --- Imports and helpers ---

	public void addImport(String name)
	{
		imports.addImport(name);
	}

	public ImportRegistry getImportRegistry()
	{
		return imports;
	}

	public String provideFunction(String logicalName, List<String> lines)
	{
		return helpers.provideFunction(logicalName, lines);
	}

	public String provideFunction(String logicalName, Supplier<List<String>> factory)
	{
		return helpers.provideFunction(logicalName, factory);
	}

	public String provideFunction(String logicalName, HelperBody body, HelperSignature signature)
	{
		return helpers.provideFunction(logicalName, body, signature);
	}

	public void define(String key, String code)
	{
		helpers.define(key, code);
	}

	public HelperRegistry getHelperRegistry()
	{
		return helpers;
	}

	// --- Variables and types ---

	/**
	 * Registers {@code name} as a class field with an optional initializer.
	 * Ignored when a block enclosing {@code block} declares the name as a
	 * local, or when the field already has an initializer.
	 */
	public void setGlobalVar(Block block, String name, String initializer)
	{
		if (getLocalContext(block, name) == null && globals.get(name) == null)
		{
			globals.put(name, initializer);
		}
	}

	/**
	 * The nearest block, starting at {@code block} and walking outwards,
	 * that declares {@code name} as a local variable, or null.
	 */
	public static Block getLocalContext(Block block, String name)
	{
		for (Block current = block; current != null; current = current.getParent())
		{
			if (current.getLocalVariableNames().contains(name))
			{
				return current;
			}
		}
		return null;
	}

	/**
	 * The Java type of a workspace variable, {@code Object} when unknown.
	 */
	public String getVariableType(String name)
	{
		String type = name != null ? variableTypes.get(name) : null;
		return type != null ? type : TypeConverter.UNKNOWN_TYPE;
	}

	/**
	 * The resolved logical type of a workspace variable, or null.
	 */
	public String getLogicalType(String name)
	{
		return logicalTypes.get(name);
	}

	/**
	 * The output check of the block plugged into input {@code name}, or an
	 * empty list when nothing is plugged in or the block accepts anything.
	 */
	public List<String> getValueType(Block block, String name)
	{
		Block target = block.getInputTargetBlock(name);
		if (target == null || target.getOutputCheck() == null)
		{
			return List.of();
		}
		return target.getOutputCheck();
	}

	public String mapType(String logicalType)
	{
		return typeConverter.mapType(logicalType);
	}

	public String computeJavaType(Collection<String> logicalTypes)
	{
		return typeConverter.computeJavaType(typeResolver, logicalTypes);
	}

	public TypeEquivalence getTypeEquivalence()
	{
		return equivalence;
	}

	/**
	 * Sets the type the enclosing block expects, returning the previous one
	 * so the caller can restore it.
	 */
	public String setTargetType(String type)
	{
		String previous = targetType;
		targetType = type;
		return previous;
	}

	public String getTargetType()
	{
		return targetType;
	}

	// --- Final pass ---

	/**
	 * Field declarations for every global followed by the helper definitions
	 * (static ones first), with blank-line runs collapsed and exactly one
	 * blank line left before the body.
	 */
	public String renderDefinitions()
	{
		StringBuilder definitions = new StringBuilder();
		for (Map.Entry<String, String> global : globals.entrySet())
		{
			String type = getVariableType(global.getKey());
			String initializer = defaultInitializer(type, global.getValue());
			definitions.append("protected ").append(type).append(' ')
					.append(getVariableName(global.getKey())).append(initializer).append(";\n");
		}
		if (!globals.isEmpty())
		{
			definitions.append('\n');
		}

		for (HelperDefinition definition : helpers.getOrderedDefinitions())
		{
			definitions.append(definition.render());
		}

		if (definitions.toString().isBlank())
		{
			return "";
		}
		return definitions.toString()
				.replaceAll("\n{3,}", "\n\n")
				.replaceFirst("\n*\\z", "\n\n");
	}

	private static String defaultInitializer(String type, String configured)
	{
		if (configured != null && !configured.isEmpty())
		{
			return " = " + configured;
		}
		return switch (type)
		{
			case TypeConverter.VAR_TYPE -> " = new Var()";
			case "boolean", "Boolean" -> " = false";
			case "String" -> " = \"\"";
			default -> "";
		};
	}

	public GeneratorSettings getSettings()
	{
		return settings;
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}
}
