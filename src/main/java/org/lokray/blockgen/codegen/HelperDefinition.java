package org.lokray.blockgen.codegen;

import java.util.Arrays;
import java.util.Optional;

/**
 * A definition emitted once into the class body: a helper method, or any
 * other member a block needs (a field, a nested class).
 */
public final class HelperDefinition
{
	private final String logicalName;
	private final String emittedName;
	private final String code;
	private final HelperSignature signature;

	HelperDefinition(String logicalName, String emittedName, String code, HelperSignature signature)
	{
		this.logicalName = logicalName;
		this.emittedName = emittedName;
		this.code = code;
		this.signature = signature;
	}

	public String getLogicalName()
	{
		return logicalName;
	}

	public String getEmittedName()
	{
		return emittedName;
	}

	public String getCode()
	{
		return code;
	}

	public Optional<HelperSignature> getSignature()
	{
		return Optional.ofNullable(signature);
	}

	/**
	 * Static definitions are laid out before instance ones. Without a
	 * signature the first three words of the declaration decide.
	 */
	public boolean isStatic()
	{
		if (signature != null)
		{
			return signature.isStatic();
		}
		return Arrays.stream(code.trim().split("\\s+", 4))
				.limit(3)
				.anyMatch("static"::equals);
	}

	/**
	 * The definition as it appears in the class body, preceded by its
	 * documentation comment when it is a method.
	 */
	public String render()
	{
		String doc = signature != null ? signature.renderDoc() : "";
		return doc + code + "\n\n";
	}
}
