package org.lokray.blockgen.semantic;

import java.util.Set;

/**
 * Words the generator never issues as identifiers: the Java keywords and
 * literals, plus the runtime names that generated code relies on.
 */
public final class ReservedWords
{
	private static final Set<String> JAVA = Set.of(
			"abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
			"continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
			"for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
			"new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
			"super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
			"volatile", "while", "_", "var", "record", "yield", "sealed", "permits",
			// literal values
			"false", "null", "true",
			// java.lang and runtime types referenced by generated code
			"Object", "String", "Boolean", "Double", "Integer", "Math", "System", "Var", "YailList",
			"HashMap", "ComponentContainer", "Form"
	);

	private ReservedWords()
	{
	}

	public static Set<String> java()
	{
		return JAVA;
	}
}
