package org.lokray.blockgen.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HelperSignatureTest
{
	@Test
	void parsesModifiersReturnTypeAndParameters()
	{
		HelperSignature signature = HelperSignature.parse("public static String join(List<String> parts, String sep) {\n}").orElseThrow();

		assertEquals(List.of("public", "static"), signature.modifiers());
		assertEquals("String", signature.returnType());
		assertEquals("join", signature.name());
		assertEquals(List.of(
				new HelperSignature.Parameter("List<String>", "parts"),
				new HelperSignature.Parameter("String", "sep")), signature.parameters());
		assertTrue(signature.isStatic());
	}

	@Test
	void genericReturnTypeWithSpacesStaysWhole()
	{
		HelperSignature signature = HelperSignature.parse("private Map<String, Object> build() {").orElseThrow();

		assertEquals("Map<String, Object>", signature.returnType());
		assertEquals("build", signature.name());
	}

	@Test
	void constructorHasNoReturnType()
	{
		HelperSignature signature = HelperSignature.parse("public Point(int x, int y) {").orElseThrow();

		assertNull(signature.returnType());
		assertEquals("Point", signature.name());
	}

	@Test
	void leadingAnnotationsAreNotParameters()
	{
		HelperSignature signature = HelperSignature.parse(
				"@SimpleFunction(description = \"Adds (two) numbers\")\n@Deprecated\npublic double add(double a, double b) {").orElseThrow();

		assertEquals("add", signature.name());
		assertEquals("double", signature.returnType());
		assertEquals(List.of("public"), signature.modifiers());
		assertEquals(List.of(
				new HelperSignature.Parameter("double", "a"),
				new HelperSignature.Parameter("double", "b")), signature.parameters());
	}

	@Test
	void annotatedFieldIsNotAMethod()
	{
		assertTrue(HelperSignature.parse("@SimpleProperty\nprivate int count = 0;").isEmpty());
	}

	@Test
	void fieldsAreNotMethods()
	{
		assertTrue(HelperSignature.parse("private int counter = 0;").isEmpty());
		assertTrue(HelperSignature.parse("private final Map<String, Object> cache = new HashMap<>();").isEmpty());
	}

	@Test
	void docListsParametersAndReturn()
	{
		HelperSignature signature = HelperSignature.parse("public static String f(Object object) {").orElseThrow();

		assertEquals("/**\n * Description goes here\n *\n * @param object\n * @return String\n */\n", signature.renderDoc());
	}

	@Test
	void voidMethodWithoutParametersHasBareDoc()
	{
		HelperSignature signature = HelperSignature.parse("public void tick() {").orElseThrow();

		assertEquals("/**\n * Description goes here\n */\n", signature.renderDoc());
	}
}
