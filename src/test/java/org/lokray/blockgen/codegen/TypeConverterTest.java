package org.lokray.blockgen.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.blockgen.semantic.TypeEquivalence;
import org.lokray.blockgen.semantic.TypeResolver;
import org.lokray.blockgen.util.ErrorHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeConverterTest
{
	private ErrorHandler errors;
	private TypeEquivalence equivalence;
	private TypeConverter converter;

	@BeforeEach
	void setUp()
	{
		errors = new ErrorHandler();
		equivalence = new TypeEquivalence();
		converter = new TypeConverter(Map.of("Sprite", "ImageSprite"), equivalence, errors);
	}

	@Test
	void scalarTypesMapToPrimitives()
	{
		assertEquals("double", converter.mapType("Number"));
		assertEquals("boolean", converter.mapType("Boolean"));
		assertEquals("String", converter.mapType("Colour"));
		assertEquals("Var", converter.mapType("Var"));
		assertFalse(errors.hasWarnings());
	}

	@Test
	void nestedTypesUseBoxedElementTypes()
	{
		assertEquals("YailList<Double>", converter.mapType("Array:Number"));
		assertEquals("YailList<YailList<Boolean>>", converter.mapType("Array:Array:Boolean"));
		assertEquals("HashMap<String>", converter.mapType("Map:Colour"));
	}

	@Test
	void blockClassesAreUsedAsIs()
	{
		assertEquals("ImageSprite", converter.mapType("Sprite"));
		assertEquals("YailList<ImageSprite>", converter.mapType("Array:Sprite"));
	}

	@Test
	void unknownTypeFallsBackToObjectWithWarning()
	{
		assertEquals("Object", converter.mapType("Widget"));
		assertEquals(1, errors.getDiagnostics().size());
		assertTrue(errors.getDiagnostics().get(0).contains("Unknown type for Widget"));
	}

	@Test
	void emptyTypeFallsBackToObjectWithWarning()
	{
		assertEquals("Object", converter.mapType(""));
		assertTrue(errors.getDiagnostics().get(0).contains("Empty type"));
	}

	@Test
	void computeJavaTypeResolvesThenMaps()
	{
		TypeResolver resolver = new TypeResolver(equivalence);

		assertEquals("YailList<Double>", converter.computeJavaType(resolver, Set.of("Array", "Array:Number")));
		assertEquals("Object", converter.computeJavaType(resolver, List.of()));
		assertEquals("Object", converter.computeJavaType(resolver, List.of("Number", "String")));
	}
}
