package org.lokray.blockgen.semantic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class NameRegistryTest
{
	@Test
	void illegalCharactersBecomeUnderscores()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("my_var", names.getName("my var", NameCategory.VARIABLE));
		assertEquals("my_2fast", names.getName("2fast", NameCategory.VARIABLE));
		assertEquals("unnamed", names.getName("", NameCategory.VARIABLE));
	}

	@Test
	void reservedWordsAreNeverIssued()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("class2", names.getName("class", NameCategory.VARIABLE));
		assertEquals("String2", names.getName("String", NameCategory.PROCEDURE));
	}

	@Test
	void nameOfOnlyIllegalCharactersIsNotTheUnderscoreKeyword()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("_2", names.getName("-", NameCategory.VARIABLE));
		assertEquals("_3", names.getName("?", NameCategory.VARIABLE));
	}

	@Test
	void reservedNamesAreSkipped()
	{
		NameRegistry names = new NameRegistry();
		names.reserve("counter");

		assertEquals("counter2", names.getName("counter", NameCategory.VARIABLE));
	}

	@Test
	void sameLogicalNameIsStable()
	{
		NameRegistry names = new NameRegistry();

		String first = names.getName("count", NameCategory.VARIABLE);

		assertEquals(first, names.getName("count", NameCategory.VARIABLE));
	}

	@Test
	void distinctNamesThatSanitizeAlikeStayDistinct()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("a_b", names.getName("a b", NameCategory.VARIABLE));
		assertEquals("a_b2", names.getName("a_b", NameCategory.VARIABLE));
		assertEquals("a_b3", names.getName("a-b", NameCategory.VARIABLE));
	}

	@Test
	void uniquenessHoldsAcrossCategories()
	{
		NameRegistry names = new NameRegistry();

		String variable = names.getName("foo", NameCategory.VARIABLE);
		String procedure = names.getName("foo", NameCategory.PROCEDURE);

		assertNotEquals(variable, procedure);
	}

	@Test
	void namesAreCaseSensitive()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("total", names.getName("total", NameCategory.VARIABLE));
		assertEquals("Total", names.getName("Total", NameCategory.VARIABLE));
	}

	@Test
	void distinctNameNeverBinds()
	{
		NameRegistry names = new NameRegistry();

		assertEquals("i", names.getDistinctName("i", NameCategory.VARIABLE));
		assertEquals("i2", names.getDistinctName("i", NameCategory.VARIABLE));
	}

	@Test
	void resetReleasesIssuedNames()
	{
		NameRegistry names = new NameRegistry();
		names.getName("x", NameCategory.VARIABLE);
		names.reset();

		assertEquals("x", names.getName("x", NameCategory.PROCEDURE));
	}
}
