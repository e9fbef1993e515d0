package org.lokray.blockgen.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImportRegistryTest
{
	@Test
	void importsAreSortedAndDeduplicatedWhateverTheOrderOfRequests()
	{
		ImportRegistry first = new ImportRegistry();
		first.addImport("java.util.List");
		first.addImport("java.text.DecimalFormat");
		first.addImport("java.util.List");

		ImportRegistry second = new ImportRegistry();
		second.addImport("java.text.DecimalFormat");
		second.addImport(" java.util.List ");

		assertEquals(List.of("java.text.DecimalFormat", "java.util.List"), first.getImports());
		assertEquals(first.getImports(), second.getImports());
	}

	@Test
	void renderMergesExtraImports()
	{
		ImportRegistry imports = new ImportRegistry();
		imports.addImport("java.util.Map");
		imports.addImport("");

		assertEquals("import java.util.HashMap;\nimport java.util.Map;\n", imports.render(List.of("java.util.HashMap")));
	}

	@Test
	void resetForgetsEverything()
	{
		ImportRegistry imports = new ImportRegistry();
		imports.addImport("java.util.Map");
		imports.reset();

		assertEquals("", imports.render(List.of()));
	}
}
