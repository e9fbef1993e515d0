package org.lokray.blockgen.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsLoaderTest
{
	@TempDir
	Path dir;

	@Test
	void absentKeysKeepDefaults() throws IOException
	{
		Path file = dir.resolve("settings.json");
		Files.writeString(file, "{ \"appName\": \"Greeter\", \"versionNumber\": 3, \"interfaces\": [\"Runnable\", \"Runnable\"] }");

		GeneratorSettings settings = SettingsLoader.load(file);

		assertEquals("Greeter", settings.getAppName());
		assertEquals(3, settings.getVersionNumber());
		assertEquals(List.of("Runnable"), settings.getInterfaces());
		assertEquals(GeneratorSettings.DEFAULT_PACKAGE, settings.getPackageName());
		assertEquals(GeneratorSettings.DEFAULT_BASE_CLASS, settings.getBaseClass());
		assertEquals("images/extension.png", settings.getIcon());
	}

	@Test
	void emptyFileGivesDefaults() throws IOException
	{
		Path file = dir.resolve("empty.json");
		Files.writeString(file, "");

		assertEquals(GeneratorSettings.DEFAULT_APP_NAME, SettingsLoader.load(file).getAppName());
	}

	@Test
	void malformedFileIsReported() throws IOException
	{
		Path file = dir.resolve("broken.json");
		Files.writeString(file, "{ \"appName\": ");

		assertThrows(IOException.class, () -> SettingsLoader.load(file));
	}

	@Test
	void nullEntriesAreIgnored() throws IOException
	{
		Path file = dir.resolve("nulls.json");
		Files.writeString(file, "{ \"extraImports\": [null, \"java.util.List\"], "
				+ "\"extraClasses\": { \"A\": null, \"B\": [\"class B {\", null, \"}\"] } }");

		GeneratorSettings settings = SettingsLoader.load(file);

		assertEquals(List.of("java.util.List"), settings.getExtraImports());
		assertEquals(List.of("B"), List.copyOf(settings.getExtraClasses().keySet()));
		assertEquals(List.of("class B {", "}"), settings.getExtraClasses().get("B"));
	}

	@Test
	void savedSettingsLoadBack() throws IOException
	{
		GeneratorSettings original = GeneratorSettings.builder()
				.appName("Counter")
				.packageName("com.example.counter")
				.authorName("Ada")
				.year(2024)
				.addExtraImport("java.util.List")
				.extraClass("Point", List.of("class Point {", "}"))
				.build();
		Path file = dir.resolve("nested/settings.json");

		SettingsLoader.save(original, file);
		GeneratorSettings loaded = SettingsLoader.load(file);

		assertEquals("Counter", loaded.getAppName());
		assertEquals("com.example.counter", loaded.getPackageName());
		assertEquals(2024, loaded.getYear());
		assertEquals(List.of("java.util.List"), loaded.getExtraImports());
		assertEquals(List.of("class Point {", "}"), loaded.getExtraClasses().get("Point"));
	}

	@Test
	void emptyAppNameFallsBackToDefault()
	{
		GeneratorSettings settings = GeneratorSettings.builder().appName("").packageName(null).build();

		assertEquals(GeneratorSettings.DEFAULT_APP_NAME, settings.getAppName());
		assertEquals(GeneratorSettings.DEFAULT_PACKAGE, settings.getPackageName());
	}
}
