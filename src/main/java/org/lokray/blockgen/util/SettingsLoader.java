package org.lokray.blockgen.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.lokray.blockgen.dto.SettingsDTO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GeneratorSettings} from a JSON file.
 */
public class SettingsLoader
{
	private static final Gson GSON = new GsonBuilder().create();

	public static GeneratorSettings load(Path file) throws IOException
	{
		String json = Files.readString(file);
		SettingsDTO dto;
		try
		{
			dto = GSON.fromJson(json, SettingsDTO.class);
		}
		catch (JsonParseException e)
		{
			Debug.logError("Could not parse settings file " + file);
			throw new IOException("Malformed settings file " + file + ": " + e.getMessage(), e);
		}

		if (dto == null)
		{
			Debug.logWarning("Settings file " + file + " is empty, using defaults.");
			return GeneratorSettings.defaults();
		}
		Debug.logDebug("Loaded generator settings from " + file);
		return fromDTO(dto);
	}

	public static GeneratorSettings fromDTO(SettingsDTO dto)
	{
		GeneratorSettings.Builder builder = GeneratorSettings.builder();
		if (dto.appName != null)
		{
			builder.appName(dto.appName);
		}
		if (dto.description != null)
		{
			builder.description(dto.description);
		}
		if (dto.versionName != null)
		{
			builder.versionName(dto.versionName);
		}
		if (dto.versionNumber != null)
		{
			builder.versionNumber(dto.versionNumber);
		}
		if (dto.homeWebsite != null)
		{
			builder.homeWebsite(dto.homeWebsite);
		}
		if (dto.minSdk != null)
		{
			builder.minSdk(dto.minSdk);
		}
		if (dto.icon != null)
		{
			builder.icon(dto.icon);
		}
		if (dto.authorName != null)
		{
			builder.authorName(dto.authorName);
		}
		if (dto.year != null)
		{
			builder.year(dto.year);
		}
		if (dto.packageName != null)
		{
			builder.packageName(dto.packageName);
		}
		if (dto.baseClass != null)
		{
			builder.baseClass(dto.baseClass);
		}
		if (dto.interfaces != null)
		{
			dto.interfaces.forEach(builder::addInterface);
		}
		if (dto.extraImports != null)
		{
			dto.extraImports.forEach(builder::addExtraImport);
		}
		if (dto.extraClasses != null)
		{
			dto.extraClasses.forEach(builder::extraClass);
		}
		return builder.build();
	}

	/**
	 * Writes the settings back out, pretty printed.
	 */
	public static void save(GeneratorSettings settings, Path file) throws IOException
	{
		SettingsDTO dto = new SettingsDTO();
		dto.appName = settings.getAppName();
		dto.description = settings.getDescription();
		dto.versionName = settings.getVersionName();
		dto.versionNumber = settings.getVersionNumber();
		dto.homeWebsite = settings.getHomeWebsite();
		dto.minSdk = settings.getMinSdk();
		dto.icon = settings.getIcon();
		dto.authorName = settings.getAuthorName();
		dto.year = settings.getYear();
		dto.packageName = settings.getPackageName();
		dto.baseClass = settings.getBaseClass();
		dto.interfaces.addAll(settings.getInterfaces());
		dto.extraImports.addAll(settings.getExtraImports());
		dto.extraClasses.putAll(settings.getExtraClasses());

		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		if (file.getParent() != null)
		{
			Files.createDirectories(file.getParent());
		}
		Files.writeString(file, gson.toJson(dto));
		Debug.logInfo("Wrote generator settings to: " + file);
	}
}
