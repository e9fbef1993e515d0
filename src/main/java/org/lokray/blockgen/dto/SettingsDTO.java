package org.lokray.blockgen.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of a generator settings file. Absent keys stay null and fall back
 * to the generator defaults.
 */
public class SettingsDTO
{
	public String appName;
	public String description;
	public String versionName;
	public Integer versionNumber;
	public String homeWebsite;
	public String minSdk;
	public String icon;
	public String authorName;
	public Integer year;
	public String packageName;
	public String baseClass;
	public List<String> interfaces = new ArrayList<>();
	public List<String> extraImports = new ArrayList<>();
	public Map<String, List<String>> extraClasses = new LinkedHashMap<>();
}
