package org.lokray.blockgen.util;

import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run configuration of the generated extension class. The generator
 * only reads it; nothing here survives into the next run unless the caller
 * passes it again.
 */
public final class GeneratorSettings
{
	public static final String DEFAULT_APP_NAME = "MyApp";
	public static final String DEFAULT_PACKAGE = "demo";
	public static final String DEFAULT_BASE_CLASS = "AndroidNonvisibleComponent";

	private final String appName;
	private final String description;
	private final String versionName;
	private final int versionNumber;
	private final String homeWebsite;
	private final String minSdk;
	private final String icon;
	private final String authorName;
	private final int year;
	private final String packageName;
	private final String baseClass;
	private final List<String> interfaces;
	private final List<String> extraImports;
	private final Map<String, List<String>> extraClasses;

	private GeneratorSettings(Builder builder)
	{
		this.appName = orDefault(builder.appName, DEFAULT_APP_NAME);
		this.description = nullToEmpty(builder.description);
		this.versionName = nullToEmpty(builder.versionName);
		this.versionNumber = builder.versionNumber;
		this.homeWebsite = nullToEmpty(builder.homeWebsite);
		this.minSdk = nullToEmpty(builder.minSdk);
		this.icon = nullToEmpty(builder.icon);
		this.authorName = nullToEmpty(builder.authorName);
		this.year = builder.year;
		this.packageName = orDefault(builder.packageName, DEFAULT_PACKAGE);
		this.baseClass = nullToEmpty(builder.baseClass);
		this.interfaces = List.copyOf(builder.interfaces);
		this.extraImports = List.copyOf(builder.extraImports);
		Map<String, List<String>> classes = new LinkedHashMap<>();
		builder.extraClasses.forEach((name, lines) -> classes.put(name, List.copyOf(lines)));
		this.extraClasses = Collections.unmodifiableMap(classes);
	}

	public static GeneratorSettings defaults()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	private static String orDefault(String value, String fallback)
	{
		return value == null || value.isEmpty() ? fallback : value;
	}

	private static String nullToEmpty(String value)
	{
		return value == null ? "" : value;
	}

	public String getAppName()
	{
		return appName;
	}

	public String getDescription()
	{
		return description;
	}

	public String getVersionName()
	{
		return versionName;
	}

	public int getVersionNumber()
	{
		return versionNumber;
	}

	public String getHomeWebsite()
	{
		return homeWebsite;
	}

	public String getMinSdk()
	{
		return minSdk;
	}

	public String getIcon()
	{
		return icon;
	}

	public String getAuthorName()
	{
		return authorName;
	}

	public int getYear()
	{
		return year;
	}

	public String getPackageName()
	{
		return packageName;
	}

	public String getBaseClass()
	{
		return baseClass;
	}

	public List<String> getInterfaces()
	{
		return interfaces;
	}

	public List<String> getExtraImports()
	{
		return extraImports;
	}

	public Map<String, List<String>> getExtraClasses()
	{
		return extraClasses;
	}

	public static final class Builder
	{
		private String appName = DEFAULT_APP_NAME;
		private String description = "An AppInventor 2 Extension.";
		private String versionName = "1.0";
		private int versionNumber = 0;
		private String homeWebsite = "";
		private String minSdk = "";
		private String icon = "images/extension.png";
		private String authorName = "<<Your Name>>";
		private int year = Year.now().getValue();
		private String packageName = DEFAULT_PACKAGE;
		private String baseClass = DEFAULT_BASE_CLASS;
		private final List<String> interfaces = new ArrayList<>();
		private final List<String> extraImports = new ArrayList<>();
		private final Map<String, List<String>> extraClasses = new LinkedHashMap<>();

		private Builder()
		{
		}

		public Builder appName(String appName)
		{
			this.appName = appName;
			return this;
		}

		public Builder description(String description)
		{
			this.description = description;
			return this;
		}

		public Builder versionName(String versionName)
		{
			this.versionName = versionName;
			return this;
		}

		public Builder versionNumber(int versionNumber)
		{
			this.versionNumber = versionNumber;
			return this;
		}

		public Builder homeWebsite(String homeWebsite)
		{
			this.homeWebsite = homeWebsite;
			return this;
		}

		public Builder minSdk(String minSdk)
		{
			this.minSdk = minSdk;
			return this;
		}

		public Builder icon(String icon)
		{
			this.icon = icon;
			return this;
		}

		public Builder authorName(String authorName)
		{
			this.authorName = authorName;
			return this;
		}

		public Builder year(int year)
		{
			this.year = year;
			return this;
		}

		public Builder packageName(String packageName)
		{
			this.packageName = packageName;
			return this;
		}

		public Builder baseClass(String baseClass)
		{
			this.baseClass = baseClass;
			return this;
		}

		public Builder addInterface(String iface)
		{
			if (iface != null && !iface.isEmpty() && !interfaces.contains(iface))
			{
				interfaces.add(iface);
			}
			return this;
		}

		public Builder addExtraImport(String name)
		{
			if (name != null && !name.isBlank())
			{
				extraImports.add(name);
			}
			return this;
		}

		/**
		 * Adds a class appended verbatim after the generated one. A null body
		 * is ignored and null lines are dropped.
		 */
		public Builder extraClass(String name, List<String> lines)
		{
			if (name != null && lines != null)
			{
				extraClasses.put(name, lines.stream().filter(Objects::nonNull).toList());
			}
			return this;
		}

		public GeneratorSettings build()
		{
			return new GeneratorSettings(this);
		}
	}
}
