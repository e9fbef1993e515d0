package org.lokray.blockgen.codegen;

import org.lokray.blockgen.model.Block;
import org.lokray.blockgen.model.VariableEntry;
import org.lokray.blockgen.model.Workspace;
import org.lokray.blockgen.util.Debug;
import org.lokray.blockgen.util.ErrorHandler;
import org.lokray.blockgen.util.GeneratorSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a workspace (or a single block) into one complete Java compilation
 * unit: an App Inventor extension class holding the generated fields,
 * helpers and body.
 */
public class ProgramAssembler
{
	public static final List<String> REQUIRED_IMPORTS = List.of(
			"com.google.appinventor.components.runtime.AndroidNonvisibleComponent",
			"com.google.appinventor.components.runtime.ComponentContainer",
			"com.google.appinventor.components.annotations.SimpleObject",
			"com.google.appinventor.components.annotations.DesignerComponent",
			"com.google.appinventor.components.common.ComponentCategory"
	);

	static final String FILE_HEADER = """
			/*
			 * Copyright (c) <<Year>>, <<Your Name>>
			 * All rights reserved.
			 *
			 * Redistribution and use in source and binary forms, with or without
			 * modification, are permitted provided that the following conditions are met:
			 *
			 * * Redistributions of source code must retain the above copyright notice, this
			 *   list of conditions and the following disclaimer.
			 * * Redistributions in binary form must reproduce the above copyright notice,
			 *   this list of conditions and the following disclaimer in the documentation
			 *   and/or other materials provided with the distribution.
			 *
			 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
			 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
			 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
			 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
			 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
			 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
			 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
			 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
			 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
			 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
			 * POSSIBILITY OF SUCH DAMAGE.
			 */
			""";

	private final GeneratorRegistry registry;
	private final GeneratorSettings settings;
	private final ErrorHandler errorHandler;

	public ProgramAssembler(GeneratorRegistry registry, GeneratorSettings settings, ErrorHandler errorHandler)
	{
		this.registry = registry;
		this.settings = settings;
		this.errorHandler = errorHandler;
	}

	public ProgramAssembler(GeneratorRegistry registry, GeneratorSettings settings)
	{
		this(registry, settings, new ErrorHandler());
	}

	/**
	 * Generates the compilation unit for {@code root}, which must be a
	 * {@link Workspace} or a {@link Block}.
	 *
	 * @throws IllegalArgumentException if {@code root} is neither.
	 */
	public String generate(Object root)
	{
		Workspace workspace = asWorkspace(root);

		// 1. Fresh state for this run
		errorHandler.reset();
		GenerationContext context = new GenerationContext(settings, registry, errorHandler);

		// 2. Let change-reactive blocks settle before anything reads them
		settle(workspace);
		context.init(workspace.getVariables());
		String className = context.getClassName(appName(workspace));
		String baseClass = settings.getBaseClass().isEmpty() ? "" : context.getClassName(settings.getBaseClass());

		// 3. The body; imports, helpers and globals accumulate as a side effect
		String body = workspaceToCode(workspace, context);

		// 4. Imports every extension needs
		REQUIRED_IMPORTS.forEach(context::addImport);

		// 5-6. Fields and helpers, placed ahead of the body
		String members = cleanUp(context.renderDefinitions() + body);

		// 7. The compilation unit
		StringBuilder out = new StringBuilder();
		out.append(FILE_HEADER
				.replace("<<Your Name>>", settings.getAuthorName())
				.replace("<<Year>>", String.valueOf(settings.getYear())));
		out.append("package ").append(settings.getPackageName()).append(";\n\n");
		out.append(context.getImportRegistry().render(settings.getExtraImports())).append('\n');
		out.append(classAnnotations());
		out.append(classSignature(className, baseClass)).append(" {\n\n");
		out.append(BlockEmitter.prefixLines(constructor(className) + members, BlockEmitter.INDENT));
		out.append("}\n");

		Debug.logDebug("ProgramAssembler: generated class " + className + " with "
				+ context.getHelperRegistry().getOrderedDefinitions().size() + " definitions");

		// 8. No trailing whitespace, at most one blank line in a row; extra classes go in verbatim
		String unit = cleanUp(out.toString()).replaceAll("\n{3,}", "\n\n");
		String extras = extraClasses();
		return extras.isEmpty() ? unit : unit + "\n" + extras;
	}

	private static Workspace asWorkspace(Object root)
	{
		if (root instanceof Workspace workspace)
		{
			return workspace;
		}
		if (root instanceof Block block)
		{
			return new Workspace()
			{
				@Override
				public List<Block> getTopBlocks()
				{
					return List.of(block);
				}

				@Override
				public List<VariableEntry> getVariables()
				{
					return List.of();
				}
			};
		}
		throw new IllegalArgumentException("Not Block or Workspace: " + root);
	}

	private static void settle(Workspace workspace)
	{
		for (Block block : workspace.getAllBlocks())
		{
			block.onChange();
		}
	}

	/**
	 * Emits every top-level chain. A value block sitting loose at the top
	 * level becomes an expression statement.
	 */
	static String workspaceToCode(Workspace workspace, GenerationContext context)
	{
		List<String> lines = new ArrayList<>();
		for (Block top : workspace.getTopBlocks())
		{
			CodeFragment fragment = context.emit(top);
			String line = fragment.code();
			if (line.isEmpty())
			{
				continue;
			}
			if (fragment.isExpression())
			{
				line = scrubNakedValue(line);
			}
			lines.add(line);
		}
		return String.join("\n", lines);
	}

	static String scrubNakedValue(String line)
	{
		return line + ";\n";
	}

	private String appName(Workspace workspace)
	{
		String title = workspace.getTitle();
		return title != null && !title.isEmpty() ? title : settings.getAppName();
	}

	private String classAnnotations()
	{
		StringBuilder out = new StringBuilder();
		out.append("@SimpleObject(external=true)\n");
		out.append("@DesignerComponent(version = ").append(settings.getVersionNumber())
				.append(", nonVisible = true, category = ComponentCategory.EXTENSION, iconName = ")
				.append(JavaLiterals.quote(settings.getIcon()))
				.append(", description = ").append(JavaLiterals.quote(settings.getDescription()))
				.append(", versionName = ").append(JavaLiterals.quote(settings.getVersionName()));
		if (!settings.getHomeWebsite().isEmpty())
		{
			out.append(", helpUrl = ").append(JavaLiterals.quote(settings.getHomeWebsite()));
		}
		if (!settings.getMinSdk().isEmpty())
		{
			out.append(", androidMinSdk = ").append(settings.getMinSdk());
		}
		out.append(")\n");
		return out.toString();
	}

	private String classSignature(String className, String baseClass)
	{
		StringBuilder out = new StringBuilder("public class ").append(className);
		if (!baseClass.isEmpty())
		{
			out.append(" extends ").append(baseClass);
		}
		if (!settings.getInterfaces().isEmpty())
		{
			out.append(" implements ").append(String.join(", ", settings.getInterfaces()));
		}
		return out.toString();
	}

	private static String constructor(String className)
	{
		return "public " + className + "(ComponentContainer container) {\n"
				+ BlockEmitter.INDENT + "super(container.$form());\n"
				+ "}\n\n";
	}

	private String extraClasses()
	{
		StringBuilder out = new StringBuilder();
		for (Map.Entry<String, List<String>> extra : settings.getExtraClasses().entrySet())
		{
			out.append(String.join("\n", extra.getValue())).append('\n');
		}
		return out.toString();
	}

	/**
	 * Drops leading blank lines, trailing whitespace on every line, and
	 * trailing blank lines.
	 */
	static String cleanUp(String code)
	{
		return code.replaceFirst("^\\s+\n", "")
				.replaceAll("[ \t]+\n", "\n")
				.replaceFirst("\n\\s+\\z", "\n");
	}
}
