package org.lokray.blockgen.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structured description of a helper method, used to order helpers and to
 * write their documentation comment.
 *
 * @param modifiers  Declaration modifiers in source order ({@code public}, {@code static}, ...).
 * @param returnType The return type, or null for a constructor.
 * @param name       The emitted method name.
 * @param parameters The formal parameters in order.
 */
public record HelperSignature(
		List<String> modifiers,
		String returnType,
		String name,
		List<Parameter> parameters
)
{
	public record Parameter(String type, String name)
	{
	}

	public HelperSignature
	{
		modifiers = List.copyOf(modifiers);
		parameters = List.copyOf(parameters);
	}

	public boolean isStatic()
	{
		return modifiers.contains("static");
	}

	/**
	 * A Javadoc block listing each parameter and the return type.
	 */
	public String renderDoc()
	{
		StringBuilder doc = new StringBuilder();
		doc.append("/**\n");
		doc.append(" * Description goes here\n");
		String separator = " *\n";
		for (Parameter parameter : parameters)
		{
			doc.append(separator).append(" * @param ").append(parameter.name()).append('\n');
			separator = "";
		}
		if (returnType != null && !returnType.equals("void"))
		{
			doc.append(separator).append(" * @return ").append(returnType).append('\n');
		}
		doc.append(" */\n");
		return doc.toString();
	}

	/**
	 * Reads the signature from the declaration that opens {@code text},
	 * after any leading annotations. Returns empty when the code does not start with a method declaration
	 * (a field or a statement ends before any parameter list opens).
	 */
	public static Optional<HelperSignature> parse(String text)
	{
		int start = skipAnnotations(text);
		if (start < 0)
		{
			return Optional.empty();
		}
		String code = text.substring(start);
		int open = code.indexOf('(');
		if (open < 0)
		{
			return Optional.empty();
		}
		String head = code.substring(0, open);
		if (head.contains(";") || head.contains("=") || head.contains("{"))
		{
			return Optional.empty();
		}
		int close = matchingParen(code, open);
		if (close < 0)
		{
			return Optional.empty();
		}

		List<String> headTokens = splitTopLevel(head.trim(), ' ');
		if (headTokens.isEmpty())
		{
			return Optional.empty();
		}
		String name = headTokens.get(headTokens.size() - 1);
		String returnType = null;
		List<String> modifiers = new ArrayList<>();
		if (headTokens.size() >= 2)
		{
			String candidate = headTokens.get(headTokens.size() - 2);
			if (isModifier(candidate))
			{
				modifiers.addAll(headTokens.subList(0, headTokens.size() - 1));
			}
			else
			{
				returnType = candidate;
				modifiers.addAll(headTokens.subList(0, headTokens.size() - 2));
			}
		}

		List<Parameter> parameters = new ArrayList<>();
		String parameterList = code.substring(open + 1, close).trim();
		if (!parameterList.isEmpty())
		{
			for (String declaration : splitTopLevel(parameterList, ','))
			{
				List<String> parts = splitTopLevel(declaration.trim(), ' ');
				if (parts.isEmpty())
				{
					continue;
				}
				String parameterName = parts.get(parts.size() - 1);
				String type = String.join(" ", parts.subList(0, parts.size() - 1));
				parameters.add(new Parameter(type, parameterName));
			}
		}
		return Optional.of(new HelperSignature(modifiers, returnType, name, parameters));
	}

	/**
	 * Index of the first character after the annotations that lead
	 * {@code text}, or -1 when an annotation's argument list is unclosed.
	 */
	private static int skipAnnotations(String text)
	{
		int i = skipWhitespace(text, 0);
		while (i < text.length() && text.charAt(i) == '@' && !text.startsWith("@interface", i))
		{
			i++;
			while (i < text.length() && (Character.isJavaIdentifierPart(text.charAt(i)) || text.charAt(i) == '.'))
			{
				i++;
			}
			int next = skipWhitespace(text, i);
			if (next < text.length() && text.charAt(next) == '(')
			{
				int close = matchingParen(text, next);
				if (close < 0)
				{
					return -1;
				}
				next = close + 1;
			}
			i = skipWhitespace(text, next);
		}
		return i;
	}

	private static int skipWhitespace(String text, int from)
	{
		int i = from;
		while (i < text.length() && Character.isWhitespace(text.charAt(i)))
		{
			i++;
		}
		return i;
	}

	private static boolean isModifier(String token)
	{
		return switch (token)
		{
			case "public", "protected", "private", "static", "final", "abstract", "synchronized", "native", "strictfp" -> true;
			default -> false;
		};
	}

	private static int matchingParen(String text, int open)
	{
		int depth = 0;
		for (int i = open; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c == '(')
			{
				depth++;
			}
			else if (c == ')')
			{
				depth--;
				if (depth == 0)
				{
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Splits on {@code separator} outside angle brackets, so generic types
	 * such as {@code Map<String, Object>} stay whole. Empty pieces are dropped.
	 */
	private static List<String> splitTopLevel(String text, char separator)
	{
		List<String> pieces = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int depth = 0;
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c == '<')
			{
				depth++;
			}
			else if (c == '>')
			{
				depth--;
			}

			boolean split = depth == 0 && (c == separator || (separator == ' ' && Character.isWhitespace(c)));
			if (split)
			{
				if (!current.toString().isBlank())
				{
					pieces.add(current.toString().trim());
				}
				current.setLength(0);
			}
			else
			{
				current.append(c);
			}
		}
		if (!current.toString().isBlank())
		{
			pieces.add(current.toString().trim());
		}
		return pieces;
	}
}
