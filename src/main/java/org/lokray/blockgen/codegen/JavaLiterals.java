package org.lokray.blockgen.codegen;

import java.util.regex.Pattern;

/**
 * The one place string literals are escaped for generated source.
 */
public final class JavaLiterals
{
	private static final Pattern NUMBER = Pattern.compile("^\\s*-?\\d+(\\.\\d+)?\\s*$");

	private JavaLiterals()
	{
	}

	/**
	 * Encodes {@code text} as a Java string literal, quotes included.
	 * Quotes, backslashes and control characters are escaped, and so is
	 * everything outside printable ASCII, so the result is safe in any
	 * source encoding.
	 */
	public static String quote(String text)
	{
		StringBuilder out = new StringBuilder(text.length() + 2);
		out.append('"');
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			switch (c)
			{
				case '"' -> out.append("\\\"");
				case '\\' -> out.append("\\\\");
				case '\n' -> out.append("\\n");
				case '\r' -> out.append("\\r");
				case '\t' -> out.append("\\t");
				case '\b' -> out.append("\\b");
				case '\f' -> out.append("\\f");
				default ->
				{
					if (c < 0x20 || c > 0x7e)
					{
						out.append(String.format("\\u%04x", (int) c));
					}
					else
					{
						out.append(c);
					}
				}
			}
		}
		out.append('"');
		return out.toString();
	}

	/**
	 * Whether {@code text} is a plain decimal literal such as {@code 12} or {@code -3.5}.
	 */
	public static boolean isNumber(String text)
	{
		return text != null && NUMBER.matcher(text).matches();
	}
}
