package org.lokray.blockgen.codegen;

/**
 * What a block generator hands back: statement text, or expression text
 * tagged with the category of its outermost operator.
 *
 * @param code  The generated text. Never null.
 * @param order The expression category, or null for a statement.
 */
public record CodeFragment(String code, Order order)
{
	public CodeFragment
	{
		code = code == null ? "" : code;
	}

	public static CodeFragment statement(String code)
	{
		return new CodeFragment(code, null);
	}

	public static CodeFragment expression(String code, Order order)
	{
		if (order == null)
		{
			throw new CodeGenerationException("Expression '" + code + "' has no order");
		}
		return new CodeFragment(code, order);
	}

	public boolean isExpression()
	{
		return order != null;
	}

	public boolean isEmpty()
	{
		return code.isEmpty();
	}
}
