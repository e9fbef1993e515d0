package org.lokray.blockgen.codegen;

/**
 * Expression categories ordered by binding strength, tightest first.
 * See https://docs.oracle.com/javase/tutorial/java/nutsandbolts/operators.html
 */
public enum Order
{
	ATOMIC(0),             // literals, names
	COLLECTION(1),         // array and collection literals
	STRING_CONVERSION(1),
	MEMBER(2),             // . []
	FUNCTION_CALL(2),      // ()
	POSTFIX(3),            // expr++ expr--
	LOGICAL_NOT(3),        // !
	UNARY_SIGN(4),         // ++expr --expr +expr -expr ~
	MULTIPLICATIVE(5),     // * / %
	ADDITIVE(6),           // + -
	BITWISE_SHIFT(7),      // << >> >>>
	RELATIONAL(8),         // < > <= >= instanceof
	EQUALITY(9),           // == !=
	BITWISE_AND(10),       // &
	BITWISE_XOR(11),       // ^
	BITWISE_OR(12),        // |
	LOGICAL_AND(13),       // &&
	LOGICAL_OR(14),        // ||
	CONDITIONAL(15),       // ? :
	ASSIGNMENT(16),        // = += -= *= /= %= &= ^= |= <<= >>= >>>=
	NONE(99);              // no surrounding expression

	private final int precedence;

	Order(int precedence)
	{
		this.precedence = precedence;
	}

	public int precedence()
	{
		return precedence;
	}

	/**
	 * Whether an expression of category {@code inner} must be wrapped in
	 * parentheses when placed where the parent demands {@code outer}. The
	 * inner expression has to bind strictly tighter than the outer context;
	 * equal categories are wrapped so that {@code a - (b - c)} keeps its
	 * meaning. Atomic-in-atomic and anything in a {@link #NONE} context are
	 * never wrapped.
	 */
	public static boolean needsParens(Order inner, Order outer)
	{
		if (outer.precedence > inner.precedence)
		{
			return false;
		}
		return !(outer.precedence == inner.precedence && (outer.precedence == ATOMIC.precedence || outer == NONE));
	}
}
