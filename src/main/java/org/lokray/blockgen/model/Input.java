package org.lokray.blockgen.model;

public interface Input
{
	String getName();

	InputKind getKind();

	/**
	 * The block plugged into this input (a value, or the head of a statement chain), or null.
	 */
	Block getTargetBlock();
}
