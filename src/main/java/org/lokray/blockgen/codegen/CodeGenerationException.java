package org.lokray.blockgen.codegen;

/**
 * Raised when a block generator breaks its contract with the emitter,
 * for example by answering a value slot with statement text.
 */
public class CodeGenerationException extends RuntimeException
{
	public CodeGenerationException(String message)
	{
		super(message);
	}
}
