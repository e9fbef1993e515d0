package org.lokray.blockgen.codegen;

import org.lokray.blockgen.model.Block;

/**
 * The per-type emission rule for a block. Value blocks answer with
 * {@link CodeFragment#expression}, statement blocks with
 * {@link CodeFragment#statement}. Returning null means the block
 * contributes nothing to the body (a definition registered through the
 * context, for instance).
 */
@FunctionalInterface
public interface BlockGenerator
{
	CodeFragment generate(Block block, GenerationContext context);
}
