package org.lokray.blockgen.codegen;

import org.lokray.blockgen.model.Block;
import org.lokray.blockgen.model.Input;
import org.lokray.blockgen.model.InputKind;
import org.lokray.blockgen.util.Debug;
import org.lokray.blockgen.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks blocks and turns each one into text. Every block is dispatched to
 * the generator registered for its type tag; the emitter then attaches the
 * block's comments and appends whatever statement follows it.
 */
public class BlockEmitter
{
	public static final String INDENT = "    ";

	private static final Pattern INNER_NEWLINE = Pattern.compile("(?!\\n\\z)\\n");

	private final GeneratorRegistry registry;
	private final ErrorHandler errorHandler;
	private GenerationContext context;

	// Single-use modifiers for the statements following the current block
	private String postfix = "";
	private String extraIndent = "";

	public BlockEmitter(GeneratorRegistry registry, ErrorHandler errorHandler)
	{
		this.registry = registry;
		this.errorHandler = errorHandler;
	}

	void attach(GenerationContext context)
	{
		this.context = context;
	}

	/**
	 * Emits {@code block} and, for a statement, every block chained after it.
	 * A missing block yields an empty statement.
	 */
	public CodeFragment emit(Block block)
	{
		if (block == null)
		{
			return CodeFragment.statement("");
		}
		if (!block.isEnabled())
		{
			Debug.logDebug("BlockEmitter: skipping disabled block " + block.getId());
			return emit(block.getNextBlock());
		}

		BlockGenerator generator = registry.get(block.getType());
		if (generator == null)
		{
			errorHandler.logWarning(block, "No generator for block type '" + block.getType() + "', block skipped");
			return emit(block.getNextBlock());
		}

		CodeFragment fragment = generator.generate(block, context);
		if (fragment == null)
		{
			// The block handled its own output (a definition, for instance); its successors still emit
			return CodeFragment.statement(scrub(block, ""));
		}
		if (fragment.isExpression())
		{
			return CodeFragment.expression(scrub(block, fragment.code()), fragment.order());
		}
		return CodeFragment.statement(scrub(block, fragment.code()));
	}

	/**
	 * Emits a statement block and its successors as text.
	 */
	public String blockToCode(Block block)
	{
		CodeFragment fragment = emit(block);
		if (fragment.isExpression())
		{
			throw new CodeGenerationException("Expecting a statement from block type '" + block.getType() + "'");
		}
		return fragment.code();
	}

	/**
	 * Emits the value plugged into input {@code name}, parenthesized when
	 * its category binds no tighter than {@code outerOrder}. An empty input
	 * yields an empty string.
	 */
	public String valueToCode(Block block, String name, Order outerOrder)
	{
		Block target = block.getInputTargetBlock(name);
		if (target == null)
		{
			return "";
		}

		CodeFragment fragment = emit(target);
		if (fragment.isEmpty())
		{
			return "";
		}
		if (!fragment.isExpression())
		{
			throw new CodeGenerationException("Expecting an expression from block type '" + target.getType()
					+ "' in input '" + name + "' of '" + block.getType() + "'");
		}

		String code = fragment.code();
		if (Order.needsParens(fragment.order(), outerOrder))
		{
			code = "(" + code + ")";
		}
		return code;
	}

	/**
	 * Emits the statement chain plugged into input {@code name}, indented
	 * one level.
	 */
	public String statementToCode(Block block, String name)
	{
		Block target = block.getInputTargetBlock(name);
		String code = blockToCode(target);
		if (!code.isEmpty())
		{
			code = prefixLines(code, INDENT);
		}
		return code;
	}

	public void setPostfix(String postfix)
	{
		this.postfix = postfix == null ? "" : postfix;
	}

	public void setExtraIndent(String extraIndent)
	{
		this.extraIndent = extraIndent == null ? "" : extraIndent;
	}

	/**
	 * Prepends the block's comments, then appends the code of the next
	 * block in the chain. Comments are collected only for blocks that are
	 * not inlined into a parent expression: the block's own comment first,
	 * then those of the values plugged into it. Nested statements carry
	 * their own comments.
	 */
	private String scrub(Block block, String code)
	{
		StringBuilder commentCode = new StringBuilder();
		if (!block.isOutputConnected())
		{
			String comment = block.getCommentText();
			if (comment != null && !comment.isEmpty())
			{
				commentCode.append(prefixLines(comment, "// ")).append('\n');
			}
			for (Input input : block.getInputs())
			{
				if (input.getKind() == InputKind.VALUE && input.getTargetBlock() != null)
				{
					String nested = allNestedComments(input.getTargetBlock());
					if (!nested.isEmpty())
					{
						commentCode.append(prefixLines(nested, "// "));
					}
				}
			}
		}

		// Consume the modifiers before walking on so they cannot leak into nested calls
		String stagedPostfix = postfix;
		postfix = "";
		String stagedIndent = extraIndent;
		extraIndent = "";

		String nextCode = blockToCode(block.getNextBlock());
		if (!stagedIndent.isEmpty())
		{
			nextCode = prefixLines(nextCode, stagedIndent);
		}
		return commentCode + code + nextCode + stagedPostfix;
	}

	/**
	 * Comments of a block and all its descendants, one per line.
	 */
	public static String allNestedComments(Block block)
	{
		List<String> comments = new ArrayList<>();
		for (Block descendant : block.getDescendants())
		{
			String comment = descendant.getCommentText();
			if (comment != null && !comment.isEmpty())
			{
				comments.add(comment);
			}
		}
		return comments.isEmpty() ? "" : String.join("\n", comments) + "\n";
	}

	/**
	 * Puts {@code prefix} in front of every line of {@code text}. A trailing
	 * newline does not start a new line.
	 */
	public static String prefixLines(String text, String prefix)
	{
		if (text.isEmpty())
		{
			return text;
		}
		return prefix + INNER_NEWLINE.matcher(text).replaceAll(Matcher.quoteReplacement("\n" + prefix));
	}
}
