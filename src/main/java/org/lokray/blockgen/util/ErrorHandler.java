package org.lokray.blockgen.util;

import org.lokray.blockgen.model.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the recoverable anomalies of one generation run. Every entry is
 * printed through {@link Debug} as it is reported and kept for the caller.
 */
public class ErrorHandler
{
	private final List<String> diagnostics = new ArrayList<>();

	public void logWarning(Block block, String msg)
	{
		String where = block != null ? block.getType() + "#" + block.getId() : "<generator>";
		String warning = String.format("[Generation Warning] %s - %s", where, msg);
		Debug.logWarning(warning);
		diagnostics.add(warning);
	}

	public void logWarning(String msg)
	{
		logWarning(null, msg);
	}

	public boolean hasWarnings()
	{
		return !diagnostics.isEmpty();
	}

	public List<String> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public void reset()
	{
		diagnostics.clear();
	}
}
