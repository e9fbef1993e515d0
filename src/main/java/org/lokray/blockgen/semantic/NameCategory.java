package org.lokray.blockgen.semantic;

public enum NameCategory
{
	VARIABLE,
	PROCEDURE,
	CLASS
}
