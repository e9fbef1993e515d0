package org.lokray.blockgen.model;

public enum InputKind
{
	VALUE,
	STATEMENT,
	DUMMY
}
