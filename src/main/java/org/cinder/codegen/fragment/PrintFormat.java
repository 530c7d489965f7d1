package org.cinder.codegen.fragment;

import org.cinder.semantic.type.ValueType;

/**
 * How a printed value is written out, picked from its inferred type.
 */
public enum PrintFormat
{
	STRING,
	BOOL,
	FLOAT,
	LIST,
	TUPLE,
	DICT,
	INT;

	public static PrintFormat forType(ValueType type)
	{
		return switch (type)
		{
			case STRING -> STRING;
			case BOOL -> BOOL;
			case FLOAT -> FLOAT;
			case LIST -> LIST;
			case TUPLE -> TUPLE;
			case DICT -> DICT;
			case INT, UNKNOWN -> INT;
		};
	}
}
