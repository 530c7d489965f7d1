package org.cinder.semantic.type;

import java.util.Optional;

import static org.cinder.parser.CinderLexer.*;

/**
 * The closed set of value types the transpiler reasons about, with the C spelling used when
 * declaring a variable of that type.
 */
public enum ValueType
{
	INT("int", "int"),
	FLOAT("float", "float"),
	BOOL("bool", "bool"),
	STRING("string", "char*"),
	LIST("list", "List"),
	DICT("dict", "Dict"),
	TUPLE("tuple", "Tuple"),
	UNKNOWN("unknown", "int");

	private final String keyword;
	private final String cType;

	ValueType(String keyword, String cType)
	{
		this.keyword = keyword;
		this.cType = cType;
	}

	/**
	 * Maps a declaration keyword token ({@code int}, {@code list}, ...) to its type.
	 */
	public static Optional<ValueType> fromTypeToken(int tokenType)
	{
		return Optional.ofNullable(switch (tokenType)
		{
			case INT_TYPE -> INT;
			case FLOAT_TYPE -> FLOAT;
			case BOOL_TYPE -> BOOL;
			case STRING_TYPE -> STRING;
			case LIST_TYPE -> LIST;
			case DICT_TYPE -> DICT;
			case TUPLE_TYPE -> TUPLE;
			default -> null;
		});
	}

	public static boolean isTypeToken(int tokenType)
	{
		return fromTypeToken(tokenType).isPresent();
	}

	public String getKeyword()
	{
		return keyword;
	}

	public String getCType()
	{
		return cType;
	}

	/**
	 * Types whose elements are read through the {@code .data} storage of the runtime struct.
	 */
	public boolean hasIndexedStorage()
	{
		return this == LIST || this == TUPLE;
	}
}
