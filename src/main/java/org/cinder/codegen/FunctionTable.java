package org.cinder.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Functions in declaration order. Names are not unique: a redefinition is reported by the
 * caller and kept alongside the first one.
 */
public class FunctionTable
{
	private final int capacity;
	private final List<FunctionDefinition> definitions = new ArrayList<>();

	public FunctionTable(int capacity)
	{
		this.capacity = capacity;
	}

	/**
	 * Creates a function with an empty body bounded to {@code bodyCapacity} fragments.
	 *
	 * @return empty if the table is full
	 */
	public Optional<FunctionDefinition> define(String name, int line, int bodyCapacity)
	{
		if (definitions.size() >= capacity)
		{
			return Optional.empty();
		}
		FunctionDefinition definition = new FunctionDefinition(name, line, new FragmentStream(bodyCapacity));
		definitions.add(definition);
		return Optional.of(definition);
	}

	public Optional<FunctionDefinition> find(String name)
	{
		return definitions.stream().filter(def -> def.getName().equals(name)).findFirst();
	}

	public int size()
	{
		return definitions.size();
	}

	public int getCapacity()
	{
		return capacity;
	}

	public List<FunctionDefinition> getDefinitions()
	{
		return Collections.unmodifiableList(definitions);
	}
}
