package org.cinder.semantic;

import org.cinder.semantic.type.ValueType;
import org.cinder.util.Debug;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One flat table of variables for the whole compilation unit. Names are not scoped:
 * declaring a name again simply overwrites its type and const flag.
 */
public class SymbolTable
{
	private final int capacity;
	private final Map<String, VariableSymbol> symbols = new LinkedHashMap<>();

	public SymbolTable(int capacity)
	{
		this.capacity = capacity;
	}

	/**
	 * Adds or updates {@code name}.
	 *
	 * @return {@code false} if {@code name} is new and the table is already full; the table is
	 * left untouched in that case
	 */
	public boolean register(String name, ValueType type, boolean isConst)
	{
		VariableSymbol existing = symbols.get(name);
		if (existing != null)
		{
			existing.setType(type);
			existing.setConst(isConst);
			Debug.logDebug("symbol '" + name + "' redeclared as " + type.getKeyword());
			return true;
		}
		if (symbols.size() >= capacity)
		{
			return false;
		}
		symbols.put(name, new VariableSymbol(name, type, isConst));
		Debug.logDebug("symbol '" + name + "' registered as " + (isConst ? "const " : "") + type.getKeyword());
		return true;
	}

	public ValueType lookup(String name)
	{
		return resolve(name).map(VariableSymbol::getType).orElse(ValueType.UNKNOWN);
	}

	public Optional<VariableSymbol> resolve(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean isConst(String name)
	{
		return resolve(name).map(VariableSymbol::isConst).orElse(false);
	}

	public int size()
	{
		return symbols.size();
	}

	public int getCapacity()
	{
		return capacity;
	}

	public Collection<VariableSymbol> getSymbols()
	{
		return Collections.unmodifiableCollection(symbols.values());
	}
}
