package org.cinder.codegen;

import org.cinder.codegen.fragment.Fragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, capacity-bounded list of fragments: the main program body or one function body.
 */
public class FragmentStream
{
	private final int capacity;
	private final List<Fragment> fragments = new ArrayList<>();

	public FragmentStream(int capacity)
	{
		this.capacity = capacity;
	}

	/**
	 * @return {@code false} if the stream is full; the fragment is dropped in that case
	 */
	public boolean add(Fragment fragment)
	{
		if (isFull())
		{
			return false;
		}
		fragments.add(fragment);
		return true;
	}

	public boolean isFull()
	{
		return fragments.size() >= capacity;
	}

	public int size()
	{
		return fragments.size();
	}

	public int getCapacity()
	{
		return capacity;
	}

	public List<Fragment> getFragments()
	{
		return Collections.unmodifiableList(fragments);
	}
}
