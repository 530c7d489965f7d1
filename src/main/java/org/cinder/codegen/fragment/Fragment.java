package org.cinder.codegen.fragment;

/**
 * One statement-level piece of generated C, with its operands already resolved and
 * rewritten. Fragments carry no layout; {@link org.cinder.codegen.CRenderer} decides that.
 */
public interface Fragment
{
	<R> R accept(FragmentVisitor<R> visitor);
}
