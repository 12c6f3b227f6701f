// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Definition of a mutation: its key and the function performing it.
 * Key is used only for filtering in {@link MutationCache}.
 */
@StubDocs
public class MutationDescriptor<V, D> {
	private final String key;
	private final MutationFunction<V, D> function;
	public MutationDescriptor(String key, MutationFunction<V, D> function) {
		Objects.requireNonNull(key);
		this.key = key;
		this.function = function;
	}
	public MutationDescriptor(MutationFunction<V, D> function) {
		this(QueryKeys.generate(), function);
	}
	public String key() {
		return key;
	}
	public MutationFunction<V, D> function() {
		return function;
	}
	private QueryDefaults defaults = new QueryDefaults();
	/**
	 * Retry, network mode, and GC settings of this mutation. Other settings in the layer are ignored.
	 */
	public QueryDefaults defaults() {
		return defaults;
	}
	public MutationDescriptor<V, D> defaults(QueryDefaults defaults) {
		Objects.requireNonNull(defaults);
		this.defaults = defaults;
		return this;
	}
	@Override
	public String toString() {
		return "MutationDescriptor[" + key + "]";
	}
}
