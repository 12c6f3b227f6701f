// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Provisional data shown by {@link ObservableQuery} while no real data is cached.
 * Placeholder is never written into the cache.
 */
@FunctionalInterface
public interface PlaceholderData<V, D> {
	/**
	 * Computes placeholder.
	 * 
	 * @param previousData
	 *            data of the last resource observed by the same observer that had any data, or {@code null}
	 * @param previousQuery
	 *            the resource {@code previousData} comes from, or {@code null}
	 * @return placeholder or {@code null} for no placeholder
	 */
	D placeholder(D previousData, QueryInfo<V, D> previousQuery);
	static <V, D> PlaceholderData<V, D> of(D value) {
		Objects.requireNonNull(value);
		return (data, query) -> value;
	}
	/**
	 * Keeps showing data of the previously observed resource while the new one loads.
	 */
	static <V, D> PlaceholderData<V, D> previous() {
		return (data, query) -> data;
	}
}
