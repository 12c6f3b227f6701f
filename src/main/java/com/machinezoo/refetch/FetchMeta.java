// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Describes what kind of fetch is in progress. It is stored in entry state while the fetch runs.
 * Fetch with different meta than the one in progress is dispatched anew even if the entry is already fetching.
 */
public class FetchMeta {
	private final FetchDirection direction;
	private FetchMeta(FetchDirection direction) {
		this.direction = direction;
	}
	/**
	 * Fetch of one more page in the given direction.
	 */
	public static FetchMeta more(FetchDirection direction) {
		Objects.requireNonNull(direction);
		return new FetchMeta(direction);
	}
	/**
	 * Direction of incremental page fetch or {@code null} for full refetch.
	 */
	public FetchDirection direction() {
		return direction;
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof FetchMeta && ((FetchMeta)obj).direction == direction;
	}
	@Override
	public int hashCode() {
		return Objects.hashCode(direction);
	}
	@Override
	public String toString() {
		return "FetchMeta[direction=" + direction + "]";
	}
}
