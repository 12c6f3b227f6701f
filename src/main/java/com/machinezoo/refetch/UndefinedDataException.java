// Part of Refetch
package com.machinezoo.refetch;

/**
 * Thrown when a fetch function completes with {@code null}.
 * Entries cannot store {@code null}, because it is indistinguishable from missing data.
 * Fetch functions should produce an empty value (empty list, {@link java.util.Optional#empty()}) instead.
 */
public class UndefinedDataException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	public UndefinedDataException(String queryHash) {
		super("Fetch function of " + queryHash + " completed with null data.");
	}
}
