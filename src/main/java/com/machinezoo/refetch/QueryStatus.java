// Part of Refetch
package com.machinezoo.refetch;

/**
 * Outcome of the last completed fetch. It is independent of {@link FetchStatus}.
 */
public enum QueryStatus {
	/**
	 * No data was ever cached.
	 */
	PENDING,
	ERROR,
	SUCCESS
}
