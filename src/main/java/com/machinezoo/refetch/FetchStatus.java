// Part of Refetch
package com.machinezoo.refetch;

/**
 * Current transport activity of a resource. It is independent of {@link QueryStatus}.
 */
public enum FetchStatus {
	IDLE,
	FETCHING,
	/**
	 * Fetch was requested, but it waits for focus or connectivity.
	 */
	PAUSED
}
