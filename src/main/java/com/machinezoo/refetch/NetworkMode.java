// Part of Refetch
package com.machinezoo.refetch;

/**
 * Policy deciding whether fetches proceed while {@link QueryEnvironment} reports that connectivity is down.
 */
public enum NetworkMode {
	/**
	 * Fetches neither start nor retry while offline. They are paused until connectivity returns.
	 */
	ONLINE,
	/**
	 * Connectivity is ignored. Useful for fetch functions that do not touch the network.
	 */
	ALWAYS,
	/**
	 * First attempt runs regardless of connectivity, but retries wait until connectivity returns.
	 */
	OFFLINE_FIRST
}
