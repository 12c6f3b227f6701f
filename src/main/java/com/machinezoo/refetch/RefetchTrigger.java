// Part of Refetch
package com.machinezoo.refetch;

/**
 * Whether an event (mount, focus, reconnect) causes an observer to refetch.
 */
public enum RefetchTrigger {
	NEVER,
	/**
	 * Refetch only if the observed data is stale.
	 */
	IF_STALE,
	ALWAYS
}
