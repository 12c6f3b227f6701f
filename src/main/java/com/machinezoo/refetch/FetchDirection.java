// Part of Refetch
package com.machinezoo.refetch;

/**
 * Direction of an incremental page fetch in infinite queries.
 */
public enum FetchDirection {
	FORWARD,
	BACKWARD
}
