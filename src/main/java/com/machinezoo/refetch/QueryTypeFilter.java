// Part of Refetch
package com.machinezoo.refetch;

/**
 * Selects resources by whether they have enabled observers.
 */
public enum QueryTypeFilter {
	ALL,
	ACTIVE,
	INACTIVE
}
