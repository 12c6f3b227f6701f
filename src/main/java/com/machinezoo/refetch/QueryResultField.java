// Part of Refetch
package com.machinezoo.refetch;

/**
 * Fields of {@link QueryResult}, used to track which fields the caller reads.
 */
public enum QueryResultField {
	DATA,
	ERROR,
	STATUS,
	FETCH_STATUS,
	DATA_UPDATED_AT,
	ERROR_UPDATED_AT,
	LOADING,
	FETCHING,
	PLACEHOLDER_DATA,
	STALE,
	HAS_NEXT_PAGE,
	HAS_PREVIOUS_PAGE,
	FETCHING_NEXT_PAGE,
	FETCHING_PREVIOUS_PAGE;
	/*
	 * Data and error are compared by reference. Everything else is a value.
	 */
	boolean changed(QueryResult<?> previous, QueryResult<?> next) {
		Object a = previous.field(this);
		Object b = next.field(this);
		if (this == DATA || this == ERROR)
			return a != b;
		return !a.equals(b);
	}
}
