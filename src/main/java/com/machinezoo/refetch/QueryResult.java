// Part of Refetch
package com.machinezoo.refetch;

/**
 * Immutable snapshot of a resource as seen by one {@link ObservableQuery}.
 * Data is after selection and it may be placeholder data.
 */
public interface QueryResult<R> {
	R data();
	Throwable error();
	QueryStatus status();
	FetchStatus fetchStatus();
	long dataUpdatedAt();
	long errorUpdatedAt();
	/**
	 * Whether there is no data yet, i.e. {@link QueryStatus#PENDING}.
	 */
	boolean loading();
	boolean fetching();
	boolean placeholderData();
	boolean stale();
	default boolean success() {
		return status() == QueryStatus.SUCCESS;
	}
	Object field(QueryResultField field);
}
