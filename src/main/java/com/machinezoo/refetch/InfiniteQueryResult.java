// Part of Refetch
package com.machinezoo.refetch;

/**
 * Result of {@link ObservableInfiniteQuery} with information about page navigation.
 */
public interface InfiniteQueryResult<R> extends QueryResult<R> {
	boolean hasNextPage();
	boolean hasPreviousPage();
	boolean fetchingNextPage();
	boolean fetchingPreviousPage();
}
