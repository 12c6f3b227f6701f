// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/*
 * Explicit wrapper instead of proxying. Every accessor records the field before delegating.
 */
/**
 * View of {@link QueryResult} that records which fields were read.
 * Observer then notifies listeners only about changes in recorded fields.
 * 
 * @see ObservableQuery#trackResult(QueryResult)
 */
public class TrackedQueryResult<R> implements InfiniteQueryResult<R> {
	private final QueryResultSnapshot<R> result;
	private final Set<QueryResultField> tracked;
	TrackedQueryResult(QueryResultSnapshot<R> result, Set<QueryResultField> tracked) {
		this.result = result;
		this.tracked = tracked;
	}
	private void track(QueryResultField field) {
		tracked.add(field);
	}
	@Override
	public R data() {
		track(QueryResultField.DATA);
		return result.data();
	}
	@Override
	public Throwable error() {
		track(QueryResultField.ERROR);
		return result.error();
	}
	@Override
	public QueryStatus status() {
		track(QueryResultField.STATUS);
		return result.status();
	}
	@Override
	public FetchStatus fetchStatus() {
		track(QueryResultField.FETCH_STATUS);
		return result.fetchStatus();
	}
	@Override
	public long dataUpdatedAt() {
		track(QueryResultField.DATA_UPDATED_AT);
		return result.dataUpdatedAt();
	}
	@Override
	public long errorUpdatedAt() {
		track(QueryResultField.ERROR_UPDATED_AT);
		return result.errorUpdatedAt();
	}
	@Override
	public boolean loading() {
		track(QueryResultField.LOADING);
		return result.loading();
	}
	@Override
	public boolean fetching() {
		track(QueryResultField.FETCHING);
		return result.fetching();
	}
	@Override
	public boolean placeholderData() {
		track(QueryResultField.PLACEHOLDER_DATA);
		return result.placeholderData();
	}
	@Override
	public boolean stale() {
		track(QueryResultField.STALE);
		return result.stale();
	}
	@Override
	public boolean hasNextPage() {
		track(QueryResultField.HAS_NEXT_PAGE);
		return result.hasNextPage();
	}
	@Override
	public boolean hasPreviousPage() {
		track(QueryResultField.HAS_PREVIOUS_PAGE);
		return result.hasPreviousPage();
	}
	@Override
	public boolean fetchingNextPage() {
		track(QueryResultField.FETCHING_NEXT_PAGE);
		return result.fetchingNextPage();
	}
	@Override
	public boolean fetchingPreviousPage() {
		track(QueryResultField.FETCHING_PREVIOUS_PAGE);
		return result.fetchingPreviousPage();
	}
	@Override
	public Object field(QueryResultField field) {
		track(field);
		return result.field(field);
	}
	@Override
	public String toString() {
		return result.toString();
	}
}
