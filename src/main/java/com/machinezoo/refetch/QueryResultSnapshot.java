// Part of Refetch
package com.machinezoo.refetch;

class QueryResultSnapshot<R> implements InfiniteQueryResult<R> {
	private final R data;
	private final Throwable error;
	private final QueryStatus status;
	private final FetchStatus fetchStatus;
	private final long dataUpdatedAt;
	private final long errorUpdatedAt;
	private final boolean placeholderData;
	private final boolean stale;
	private final boolean hasNextPage;
	private final boolean hasPreviousPage;
	private final boolean fetchingNextPage;
	private final boolean fetchingPreviousPage;
	QueryResultSnapshot(R data, Throwable error, QueryStatus status, FetchStatus fetchStatus, long dataUpdatedAt, long errorUpdatedAt, boolean placeholderData, boolean stale) {
		this(data, error, status, fetchStatus, dataUpdatedAt, errorUpdatedAt, placeholderData, stale, false, false, false, false);
	}
	private QueryResultSnapshot(R data, Throwable error, QueryStatus status, FetchStatus fetchStatus, long dataUpdatedAt, long errorUpdatedAt, boolean placeholderData, boolean stale,
		boolean hasNextPage, boolean hasPreviousPage, boolean fetchingNextPage, boolean fetchingPreviousPage) {
		this.data = data;
		this.error = error;
		this.status = status;
		this.fetchStatus = fetchStatus;
		this.dataUpdatedAt = dataUpdatedAt;
		this.errorUpdatedAt = errorUpdatedAt;
		this.placeholderData = placeholderData;
		this.stale = stale;
		this.hasNextPage = hasNextPage;
		this.hasPreviousPage = hasPreviousPage;
		this.fetchingNextPage = fetchingNextPage;
		this.fetchingPreviousPage = fetchingPreviousPage;
	}
	QueryResultSnapshot<R> withPages(boolean hasNextPage, boolean hasPreviousPage, boolean fetchingNextPage, boolean fetchingPreviousPage) {
		return new QueryResultSnapshot<>(data, error, status, fetchStatus, dataUpdatedAt, errorUpdatedAt, placeholderData, stale, hasNextPage, hasPreviousPage, fetchingNextPage, fetchingPreviousPage);
	}
	@Override
	public R data() {
		return data;
	}
	@Override
	public Throwable error() {
		return error;
	}
	@Override
	public QueryStatus status() {
		return status;
	}
	@Override
	public FetchStatus fetchStatus() {
		return fetchStatus;
	}
	@Override
	public long dataUpdatedAt() {
		return dataUpdatedAt;
	}
	@Override
	public long errorUpdatedAt() {
		return errorUpdatedAt;
	}
	@Override
	public boolean loading() {
		return status == QueryStatus.PENDING;
	}
	@Override
	public boolean fetching() {
		return fetchStatus == FetchStatus.FETCHING;
	}
	@Override
	public boolean placeholderData() {
		return placeholderData;
	}
	@Override
	public boolean stale() {
		return stale;
	}
	@Override
	public boolean hasNextPage() {
		return hasNextPage;
	}
	@Override
	public boolean hasPreviousPage() {
		return hasPreviousPage;
	}
	@Override
	public boolean fetchingNextPage() {
		return fetchingNextPage;
	}
	@Override
	public boolean fetchingPreviousPage() {
		return fetchingPreviousPage;
	}
	@Override
	public Object field(QueryResultField field) {
		switch (field) {
		case DATA:
			return data;
		case ERROR:
			return error;
		case STATUS:
			return status;
		case FETCH_STATUS:
			return fetchStatus;
		case DATA_UPDATED_AT:
			return dataUpdatedAt;
		case ERROR_UPDATED_AT:
			return errorUpdatedAt;
		case LOADING:
			return loading();
		case FETCHING:
			return fetching();
		case PLACEHOLDER_DATA:
			return placeholderData;
		case STALE:
			return stale;
		case HAS_NEXT_PAGE:
			return hasNextPage;
		case HAS_PREVIOUS_PAGE:
			return hasPreviousPage;
		case FETCHING_NEXT_PAGE:
			return fetchingNextPage;
		case FETCHING_PREVIOUS_PAGE:
			return fetchingPreviousPage;
		default:
			throw new IllegalArgumentException();
		}
	}
	/*
	 * Field-wise comparison with reference equality for data and error.
	 */
	boolean sameAs(QueryResult<?> other) {
		if (other == null)
			return false;
		for (QueryResultField field : QueryResultField.values())
			if (field.changed(this, other))
				return false;
		return true;
	}
	@Override
	public String toString() {
		return "QueryResult[status=" + status + ", fetchStatus=" + fetchStatus + ", stale=" + stale + ", placeholderData=" + placeholderData + ", data=" + data + "]";
	}
}
