// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/*
 * Immutable, so that observers can compare states by reference and keep them around as snapshots.
 * All transitions go through apply(), which keeps the state machine testable without any entry around it.
 */
/**
 * State of one cached resource.
 * <p>
 * {@link #status()} reflects the last terminal outcome while {@link #fetchStatus()} reflects current transport activity.
 * The two are orthogonal. For example, resource can be {@link QueryStatus#SUCCESS} and {@link FetchStatus#FETCHING}
 * during background refresh. {@link #dataUpdatedAt()} is zero if and only if no data was ever cached.
 */
public class QueryInfoState<D> {
	private final D data;
	private final long dataUpdatedAt;
	private final Throwable error;
	private final long errorUpdatedAt;
	private final FetchMeta fetchMeta;
	private final boolean invalidated;
	private final QueryStatus status;
	private final FetchStatus fetchStatus;
	private QueryInfoState(D data, long dataUpdatedAt, Throwable error, long errorUpdatedAt, FetchMeta fetchMeta, boolean invalidated, QueryStatus status, FetchStatus fetchStatus) {
		Objects.requireNonNull(status);
		Objects.requireNonNull(fetchStatus);
		this.data = data;
		this.dataUpdatedAt = dataUpdatedAt;
		this.error = error;
		this.errorUpdatedAt = errorUpdatedAt;
		this.fetchMeta = fetchMeta;
		this.invalidated = invalidated;
		this.status = status;
		this.fetchStatus = fetchStatus;
	}
	public static <D> QueryInfoState<D> of(D data, long dataUpdatedAt, Throwable error, long errorUpdatedAt, FetchMeta fetchMeta, boolean invalidated, QueryStatus status, FetchStatus fetchStatus) {
		return new QueryInfoState<>(data, dataUpdatedAt, error, errorUpdatedAt, fetchMeta, invalidated, status, fetchStatus);
	}
	/**
	 * State of newly created resource.
	 * 
	 * @param initialData
	 *            data to start with or {@code null} to start empty
	 * @param updatedAt
	 *            timestamp of the initial data
	 */
	public static <D> QueryInfoState<D> initial(D initialData, long updatedAt) {
		if (initialData == null)
			return new QueryInfoState<>(null, 0, null, 0, null, false, QueryStatus.PENDING, FetchStatus.IDLE);
		return new QueryInfoState<>(initialData, updatedAt, null, 0, null, false, QueryStatus.SUCCESS, FetchStatus.IDLE);
	}
	public D data() {
		return data;
	}
	public long dataUpdatedAt() {
		return dataUpdatedAt;
	}
	public Throwable error() {
		return error;
	}
	public long errorUpdatedAt() {
		return errorUpdatedAt;
	}
	public FetchMeta fetchMeta() {
		return fetchMeta;
	}
	public boolean invalidated() {
		return invalidated;
	}
	public QueryStatus status() {
		return status;
	}
	public FetchStatus fetchStatus() {
		return fetchStatus;
	}
	public QueryInfoState<D> withFetchStatus(FetchStatus fetchStatus) {
		if (fetchStatus == this.fetchStatus)
			return this;
		return new QueryInfoState<>(data, dataUpdatedAt, error, errorUpdatedAt, fetchMeta, invalidated, status, fetchStatus);
	}
	public QueryInfoState<D> apply(QueryAction<D> action) {
		switch (action.type()) {
		case PAUSE:
			return withFetchStatus(FetchStatus.PAUSED);
		case CONTINUE:
			return withFetchStatus(FetchStatus.FETCHING);
		case FETCH:
			if (dataUpdatedAt == 0)
				return new QueryInfoState<>(data, dataUpdatedAt, null, errorUpdatedAt, action.meta(), invalidated, QueryStatus.PENDING, action.paused() ? FetchStatus.PAUSED : FetchStatus.FETCHING);
			return new QueryInfoState<>(data, dataUpdatedAt, error, errorUpdatedAt, action.meta(), invalidated, status, action.paused() ? FetchStatus.PAUSED : FetchStatus.FETCHING);
		case SUCCESS:
			return new QueryInfoState<>(action.data(), action.updatedAt(), null, errorUpdatedAt, fetchMeta, false, QueryStatus.SUCCESS, action.manual() ? fetchStatus : FetchStatus.IDLE);
		case ERROR:
			if (action.error() instanceof CancelledException && ((CancelledException)action.error()).revert() && action.state() != null)
				return action.state();
			return new QueryInfoState<>(data, dataUpdatedAt, action.error(), action.updatedAt(), fetchMeta, invalidated, QueryStatus.ERROR, FetchStatus.IDLE);
		case INVALIDATE:
			if (invalidated)
				return this;
			return new QueryInfoState<>(data, dataUpdatedAt, error, errorUpdatedAt, fetchMeta, true, status, fetchStatus);
		case SET_STATE:
			return action.state();
		default:
			throw new IllegalStateException();
		}
	}
	@Override
	public String toString() {
		return "QueryInfoState[status=" + status + ", fetchStatus=" + fetchStatus + ", dataUpdatedAt=" + dataUpdatedAt + ", invalidated=" + invalidated + "]";
	}
}
