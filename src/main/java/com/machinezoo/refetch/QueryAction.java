// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Transition of {@link QueryInfoState}. Actions are applied by {@link QueryInfoState#apply(QueryAction)}
 * and broadcast in {@link QueryCacheEvent}s.
 */
public class QueryAction<D> {
	public enum Type {
		FETCH,
		SUCCESS,
		ERROR,
		INVALIDATE,
		PAUSE,
		CONTINUE,
		SET_STATE
	}
	private final Type type;
	private D data;
	private long updatedAt;
	private boolean manual;
	private Throwable error;
	private FetchMeta meta;
	private boolean paused;
	private QueryInfoState<D> state;
	private QueryAction(Type type) {
		this.type = type;
	}
	public static <D> QueryAction<D> fetch(FetchMeta meta, boolean paused) {
		QueryAction<D> action = new QueryAction<>(Type.FETCH);
		action.meta = meta;
		action.paused = paused;
		return action;
	}
	public static <D> QueryAction<D> success(D data, long updatedAt, boolean manual) {
		Objects.requireNonNull(data);
		QueryAction<D> action = new QueryAction<>(Type.SUCCESS);
		action.data = data;
		action.updatedAt = updatedAt;
		action.manual = manual;
		return action;
	}
	/**
	 * Creates error action.
	 * 
	 * @param revertState
	 *            state to return to if the error is a reverting {@link CancelledException}
	 */
	public static <D> QueryAction<D> error(Throwable error, long updatedAt, QueryInfoState<D> revertState) {
		Objects.requireNonNull(error);
		QueryAction<D> action = new QueryAction<>(Type.ERROR);
		action.error = error;
		action.updatedAt = updatedAt;
		action.state = revertState;
		return action;
	}
	public static <D> QueryAction<D> invalidate() {
		return new QueryAction<>(Type.INVALIDATE);
	}
	public static <D> QueryAction<D> pause() {
		return new QueryAction<>(Type.PAUSE);
	}
	public static <D> QueryAction<D> resume() {
		return new QueryAction<>(Type.CONTINUE);
	}
	public static <D> QueryAction<D> setState(QueryInfoState<D> state) {
		Objects.requireNonNull(state);
		QueryAction<D> action = new QueryAction<>(Type.SET_STATE);
		action.state = state;
		return action;
	}
	public Type type() {
		return type;
	}
	public D data() {
		return data;
	}
	public long updatedAt() {
		return updatedAt;
	}
	public boolean manual() {
		return manual;
	}
	public Throwable error() {
		return error;
	}
	public FetchMeta meta() {
		return meta;
	}
	public boolean paused() {
		return paused;
	}
	public QueryInfoState<D> state() {
		return state;
	}
	@Override
	public String toString() {
		return "QueryAction[" + type + "]";
	}
}
