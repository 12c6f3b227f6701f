// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Change in {@link QueryCache}.
 */
public class QueryCacheEvent {
	public enum Type {
		ADDED,
		UPDATED,
		REMOVED
	}
	private final Type type;
	private final QueryInfo<?, ?> query;
	private final QueryAction<?> action;
	public QueryCacheEvent(Type type, QueryInfo<?, ?> query, QueryAction<?> action) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(query);
		this.type = type;
		this.query = query;
		this.action = action;
	}
	public Type type() {
		return type;
	}
	public QueryInfo<?, ?> query() {
		return query;
	}
	/**
	 * Action that caused {@link Type#UPDATED} event, {@code null} for other events.
	 */
	public QueryAction<?> action() {
		return action;
	}
	@Override
	public String toString() {
		return "QueryCacheEvent[" + type + ", " + query.queryHash() + (action != null ? ", " + action.type() : "") + "]";
	}
}
