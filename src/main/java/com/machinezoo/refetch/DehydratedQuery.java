// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Snapshot of one cached resource as produced by {@link QuerySnapshots#dehydrate(QueryClient)}.
 */
public class DehydratedQuery {
	private final String key;
	private final boolean infinite;
	private final String queryHash;
	private final QueryInfoState<Object> state;
	private final Object variables;
	private final Map<String, Object> meta;
	public DehydratedQuery(String key, boolean infinite, String queryHash, QueryInfoState<Object> state, Object variables, Map<String, Object> meta) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(queryHash);
		Objects.requireNonNull(state);
		this.key = key;
		this.infinite = infinite;
		this.queryHash = queryHash;
		this.state = state;
		this.variables = variables;
		this.meta = meta != null ? meta : Collections.emptyMap();
	}
	@SuppressWarnings("unchecked")
	static DehydratedQuery of(QueryInfo<?, ?> query) {
		QueryOptions<?, ?, ?> options = query.options();
		return new DehydratedQuery(
			options.descriptor().key(),
			options.descriptor().infinite(),
			query.queryHash(),
			(QueryInfoState<Object>)query.state(),
			options.variables(),
			options.meta());
	}
	public String key() {
		return key;
	}
	public boolean infinite() {
		return infinite;
	}
	public String queryHash() {
		return queryHash;
	}
	public QueryInfoState<Object> state() {
		return state;
	}
	public Object variables() {
		return variables;
	}
	public Map<String, Object> meta() {
		return meta;
	}
	@Override
	public String toString() {
		return "DehydratedQuery[" + queryHash + "]";
	}
}
