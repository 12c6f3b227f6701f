// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Information passed to fetch functions along with variables.
 */
public class FetchContext<V, D> {
	private final QueryInfo<V, D> query;
	private final QueryOptions<V, D, ?> options;
	private final D data;
	private final FetchMeta fetchMeta;
	private final AbortSignal signal;
	FetchContext(QueryInfo<V, D> query, QueryOptions<V, D, ?> options, D data, FetchMeta fetchMeta, AbortSignal signal) {
		this.query = query;
		this.options = options;
		this.data = data;
		this.fetchMeta = fetchMeta;
		this.signal = signal;
	}
	public String key() {
		return options.descriptor().key();
	}
	public V variables() {
		return options.variables();
	}
	public String queryHash() {
		return query.queryHash();
	}
	public QueryOptions<V, D, ?> options() {
		return options;
	}
	/**
	 * Cached data as of the start of the fetch or {@code null} if nothing is cached.
	 */
	public D data() {
		return data;
	}
	public FetchMeta fetchMeta() {
		return fetchMeta;
	}
	public Map<String, Object> meta() {
		return options.meta();
	}
	/**
	 * Abort signal of this fetch.
	 * Reading it declares that the fetch function honors cancellation.
	 * Such fetches are cancelled with state rollback when their last observer goes away,
	 * while fetches that never read the signal are allowed to finish and cache their result.
	 */
	public AbortSignal signal() {
		query.consumeSignal();
		return signal;
	}
	AbortSignal peekSignal() {
		return signal;
	}
}
