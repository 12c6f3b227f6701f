// Part of Refetch
package com.machinezoo.refetch;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Map is only modified by build() and remove(). Both run under the engine lock.
 * Iteration always works on a snapshot, because removal of an entry may notify listeners
 * that in turn build or remove other entries.
 */
/**
 * Registry of cached resources keyed by hash.
 */
@StubDocs
public class QueryCache {
	private final QueryEnvironment env;
	private final QueryCacheConfig config;
	private final Map<String, QueryInfo<?, ?>> queries = new LinkedHashMap<>();
	private final ObserverList<Consumer<QueryCacheEvent>> listeners = new ObserverList<>();
	public QueryCache(QueryEnvironment env, QueryCacheConfig config) {
		Objects.requireNonNull(env);
		Objects.requireNonNull(config);
		this.env = env;
		this.config = config;
		OwnerTrace.of(this).alias("qcache").parent(env);
	}
	public QueryCache(QueryEnvironment env) {
		this(env, new QueryCacheConfig());
	}
	public QueryEnvironment env() {
		return env;
	}
	public QueryCacheConfig config() {
		return config;
	}
	/**
	 * Returns existing entry for the hash in resolved options or creates new one.
	 * Existing entries are returned untouched.
	 * 
	 * @param state
	 *            initial state of newly created entry or {@code null} to derive it from options
	 */
	@SuppressWarnings("unchecked")
	public <V, D> QueryInfo<V, D> build(QueryOptions<V, D, ?> options, QueryInfoState<D> state) {
		synchronized (env.lock) {
			QueryInfo<V, D> query = (QueryInfo<V, D>)queries.get(options.queryHash());
			if (query == null) {
				query = new QueryInfo<>(this, options, state);
				queries.put(query.queryHash(), query);
				notify(new QueryCacheEvent(QueryCacheEvent.Type.ADDED, query, null));
			}
			return query;
		}
	}
	public <V, D> QueryInfo<V, D> build(QueryOptions<V, D, ?> options) {
		return build(options, null);
	}
	/**
	 * Destroys the entry (cancelling its fetch) and removes it from the cache if it is still there.
	 */
	public void remove(QueryInfo<?, ?> query) {
		synchronized (env.lock) {
			QueryInfo<?, ?> current = queries.get(query.queryHash());
			if (current != null) {
				query.destroy();
				if (current == query)
					queries.remove(query.queryHash());
				notify(new QueryCacheEvent(QueryCacheEvent.Type.REMOVED, query, null));
			}
		}
	}
	public void clear() {
		synchronized (env.lock) {
			for (QueryInfo<?, ?> query : all())
				remove(query);
		}
	}
	@SuppressWarnings("unchecked")
	public <V, D> QueryInfo<V, D> get(String queryHash) {
		synchronized (env.lock) {
			return (QueryInfo<V, D>)queries.get(queryHash);
		}
	}
	public List<QueryInfo<?, ?>> all() {
		synchronized (env.lock) {
			return new ArrayList<>(queries.values());
		}
	}
	/**
	 * Finds first matching entry. Unlike {@link #findAll(QueryFilters)}, descriptor match is exact unless specified otherwise.
	 */
	public Optional<QueryInfo<?, ?>> find(QueryFilters filters) {
		QueryFilters exact = filters.copy();
		if (exact.exact() == null)
			exact.exact(true);
		return all().stream().filter(exact::matches).findFirst();
	}
	public List<QueryInfo<?, ?>> findAll(QueryFilters filters) {
		return all().stream().filter(filters::matches).collect(toList());
	}
	public List<QueryInfo<?, ?>> findAll() {
		return all();
	}
	public CloseableScope subscribe(Consumer<QueryCacheEvent> listener) {
		return listeners.subscribe(listener);
	}
	/**
	 * Subscribes to events of entries matching the filters. Filters are evaluated when the event is delivered.
	 */
	public CloseableScope subscribe(QueryFilters filters, Consumer<QueryCacheEvent> listener) {
		Objects.requireNonNull(filters);
		Objects.requireNonNull(listener);
		return listeners.subscribe(event -> {
			if (filters.matches(event.query()))
				listener.accept(event);
		});
	}
	public void notify(QueryCacheEvent event) {
		synchronized (env.lock) {
			listeners.forEach(l -> l.accept(event));
		}
	}
	public void onFocus() {
		synchronized (env.lock) {
			all().forEach(QueryInfo::onFocus);
		}
	}
	public void onOnline() {
		synchronized (env.lock) {
			all().forEach(QueryInfo::onOnline);
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
