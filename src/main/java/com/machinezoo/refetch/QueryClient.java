// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Client is a thin facade over the two caches. It owns option resolution, so that every entry point
 * resolves options the same way, and it wires environment focus and connectivity changes to the caches while mounted.
 * 
 * Bulk operations select entries with QueryFilters and return futures that never fail unless asked to.
 */
/**
 * Entry point for reading, writing, fetching, and observing cached resources and for running mutations.
 */
@DraftDocs("usage examples")
public class QueryClient {
	private final QueryEnvironment env;
	private final QueryCache queryCache;
	private final MutationCache mutationCache;
	private volatile QueryDefaults defaults;
	private volatile QueryDefaults mutationDefaults;
	private int mountCount;
	private CloseableScope focusSubscription;
	private CloseableScope onlineSubscription;
	public QueryClient(QueryClientConfig config) {
		Objects.requireNonNull(config);
		env = config.env() != null ? config.env() : new QueryEnvironment();
		queryCache = new QueryCache(env, config.queryCache());
		mutationCache = new MutationCache(env, config.mutationCache());
		defaults = config.queries();
		mutationDefaults = config.mutations();
		OwnerTrace.of(this).alias("client").parent(env);
	}
	public QueryClient() {
		this(new QueryClientConfig());
	}
	public QueryEnvironment env() {
		return env;
	}
	public QueryCache queryCache() {
		return queryCache;
	}
	public MutationCache mutationCache() {
		return mutationCache;
	}
	/**
	 * Client-wide query defaults. They apply to options resolved after the change.
	 */
	public QueryDefaults defaults() {
		return defaults;
	}
	public QueryClient defaults(QueryDefaults defaults) {
		Objects.requireNonNull(defaults);
		this.defaults = defaults;
		return this;
	}
	public QueryDefaults mutationDefaults() {
		return mutationDefaults;
	}
	public QueryClient mutationDefaults(QueryDefaults mutationDefaults) {
		Objects.requireNonNull(mutationDefaults);
		this.mutationDefaults = mutationDefaults;
		return this;
	}
	/**
	 * Starts forwarding focus and reconnection events from the environment to caches.
	 * Calls are counted and only the first one subscribes.
	 */
	public void mount() {
		synchronized (env.lock) {
			if (++mountCount != 1)
				return;
			focusSubscription = env.onFocus(focused -> {
				if (focused) {
					queryCache.onFocus();
					mutationCache.onFocus();
				}
			});
			onlineSubscription = env.onOnline(online -> {
				if (online) {
					queryCache.onOnline();
					mutationCache.onOnline();
				}
			});
		}
	}
	public void unmount() {
		synchronized (env.lock) {
			if (mountCount == 0 || --mountCount != 0)
				return;
			focusSubscription.close();
			focusSubscription = null;
			onlineSubscription.close();
			onlineSubscription = null;
		}
	}
	/**
	 * Merges call site options with descriptor and client defaults and computes the hash.
	 * Already resolved options are returned unchanged.
	 */
	public <V, D, R> QueryOptions<V, D, R> defaultQueryOptions(QueryOptions<V, D, R> options) {
		Objects.requireNonNull(options);
		return options.resolve(defaults, env);
	}
	public <V, D> MutationOptions<V, D> defaultMutationOptions(MutationOptions<V, D> options) {
		Objects.requireNonNull(options);
		return options.resolve(mutationDefaults, env);
	}
	/**
	 * Fetches the resource if it is stale, otherwise completes with cached data.
	 * Unlike observers, this does not retry unless retry is configured explicitly.
	 */
	public <V, D, R> CompletableFuture<D> fetchQuery(QueryOptions<V, D, R> options) {
		QueryOptions<V, D, R> effective = options;
		if (!options.resolved() && options.layered(defaults).retry() == null)
			effective = options.copy().retry(RetryPolicy.never());
		QueryOptions<V, D, R> resolved = defaultQueryOptions(effective);
		synchronized (env.lock) {
			QueryInfo<V, D> query = queryCache.build(resolved);
			if (query.isStaleByTime(resolved.staleTime()))
				return query.fetch(resolved, null);
			return CompletableFuture.completedFuture(query.state().data());
		}
	}
	public <V, D> CompletableFuture<D> fetchQuery(QueryDescriptor<V, D> descriptor, V variables) {
		return fetchQuery(QueryOptions.of(descriptor, variables));
	}
	/**
	 * Same as {@link #fetchQuery(QueryOptions)}, but the returned future never fails.
	 */
	public CompletableFuture<Void> prefetchQuery(QueryOptions<?, ?, ?> options) {
		return fetchQuery(options).handle((data, error) -> null);
	}
	/**
	 * Returns cached data if there is any, otherwise fetches it.
	 */
	public <V, D, R> CompletableFuture<D> ensureQueryData(QueryOptions<V, D, R> options) {
		D cached = getQueryData(options);
		return cached != null ? CompletableFuture.completedFuture(cached) : fetchQuery(options);
	}
	public <V, D> QueryInfoState<D> getQueryState(QueryOptions<V, D, ?> options) {
		QueryInfo<V, D> query = queryCache.get(defaultQueryOptions(options).queryHash());
		return query != null ? query.state() : null;
	}
	public <V, D> QueryInfoState<D> getQueryState(QueryDescriptor<V, D> descriptor, V variables) {
		return getQueryState(QueryOptions.of(descriptor, variables));
	}
	public <V, D> D getQueryData(QueryOptions<V, D, ?> options) {
		QueryInfoState<D> state = getQueryState(options);
		return state != null ? state.data() : null;
	}
	public <V, D> D getQueryData(QueryDescriptor<V, D> descriptor, V variables) {
		return getQueryData(QueryOptions.of(descriptor, variables));
	}
	/**
	 * Data of all matching resources, including those that have no data yet.
	 */
	public Map<QueryInfo<?, ?>, Object> getQueriesData(QueryFilters filters) {
		Map<QueryInfo<?, ?>, Object> data = new LinkedHashMap<>();
		for (QueryInfo<?, ?> query : queryCache.findAll(filters))
			data.put(query, query.state().data());
		return data;
	}
	/**
	 * Writes data computed from cached data. Entry is created if it does not exist.
	 * Nothing is written if the updater returns {@code null}.
	 * 
	 * @return data as stored in the cache or {@code null} if nothing was written
	 */
	public <V, D> D setQueryData(QueryOptions<V, D, ?> options, UnaryOperator<D> updater, SetDataOptions setOptions) {
		Objects.requireNonNull(updater);
		Objects.requireNonNull(setOptions);
		QueryOptions<V, D, ?> resolved = defaultQueryOptions(options);
		synchronized (env.lock) {
			QueryInfo<V, D> existing = queryCache.get(resolved.queryHash());
			D data = updater.apply(existing != null ? existing.state().data() : null);
			if (data == null)
				return null;
			return queryCache.build(resolved).setData(data, setOptions.copy().manual(true));
		}
	}
	/*
	 * Named differently from setQueryData(), because lambda would be ambiguous with the overload taking data.
	 */
	public <V, D> D updateQueryData(QueryDescriptor<V, D> descriptor, V variables, UnaryOperator<D> updater) {
		return setQueryData(QueryOptions.of(descriptor, variables), updater, new SetDataOptions());
	}
	public <V, D> D setQueryData(QueryDescriptor<V, D> descriptor, V variables, D data) {
		return updateQueryData(descriptor, variables, previous -> data);
	}
	/**
	 * Applies the updater to every matching resource.
	 * 
	 * @return data stored in every matching resource, {@code null} where the updater declined to write
	 */
	public Map<QueryInfo<?, ?>, Object> setQueriesData(QueryFilters filters, UnaryOperator<Object> updater, SetDataOptions setOptions) {
		Objects.requireNonNull(updater);
		Objects.requireNonNull(setOptions);
		synchronized (env.lock) {
			Map<QueryInfo<?, ?>, Object> written = new LinkedHashMap<>();
			for (QueryInfo<?, ?> query : queryCache.findAll(filters))
				written.put(query, update(query, updater, setOptions));
			return written;
		}
	}
	@SuppressWarnings("unchecked")
	private static Object update(QueryInfo<?, ?> query, UnaryOperator<Object> updater, SetDataOptions setOptions) {
		QueryInfo<?, Object> typed = (QueryInfo<?, Object>)query;
		Object data = updater.apply(typed.state().data());
		return data != null ? typed.setData(data, setOptions.copy().manual(true)) : null;
	}
	public void removeQueries(QueryFilters filters) {
		synchronized (env.lock) {
			for (QueryInfo<?, ?> query : queryCache.findAll(filters))
				queryCache.remove(query);
		}
	}
	/**
	 * Refetches matching resources except those that are observed only by disabled observers.
	 * Running fetches are restarted unless {@link FetchOptions#cancelRefetch(Boolean)} is disabled.
	 * Paused fetches count as done immediately.
	 */
	public CompletableFuture<Void> refetchQueries(QueryFilters filters, FetchOptions fetchOptions) {
		FetchOptions effective = fetchOptions.copy();
		if (effective.cancelRefetch() == null)
			effective.cancelRefetch(true);
		synchronized (env.lock) {
			List<CompletableFuture<?>> futures = new ArrayList<>();
			for (QueryInfo<?, ?> query : queryCache.findAll(filters)) {
				if (query.isDisabled())
					continue;
				CompletableFuture<?> future = query.fetch(null, effective);
				if (!effective.throwOnError())
					future = future.exceptionally(e -> null);
				futures.add(query.state().fetchStatus() == FetchStatus.PAUSED ? CompletableFuture.completedFuture(null) : future);
			}
			return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[futures.size()]));
		}
	}
	public CompletableFuture<Void> refetchQueries(QueryFilters filters) {
		return refetchQueries(filters, new FetchOptions());
	}
	/**
	 * Marks matching resources stale and refetches them according to refetch type.
	 * 
	 * @param refetchType
	 *            which of the invalidated resources to refetch or {@code null} to use type in filters, defaulting to active resources
	 */
	public CompletableFuture<Void> invalidateQueries(QueryFilters filters, RefetchType refetchType, FetchOptions fetchOptions) {
		synchronized (env.lock) {
			for (QueryInfo<?, ?> query : queryCache.findAll(filters))
				query.invalidate();
			if (refetchType == RefetchType.NONE)
				return CompletableFuture.completedFuture(null);
			QueryTypeFilter type = refetchType != null ? refetchType.filter() : filters.type() != null ? filters.type() : QueryTypeFilter.ACTIVE;
			return refetchQueries(filters.copy().type(type), fetchOptions);
		}
	}
	public CompletableFuture<Void> invalidateQueries(QueryFilters filters, RefetchType refetchType) {
		return invalidateQueries(filters, refetchType, new FetchOptions());
	}
	public CompletableFuture<Void> invalidateQueries(QueryFilters filters) {
		return invalidateQueries(filters, null);
	}
	/**
	 * Returns matching resources to their initial state and refetches those that are active.
	 */
	public CompletableFuture<Void> resetQueries(QueryFilters filters, FetchOptions fetchOptions) {
		synchronized (env.lock) {
			for (QueryInfo<?, ?> query : queryCache.findAll(filters))
				query.reset();
			QueryFilters refetched = filters.copy();
			if (refetched.type() == null)
				refetched.type(QueryTypeFilter.ACTIVE);
			return refetchQueries(refetched, fetchOptions);
		}
	}
	public CompletableFuture<Void> resetQueries(QueryFilters filters) {
		return resetQueries(filters, new FetchOptions());
	}
	/**
	 * Cancels running fetches of matching resources.
	 * 
	 * @return future that completes when all cancelled fetches settle
	 */
	public CompletableFuture<Void> cancelQueries(QueryFilters filters, CancelOptions cancelOptions) {
		Objects.requireNonNull(cancelOptions);
		synchronized (env.lock) {
			List<CompletableFuture<Void>> futures = new ArrayList<>();
			for (QueryInfo<?, ?> query : queryCache.findAll(filters))
				futures.add(query.cancel(cancelOptions));
			return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[futures.size()])).handle((v, e) -> null);
		}
	}
	/**
	 * Cancels running fetches, rolling back state of cancelled resources.
	 */
	public CompletableFuture<Void> cancelQueries(QueryFilters filters) {
		return cancelQueries(filters, new CancelOptions().revert(true));
	}
	public <V, D> CompletableFuture<D> triggerMutation(MutationOptions<V, D> options, V variables) {
		return mutationCache.build(defaultMutationOptions(options)).trigger(variables);
	}
	public int isFetching(QueryFilters filters) {
		return queryCache.findAll(filters.copy().fetchStatus(FetchStatus.FETCHING)).size();
	}
	public int isFetching() {
		return isFetching(new QueryFilters());
	}
	public int isMutating(MutationFilters filters) {
		return (int)mutationCache.findAll(filters).stream()
			.filter(m -> m.state().status() == MutationStatus.MUTATING)
			.count();
	}
	public int isMutating() {
		return isMutating(new MutationFilters());
	}
	/**
	 * Creates observer for the options. Options with infinite descriptor produce {@link ObservableInfiniteQuery}.
	 */
	@SuppressWarnings("unchecked")
	public <V, D, R> ObservableQuery<V, D, R> watchQuery(QueryOptions<V, D, R> options) {
		if (options.descriptor().infinite()) {
			QueryOptions<V, InfiniteData<Object, Object>, R> paged = (QueryOptions<V, InfiniteData<Object, Object>, R>)(QueryOptions<?, ?, ?>)options;
			return (ObservableQuery<V, D, R>)(ObservableQuery<?, ?, ?>)watchInfiniteQuery(paged);
		}
		return new ObservableQuery<>(this, options);
	}
	public <V, T, P, R> ObservableInfiniteQuery<V, T, P, R> watchInfiniteQuery(QueryOptions<V, InfiniteData<T, P>, R> options) {
		return new ObservableInfiniteQuery<>(this, options);
	}
	public <C> ObservableQueries<C> watchQueries(List<? extends QueryOptions<?, ?, ?>> queries, Function<List<QueryResult<?>>, C> combine) {
		return new ObservableQueries<>(this, queries, combine);
	}
	public ObservableQueries<List<QueryResult<?>>> watchQueries(List<? extends QueryOptions<?, ?, ?>> queries) {
		return ObservableQueries.of(this, queries);
	}
	/**
	 * Removes all resources and mutations.
	 */
	public void clear() {
		synchronized (env.lock) {
			queryCache.clear();
			mutationCache.clear();
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
