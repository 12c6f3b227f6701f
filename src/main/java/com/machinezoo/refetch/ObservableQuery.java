// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.time.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Observer is mounted while it has at least one listener. Only mounted observers are registered in their QueryInfo,
 * trigger automatic fetches, and run stale and refetch timers. Unmounted observer can still compute results,
 * which is what getOptimisticResult() is for.
 * 
 * Results are recomputed on every change of the entry, but listeners are notified only when the result changed
 * in a field the listener cares about. Fields are either listed explicitly in options or tracked automatically
 * by handing out TrackedQueryResult wrappers.
 */
/**
 * Subscription to one resource with selection, placeholder data, and automatic refetching.
 * The resource can be swapped by changing options.
 */
@StubDocs
public class ObservableQuery<V, D, R> {
	final QueryClient client;
	final QueryEnvironment env;
	private final ObserverList<Consumer<QueryResult<R>>> listeners = new ObserverList<>();
	private final Set<QueryResultField> tracked = ConcurrentHashMap.newKeySet();
	private QueryOptions<V, D, R> options;
	private QueryInfo<V, D> query;
	private QueryResultSnapshot<R> currentResult;
	private QueryInfoState<D> currentResultState;
	private QueryOptions<V, D, R> currentResultOptions;
	private QueryInfo<V, D> lastQueryWithDefinedData;
	private Function<? super D, ? extends R> selectFn;
	private R selectResult;
	private Throwable selectError;
	private long selectErrorAt;
	private ScheduledFuture<?> staleTimer;
	private ScheduledFuture<?> refetchTimer;
	private Duration currentRefetchInterval;
	public ObservableQuery(QueryClient client, QueryOptions<V, D, R> options) {
		Objects.requireNonNull(client);
		this.client = client;
		env = client.env();
		OwnerTrace.of(this).alias("observer").parent(client);
		setOptions(options);
	}
	public QueryOptions<V, D, R> options() {
		synchronized (env.lock) {
			return options;
		}
	}
	public QueryInfo<V, D> query() {
		synchronized (env.lock) {
			return query;
		}
	}
	public boolean hasListeners() {
		return !listeners.isEmpty();
	}
	/**
	 * Subscribes to results. The first listener mounts the observer, which may start a fetch.
	 * 
	 * @return scope that unsubscribes the listener when closed
	 */
	public CloseableScope subscribe(Consumer<QueryResult<R>> listener) {
		Objects.requireNonNull(listener);
		synchronized (env.lock) {
			if (listeners.add(listener) && listeners.size() == 1) {
				query.addObserver(this);
				if (shouldFetchOnMount(query, options))
					executeFetch(new FetchOptions());
				else
					updateResult();
				updateTimers();
			}
		}
		return () -> unsubscribe(listener);
	}
	private void unsubscribe(Consumer<QueryResult<R>> listener) {
		synchronized (env.lock) {
			if (listeners.remove(listener) && listeners.isEmpty())
				destroy();
		}
	}
	/**
	 * Unsubscribes all listeners and stops all timers.
	 */
	public void destroy() {
		synchronized (env.lock) {
			listeners.clear();
			clearStaleTimeout();
			clearRefetchInterval();
			query.removeObserver(this);
		}
	}
	/**
	 * Replaces options. If the options resolve to a different hash, the observer switches to another resource.
	 * Mounted observer fetches if the new resource is stale and reschedules its timers.
	 */
	public void setOptions(QueryOptions<V, D, R> next) {
		Objects.requireNonNull(next);
		synchronized (env.lock) {
			QueryOptions<V, D, R> prevOptions = options;
			QueryInfo<V, D> prevQuery = query;
			options = client.defaultQueryOptions(next);
			updateQuery();
			query.setOptions(options);
			boolean mounted = hasListeners();
			if (mounted && shouldFetchOptionally(query, prevQuery, options, prevOptions))
				executeFetch(new FetchOptions());
			updateResult();
			boolean switched = query != prevQuery || prevOptions == null || options.enabled() != prevOptions.enabled();
			if (mounted && (switched || !Objects.equals(options.staleTime(), prevOptions.staleTime())))
				updateStaleTimeout();
			Duration interval = computeRefetchInterval();
			if (mounted && (switched || !Objects.equals(interval, currentRefetchInterval)))
				updateRefetchInterval(interval);
		}
	}
	public QueryResult<R> getCurrentResult() {
		synchronized (env.lock) {
			return currentResult;
		}
	}
	/**
	 * Computes result for given options as if the fetch that mounting would start was already running.
	 * This is used for synchronous reads before the observer is subscribed.
	 */
	public QueryResult<R> getOptimisticResult(QueryOptions<V, D, R> next) {
		synchronized (env.lock) {
			QueryOptions<V, D, R> resolved = client.defaultQueryOptions(next);
			QueryInfo<V, D> target = client.queryCache().build(resolved);
			QueryResultSnapshot<R> result = createResult(target, resolved, true);
			if (!result.sameAs(currentResult)) {
				currentResult = result;
				currentResultOptions = options;
				currentResultState = query.state();
			}
			return result;
		}
	}
	/**
	 * Wraps the result, so that fields read through the wrapper are tracked for change notifications.
	 */
	public QueryResult<R> trackResult(QueryResult<R> result) {
		Objects.requireNonNull(result);
		if (!(result instanceof QueryResultSnapshot))
			throw new IllegalArgumentException("Only results produced by observers can be tracked.");
		return new TrackedQueryResult<>((QueryResultSnapshot<R>)result, tracked);
	}
	public Set<QueryResultField> trackedFields() {
		return Collections.unmodifiableSet(tracked);
	}
	public CompletableFuture<QueryResult<R>> refetch(FetchOptions fetchOptions) {
		return fetch(fetchOptions);
	}
	public CompletableFuture<QueryResult<R>> refetch() {
		return refetch(new FetchOptions());
	}
	/**
	 * Fetches the resource without mounting the observer. Resource is not evicted when this fetch settles.
	 */
	public CompletableFuture<QueryResult<R>> fetchOptimistic(QueryOptions<V, D, R> next) {
		synchronized (env.lock) {
			QueryOptions<V, D, R> resolved = client.defaultQueryOptions(next);
			QueryInfo<V, D> target = client.queryCache().build(resolved);
			target.fetchingOptimistic(true);
			return target.fetch(resolved, null).thenApply(data -> {
				synchronized (env.lock) {
					updateResult();
					return currentResult;
				}
			});
		}
	}
	CompletableFuture<QueryResult<R>> fetch(FetchOptions fetchOptions) {
		FetchOptions effective = fetchOptions.copy();
		if (effective.cancelRefetch() == null)
			effective.cancelRefetch(true);
		return executeFetch(effective).thenApply(data -> {
			synchronized (env.lock) {
				updateResult();
				return currentResult;
			}
		});
	}
	private CompletableFuture<D> executeFetch(FetchOptions fetchOptions) {
		synchronized (env.lock) {
			updateQuery();
			CompletableFuture<D> future = query.fetch(options, fetchOptions);
			if (!fetchOptions.throwOnError())
				future = future.exceptionally(e -> null);
			return future;
		}
	}
	private void updateQuery() {
		QueryInfo<V, D> next = client.queryCache().build(options);
		if (next == query)
			return;
		QueryInfo<V, D> previous = query;
		query = next;
		if (hasListeners()) {
			if (previous != null)
				previous.removeObserver(this);
			next.addObserver(this);
		}
	}
	void onQueryUpdate() {
		synchronized (env.lock) {
			updateResult();
			if (hasListeners())
				updateTimers();
		}
	}
	boolean shouldFetchOnWindowFocus() {
		return shouldFetchOn(query, options, options.refetchOnWindowFocus());
	}
	boolean shouldFetchOnReconnect() {
		return shouldFetchOn(query, options, options.refetchOnReconnect());
	}
	void updateResult() {
		QueryResultSnapshot<R> previous = currentResult;
		QueryResultSnapshot<R> next = createResult(query, options, false);
		currentResultState = query.state();
		currentResultOptions = options;
		if (currentResultState.data() != null)
			lastQueryWithDefinedData = query;
		if (next.sameAs(previous))
			return;
		currentResult = next;
		if (shouldNotifyListeners(previous, next))
			listeners.forEach(l -> l.accept(next));
	}
	private boolean shouldNotifyListeners(QueryResultSnapshot<R> previous, QueryResultSnapshot<R> next) {
		if (previous == null)
			return true;
		Set<QueryResultField> fields = options.notifyOnChange();
		if (fields == null && tracked.isEmpty())
			return true;
		Set<QueryResultField> included = new HashSet<>(fields != null ? fields : tracked);
		if (options.throwOnError())
			included.add(QueryResultField.ERROR);
		return included.stream().anyMatch(f -> f.changed(previous, next));
	}
	@SuppressWarnings("unchecked")
	QueryResultSnapshot<R> createResult(QueryInfo<V, D> target, QueryOptions<V, D, R> resolved, boolean optimistic) {
		QueryResultSnapshot<R> prevResult = currentResult;
		QueryInfoState<D> prevResultState = currentResultState;
		QueryOptions<V, D, R> prevResultOptions = currentResultOptions;
		QueryInfoState<D> state = target.state();
		QueryStatus status = state.status();
		FetchStatus fetchStatus = state.fetchStatus();
		Throwable error = state.error();
		long errorUpdatedAt = state.errorUpdatedAt();
		if (optimistic) {
			boolean mounted = hasListeners();
			boolean fetchOnMount = !mounted && shouldFetchOnMount(target, resolved);
			boolean fetchOptionally = mounted && shouldFetchOptionally(target, query, resolved, options);
			if (fetchOnMount || fetchOptionally) {
				fetchStatus = env.canFetch(resolved.networkMode()) ? FetchStatus.FETCHING : FetchStatus.PAUSED;
				if (state.dataUpdatedAt() == 0)
					status = QueryStatus.PENDING;
			}
		}
		R data;
		if (resolved.select() != null && state.data() != null) {
			if (prevResult != null && prevResultState != null && state.data() == prevResultState.data() && resolved.select() == selectFn)
				data = selectResult;
			else {
				selectFn = resolved.select();
				data = null;
				try {
					data = share(prevResult, resolved.select().apply(state.data()), resolved);
					selectResult = data;
					selectError = null;
				} catch (Throwable ex) {
					failSelection(ex);
				}
			}
		} else {
			data = (R)state.data();
			// Selector failure belongs to data that is no longer there.
			if (state.data() == null) {
				selectError = null;
				selectResult = null;
			}
		}
		boolean placeholder = false;
		if (resolved.placeholderData() != null && data == null && status == QueryStatus.PENDING) {
			R substitute = null;
			if (prevResult != null && prevResult.placeholderData() && prevResultOptions != null && resolved.placeholderData() == prevResultOptions.placeholderData())
				substitute = prevResult.data();
			else {
				D previousData = lastQueryWithDefinedData != null ? lastQueryWithDefinedData.state().data() : null;
				D raw = resolved.placeholderData().placeholder(previousData, lastQueryWithDefinedData);
				if (raw != null) {
					if (resolved.select() != null) {
						try {
							substitute = resolved.select().apply(raw);
							selectError = null;
						} catch (Throwable ex) {
							failSelection(ex);
						}
					} else
						substitute = (R)raw;
				}
			}
			if (substitute != null) {
				status = QueryStatus.SUCCESS;
				data = share(prevResult, substitute, resolved);
				placeholder = true;
			}
		}
		/*
		 * Failed selection keeps the last successfully selected data and reports the selector exception as error.
		 */
		if (selectError != null) {
			error = selectError;
			data = selectResult;
			errorUpdatedAt = selectErrorAt;
			status = QueryStatus.ERROR;
		}
		return new QueryResultSnapshot<>(data, error, status, fetchStatus, state.dataUpdatedAt(), errorUpdatedAt, placeholder, isStale(target, resolved));
	}
	private void failSelection(Throwable ex) {
		if (selectError == null)
			selectErrorAt = env.now();
		selectError = new SelectionException(ex);
	}
	private R share(QueryResultSnapshot<R> prevResult, R value, QueryOptions<V, D, R> resolved) {
		if (!resolved.structuralSharing())
			return value;
		return StructuralSharing.replaceEqualDeep(prevResult != null ? prevResult.data() : null, value);
	}
	private void updateTimers() {
		updateStaleTimeout();
		updateRefetchInterval(computeRefetchInterval());
	}
	private Duration computeRefetchInterval() {
		if (options.refetchIntervalFunction() != null)
			return options.refetchIntervalFunction().apply(query.state().data(), query);
		return options.refetchInterval();
	}
	private void updateStaleTimeout() {
		clearStaleTimeout();
		if (env.server() || currentResult.stale() || !Timeouts.valid(options.staleTime()))
			return;
		long remaining = Timeouts.untilStale(currentResult.dataUpdatedAt(), options.staleTime(), env.now());
		ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
		self[0] = env.scheduler().schedule(() -> {
			synchronized (env.lock) {
				if (staleTimer != self[0])
					return;
				staleTimer = null;
				if (!currentResult.stale())
					updateResult();
			}
		}, remaining + 1, TimeUnit.MILLISECONDS);
		staleTimer = self[0];
	}
	private void clearStaleTimeout() {
		if (staleTimer != null) {
			staleTimer.cancel(false);
			staleTimer = null;
		}
	}
	private void updateRefetchInterval(Duration interval) {
		clearRefetchInterval();
		currentRefetchInterval = interval;
		if (env.server() || !options.enabled() || !Timeouts.valid(interval) || interval.isZero())
			return;
		long period = Math.max(1, interval.toMillis());
		ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
		self[0] = env.scheduler().scheduleAtFixedRate(() -> {
			synchronized (env.lock) {
				if (refetchTimer != self[0])
					return;
				if (options.refetchIntervalInBackground() || env.focused())
					executeFetch(new FetchOptions());
			}
		}, period, period, TimeUnit.MILLISECONDS);
		refetchTimer = self[0];
	}
	private void clearRefetchInterval() {
		if (refetchTimer != null) {
			refetchTimer.cancel(false);
			refetchTimer = null;
		}
	}
	static boolean isStale(QueryInfo<?, ?> query, QueryOptions<?, ?, ?> options) {
		return query.isStaleByTime(options.staleTime());
	}
	static boolean shouldLoadOnMount(QueryInfo<?, ?> query, QueryOptions<?, ?, ?> options) {
		QueryInfoState<?> state = query.state();
		return options.enabled()
			&& state.dataUpdatedAt() == 0
			&& !(state.status() == QueryStatus.ERROR && !options.retryOnMount());
	}
	static boolean shouldFetchOnMount(QueryInfo<?, ?> query, QueryOptions<?, ?, ?> options) {
		return shouldLoadOnMount(query, options)
			|| query.state().dataUpdatedAt() > 0 && shouldFetchOn(query, options, options.refetchOnMount());
	}
	static boolean shouldFetchOn(QueryInfo<?, ?> query, QueryOptions<?, ?, ?> options, RefetchTrigger trigger) {
		return options.enabled()
			&& (trigger == RefetchTrigger.ALWAYS || trigger != RefetchTrigger.NEVER && isStale(query, options));
	}
	static boolean shouldFetchOptionally(QueryInfo<?, ?> query, QueryInfo<?, ?> prevQuery, QueryOptions<?, ?, ?> options, QueryOptions<?, ?, ?> prevOptions) {
		return options.enabled()
			&& (query != prevQuery || prevOptions == null || !prevOptions.enabled())
			&& isStale(query, options);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
