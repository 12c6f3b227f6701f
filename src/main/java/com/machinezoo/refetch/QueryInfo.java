// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.fasterxml.jackson.databind.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.refetch.time.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * QueryInfo is owned by its QueryCache entry. Observers reference it, but they don't keep it alive.
 * Once the last observer leaves, the GC timer is armed and the entry is evicted when the timer fires
 * while the entry is still unobserved and idle. Entries fetching at that moment are evicted
 * when the timer is rearmed after the fetch settles.
 * 
 * Every transition goes through dispatch(), which applies the action to immutable state
 * and notifies observers and the cache while still holding the engine lock.
 */
/**
 * Cached state of one resource, identified by its hash.
 * Entries are created by {@link QueryCache#build(QueryOptions, QueryInfoState)} and shared by all observers of the resource.
 */
@DraftDocs("state diagram")
public class QueryInfo<V, D> {
	private static final Logger logger = LoggerFactory.getLogger(QueryInfo.class);
	private static final Timer fetchTimer = Metrics.timer("refetch.fetches");
	private static final Counter undefinedCount = Metrics.counter("refetch.fetches.undefined");
	private static final Counter evictionCount = Metrics.counter("refetch.evictions");
	private final QueryCache cache;
	private final QueryEnvironment env;
	private final String queryHash;
	private final JsonNode fullKey;
	private final QueryInfoState<D> defaultState;
	private final GcScheduler gc;
	private final ObserverList<ObservableQuery<V, D, ?>> observers = new ObserverList<>();
	private QueryOptions<V, D, ?> options;
	private QueryInfoState<D> state;
	private QueryInfoState<D> revertState;
	private Retryer<D> retryer;
	private CompletableFuture<D> promise;
	private volatile boolean abortSignalConsumed;
	private boolean fetchingOptimistic;
	QueryInfo(QueryCache cache, QueryOptions<V, D, ?> options, QueryInfoState<D> state) {
		requireResolved(options);
		this.cache = cache;
		env = cache.env();
		this.options = options;
		queryHash = options.queryHash();
		fullKey = QueryKeys.fullKey(options.descriptor().key(), options.variables());
		defaultState = QueryInfoState.initial(options.initialData(), options.initialDataUpdatedAt() != null ? options.initialDataUpdatedAt() : env.now());
		this.state = state != null ? state : defaultState;
		gc = new GcScheduler(env.scheduler(), env.lock, this::optionalRemove);
		gc.updateGcTime(options.gcTime());
		OwnerTrace.of(this)
			.alias("query")
			.parent(cache)
			.tag("key", options.descriptor().key())
			.tag("hash", queryHash);
		gc.schedule();
	}
	private static void requireResolved(QueryOptions<?, ?, ?> options) {
		Objects.requireNonNull(options);
		if (!options.resolved())
			throw new IllegalArgumentException("Options must be resolved with QueryClient.defaultQueryOptions().");
	}
	public String queryHash() {
		return queryHash;
	}
	/**
	 * Key and variables as JSON array, used for partial matching in {@link QueryFilters}.
	 */
	public JsonNode fullKey() {
		return fullKey;
	}
	public QueryCache cache() {
		return cache;
	}
	public QueryDescriptor<V, D> descriptor() {
		synchronized (env.lock) {
			return options.descriptor();
		}
	}
	public V variables() {
		synchronized (env.lock) {
			return options.variables();
		}
	}
	public QueryOptions<V, D, ?> options() {
		synchronized (env.lock) {
			return options;
		}
	}
	/*
	 * Options of the most recent observer or fetch win, except for GC time, which only grows.
	 */
	public void setOptions(QueryOptions<V, D, ?> options) {
		requireResolved(options);
		synchronized (env.lock) {
			this.options = options;
			gc.updateGcTime(options.gcTime());
		}
	}
	public QueryInfoState<D> state() {
		synchronized (env.lock) {
			return state;
		}
	}
	public Duration gcTime() {
		return gc.gcTime();
	}
	void consumeSignal() {
		abortSignalConsumed = true;
	}
	void fetchingOptimistic(boolean fetchingOptimistic) {
		synchronized (env.lock) {
			this.fetchingOptimistic = fetchingOptimistic;
		}
	}
	/**
	 * Future of the running or last fetch, {@code null} if the resource was never fetched.
	 */
	public CompletableFuture<D> promise() {
		synchronized (env.lock) {
			return promise;
		}
	}
	private void dispatch(QueryAction<D> action) {
		state = state.apply(action);
		observers.forEach(ObservableQuery::onQueryUpdate);
		cache.notify(new QueryCacheEvent(QueryCacheEvent.Type.UPDATED, this, action));
	}
	public void setState(QueryInfoState<D> state) {
		Objects.requireNonNull(state);
		synchronized (env.lock) {
			dispatch(QueryAction.setState(state));
		}
	}
	/**
	 * Writes data directly into the cache. Data is structurally shared with the previous data unless disabled in options.
	 * 
	 * @return data as stored in the cache
	 */
	public D setData(D data, SetDataOptions setOptions) {
		Objects.requireNonNull(data);
		Objects.requireNonNull(setOptions);
		synchronized (env.lock) {
			D shared = options.structuralSharing() ? StructuralSharing.replaceEqualDeep(state.data(), data) : data;
			long updatedAt = setOptions.updatedAt() != null ? setOptions.updatedAt() : env.now();
			dispatch(QueryAction.success(shared, updatedAt, setOptions.manual()));
			return shared;
		}
	}
	public void invalidate() {
		synchronized (env.lock) {
			if (!state.invalidated())
				dispatch(QueryAction.invalidate());
		}
	}
	/**
	 * Cancels running fetch.
	 * 
	 * @return future that completes when the cancelled fetch settles, never failing
	 */
	public CompletableFuture<Void> cancel(CancelOptions cancelOptions) {
		Objects.requireNonNull(cancelOptions);
		synchronized (env.lock) {
			CompletableFuture<D> current = promise;
			if (retryer != null)
				retryer.cancel(cancelOptions);
			return current != null ? current.handle((v, e) -> (Void)null) : CompletableFuture.completedFuture(null);
		}
	}
	public void destroy() {
		synchronized (env.lock) {
			gc.clear();
			cancel(new CancelOptions().silent(true));
		}
	}
	/**
	 * Cancels running fetch and returns to the initial state, which includes initial data if there is any.
	 */
	public void reset() {
		synchronized (env.lock) {
			destroy();
			setState(defaultState);
		}
	}
	public boolean isActive() {
		synchronized (env.lock) {
			return observers.snapshot().stream().anyMatch(o -> o.options().enabled());
		}
	}
	public boolean isDisabled() {
		synchronized (env.lock) {
			return !observers.isEmpty() && !isActive();
		}
	}
	public boolean isStale() {
		synchronized (env.lock) {
			return state.invalidated()
				|| state.dataUpdatedAt() == 0
				|| observers.snapshot().stream().anyMatch(o -> o.getCurrentResult().stale());
		}
	}
	public boolean isStaleByTime(Duration staleTime) {
		synchronized (env.lock) {
			return state.invalidated()
				|| state.dataUpdatedAt() == 0
				|| Timeouts.untilStale(state.dataUpdatedAt(), staleTime != null ? staleTime : Duration.ZERO, env.now()) == 0;
		}
	}
	public int observerCount() {
		return observers.size();
	}
	void addObserver(ObservableQuery<V, D, ?> observer) {
		synchronized (env.lock) {
			if (observers.add(observer))
				gc.clear();
		}
	}
	/*
	 * Fetch that never looked at its abort signal is allowed to finish and cache its result, only retries are stopped.
	 * Fetch that did look at the signal is cancelled and the entry rolls back to the state before the fetch.
	 */
	void removeObserver(ObservableQuery<V, D, ?> observer) {
		synchronized (env.lock) {
			if (observers.remove(observer) && observers.isEmpty()) {
				if (retryer != null) {
					if (abortSignalConsumed)
						retryer.cancel(new CancelOptions().revert(true));
					else
						retryer.cancelRetry();
				}
				gc.schedule();
			}
		}
	}
	public void onFocus() {
		synchronized (env.lock) {
			observers.snapshot().stream()
				.filter(ObservableQuery::shouldFetchOnWindowFocus)
				.findFirst()
				.ifPresent(o -> o.refetch(new FetchOptions().cancelRefetch(false)));
			if (retryer != null)
				retryer.resume();
		}
	}
	public void onOnline() {
		synchronized (env.lock) {
			observers.snapshot().stream()
				.filter(ObservableQuery::shouldFetchOnReconnect)
				.findFirst()
				.ifPresent(o -> o.refetch(new FetchOptions().cancelRefetch(false)));
			if (retryer != null)
				retryer.resume();
		}
	}
	private void optionalRemove() {
		if (observers.isEmpty() && state.fetchStatus() == FetchStatus.IDLE) {
			evictionCount.increment();
			cache.remove(this);
		}
	}
	public CompletableFuture<D> fetch() {
		return fetch(null, null);
	}
	/**
	 * Fetches the resource unless it is already being fetched.
	 * Concurrent calls share one fetch. Resource that already has data and is fetching is refetched from scratch
	 * if {@link FetchOptions#cancelRefetch(Boolean)} is set. Paused fetch is resumed if focus and connectivity allow it.
	 * 
	 * @param fetchOptions
	 *            fetch options or {@code null} for defaults
	 * @return future of fetched data
	 */
	public CompletableFuture<D> fetch(QueryOptions<V, D, ?> newOptions, FetchOptions fetchOptions) {
		FetchOptions fo = fetchOptions != null ? fetchOptions : new FetchOptions();
		synchronized (env.lock) {
			if (state.fetchStatus() != FetchStatus.IDLE) {
				if (state.dataUpdatedAt() > 0 && Boolean.TRUE.equals(fo.cancelRefetch()))
					cancel(new CancelOptions().silent(true));
				else if (promise != null) {
					retryer.continueRetry();
					retryer.resume();
					return promise;
				}
			}
			if (newOptions != null)
				setOptions(newOptions);
			FetchMeta meta = fo.meta();
			AbortSignal signal = new AbortSignal();
			FetchContext<V, D> context = new FetchContext<>(this, options, state.data(), meta, signal);
			QueryBehavior<V, D> behavior = options.descriptor().behavior();
			revertState = state;
			if (state.fetchStatus() == FetchStatus.IDLE || !Objects.equals(state.fetchMeta(), meta))
				dispatch(QueryAction.fetch(meta, !env.canFetch(options.networkMode())));
			Span span = GlobalTracer.get().buildSpan("refetch.fetch")
				.withTag("component", "refetch")
				.start();
			OwnerTrace.of(this).fill(span);
			Timer.Sample sample = Timer.start();
			Retryer<D> created = new Retryer<D>(env, () -> {
				abortSignalConsumed = false;
				return behavior.fetch(context);
			})
				.retry(options.retry())
				.retryDelay(options.retryDelay())
				.networkMode(options.networkMode())
				.abort(signal::abort)
				.onSuccess(this::onFetchSuccess)
				.onError(this::onFetchError)
				.onPause(() -> dispatch(QueryAction.pause()))
				.onContinue(() -> dispatch(QueryAction.resume()));
			OwnerTrace.of(created).parent(this);
			retryer = created;
			promise = created.future().thenApply(data -> {
				if (data == null)
					throw new UndefinedDataException(queryHash);
				return data;
			});
			created.future().whenComplete((data, error) -> {
				sample.stop(fetchTimer);
				if (error != null)
					span.setTag("error", true);
				span.finish();
			});
			created.start();
			return promise;
		}
	}
	private void onFetchSuccess(D data) {
		if (data == null) {
			undefinedCount.increment();
			logger.error("Fetch function of {} completed with null data. Fetch functions must produce non-null value.", queryHash);
			onFetchError(new UndefinedDataException(queryHash));
			return;
		}
		D stored = setData(data, new SetDataOptions());
		ExceptionLogging.log(logger).run(() -> cache.config().onSuccess().accept(stored, this));
		ExceptionLogging.log(logger).run(() -> cache.config().onSettled().settled(stored, null, this));
		settleFetch();
	}
	private void onFetchError(Throwable error) {
		boolean cancelled = error instanceof CancelledException;
		if (!cancelled || !((CancelledException)error).silent())
			dispatch(QueryAction.error(error, env.now(), revertState));
		if (!cancelled) {
			ExceptionLogging.log(logger).run(() -> cache.config().onError().accept(error, this));
			ExceptionLogging.log(logger).run(() -> cache.config().onSettled().settled(state.data(), error, this));
		}
		settleFetch();
	}
	/*
	 * Optimistic fetches are started before any observer subscribes, so eviction would race with the subscription.
	 */
	private void settleFetch() {
		if (!fetchingOptimistic)
			gc.schedule();
		fetchingOptimistic = false;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
