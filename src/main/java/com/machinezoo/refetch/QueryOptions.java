// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Options are resolved once by QueryClient.defaultQueryOptions(), which produces a copy with all layers of defaults
 * merged in and with the hash computed. Resolved options carry a marker, so that resolving them again is a no-op.
 * Setters mutate the instance. They are meant for building options, not for modifying options already in use.
 */
/**
 * Options of one resource as seen by one caller.
 * 
 * @param <V>
 *            type of variables
 * @param <D>
 *            type of cached data
 * @param <R>
 *            type of data in results after optional {@link #select(Function)}
 */
@StubDocs
@DraftApi("builder separate from resolved options")
public class QueryOptions<V, D, R> {
	private final QueryDescriptor<V, D> descriptor;
	public QueryOptions(QueryDescriptor<V, D> descriptor) {
		Objects.requireNonNull(descriptor);
		this.descriptor = descriptor;
	}
	public static <V, D> QueryOptions<V, D, D> of(QueryDescriptor<V, D> descriptor, V variables) {
		return new QueryOptions<V, D, D>(descriptor).variables(variables);
	}
	public static <V, D> QueryOptions<V, D, D> of(QueryDescriptor<V, D> descriptor) {
		return new QueryOptions<>(descriptor);
	}
	private QueryOptions(QueryOptions<V, D, R> other) {
		descriptor = other.descriptor;
		variables = other.variables;
		queryHash = other.queryHash;
		hashFunction = other.hashFunction;
		defaults = other.defaults.copy();
		initialData = other.initialData;
		initialDataUpdatedAt = other.initialDataUpdatedAt;
		select = other.select;
		placeholderData = other.placeholderData;
		refetchInterval = other.refetchInterval;
		refetchIntervalFunction = other.refetchIntervalFunction;
		meta = other.meta;
		maxPages = other.maxPages;
		pages = other.pages;
		notifyOnChange = other.notifyOnChange;
		resolved = other.resolved;
	}
	public QueryOptions<V, D, R> copy() {
		return new QueryOptions<>(this);
	}
	public QueryDescriptor<V, D> descriptor() {
		return descriptor;
	}
	private V variables;
	public V variables() {
		return variables;
	}
	public QueryOptions<V, D, R> variables(V variables) {
		this.variables = variables;
		return this;
	}
	private String queryHash;
	public String queryHash() {
		return queryHash;
	}
	public QueryOptions<V, D, R> queryHash(String queryHash) {
		this.queryHash = queryHash;
		return this;
	}
	private BiFunction<String, Object, String> hashFunction;
	public BiFunction<String, Object, String> hashFunction() {
		return hashFunction;
	}
	/**
	 * Custom hashing of key and variables. Default is {@link QueryKeys#hash(String, Object)}.
	 */
	public QueryOptions<V, D, R> hashFunction(BiFunction<String, Object, String> hashFunction) {
		this.hashFunction = hashFunction;
		return this;
	}
	private QueryDefaults defaults = new QueryDefaults();
	/**
	 * Call site layer of settings. After resolution, this holds all layers merged.
	 */
	public QueryDefaults defaults() {
		return defaults;
	}
	public Duration staleTime() {
		return defaults.staleTime();
	}
	public QueryOptions<V, D, R> staleTime(Duration staleTime) {
		defaults.staleTime(staleTime);
		return this;
	}
	public Duration gcTime() {
		return defaults.gcTime();
	}
	public QueryOptions<V, D, R> gcTime(Duration gcTime) {
		defaults.gcTime(gcTime);
		return this;
	}
	public RetryPolicy retry() {
		return defaults.retry();
	}
	public QueryOptions<V, D, R> retry(RetryPolicy retry) {
		defaults.retry(retry);
		return this;
	}
	public RetryDelay retryDelay() {
		return defaults.retryDelay();
	}
	public QueryOptions<V, D, R> retryDelay(RetryDelay retryDelay) {
		defaults.retryDelay(retryDelay);
		return this;
	}
	public NetworkMode networkMode() {
		return defaults.networkMode();
	}
	public QueryOptions<V, D, R> networkMode(NetworkMode networkMode) {
		defaults.networkMode(networkMode);
		return this;
	}
	public boolean enabled() {
		return !Boolean.FALSE.equals(defaults.enabled());
	}
	public QueryOptions<V, D, R> enabled(boolean enabled) {
		defaults.enabled(enabled);
		return this;
	}
	public RefetchTrigger refetchOnMount() {
		return defaults.refetchOnMount();
	}
	public QueryOptions<V, D, R> refetchOnMount(RefetchTrigger refetchOnMount) {
		defaults.refetchOnMount(refetchOnMount);
		return this;
	}
	public RefetchTrigger refetchOnWindowFocus() {
		return defaults.refetchOnWindowFocus();
	}
	public QueryOptions<V, D, R> refetchOnWindowFocus(RefetchTrigger refetchOnWindowFocus) {
		defaults.refetchOnWindowFocus(refetchOnWindowFocus);
		return this;
	}
	public RefetchTrigger refetchOnReconnect() {
		return defaults.refetchOnReconnect();
	}
	public QueryOptions<V, D, R> refetchOnReconnect(RefetchTrigger refetchOnReconnect) {
		defaults.refetchOnReconnect(refetchOnReconnect);
		return this;
	}
	public boolean refetchIntervalInBackground() {
		return Boolean.TRUE.equals(defaults.refetchIntervalInBackground());
	}
	public QueryOptions<V, D, R> refetchIntervalInBackground(boolean refetchIntervalInBackground) {
		defaults.refetchIntervalInBackground(refetchIntervalInBackground);
		return this;
	}
	public boolean retryOnMount() {
		return !Boolean.FALSE.equals(defaults.retryOnMount());
	}
	public QueryOptions<V, D, R> retryOnMount(boolean retryOnMount) {
		defaults.retryOnMount(retryOnMount);
		return this;
	}
	public boolean throwOnError() {
		return Boolean.TRUE.equals(defaults.throwOnError());
	}
	public QueryOptions<V, D, R> throwOnError(boolean throwOnError) {
		defaults.throwOnError(throwOnError);
		return this;
	}
	public boolean structuralSharing() {
		return !Boolean.FALSE.equals(defaults.structuralSharing());
	}
	public QueryOptions<V, D, R> structuralSharing(boolean structuralSharing) {
		defaults.structuralSharing(structuralSharing);
		return this;
	}
	private D initialData;
	public D initialData() {
		return initialData;
	}
	/**
	 * Data the resource starts with when it is created by these options. It counts as successfully fetched data.
	 */
	public QueryOptions<V, D, R> initialData(D initialData) {
		this.initialData = initialData;
		return this;
	}
	private Long initialDataUpdatedAt;
	public Long initialDataUpdatedAt() {
		return initialDataUpdatedAt;
	}
	public QueryOptions<V, D, R> initialDataUpdatedAt(Long initialDataUpdatedAt) {
		this.initialDataUpdatedAt = initialDataUpdatedAt;
		return this;
	}
	private Function<? super D, ? extends R> select;
	public Function<? super D, ? extends R> select() {
		return select;
	}
	/**
	 * Transforms cached data into result data. Selector runs again only when data or selector reference changes,
	 * so it should be kept in a field rather than recreated for every call.
	 */
	@SuppressWarnings("unchecked")
	public <S> QueryOptions<V, D, S> select(Function<? super D, ? extends S> select) {
		QueryOptions<V, D, S> typed = (QueryOptions<V, D, S>)(QueryOptions<?, ?, ?>)this;
		typed.select = select;
		return typed;
	}
	private PlaceholderData<V, D> placeholderData;
	public PlaceholderData<V, D> placeholderData() {
		return placeholderData;
	}
	public QueryOptions<V, D, R> placeholderData(PlaceholderData<V, D> placeholderData) {
		this.placeholderData = placeholderData;
		return this;
	}
	private Duration refetchInterval;
	public Duration refetchInterval() {
		return refetchInterval;
	}
	/**
	 * Periodic refetch while observed. Null or zero disables it.
	 */
	public QueryOptions<V, D, R> refetchInterval(Duration refetchInterval) {
		this.refetchInterval = refetchInterval;
		return this;
	}
	private BiFunction<D, QueryInfo<V, D>, Duration> refetchIntervalFunction;
	public BiFunction<D, QueryInfo<V, D>, Duration> refetchIntervalFunction() {
		return refetchIntervalFunction;
	}
	/**
	 * Computes refetch interval from current data. It takes precedence over fixed {@link #refetchInterval(Duration)}.
	 */
	public QueryOptions<V, D, R> refetchIntervalFunction(BiFunction<D, QueryInfo<V, D>, Duration> refetchIntervalFunction) {
		this.refetchIntervalFunction = refetchIntervalFunction;
		return this;
	}
	private Map<String, Object> meta = Collections.emptyMap();
	public Map<String, Object> meta() {
		return meta;
	}
	public QueryOptions<V, D, R> meta(Map<String, Object> meta) {
		Objects.requireNonNull(meta);
		this.meta = meta;
		return this;
	}
	private Integer maxPages;
	public Integer maxPages() {
		return maxPages;
	}
	/**
	 * Maximum number of pages kept by infinite queries. Pages are dropped from the opposite end.
	 */
	public QueryOptions<V, D, R> maxPages(Integer maxPages) {
		if (maxPages != null && maxPages <= 0)
			throw new IllegalArgumentException();
		this.maxPages = maxPages;
		return this;
	}
	private Integer pages;
	public Integer pages() {
		return pages;
	}
	/**
	 * Number of pages fetched by full refetch of infinite query. Defaults to the number of cached pages.
	 */
	public QueryOptions<V, D, R> pages(Integer pages) {
		this.pages = pages;
		return this;
	}
	private Set<QueryResultField> notifyOnChange;
	public Set<QueryResultField> notifyOnChange() {
		return notifyOnChange;
	}
	/**
	 * Result fields whose change notifies listeners. Default is to track fields read through {@link ObservableQuery#trackResult(QueryResult)}.
	 */
	public QueryOptions<V, D, R> notifyOnChange(Set<QueryResultField> notifyOnChange) {
		this.notifyOnChange = notifyOnChange;
		return this;
	}
	private boolean resolved;
	public boolean resolved() {
		return resolved;
	}
	/*
	 * Layers below call site, i.e. descriptor defaults and client defaults, without built-in defaults.
	 */
	QueryDefaults layered(QueryDefaults client) {
		return defaults.withFallback(descriptor.defaults()).withFallback(client);
	}
	QueryOptions<V, D, R> resolve(QueryDefaults client, QueryEnvironment env) {
		if (resolved)
			return this;
		QueryOptions<V, D, R> result = copy();
		QueryDefaults layered = layered(client);
		result.defaults = layered.withFallback(QueryDefaults.builtin(env, layered.networkMode()));
		if (result.queryHash == null) {
			result.queryHash = hashFunction != null
				? hashFunction.apply(descriptor.key(), variables)
				: QueryKeys.hash(descriptor.key(), variables);
		}
		result.resolved = true;
		return result;
	}
	@Override
	public String toString() {
		return "QueryOptions[" + (queryHash != null ? queryHash : descriptor.key()) + "]";
	}
}
