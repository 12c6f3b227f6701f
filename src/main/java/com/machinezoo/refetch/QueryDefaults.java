// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import com.machinezoo.stagean.*;

/*
 * All settings are nullable. Null means "not specified in this layer".
 * Layers are combined with withFallback() in order call site, descriptor, client, built-in.
 */
/**
 * One layer of query settings.
 */
@StubDocs
public class QueryDefaults {
	private Duration staleTime;
	/**
	 * How long fetched data stays fresh. Zero means data is stale immediately after fetch.
	 */
	public Duration staleTime() {
		return staleTime;
	}
	public QueryDefaults staleTime(Duration staleTime) {
		this.staleTime = staleTime;
		return this;
	}
	private Duration gcTime;
	/**
	 * How long unobserved resource stays cached.
	 */
	public Duration gcTime() {
		return gcTime;
	}
	public QueryDefaults gcTime(Duration gcTime) {
		this.gcTime = gcTime;
		return this;
	}
	private RetryPolicy retry;
	public RetryPolicy retry() {
		return retry;
	}
	public QueryDefaults retry(RetryPolicy retry) {
		this.retry = retry;
		return this;
	}
	private RetryDelay retryDelay;
	public RetryDelay retryDelay() {
		return retryDelay;
	}
	public QueryDefaults retryDelay(RetryDelay retryDelay) {
		this.retryDelay = retryDelay;
		return this;
	}
	private NetworkMode networkMode;
	public NetworkMode networkMode() {
		return networkMode;
	}
	public QueryDefaults networkMode(NetworkMode networkMode) {
		this.networkMode = networkMode;
		return this;
	}
	private Boolean enabled;
	/**
	 * Disabled observers never fetch automatically.
	 */
	public Boolean enabled() {
		return enabled;
	}
	public QueryDefaults enabled(Boolean enabled) {
		this.enabled = enabled;
		return this;
	}
	private RefetchTrigger refetchOnMount;
	public RefetchTrigger refetchOnMount() {
		return refetchOnMount;
	}
	public QueryDefaults refetchOnMount(RefetchTrigger refetchOnMount) {
		this.refetchOnMount = refetchOnMount;
		return this;
	}
	private RefetchTrigger refetchOnWindowFocus;
	public RefetchTrigger refetchOnWindowFocus() {
		return refetchOnWindowFocus;
	}
	public QueryDefaults refetchOnWindowFocus(RefetchTrigger refetchOnWindowFocus) {
		this.refetchOnWindowFocus = refetchOnWindowFocus;
		return this;
	}
	private RefetchTrigger refetchOnReconnect;
	public RefetchTrigger refetchOnReconnect() {
		return refetchOnReconnect;
	}
	public QueryDefaults refetchOnReconnect(RefetchTrigger refetchOnReconnect) {
		this.refetchOnReconnect = refetchOnReconnect;
		return this;
	}
	private Boolean refetchIntervalInBackground;
	public Boolean refetchIntervalInBackground() {
		return refetchIntervalInBackground;
	}
	public QueryDefaults refetchIntervalInBackground(Boolean refetchIntervalInBackground) {
		this.refetchIntervalInBackground = refetchIntervalInBackground;
		return this;
	}
	private Boolean retryOnMount;
	/**
	 * Whether mounting an observer retries resource that failed before.
	 */
	public Boolean retryOnMount() {
		return retryOnMount;
	}
	public QueryDefaults retryOnMount(Boolean retryOnMount) {
		this.retryOnMount = retryOnMount;
		return this;
	}
	private Boolean throwOnError;
	public Boolean throwOnError() {
		return throwOnError;
	}
	public QueryDefaults throwOnError(Boolean throwOnError) {
		this.throwOnError = throwOnError;
		return this;
	}
	private Boolean structuralSharing;
	public Boolean structuralSharing() {
		return structuralSharing;
	}
	public QueryDefaults structuralSharing(Boolean structuralSharing) {
		this.structuralSharing = structuralSharing;
		return this;
	}
	public QueryDefaults copy() {
		return new QueryDefaults().withFallback(this);
	}
	/**
	 * Creates new layer that takes settings from this layer and falls back to {@code fallback} where this layer has none.
	 */
	public QueryDefaults withFallback(QueryDefaults fallback) {
		QueryDefaults merged = new QueryDefaults();
		merged.staleTime = staleTime != null ? staleTime : fallback.staleTime;
		merged.gcTime = gcTime != null ? gcTime : fallback.gcTime;
		merged.retry = retry != null ? retry : fallback.retry;
		merged.retryDelay = retryDelay != null ? retryDelay : fallback.retryDelay;
		merged.networkMode = networkMode != null ? networkMode : fallback.networkMode;
		merged.enabled = enabled != null ? enabled : fallback.enabled;
		merged.refetchOnMount = refetchOnMount != null ? refetchOnMount : fallback.refetchOnMount;
		merged.refetchOnWindowFocus = refetchOnWindowFocus != null ? refetchOnWindowFocus : fallback.refetchOnWindowFocus;
		merged.refetchOnReconnect = refetchOnReconnect != null ? refetchOnReconnect : fallback.refetchOnReconnect;
		merged.refetchIntervalInBackground = refetchIntervalInBackground != null ? refetchIntervalInBackground : fallback.refetchIntervalInBackground;
		merged.retryOnMount = retryOnMount != null ? retryOnMount : fallback.retryOnMount;
		merged.throwOnError = throwOnError != null ? throwOnError : fallback.throwOnError;
		merged.structuralSharing = structuralSharing != null ? structuralSharing : fallback.structuralSharing;
		return merged;
	}
	/*
	 * Refetch on reconnect makes no sense for resources that ignore connectivity.
	 */
	static QueryDefaults builtin(QueryEnvironment env, NetworkMode mode) {
		NetworkMode effective = mode != null ? mode : NetworkMode.ONLINE;
		return new QueryDefaults()
			.staleTime(Duration.ZERO)
			.gcTime(env.gcTime())
			.retry(env.retry())
			.retryDelay(RetryDelay.exponential())
			.networkMode(effective)
			.enabled(true)
			.refetchOnMount(RefetchTrigger.IF_STALE)
			.refetchOnWindowFocus(RefetchTrigger.IF_STALE)
			.refetchOnReconnect(effective != NetworkMode.ALWAYS ? RefetchTrigger.IF_STALE : RefetchTrigger.NEVER)
			.refetchIntervalInBackground(false)
			.retryOnMount(true)
			.throwOnError(false)
			.structuralSharing(true);
	}
}
