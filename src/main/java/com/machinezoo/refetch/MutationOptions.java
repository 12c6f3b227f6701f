// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.stagean.*;

/*
 * Callbacks may return a stage that is awaited before the next callback runs. Returning null means nothing to wait for.
 */
/**
 * Options of one mutation trigger.
 */
@StubDocs
@DraftApi("builder separate from resolved options")
public class MutationOptions<V, D> {
	@FunctionalInterface
	public interface SuccessHandler<V, D> {
		CompletionStage<?> success(D data, V variables, MutationInfo<V, D> mutation);
	}
	@FunctionalInterface
	public interface ErrorHandler<V, D> {
		CompletionStage<?> error(Throwable error, V variables, MutationInfo<V, D> mutation);
	}
	@FunctionalInterface
	public interface SettledHandler<V, D> {
		CompletionStage<?> settled(D data, Throwable error, V variables, MutationInfo<V, D> mutation);
	}
	private final MutationDescriptor<V, D> descriptor;
	public MutationOptions(MutationDescriptor<V, D> descriptor) {
		Objects.requireNonNull(descriptor);
		this.descriptor = descriptor;
	}
	public static <V, D> MutationOptions<V, D> of(MutationDescriptor<V, D> descriptor) {
		return new MutationOptions<>(descriptor);
	}
	private MutationOptions(MutationOptions<V, D> other) {
		descriptor = other.descriptor;
		defaults = other.defaults.copy();
		meta = other.meta;
		onSuccess = other.onSuccess;
		onError = other.onError;
		onSettled = other.onSettled;
		resolved = other.resolved;
	}
	public MutationOptions<V, D> copy() {
		return new MutationOptions<>(this);
	}
	public MutationDescriptor<V, D> descriptor() {
		return descriptor;
	}
	private QueryDefaults defaults = new QueryDefaults();
	public QueryDefaults defaults() {
		return defaults;
	}
	public RetryPolicy retry() {
		return defaults.retry();
	}
	public MutationOptions<V, D> retry(RetryPolicy retry) {
		defaults.retry(retry);
		return this;
	}
	public RetryDelay retryDelay() {
		return defaults.retryDelay();
	}
	public MutationOptions<V, D> retryDelay(RetryDelay retryDelay) {
		defaults.retryDelay(retryDelay);
		return this;
	}
	public NetworkMode networkMode() {
		return defaults.networkMode();
	}
	public MutationOptions<V, D> networkMode(NetworkMode networkMode) {
		defaults.networkMode(networkMode);
		return this;
	}
	public Duration gcTime() {
		return defaults.gcTime();
	}
	public MutationOptions<V, D> gcTime(Duration gcTime) {
		defaults.gcTime(gcTime);
		return this;
	}
	private Map<String, Object> meta = Collections.emptyMap();
	public Map<String, Object> meta() {
		return meta;
	}
	public MutationOptions<V, D> meta(Map<String, Object> meta) {
		Objects.requireNonNull(meta);
		this.meta = meta;
		return this;
	}
	private SuccessHandler<V, D> onSuccess;
	public SuccessHandler<V, D> onSuccess() {
		return onSuccess;
	}
	public MutationOptions<V, D> onSuccess(SuccessHandler<V, D> onSuccess) {
		this.onSuccess = onSuccess;
		return this;
	}
	private ErrorHandler<V, D> onError;
	public ErrorHandler<V, D> onError() {
		return onError;
	}
	public MutationOptions<V, D> onError(ErrorHandler<V, D> onError) {
		this.onError = onError;
		return this;
	}
	private SettledHandler<V, D> onSettled;
	public SettledHandler<V, D> onSettled() {
		return onSettled;
	}
	public MutationOptions<V, D> onSettled(SettledHandler<V, D> onSettled) {
		this.onSettled = onSettled;
		return this;
	}
	private boolean resolved;
	public boolean resolved() {
		return resolved;
	}
	/*
	 * Mutations are not retried unless some layer asks for it.
	 */
	MutationOptions<V, D> resolve(QueryDefaults client, QueryEnvironment env) {
		if (resolved)
			return this;
		MutationOptions<V, D> result = copy();
		QueryDefaults layered = defaults.withFallback(descriptor.defaults()).withFallback(client);
		result.defaults = layered.withFallback(new QueryDefaults()
			.gcTime(env.gcTime())
			.retry(RetryPolicy.never())
			.retryDelay(RetryDelay.exponential())
			.networkMode(NetworkMode.ONLINE));
		result.resolved = true;
		return result;
	}
	@Override
	public String toString() {
		return "MutationOptions[" + descriptor.key() + "]";
	}
}
