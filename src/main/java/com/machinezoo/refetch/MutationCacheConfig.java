// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;

/**
 * Callbacks invoked for every mutation in the cache before callbacks in {@link MutationOptions}.
 * Returned stage, if any, is awaited before the next callback runs.
 */
public class MutationCacheConfig {
	@FunctionalInterface
	public interface SuccessHandler {
		CompletionStage<?> success(Object data, Object variables, MutationInfo<?, ?> mutation);
	}
	@FunctionalInterface
	public interface ErrorHandler {
		CompletionStage<?> error(Throwable error, Object variables, MutationInfo<?, ?> mutation);
	}
	@FunctionalInterface
	public interface SettledHandler {
		CompletionStage<?> settled(Object data, Throwable error, Object variables, MutationInfo<?, ?> mutation);
	}
	private SuccessHandler onSuccess = (data, variables, mutation) -> null;
	public SuccessHandler onSuccess() {
		return onSuccess;
	}
	public MutationCacheConfig onSuccess(SuccessHandler onSuccess) {
		Objects.requireNonNull(onSuccess);
		this.onSuccess = onSuccess;
		return this;
	}
	private ErrorHandler onError = (error, variables, mutation) -> null;
	public ErrorHandler onError() {
		return onError;
	}
	public MutationCacheConfig onError(ErrorHandler onError) {
		Objects.requireNonNull(onError);
		this.onError = onError;
		return this;
	}
	private SettledHandler onSettled = (data, error, variables, mutation) -> null;
	public SettledHandler onSettled() {
		return onSettled;
	}
	public MutationCacheConfig onSettled(SettledHandler onSettled) {
		Objects.requireNonNull(onSettled);
		this.onSettled = onSettled;
		return this;
	}
}
