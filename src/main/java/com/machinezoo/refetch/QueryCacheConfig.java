// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.function.*;

/**
 * Callbacks invoked after every fetch of every resource in the cache. Cancelled fetches are not reported.
 */
public class QueryCacheConfig {
	@FunctionalInterface
	public interface SettledHandler {
		void settled(Object data, Throwable error, QueryInfo<?, ?> query);
	}
	private BiConsumer<Object, QueryInfo<?, ?>> onSuccess = (data, query) -> {};
	public BiConsumer<Object, QueryInfo<?, ?>> onSuccess() {
		return onSuccess;
	}
	public QueryCacheConfig onSuccess(BiConsumer<Object, QueryInfo<?, ?>> onSuccess) {
		Objects.requireNonNull(onSuccess);
		this.onSuccess = onSuccess;
		return this;
	}
	private BiConsumer<Throwable, QueryInfo<?, ?>> onError = (error, query) -> {};
	public BiConsumer<Throwable, QueryInfo<?, ?>> onError() {
		return onError;
	}
	public QueryCacheConfig onError(BiConsumer<Throwable, QueryInfo<?, ?>> onError) {
		Objects.requireNonNull(onError);
		this.onError = onError;
		return this;
	}
	private SettledHandler onSettled = (data, error, query) -> {};
	public SettledHandler onSettled() {
		return onSettled;
	}
	public QueryCacheConfig onSettled(SettledHandler onSettled) {
		Objects.requireNonNull(onSettled);
		this.onSettled = onSettled;
		return this;
	}
}
