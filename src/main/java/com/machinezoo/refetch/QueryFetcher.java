// Part of Refetch
package com.machinezoo.refetch;

import java.util.concurrent.*;

/**
 * Caller-supplied asynchronous function producing data of one resource.
 * Completing with {@code null} is an error. See {@link UndefinedDataException}.
 */
@FunctionalInterface
public interface QueryFetcher<V, D> {
	CompletableFuture<D> fetch(V variables, FetchContext<V, D> context);
}
