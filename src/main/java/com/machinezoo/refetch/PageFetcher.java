// Part of Refetch
package com.machinezoo.refetch;

import java.util.concurrent.*;

/**
 * Fetch function of infinite resources. It fetches one page at a time.
 */
@FunctionalInterface
public interface PageFetcher<V, T, P> {
	CompletableFuture<T> fetch(V variables, PageContext<V, T, P> context);
}
