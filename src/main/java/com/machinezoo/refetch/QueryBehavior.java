// Part of Refetch
package com.machinezoo.refetch;

import java.util.concurrent.*;

/**
 * Fetch pipeline of a resource. Plain resources just call their {@link QueryFetcher}.
 * Infinite queries assemble their data from several page fetches.
 */
@FunctionalInterface
public interface QueryBehavior<V, D> {
	CompletableFuture<D> fetch(FetchContext<V, D> context);
}
