// Part of Refetch
package com.machinezoo.refetch;

import java.util.concurrent.*;

@FunctionalInterface
public interface MutationFunction<V, D> {
	CompletableFuture<D> mutate(V variables, MutationContext context);
}
