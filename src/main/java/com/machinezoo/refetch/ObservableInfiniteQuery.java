// Part of Refetch
package com.machinezoo.refetch;

import java.util.concurrent.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Observer of paginated resource. Results additionally report availability of adjacent pages
 * and whether a page is currently being fetched in either direction.
 */
@StubDocs
public class ObservableInfiniteQuery<V, T, P, R> extends ObservableQuery<V, InfiniteData<T, P>, R> {
	public ObservableInfiniteQuery(QueryClient client, QueryOptions<V, InfiniteData<T, P>, R> options) {
		super(client, requireInfinite(options));
		OwnerTrace.of(this).alias("infinite");
	}
	private static <O extends QueryOptions<?, ?, ?>> O requireInfinite(O options) {
		if (!(options.descriptor() instanceof InfiniteQueryDescriptor))
			throw new IllegalArgumentException("Infinite observer requires InfiniteQueryDescriptor.");
		return options;
	}
	@Override
	public void setOptions(QueryOptions<V, InfiniteData<T, P>, R> next) {
		super.setOptions(requireInfinite(next));
	}
	@Override
	public InfiniteQueryResult<R> getCurrentResult() {
		return (InfiniteQueryResult<R>)super.getCurrentResult();
	}
	@Override
	public InfiniteQueryResult<R> trackResult(QueryResult<R> result) {
		return (InfiniteQueryResult<R>)super.trackResult(result);
	}
	public CompletableFuture<InfiniteQueryResult<R>> fetchNextPage(FetchOptions fetchOptions) {
		return fetch(fetchOptions.copy().meta(FetchMeta.more(FetchDirection.FORWARD))).thenApply(r -> (InfiniteQueryResult<R>)r);
	}
	public CompletableFuture<InfiniteQueryResult<R>> fetchNextPage() {
		return fetchNextPage(new FetchOptions());
	}
	public CompletableFuture<InfiniteQueryResult<R>> fetchPreviousPage(FetchOptions fetchOptions) {
		return fetch(fetchOptions.copy().meta(FetchMeta.more(FetchDirection.BACKWARD))).thenApply(r -> (InfiniteQueryResult<R>)r);
	}
	public CompletableFuture<InfiniteQueryResult<R>> fetchPreviousPage() {
		return fetchPreviousPage(new FetchOptions());
	}
	@Override
	QueryResultSnapshot<R> createResult(QueryInfo<V, InfiniteData<T, P>> target, QueryOptions<V, InfiniteData<T, P>, R> resolved, boolean optimistic) {
		QueryResultSnapshot<R> result = super.createResult(target, resolved, optimistic);
		@SuppressWarnings("unchecked")
		InfiniteQueryDescriptor<V, T, P> descriptor = (InfiniteQueryDescriptor<V, T, P>)resolved.descriptor();
		QueryInfoState<InfiniteData<T, P>> state = target.state();
		FetchDirection direction = state.fetchMeta() != null ? state.fetchMeta().direction() : null;
		boolean fetching = result.fetching();
		return result.withPages(
			InfiniteQueryBehavior.hasNextPage(descriptor, state.data()),
			InfiniteQueryBehavior.hasPreviousPage(descriptor, state.data()),
			fetching && direction == FetchDirection.FORWARD,
			fetching && direction == FetchDirection.BACKWARD);
	}
}
