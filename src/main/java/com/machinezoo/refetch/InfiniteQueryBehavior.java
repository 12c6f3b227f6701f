// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;

/*
 * Fetch of one more page appends or prepends the page to cached pages, trimming the opposite end to maxPages.
 * Full refetch starts from the first cached page parameter and walks forward page by page,
 * so that the refetched data is consistent even if pages shifted on the server.
 */
class InfiniteQueryBehavior<V, T, P> implements QueryBehavior<V, InfiniteData<T, P>> {
	private final InfiniteQueryDescriptor<V, T, P> descriptor;
	InfiniteQueryBehavior(InfiniteQueryDescriptor<V, T, P> descriptor) {
		this.descriptor = descriptor;
	}
	@Override
	public CompletableFuture<InfiniteData<T, P>> fetch(FetchContext<V, InfiniteData<T, P>> context) {
		if (descriptor.pageFetcher() == null)
			return CompletableFuture.failedFuture(new IllegalStateException("Missing page fetch function for key " + descriptor.key() + "."));
		FetchDirection direction = context.fetchMeta() != null ? context.fetchMeta().direction() : null;
		InfiniteData<T, P> old = context.data() != null ? context.data() : InfiniteData.empty();
		Integer maxPages = context.options().maxPages();
		if (direction != null && !old.isEmpty()) {
			boolean backward = direction == FetchDirection.BACKWARD;
			P param = backward ? previousPageParam(descriptor, old) : nextPageParam(descriptor, old);
			return fetchPage(context, old, param, backward, maxPages);
		}
		int remaining = context.options().pages() != null ? context.options().pages() : old.pages().size();
		P first = !old.isEmpty() ? old.pageParams().get(0) : descriptor.initialPageParam();
		CompletableFuture<InfiniteData<T, P>> result = fetchPage(context, InfiniteData.empty(), first, false, maxPages);
		for (int i = 1; i < remaining; ++i)
			result = result.thenCompose(data -> fetchPage(context, data, nextPageParam(descriptor, data), false, maxPages));
		return result;
	}
	private CompletableFuture<InfiniteData<T, P>> fetchPage(FetchContext<V, InfiniteData<T, P>> context, InfiniteData<T, P> data, P param, boolean backward, Integer maxPages) {
		if (param == null && !data.isEmpty())
			return CompletableFuture.completedFuture(data);
		if (context.peekSignal().aborted())
			return CompletableFuture.failedFuture(new CancelledException());
		PageContext<V, T, P> page = new PageContext<>(context, param, backward ? FetchDirection.BACKWARD : FetchDirection.FORWARD);
		CompletableFuture<T> future;
		try {
			future = descriptor.pageFetcher().fetch(context.variables(), page);
		} catch (Throwable ex) {
			return CompletableFuture.failedFuture(ex);
		}
		return future.thenApply(fetched -> {
			List<T> pages = new ArrayList<>(data.pages());
			List<P> params = new ArrayList<>(data.pageParams());
			if (backward) {
				pages.add(0, fetched);
				params.add(0, param);
				if (maxPages != null && pages.size() > maxPages) {
					pages.remove(pages.size() - 1);
					params.remove(params.size() - 1);
				}
			} else {
				pages.add(fetched);
				params.add(param);
				if (maxPages != null && pages.size() > maxPages) {
					pages.remove(0);
					params.remove(0);
				}
			}
			return new InfiniteData<>(pages, params);
		});
	}
	static <T, P> P nextPageParam(InfiniteQueryDescriptor<?, T, P> descriptor, InfiniteData<T, P> data) {
		int last = data.pages().size() - 1;
		return descriptor.nextPageParam().apply(data.pages().get(last), data.pages(), data.pageParams().get(last), data.pageParams());
	}
	static <T, P> P previousPageParam(InfiniteQueryDescriptor<?, T, P> descriptor, InfiniteData<T, P> data) {
		if (descriptor.previousPageParam() == null)
			return null;
		return descriptor.previousPageParam().apply(data.pages().get(0), data.pages(), data.pageParams().get(0), data.pageParams());
	}
	static <T, P> boolean hasNextPage(InfiniteQueryDescriptor<?, T, P> descriptor, InfiniteData<T, P> data) {
		return data != null && !data.isEmpty() && nextPageParam(descriptor, data) != null;
	}
	static <T, P> boolean hasPreviousPage(InfiniteQueryDescriptor<?, T, P> descriptor, InfiniteData<T, P> data) {
		return data != null && !data.isEmpty() && previousPageParam(descriptor, data) != null;
	}
}
