// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Information passed to {@link PageFetcher} along with variables.
 */
public class PageContext<V, T, P> {
	private final FetchContext<V, InfiniteData<T, P>> context;
	private final P pageParam;
	private final FetchDirection direction;
	PageContext(FetchContext<V, InfiniteData<T, P>> context, P pageParam, FetchDirection direction) {
		this.context = context;
		this.pageParam = pageParam;
		this.direction = direction;
	}
	public String key() {
		return context.key();
	}
	public String queryHash() {
		return context.queryHash();
	}
	public P pageParam() {
		return pageParam;
	}
	/**
	 * Direction in which the page is fetched. Pages of full refetch are fetched forward.
	 */
	public FetchDirection direction() {
		return direction;
	}
	public Map<String, Object> meta() {
		return context.meta();
	}
	/**
	 * Abort signal shared by all pages of the fetch. Reading it has the same effect as {@link FetchContext#signal()}.
	 */
	public AbortSignal signal() {
		return context.signal();
	}
}
