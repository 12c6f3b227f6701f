// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Descriptor of paginated resources. Cached data is {@link InfiniteData} holding all fetched pages.
 * Pages are fetched one at a time by {@link PageFetcher} and parameters of adjacent pages
 * are derived from edge pages by page parameter functions.
 */
@StubDocs
public class InfiniteQueryDescriptor<V, T, P> extends QueryDescriptor<V, InfiniteData<T, P>> {
	private final PageFetcher<V, T, P> pageFetcher;
	private final P initialPageParam;
	private final PageParamFunction<T, P> nextPageParam;
	private PageParamFunction<T, P> previousPageParam;
	/**
	 * Creates new descriptor.
	 * 
	 * @param pageFetcher
	 *            page fetch function or {@code null} for resources that are only restored from snapshots
	 * @param initialPageParam
	 *            parameter of the first page, may be {@code null}
	 * @param nextPageParam
	 *            derives parameter of the next page from the last page
	 */
	public InfiniteQueryDescriptor(String key, PageFetcher<V, T, P> pageFetcher, P initialPageParam, PageParamFunction<T, P> nextPageParam) {
		super(key, null);
		Objects.requireNonNull(nextPageParam);
		this.pageFetcher = pageFetcher;
		this.initialPageParam = initialPageParam;
		this.nextPageParam = nextPageParam;
	}
	public InfiniteQueryDescriptor(PageFetcher<V, T, P> pageFetcher, P initialPageParam, PageParamFunction<T, P> nextPageParam) {
		this(QueryKeys.generate(), pageFetcher, initialPageParam, nextPageParam);
	}
	public PageFetcher<V, T, P> pageFetcher() {
		return pageFetcher;
	}
	public P initialPageParam() {
		return initialPageParam;
	}
	public PageParamFunction<T, P> nextPageParam() {
		return nextPageParam;
	}
	public PageParamFunction<T, P> previousPageParam() {
		return previousPageParam;
	}
	/**
	 * Enables fetching of previous pages.
	 */
	public InfiniteQueryDescriptor<V, T, P> previousPageParam(PageParamFunction<T, P> previousPageParam) {
		this.previousPageParam = previousPageParam;
		return this;
	}
	@Override
	public InfiniteQueryDescriptor<V, T, P> defaults(QueryDefaults defaults) {
		super.defaults(defaults);
		return this;
	}
	@Override
	public boolean infinite() {
		return true;
	}
	@Override
	public QueryBehavior<V, InfiniteData<T, P>> behavior() {
		return new InfiniteQueryBehavior<>(this);
	}
	@Override
	public String toString() {
		return "InfiniteQueryDescriptor[" + key() + "]";
	}
}
