// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Pages of an infinite resource together with parameters used to fetch them.
 * Both lists always have the same length. Instances are immutable.
 */
public class InfiniteData<T, P> {
	private final List<T> pages;
	private final List<P> pageParams;
	public InfiniteData(List<T> pages, List<P> pageParams) {
		Objects.requireNonNull(pages);
		Objects.requireNonNull(pageParams);
		if (pages.size() != pageParams.size())
			throw new IllegalArgumentException("Every page must have its page parameter.");
		this.pages = Collections.unmodifiableList(new ArrayList<>(pages));
		this.pageParams = Collections.unmodifiableList(new ArrayList<>(pageParams));
	}
	public static <T, P> InfiniteData<T, P> empty() {
		return new InfiniteData<>(Collections.emptyList(), Collections.emptyList());
	}
	public List<T> pages() {
		return pages;
	}
	public List<P> pageParams() {
		return pageParams;
	}
	public boolean isEmpty() {
		return pages.isEmpty();
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof InfiniteData))
			return false;
		InfiniteData<?, ?> other = (InfiniteData<?, ?>)obj;
		return pages.equals(other.pages) && pageParams.equals(other.pageParams);
	}
	@Override
	public int hashCode() {
		return Objects.hash(pages, pageParams);
	}
	@Override
	public String toString() {
		return "InfiniteData[pages=" + pages + ", pageParams=" + pageParams + "]";
	}
}
