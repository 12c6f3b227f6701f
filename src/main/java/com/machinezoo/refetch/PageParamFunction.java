// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Computes parameter of the page adjacent to the given edge page.
 * Returning {@code null} indicates there are no more pages in that direction.
 */
@FunctionalInterface
public interface PageParamFunction<T, P> {
	P apply(T page, List<T> pages, P pageParam, List<P> pageParams);
}
