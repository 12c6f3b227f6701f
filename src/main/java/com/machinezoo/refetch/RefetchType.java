// Part of Refetch
package com.machinezoo.refetch;

/**
 * Which invalidated resources are refetched by {@link QueryClient#invalidateQueries(QueryFilters, RefetchType, FetchOptions)}.
 */
public enum RefetchType {
	ACTIVE,
	INACTIVE,
	ALL,
	NONE;
	QueryTypeFilter filter() {
		switch (this) {
		case ACTIVE:
			return QueryTypeFilter.ACTIVE;
		case INACTIVE:
			return QueryTypeFilter.INACTIVE;
		default:
			return QueryTypeFilter.ALL;
		}
	}
}
