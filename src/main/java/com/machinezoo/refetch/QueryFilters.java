// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.function.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Predicate over cached resources. All specified conditions must hold. Empty filters match everything.
 */
@StubDocs
public class QueryFilters {
	private QueryTypeFilter type;
	public QueryTypeFilter type() {
		return type;
	}
	public QueryFilters type(QueryTypeFilter type) {
		this.type = type;
		return this;
	}
	private QueryDescriptor<?, ?> descriptor;
	private Object variables;
	public QueryDescriptor<?, ?> descriptor() {
		return descriptor;
	}
	public Object variables() {
		return variables;
	}
	/**
	 * Matches resources of the descriptor. Without {@link #exact(Boolean)}, resources with any variables match.
	 */
	public QueryFilters descriptor(QueryDescriptor<?, ?> descriptor) {
		this.descriptor = descriptor;
		return this;
	}
	/**
	 * Matches resources of the descriptor whose variables contain given variables.
	 * With {@link #exact(Boolean)}, variables must be equal.
	 */
	public QueryFilters descriptor(QueryDescriptor<?, ?> descriptor, Object variables) {
		this.descriptor = descriptor;
		this.variables = variables;
		return this;
	}
	private Boolean exact;
	public Boolean exact() {
		return exact;
	}
	public QueryFilters exact(Boolean exact) {
		this.exact = exact;
		return this;
	}
	private Predicate<QueryInfo<?, ?>> predicate;
	public Predicate<QueryInfo<?, ?>> predicate() {
		return predicate;
	}
	public QueryFilters predicate(Predicate<QueryInfo<?, ?>> predicate) {
		this.predicate = predicate;
		return this;
	}
	private FetchStatus fetchStatus;
	public FetchStatus fetchStatus() {
		return fetchStatus;
	}
	public QueryFilters fetchStatus(FetchStatus fetchStatus) {
		this.fetchStatus = fetchStatus;
		return this;
	}
	private Boolean stale;
	public Boolean stale() {
		return stale;
	}
	public QueryFilters stale(Boolean stale) {
		this.stale = stale;
		return this;
	}
	public QueryFilters copy() {
		QueryFilters copy = new QueryFilters();
		copy.type = type;
		copy.descriptor = descriptor;
		copy.variables = variables;
		copy.exact = exact;
		copy.predicate = predicate;
		copy.fetchStatus = fetchStatus;
		copy.stale = stale;
		return copy;
	}
	public boolean matches(QueryInfo<?, ?> query) {
		if (descriptor != null) {
			if (Boolean.TRUE.equals(exact)) {
				if (!query.queryHash().equals(QueryKeys.hash(descriptor.key(), variables)))
					return false;
			} else if (!QueryKeys.partialMatch(query.fullKey(), QueryKeys.fullKey(descriptor.key(), variables)))
				return false;
		}
		if (type == QueryTypeFilter.ACTIVE && !query.isActive())
			return false;
		if (type == QueryTypeFilter.INACTIVE && query.isActive())
			return false;
		if (stale != null && stale != query.isStale())
			return false;
		if (fetchStatus != null && fetchStatus != query.state().fetchStatus())
			return false;
		if (predicate != null && !predicate.test(query))
			return false;
		return true;
	}
}
