// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Definition of a family of resources sharing one key and one fetch function.
 * Individual resources are distinguished by variables passed in {@link QueryOptions}.
 */
@StubDocs
public class QueryDescriptor<V, D> {
	private final String key;
	private final QueryFetcher<V, D> fetcher;
	/**
	 * Creates new descriptor.
	 * 
	 * @param key
	 *            identity of the resource family
	 * @param fetcher
	 *            fetch function or {@code null} for resources that are only written via {@link QueryClient#setQueryData(QueryDescriptor, Object, Object)}
	 */
	public QueryDescriptor(String key, QueryFetcher<V, D> fetcher) {
		Objects.requireNonNull(key);
		this.key = key;
		this.fetcher = fetcher;
	}
	/**
	 * Creates descriptor with generated key. Resources with generated keys are never included in snapshots.
	 */
	public QueryDescriptor(QueryFetcher<V, D> fetcher) {
		this(QueryKeys.generate(), fetcher);
	}
	public String key() {
		return key;
	}
	public boolean generated() {
		return QueryKeys.generated(key);
	}
	public QueryFetcher<V, D> fetcher() {
		return fetcher;
	}
	private QueryDefaults defaults = new QueryDefaults();
	/**
	 * Defaults of this descriptor. They take precedence over client defaults but not over options at call site.
	 */
	public QueryDefaults defaults() {
		return defaults;
	}
	public QueryDescriptor<V, D> defaults(QueryDefaults defaults) {
		Objects.requireNonNull(defaults);
		this.defaults = defaults;
		return this;
	}
	public boolean infinite() {
		return false;
	}
	public QueryBehavior<V, D> behavior() {
		return context -> {
			if (fetcher == null)
				return CompletableFuture.failedFuture(new IllegalStateException("Missing fetch function for key " + key + "."));
			return fetcher.fetch(context.variables(), context);
		};
	}
	@Override
	public String toString() {
		return "QueryDescriptor[" + key + "]";
	}
}
