// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Construction parameters of {@link QueryClient}.
 */
public class QueryClientConfig {
	private QueryEnvironment env;
	/**
	 * Environment shared by the client and its caches. New default environment is created if none is given.
	 */
	public QueryEnvironment env() {
		return env;
	}
	public QueryClientConfig env(QueryEnvironment env) {
		this.env = env;
		return this;
	}
	private QueryDefaults queries = new QueryDefaults();
	public QueryDefaults queries() {
		return queries;
	}
	public QueryClientConfig queries(QueryDefaults queries) {
		Objects.requireNonNull(queries);
		this.queries = queries;
		return this;
	}
	private QueryDefaults mutations = new QueryDefaults();
	/**
	 * Client-wide mutation defaults. Only retry, network mode, and GC settings apply to mutations.
	 */
	public QueryDefaults mutations() {
		return mutations;
	}
	public QueryClientConfig mutations(QueryDefaults mutations) {
		Objects.requireNonNull(mutations);
		this.mutations = mutations;
		return this;
	}
	private QueryCacheConfig queryCache = new QueryCacheConfig();
	public QueryCacheConfig queryCache() {
		return queryCache;
	}
	public QueryClientConfig queryCache(QueryCacheConfig queryCache) {
		Objects.requireNonNull(queryCache);
		this.queryCache = queryCache;
		return this;
	}
	private MutationCacheConfig mutationCache = new MutationCacheConfig();
	public MutationCacheConfig mutationCache() {
		return mutationCache;
	}
	public QueryClientConfig mutationCache(MutationCacheConfig mutationCache) {
		Objects.requireNonNull(mutationCache);
		this.mutationCache = mutationCache;
		return this;
	}
}
