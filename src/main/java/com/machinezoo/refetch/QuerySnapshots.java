// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Transfer of cached resources between clients, typically from a short-lived server-side client to a long-lived one.
 */
@StubDocs
public class QuerySnapshots {
	/**
	 * Includes successfully fetched resources.
	 */
	public static boolean shouldDehydrate(QueryInfo<?, ?> query) {
		return query.state().status() == QueryStatus.SUCCESS;
	}
	public static DehydratedState dehydrate(QueryClient client) {
		return dehydrate(client, QuerySnapshots::shouldDehydrate);
	}
	/**
	 * Captures matching resources. Resources with generated keys are always skipped,
	 * because generated keys are not stable across processes.
	 */
	public static DehydratedState dehydrate(QueryClient client, Predicate<QueryInfo<?, ?>> filter) {
		Objects.requireNonNull(client);
		Objects.requireNonNull(filter);
		List<DehydratedQuery> queries = new ArrayList<>();
		synchronized (client.env().lock) {
			for (QueryInfo<?, ?> query : client.queryCache().all())
				if (!query.descriptor().generated() && filter.test(query))
					queries.add(DehydratedQuery.of(query));
		}
		return new DehydratedState(queries);
	}
	public static void hydrate(QueryClient client, DehydratedState snapshot) {
		hydrate(client, snapshot, new QueryDefaults());
	}
	/**
	 * Restores resources from the snapshot. Restored resources are always idle.
	 * Existing resources are overwritten only if the snapshot has newer data.
	 * 
	 * @param defaults
	 *            settings of restored resources until some observer supplies its own options
	 */
	public static void hydrate(QueryClient client, DehydratedState snapshot, QueryDefaults defaults) {
		Objects.requireNonNull(client);
		Objects.requireNonNull(snapshot);
		Objects.requireNonNull(defaults);
		QueryCache cache = client.queryCache();
		synchronized (client.env().lock) {
			for (DehydratedQuery query : snapshot.queries()) {
				QueryInfoState<Object> state = query.state().withFetchStatus(FetchStatus.IDLE);
				QueryInfo<Object, Object> existing = cache.get(query.queryHash());
				if (existing != null) {
					if (existing.state().dataUpdatedAt() < state.dataUpdatedAt())
						existing.setState(state);
					continue;
				}
				cache.build(client.defaultQueryOptions(options(query, defaults)), state);
			}
		}
	}
	@SuppressWarnings("unchecked")
	private static QueryOptions<Object, Object, Object> options(DehydratedQuery query, QueryDefaults defaults) {
		QueryDescriptor<Object, Object> descriptor;
		if (query.infinite())
			descriptor = (QueryDescriptor<Object, Object>)(QueryDescriptor<?, ?>)new InfiniteQueryDescriptor<Object, Object, Object>(query.key(), null, null, (page, pages, param, params) -> null);
		else
			descriptor = new QueryDescriptor<>(query.key(), null);
		descriptor.defaults(defaults.copy());
		return QueryOptions.of(descriptor, query.variables())
			.queryHash(query.queryHash())
			.meta(query.meta());
	}
}
