// Part of Refetch
package com.machinezoo.refetch;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class QueryCacheTest extends TestBase {
	private final QueryClient client = client();
	private final QueryCache cache = client.queryCache();
	private final QueryDescriptor<Map<String, Object>, String> todos = new QueryDescriptor<>("todos", (v, c) -> CompletableFuture.completedFuture("todos " + v));
	private final QueryDescriptor<Void, String> user = new QueryDescriptor<>("user", (v, c) -> CompletableFuture.completedFuture("joe"));
	private static Map<String, Object> filter(String status, int page) {
		Map<String, Object> map = new HashMap<>();
		map.put("status", status);
		map.put("page", page);
		return map;
	}
	private <V> QueryInfo<V, String> build(QueryDescriptor<V, String> descriptor, V variables) {
		return cache.build(client.defaultQueryOptions(QueryOptions.of(descriptor, variables)));
	}
	@Test
	public void build() {
		QueryInfo<Map<String, Object>, String> a = build(todos, filter("done", 1));
		// Same hash returns the same entry.
		assertSame(a, build(todos, filter("done", 1)));
		assertNotSame(a, build(todos, filter("done", 2)));
		assertEquals(2, cache.all().size());
		assertSame(a, cache.get(a.queryHash()));
	}
	@Test
	public void events() {
		List<QueryCacheEvent.Type> events = new ArrayList<>();
		try (CloseableScope subscription = cache.subscribe(e -> events.add(e.type()))) {
			QueryInfo<Void, String> query = build(user, null);
			query.setData("joe", new SetDataOptions());
			cache.remove(query);
			assertEquals(Arrays.asList(QueryCacheEvent.Type.ADDED, QueryCacheEvent.Type.UPDATED, QueryCacheEvent.Type.REMOVED), events);
			assertNull(cache.get(query.queryHash()));
		}
		// No events after unsubscribing.
		build(user, null);
		assertEquals(3, events.size());
	}
	@Test
	public void filteredEvents() {
		List<QueryInfo<?, ?>> seen = new ArrayList<>();
		cache.subscribe(new QueryFilters().descriptor(user), e -> seen.add(e.query()));
		build(todos, filter("done", 1));
		QueryInfo<Void, String> query = build(user, null);
		assertEquals(Arrays.asList(query), seen);
	}
	@Test
	public void findAll() {
		QueryInfo<Map<String, Object>, String> done1 = build(todos, filter("done", 1));
		QueryInfo<Map<String, Object>, String> done2 = build(todos, filter("done", 2));
		QueryInfo<Map<String, Object>, String> open1 = build(todos, filter("open", 1));
		QueryInfo<Void, String> joe = build(user, null);
		// Key alone matches all variables.
		assertEquals(Arrays.asList(done1, done2, open1), cache.findAll(new QueryFilters().descriptor(todos)));
		// Partial variables.
		assertEquals(Arrays.asList(done1, done2), cache.findAll(new QueryFilters().descriptor(todos, Collections.singletonMap("status", "done"))));
		// Exact match.
		assertEquals(Arrays.asList(done2), cache.findAll(new QueryFilters().descriptor(todos, filter("done", 2)).exact(true)));
		assertEquals(Collections.emptyList(), cache.findAll(new QueryFilters().descriptor(todos, Collections.singletonMap("status", "done")).exact(true)));
		// Predicate.
		assertEquals(Arrays.asList(joe), cache.findAll(new QueryFilters().predicate(q -> q.descriptor() == user)));
		assertEquals(4, cache.findAll().size());
	}
	@Test
	public void find() {
		build(todos, filter("done", 1));
		// Find is exact by default.
		assertFalse(cache.find(new QueryFilters().descriptor(todos)).isPresent());
		assertTrue(cache.find(new QueryFilters().descriptor(todos).exact(false)).isPresent());
		assertTrue(cache.find(new QueryFilters().descriptor(todos, filter("done", 1))).isPresent());
	}
	@Test
	public void status() {
		QueryInfo<Void, String> joe = build(user, null);
		QueryInfo<Map<String, Object>, String> done = build(todos, filter("done", 1));
		done.setData("x", new SetDataOptions());
		done.invalidate();
		joe.setData("joe", new SetDataOptions());
		// Unobserved resource is stale only when invalidated or empty.
		assertEquals(Arrays.asList(done), cache.findAll(new QueryFilters().stale(true)));
		assertEquals(Collections.emptyList(), cache.findAll(new QueryFilters().fetchStatus(FetchStatus.FETCHING)));
		// Nothing is observed, so everything is inactive.
		assertEquals(Collections.emptyList(), cache.findAll(new QueryFilters().type(QueryTypeFilter.ACTIVE)));
		assertEquals(2, cache.findAll(new QueryFilters().type(QueryTypeFilter.INACTIVE)).size());
	}
	@Test
	public void clear() {
		build(todos, filter("done", 1));
		build(user, null);
		cache.clear();
		assertTrue(cache.all().isEmpty());
	}
}
