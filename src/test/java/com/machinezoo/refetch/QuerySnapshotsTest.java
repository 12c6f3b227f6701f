// Part of Refetch
package com.machinezoo.refetch;

import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import com.fasterxml.jackson.databind.*;
import com.machinezoo.refetch.util.*;

public class QuerySnapshotsTest extends TestBase {
	private final QueryDescriptor<Map<String, Object>, List<String>> todos = new QueryDescriptor<>("todos", (v, c) -> CompletableFuture.completedFuture(Arrays.asList("fetched")));
	private final Map<String, Object> page = Collections.singletonMap("page", 1);
	private DehydratedState snapshot(QueryInfoState<Object> state) {
		return new DehydratedState(Arrays.asList(new DehydratedQuery("todos", false, QueryKeys.hash("todos", page), state, page, null)));
	}
	@Test
	public void roundTrip() {
		QueryClient source = client();
		source.setQueryData(todos, page, Arrays.asList("a", "b"));
		long updatedAt = source.getQueryState(todos, page).dataUpdatedAt();
		String json = QuerySnapshots.dehydrate(source).toJson();
		QueryClient target = client();
		QuerySnapshots.hydrate(target, DehydratedState.fromJson(json));
		assertEquals(Arrays.asList("a", "b"), target.getQueryData(todos, page));
		QueryInfoState<List<String>> state = target.getQueryState(todos, page);
		assertEquals(updatedAt, state.dataUpdatedAt());
		assertEquals(QueryStatus.SUCCESS, state.status());
		assertEquals(FetchStatus.IDLE, state.fetchStatus());
	}
	@Test
	public void format() {
		QueryClient source = client();
		source.setQueryData(todos, page, Arrays.asList("a"));
		JsonNode tree = QuerySnapshots.dehydrate(source).toTree();
		JsonNode query = tree.path("queries").get(0);
		assertEquals("todos", query.path("descriptor").path("key").asText());
		assertFalse(query.path("descriptor").has("infinite"));
		assertEquals(QueryKeys.hash("todos", page), query.path("queryHash").asText());
		assertEquals(1, query.path("variables").path("page").asInt());
		assertEquals("a", query.path("state").path("data").get(0).asText());
		assertEquals("SUCCESS", query.path("state").path("status").asText());
		assertFalse(query.has("meta"));
	}
	@Test
	public void successOnly() {
		QueryClient source = client();
		QueryDescriptor<Void, String> broken = new QueryDescriptor<>("broken", (v, c) -> CompletableFuture.failedFuture(new IllegalStateException()));
		source.prefetchQuery(QueryOptions.of(broken)).join();
		source.setQueryData(todos, page, Arrays.asList("a"));
		// Failed resource is left out.
		assertEquals(1, QuerySnapshots.dehydrate(source).queries().size());
		// Unless the filter says otherwise.
		assertEquals(2, QuerySnapshots.dehydrate(source, q -> true).queries().size());
	}
	@Test
	public void generatedKeys() {
		QueryClient source = client();
		QueryDescriptor<Void, String> anonymous = new QueryDescriptor<>((v, c) -> CompletableFuture.completedFuture("x"));
		source.setQueryData(anonymous, null, "x");
		// Generated keys are not stable across processes.
		assertTrue(QuerySnapshots.dehydrate(source, q -> true).queries().isEmpty());
	}
	@Test
	public void forceIdle() {
		QueryClient target = client();
		QuerySnapshots.hydrate(target, snapshot(QueryInfoState.of(Arrays.asList("a"), 100, null, 0, null, false, QueryStatus.SUCCESS, FetchStatus.FETCHING)));
		// Fetch in progress at dehydration is not carried over.
		assertEquals(FetchStatus.IDLE, target.getQueryState(todos, page).fetchStatus());
		assertEquals(Arrays.asList("a"), target.getQueryData(todos, page));
	}
	@Test
	public void newerWins() {
		QueryClient target = client();
		target.setQueryData(todos, page, Arrays.asList("live"));
		QuerySnapshots.hydrate(target, snapshot(QueryInfoState.of(Arrays.asList("old"), 100, null, 0, null, false, QueryStatus.SUCCESS, FetchStatus.IDLE)));
		// Live data is newer.
		assertEquals(Arrays.asList("live"), target.getQueryData(todos, page));
		target.setQueryData(QueryOptions.of(todos, page), previous -> Arrays.asList("older"), new SetDataOptions().updatedAt(50L));
		QuerySnapshots.hydrate(target, snapshot(QueryInfoState.of(Arrays.asList("old"), 100, null, 0, null, false, QueryStatus.SUCCESS, FetchStatus.IDLE)));
		// Snapshot is newer.
		assertEquals(Arrays.asList("old"), target.getQueryData(todos, page));
	}
	@Test
	public void hydratedObserver() {
		QueryClient target = client();
		QuerySnapshots.hydrate(target, snapshot(QueryInfoState.of(Arrays.asList("a"), System.currentTimeMillis(), null, 0, null, false, QueryStatus.SUCCESS, FetchStatus.IDLE)));
		ObservableQuery<Map<String, Object>, List<String>, List<String>> observer = target.watchQuery(QueryOptions.of(todos, page).staleTime(Duration.ofMinutes(1)));
		observer.subscribe(r -> {});
		// Fresh restored data is used without fetching.
		assertEquals(Arrays.asList("a"), observer.getCurrentResult().data());
		// Refetch uses the observer's fetch function.
		assertEquals(Arrays.asList("fetched"), observer.refetch().join().data());
	}
	@Test
	public void infinite() {
		InfiniteQueryDescriptor<Void, String, Integer> feed = new InfiniteQueryDescriptor<Void, String, Integer>(
			"feed",
			(v, c) -> CompletableFuture.completedFuture("page" + c.pageParam()),
			1,
			(p, pages, param, params) -> param + 1);
		QueryClient source = client();
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = source.watchInfiniteQuery(QueryOptions.of(feed));
		observer.subscribe(r -> {});
		observer.fetchNextPage().join();
		DehydratedState snapshot = DehydratedState.fromJson(QuerySnapshots.dehydrate(source).toJson());
		assertTrue(snapshot.queries().get(0).infinite());
		QueryClient target = client();
		QuerySnapshots.hydrate(target, snapshot);
		InfiniteData<String, Integer> data = target.getQueryData(feed, null);
		assertEquals(Arrays.asList("page1", "page2"), data.pages());
		assertEquals(Arrays.asList(1, 2), data.pageParams());
	}
}
