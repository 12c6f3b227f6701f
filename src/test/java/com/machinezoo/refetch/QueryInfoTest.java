// Part of Refetch
package com.machinezoo.refetch;

import static org.awaitility.Awaitility.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.time.*;
import org.junit.jupiter.api.*;

public class QueryInfoTest extends TestBase {
	private final QueryClient client = client();
	private final ManualFetcher<Void, String> fetcher = new ManualFetcher<>();
	private final QueryDescriptor<Void, String> descriptor = new QueryDescriptor<>("greeting", fetcher);
	private QueryInfo<Void, String> build(QueryOptions<Void, String, String> options) {
		return client.queryCache().build(client.defaultQueryOptions(options));
	}
	private QueryInfo<Void, String> build() {
		return build(QueryOptions.of(descriptor));
	}
	@Test
	public void fetch() {
		QueryInfo<Void, String> query = build();
		// Initial state.
		assertEquals(QueryStatus.PENDING, query.state().status());
		assertNull(query.promise());
		CompletableFuture<String> future = query.fetch();
		assertEquals(FetchStatus.FETCHING, query.state().fetchStatus());
		fetcher.last().complete("hello");
		assertEquals("hello", future.join());
		assertEquals(QueryStatus.SUCCESS, query.state().status());
		assertEquals(FetchStatus.IDLE, query.state().fetchStatus());
		assertEquals("hello", query.state().data());
		assertTrue(query.state().dataUpdatedAt() > 0);
	}
	@Test
	public void dedup() {
		QueryInfo<Void, String> query = build();
		CompletableFuture<String> a = query.fetch();
		CompletableFuture<String> b = query.fetch();
		// Concurrent fetches share one call.
		assertSame(a, b);
		assertEquals(1, fetcher.calls.size());
		fetcher.last().complete("hello");
		assertEquals("hello", b.join());
	}
	@Test
	public void cancelRefetch() {
		QueryInfo<Void, String> query = build();
		query.fetch();
		fetcher.last().complete("a");
		CompletableFuture<String> first = query.fetch();
		// Resource with data is refetched from scratch when requested.
		CompletableFuture<String> second = query.fetch(null, new FetchOptions().cancelRefetch(true));
		assertNotSame(first, second);
		assertEquals(3, fetcher.calls.size());
		assertTrue(first.isCompletedExceptionally());
		fetcher.pending.get(1).complete("stale");
		fetcher.pending.get(2).complete("fresh");
		assertEquals("fresh", second.join());
		assertEquals("fresh", query.state().data());
		assertEquals(QueryStatus.SUCCESS, query.state().status());
	}
	@Test
	public void cancelRevert() {
		QueryInfo<Void, String> query = build();
		query.fetch();
		fetcher.last().complete("a");
		QueryInfoState<String> before = query.state();
		CompletableFuture<String> future = query.fetch();
		assertEquals(FetchStatus.FETCHING, query.state().fetchStatus());
		CompletableFuture<Void> cancelled = query.cancel(new CancelOptions().revert(true));
		// Cancellation waits for nothing and never fails.
		assertNull(cancelled.join());
		CompletionException ex = assertThrows(CompletionException.class, future::join);
		assertTrue(ex.getCause() instanceof CancelledException);
		// State is back where it was before the fetch.
		assertSame(before, query.state());
		// Late result is ignored.
		fetcher.last().complete("late");
		assertEquals("a", query.state().data());
	}
	@Test
	public void cancelWithoutRevert() {
		QueryInfo<Void, String> query = build();
		query.fetch();
		query.cancel(new CancelOptions()).join();
		assertEquals(QueryStatus.ERROR, query.state().status());
		assertTrue(query.state().error() instanceof CancelledException);
	}
	@Test
	public void unsubscribeAbortsSignalAwareFetch() {
		QueryDescriptor<Void, String> aware = new QueryDescriptor<Void, String>("aware", (variables, context) -> {
			context.signal();
			return fetcher.fetch(variables, context);
		});
		client.setQueryData(aware, null, "a");
		ObservableQuery<Void, String, String> observer = client.watchQuery(QueryOptions.of(aware));
		CloseableScope subscription = observer.subscribe(r -> {});
		QueryInfo<Void, String> query = observer.query();
		CompletableFuture<String> promise = query.promise();
		assertEquals(FetchStatus.FETCHING, query.state().fetchStatus());
		// Last observer leaves while the fetch is in flight.
		subscription.close();
		CompletionException ex = assertThrows(CompletionException.class, promise::join);
		assertTrue(ex.getCause() instanceof CancelledException);
		// State rolls back to what it was before the fetch.
		assertEquals("a", query.state().data());
		assertEquals(QueryStatus.SUCCESS, query.state().status());
		assertEquals(FetchStatus.IDLE, query.state().fetchStatus());
		assertNull(query.state().error());
		fetcher.last().complete("late");
		assertEquals("a", query.state().data());
	}
	@Test
	public void unsubscribeLetsFetchFinish() {
		ObservableQuery<Void, String, String> observer = client.watchQuery(QueryOptions.of(descriptor));
		CloseableScope subscription = observer.subscribe(r -> {});
		QueryInfo<Void, String> query = observer.query();
		CompletableFuture<String> promise = query.promise();
		subscription.close();
		// Fetch that ignores its signal keeps running.
		assertFalse(promise.isDone());
		assertEquals(FetchStatus.FETCHING, query.state().fetchStatus());
		fetcher.last().complete("hello");
		assertEquals("hello", promise.join());
		assertEquals("hello", query.state().data());
	}
	@Test
	public void unsubscribeStopsRetries() {
		ObservableQuery<Void, String, String> observer = client.watchQuery(QueryOptions.of(descriptor)
			.retry(RetryPolicy.count(3))
			.retryDelay(RetryDelay.fixed(Duration.ofMillis(1))));
		CloseableScope subscription = observer.subscribe(r -> {});
		QueryInfo<Void, String> query = observer.query();
		CompletableFuture<String> promise = query.promise();
		subscription.close();
		fetcher.last().completeExceptionally(new IllegalStateException("broken"));
		CompletionException ex = assertThrows(CompletionException.class, promise::join);
		assertEquals("broken", ex.getCause().getMessage());
		settle();
		// No retries after the last observer left.
		assertEquals(1, fetcher.calls.size());
		assertEquals(QueryStatus.ERROR, query.state().status());
	}
	@Test
	public void undefinedData() {
		QueryInfo<Void, String> query = build();
		CompletableFuture<String> future = query.fetch();
		fetcher.last().complete(null);
		CompletionException ex = assertThrows(CompletionException.class, future::join);
		assertTrue(ex.getCause() instanceof UndefinedDataException);
		assertEquals(QueryStatus.ERROR, query.state().status());
		assertTrue(query.state().error() instanceof UndefinedDataException);
	}
	@Test
	public void failure() {
		QueryInfo<Void, String> query = build();
		CompletableFuture<String> future = query.fetch();
		fetcher.last().completeExceptionally(new IllegalStateException("broken"));
		CompletionException ex = assertThrows(CompletionException.class, future::join);
		assertEquals("broken", ex.getCause().getMessage());
		assertEquals(QueryStatus.ERROR, query.state().status());
		assertEquals("broken", query.state().error().getMessage());
		assertTrue(query.state().errorUpdatedAt() > 0);
	}
	@Test
	public void invalidate() {
		QueryInfo<Void, String> query = build();
		AtomicInteger updates = new AtomicInteger();
		client.queryCache().subscribe(e -> {
			if (e.type() == QueryCacheEvent.Type.UPDATED)
				updates.incrementAndGet();
		});
		query.invalidate();
		assertTrue(query.state().invalidated());
		assertEquals(1, updates.get());
		// Already invalidated resource is left alone.
		query.invalidate();
		assertEquals(1, updates.get());
	}
	@Test
	public void setData() {
		QueryInfo<Void, String> query = build();
		assertEquals("hello", query.setData("hello", new SetDataOptions().updatedAt(1234L)));
		assertEquals("hello", query.state().data());
		assertEquals(1234, query.state().dataUpdatedAt());
		assertEquals(QueryStatus.SUCCESS, query.state().status());
	}
	@Test
	public void staleByTime() {
		QueryInfo<Void, String> query = build();
		// Resource without data is always stale.
		assertTrue(query.isStaleByTime(Duration.ofMinutes(1)));
		query.setData("hello", new SetDataOptions());
		assertFalse(query.isStaleByTime(Duration.ofMinutes(1)));
		assertFalse(query.isStaleByTime(Timeouts.INFINITE));
		// Zero stale time means stale immediately.
		assertTrue(query.isStaleByTime(Duration.ZERO));
		// Invalidation overrides stale time.
		query.invalidate();
		assertTrue(query.isStaleByTime(Timeouts.INFINITE));
	}
	@Test
	public void initialData() {
		QueryInfo<Void, String> query = build(QueryOptions.of(descriptor).initialData("seed").initialDataUpdatedAt(100L));
		assertEquals("seed", query.state().data());
		assertEquals(100, query.state().dataUpdatedAt());
		query.setData("hello", new SetDataOptions());
		// Reset returns to initial data.
		query.reset();
		assertEquals("seed", query.state().data());
	}
	@Test
	public void gc() {
		QueryInfo<Void, String> query = build(QueryOptions.of(descriptor).gcTime(Duration.ofMillis(10)));
		// Unobserved idle resource is evicted after GC time.
		await().until(() -> client.queryCache().get(query.queryHash()) == null);
	}
	@Test
	public void gcWhileFetching() {
		QueryInfo<Void, String> query = build(QueryOptions.of(descriptor).gcTime(Duration.ofMillis(10)));
		query.fetch();
		// Running fetch keeps the resource alive.
		sleep(100);
		assertSame(query, client.queryCache().get(query.queryHash()));
		// Timer starts again when the fetch settles.
		fetcher.last().complete("hello");
		await().until(() -> client.queryCache().get(query.queryHash()) == null);
	}
	@Test
	public void gcTimeGrows() {
		QueryInfo<Void, String> query = build(QueryOptions.of(descriptor).gcTime(Duration.ofMinutes(10)));
		query.setOptions(client.defaultQueryOptions(QueryOptions.of(descriptor).gcTime(Duration.ofMinutes(1))));
		assertEquals(Duration.ofMinutes(10), query.gcTime());
	}
}
