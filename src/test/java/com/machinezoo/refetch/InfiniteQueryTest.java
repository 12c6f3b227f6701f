// Part of Refetch
package com.machinezoo.refetch;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class InfiniteQueryTest extends TestBase {
	private final QueryClient client = client();
	private final List<Integer> fetched = new CopyOnWriteArrayList<>();
	private final InfiniteQueryDescriptor<Void, String, Integer> descriptor = new InfiniteQueryDescriptor<Void, String, Integer>(
		"pages",
		(v, c) -> {
			fetched.add(c.pageParam());
			return CompletableFuture.completedFuture("page" + c.pageParam());
		},
		1,
		(page, pages, param, params) -> param < 3 ? param + 1 : null)
		.previousPageParam((page, pages, param, params) -> param > 1 ? param - 1 : null);
	private ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> watch(QueryOptions<Void, InfiniteData<String, Integer>, InfiniteData<String, Integer>> options) {
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = client.watchInfiniteQuery(options);
		observer.subscribe(r -> {});
		return observer;
	}
	@Test
	public void forward() {
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = watch(QueryOptions.of(descriptor));
		// First page is fetched on mount.
		InfiniteQueryResult<InfiniteData<String, Integer>> result = observer.getCurrentResult();
		assertEquals(Arrays.asList("page1"), result.data().pages());
		assertEquals(Arrays.asList(1), result.data().pageParams());
		assertTrue(result.hasNextPage());
		assertFalse(result.hasPreviousPage());
		observer.fetchNextPage().join();
		result = observer.fetchNextPage().join();
		assertEquals(Arrays.asList("page1", "page2", "page3"), result.data().pages());
		assertFalse(result.hasNextPage());
		assertFalse(result.fetchingNextPage());
		// No more pages, nothing is fetched.
		result = observer.fetchNextPage().join();
		assertEquals(3, result.data().pages().size());
		assertEquals(Arrays.asList(1, 2, 3), fetched);
	}
	@Test
	public void watchQuery() {
		// Generic entry point recognizes paginated resources.
		ObservableQuery<Void, InfiniteData<String, Integer>, InfiniteData<String, Integer>> observer = client.watchQuery(QueryOptions.of(descriptor));
		assertTrue(observer instanceof ObservableInfiniteQuery);
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> paged = (ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>>)observer;
		paged.subscribe(r -> {});
		InfiniteQueryResult<InfiniteData<String, Integer>> tracked = paged.trackResult(paged.getCurrentResult());
		assertTrue(tracked.hasNextPage());
		assertTrue(paged.trackedFields().contains(QueryResultField.HAS_NEXT_PAGE));
	}
	@Test
	public void refetchAll() {
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = watch(QueryOptions.of(descriptor));
		observer.fetchNextPage().join();
		InfiniteData<String, Integer> before = observer.getCurrentResult().data();
		fetched.clear();
		// Refetch walks all cached pages from the first one.
		observer.refetch().join();
		assertEquals(Arrays.asList(1, 2), fetched);
		// Unchanged pages keep their identity.
		assertSame(before, observer.getCurrentResult().data());
	}
	@Test
	public void backward() {
		InfiniteQueryDescriptor<Void, String, Integer> middle = new InfiniteQueryDescriptor<Void, String, Integer>(
			"middle",
			(v, c) -> CompletableFuture.completedFuture("page" + c.pageParam()),
			2,
			(page, pages, param, params) -> null)
			.previousPageParam((page, pages, param, params) -> param > 1 ? param - 1 : null);
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = watch(QueryOptions.of(middle));
		assertTrue(observer.getCurrentResult().hasPreviousPage());
		assertFalse(observer.getCurrentResult().hasNextPage());
		InfiniteQueryResult<InfiniteData<String, Integer>> result = observer.fetchPreviousPage().join();
		assertEquals(Arrays.asList("page1", "page2"), result.data().pages());
		assertEquals(Arrays.asList(1, 2), result.data().pageParams());
		assertFalse(result.hasPreviousPage());
	}
	@Test
	public void maxPages() {
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = watch(QueryOptions.of(descriptor).maxPages(2));
		observer.fetchNextPage().join();
		InfiniteQueryResult<InfiniteData<String, Integer>> result = observer.fetchNextPage().join();
		// Oldest page is dropped.
		assertEquals(Arrays.asList("page2", "page3"), result.data().pages());
		assertEquals(Arrays.asList(2, 3), result.data().pageParams());
		assertTrue(result.hasPreviousPage());
		result = observer.fetchPreviousPage().join();
		assertEquals(Arrays.asList("page1", "page2"), result.data().pages());
	}
	@Test
	public void fetchingDirection() {
		ManualPages pages = new ManualPages();
		InfiniteQueryDescriptor<Void, String, Integer> manual = new InfiniteQueryDescriptor<Void, String, Integer>("manual", pages, 1, (page, all, param, params) -> param + 1);
		ObservableInfiniteQuery<Void, String, Integer, InfiniteData<String, Integer>> observer = watch(QueryOptions.of(manual));
		pages.last().complete("page1");
		CompletableFuture<InfiniteQueryResult<InfiniteData<String, Integer>>> next = observer.fetchNextPage();
		assertTrue(observer.getCurrentResult().fetchingNextPage());
		assertFalse(observer.getCurrentResult().fetchingPreviousPage());
		pages.last().complete("page2");
		assertFalse(next.join().fetchingNextPage());
		assertEquals(2, next.join().data().pages().size());
	}
	@Test
	public void pages() {
		watch(QueryOptions.of(descriptor)).fetchNextPage().join();
		fetched.clear();
		// Explicit page count overrides the number of cached pages.
		InfiniteData<String, Integer> data = client.fetchQuery(QueryOptions.of(descriptor).pages(3)).join();
		assertEquals(Arrays.asList("page1", "page2", "page3"), data.pages());
		assertEquals(Arrays.asList(1, 2, 3), fetched);
	}
	@Test
	public void requireInfinite() {
		QueryDescriptor<Void, InfiniteData<String, Integer>> plain = new QueryDescriptor<>("plain", (v, c) -> CompletableFuture.completedFuture(InfiniteData.empty()));
		assertThrows(IllegalArgumentException.class, () -> client.watchInfiniteQuery(QueryOptions.of(plain)));
	}
	private static class ManualPages implements PageFetcher<Void, String, Integer> {
		final List<CompletableFuture<String>> pending = new CopyOnWriteArrayList<>();
		@Override
		public CompletableFuture<String> fetch(Void variables, PageContext<Void, String, Integer> context) {
			CompletableFuture<String> future = new CompletableFuture<>();
			pending.add(future);
			return future;
		}
		CompletableFuture<String> last() {
			return pending.get(pending.size() - 1);
		}
	}
}
