// Part of Refetch
package com.machinezoo.refetch;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class QueryInfoStateTest {
	@Test
	public void initial() {
		QueryInfoState<String> empty = QueryInfoState.initial(null, 100);
		assertEquals(QueryStatus.PENDING, empty.status());
		assertEquals(FetchStatus.IDLE, empty.fetchStatus());
		assertEquals(0, empty.dataUpdatedAt());
		// Initial data makes the resource successful from the start.
		QueryInfoState<String> seeded = QueryInfoState.initial("hello", 100);
		assertEquals(QueryStatus.SUCCESS, seeded.status());
		assertEquals("hello", seeded.data());
		assertEquals(100, seeded.dataUpdatedAt());
	}
	@Test
	public void lifecycle() {
		QueryInfoState<String> s = QueryInfoState.initial(null, 0);
		// First fetch.
		s = s.apply(QueryAction.fetch(null, false));
		assertEquals(QueryStatus.PENDING, s.status());
		assertEquals(FetchStatus.FETCHING, s.fetchStatus());
		s = s.apply(QueryAction.success("a", 10, false));
		assertEquals(QueryStatus.SUCCESS, s.status());
		assertEquals(FetchStatus.IDLE, s.fetchStatus());
		assertEquals("a", s.data());
		assertEquals(10, s.dataUpdatedAt());
		// Refetch keeps status and data.
		s = s.apply(QueryAction.fetch(null, false));
		assertEquals(QueryStatus.SUCCESS, s.status());
		assertEquals(FetchStatus.FETCHING, s.fetchStatus());
		assertEquals("a", s.data());
		// Failed refetch keeps data too.
		Exception error = new IllegalStateException();
		s = s.apply(QueryAction.error(error, 20, null));
		assertEquals(QueryStatus.ERROR, s.status());
		assertEquals(FetchStatus.IDLE, s.fetchStatus());
		assertSame(error, s.error());
		assertEquals(20, s.errorUpdatedAt());
		assertEquals("a", s.data());
		// Success clears the error, but error timestamp stays.
		s = s.apply(QueryAction.success("b", 30, false));
		assertNull(s.error());
		assertEquals(20, s.errorUpdatedAt());
	}
	@Test
	public void paused() {
		QueryInfoState<String> s = QueryInfoState.<String>initial(null, 0).apply(QueryAction.fetch(null, true));
		assertEquals(FetchStatus.PAUSED, s.fetchStatus());
		s = s.apply(QueryAction.resume());
		assertEquals(FetchStatus.FETCHING, s.fetchStatus());
		s = s.apply(QueryAction.pause());
		assertEquals(FetchStatus.PAUSED, s.fetchStatus());
	}
	@Test
	public void invalidate() {
		QueryInfoState<String> s = QueryInfoState.initial("a", 10);
		QueryInfoState<String> invalidated = s.apply(QueryAction.invalidate());
		assertTrue(invalidated.invalidated());
		// Repeated invalidation does nothing.
		assertSame(invalidated, invalidated.apply(QueryAction.invalidate()));
		// Successful fetch validates the data again.
		assertFalse(invalidated.apply(QueryAction.success("b", 20, false)).invalidated());
	}
	@Test
	public void manual() {
		QueryInfoState<String> s = QueryInfoState.<String>initial(null, 0).apply(QueryAction.fetch(null, false));
		// Manual write does not end the running fetch.
		s = s.apply(QueryAction.success("a", 10, true));
		assertEquals(QueryStatus.SUCCESS, s.status());
		assertEquals(FetchStatus.FETCHING, s.fetchStatus());
	}
	@Test
	public void revert() {
		QueryInfoState<String> before = QueryInfoState.initial("a", 10);
		QueryInfoState<String> fetching = before.apply(QueryAction.fetch(null, false));
		// Reverting cancellation restores the state before the fetch.
		assertSame(before, fetching.apply(QueryAction.error(new CancelledException(new CancelOptions().revert(true)), 20, before)));
		// Non-reverting cancellation is an ordinary error.
		QueryInfoState<String> failed = fetching.apply(QueryAction.error(new CancelledException(new CancelOptions()), 20, before));
		assertEquals(QueryStatus.ERROR, failed.status());
		assertEquals("a", failed.data());
	}
}
