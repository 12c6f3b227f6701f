// Part of Refetch
package com.machinezoo.refetch;

import static org.awaitility.Awaitility.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class MutationInfoTest extends TestBase {
	private final List<String> log = new CopyOnWriteArrayList<>();
	private final QueryClient client = new QueryClient(new QueryClientConfig()
		.mutationCache(new MutationCacheConfig()
			.onSuccess((data, variables, mutation) -> record("cache success", mutation))
			.onError((error, variables, mutation) -> record("cache error", mutation))
			.onSettled((data, error, variables, mutation) -> record("cache settled", mutation))));
	private CompletionStage<?> record(String event, MutationInfo<?, ?> mutation) {
		log.add(event + " " + mutation.state().status());
		return null;
	}
	private final MutationDescriptor<String, String> rename = new MutationDescriptor<>("rename", (name, context) -> {
		if (name.isEmpty())
			return CompletableFuture.failedFuture(new IllegalArgumentException("empty"));
		return CompletableFuture.completedFuture("renamed to " + name);
	});
	private MutationOptions<String, String> options() {
		return MutationOptions.of(rename)
			.onSuccess((data, variables, mutation) -> record("success", mutation))
			.onError((error, variables, mutation) -> record("error", mutation))
			.onSettled((data, error, variables, mutation) -> record("settled", mutation));
	}
	private MutationInfo<String, String> build(MutationOptions<String, String> options) {
		return client.mutationCache().build(client.defaultMutationOptions(options));
	}
	@Test
	public void success() {
		MutationInfo<String, String> mutation = build(options());
		// Initial state.
		assertEquals(MutationStatus.IDLE, mutation.state().status());
		List<MutationStatus> states = new ArrayList<>();
		mutation.subscribe(s -> states.add(s.status()));
		assertEquals("renamed to joe", mutation.trigger("joe").join());
		// Callbacks run before the mutation is marked as successful.
		assertEquals(Arrays.asList("cache success MUTATING", "success MUTATING", "cache settled MUTATING", "settled MUTATING"), log);
		assertEquals(Arrays.asList(MutationStatus.MUTATING, MutationStatus.SUCCESS), states);
		assertEquals("renamed to joe", mutation.state().data());
		assertEquals("joe", mutation.state().variables());
	}
	@Test
	public void error() {
		MutationInfo<String, String> mutation = build(options());
		CompletionException ex = assertThrows(CompletionException.class, () -> mutation.trigger("").join());
		assertEquals("empty", ex.getCause().getMessage());
		assertEquals(Arrays.asList("cache error MUTATING", "error MUTATING", "cache settled MUTATING", "settled MUTATING"), log);
		assertEquals(MutationStatus.ERROR, mutation.state().status());
		assertEquals("empty", mutation.state().error().getMessage());
		assertEquals("", mutation.state().variables());
	}
	@Test
	public void asyncCallback() {
		CompletableFuture<Void> gate = new CompletableFuture<>();
		MutationInfo<String, String> mutation = build(MutationOptions.of(rename).onSuccess((data, variables, m) -> gate));
		CompletableFuture<String> result = mutation.trigger("joe");
		// Mutation waits for the callback.
		assertFalse(result.isDone());
		assertEquals(MutationStatus.MUTATING, mutation.state().status());
		gate.complete(null);
		assertEquals("renamed to joe", result.join());
		assertEquals(MutationStatus.SUCCESS, mutation.state().status());
	}
	@Test
	public void failingCallback() {
		MutationInfo<String, String> mutation = build(MutationOptions.of(rename).onSuccess((data, variables, m) -> {
			throw new IllegalStateException("callback");
		}));
		CompletionException ex = assertThrows(CompletionException.class, () -> mutation.trigger("joe").join());
		// Failed callback fails the mutation.
		assertEquals("callback", ex.getCause().getMessage());
		assertEquals(MutationStatus.ERROR, mutation.state().status());
	}
	@Test
	public void missingFunction() {
		MutationInfo<String, String> mutation = build(MutationOptions.of(new MutationDescriptor<String, String>("none", null)));
		CompletionException ex = assertThrows(CompletionException.class, () -> mutation.trigger("joe").join());
		assertTrue(ex.getCause() instanceof IllegalStateException);
	}
	@Test
	public void reset() {
		MutationInfo<String, String> mutation = build(options());
		mutation.trigger("joe").join();
		mutation.reset();
		assertEquals(MutationStatus.IDLE, mutation.state().status());
		assertNull(mutation.state().data());
		assertNull(mutation.state().variables());
	}
	@Test
	public void noRetryByDefault() {
		List<String> calls = new CopyOnWriteArrayList<>();
		MutationDescriptor<String, String> broken = new MutationDescriptor<>("broken", (name, context) -> {
			calls.add(name);
			return CompletableFuture.failedFuture(new IllegalStateException());
		});
		MutationInfo<String, String> mutation = build(MutationOptions.of(broken));
		assertThrows(CompletionException.class, () -> mutation.trigger("joe").join());
		assertEquals(1, calls.size());
	}
	@Test
	public void retry() {
		List<String> calls = new CopyOnWriteArrayList<>();
		MutationDescriptor<String, String> flaky = new MutationDescriptor<>("flaky", (name, context) -> {
			calls.add(name);
			if (calls.size() < 2)
				return CompletableFuture.failedFuture(new IllegalStateException());
			return CompletableFuture.completedFuture("ok");
		});
		MutationInfo<String, String> mutation = build(MutationOptions.of(flaky).retry(RetryPolicy.count(1)).retryDelay(RetryDelay.fixed(Duration.ofMillis(1))));
		CompletableFuture<String> result = mutation.trigger("joe");
		await().until(result::isDone);
		assertEquals("ok", result.join());
		assertEquals(2, calls.size());
	}
	@Test
	public void gc() {
		MutationInfo<String, String> mutation = build(options().gcTime(Duration.ofMillis(10)));
		mutation.trigger("joe").join();
		await().until(() -> !client.mutationCache().all().contains(mutation));
	}
	@Test
	public void context() {
		List<Integer> ids = new CopyOnWriteArrayList<>();
		MutationDescriptor<String, String> probe = new MutationDescriptor<>("probe", (name, context) -> {
			ids.add(context.mutationId());
			assertEquals("probe", context.key());
			assertEquals("v", context.meta().get("k"));
			return CompletableFuture.completedFuture(name);
		});
		MutationInfo<String, String> mutation = build(MutationOptions.of(probe).meta(Collections.singletonMap("k", "v")));
		mutation.trigger("joe").join();
		assertEquals(Arrays.asList(mutation.mutationId()), ids);
	}
}
