// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.time.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Mutation settles in three steps: the mutation function completes (possibly after retries),
 * cache-level and mutation-level callbacks run one after another, each awaited,
 * and only then the terminal transition is dispatched and the trigger future completes.
 * Code waiting on the trigger future thus sees all side effects of the callbacks.
 * 
 * Callback failure on the success path turns the mutation into failure.
 * Callback failure on the error path replaces the error reported by the trigger future,
 * but the recorded state keeps the original error.
 */
/**
 * One execution of a mutation. Instances are created by {@link MutationCache#build(MutationOptions)}.
 */
@DraftDocs("callback order")
public class MutationInfo<V, D> {
	private static final Timer mutationTimer = Metrics.timer("refetch.mutations");
	private static final Counter failureCount = Metrics.counter("refetch.mutations.failed");
	private final MutationCache cache;
	private final QueryEnvironment env;
	private final int mutationId;
	private final GcScheduler gc;
	private final ObserverList<Consumer<MutationState<V, D>>> listeners = new ObserverList<>();
	private MutationOptions<V, D> options;
	private MutationState<V, D> state = MutationState.idle();
	private Retryer<D> retryer;
	MutationInfo(MutationCache cache, MutationOptions<V, D> options, int mutationId) {
		requireResolved(options);
		this.cache = cache;
		env = cache.env();
		this.options = options;
		this.mutationId = mutationId;
		gc = new GcScheduler(env.scheduler(), env.lock, this::optionalRemove);
		gc.updateGcTime(options.gcTime());
		OwnerTrace.of(this)
			.alias("mutation")
			.parent(cache)
			.tag("key", options.descriptor().key())
			.tag("id", mutationId);
		gc.schedule();
	}
	private static void requireResolved(MutationOptions<?, ?> options) {
		Objects.requireNonNull(options);
		if (!options.resolved())
			throw new IllegalArgumentException("Options must be resolved with QueryClient.defaultMutationOptions().");
	}
	public int mutationId() {
		return mutationId;
	}
	public MutationDescriptor<V, D> descriptor() {
		return options.descriptor();
	}
	public MutationOptions<V, D> options() {
		synchronized (env.lock) {
			return options;
		}
	}
	public void setOptions(MutationOptions<V, D> options) {
		requireResolved(options);
		synchronized (env.lock) {
			this.options = options;
			gc.updateGcTime(options.gcTime());
		}
	}
	public MutationState<V, D> state() {
		synchronized (env.lock) {
			return state;
		}
	}
	public Map<String, Object> meta() {
		return options().meta();
	}
	/**
	 * Subscribes to state changes. Subscribed mutation is not evicted.
	 */
	public CloseableScope subscribe(Consumer<MutationState<V, D>> listener) {
		Objects.requireNonNull(listener);
		synchronized (env.lock) {
			listeners.add(listener);
			gc.clear();
		}
		return () -> {
			synchronized (env.lock) {
				if (listeners.remove(listener))
					gc.schedule();
			}
		};
	}
	private void optionalRemove() {
		if (listeners.isEmpty()) {
			if (state.status() == MutationStatus.MUTATING)
				gc.schedule();
			else
				cache.remove(this);
		}
	}
	void destroy() {
		synchronized (env.lock) {
			gc.clear();
		}
	}
	private void dispatch(MutationAction<V, D> action) {
		MutationState<V, D> next = state.apply(action);
		state = next;
		listeners.forEach(l -> l.accept(next));
		cache.notify(new MutationCacheEvent(MutationCacheEvent.Type.UPDATED, this, action));
	}
	public void reset() {
		synchronized (env.lock) {
			dispatch(MutationAction.reset());
		}
	}
	/**
	 * Runs the mutation. If the mutation is already in progress, for example after it was restored,
	 * the mutating transition is not dispatched again and state variables are reused when none are given.
	 * 
	 * @return future that completes after all callbacks have run
	 */
	public CompletableFuture<D> trigger(V variables) {
		synchronized (env.lock) {
			boolean restored = state.status() == MutationStatus.MUTATING;
			V effective = restored && variables == null ? state.variables() : variables;
			if (!restored)
				dispatch(MutationAction.mutating(effective));
			MutationOptions<V, D> current = options;
			Timer.Sample sample = Timer.start();
			Retryer<D> created = new Retryer<D>(env, () -> {
				MutationFunction<V, D> function = current.descriptor().function();
				if (function == null)
					return CompletableFuture.failedFuture(new IllegalStateException("Missing mutation function for key " + current.descriptor().key() + "."));
				return function.mutate(effective, new MutationContext(current.descriptor().key(), mutationId, current.meta()));
			})
				.retry(current.retry())
				.retryDelay(current.retryDelay())
				.networkMode(current.networkMode());
			OwnerTrace.of(created).parent(this);
			retryer = created;
			CompletableFuture<D> result = new CompletableFuture<>();
			created.future().whenComplete((data, error) -> {
				sample.stop(mutationTimer);
				if (error == null)
					succeed(current, effective, data, result);
				else
					fail(current, effective, Retryer.unwrap(error), result);
			});
			created.start();
			return result;
		}
	}
	void resume() {
		synchronized (env.lock) {
			if (retryer != null)
				retryer.resume();
		}
	}
	private void succeed(MutationOptions<V, D> current, V variables, D data, CompletableFuture<D> result) {
		MutationCacheConfig config = cache.config();
		CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
		chain = then(chain, () -> config.onSuccess().success(data, variables, this));
		if (current.onSuccess() != null)
			chain = then(chain, () -> current.onSuccess().success(data, variables, this));
		chain = then(chain, () -> config.onSettled().settled(data, null, variables, this));
		if (current.onSettled() != null)
			chain = then(chain, () -> current.onSettled().settled(data, null, variables, this));
		chain.whenComplete((nothing, error) -> {
			if (error != null) {
				fail(current, variables, Retryer.unwrap(error), result);
				return;
			}
			synchronized (env.lock) {
				dispatch(MutationAction.success(data));
			}
			result.complete(data);
		});
	}
	private void fail(MutationOptions<V, D> current, V variables, Throwable error, CompletableFuture<D> result) {
		failureCount.increment();
		MutationCacheConfig config = cache.config();
		CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
		chain = then(chain, () -> config.onError().error(error, variables, this));
		if (current.onError() != null)
			chain = then(chain, () -> current.onError().error(error, variables, this));
		chain = then(chain, () -> config.onSettled().settled(null, error, variables, this));
		if (current.onSettled() != null)
			chain = then(chain, () -> current.onSettled().settled(null, error, variables, this));
		chain.whenComplete((nothing, callbackError) -> {
			synchronized (env.lock) {
				dispatch(MutationAction.error(error));
			}
			result.completeExceptionally(callbackError != null ? Retryer.unwrap(callbackError) : error);
		});
	}
	private static CompletableFuture<Void> then(CompletableFuture<Void> chain, Supplier<CompletionStage<?>> callback) {
		return chain.thenCompose(nothing -> {
			CompletionStage<?> stage = callback.get();
			if (stage == null)
				return CompletableFuture.completedFuture(null);
			return stage.thenApply(value -> (Void)null);
		});
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
