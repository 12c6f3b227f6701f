// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Retryer is a small state machine:
 * - RUNNING: an attempt is in flight or we are waiting out the backoff delay
 * - PAUSED: waiting for focus/connectivity before the next attempt
 * - RESOLVED: result future is completed, nothing more will happen
 * 
 * All transitions run under the environment lock. Attempt futures and backoff timers complete on arbitrary threads
 * and reacquire the lock before doing anything. Callbacks (onSuccess, onPause, ...) are invoked under the lock too,
 * so that the owning entry can dispatch its own transitions synchronously.
 */
/**
 * Runs one asynchronous operation with retries, backoff, pausing while offline or unfocused, and cooperative cancellation.
 * Configure it with fluent setters and then call {@link #start()}.
 */
@StubDocs
public class Retryer<T> {
	private static final Logger logger = LoggerFactory.getLogger(Retryer.class);
	private static final Counter retryCount = Metrics.counter("refetch.retries");
	public enum State {
		RUNNING,
		PAUSED,
		RESOLVED
	}
	private final QueryEnvironment env;
	private final Supplier<CompletableFuture<T>> fn;
	private final CompletableFuture<T> future = new CompletableFuture<>();
	private State state = State.RUNNING;
	private boolean started;
	private int failureCount;
	private boolean retryCancelled;
	private Runnable continuation;
	private ScheduledFuture<?> backoff;
	public Retryer(QueryEnvironment env, Supplier<CompletableFuture<T>> fn) {
		Objects.requireNonNull(env);
		Objects.requireNonNull(fn);
		this.env = env;
		this.fn = fn;
		retry = env.retry();
		OwnerTrace.of(this).alias("retryer");
	}
	private RetryPolicy retry;
	public Retryer<T> retry(RetryPolicy retry) {
		Objects.requireNonNull(retry);
		this.retry = retry;
		return this;
	}
	private RetryDelay retryDelay = RetryDelay.exponential();
	public Retryer<T> retryDelay(RetryDelay retryDelay) {
		Objects.requireNonNull(retryDelay);
		this.retryDelay = retryDelay;
		return this;
	}
	private NetworkMode networkMode = NetworkMode.ONLINE;
	public Retryer<T> networkMode(NetworkMode networkMode) {
		Objects.requireNonNull(networkMode);
		this.networkMode = networkMode;
		return this;
	}
	private Consumer<T> onSuccess = v -> {};
	public Retryer<T> onSuccess(Consumer<T> onSuccess) {
		Objects.requireNonNull(onSuccess);
		this.onSuccess = onSuccess;
		return this;
	}
	private Consumer<Throwable> onError = e -> {};
	public Retryer<T> onError(Consumer<Throwable> onError) {
		Objects.requireNonNull(onError);
		this.onError = onError;
		return this;
	}
	private BiConsumer<Integer, Throwable> onFail = (c, e) -> {};
	public Retryer<T> onFail(BiConsumer<Integer, Throwable> onFail) {
		Objects.requireNonNull(onFail);
		this.onFail = onFail;
		return this;
	}
	private Runnable onPause = () -> {};
	public Retryer<T> onPause(Runnable onPause) {
		Objects.requireNonNull(onPause);
		this.onPause = onPause;
		return this;
	}
	private Runnable onContinue = () -> {};
	public Retryer<T> onContinue(Runnable onContinue) {
		Objects.requireNonNull(onContinue);
		this.onContinue = onContinue;
		return this;
	}
	private Runnable abort = () -> {};
	public Retryer<T> abort(Runnable abort) {
		Objects.requireNonNull(abort);
		this.abort = abort;
		return this;
	}
	/**
	 * Result of the whole attempt sequence.
	 * It fails with the last error when retries are exhausted or with {@link CancelledException} when cancelled.
	 */
	public CompletableFuture<T> future() {
		return future;
	}
	public State state() {
		synchronized (env.lock) {
			return state;
		}
	}
	public int failureCount() {
		synchronized (env.lock) {
			return failureCount;
		}
	}
	public Retryer<T> start() {
		synchronized (env.lock) {
			if (started)
				throw new IllegalStateException("Retryer was already started.");
			started = true;
			if (env.canFetch(networkMode))
				run();
			else
				pause(this::run);
		}
		return this;
	}
	private void run() {
		if (state == State.RESOLVED)
			return;
		CompletableFuture<T> attempt;
		try {
			attempt = fn.get();
			if (attempt == null)
				attempt = CompletableFuture.completedFuture(null);
		} catch (Throwable ex) {
			attempt = CompletableFuture.failedFuture(ex);
		}
		attempt.whenComplete((value, error) -> {
			synchronized (env.lock) {
				if (error == null)
					resolve(value);
				else
					fail(unwrap(error));
			}
		});
	}
	private void fail(Throwable error) {
		if (state == State.RESOLVED)
			return;
		boolean shouldRetry;
		try {
			shouldRetry = !retryCancelled && retry.retry(failureCount, error);
		} catch (Throwable ex) {
			ExceptionLogging.log(logger).handle(ex);
			shouldRetry = false;
		}
		Duration delay = null;
		if (shouldRetry) {
			try {
				delay = retryDelay.delay(failureCount, error);
			} catch (Throwable ex) {
				ExceptionLogging.log(logger).handle(ex);
			}
		}
		/*
		 * Broken delay function ends the sequence with the original error.
		 */
		if (delay == null) {
			reject(error);
			return;
		}
		++failureCount;
		retryCount.increment();
		ExceptionLogging.log(logger).run(() -> onFail.accept(failureCount, error));
		backoff = env.scheduler().schedule(() -> {
			synchronized (env.lock) {
				backoff = null;
				if (state == State.RESOLVED)
					return;
				if (env.shouldPause(networkMode))
					pause(() -> retryOrReject(error));
				else
					retryOrReject(error);
			}
		}, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
	}
	private void retryOrReject(Throwable error) {
		if (retryCancelled)
			reject(error);
		else
			run();
	}
	private void pause(Runnable then) {
		state = State.PAUSED;
		continuation = then;
		onPause.run();
	}
	/**
	 * Wakes up paused retryer if focus and connectivity allow it. Running or resolved retryer is left alone.
	 * 
	 * @return {@code true} if the retryer can continue
	 */
	public boolean resume() {
		synchronized (env.lock) {
			if (state != State.PAUSED)
				return state == State.RESOLVED || !env.shouldPause(networkMode);
			if (env.shouldPause(networkMode))
				return false;
			Runnable then = continuation;
			continuation = null;
			state = State.RUNNING;
			onContinue.run();
			then.run();
			return true;
		}
	}
	private void resolve(T value) {
		if (state == State.RESOLVED)
			return;
		settle();
		onSuccess.accept(value);
		future.complete(value);
	}
	private void reject(Throwable error) {
		if (state == State.RESOLVED)
			return;
		settle();
		onError.accept(error);
		future.completeExceptionally(error);
	}
	private void settle() {
		state = State.RESOLVED;
		continuation = null;
		if (backoff != null) {
			backoff.cancel(false);
			backoff = null;
		}
	}
	/**
	 * Fails the result with {@link CancelledException} and invokes the abort callback.
	 * The attempt in flight may still run to completion, but its outcome is ignored.
	 */
	public void cancel(CancelOptions options) {
		Objects.requireNonNull(options);
		synchronized (env.lock) {
			if (state != State.RESOLVED) {
				reject(new CancelledException(options));
				ExceptionLogging.log(logger).run(abort);
			}
		}
	}
	/**
	 * Lets the current attempt finish, but prevents any further retries.
	 */
	public void cancelRetry() {
		synchronized (env.lock) {
			retryCancelled = true;
		}
	}
	public void continueRetry() {
		synchronized (env.lock) {
			retryCancelled = false;
		}
	}
	static Throwable unwrap(Throwable error) {
		while ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null)
			error = error.getCause();
		return error;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
