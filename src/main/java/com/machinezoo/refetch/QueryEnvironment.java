// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.time.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * Connectivity and focus are process-wide concepts in browser-like hosts, but here they are instance state.
 * Several clients can run side by side with different environments and tests can flip the flags deterministically.
 * 
 * Environment also owns the engine monitor. Every state transition in caches, entries, observers, and retryers
 * happens while holding it. Asynchronous continuations (completion of fetch futures, timers) reacquire it
 * before touching any state. This is a single-writer discipline: transition and its notification
 * are never interleaved with another transition.
 */
/**
 * Connectivity, focus, timers, clock, and lock shared by one engine instance.
 */
@DraftApi("focus and connectivity might be better modeled as separate sources")
public class QueryEnvironment {
	private static final ScheduledExecutorService timers = Executors.newScheduledThreadPool(1, new ThreadFactory() {
		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("refetch-timing");
			return thread;
		}
	});
	final Object lock = new Object();
	private final boolean server;
	/**
	 * Creates environment for a long-lived interactive process.
	 */
	public QueryEnvironment() {
		this(false);
	}
	/**
	 * Creates new environment.
	 * 
	 * @param server
	 *            {@code true} for short-lived server-like processes, which default to no retries, no eviction, and no timers
	 */
	public QueryEnvironment(boolean server) {
		this.server = server;
		retry = server ? RetryPolicy.never() : RetryPolicy.count(3);
		gcTime = server ? Timeouts.INFINITE : Duration.ofMinutes(5);
		OwnerTrace.of(this).alias("env").tag("server", server);
	}
	public boolean server() {
		return server;
	}
	private volatile RetryPolicy retry;
	/**
	 * Retry policy used when neither call site nor any layer of defaults specifies one.
	 */
	public RetryPolicy retry() {
		return retry;
	}
	public QueryEnvironment retry(RetryPolicy retry) {
		Objects.requireNonNull(retry);
		this.retry = retry;
		return this;
	}
	private volatile Duration gcTime;
	public Duration gcTime() {
		return gcTime;
	}
	public QueryEnvironment gcTime(Duration gcTime) {
		Objects.requireNonNull(gcTime);
		this.gcTime = gcTime;
		return this;
	}
	private volatile ScheduledExecutorService scheduler = timers;
	public ScheduledExecutorService scheduler() {
		return scheduler;
	}
	public QueryEnvironment scheduler(ScheduledExecutorService scheduler) {
		Objects.requireNonNull(scheduler);
		this.scheduler = scheduler;
		return this;
	}
	private volatile Clock clock = Clock.systemUTC();
	public Clock clock() {
		return clock;
	}
	public QueryEnvironment clock(Clock clock) {
		Objects.requireNonNull(clock);
		this.clock = clock;
		return this;
	}
	/*
	 * Epoch milliseconds, the unit of all timestamps in entry state.
	 */
	public long now() {
		return clock.millis();
	}
	private volatile boolean online = true;
	private final ObserverList<Consumer<Boolean>> onlineListeners = new ObserverList<>();
	public boolean online() {
		return online;
	}
	public QueryEnvironment online(boolean online) {
		synchronized (lock) {
			if (this.online != online) {
				this.online = online;
				onlineListeners.forEach(l -> l.accept(online));
			}
		}
		return this;
	}
	public CloseableScope onOnline(Consumer<Boolean> listener) {
		return onlineListeners.subscribe(listener);
	}
	private volatile boolean focused = true;
	private final ObserverList<Consumer<Boolean>> focusListeners = new ObserverList<>();
	public boolean focused() {
		return focused;
	}
	public QueryEnvironment focused(boolean focused) {
		synchronized (lock) {
			if (this.focused != focused) {
				this.focused = focused;
				focusListeners.forEach(l -> l.accept(focused));
			}
		}
		return this;
	}
	public CloseableScope onFocus(Consumer<Boolean> listener) {
		return focusListeners.subscribe(listener);
	}
	/*
	 * Only ONLINE mode consults connectivity before the first attempt.
	 */
	boolean canFetch(NetworkMode mode) {
		return mode != NetworkMode.ONLINE || online;
	}
	boolean shouldPause(NetworkMode mode) {
		return !focused || mode != NetworkMode.ALWAYS && !online;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
