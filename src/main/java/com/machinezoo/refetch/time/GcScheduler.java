// Part of Refetch
package com.machinezoo.refetch.time;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Every cache entry owns one of these. The timer only tells the owner that the timeout elapsed.
 * Owner decides whether eviction is possible at that moment, because only the owner knows about its observers and fetches.
 */
/**
 * Eviction timer of one cache entry.
 */
@StubDocs
public class GcScheduler {
	private static final Logger logger = LoggerFactory.getLogger(GcScheduler.class);
	private final ScheduledExecutorService executor;
	private final Object lock;
	private final Runnable expire;
	private Duration gcTime;
	private ScheduledFuture<?> future;
	/**
	 * Creates new timer.
	 * 
	 * @param executor
	 *            scheduler to run the timer on
	 * @param lock
	 *            monitor held while the expiration callback runs
	 * @param expire
	 *            callback invoked when the timeout elapses
	 */
	public GcScheduler(ScheduledExecutorService executor, Object lock, Runnable expire) {
		Objects.requireNonNull(executor);
		Objects.requireNonNull(lock);
		Objects.requireNonNull(expire);
		this.executor = executor;
		this.lock = lock;
		this.expire = expire;
	}
	public Duration gcTime() {
		synchronized (lock) {
			return gcTime;
		}
	}
	/**
	 * Raises the timeout to {@code requested} if it is longer than the current timeout.
	 * Timeout never shrinks, because several observers may request different timeouts for the same entry.
	 */
	public void updateGcTime(Duration requested) {
		synchronized (lock) {
			gcTime = Timeouts.max(gcTime, requested);
		}
	}
	public void schedule() {
		synchronized (lock) {
			clear();
			if (Timeouts.valid(gcTime)) {
				ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
				self[0] = executor.schedule(() -> {
					synchronized (lock) {
						/*
						 * Timer could have been cleared or rescheduled while we were waiting for the lock.
						 */
						if (future != self[0])
							return;
						future = null;
						ExceptionLogging.log(logger).run(expire);
					}
				}, gcTime.toMillis(), TimeUnit.MILLISECONDS);
				future = self[0];
			}
		}
	}
	public void clear() {
		synchronized (lock) {
			if (future != null) {
				future.cancel(false);
				future = null;
			}
		}
	}
	public boolean scheduled() {
		synchronized (lock) {
			return future != null;
		}
	}
}
