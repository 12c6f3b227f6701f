// Part of Refetch
package com.machinezoo.refetch;

import java.time.*;
import java.util.*;

/**
 * Backoff between a failed attempt and its retry.
 */
@FunctionalInterface
public interface RetryDelay {
	Duration delay(int failureCount, Throwable error);
	/**
	 * Doubles the delay after every failure, starting at one second and capped at 30 seconds.
	 */
	static RetryDelay exponential() {
		return (count, error) -> Duration.ofMillis(Math.min(1000L << Math.min(count, 20), 30_000));
	}
	static RetryDelay fixed(Duration delay) {
		Objects.requireNonNull(delay);
		return (count, error) -> delay;
	}
}
