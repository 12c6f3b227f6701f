// Part of Refetch
package com.machinezoo.refetch.time;

import java.time.*;
import java.time.temporal.*;
import com.machinezoo.stagean.*;

/**
 * Helpers for durations that may be infinite.
 * Infinite duration is represented by {@link #INFINITE} and it is never scheduled on a timer.
 */
@StubDocs
public class Timeouts {
	public static final Duration INFINITE = ChronoUnit.FOREVER.getDuration();
	public static boolean infinite(Duration duration) {
		return INFINITE.equals(duration);
	}
	/*
	 * Finite non-negative durations can be passed to a scheduler. Everything else means "never".
	 */
	public static boolean valid(Duration duration) {
		return duration != null && !duration.isNegative() && !infinite(duration);
	}
	public static Duration max(Duration a, Duration b) {
		if (a == null)
			return b;
		if (b == null)
			return a;
		return a.compareTo(b) >= 0 ? a : b;
	}
	/*
	 * Remaining time until the data updated at given epoch millis becomes stale, never negative.
	 * Durations too long to be expressed in epoch millis saturate at Long.MAX_VALUE.
	 */
	public static long untilStale(long updatedAt, Duration staleTime, long now) {
		if (infinite(staleTime))
			return Long.MAX_VALUE;
		long staleAt;
		try {
			staleAt = Math.addExact(updatedAt, staleTime.toMillis());
		} catch (ArithmeticException ex) {
			return Long.MAX_VALUE;
		}
		return Math.max(staleAt - now, 0);
	}
}
