// Part of Refetch
package com.machinezoo.refetch;

/**
 * Decides whether a failed attempt should be retried.
 */
@FunctionalInterface
public interface RetryPolicy {
	/**
	 * Decides whether to retry.
	 * 
	 * @param failureCount
	 *            number of failures before the one that just happened
	 * @param error
	 *            exception the attempt failed with
	 * @return {@code true} to retry after backoff
	 */
	boolean retry(int failureCount, Throwable error);
	static RetryPolicy never() {
		return (count, error) -> false;
	}
	static RetryPolicy always() {
		return (count, error) -> true;
	}
	static RetryPolicy count(int retries) {
		if (retries < 0)
			throw new IllegalArgumentException();
		return (count, error) -> count < retries;
	}
}
