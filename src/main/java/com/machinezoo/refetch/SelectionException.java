// Part of Refetch
package com.machinezoo.refetch;

/**
 * Wraps an exception thrown by a selector of {@link ObservableQuery}.
 * It is reported in query results as their error while cached data stays intact.
 */
public class SelectionException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public SelectionException(Throwable cause) {
		super("Selector failed.", cause);
	}
}
