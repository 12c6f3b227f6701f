// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.concurrent.*;

/**
 * Signals that a fetch or mutation was cancelled before it completed.
 * Flags copied from {@link CancelOptions} tell entries how to react to the cancellation.
 */
public class CancelledException extends CancellationException {
	private static final long serialVersionUID = 1L;
	private final boolean revert;
	private final boolean silent;
	public CancelledException(CancelOptions options) {
		super("Cancelled.");
		Objects.requireNonNull(options);
		revert = options.revert();
		silent = options.silent();
	}
	public CancelledException() {
		this(new CancelOptions());
	}
	public boolean revert() {
		return revert;
	}
	public boolean silent() {
		return silent;
	}
}
