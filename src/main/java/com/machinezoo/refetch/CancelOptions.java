// Part of Refetch
package com.machinezoo.refetch;

/**
 * Cancellation flags carried by {@link CancelledException}.
 */
public class CancelOptions {
	private boolean revert;
	/**
	 * Whether entry state should roll back to what it was before the cancelled fetch started.
	 */
	public boolean revert() {
		return revert;
	}
	public CancelOptions revert(boolean revert) {
		this.revert = revert;
		return this;
	}
	private boolean silent;
	/**
	 * Whether the cancellation should leave entry state alone instead of recording it as an error.
	 */
	public boolean silent() {
		return silent;
	}
	public CancelOptions silent(boolean silent) {
		this.silent = silent;
		return this;
	}
	@Override
	public String toString() {
		return "CancelOptions[revert=" + revert + ", silent=" + silent + "]";
	}
}
