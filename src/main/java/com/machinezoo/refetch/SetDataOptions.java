// Part of Refetch
package com.machinezoo.refetch;

/**
 * Options of direct writes into the cache.
 */
public class SetDataOptions {
	private Long updatedAt;
	public Long updatedAt() {
		return updatedAt;
	}
	/**
	 * Timestamp of the data in epoch millis. Defaults to current time.
	 */
	public SetDataOptions updatedAt(Long updatedAt) {
		this.updatedAt = updatedAt;
		return this;
	}
	private boolean manual;
	public boolean manual() {
		return manual;
	}
	/**
	 * Manual writes leave fetch status alone, because they may happen while a fetch is running.
	 */
	public SetDataOptions manual(boolean manual) {
		this.manual = manual;
		return this;
	}
	SetDataOptions copy() {
		return new SetDataOptions().updatedAt(updatedAt).manual(manual);
	}
}
