// Part of Refetch
package com.machinezoo.refetch;

/**
 * Options of one explicit fetch.
 */
public class FetchOptions {
	private Boolean cancelRefetch;
	public Boolean cancelRefetch() {
		return cancelRefetch;
	}
	/**
	 * Whether fetch of resource that already has data and is fetching cancels the running fetch and starts over.
	 * When disabled, the running fetch is reused. Unspecified means enabled for explicit refetches
	 * and disabled for automatic fetches.
	 */
	public FetchOptions cancelRefetch(Boolean cancelRefetch) {
		this.cancelRefetch = cancelRefetch;
		return this;
	}
	private boolean throwOnError;
	public boolean throwOnError() {
		return throwOnError;
	}
	/**
	 * Whether the returned future fails when the fetch fails. By default, errors are only recorded in resource state.
	 */
	public FetchOptions throwOnError(boolean throwOnError) {
		this.throwOnError = throwOnError;
		return this;
	}
	private FetchMeta meta;
	public FetchMeta meta() {
		return meta;
	}
	public FetchOptions meta(FetchMeta meta) {
		this.meta = meta;
		return this;
	}
	FetchOptions copy() {
		return new FetchOptions().cancelRefetch(cancelRefetch).throwOnError(throwOnError).meta(meta);
	}
}
