// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Information passed to {@link MutationFunction} along with variables.
 */
public class MutationContext {
	private final String key;
	private final int mutationId;
	private final Map<String, Object> meta;
	MutationContext(String key, int mutationId, Map<String, Object> meta) {
		this.key = key;
		this.mutationId = mutationId;
		this.meta = meta;
	}
	public String key() {
		return key;
	}
	public int mutationId() {
		return mutationId;
	}
	public Map<String, Object> meta() {
		return meta;
	}
}
