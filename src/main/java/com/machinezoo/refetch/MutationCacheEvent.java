// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Change in {@link MutationCache}.
 */
public class MutationCacheEvent {
	public enum Type {
		ADDED,
		UPDATED,
		REMOVED
	}
	private final Type type;
	private final MutationInfo<?, ?> mutation;
	private final MutationAction<?, ?> action;
	public MutationCacheEvent(Type type, MutationInfo<?, ?> mutation, MutationAction<?, ?> action) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(mutation);
		this.type = type;
		this.mutation = mutation;
		this.action = action;
	}
	public Type type() {
		return type;
	}
	public MutationInfo<?, ?> mutation() {
		return mutation;
	}
	/**
	 * Action that caused {@link Type#UPDATED} event, {@code null} for other events.
	 */
	public MutationAction<?, ?> action() {
		return action;
	}
	@Override
	public String toString() {
		return "MutationCacheEvent[" + type + ", " + mutation.mutationId() + (action != null ? ", " + action.type() : "") + "]";
	}
}
