// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;

/**
 * Transition of {@link MutationState}, reported in {@link MutationCacheEvent}.
 */
public class MutationAction<V, D> {
	public enum Type {
		MUTATING,
		SUCCESS,
		ERROR,
		RESET
	}
	private final Type type;
	private final V variables;
	private final D data;
	private final Throwable error;
	private MutationAction(Type type, V variables, D data, Throwable error) {
		this.type = type;
		this.variables = variables;
		this.data = data;
		this.error = error;
	}
	public static <V, D> MutationAction<V, D> mutating(V variables) {
		return new MutationAction<>(Type.MUTATING, variables, null, null);
	}
	public static <V, D> MutationAction<V, D> success(D data) {
		return new MutationAction<>(Type.SUCCESS, null, data, null);
	}
	public static <V, D> MutationAction<V, D> error(Throwable error) {
		Objects.requireNonNull(error);
		return new MutationAction<>(Type.ERROR, null, null, error);
	}
	public static <V, D> MutationAction<V, D> reset() {
		return new MutationAction<>(Type.RESET, null, null, null);
	}
	public Type type() {
		return type;
	}
	public V variables() {
		return variables;
	}
	public D data() {
		return data;
	}
	public Throwable error() {
		return error;
	}
	@Override
	public String toString() {
		return "MutationAction[" + type + "]";
	}
}
