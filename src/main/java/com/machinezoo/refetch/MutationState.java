// Part of Refetch
package com.machinezoo.refetch;

/**
 * Immutable state of one mutation.
 */
public class MutationState<V, D> {
	private final D data;
	private final Throwable error;
	private final MutationStatus status;
	private final V variables;
	private MutationState(D data, Throwable error, MutationStatus status, V variables) {
		this.data = data;
		this.error = error;
		this.status = status;
		this.variables = variables;
	}
	public static <V, D> MutationState<V, D> idle() {
		return new MutationState<>(null, null, MutationStatus.IDLE, null);
	}
	public D data() {
		return data;
	}
	public Throwable error() {
		return error;
	}
	public MutationStatus status() {
		return status;
	}
	/**
	 * Variables of the last trigger, {@code null} while idle.
	 */
	public V variables() {
		return variables;
	}
	public MutationState<V, D> apply(MutationAction<V, D> action) {
		switch (action.type()) {
		case MUTATING:
			return new MutationState<>(null, null, MutationStatus.MUTATING, action.variables());
		case SUCCESS:
			return new MutationState<>(action.data(), null, MutationStatus.SUCCESS, variables);
		case ERROR:
			return new MutationState<>(null, action.error(), MutationStatus.ERROR, variables);
		case RESET:
			return idle();
		default:
			throw new IllegalStateException();
		}
	}
	@Override
	public String toString() {
		return "MutationState[" + status + "]";
	}
}
