// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import java.util.function.*;
import com.machinezoo.refetch.util.*;

/**
 * Predicate over mutations. All specified conditions must hold. Empty filters match everything.
 */
public class MutationFilters {
	private MutationDescriptor<?, ?> descriptor;
	private Object variables;
	public MutationDescriptor<?, ?> descriptor() {
		return descriptor;
	}
	public Object variables() {
		return variables;
	}
	public MutationFilters descriptor(MutationDescriptor<?, ?> descriptor) {
		this.descriptor = descriptor;
		return this;
	}
	/**
	 * Matches mutations of the descriptor triggered with variables containing given variables,
	 * or equal to them if {@link #exact(boolean)} is set.
	 */
	public MutationFilters descriptor(MutationDescriptor<?, ?> descriptor, Object variables) {
		this.descriptor = descriptor;
		this.variables = variables;
		return this;
	}
	private boolean exact;
	public boolean exact() {
		return exact;
	}
	public MutationFilters exact(boolean exact) {
		this.exact = exact;
		return this;
	}
	private MutationStatus status;
	public MutationStatus status() {
		return status;
	}
	public MutationFilters status(MutationStatus status) {
		this.status = status;
		return this;
	}
	private Predicate<MutationInfo<?, ?>> predicate;
	public Predicate<MutationInfo<?, ?>> predicate() {
		return predicate;
	}
	public MutationFilters predicate(Predicate<MutationInfo<?, ?>> predicate) {
		this.predicate = predicate;
		return this;
	}
	public boolean matches(MutationInfo<?, ?> mutation) {
		MutationState<?, ?> state = mutation.state();
		if (descriptor != null) {
			String key = mutation.descriptor().key();
			if (exact) {
				if (!QueryKeys.hash(key, state.variables()).equals(QueryKeys.hash(descriptor.key(), variables)))
					return false;
			} else if (!QueryKeys.partialMatch(QueryKeys.fullKey(key, state.variables()), QueryKeys.fullKey(descriptor.key(), variables)))
				return false;
		}
		if (status != null && status != state.status())
			return false;
		if (predicate != null && !predicate.test(mutation))
			return false;
		return true;
	}
}
