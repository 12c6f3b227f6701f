// Part of Refetch
package com.machinezoo.refetch;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/**
 * Registry of mutations. Mutations are not keyed. Every build creates new entry.
 */
@StubDocs
public class MutationCache {
	private final QueryEnvironment env;
	private final MutationCacheConfig config;
	private final List<MutationInfo<?, ?>> mutations = new ArrayList<>();
	private final ObserverList<Consumer<MutationCacheEvent>> listeners = new ObserverList<>();
	private int mutationId;
	private volatile long lastUpdated;
	public MutationCache(QueryEnvironment env, MutationCacheConfig config) {
		Objects.requireNonNull(env);
		Objects.requireNonNull(config);
		this.env = env;
		this.config = config;
		lastUpdated = env.now();
		OwnerTrace.of(this).alias("mcache").parent(env);
	}
	public MutationCache(QueryEnvironment env) {
		this(env, new MutationCacheConfig());
	}
	public QueryEnvironment env() {
		return env;
	}
	public MutationCacheConfig config() {
		return config;
	}
	/**
	 * Time of the last event in this cache.
	 */
	public long lastUpdated() {
		return lastUpdated;
	}
	public <V, D> MutationInfo<V, D> build(MutationOptions<V, D> options) {
		synchronized (env.lock) {
			MutationInfo<V, D> mutation = new MutationInfo<>(this, options, ++mutationId);
			mutations.add(mutation);
			notify(new MutationCacheEvent(MutationCacheEvent.Type.ADDED, mutation, null));
			return mutation;
		}
	}
	public void remove(MutationInfo<?, ?> mutation) {
		synchronized (env.lock) {
			if (mutations.remove(mutation)) {
				mutation.destroy();
				notify(new MutationCacheEvent(MutationCacheEvent.Type.REMOVED, mutation, null));
			}
		}
	}
	public void clear() {
		synchronized (env.lock) {
			for (MutationInfo<?, ?> mutation : all())
				remove(mutation);
		}
	}
	public List<MutationInfo<?, ?>> all() {
		synchronized (env.lock) {
			return new ArrayList<>(mutations);
		}
	}
	public Optional<MutationInfo<?, ?>> find(MutationFilters filters) {
		return all().stream().filter(filters::matches).findFirst();
	}
	public List<MutationInfo<?, ?>> findAll(MutationFilters filters) {
		return all().stream().filter(filters::matches).collect(toList());
	}
	public CloseableScope subscribe(Consumer<MutationCacheEvent> listener) {
		return listeners.subscribe(listener);
	}
	public CloseableScope subscribe(MutationFilters filters, Consumer<MutationCacheEvent> listener) {
		Objects.requireNonNull(filters);
		Objects.requireNonNull(listener);
		return listeners.subscribe(event -> {
			if (filters.matches(event.mutation()))
				listener.accept(event);
		});
	}
	public void notify(MutationCacheEvent event) {
		synchronized (env.lock) {
			lastUpdated = env.now();
			listeners.forEach(l -> l.accept(event));
		}
	}
	/**
	 * Resumes mutations paused for lack of focus or connectivity.
	 */
	public void resumePausedMutations() {
		synchronized (env.lock) {
			all().forEach(MutationInfo::resume);
		}
	}
	public void onFocus() {
		resumePausedMutations();
	}
	public void onOnline() {
		resumePausedMutations();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
