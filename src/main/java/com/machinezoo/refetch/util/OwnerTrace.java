// Part of Refetch
package com.machinezoo.refetch.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Cache entries, observers, and retryers form a shallow ownership tree (client, cache, entry, observer).
 * Spans and toString() of every object include tags of all its owners, so that a retry span
 * says which query hash it belongs to even though the retryer itself knows nothing about hashes.
 * 
 * Trace data is attached externally via a weak-keyed map, so that traced classes don't need any extra field.
 * Guava's weak keys compare by identity, which keeps equals()/hashCode() of traced objects out of the picture.
 */
/**
 * Ownership chain and tags of an object, used in tracing spans and {@code toString()}.
 */
@NoTests
@StubDocs
public class OwnerTrace<T> {
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		Objects.requireNonNull(target);
		this.target = target;
		this.data = data;
	}
	/*
	 * Fields are volatile, because traces are written under the engine lock but read from any thread.
	 * Holding a reference to the target here would keep the weak key alive forever.
	 */
	private static class TraceData {
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Null values are silently dropped. Tags are few and rarely written, so copy-on-write is good enough.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> tags = new LinkedHashMap<>(data.tags);
				tags.put(key, value);
				data.tags = tags;
			}
		}
		return this;
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent == null)
			data.parent = null;
		else if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else
			data.parent = OwnerTrace.of(parent).data;
		return this;
	}
	/*
	 * Root first. Repeated aliases get numeric suffix, e.g. "query.observer.observer2".
	 */
	private List<Map.Entry<String, TraceData>> namespaces() {
		List<TraceData> chain = new ArrayList<>();
		for (TraceData ancestor = data; ancestor != null && chain.size() < 32; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>();
		List<Map.Entry<String, TraceData>> namespaces = new ArrayList<>();
		for (TraceData ancestor : chain) {
			String alias = ancestor.alias;
			int number = numbering.getInt(alias);
			numbering.put(alias, number + 1);
			namespaces.add(new AbstractMap.SimpleImmutableEntry<>(number == 0 ? alias : alias + (number + 1), ancestor));
		}
		return namespaces;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		span.setTag("owner", namespaces.stream().map(Map.Entry::getKey).collect(joining(".")));
		for (Map.Entry<String, TraceData> ns : namespaces) {
			for (Map.Entry<String, Object> tag : ns.getValue().tags.entrySet()) {
				String key = ns.getKey() + "." + tag.getKey();
				Object value = tag.getValue();
				if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Map.Entry<String, TraceData>> namespaces = namespaces();
		for (Map.Entry<String, TraceData> ns : namespaces)
			for (Map.Entry<String, Object> tag : ns.getValue().tags.entrySet())
				sorted.put(ns.getKey() + "." + tag.getKey(), tag.getValue());
		return namespaces.stream().map(Map.Entry::getKey).collect(joining(".")) + sorted;
	}
}
