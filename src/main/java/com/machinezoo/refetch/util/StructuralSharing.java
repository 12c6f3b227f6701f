// Part of Refetch
package com.machinezoo.refetch.util;

import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Structural sharing of freshly produced values with their previous versions.
 * Parts of the new value that are deeply equal to the corresponding parts of the previous value
 * are replaced with references to the previous parts, so that unchanged data keeps its identity.
 * <p>
 * Only plain lists and maps from {@code java.util} are descended into.
 * Anything else is kept from the previous value only if it is {@link Object#equals(Object)} to the new one.
 */
@StubDocs
public class StructuralSharing {
	@SuppressWarnings("unchecked")
	public static <T> T replaceEqualDeep(Object previous, T next) {
		if (previous == next)
			return next;
		if (plainList(previous) && plainList(next))
			return (T)replaceList((List<Object>)previous, (List<Object>)next);
		if (plainMap(previous) && plainMap(next))
			return (T)replaceMap((Map<Object, Object>)previous, (Map<Object, Object>)next);
		return Objects.equals(previous, next) ? (T)previous : next;
	}
	private static Object replaceList(List<Object> previous, List<Object> next) {
		List<Object> copy = new ArrayList<>(next.size());
		int shared = 0;
		for (int i = 0; i < next.size(); ++i) {
			Object old = i < previous.size() ? previous.get(i) : null;
			Object item = replaceEqualDeep(old, next.get(i));
			if (i < previous.size() && item == old)
				++shared;
			copy.add(item);
		}
		if (previous.size() == next.size() && shared == previous.size())
			return previous;
		return next instanceof ArrayList ? copy : Collections.unmodifiableList(copy);
	}
	private static Object replaceMap(Map<Object, Object> previous, Map<Object, Object> next) {
		Map<Object, Object> copy = new LinkedHashMap<>();
		int shared = 0;
		for (Map.Entry<Object, Object> entry : next.entrySet()) {
			Object old = previous.get(entry.getKey());
			Object item = replaceEqualDeep(old, entry.getValue());
			if (item == old && previous.containsKey(entry.getKey()))
				++shared;
			copy.put(entry.getKey(), item);
		}
		if (previous.size() == next.size() && shared == previous.size())
			return previous;
		return next instanceof HashMap ? copy : Collections.unmodifiableMap(copy);
	}
	/*
	 * Other collection classes may be user types we cannot safely recreate.
	 */
	private static final Set<Class<?>> lists = new HashSet<>(Arrays.<Class<?>>asList(
		ArrayList.class,
		Arrays.asList().getClass(),
		List.of().getClass(),
		List.of(1).getClass(),
		Collections.emptyList().getClass(),
		Collections.singletonList(1).getClass(),
		Collections.unmodifiableList(new ArrayList<>()).getClass(),
		Collections.unmodifiableList(new LinkedList<>()).getClass()));
	private static final Set<Class<?>> maps = new HashSet<>(Arrays.<Class<?>>asList(
		HashMap.class,
		LinkedHashMap.class,
		Map.of().getClass(),
		Map.of(1, 1).getClass(),
		Collections.emptyMap().getClass(),
		Collections.singletonMap(1, 1).getClass(),
		Collections.unmodifiableMap(new HashMap<>()).getClass()));
	private static boolean plainList(Object value) {
		return value instanceof List && lists.contains(value.getClass());
	}
	private static boolean plainMap(Object value) {
		return value instanceof Map && maps.contains(value.getClass());
	}
}
