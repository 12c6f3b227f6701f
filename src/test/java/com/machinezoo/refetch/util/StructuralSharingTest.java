// Part of Refetch
package com.machinezoo.refetch.util;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class StructuralSharingTest {
	private static Map<String, Object> item(int id, String title) {
		Map<String, Object> map = new HashMap<>();
		map.put("id", id);
		map.put("title", title);
		return map;
	}
	@Test
	public void equal() {
		List<Object> previous = new ArrayList<>(Arrays.asList(item(1, "a"), item(2, "b")));
		List<Object> next = new ArrayList<>(Arrays.asList(item(1, "a"), item(2, "b")));
		// Deeply equal value is replaced with the previous one.
		assertSame(previous, StructuralSharing.replaceEqualDeep(previous, next));
	}
	@Test
	public void partial() {
		List<Object> previous = new ArrayList<>(Arrays.asList(item(1, "a"), item(2, "b")));
		List<Object> next = new ArrayList<>(Arrays.asList(item(1, "a"), item(2, "c")));
		List<Object> shared = StructuralSharing.replaceEqualDeep(previous, next);
		// Changed value is new, but unchanged parts keep their identity.
		assertNotSame(previous, shared);
		assertEquals(next, shared);
		assertSame(previous.get(0), shared.get(0));
		assertNotSame(previous.get(1), shared.get(1));
	}
	@Test
	public void maps() {
		Map<String, Object> previous = new HashMap<>();
		previous.put("user", item(1, "joe"));
		previous.put("count", 3);
		Map<String, Object> next = new HashMap<>();
		next.put("user", item(1, "joe"));
		next.put("count", 4);
		Map<String, Object> shared = StructuralSharing.replaceEqualDeep(previous, next);
		assertEquals(next, shared);
		assertSame(previous.get("user"), shared.get("user"));
	}
	@Test
	public void leaves() {
		// Equal leaves are shared, different ones are not.
		String previous = new String("hello");
		assertSame(previous, StructuralSharing.replaceEqualDeep(previous, new String("hello")));
		assertEquals("world", StructuralSharing.replaceEqualDeep(previous, "world"));
		// Nothing to share with.
		List<Object> next = new ArrayList<>();
		assertSame(next, StructuralSharing.replaceEqualDeep(null, next));
	}
	@Test
	public void immutableCollections() {
		List<Object> previous = List.<Object>of(Map.of("id", 1), Map.of("id", 2));
		List<Object> next = List.<Object>of(Map.of("id", 1), Map.of("id", 3));
		List<Object> shared = StructuralSharing.replaceEqualDeep(previous, next);
		// JDK immutable collections are descended into.
		assertEquals(next, shared);
		assertSame(previous.get(0), shared.get(0));
	}
	@Test
	public void customCollections() {
		List<Object> previous = new LinkedList<>(Arrays.asList(item(1, "a")));
		List<Object> next = new LinkedList<>(Arrays.asList(item(1, "a"), item(2, "b")));
		// Other list types are compared as a whole.
		assertSame(next, StructuralSharing.replaceEqualDeep(previous, next));
		List<Object> equal = new LinkedList<>(Arrays.asList(item(1, "a")));
		assertSame(previous, StructuralSharing.replaceEqualDeep(previous, equal));
	}
}
