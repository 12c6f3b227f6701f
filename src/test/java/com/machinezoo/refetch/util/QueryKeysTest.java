// Part of Refetch
package com.machinezoo.refetch.util;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class QueryKeysTest {
	public static class Filter {
		public String getStatus() {
			return "done";
		}
		public int getPage() {
			return 2;
		}
	}
	private static Map<String, Object> map(Object... pairs) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < pairs.length; i += 2)
			map.put((String)pairs[i], pairs[i + 1]);
		return map;
	}
	@Test
	public void orderIndependent() {
		// Member order does not matter.
		assertEquals(QueryKeys.hash("todos", map("status", "done", "page", 2)), QueryKeys.hash("todos", map("page", 2, "status", "done")));
		// Neither does nesting.
		assertEquals(
			QueryKeys.hash("todos", map("filter", map("a", 1, "b", 2))),
			QueryKeys.hash("todos", map("filter", map("b", 2, "a", 1))));
		// Beans hash like equivalent maps.
		assertEquals(QueryKeys.hash("todos", map("page", 2, "status", "done")), QueryKeys.hash("todos", new Filter()));
	}
	@Test
	public void distinct() {
		assertNotEquals(QueryKeys.hash("todos", null), QueryKeys.hash("todo", null));
		assertNotEquals(QueryKeys.hash("todos", null), QueryKeys.hash("todos", map()));
		assertNotEquals(QueryKeys.hash("todos", Arrays.asList(1, 2)), QueryKeys.hash("todos", Arrays.asList(2, 1)));
		assertNotEquals(QueryKeys.hash("todos", map("id", 1)), QueryKeys.hash("todos", map("id", "1")));
	}
	@Test
	public void fullKey() {
		assertEquals("[\"todos\"]", QueryKeys.fullKey("todos", null).toString());
		assertEquals("[\"todos\",{\"id\":1}]", QueryKeys.fullKey("todos", map("id", 1)).toString());
	}
	@Test
	public void partialMatch() {
		Object full = QueryKeys.fullKey("todos", map("status", "done", "page", 2, "tags", Arrays.asList("a", "b")));
		// Prefixes match.
		assertTrue(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", null)));
		assertTrue(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("status", "done"))));
		assertTrue(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("tags", Arrays.asList("a")))));
		// Everything in the pattern must be present.
		assertFalse(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("status", "open"))));
		assertFalse(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("owner", "joe"))));
		assertFalse(QueryKeys.partialMatch(full, QueryKeys.fullKey("todo", null)));
		// Pattern longer than the key does not match.
		assertFalse(QueryKeys.partialMatch(QueryKeys.fullKey("todos", null), full));
	}
	@Test
	public void partialMatchNull() {
		Object full = QueryKeys.fullKey("todos", map("status", "done"));
		// Null in the pattern stands for a missing member.
		assertTrue(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("status", "done", "owner", null))));
		assertFalse(QueryKeys.partialMatch(full, QueryKeys.fullKey("todos", map("status", null))));
		assertTrue(QueryKeys.partialMatch(QueryKeys.fullKey("todos", map("owner", null)), QueryKeys.fullKey("todos", map())));
	}
	@Test
	public void generated() {
		String a = QueryKeys.generate();
		String b = QueryKeys.generate();
		assertNotEquals(a, b);
		assertTrue(QueryKeys.generated(a));
		assertFalse(QueryKeys.generated("todos"));
		assertFalse(QueryKeys.generated(null));
	}
}
