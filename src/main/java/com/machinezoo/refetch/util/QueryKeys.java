// Part of Refetch
package com.machinezoo.refetch.util;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.*;
import com.fasterxml.jackson.databind.node.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;

/*
 * Keys and variables are converted to JSON trees first. Hashing and matching then operate on the trees,
 * which gives us order-independent object comparison for maps, beans, and any mix of the two.
 */
/**
 * Canonical hashing and partial matching of resource keys.
 * Full key is a JSON array of the key string followed by variables if there are any.
 */
@StubDocs
public class QueryKeys {
	private static final ObjectMapper json = JsonMapper.builder()
		.configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
		.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
		.build();
	/*
	 * Shared with snapshot encoding, so that snapshots and hashes agree on how values look as JSON.
	 */
	@DraftApi("should be configurable")
	public static ObjectMapper json() {
		return json;
	}
	private static final String GENERATED_PREFIX = "$q$";
	private static final AtomicLong counter = new AtomicLong();
	public static String generate() {
		return GENERATED_PREFIX + counter.incrementAndGet();
	}
	public static boolean generated(String key) {
		return key != null && key.startsWith(GENERATED_PREFIX);
	}
	public static JsonNode tree(Object value) {
		if (value instanceof JsonNode)
			return (JsonNode)value;
		return json.valueToTree(value);
	}
	public static ArrayNode fullKey(String key, Object variables) {
		Objects.requireNonNull(key);
		ArrayNode full = json.createArrayNode();
		full.add(key);
		if (variables != null)
			full.add(tree(variables));
		return full;
	}
	public static String hash(String key, Object variables) {
		return hash(fullKey(key, variables));
	}
	public static String hash(JsonNode fullKey) {
		return Exceptions.sneak().get(() -> json.writeValueAsString(canonical(fullKey)));
	}
	private static JsonNode canonical(JsonNode node) {
		if (node.isObject()) {
			ObjectNode sorted = json.createObjectNode();
			List<String> names = new ArrayList<>();
			node.fieldNames().forEachRemaining(names::add);
			Collections.sort(names);
			for (String name : names)
				sorted.set(name, canonical(node.get(name)));
			return sorted;
		}
		if (node.isArray()) {
			ArrayNode array = json.createArrayNode();
			for (JsonNode item : node)
				array.add(canonical(item));
			return array;
		}
		return node;
	}
	/**
	 * Checks whether {@code a} contains everything in {@code b}.
	 * Objects match when every member of {@code b} is present in {@code a} and matches recursively.
	 * Arrays are treated as objects indexed by position. Leaves are compared by value.
	 * Null member matches missing member.
	 */
	public static boolean partialMatch(JsonNode a, JsonNode b) {
		a = absent(a) ? null : a;
		b = absent(b) ? null : b;
		if (a == null || b == null)
			return a == b;
		if (a.equals(b))
			return true;
		if (a.isObject() && b.isObject()) {
			for (Iterator<Map.Entry<String, JsonNode>> it = b.fields(); it.hasNext();) {
				Map.Entry<String, JsonNode> member = it.next();
				if (!partialMatch(a.get(member.getKey()), member.getValue()))
					return false;
			}
			return true;
		}
		if (a.isArray() && b.isArray()) {
			for (int i = 0; i < b.size(); ++i)
				if (i >= a.size() || !partialMatch(a.get(i), b.get(i)))
					return false;
			return true;
		}
		return false;
	}
	/*
	 * JSON null member is the same as no member at all.
	 */
	private static boolean absent(JsonNode node) {
		return node == null || node.isNull() || node.isMissingNode();
	}
	public static boolean partialMatch(Object a, Object b) {
		return partialMatch(a != null ? tree(a) : null, b != null ? tree(b) : null);
	}
}
