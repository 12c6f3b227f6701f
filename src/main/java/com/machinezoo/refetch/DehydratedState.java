// Part of Refetch
package com.machinezoo.refetch;

import java.util.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.*;
import com.machinezoo.noexception.*;
import com.machinezoo.refetch.util.*;
import com.machinezoo.stagean.*;

/*
 * JSON layout:
 * 
 * { "queries": [ { "descriptor": { "key": ..., "infinite": true }, "queryHash": ..., "state": { ... }, "variables": ..., "meta": { ... } } ] }
 * 
 * Optional members are omitted when empty. Errors are reduced to their message. Data, variables, and meta are written
 * as plain JSON and read back as maps, lists, and scalars. Pages of infinite resources are written as {pages, pageParams}.
 */
/**
 * Snapshot of cached resources that can be restored in another client, possibly in another process.
 */
@DraftApi("typed data after JSON transfer")
public class DehydratedState {
	private final List<DehydratedQuery> queries;
	public DehydratedState(List<DehydratedQuery> queries) {
		Objects.requireNonNull(queries);
		this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
	}
	public List<DehydratedQuery> queries() {
		return queries;
	}
	public JsonNode toTree() {
		ObjectMapper json = QueryKeys.json();
		ObjectNode root = json.createObjectNode();
		ArrayNode array = root.putArray("queries");
		for (DehydratedQuery query : queries) {
			ObjectNode item = array.addObject();
			ObjectNode descriptor = item.putObject("descriptor");
			descriptor.put("key", query.key());
			if (query.infinite())
				descriptor.put("infinite", true);
			item.put("queryHash", query.queryHash());
			item.set("state", encodeState(query.state()));
			if (query.variables() != null)
				item.set("variables", QueryKeys.tree(query.variables()));
			if (!query.meta().isEmpty())
				item.set("meta", QueryKeys.tree(query.meta()));
		}
		return root;
	}
	private static ObjectNode encodeState(QueryInfoState<Object> state) {
		ObjectNode node = QueryKeys.json().createObjectNode();
		if (state.data() != null)
			node.set("data", encodeData(state.data()));
		node.put("dataUpdatedAt", state.dataUpdatedAt());
		if (state.error() != null)
			node.put("error", String.valueOf(state.error().getMessage()));
		node.put("errorUpdatedAt", state.errorUpdatedAt());
		if (state.fetchMeta() != null && state.fetchMeta().direction() != null)
			node.put("fetchDirection", state.fetchMeta().direction().name());
		node.put("invalidated", state.invalidated());
		node.put("status", state.status().name());
		node.put("fetchStatus", state.fetchStatus().name());
		return node;
	}
	private static JsonNode encodeData(Object data) {
		if (data instanceof InfiniteData) {
			InfiniteData<?, ?> pages = (InfiniteData<?, ?>)data;
			ObjectNode node = QueryKeys.json().createObjectNode();
			node.set("pages", QueryKeys.tree(pages.pages()));
			node.set("pageParams", QueryKeys.tree(pages.pageParams()));
			return node;
		}
		return QueryKeys.tree(data);
	}
	public String toJson() {
		return Exceptions.sneak().get(() -> QueryKeys.json().writeValueAsString(toTree()));
	}
	public static DehydratedState fromTree(JsonNode root) {
		Objects.requireNonNull(root);
		List<DehydratedQuery> queries = new ArrayList<>();
		for (JsonNode item : root.path("queries")) {
			JsonNode descriptor = item.path("descriptor");
			boolean infinite = descriptor.path("infinite").asBoolean(false);
			queries.add(new DehydratedQuery(
				descriptor.path("key").asText(),
				infinite,
				item.path("queryHash").asText(),
				decodeState(item.path("state"), infinite),
				item.hasNonNull("variables") ? plain(item.get("variables")) : null,
				item.hasNonNull("meta") ? meta(item.get("meta")) : null));
		}
		return new DehydratedState(queries);
	}
	private static QueryInfoState<Object> decodeState(JsonNode node, boolean infinite) {
		Object data = null;
		if (node.hasNonNull("data"))
			data = infinite ? pages(node.get("data")) : plain(node.get("data"));
		Throwable error = node.hasNonNull("error") ? new RuntimeException(node.get("error").asText()) : null;
		FetchMeta fetchMeta = node.hasNonNull("fetchDirection") ? FetchMeta.more(FetchDirection.valueOf(node.get("fetchDirection").asText())) : null;
		return QueryInfoState.of(
			data,
			node.path("dataUpdatedAt").asLong(),
			error,
			node.path("errorUpdatedAt").asLong(),
			fetchMeta,
			node.path("invalidated").asBoolean(false),
			QueryStatus.valueOf(node.path("status").asText(QueryStatus.PENDING.name())),
			FetchStatus.valueOf(node.path("fetchStatus").asText(FetchStatus.IDLE.name())));
	}
	@SuppressWarnings("unchecked")
	private static InfiniteData<Object, Object> pages(JsonNode node) {
		List<Object> pages = node.has("pages") ? (List<Object>)plain(node.get("pages")) : Collections.emptyList();
		List<Object> params = node.has("pageParams") ? (List<Object>)plain(node.get("pageParams")) : Collections.emptyList();
		return new InfiniteData<>(pages, params);
	}
	@SuppressWarnings("unchecked")
	private static Map<String, Object> meta(JsonNode node) {
		return (Map<String, Object>)plain(node);
	}
	private static Object plain(JsonNode node) {
		return Exceptions.sneak().get(() -> QueryKeys.json().treeToValue(node, Object.class));
	}
	public static DehydratedState fromJson(String json) {
		Objects.requireNonNull(json);
		return fromTree(Exceptions.sneak().get(() -> QueryKeys.json().readTree(json)));
	}
	@Override
	public String toString() {
		return "DehydratedState[" + queries.size() + " queries]";
	}
}
