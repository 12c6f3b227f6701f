// Part of Refetch
/**
 * Refetch is an in-memory cache and subscription engine for asynchronously fetched, key-addressed resources.
 * <p>
 * The main package {@link com.machinezoo.refetch} contains the client facade, registries, per-resource state machines,
 * and observers. Package {@link com.machinezoo.refetch.util} holds key hashing and other general-purpose helpers.
 * Package {@link com.machinezoo.refetch.time} holds garbage collection timers.
 */
module com.machinezoo.refetch {
	exports com.machinezoo.refetch;
	exports com.machinezoo.refetch.util;
	exports com.machinezoo.refetch.time;
	requires com.machinezoo.stagean;
	requires transitive com.machinezoo.noexception;
	requires com.machinezoo.noexception.slf4j;
	requires transitive com.machinezoo.closeablescope;
	requires org.slf4j;
	requires com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
	/*
	 * Jackson serializes keys and variables into canonical hashes and encodes snapshots.
	 */
	requires com.fasterxml.jackson.databind;
}
