/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.common;

import java.util.Collections;

/**
 * Request-scoped key/value context handed to exposed methods that declare it as their
 * first parameter. The transport fills it (for example with the servlet request) and the
 * dispatcher passes it through unmodified.
 */
public interface RpcTransportContext {

	/**
	 * An empty, immutable context.
	 */
	RpcTransportContext EMPTY = new DefaultRpcTransportContext(Collections.emptyMap());

	/**
	 * Create an empty, mutable context.
	 * @return a new context
	 */
	static RpcTransportContext create() {
		return new DefaultRpcTransportContext();
	}

	/**
	 * Extract a value from the context.
	 * @param key the key under which the value was stored
	 * @return the stored value or {@code null}
	 */
	Object get(String key);

	/**
	 * Store a value in the context.
	 * @param key the key
	 * @param value the value
	 */
	void put(String key, Object value);

	/**
	 * Copy the contents of this context into a new, independent instance.
	 * @return the copy
	 */
	RpcTransportContext copy();

}
