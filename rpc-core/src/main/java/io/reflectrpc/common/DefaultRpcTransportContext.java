/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.common;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.reflectrpc.util.Assert;

/**
 * Default implementation for {@link RpcTransportContext} which uses a thread-safe map.
 */
public class DefaultRpcTransportContext implements RpcTransportContext {

	private final Map<String, Object> storage;

	public DefaultRpcTransportContext() {
		this.storage = new ConcurrentHashMap<>();
	}

	DefaultRpcTransportContext(Map<String, Object> storage) {
		this.storage = storage;
	}

	@Override
	public Object get(String key) {
		return this.storage.get(key);
	}

	@Override
	public void put(String key, Object value) {
		Assert.notNull(key, "key must not be null");
		Assert.notNull(value, "value must not be null");
		this.storage.put(key, value);
	}

	@Override
	public RpcTransportContext copy() {
		return new DefaultRpcTransportContext(new ConcurrentHashMap<>(this.storage));
	}

	@Override
	public String toString() {
		return "DefaultRpcTransportContext" + this.storage.keySet();
	}

}
