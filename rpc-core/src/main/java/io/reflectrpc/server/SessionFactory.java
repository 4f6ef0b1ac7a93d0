/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import io.reflectrpc.common.RpcTransportContext;

/**
 * Creates a fresh receiver for every request. A failure is reported as
 * {@link RpcErrorKind#INTERNAL_ERROR} and no method is invoked.
 *
 * @param <T> the receiver type
 */
@FunctionalInterface
public interface SessionFactory<T> {

	T create(RpcTransportContext context) throws Exception;

}
