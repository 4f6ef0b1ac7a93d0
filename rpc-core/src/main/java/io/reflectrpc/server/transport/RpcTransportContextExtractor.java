/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server.transport;

import io.reflectrpc.common.RpcTransportContext;

/**
 * Fills the ambient context of a call from the transport's request.
 *
 * @param <T> the request type
 */
@FunctionalInterface
public interface RpcTransportContextExtractor<T> {

	/**
	 * @param request the incoming request
	 * @param transportContext a fresh, empty context
	 * @return the context handed to the invoked method
	 */
	RpcTransportContext extract(T request, RpcTransportContext transportContext);

}
