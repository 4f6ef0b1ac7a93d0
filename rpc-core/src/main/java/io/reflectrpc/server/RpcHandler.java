/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.util.Map;

import reactor.core.publisher.Mono;

import io.reflectrpc.common.RpcTransportContext;

/**
 * Looks up an exposed method by name and dispatches an encoded call to it. Transports
 * depend on this interface only.
 */
public interface RpcHandler {

	/**
	 * Handle one call.
	 * @param method the requested method name as received from the transport
	 * @param body the raw request body, may be {@code null}
	 * @param context the ambient context
	 * @return the outcome, never an error signal
	 */
	Mono<RpcResponse> handle(String method, byte[] body, RpcTransportContext context);

	/**
	 * The exposed methods keyed by their declared name.
	 * @return an unmodifiable, name ordered view
	 */
	Map<String, MethodDescriptor> methods();

	/**
	 * The call convention the methods were scanned for.
	 * @return the convention
	 */
	CallConvention convention();

}
