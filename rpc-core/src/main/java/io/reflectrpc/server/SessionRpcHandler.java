/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.util.Assert;

/**
 * {@link RpcHandler} that builds a fresh receiver for every call. The method is resolved
 * first, so an unknown name never reaches the {@link SessionFactory}.
 *
 * @param <T> the receiver type
 */
public class SessionRpcHandler<T> implements RpcHandler {

	private static final Logger logger = LoggerFactory.getLogger(SessionRpcHandler.class);

	private final Class<T> type;

	private final SessionFactory<? extends T> factory;

	private final Map<String, MethodDescriptor> methods;

	private final Map<String, MethodDescriptor> routes;

	private final MethodDispatcher dispatcher;

	public SessionRpcHandler(Class<T> type, SessionFactory<? extends T> factory, MethodDispatcher dispatcher) {
		Assert.notNull(type, "type must not be null");
		Assert.notNull(factory, "factory must not be null");
		Assert.notNull(dispatcher, "dispatcher must not be null");
		this.type = type;
		this.factory = factory;
		this.dispatcher = dispatcher;
		this.methods = MethodScanner.scan(type, CallConvention.POSITIONAL);
		this.routes = DefaultRpcHandler.routes(this.methods, CallConvention.POSITIONAL);
	}

	@Override
	public Mono<RpcResponse> handle(String method, byte[] body, RpcTransportContext context) {
		MethodDescriptor descriptor = DefaultRpcHandler.route(this.routes, method, CallConvention.POSITIONAL);
		if (descriptor == null) {
			logger.debug("Unknown method {} on {}", method, this.type.getSimpleName());
			return Mono.just(RpcResponse.failure(RpcError.unknownMethod(method)));
		}
		return this.dispatcher.dispatchSession(descriptor, this.factory, body, context);
	}

	@Override
	public Map<String, MethodDescriptor> methods() {
		return this.methods;
	}

	@Override
	public CallConvention convention() {
		return CallConvention.POSITIONAL;
	}

	public Class<T> getType() {
		return this.type;
	}

}
