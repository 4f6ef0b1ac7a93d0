/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.util.Assert;
import io.reflectrpc.util.Utils;

/**
 * {@link RpcHandler} over a single long-lived receiver. Positional methods are looked up
 * case-insensitively, single-payload methods by their exact name.
 */
public class DefaultRpcHandler implements RpcHandler {

	private static final Logger logger = LoggerFactory.getLogger(DefaultRpcHandler.class);

	private final Map<String, MethodDescriptor> methods;

	private final Map<String, MethodDescriptor> routes;

	private final CallConvention convention;

	private final MethodDispatcher dispatcher;

	public DefaultRpcHandler(Map<String, MethodDescriptor> methods, CallConvention convention,
			MethodDispatcher dispatcher) {
		Assert.notNull(methods, "methods must not be null");
		Assert.notNull(convention, "convention must not be null");
		Assert.notNull(dispatcher, "dispatcher must not be null");
		this.methods = methods;
		this.convention = convention;
		this.dispatcher = dispatcher;
		this.routes = routes(methods, convention);
	}

	/**
	 * The routing table for the given methods. Positional routes are lower-cased names;
	 * when two names differ only in case the first one in iteration order keeps the route.
	 * Single-payload routes are the names themselves.
	 * @param methods descriptors keyed by method name
	 * @param convention the convention the methods were scanned for
	 * @return the methods keyed by route, in the iteration order of {@code methods}
	 */
	public static Map<String, MethodDescriptor> routes(Map<String, MethodDescriptor> methods,
			CallConvention convention) {
		if (convention == CallConvention.SINGLE_PAYLOAD) {
			return methods;
		}
		Map<String, MethodDescriptor> routes = new LinkedHashMap<>();
		methods.forEach((name, descriptor) -> {
			MethodDescriptor previous = routes.putIfAbsent(Utils.routingKey(name), descriptor);
			if (previous != null) {
				logger.warn("Methods {} and {} share the route {}, keeping {}", previous.name(), name,
						Utils.routingKey(name), previous.name());
			}
		});
		return Collections.unmodifiableMap(routes);
	}

	static MethodDescriptor route(Map<String, MethodDescriptor> routes, String method, CallConvention convention) {
		if (method == null) {
			return null;
		}
		return routes.get(convention == CallConvention.POSITIONAL ? Utils.routingKey(method) : method);
	}

	@Override
	public Mono<RpcResponse> handle(String method, byte[] body, RpcTransportContext context) {
		MethodDescriptor descriptor = route(this.routes, method, this.convention);
		if (descriptor == null) {
			logger.debug("Unknown method {}", method);
			return Mono.just(RpcResponse.failure(RpcError.unknownMethod(method)));
		}
		return this.dispatcher.dispatch(descriptor, body, context);
	}

	@Override
	public Map<String, MethodDescriptor> methods() {
		return this.methods;
	}

	@Override
	public CallConvention convention() {
		return this.convention;
	}

}
