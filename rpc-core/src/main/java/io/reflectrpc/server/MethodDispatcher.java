/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.json.RpcJsonMapper;
import io.reflectrpc.util.Assert;
import io.reflectrpc.util.Utils;

/**
 * Binds encoded arguments to a {@link MethodDescriptor}, invokes the method and encodes
 * the outcome.
 * <p>
 * The returned {@link Mono} never signals an error: decode failures become
 * {@link RpcErrorKind#BAD_REQUEST}, failures of the method or of the session factory
 * become {@link RpcErrorKind#INTERNAL_ERROR} with the failure's message as the body.
 * Nothing is retried. The dispatcher holds no per-call state and may be shared.
 */
public class MethodDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(MethodDispatcher.class);

	private final RpcJsonMapper jsonMapper;

	public MethodDispatcher(RpcJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Dispatch to the receiver the descriptor is bound to.
	 * @param descriptor a bound descriptor
	 * @param body the raw request body, may be {@code null}
	 * @param context the ambient context
	 * @return the outcome
	 */
	public Mono<RpcResponse> dispatch(MethodDescriptor descriptor, byte[] body, RpcTransportContext context) {
		Assert.notNull(descriptor, "descriptor must not be null");
		Assert.isTrue(descriptor.isBound(), "descriptor " + descriptor.name() + " is not bound to a receiver");
		return dispatch(descriptor, descriptor.receiver(), body, context);
	}

	/**
	 * Dispatch to a receiver created for this call. The factory runs first; when it fails
	 * the method is not invoked.
	 * @param descriptor the descriptor, bound or not
	 * @param factory creates the receiver from the ambient context
	 * @param body the raw request body, may be {@code null}
	 * @param context the ambient context
	 * @return the outcome
	 */
	public Mono<RpcResponse> dispatchSession(MethodDescriptor descriptor, SessionFactory<?> factory, byte[] body,
			RpcTransportContext context) {
		Assert.notNull(descriptor, "descriptor must not be null");
		Assert.notNull(factory, "factory must not be null");
		return Mono.defer(() -> {
			Object receiver;
			try {
				receiver = factory.create(context);
			}
			catch (Exception e) {
				logger.warn("Session factory failed for {}: {}", descriptor.name(), e.getMessage());
				return Mono.just(RpcResponse.failure(RpcError.application(e)));
			}
			if (receiver == null) {
				return Mono.just(RpcResponse.failure(RpcErrorKind.INTERNAL_ERROR, "session factory returned null"));
			}
			return dispatch(descriptor, receiver, body, context);
		});
	}

	/**
	 * Dispatch to an explicit receiver.
	 * @param descriptor the descriptor
	 * @param receiver the instance to invoke the method on
	 * @param body the raw request body, may be {@code null}
	 * @param context the ambient context
	 * @return the outcome
	 */
	public Mono<RpcResponse> dispatch(MethodDescriptor descriptor, Object receiver, byte[] body,
			RpcTransportContext context) {
		Assert.notNull(descriptor, "descriptor must not be null");
		Assert.notNull(receiver, "receiver must not be null");
		return Mono.defer(() -> {
			Object[] arguments;
			try {
				arguments = bindArguments(descriptor, body, context);
			}
			catch (RpcError e) {
				logger.debug("Rejected call of {}: {}", descriptor.name(), e.getMessage());
				return Mono.just(RpcResponse.failure(e));
			}
			return invoke(descriptor, receiver, arguments);
		});
	}

	Object[] bindArguments(MethodDescriptor descriptor, byte[] body, RpcTransportContext context) {
		int offset = descriptor.acceptsContext() ? 1 : 0;
		Object[] arguments = new Object[offset + descriptor.arity()];
		if (descriptor.acceptsContext()) {
			arguments[0] = context != null ? context : RpcTransportContext.EMPTY;
		}
		if (descriptor.convention() == CallConvention.SINGLE_PAYLOAD) {
			if (descriptor.arity() == 0) {
				return arguments;
			}
			if (Utils.isBlank(body)) {
				throw RpcError.badRequest("payload required");
			}
			arguments[offset] = decode(body, descriptor, 0);
			return arguments;
		}

		List<byte[]> elements;
		try {
			elements = Utils.isBlank(body) ? List.of() : this.jsonMapper.readArrayElements(body);
		}
		catch (IOException e) {
			throw RpcError.badRequest(e.getMessage(), e);
		}
		if (elements.size() < descriptor.arity()) {
			throw RpcError.badRequest("not enough arguments, expected " + descriptor.arity());
		}
		for (int i = 0; i < descriptor.arity(); i++) {
			arguments[offset + i] = decode(elements.get(i), descriptor, i);
		}
		return arguments;
	}

	private Object decode(byte[] element, MethodDescriptor descriptor, int index) {
		try {
			return this.jsonMapper.readValue(element, descriptor.argumentTypes().get(index));
		}
		catch (IOException e) {
			throw RpcError.badRequest("argument " + descriptor.argumentNames().get(index) + ": " + e.getMessage(),
					e);
		}
	}

	private Mono<RpcResponse> invoke(MethodDescriptor descriptor, Object receiver, Object[] arguments) {
		Object result;
		try {
			result = descriptor.method().invoke(receiver, arguments);
		}
		catch (InvocationTargetException e) {
			return Mono.just(applicationFailure(descriptor, e.getCause() != null ? e.getCause() : e));
		}
		catch (IllegalAccessException | IllegalArgumentException e) {
			logger.error("Failed to invoke {}", descriptor.method(), e);
			return Mono.just(applicationFailure(descriptor, e));
		}

		switch (descriptor.resultShape()) {
			case NONE:
				return Mono.just(RpcResponse.noContent());
			case ERROR:
				if (result != null) {
					return Mono.just(applicationFailure(descriptor, (Throwable) result));
				}
				return Mono.just(RpcResponse.noContent());
			case ASYNC:
				return fromAsync(descriptor, result);
			default:
				return Mono.just(encode(descriptor, result));
		}
	}

	private Mono<RpcResponse> fromAsync(MethodDescriptor descriptor, Object result) {
		Mono<?> mono;
		if (result == null) {
			mono = Mono.empty();
		}
		else if (result instanceof Mono<?> publisher) {
			mono = publisher;
		}
		else {
			mono = Mono.fromCompletionStage((CompletionStage<?>) result);
		}
		return mono.<RpcResponse>map(value -> encode(descriptor, value))
			.switchIfEmpty(Mono.fromSupplier(() -> encode(descriptor, null)))
			.onErrorResume(t -> Mono.just(applicationFailure(descriptor, t)));
	}

	private RpcResponse encode(MethodDescriptor descriptor, Object value) {
		if (!descriptor.producesValue()) {
			return RpcResponse.noContent();
		}
		try {
			return RpcResponse.ok(this.jsonMapper.writeValueAsBytes(value));
		}
		catch (IOException e) {
			logger.error("Failed to encode result of {}", descriptor.name(), e);
			return RpcResponse.failure(RpcErrorKind.INTERNAL_ERROR, "encode result: " + e.getMessage());
		}
	}

	private RpcResponse applicationFailure(MethodDescriptor descriptor, Throwable t) {
		RpcError error = RpcError.application(t);
		logger.warn("Method {} failed: {}", descriptor.name(), error.getMessage());
		return RpcResponse.failure(error);
	}

}
