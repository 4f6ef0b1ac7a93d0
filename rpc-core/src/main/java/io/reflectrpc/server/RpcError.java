/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import io.reflectrpc.util.Assert;

/**
 * Terminal failure of a single call. Exposed methods may throw it directly to choose the
 * reported {@link RpcErrorKind}; any other exception is reported as
 * {@link RpcErrorKind#INTERNAL_ERROR}.
 */
public class RpcError extends RuntimeException {

	private final RpcErrorKind kind;

	public RpcError(RpcErrorKind kind, String message) {
		this(kind, message, null);
	}

	public RpcError(RpcErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		Assert.notNull(kind, "kind must not be null");
		this.kind = kind;
	}

	public RpcErrorKind getKind() {
		return this.kind;
	}

	/**
	 * Malformed or insufficient encoded input.
	 * @param message the decoder's message
	 * @return the error
	 */
	public static RpcError badRequest(String message) {
		return new RpcError(RpcErrorKind.BAD_REQUEST, message);
	}

	public static RpcError badRequest(String message, Throwable cause) {
		return new RpcError(RpcErrorKind.BAD_REQUEST, message, cause);
	}

	/**
	 * The requested method name is not in the index.
	 * @param method the requested name
	 * @return the error
	 */
	public static RpcError unknownMethod(String method) {
		return new RpcError(RpcErrorKind.NOT_FOUND, "unknown method " + method);
	}

	/**
	 * The invoked method or the session factory failed. The message of the failure becomes
	 * the message of the error.
	 * @param cause the failure
	 * @return the error
	 */
	public static RpcError application(Throwable cause) {
		if (cause instanceof RpcError rpcError) {
			return rpcError;
		}
		return new RpcError(RpcErrorKind.INTERNAL_ERROR, messageOf(cause), cause);
	}

	static String messageOf(Throwable t) {
		String message = t.getMessage();
		return message != null ? message : t.getClass().getName();
	}

}
