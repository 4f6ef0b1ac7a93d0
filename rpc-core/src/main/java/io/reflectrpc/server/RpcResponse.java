/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.nio.charset.StandardCharsets;

import io.reflectrpc.util.Assert;

/**
 * Outcome of one dispatched call: either an encoded result (possibly no body at all) or an
 * {@link RpcErrorKind} with a plain-text message as the body.
 *
 * @param error the failure class, {@code null} on success
 * @param body the encoded result or the failure text, {@code null} when there is no body
 */
public record RpcResponse(RpcErrorKind error, byte[] body) {

	private static final RpcResponse NO_CONTENT = new RpcResponse(null, null);

	public static RpcResponse ok(byte[] body) {
		Assert.notNull(body, "body must not be null");
		return new RpcResponse(null, body);
	}

	public static RpcResponse noContent() {
		return NO_CONTENT;
	}

	public static RpcResponse failure(RpcErrorKind kind, String message) {
		Assert.notNull(kind, "kind must not be null");
		return new RpcResponse(kind, (message != null ? message : "").getBytes(StandardCharsets.UTF_8));
	}

	public static RpcResponse failure(RpcError error) {
		return failure(error.getKind(), error.getMessage());
	}

	public boolean isSuccess() {
		return this.error == null;
	}

	public boolean hasBody() {
		return this.body != null;
	}

	/**
	 * The body decoded as UTF-8, or an empty string when there is no body.
	 * @return the body text
	 */
	public String bodyAsString() {
		return this.body != null ? new String(this.body, StandardCharsets.UTF_8) : "";
	}

	@Override
	public String toString() {
		return "RpcResponse[error=" + this.error + ", body=" + bodyAsString() + "]";
	}

}
