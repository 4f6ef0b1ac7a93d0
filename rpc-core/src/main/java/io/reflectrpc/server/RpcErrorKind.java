/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

/**
 * The failure classes reported to the transport layer. Mapping them to status codes is the
 * transport's job.
 */
public enum RpcErrorKind {

	/**
	 * The request body could not be decoded into the method's arguments, or there were
	 * not enough arguments.
	 */
	BAD_REQUEST,

	/**
	 * The requested method is not exposed.
	 */
	NOT_FOUND,

	/**
	 * The invoked method, or the session factory, failed.
	 */
	INTERNAL_ERROR

}
