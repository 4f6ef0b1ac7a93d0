/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

/**
 * How arguments of an exposed method travel in the request body.
 */
public enum CallConvention {

	/**
	 * All data arguments form one JSON array, in declaration order. Method names are
	 * matched case-insensitively.
	 */
	POSITIONAL,

	/**
	 * At most one data argument, sent as the whole body. Method names are matched
	 * case-sensitively.
	 */
	SINGLE_PAYLOAD

}
