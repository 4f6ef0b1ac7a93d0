/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

/**
 * What an exposed method hands back to the dispatcher.
 */
public enum ResultShape {

	/**
	 * {@code void}: nothing.
	 */
	NONE,

	/**
	 * A plain value.
	 */
	VALUE,

	/**
	 * A {@link Throwable}: {@code null} means success, anything else is the failure.
	 */
	ERROR,

	/**
	 * A {@code Mono} or {@code CompletionStage} carrying either a value or a failure.
	 */
	ASYNC

}
