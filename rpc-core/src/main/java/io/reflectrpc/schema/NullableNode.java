/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * A value that may be {@code null}. The OpenAPI output renders the inner node as is.
 *
 * @param inner the schema of a present value
 */
public record NullableNode(SchemaNode inner) implements SchemaNode {

	public NullableNode {
		Assert.notNull(inner, "inner must not be null");
	}

	/**
	 * Wrap a node unless it already is nullable.
	 * @param node the node
	 * @return a nullable node
	 */
	public static NullableNode of(SchemaNode node) {
		return node instanceof NullableNode nullable ? nullable : new NullableNode(node);
	}

}
