/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * Sequence of uniformly typed items.
 *
 * @param items the item schema
 * @param minItems optional minimum length
 * @param maxItems optional maximum length
 */
public record ArrayNode(SchemaNode items, Integer minItems, Integer maxItems) implements SchemaNode {

	public ArrayNode {
		Assert.notNull(items, "items must not be null");
	}

	public static ArrayNode of(SchemaNode items) {
		return new ArrayNode(items, null, null);
	}

}
