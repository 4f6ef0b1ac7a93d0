/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * One serialized property of an object.
 *
 * @param name the serialized name
 * @param node the property schema
 * @param optional whether the property is omitted when empty
 * @param required whether the property is declared as required
 */
public record SchemaProperty(String name, SchemaNode node, boolean optional, boolean required) {

	public SchemaProperty {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(node, "node must not be null");
	}

}
