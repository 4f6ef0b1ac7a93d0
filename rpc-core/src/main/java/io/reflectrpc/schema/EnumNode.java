/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.util.List;

import io.reflectrpc.util.Assert;

/**
 * Named string enumeration.
 *
 * @param name the component name
 * @param identity the Java type identity
 * @param values the serialized constant names, in declaration order
 */
public record EnumNode(String name, TypeIdentity identity, List<String> values) implements NamedSchemaNode {

	public EnumNode {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(identity, "identity must not be null");
		Assert.notNull(values, "values must not be null");
		values = List.copyOf(values);
	}

}
