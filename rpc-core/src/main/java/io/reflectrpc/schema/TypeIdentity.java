/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import com.fasterxml.jackson.databind.JavaType;

import io.reflectrpc.util.Assert;

/**
 * Stable identity of a Java type across one synthesis pass. Parameterizations are part
 * of the identity, so {@code Page<User>} and {@code Page<Item>} are distinct.
 *
 * @param packageName the package of the raw class, empty for the default package
 * @param typeName the canonical generic type name
 */
public record TypeIdentity(String packageName, String typeName) {

	public TypeIdentity {
		Assert.notNull(packageName, "packageName must not be null");
		Assert.hasText(typeName, "typeName must not be empty");
	}

	public static TypeIdentity of(JavaType type) {
		Assert.notNull(type, "type must not be null");
		return new TypeIdentity(type.getRawClass().getPackageName(), type.toCanonical());
	}

}
