/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

/**
 * A node that can be registered in the {@link ComponentRegistry} and referenced by name.
 */
public sealed interface NamedSchemaNode extends SchemaNode permits ObjectNode, EnumNode {

	/**
	 * The component name, {@code null} for anonymous objects.
	 * @return the name
	 */
	String name();

	/**
	 * The identity of the Java type the node was built from, {@code null} for anonymous
	 * objects.
	 * @return the identity
	 */
	TypeIdentity identity();

}
