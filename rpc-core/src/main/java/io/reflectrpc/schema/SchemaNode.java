/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

/**
 * One node of a synthesized type schema. Nodes are produced by the {@link TypeWalker} and
 * rendered by the OpenAPI assembler or the TypeScript generator.
 */
public sealed interface SchemaNode
		permits PrimitiveNode, ArrayNode, MapNode, NullableNode, ReferenceNode, NamedSchemaNode, AnyNode {

	/**
	 * Unconstrained value.
	 */
	SchemaNode ANY = new AnyNode();

}
