/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

/**
 * Value of any shape. Use {@link SchemaNode#ANY}.
 */
public record AnyNode() implements SchemaNode {
}
