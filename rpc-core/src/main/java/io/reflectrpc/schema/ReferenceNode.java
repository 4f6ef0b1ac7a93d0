/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * Reference to a registered component.
 *
 * @param target the registered node
 */
public record ReferenceNode(NamedSchemaNode target) implements SchemaNode {

	public ReferenceNode {
		Assert.notNull(target, "target must not be null");
		Assert.notNull(target.name(), "only named nodes can be referenced");
	}

	public String name() {
		return this.target.name();
	}

	@Override
	public String toString() {
		return "ReferenceNode[" + this.target.name() + "]";
	}

}
