/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * Open-ended object whose keys are strings and whose values share one schema.
 *
 * @param values the value schema
 */
public record MapNode(SchemaNode values) implements SchemaNode {

	public MapNode {
		Assert.notNull(values, "values must not be null");
	}

}
