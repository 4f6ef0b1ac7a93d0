/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import io.reflectrpc.util.Assert;

/**
 * Scalar leaf.
 *
 * @param type the JSON type: {@code integer}, {@code number}, {@code string} or
 * {@code boolean}
 * @param format optional format hint
 * @param minimum optional lower bound
 * @param maximum optional upper bound
 * @param description optional free text
 */
public record PrimitiveNode(String type, String format, Long minimum, Long maximum,
		String description) implements SchemaNode {

	public static final PrimitiveNode INT8 = new PrimitiveNode("integer", null, (long) Byte.MIN_VALUE,
			(long) Byte.MAX_VALUE, null);

	public static final PrimitiveNode INT16 = new PrimitiveNode("integer", null, (long) Short.MIN_VALUE,
			(long) Short.MAX_VALUE, null);

	public static final PrimitiveNode INT32 = format("integer", "int32");

	public static final PrimitiveNode INT64 = format("integer", "int64");

	public static final PrimitiveNode INTEGER = of("integer");

	public static final PrimitiveNode FLOAT = format("number", "float");

	public static final PrimitiveNode DOUBLE = format("number", "double");

	public static final PrimitiveNode BOOLEAN = of("boolean");

	public static final PrimitiveNode STRING = of("string");

	/**
	 * Base64 encoded byte sequence.
	 */
	public static final PrimitiveNode BYTES = format("string", "byte");

	public PrimitiveNode {
		Assert.hasText(type, "type must not be empty");
	}

	public static PrimitiveNode of(String type) {
		return new PrimitiveNode(type, null, null, null, null);
	}

	public static PrimitiveNode format(String type, String format) {
		return new PrimitiveNode(type, format, null, null, null);
	}

	public static PrimitiveNode described(String type, String description) {
		return new PrimitiveNode(type, null, null, null, description);
	}

	public boolean isNumeric() {
		return "integer".equals(this.type) || "number".equals(this.type);
	}

}
