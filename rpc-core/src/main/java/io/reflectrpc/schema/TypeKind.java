/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Closed set of type shapes the {@link TypeWalker} distinguishes. Each constant is handled
 * by an explicit case; {@link #ANY} is the catch-all.
 */
public enum TypeKind {

	/**
	 * A user or default definition is registered for the raw class.
	 */
	OVERRIDE,

	/**
	 * {@code Optional} variants and boxed primitives.
	 */
	NULLABLE,

	/**
	 * Java primitives, {@code String} and {@code BigInteger}.
	 */
	PRIMITIVE,

	/**
	 * {@code byte[]}, encoded as base64 text. {@code Byte[]} is a sequence of numbers.
	 */
	BYTES,

	/**
	 * Arrays and {@code Iterable}s.
	 */
	SEQUENCE,

	/**
	 * {@code Map}s.
	 */
	MAPPING,

	/**
	 * Enumerations, registered by name.
	 */
	ENUM,

	/**
	 * Records and beans with a name, registered.
	 */
	COMPOSITE_NAMED,

	/**
	 * Anonymous or hidden classes, expanded inline.
	 */
	COMPOSITE_ANONYMOUS,

	/**
	 * Anything else.
	 */
	ANY;

	private static final Set<Class<?>> BOXED = Set.of(Integer.class, Long.class, Short.class, Byte.class,
			Float.class, Double.class, Boolean.class, Character.class);

	private static final Set<Class<?>> OPTIONALS = Set.of(Optional.class, OptionalInt.class, OptionalLong.class,
			OptionalDouble.class);

	/**
	 * Classify a type.
	 * @param type the type
	 * @param definitions the raw classes with a registered definition
	 * @return the kind
	 */
	public static TypeKind of(JavaType type, Set<Class<?>> definitions) {
		Class<?> raw = type.getRawClass();
		if (definitions.contains(raw)) {
			return OVERRIDE;
		}
		if (OPTIONALS.contains(raw) || BOXED.contains(raw)) {
			return NULLABLE;
		}
		if (raw.isPrimitive() && raw != void.class) {
			return PRIMITIVE;
		}
		if (raw == String.class || raw == BigInteger.class) {
			return PRIMITIVE;
		}
		if (raw == byte[].class) {
			return BYTES;
		}
		if (type.isArrayType() || type.isCollectionLikeType() || Iterable.class.isAssignableFrom(raw)) {
			return SEQUENCE;
		}
		if (type.isMapLikeType() || Map.class.isAssignableFrom(raw)) {
			return MAPPING;
		}
		if (type.isEnumType()) {
			return ENUM;
		}
		if (raw == Object.class || raw.isInterface() || Modifier.isAbstract(raw.getModifiers())
				|| JsonNode.class.isAssignableFrom(raw) || raw.isAnnotation()) {
			return ANY;
		}
		if (raw.isAnonymousClass() || raw.isHidden()) {
			return COMPOSITE_ANONYMOUS;
		}
		if (isPlatformType(raw)) {
			return ANY;
		}
		return COMPOSITE_NAMED;
	}

	private static boolean isPlatformType(Class<?> raw) {
		String name = raw.getName();
		return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
				|| name.startsWith("sun.");
	}

}
