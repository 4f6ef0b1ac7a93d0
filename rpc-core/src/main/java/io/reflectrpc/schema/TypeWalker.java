/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.lang.reflect.Type;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.type.TypeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.reflectrpc.util.Assert;

/**
 * Turns Java types into {@link SchemaNode}s.
 * <p>
 * Named composites and enums are registered in the walker's {@link ComponentRegistry}
 * and returned as {@link ReferenceNode}s. A composite is registered before its properties
 * are walked, so self-referential and mutually referential types terminate. Properties are
 * discovered with Jackson's serialization introspection and therefore follow
 * {@code @JsonProperty}, {@code @JsonIgnore} and {@code @JsonInclude}.
 * <p>
 * A walker is one synthesis pass and is not thread-safe.
 */
public class TypeWalker {

	private static final Logger logger = LoggerFactory.getLogger(TypeWalker.class);

	private final ObjectMapper objectMapper;

	private final TypeFactory typeFactory;

	private final Map<Class<?>, SchemaNode> definitions;

	private final ComponentRegistry registry = new ComponentRegistry();

	public TypeWalker(SchemaOptions options) {
		Assert.notNull(options, "options must not be null");
		this.objectMapper = options.objectMapper();
		this.typeFactory = this.objectMapper.getTypeFactory();
		this.definitions = options.definitions();
	}

	public ComponentRegistry registry() {
		return this.registry;
	}

	public SchemaNode walk(Type type) {
		Assert.notNull(type, "type must not be null");
		return walk(this.typeFactory.constructType(type));
	}

	public SchemaNode walk(JavaType type) {
		Assert.notNull(type, "type must not be null");
		TypeKind kind = TypeKind.of(type, this.definitions.keySet());
		switch (kind) {
			case OVERRIDE:
				return this.definitions.get(type.getRawClass());
			case NULLABLE:
				return NullableNode.of(walk(presentType(type)));
			case PRIMITIVE:
				return primitive(type.getRawClass());
			case BYTES:
				return PrimitiveNode.BYTES;
			case SEQUENCE:
				return ArrayNode.of(walk(elementType(type)));
			case MAPPING:
				return new MapNode(walk(type.getContentType() != null ? type.getContentType() : unknown()));
			case ENUM:
				return enumeration(type);
			case COMPOSITE_NAMED:
				return namedComposite(type);
			case COMPOSITE_ANONYMOUS:
				return populate(ObjectNode.anonymous(), type);
			default:
				return SchemaNode.ANY;
		}
	}

	private JavaType presentType(JavaType type) {
		Class<?> raw = type.getRawClass();
		if (raw == OptionalInt.class) {
			return this.typeFactory.constructType(int.class);
		}
		if (raw == OptionalLong.class) {
			return this.typeFactory.constructType(long.class);
		}
		if (raw == OptionalDouble.class) {
			return this.typeFactory.constructType(double.class);
		}
		if (type.isReferenceType()) {
			return type.getReferencedType();
		}
		if (raw.isPrimitive() || raw.getTypeParameters().length == 0) {
			// boxed primitive
			return this.typeFactory.constructType(unbox(raw));
		}
		return type.containedTypeOrUnknown(0);
	}

	private JavaType elementType(JavaType type) {
		if (type.getContentType() != null) {
			return type.getContentType();
		}
		JavaType[] parameters = type.findTypeParameters(Iterable.class);
		return parameters.length > 0 ? parameters[0] : unknown();
	}

	private JavaType unknown() {
		return TypeFactory.unknownType();
	}

	private static Class<?> unbox(Class<?> boxed) {
		if (boxed == Integer.class) {
			return int.class;
		}
		if (boxed == Long.class) {
			return long.class;
		}
		if (boxed == Short.class) {
			return short.class;
		}
		if (boxed == Byte.class) {
			return byte.class;
		}
		if (boxed == Float.class) {
			return float.class;
		}
		if (boxed == Double.class) {
			return double.class;
		}
		if (boxed == Boolean.class) {
			return boolean.class;
		}
		return char.class;
	}

	static PrimitiveNode primitive(Class<?> raw) {
		if (raw == int.class) {
			return PrimitiveNode.INT32;
		}
		if (raw == long.class) {
			return PrimitiveNode.INT64;
		}
		if (raw == short.class) {
			return PrimitiveNode.INT16;
		}
		if (raw == byte.class) {
			return PrimitiveNode.INT8;
		}
		if (raw == float.class) {
			return PrimitiveNode.FLOAT;
		}
		if (raw == double.class) {
			return PrimitiveNode.DOUBLE;
		}
		if (raw == boolean.class) {
			return PrimitiveNode.BOOLEAN;
		}
		if (raw == BigInteger.class) {
			return PrimitiveNode.INTEGER;
		}
		return PrimitiveNode.STRING;
	}

	private SchemaNode enumeration(JavaType type) {
		TypeIdentity identity = TypeIdentity.of(type);
		NamedSchemaNode existing = this.registry.lookup(identity);
		if (existing != null) {
			return new ReferenceNode(existing);
		}
		Class<?> raw = type.getRawClass();
		List<String> values = new ArrayList<>();
		for (Object constant : raw.getEnumConstants()) {
			values.add(serializedName((Enum<?>) constant));
		}
		EnumNode node = new EnumNode(this.registry.allocateName(raw.getSimpleName()), identity, values);
		this.registry.register(node);
		return new ReferenceNode(node);
	}

	private static String serializedName(Enum<?> constant) {
		try {
			JsonProperty property = constant.getDeclaringClass()
				.getField(constant.name())
				.getAnnotation(JsonProperty.class);
			if (property != null && !property.value().isEmpty()) {
				return property.value();
			}
		}
		catch (NoSuchFieldException e) {
			logger.debug("No field for enum constant {}", constant.name());
		}
		return constant.name();
	}

	private SchemaNode namedComposite(JavaType type) {
		TypeIdentity identity = TypeIdentity.of(type);
		NamedSchemaNode existing = this.registry.lookup(identity);
		if (existing != null) {
			return new ReferenceNode(existing);
		}
		ObjectNode node = ObjectNode.named(this.registry.allocateName(type.getRawClass().getSimpleName()), identity);
		// registered before the properties are walked so that cycles resolve to this node
		this.registry.register(node);
		populate(node, type);
		return new ReferenceNode(node);
	}

	private ObjectNode populate(ObjectNode node, JavaType type) {
		SerializationConfig config = this.objectMapper.getSerializationConfig();
		BeanDescription description = config.introspect(type);
		JsonInclude.Value classInclusion = description
			.findPropertyInclusion(config.getDefaultPropertyInclusion(type.getRawClass(), JsonInclude.Value.empty()));
		for (BeanPropertyDefinition property : description.findProperties()) {
			if (!property.couldSerialize()) {
				continue;
			}
			JsonInclude.Value inclusion = classInclusion.withOverrides(property.findInclusion());
			node.addProperty(new SchemaProperty(property.getName(), walk(property.getPrimaryType()),
					isOptional(inclusion), property.isRequired()));
		}
		logger.debug("Walked {} into {} properties", type, node.properties().size());
		return node;
	}

	private static boolean isOptional(JsonInclude.Value inclusion) {
		JsonInclude.Include value = inclusion.getValueInclusion();
		return value != JsonInclude.Include.ALWAYS && value != JsonInclude.Include.USE_DEFAULTS;
	}

}
