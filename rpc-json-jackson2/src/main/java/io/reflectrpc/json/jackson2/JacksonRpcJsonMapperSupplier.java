/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.reflectrpc.json.RpcJsonMapper;
import io.reflectrpc.json.RpcJsonMapperSupplier;

/**
 * A supplier of {@link RpcJsonMapper} instances that uses the Jackson library for JSON
 * serialization and deserialization.
 * <p>
 * The mapper is configured to:
 * <ul>
 * <li>Reject scalar coercions, so {@code "2"} is not an {@code int} and {@code 123} is not
 * a {@code String}</li>
 * <li>Ignore unknown object properties</li>
 * <li>Write {@code java.time} values as ISO-8601 strings</li>
 * <li>Use the {@link ParameterNamesModule} to discover constructor parameter names from
 * bytecode (requires the {@code -parameters} compiler flag)</li>
 * </ul>
 */
public class JacksonRpcJsonMapperSupplier implements RpcJsonMapperSupplier {

	/**
	 * Returns a new instance of {@link RpcJsonMapper} that uses the Jackson library for
	 * JSON serialization and deserialization.
	 * @return a new {@link RpcJsonMapper} instance
	 */
	@Override
	public RpcJsonMapper get() {
		return new JacksonRpcJsonMapper(createStrictMapper());
	}

	/**
	 * Creates the {@link ObjectMapper} used for request arguments and results.
	 * @return a strict ObjectMapper
	 */
	public static ObjectMapper createStrictMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
			.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
			.withCoercionConfig(LogicalType.Textual,
					config -> config.setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
						.setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
						.setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
			.addModule(new ParameterNamesModule())
			.addModule(new Jdk8Module())
			.addModule(new JavaTimeModule())
			.build();
	}

}
