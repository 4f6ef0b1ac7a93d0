/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.json.jackson2;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.reflectrpc.json.RpcJsonMapper;

/**
 * Jackson-based implementation of {@link RpcJsonMapper}. Wraps a Jackson
 * {@link ObjectMapper} but keeps the RPC core decoupled from Jackson at the codec seam.
 */
public final class JacksonRpcJsonMapper implements RpcJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonRpcJsonMapper instance with the given ObjectMapper.
	 * @param objectMapper the ObjectMapper to be used for JSON serialization and
	 * deserialization. Must not be null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null.
	 */
	public JacksonRpcJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper} used for JSON serialization and
	 * deserialization.
	 * @return the ObjectMapper instance
	 */
	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public <T> T readValue(byte[] content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public Object readValue(byte[] content, Type type) throws IOException {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type);
		return objectMapper.readValue(content, javaType);
	}

	@Override
	public List<byte[]> readArrayElements(byte[] content) throws IOException {
		JsonNode node = objectMapper.readTree(content);
		if (node == null || node.isMissingNode() || node.isNull()) {
			return Collections.emptyList();
		}
		if (!node.isArray()) {
			throw new JsonMappingException(null, "Expected JSON array but got " + node.getNodeType());
		}
		List<byte[]> elements = new ArrayList<>(node.size());
		for (JsonNode element : node) {
			elements.add(objectMapper.writeValueAsBytes(element));
		}
		return elements;
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return objectMapper.writeValueAsBytes(value);
	}

}
