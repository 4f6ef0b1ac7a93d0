/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.json;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Abstraction for JSON serialization/deserialization to decouple the RPC core from any
 * specific JSON library. A default implementation backed by Jackson is provided in
 * {@code io.reflectrpc.json.jackson2.JacksonRpcJsonMapper}.
 * <p>
 * Implementations are expected to decode strictly: a value whose JSON shape does not match
 * the target type (for example a number for a string, or a string for a number) must fail
 * with an {@link IOException} instead of being coerced.
 */
public interface RpcJsonMapper {

	/**
	 * Deserialize JSON bytes into a target type.
	 * @param content JSON as bytes
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON string into a target type.
	 * @param content JSON as String
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON bytes into an arbitrary reflective type, such as the generic type
	 * of a method parameter.
	 * @param content JSON as bytes
	 * @param type target type
	 * @return deserialized instance
	 * @throws IOException on parse errors or type mismatches
	 */
	Object readValue(byte[] content, Type type) throws IOException;

	/**
	 * Split a JSON array into its elements, each one still encoded. A JSON {@code null}
	 * is treated as an empty array.
	 * @param content JSON array as bytes
	 * @return the encoded elements in order
	 * @throws IOException if the content is not a JSON array
	 */
	List<byte[]> readArrayElements(byte[] content) throws IOException;

	/**
	 * Serialize an object to JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Serialize an object to JSON bytes.
	 * @param value object to serialize
	 * @return JSON as bytes
	 * @throws IOException on serialization errors
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Resolves the default {@link RpcJsonMapper}.
	 * @return The default {@link RpcJsonMapper}
	 * @throws IllegalStateException If no {@link RpcJsonMapper} implementation exists on
	 * the classpath.
	 */
	static RpcJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(RpcJsonMapperSupplier.class).stream().flatMap(p -> {
			try {
				RpcJsonMapperSupplier supplier = p.get();
				return Stream.ofNullable(supplier);
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).flatMap(jsonMapperSupplier -> {
			try {
				return Stream.of(jsonMapperSupplier.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			else {
				return new IllegalStateException("No default RpcJsonMapper implementation found");
			}
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default RpcJsonMapper", toAdd);
			}
			else {
				existing.addSuppressed(toAdd);
				return existing;
			}
		});
	}

}
