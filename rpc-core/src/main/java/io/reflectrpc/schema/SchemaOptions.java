/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.reflectrpc.json.jackson2.JacksonRpcJsonMapperSupplier;
import io.reflectrpc.util.Assert;

/**
 * Settings of a schema synthesis pass: document metadata and the definitions that replace
 * the walker's structural handling of specific classes.
 */
public final class SchemaOptions {

	public static final String DEFAULT_TITLE = "API";

	public static final String DEFAULT_VERSION = "0.0.0";

	private final String title;

	private final String version;

	private final List<String> servers;

	private final Map<Class<?>, SchemaNode> definitions;

	private final ObjectMapper objectMapper;

	private SchemaOptions(Builder builder) {
		this.title = builder.title;
		this.version = builder.version;
		this.servers = List.copyOf(builder.servers);
		this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.definitions));
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper
				: JacksonRpcJsonMapperSupplier.createStrictMapper();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static SchemaOptions defaults() {
		return builder().build();
	}

	public String title() {
		return this.title;
	}

	public String version() {
		return this.version;
	}

	public List<String> servers() {
		return this.servers;
	}

	public Map<Class<?>, SchemaNode> definitions() {
		return this.definitions;
	}

	/**
	 * The mapper whose introspection decides property names and visibility. It should be
	 * the mapper the dispatcher decodes with.
	 * @return the object mapper
	 */
	public ObjectMapper objectMapper() {
		return this.objectMapper;
	}

	/**
	 * Definitions for JDK value types whose JSON form is a string or number rather than
	 * their bean structure.
	 * @return a mutable map of the default definitions
	 */
	public static Map<Class<?>, SchemaNode> defaultDefinitions() {
		PrimitiveNode dateTime = PrimitiveNode.format("string", "date-time");
		Map<Class<?>, SchemaNode> definitions = new LinkedHashMap<>();
		definitions.put(Instant.class, dateTime);
		definitions.put(OffsetDateTime.class, dateTime);
		definitions.put(ZonedDateTime.class, dateTime);
		definitions.put(LocalDateTime.class, dateTime);
		definitions.put(Date.class, dateTime);
		definitions.put(LocalDate.class, PrimitiveNode.format("string", "date"));
		definitions.put(LocalTime.class, PrimitiveNode.format("string", "time"));
		definitions.put(Duration.class, PrimitiveNode.described("string", "duration in ISO-8601 format"));
		definitions.put(BigDecimal.class, PrimitiveNode.described("number", "precise representation of decimal value"));
		definitions.put(UUID.class, PrimitiveNode.format("string", "uuid"));
		definitions.put(URI.class, PrimitiveNode.format("string", "uri"));
		return definitions;
	}

	public static class Builder {

		private String title = DEFAULT_TITLE;

		private String version = DEFAULT_VERSION;

		private final List<String> servers = new ArrayList<>();

		private final Map<Class<?>, SchemaNode> definitions = defaultDefinitions();

		private ObjectMapper objectMapper;

		public Builder title(String title) {
			Assert.notNull(title, "title must not be null");
			this.title = title;
			return this;
		}

		public Builder version(String version) {
			Assert.notNull(version, "version must not be null");
			this.version = version;
			return this;
		}

		public Builder server(String url) {
			Assert.hasText(url, "server url must not be empty");
			this.servers.add(url);
			return this;
		}

		/**
		 * Describe a class with a fixed schema instead of walking it. Replaces a default
		 * definition for the same class.
		 * @param type the class
		 * @param node the schema used wherever the class appears
		 * @return this builder
		 */
		public Builder define(Class<?> type, SchemaNode node) {
			Assert.notNull(type, "type must not be null");
			Assert.notNull(node, "node must not be null");
			this.definitions.put(type, node);
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public SchemaOptions build() {
			return new SchemaOptions(this);
		}

	}

}
