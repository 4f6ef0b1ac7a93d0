/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.openapi;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of the OpenAPI 3.1 document model the assembler produces.
 */
public final class OpenApi {

	public static final String VERSION = "3.1.0";

	public static final String APPLICATION_JSON = "application/json";

	public static final String TEXT_PLAIN = "text/plain";

	public static final String COMPONENTS_PREFIX = "#/components/schemas/";

	private OpenApi() {
	}

	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Document( // @formatter:off
		@JsonProperty("openapi") String openapi,
		@JsonProperty("info") Info info,
		@JsonProperty("servers") List<Server> servers,
		@JsonProperty("paths") Map<String, PathItem> paths,
		@JsonProperty("components") Components components) { // @formatter:on
	}

	public record Info( // @formatter:off
		@JsonProperty("title") String title,
		@JsonProperty("version") String version) { // @formatter:on
	}

	public record Server(@JsonProperty("url") String url) {
	}

	public record PathItem(@JsonProperty("post") Operation post) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Operation( // @formatter:off
		@JsonProperty("operationId") String operationId,
		@JsonProperty("requestBody") RequestBody requestBody,
		@JsonProperty("responses") Map<String, Response> responses) { // @formatter:on
	}

	public record RequestBody( // @formatter:off
		@JsonProperty("required") boolean required,
		@JsonProperty("content") Map<String, MediaType> content) { // @formatter:on
	}

	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Response( // @formatter:off
		@JsonProperty("description") String description,
		@JsonProperty("content") Map<String, MediaType> content) { // @formatter:on
	}

	public record MediaType(@JsonProperty("schema") Schema schema) {
	}

	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Components(@JsonProperty("schemas") Map<String, Schema> schemas) {
	}

	@JsonInclude(JsonInclude.Include.NON_EMPTY)
	public record Schema( // @formatter:off
		@JsonProperty("type") String type,
		@JsonProperty("format") String format,
		@JsonProperty("$ref") String ref,
		@JsonProperty("description") String description,
		@JsonProperty("items") Schema items,
		@JsonProperty("prefixItems") List<Schema> prefixItems,
		@JsonProperty("minItems") Integer minItems,
		@JsonProperty("maxItems") Integer maxItems,
		@JsonProperty("properties") Map<String, Schema> properties,
		@JsonProperty("required") List<String> required,
		@JsonProperty("additionalProperties") Schema additionalProperties,
		@JsonProperty("enum") List<String> enumValues,
		@JsonProperty("minimum") Long minimum,
		@JsonProperty("maximum") Long maximum) { // @formatter:on

		/**
		 * The unconstrained schema, rendered as {@code {}}.
		 */
		public static final Schema ANY = builder().build();

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private String type;

			private String format;

			private String ref;

			private String description;

			private Schema items;

			private List<Schema> prefixItems;

			private Integer minItems;

			private Integer maxItems;

			private Map<String, Schema> properties;

			private List<String> required;

			private Schema additionalProperties;

			private List<String> enumValues;

			private Long minimum;

			private Long maximum;

			public Builder type(String type) {
				this.type = type;
				return this;
			}

			public Builder format(String format) {
				this.format = format;
				return this;
			}

			public Builder ref(String ref) {
				this.ref = ref;
				return this;
			}

			public Builder description(String description) {
				this.description = description;
				return this;
			}

			public Builder items(Schema items) {
				this.items = items;
				return this;
			}

			public Builder prefixItems(List<Schema> prefixItems) {
				this.prefixItems = prefixItems;
				return this;
			}

			public Builder minItems(Integer minItems) {
				this.minItems = minItems;
				return this;
			}

			public Builder maxItems(Integer maxItems) {
				this.maxItems = maxItems;
				return this;
			}

			public Builder properties(Map<String, Schema> properties) {
				this.properties = properties;
				return this;
			}

			public Builder required(List<String> required) {
				this.required = required;
				return this;
			}

			public Builder additionalProperties(Schema additionalProperties) {
				this.additionalProperties = additionalProperties;
				return this;
			}

			public Builder enumValues(List<String> enumValues) {
				this.enumValues = enumValues;
				return this;
			}

			public Builder minimum(Long minimum) {
				this.minimum = minimum;
				return this;
			}

			public Builder maximum(Long maximum) {
				this.maximum = maximum;
				return this;
			}

			public Schema build() {
				return new Schema(this.type, this.format, this.ref, this.description, this.items, this.prefixItems,
						this.minItems, this.maxItems, this.properties, this.required, this.additionalProperties,
						this.enumValues, this.minimum, this.maximum);
			}

		}

	}

}
