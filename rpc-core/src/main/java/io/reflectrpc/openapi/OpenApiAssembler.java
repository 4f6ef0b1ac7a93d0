/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.openapi;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.reflectrpc.schema.AnyNode;
import io.reflectrpc.schema.ArrayNode;
import io.reflectrpc.schema.EnumNode;
import io.reflectrpc.schema.MapNode;
import io.reflectrpc.schema.NamedSchemaNode;
import io.reflectrpc.schema.NullableNode;
import io.reflectrpc.schema.ObjectNode;
import io.reflectrpc.schema.PrimitiveNode;
import io.reflectrpc.schema.ReferenceNode;
import io.reflectrpc.schema.SchemaNode;
import io.reflectrpc.schema.SchemaOptions;
import io.reflectrpc.schema.SchemaProperty;
import io.reflectrpc.schema.TypeWalker;
import io.reflectrpc.server.CallConvention;
import io.reflectrpc.server.DefaultRpcHandler;
import io.reflectrpc.server.MethodDescriptor;
import io.reflectrpc.server.RpcHandler;
import io.reflectrpc.util.Assert;
import io.reflectrpc.util.Utils;

/**
 * Builds an OpenAPI 3.1 document describing a set of exposed methods. Every call is an
 * independent synthesis pass; callers cache the result.
 */
public class OpenApiAssembler {

	private static final Logger logger = LoggerFactory.getLogger(OpenApiAssembler.class);

	public static final String SUCCESS_DESCRIPTION = "Success";

	public static final String BAD_REQUEST_DESCRIPTION = "Payload can not be unmarshalled to arguments or number of arguments not enough, returns error message (plain text)";

	public static final String INTERNAL_ERROR_DESCRIPTION = "Method returned an error or factory returned error, returns error message (plain text)";

	private static final OpenApi.Schema PLAIN_TEXT = OpenApi.Schema.builder().type("string").build();

	private final SchemaOptions options;

	public OpenApiAssembler() {
		this(SchemaOptions.defaults());
	}

	public OpenApiAssembler(SchemaOptions options) {
		Assert.notNull(options, "options must not be null");
		this.options = options;
	}

	public OpenApi.Document assemble(RpcHandler handler) {
		Assert.notNull(handler, "handler must not be null");
		return assemble(handler.methods());
	}

	/**
	 * Describe the given methods.
	 * @param methods descriptors keyed by method name
	 * @return the document
	 */
	public OpenApi.Document assemble(Map<String, MethodDescriptor> methods) {
		Assert.notNull(methods, "methods must not be null");
		TypeWalker walker = new TypeWalker(this.options);

		OpenApi.Response badRequest = plainTextResponse(BAD_REQUEST_DESCRIPTION);
		OpenApi.Response internalError = plainTextResponse(INTERNAL_ERROR_DESCRIPTION);

		Map<String, OpenApi.PathItem> paths = new TreeMap<>();
		for (MethodDescriptor descriptor : routed(methods)) {
			Map<String, OpenApi.Response> responses = new LinkedHashMap<>();
			responses.put("200", new OpenApi.Response(SUCCESS_DESCRIPTION,
					Map.of(OpenApi.APPLICATION_JSON, new OpenApi.MediaType(resultSchema(walker, descriptor)))));
			responses.put("400", badRequest);
			responses.put("500", internalError);

			OpenApi.Operation operation = new OpenApi.Operation(descriptor.name(), requestBody(walker, descriptor),
					responses);
			paths.put(path(descriptor), new OpenApi.PathItem(operation));
		}

		Map<String, OpenApi.Schema> schemas = new TreeMap<>();
		walker.registry().components().forEach((name, node) -> schemas.put(name, componentSchema(node)));

		List<OpenApi.Server> servers = new ArrayList<>();
		for (String url : this.options.servers()) {
			servers.add(new OpenApi.Server(url));
		}
		logger.debug("Assembled {} paths and {} components", paths.size(), schemas.size());
		return new OpenApi.Document(OpenApi.VERSION, new OpenApi.Info(this.options.title(), this.options.version()),
				servers, paths, new OpenApi.Components(schemas));
	}

	private static Collection<MethodDescriptor> routed(Map<String, MethodDescriptor> methods) {
		if (methods.isEmpty()) {
			return List.of();
		}
		CallConvention convention = methods.values().iterator().next().convention();
		return DefaultRpcHandler.routes(methods, convention).values();
	}

	/**
	 * The path a method is served under.
	 * @param descriptor the method
	 * @return {@code /} followed by the routed name
	 */
	public static String path(MethodDescriptor descriptor) {
		return "/" + (descriptor.convention() == CallConvention.POSITIONAL ? Utils.routingKey(descriptor.name())
				: descriptor.name());
	}

	private OpenApi.RequestBody requestBody(TypeWalker walker, MethodDescriptor descriptor) {
		OpenApi.Schema schema;
		if (descriptor.convention() == CallConvention.SINGLE_PAYLOAD) {
			if (descriptor.arity() == 0) {
				return null;
			}
			schema = toSchema(walker.walk(descriptor.argumentTypes().get(0)));
		}
		else {
			List<OpenApi.Schema> prefixItems = new ArrayList<>();
			for (Type type : descriptor.argumentTypes()) {
				prefixItems.add(toSchema(walker.walk(type)));
			}
			schema = OpenApi.Schema.builder()
				.type("array")
				.prefixItems(prefixItems)
				.minItems(descriptor.arity())
				.maxItems(descriptor.arity())
				.items(OpenApi.Schema.ANY)
				.build();
		}
		return new OpenApi.RequestBody(descriptor.arity() > 0,
				Map.of(OpenApi.APPLICATION_JSON, new OpenApi.MediaType(schema)));
	}

	private OpenApi.Schema resultSchema(TypeWalker walker, MethodDescriptor descriptor) {
		if (!descriptor.producesValue()) {
			return OpenApi.Schema.ANY;
		}
		return toSchema(walker.walk(descriptor.resultType()));
	}

	private static OpenApi.Response plainTextResponse(String description) {
		return new OpenApi.Response(description, Map.of(OpenApi.TEXT_PLAIN, new OpenApi.MediaType(PLAIN_TEXT)));
	}

	static OpenApi.Schema componentSchema(NamedSchemaNode node) {
		if (node instanceof EnumNode enumNode) {
			return OpenApi.Schema.builder().type("string").enumValues(enumNode.values()).build();
		}
		return objectSchema((ObjectNode) node);
	}

	static OpenApi.Schema toSchema(SchemaNode node) {
		if (node instanceof PrimitiveNode primitive) {
			return OpenApi.Schema.builder()
				.type(primitive.type())
				.format(primitive.format())
				.minimum(primitive.minimum())
				.maximum(primitive.maximum())
				.description(primitive.description())
				.build();
		}
		if (node instanceof ArrayNode array) {
			return OpenApi.Schema.builder()
				.type("array")
				.items(toSchema(array.items()))
				.minItems(array.minItems())
				.maxItems(array.maxItems())
				.build();
		}
		if (node instanceof MapNode map) {
			return OpenApi.Schema.builder().type("object").additionalProperties(toSchema(map.values())).build();
		}
		if (node instanceof NullableNode nullable) {
			return toSchema(nullable.inner());
		}
		if (node instanceof ReferenceNode reference) {
			return OpenApi.Schema.builder().ref(OpenApi.COMPONENTS_PREFIX + reference.name()).build();
		}
		if (node instanceof ObjectNode object) {
			if (object.isAnonymous()) {
				return objectSchema(object);
			}
			return OpenApi.Schema.builder().ref(OpenApi.COMPONENTS_PREFIX + object.name()).build();
		}
		if (node instanceof EnumNode enumNode) {
			return OpenApi.Schema.builder().ref(OpenApi.COMPONENTS_PREFIX + enumNode.name()).build();
		}
		if (node instanceof AnyNode) {
			return OpenApi.Schema.ANY;
		}
		throw new IllegalArgumentException("Unsupported schema node " + node);
	}

	private static OpenApi.Schema objectSchema(ObjectNode node) {
		Map<String, OpenApi.Schema> properties = new LinkedHashMap<>();
		for (SchemaProperty property : node.properties()) {
			properties.put(property.name(), toSchema(property.node()));
		}
		return OpenApi.Schema.builder()
			.type("object")
			.properties(properties)
			.required(node.requiredNames())
			.build();
	}

}
