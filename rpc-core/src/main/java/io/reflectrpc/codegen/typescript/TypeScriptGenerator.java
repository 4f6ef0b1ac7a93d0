/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.codegen.typescript;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

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
import io.reflectrpc.server.MethodScanner;
import io.reflectrpc.util.Assert;
import io.reflectrpc.util.Utils;

/**
 * Derives a {@link TypeScriptApi} from the methods a type exposes. Types are walked with
 * the same {@link TypeWalker} the OpenAPI assembler uses; classes defined through
 * {@link SchemaOptions.Builder#define} map to the TypeScript type of their definition.
 */
public class TypeScriptGenerator {

	private static final Logger logger = LoggerFactory.getLogger(TypeScriptGenerator.class);

	static final String ANONYMOUS_NAME = "Anon";

	private final SchemaOptions options;

	public TypeScriptGenerator() {
		this(SchemaOptions.defaults());
	}

	public TypeScriptGenerator(SchemaOptions options) {
		Assert.notNull(options, "options must not be null");
		this.options = options;
	}

	public TypeScriptApi generate(Class<?> api, CallConvention convention) {
		Assert.notNull(api, "api must not be null");
		return generate(api.getSimpleName(), MethodScanner.scan(api, convention), convention);
	}

	/**
	 * Describe already scanned methods.
	 * @param name the client class name
	 * @param methods descriptors keyed by method name
	 * @param convention the convention the descriptors were scanned for
	 * @return the TypeScript view
	 */
	public TypeScriptApi generate(String name, Map<String, MethodDescriptor> methods, CallConvention convention) {
		Assert.notNull(methods, "methods must not be null");
		Assert.notNull(convention, "convention must not be null");
		Pass pass = new Pass(new TypeWalker(this.options));
		List<TypeScriptApi.Method> result = new ArrayList<>();
		for (MethodDescriptor descriptor : DefaultRpcHandler.routes(methods, convention).values()) {
			result.add(pass.method(descriptor));
		}
		pass.collectComponents();
		logger.debug("Generated {} methods, {} interfaces and {} aliases for {}", result.size(),
				pass.interfaces.size(), pass.aliases.size(), name);
		return new TypeScriptApi(name, convention, result, sorted(pass.interfaces, TypeScriptApi.Interface::name),
				sorted(pass.aliases, TypeScriptApi.Alias::name));
	}

	private static <T> List<T> sorted(List<T> items, Function<T, String> name) {
		return items.stream().sorted(Comparator.comparing(name)).collect(Collectors.toList());
	}

	/**
	 * State of one generation.
	 */
	static final class Pass {

		private final TypeWalker walker;

		private final Map<ObjectNode, String> anonymous = new IdentityHashMap<>();

		private final List<TypeScriptApi.Interface> interfaces = new ArrayList<>();

		private final List<TypeScriptApi.Alias> aliases = new ArrayList<>();

		Pass(TypeWalker walker) {
			this.walker = walker;
		}

		TypeScriptApi.Method method(MethodDescriptor descriptor) {
			List<TypeScriptApi.Field> parameters = new ArrayList<>();
			for (int i = 0; i < descriptor.arity(); i++) {
				Type type = descriptor.argumentTypes().get(i);
				parameters.add(new TypeScriptApi.Field(descriptor.argumentNames().get(i), typeOf(type), false));
			}
			String route = descriptor.convention() == CallConvention.POSITIONAL ? Utils.routingKey(descriptor.name())
					: descriptor.name();
			String returnType = descriptor.producesValue() ? typeOf(descriptor.resultType()) : null;
			return new TypeScriptApi.Method(descriptor.name(), route, parameters, returnType);
		}

		String typeOf(Type type) {
			return render(this.walker.walk(type));
		}

		void collectComponents() {
			for (NamedSchemaNode node : this.walker.registry().components().values()) {
				if (node instanceof EnumNode enumNode) {
					this.aliases.add(new TypeScriptApi.Alias(enumNode.name(), union(enumNode.values())));
				}
				else {
					this.interfaces.add(new TypeScriptApi.Interface(node.name(), fields((ObjectNode) node)));
				}
			}
		}

		String render(SchemaNode node) {
			if (node instanceof PrimitiveNode primitive) {
				if (primitive.isNumeric()) {
					return "number";
				}
				return "boolean".equals(primitive.type()) ? "boolean" : "string";
			}
			if (node instanceof ArrayNode array) {
				return render(array.items()) + "[]";
			}
			if (node instanceof MapNode map) {
				return "{[key: string]: " + render(map.values()) + "}";
			}
			if (node instanceof NullableNode nullable) {
				return "(" + render(nullable.inner()) + " | null)";
			}
			if (node instanceof ReferenceNode reference) {
				return reference.name();
			}
			if (node instanceof ObjectNode object) {
				return object.isAnonymous() ? anonymousName(object) : object.name();
			}
			if (node instanceof EnumNode enumNode) {
				return enumNode.name();
			}
			if (node instanceof AnyNode) {
				return "any";
			}
			throw new IllegalArgumentException("Unsupported schema node " + node);
		}

		private String anonymousName(ObjectNode node) {
			String name = this.anonymous.get(node);
			if (name == null) {
				name = this.walker.registry().allocateName(ANONYMOUS_NAME);
				this.anonymous.put(node, name);
				this.interfaces.add(new TypeScriptApi.Interface(name, fields(node)));
			}
			return name;
		}

		private List<TypeScriptApi.Field> fields(ObjectNode node) {
			List<TypeScriptApi.Field> fields = new ArrayList<>();
			for (SchemaProperty property : node.properties()) {
				fields.add(new TypeScriptApi.Field(property.name(), render(property.node()), property.optional()));
			}
			return fields;
		}

		private static String union(List<String> values) {
			if (values.isEmpty()) {
				return "never";
			}
			return values.stream().map(TypeScriptRenderer::quote).collect(Collectors.joining(" | "));
		}

	}

}
