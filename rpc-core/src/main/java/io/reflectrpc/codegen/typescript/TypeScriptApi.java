/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.codegen.typescript;

import java.util.List;

import io.reflectrpc.server.CallConvention;
import io.reflectrpc.util.Assert;

/**
 * TypeScript view of an exposed API, ready to be rendered.
 *
 * @param name the client class name
 * @param convention how calls are encoded
 * @param methods one entry per exposed method, ordered by name
 * @param interfaces one entry per object type, ordered by name
 * @param aliases one entry per enumeration, ordered by name
 */
public record TypeScriptApi(String name, CallConvention convention, List<Method> methods, List<Interface> interfaces,
		List<Alias> aliases) {

	public TypeScriptApi {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(convention, "convention must not be null");
		methods = List.copyOf(methods);
		interfaces = List.copyOf(interfaces);
		aliases = List.copyOf(aliases);
	}

	/**
	 * @param name the method name
	 * @param route the last path segment the method is served under
	 * @param parameters the data parameters
	 * @param returnType the TypeScript result type, {@code null} when no value is returned
	 */
	public record Method(String name, String route, List<Field> parameters, String returnType) {

		public Method {
			parameters = List.copyOf(parameters);
		}

		public boolean returnsValue() {
			return this.returnType != null;
		}

	}

	/**
	 * @param name the field or parameter name
	 * @param type the TypeScript type
	 * @param optional whether the field may be absent
	 */
	public record Field(String name, String type, boolean optional) {
	}

	public record Interface(String name, List<Field> fields) {

		public Interface {
			fields = List.copyOf(fields);
		}

	}

	public record Alias(String name, String type) {
	}

	public Interface findInterface(String name) {
		return this.interfaces.stream().filter(i -> i.name().equals(name)).findFirst().orElse(null);
	}

	public Method findMethod(String name) {
		return this.methods.stream().filter(m -> m.name().equals(name)).findFirst().orElse(null);
	}

}
