/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.codegen.typescript;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.reflectrpc.server.CallConvention;
import io.reflectrpc.util.Assert;

/**
 * Renders a {@link TypeScriptApi} as a single TypeScript module: a default-exported client
 * class calling the endpoints with {@code fetch}, followed by the interfaces and type
 * aliases it uses.
 */
public final class TypeScriptRenderer {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

	private static final String INDENT = "    ";

	private TypeScriptRenderer() {
	}

	public static String render(TypeScriptApi api) {
		Assert.notNull(api, "api must not be null");
		StringBuilder out = new StringBuilder();
		out.append("export default class ").append(api.name()).append(" {\n\n");
		out.append(INDENT).append("constructor(private readonly baseURL: string = \".\") {}\n");
		for (TypeScriptApi.Method method : api.methods()) {
			out.append('\n');
			renderMethod(out, method, api.convention());
		}
		out.append('\n');
		renderInvoke(out);
		out.append("}\n");

		for (TypeScriptApi.Interface type : api.interfaces()) {
			out.append("\nexport interface ").append(type.name()).append(" {\n");
			for (TypeScriptApi.Field field : type.fields()) {
				out.append(INDENT)
					.append(propertyName(field.name()))
					.append(field.optional() ? "?: " : ": ")
					.append(field.type())
					.append('\n');
			}
			out.append("}\n");
		}
		for (TypeScriptApi.Alias alias : api.aliases()) {
			out.append("\nexport type ").append(alias.name()).append(" = ").append(alias.type()).append('\n');
		}
		return out.toString();
	}

	private static void renderMethod(StringBuilder out, TypeScriptApi.Method method, CallConvention convention) {
		String parameters = method.parameters()
			.stream()
			.map(p -> p.name() + ": " + p.type())
			.collect(Collectors.joining(", "));
		String returnType = method.returnsValue() ? method.returnType() : "void";
		String call = "this.invoke(" + quote(method.route()) + ", " + payload(method.parameters(), convention) + ")";

		out.append(INDENT)
			.append("async ")
			.append(method.name())
			.append('(')
			.append(parameters)
			.append("): Promise<")
			.append(returnType)
			.append("> {\n");
		if (method.returnsValue()) {
			out.append(INDENT).append(INDENT).append("return (await ").append(call).append(") as ").append(returnType);
		}
		else {
			out.append(INDENT).append(INDENT).append("await ").append(call);
		}
		out.append('\n').append(INDENT).append("}\n");
	}

	private static String payload(List<TypeScriptApi.Field> parameters, CallConvention convention) {
		if (convention == CallConvention.SINGLE_PAYLOAD) {
			return parameters.isEmpty() ? "undefined" : parameters.get(0).name();
		}
		return "[" + parameters.stream().map(TypeScriptApi.Field::name).collect(Collectors.joining(", ")) + "]";
	}

	private static void renderInvoke(StringBuilder out) {
		String i2 = INDENT + INDENT;
		out.append(INDENT).append("private async invoke(method: string, payload: any): Promise<any> {\n");
		out.append(i2).append("const res = await fetch(this.baseURL + \"/\" + encodeURIComponent(method), {\n");
		out.append(i2).append(INDENT).append("method: \"POST\",\n");
		out.append(i2).append(INDENT).append("body: payload === undefined ? undefined : JSON.stringify(payload),\n");
		out.append(i2).append(INDENT).append("headers: {\n");
		out.append(i2).append(INDENT).append(INDENT).append("\"Content-Type\": \"application/json\"\n");
		out.append(i2).append(INDENT).append("}\n");
		out.append(i2).append("})\n");
		out.append(i2).append("if (!res.ok) throw new Error(await res.text());\n");
		out.append(i2).append("if (res.status === 204) return undefined;\n");
		out.append(i2).append("return await res.json()\n");
		out.append(INDENT).append("}\n");
	}

	private static String propertyName(String name) {
		return IDENTIFIER.matcher(name).matches() ? name : quote(name);
	}

	static String quote(String value) {
		return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

}
