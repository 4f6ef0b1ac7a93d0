/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.codegen.typescript;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.jupiter.api.Test;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.schema.PrimitiveNode;
import io.reflectrpc.schema.SchemaOptions;
import io.reflectrpc.schema.TypeWalker;
import io.reflectrpc.server.CallConvention;

import static org.assertj.core.api.Assertions.assertThat;

class TypeScriptGeneratorTests {

	private final TypeScriptGenerator generator = new TypeScriptGenerator();

	@Test
	void describesMethods() {
		TypeScriptApi api = this.generator.generate(Library.class, CallConvention.POSITIONAL);

		assertThat(api.name()).isEqualTo("Library");
		assertThat(api.methods()).extracting(TypeScriptApi.Method::name)
			.containsExactly("borrow", "catalog", "find", "ping", "stats");

		TypeScriptApi.Method borrow = api.findMethod("borrow");
		assertThat(borrow.route()).isEqualTo("borrow");
		assertThat(borrow.parameters()).containsExactly(new TypeScriptApi.Field("book", "Book", false),
				new TypeScriptApi.Field("days", "number", false));
		assertThat(borrow.returnType()).isEqualTo("Loan");
		assertThat(api.findMethod("ping").returnsValue()).isFalse();
	}

	@Test
	void mapsContainerTypes() {
		TypeScriptApi api = this.generator.generate(Library.class, CallConvention.POSITIONAL);

		assertThat(api.findMethod("catalog").returnType()).isEqualTo("Book[]");
		assertThat(api.findMethod("stats").returnType()).isEqualTo("{[key: string]: (number | null)}");
		assertThat(api.findMethod("find").returnType()).isEqualTo("(Book | null)");
	}

	@Test
	void describesComposites() {
		TypeScriptApi api = this.generator.generate(Library.class, CallConvention.POSITIONAL);

		assertThat(api.interfaces()).extracting(TypeScriptApi.Interface::name).containsExactly("Book", "Loan");
		assertThat(api.findInterface("Book").fields()).containsExactlyInAnyOrder(
				new TypeScriptApi.Field("Title", "string", false), new TypeScriptApi.Field("cover", "string", false),
				new TypeScriptApi.Field("subtitle", "(string | null)", true),
				new TypeScriptApi.Field("genre", "Genre", false));
		assertThat(api.findInterface("Loan").fields()).containsExactlyInAnyOrder(
				new TypeScriptApi.Field("book", "Book", false), new TypeScriptApi.Field("due", "string", false),
				new TypeScriptApi.Field("renewedFrom", "Loan", false));
	}

	@Test
	void enumsBecomeAliases() {
		TypeScriptApi api = this.generator.generate(Library.class, CallConvention.POSITIONAL);

		assertThat(api.aliases()).containsExactly(new TypeScriptApi.Alias("Genre", "\"novel\" | \"POETRY\""));
	}

	@Test
	void definitionsDecideTheTypeScriptType() {
		TypeScriptGenerator custom = new TypeScriptGenerator(
				SchemaOptions.builder().define(Loan.class, PrimitiveNode.INT64).build());

		TypeScriptApi api = custom.generate(Library.class, CallConvention.POSITIONAL);

		assertThat(api.findMethod("borrow").returnType()).isEqualTo("number");
		assertThat(api.interfaces()).extracting(TypeScriptApi.Interface::name).containsExactly("Book");
	}

	@Test
	void anonymousObjectsGetAllocatedNames() {
		TypeScriptGenerator.Pass pass = new TypeScriptGenerator.Pass(new TypeWalker(SchemaOptions.defaults()));
		Object first = new Object() {
			public int x;
		};
		Object second = new Object() {
			public String label;
		};

		assertThat(pass.typeOf(first.getClass())).isEqualTo("Anon");
		assertThat(pass.typeOf(second.getClass())).isEqualTo("Anon1");
	}

	@Test
	void caseOnlyNameClashKeepsOneMethodPerRoute() {
		TypeScriptApi api = this.generator.generate(Clash.class, CallConvention.POSITIONAL);

		assertThat(api.methods()).extracting(TypeScriptApi.Method::name).containsExactly("Add");
		assertThat(api.findMethod("Add").route()).isEqualTo("add");
		assertThat(api.findMethod("Add").parameters()).isEmpty();
	}

	@Test
	void singlePayloadRoutesUseExactNames() {
		TypeScriptApi api = this.generator.generate(Library.class, CallConvention.SINGLE_PAYLOAD);

		assertThat(api.findMethod("borrow")).isNull();
		assertThat(api.findMethod("catalog").route()).isEqualTo("catalog");
		assertThat(api.convention()).isEqualTo(CallConvention.SINGLE_PAYLOAD);
	}

	@Test
	void rendersClientModule() {
		String source = TypeScriptRenderer.render(this.generator.generate(Library.class, CallConvention.POSITIONAL));

		assertThat(source).startsWith("export default class Library {\n")
			.contains("constructor(private readonly baseURL: string = \".\") {}")
			.contains("    async borrow(book: Book, days: number): Promise<Loan> {\n"
					+ "        return (await this.invoke(\"borrow\", [book, days])) as Loan\n" + "    }\n")
			.contains("    async ping(): Promise<void> {\n" + "        await this.invoke(\"ping\", [])\n" + "    }\n")
			.contains("private async invoke(method: string, payload: any): Promise<any> {")
			.contains("if (res.status === 204) return undefined;")
			.contains("export interface Book {\n")
			.contains("    subtitle?: (string | null)\n")
			.contains("    Title: string\n")
			.contains("export type Genre = \"novel\" | \"POETRY\"\n");
	}

	@Test
	void rendersSinglePayloadCalls() {
		String source = TypeScriptRenderer
			.render(this.generator.generate(Library.class, CallConvention.SINGLE_PAYLOAD));

		assertThat(source).contains("return (await this.invoke(\"catalog\", undefined)) as Book[]")
			.contains("await this.invoke(\"ping\", undefined)");
	}

	@Test
	void quotesPropertiesThatAreNotIdentifiers() {
		TypeScriptApi api = new TypeScriptApi("Odd", CallConvention.POSITIONAL, List.of(),
				List.of(new TypeScriptApi.Interface("Odd", List.of(new TypeScriptApi.Field("x-y", "number", false)))),
				List.of());

		assertThat(TypeScriptRenderer.render(api)).contains("    \"x-y\": number\n");
	}

	public enum Genre {

		@JsonProperty("novel")
		NOVEL,

		POETRY

	}

	public record Book(@JsonProperty("Title") String title, byte[] cover,
			@JsonInclude(JsonInclude.Include.NON_ABSENT) Optional<String> subtitle, Genre genre) {
	}

	public record Loan(Book book, Instant due, Loan renewedFrom) {
	}

	public static class Library {

		public Loan borrow(RpcTransportContext context, Book book, int days) {
			return null;
		}

		public List<Book> catalog() {
			return List.of();
		}

		public Map<String, Integer> stats() {
			return Map.of();
		}

		public Optional<Book> find(String title) {
			return Optional.empty();
		}

		public void ping() {
		}

	}

	public static class Clash {

		public String Add() {
			return "upper";
		}

		public int add(int value) {
			return value;
		}

	}

}
