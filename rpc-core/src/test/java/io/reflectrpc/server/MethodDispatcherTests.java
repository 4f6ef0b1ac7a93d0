/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.json.RpcJsonMapper;

import static org.assertj.core.api.Assertions.assertThat;

class MethodDispatcherTests {

	private final Calculator calculator = new Calculator();

	private final Map<String, MethodDescriptor> positional = MethodScanner.scan(this.calculator,
			CallConvention.POSITIONAL);

	private final MethodDispatcher dispatcher = new MethodDispatcher(RpcJsonMapper.createDefault());

	@Test
	void addsPositionalArguments() {
		StepVerifier.create(call("add", "[2,3]")).assertNext(response -> {
			assertThat(response.isSuccess()).isTrue();
			assertThat(response.bodyAsString()).isEqualTo("5");
		}).verifyComplete();
	}

	@Test
	void ignoresExtraArguments() {
		StepVerifier.create(call("add", "[2,3,4,\"x\"]"))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("5"))
			.verifyComplete();
	}

	@Test
	void rejectsMissingArguments() {
		StepVerifier.create(call("add", "[2]")).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST);
			assertThat(response.bodyAsString()).isEqualTo("not enough arguments, expected 2");
		}).verifyComplete();
		assertThat(this.calculator.calls()).isZero();
	}

	@Test
	void emptyBodyIsAnEmptyArgumentList() {
		StepVerifier.create(call("add", ""))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("not enough arguments, expected 2"))
			.verifyComplete();
		StepVerifier.create(this.dispatcher.dispatch(this.positional.get("reset"), null, RpcTransportContext.EMPTY))
			.assertNext(response -> {
				assertThat(response.isSuccess()).isTrue();
				assertThat(response.hasBody()).isFalse();
			})
			.verifyComplete();
		StepVerifier.create(call("reset", "null"))
			.assertNext(response -> assertThat(response).isEqualTo(RpcResponse.noContent()))
			.verifyComplete();
	}

	@Test
	void rejectsMistypedArgumentsWithoutInvoking() {
		StepVerifier.create(call("add", "[\"2\",3]"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		StepVerifier.create(call("add", "[2.5,3]"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		assertThat(this.calculator.calls()).isZero();
	}

	@Test
	void rejectsNonArrayPayload() {
		StepVerifier.create(call("add", "{\"a\":2,\"b\":3}"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		StepVerifier.create(call("add", "[2,"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
	}

	@Test
	void methodWithoutArgumentsStillRequiresArrayPayload() {
		StepVerifier.create(call("add", "[1,1]")).expectNextCount(1).verifyComplete();

		StepVerifier.create(call("reset", "{garbage"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		StepVerifier.create(call("reset", "{\"a\":1}"))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		assertThat(this.calculator.calls()).isEqualTo(1);

		StepVerifier.create(call("reset", "[\"ignored\"]"))
			.assertNext(response -> assertThat(response).isEqualTo(RpcResponse.noContent()))
			.verifyComplete();
		assertThat(this.calculator.calls()).isZero();
	}

	@Test
	void returnedErrorBecomesInternalError() {
		StepVerifier.create(call("check", "[-1]")).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.INTERNAL_ERROR);
			assertThat(response.bodyAsString()).isEqualTo("negative value");
		}).verifyComplete();
	}

	@Test
	void nullErrorIsSuccessWithoutBody() {
		StepVerifier.create(call("check", "[1]")).assertNext(response -> {
			assertThat(response.isSuccess()).isTrue();
			assertThat(response.hasBody()).isFalse();
		}).verifyComplete();
	}

	@Test
	void thrownExceptionBecomesInternalError() {
		StepVerifier.create(call("fail", "[]")).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.INTERNAL_ERROR);
			assertThat(response.bodyAsString()).isEqualTo("disk on fire");
		}).verifyComplete();
	}

	@Test
	void thrownRpcErrorKeepsItsKind() {
		StepVerifier.create(call("denied", "[]")).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST);
			assertThat(response.bodyAsString()).isEqualTo("not allowed");
		}).verifyComplete();
	}

	@Test
	void passesContextThrough() {
		RpcTransportContext context = RpcTransportContext.create();
		context.put("prefix", "Dr.");

		StepVerifier
			.create(this.dispatcher.dispatch(this.positional.get("greet"), bytes("[\"Ann\"]"), context))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("\"Dr. Ann\""))
			.verifyComplete();
	}

	@Test
	void awaitsAsynchronousResults() {
		StepVerifier.create(call("addLater", "[2,3]"))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("5"))
			.verifyComplete();
		StepVerifier.create(call("upper", "[\"abc\"]"))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("\"ABC\""))
			.verifyComplete();
		StepVerifier.create(call("touch", "[]"))
			.assertNext(response -> assertThat(response).isEqualTo(RpcResponse.noContent()))
			.verifyComplete();
	}

	@Test
	void asynchronousFailureBecomesInternalError() {
		StepVerifier.create(call("failLater", "[]")).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.INTERNAL_ERROR);
			assertThat(response.bodyAsString()).isEqualTo("later");
		}).verifyComplete();
	}

	@Test
	void encodesEmptyOptionalAsNull() {
		StepVerifier.create(call("find", "[\"pi\"]"))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("\"3.14\""))
			.verifyComplete();
		StepVerifier.create(call("find", "[\"e\"]"))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("null"))
			.verifyComplete();
	}

	@Test
	void decodesSinglePayload() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(new Greeter(), CallConvention.SINGLE_PAYLOAD);

		StepVerifier
			.create(this.dispatcher.dispatch(index.get("greet"), bytes("{\"Name\":\"Ann\",\"Prefix\":\"Dr.\"}"),
					RpcTransportContext.EMPTY))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("\"Dr. Ann\""))
			.verifyComplete();
	}

	@Test
	void rejectsMistypedSinglePayload() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(new Greeter(), CallConvention.SINGLE_PAYLOAD);

		StepVerifier
			.create(this.dispatcher.dispatch(index.get("greet"), bytes("{\"Name\":123}"), RpcTransportContext.EMPTY))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST))
			.verifyComplete();
		StepVerifier.create(this.dispatcher.dispatch(index.get("greet"), null, RpcTransportContext.EMPTY))
			.assertNext(response -> {
				assertThat(response.error()).isEqualTo(RpcErrorKind.BAD_REQUEST);
				assertThat(response.bodyAsString()).isEqualTo("payload required");
			})
			.verifyComplete();
	}

	@Test
	void ignoresPayloadOfMethodWithoutArgument() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(new Greeter(), CallConvention.SINGLE_PAYLOAD);

		StepVerifier
			.create(this.dispatcher.dispatch(index.get("hello"), bytes("not even json"), RpcTransportContext.EMPTY))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("\"hello\""))
			.verifyComplete();
	}

	@Test
	void sessionFactoryRunsBeforeInvocation() {
		MethodDescriptor add = MethodScanner.scan(Calculator.class, CallConvention.POSITIONAL).get("add");
		AtomicInteger sessions = new AtomicInteger();

		StepVerifier.create(this.dispatcher.dispatchSession(add, context -> {
			sessions.incrementAndGet();
			return this.calculator;
		}, bytes("[1,1]"), RpcTransportContext.EMPTY))
			.assertNext(response -> assertThat(response.bodyAsString()).isEqualTo("2"))
			.verifyComplete();
		assertThat(sessions).hasValue(1);
	}

	@Test
	void sessionFactoryFailureSkipsInvocation() {
		MethodDescriptor add = MethodScanner.scan(Calculator.class, CallConvention.POSITIONAL).get("add");

		StepVerifier.create(this.dispatcher.dispatchSession(add, context -> {
			throw new IllegalStateException("no session");
		}, bytes("[1,1]"), RpcTransportContext.EMPTY)).assertNext(response -> {
			assertThat(response.error()).isEqualTo(RpcErrorKind.INTERNAL_ERROR);
			assertThat(response.bodyAsString()).isEqualTo("no session");
		}).verifyComplete();

		StepVerifier
			.create(this.dispatcher.dispatchSession(add, context -> null, bytes("[1,1]"), RpcTransportContext.EMPTY))
			.assertNext(response -> assertThat(response.error()).isEqualTo(RpcErrorKind.INTERNAL_ERROR))
			.verifyComplete();
		assertThat(this.calculator.calls()).isZero();
	}

	private Mono<RpcResponse> call(String method, String body) {
		return this.dispatcher.dispatch(this.positional.get(method), bytes(body), RpcTransportContext.EMPTY);
	}

	private static byte[] bytes(String value) {
		return value.getBytes(StandardCharsets.UTF_8);
	}

	public record Greeting(@JsonProperty("Name") String name, @JsonProperty("Prefix") String prefix) {
	}

	public static class Greeter {

		public String greet(Greeting greeting) {
			return greeting.prefix() + " " + greeting.name();
		}

		public String hello() {
			return "hello";
		}

	}

}
