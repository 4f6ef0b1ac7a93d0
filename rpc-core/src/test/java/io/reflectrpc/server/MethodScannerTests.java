/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.reflectrpc.common.RpcTransportContext;

import static org.assertj.core.api.Assertions.assertThat;

class MethodScannerTests {

	private final Calculator calculator = new Calculator();

	@Test
	void indexesAcceptedSignatures() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL);

		assertThat(index).containsOnlyKeys("add", "addLater", "calls", "check", "denied", "fail", "failLater", "find",
				"greet", "reset", "touch", "upper");
	}

	@Test
	void skipsStaticGenericOverloadedAndObjectMethods() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL);

		assertThat(index).doesNotContainKeys("twice", "echo", "over", "toString", "hashCode", "equals", "getClass");
	}

	@Test
	void skipsOverridesOfObjectMethods() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(new Point(1, 2), CallConvention.POSITIONAL);

		assertThat(index).containsOnlyKeys("sum", "x", "y");
		assertThat(MethodScanner.scan(new Labelled(), CallConvention.POSITIONAL)).containsOnlyKeys("equals");
	}

	@Test
	void skipsStreamingResultsAndErrorsCarriedAsValues() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL);

		assertThat(index).doesNotContainKeys("count", "lines", "broken");
	}

	@Test
	void skipsContextOutsideFirstPosition() {
		assertThat(MethodScanner.scan(this.calculator, CallConvention.POSITIONAL)).doesNotContainKey("misplaced");
	}

	@Test
	void describesValueMethod() {
		MethodDescriptor add = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL).get("add");

		assertThat(add.argumentTypes()).containsExactly(int.class, int.class);
		assertThat(add.argumentNames()).containsExactly("a", "b");
		assertThat(add.acceptsContext()).isFalse();
		assertThat(add.producesValue()).isTrue();
		assertThat(add.producesError()).isFalse();
		assertThat(add.resultType()).isEqualTo(int.class);
		assertThat(add.resultShape()).isEqualTo(ResultShape.VALUE);
		assertThat(add.receiver()).isSameAs(this.calculator);
	}

	@Test
	void errorOnlyMethodProducesNoValue() {
		MethodDescriptor check = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL).get("check");

		assertThat(check.producesValue()).isFalse();
		assertThat(check.producesError()).isTrue();
		assertThat(check.resultShape()).isEqualTo(ResultShape.ERROR);
		assertThat(check.resultType()).isNull();
	}

	@Test
	void declaredExceptionsMarkAnErrorChannel() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL);

		assertThat(index.get("fail").producesError()).isTrue();
		assertThat(index.get("fail").producesValue()).isTrue();
		assertThat(index.get("reset").producesError()).isFalse();
		assertThat(index.get("reset").producesValue()).isFalse();
		assertThat(index.get("reset").resultShape()).isEqualTo(ResultShape.NONE);
	}

	@Test
	void contextIsExcludedFromArguments() {
		MethodDescriptor greet = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL).get("greet");

		assertThat(greet.acceptsContext()).isTrue();
		assertThat(greet.arity()).isEqualTo(1);
		assertThat(greet.argumentTypes()).containsExactly(String.class);
		assertThat(greet.method().getParameterTypes()[0]).isEqualTo(RpcTransportContext.class);
	}

	@Test
	void unwrapsAsynchronousResults() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.POSITIONAL);

		assertThat(index.get("addLater").resultShape()).isEqualTo(ResultShape.ASYNC);
		assertThat(index.get("addLater").resultType()).isEqualTo(Integer.class);
		assertThat(index.get("upper").resultType()).isEqualTo(String.class);
		assertThat(index.get("touch").producesValue()).isFalse();
		assertThat(index.get("touch").producesError()).isTrue();
	}

	@Test
	void singlePayloadAcceptsAtMostOneArgument() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(this.calculator, CallConvention.SINGLE_PAYLOAD);

		assertThat(index).doesNotContainKeys("add", "addLater");
		assertThat(index).containsKeys("greet", "check", "upper", "reset");
		assertThat(index.get("greet").convention()).isEqualTo(CallConvention.SINGLE_PAYLOAD);
	}

	@Test
	void rescanningIsIdempotent() {
		assertThat(MethodScanner.scan(this.calculator, CallConvention.POSITIONAL))
			.isEqualTo(MethodScanner.scan(this.calculator, CallConvention.POSITIONAL));
	}

	@Test
	void typeScanProducesUnboundDescriptors() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(Calculator.class, CallConvention.POSITIONAL);

		assertThat(index.get("add").isBound()).isFalse();
		assertThat(index.get("add").bindTo(this.calculator).receiver()).isSameAs(this.calculator);
	}

	@Test
	void scansNonPublicClasses() {
		Map<String, MethodDescriptor> index = MethodScanner.scan(new Hidden(), CallConvention.POSITIONAL);

		assertThat(index).containsOnlyKeys("names");
		assertThat(index.get("names").resultType().getTypeName()).isEqualTo("java.util.List<java.lang.String>");
	}

	public record Point(int x, int y) {

		public int sum() {
			return this.x + this.y;
		}

	}

	public static class Labelled {

		@Override
		public String toString() {
			return "labelled";
		}

		// same name as Object#equals, different parameters
		public boolean equals(String other) {
			return "labelled".equals(other);
		}

	}

	private static class Hidden {

		public List<String> names() {
			return List.of("a", "b");
		}

	}

}
