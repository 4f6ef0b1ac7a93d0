/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import io.reflectrpc.json.RpcJsonMapper;
import io.reflectrpc.util.Assert;

/**
 * Entry point for building {@link RpcHandler}s.
 *
 * <pre>{@code
 * RpcHandler handler = RpcServer.expose(new Calculator())
 *     .convention(CallConvention.POSITIONAL)
 *     .build();
 *
 * RpcHandler sessions = RpcServer.sessions(Calculator.class, ctx -> new Calculator())
 *     .build();
 * }</pre>
 */
public interface RpcServer {

	/**
	 * Expose the public methods of a long-lived object.
	 * @param target the receiver of every call
	 * @return a specification to configure the handler
	 */
	static ExposeSpecification expose(Object target) {
		return new ExposeSpecification(target);
	}

	/**
	 * Expose the public methods of a type whose instances are created per call.
	 * @param type the receiver type scanned for methods
	 * @param factory creates a receiver from the ambient context
	 * @param <T> the receiver type
	 * @return a specification to configure the handler
	 */
	static <T> SessionSpecification<T> sessions(Class<T> type, SessionFactory<? extends T> factory) {
		return new SessionSpecification<>(type, factory);
	}

	class ExposeSpecification {

		private final Object target;

		private CallConvention convention = CallConvention.POSITIONAL;

		private RpcJsonMapper jsonMapper;

		private ExposeSpecification(Object target) {
			Assert.notNull(target, "target must not be null");
			this.target = target;
		}

		public ExposeSpecification convention(CallConvention convention) {
			Assert.notNull(convention, "convention must not be null");
			this.convention = convention;
			return this;
		}

		public ExposeSpecification jsonMapper(RpcJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public RpcHandler build() {
			RpcJsonMapper mapper = this.jsonMapper != null ? this.jsonMapper : RpcJsonMapper.createDefault();
			return new DefaultRpcHandler(MethodScanner.scan(this.target, this.convention), this.convention,
					new MethodDispatcher(mapper));
		}

	}

	class SessionSpecification<T> {

		private final Class<T> type;

		private final SessionFactory<? extends T> factory;

		private RpcJsonMapper jsonMapper;

		private SessionSpecification(Class<T> type, SessionFactory<? extends T> factory) {
			Assert.notNull(type, "type must not be null");
			Assert.notNull(factory, "factory must not be null");
			this.type = type;
			this.factory = factory;
		}

		public SessionSpecification<T> jsonMapper(RpcJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public SessionRpcHandler<T> build() {
			RpcJsonMapper mapper = this.jsonMapper != null ? this.jsonMapper : RpcJsonMapper.createDefault();
			return new SessionRpcHandler<>(this.type, this.factory, new MethodDispatcher(mapper));
		}

	}

}
