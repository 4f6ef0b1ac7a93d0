/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.List;

import io.reflectrpc.util.Assert;

/**
 * Validated, callable description of one exposed method. Built once by the
 * {@link MethodScanner} and shared read-only by concurrent dispatches.
 *
 * @param name the method name, case preserved
 * @param method the reflective method
 * @param argumentTypes the data argument types, in declaration order, without the context
 * parameter
 * @param argumentNames the data argument names, parallel to {@code argumentTypes}
 * @param acceptsContext whether the first parameter is the ambient context
 * @param producesValue whether a result value is encoded
 * @param producesError whether the signature declares a failure channel
 * @param resultType the value type, {@code null} when no value is produced
 * @param resultShape how the result is handed back
 * @param convention the call convention the method was scanned for
 * @param receiver the bound instance, {@code null} for descriptors scanned from a type
 */
public record MethodDescriptor(String name, Method method, List<Type> argumentTypes, List<String> argumentNames,
		boolean acceptsContext, boolean producesValue, boolean producesError, Type resultType,
		ResultShape resultShape, CallConvention convention, Object receiver) {

	public MethodDescriptor {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(method, "method must not be null");
		Assert.notNull(resultShape, "resultShape must not be null");
		Assert.notNull(convention, "convention must not be null");
		Assert.notNull(argumentTypes, "argumentTypes must not be null");
		Assert.notNull(argumentNames, "argumentNames must not be null");
		Assert.isTrue(argumentTypes.size() == argumentNames.size(), "argument names and types must match");
		argumentTypes = List.copyOf(argumentTypes);
		argumentNames = List.copyOf(argumentNames);
	}

	/**
	 * Number of data arguments.
	 * @return the arity
	 */
	public int arity() {
		return this.argumentTypes.size();
	}

	/**
	 * Whether the descriptor carries its own receiver.
	 * @return {@code true} when bound
	 */
	public boolean isBound() {
		return this.receiver != null;
	}

	/**
	 * Copy of this descriptor bound to another receiver.
	 * @param receiver the instance to invoke the method on
	 * @return the bound descriptor
	 */
	public MethodDescriptor bindTo(Object receiver) {
		Assert.notNull(receiver, "receiver must not be null");
		Assert.isTrue(this.method.getDeclaringClass().isInstance(receiver),
				"receiver is not an instance of " + this.method.getDeclaringClass().getName());
		return new MethodDescriptor(this.name, this.method, this.argumentTypes, this.argumentNames,
				this.acceptsContext, this.producesValue, this.producesError, this.resultType, this.resultShape,
				this.convention, receiver);
	}

}
