/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletionStage;
import java.util.stream.BaseStream;

import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.util.Assert;

/**
 * Indexes the public instance methods of an object (or a type) into
 * {@link MethodDescriptor}s.
 * <p>
 * Accepted result shapes:
 *
 * <pre>
 *     void foo(...)                     // no value
 *     int foo(...)                      // value
 *     Exception foo(...)                // error only, null means success
 *     Mono&lt;Integer&gt; foo(...)            // value or error
 *     CompletionStage&lt;Integer&gt; foo(...) // value or error
 *     Flux&lt;Integer&gt; foo(...)            // NOT ok - streaming result
 *     Mono&lt;Exception&gt; foo(...)          // NOT ok - error as a value
 * </pre>
 *
 * The first parameter may be a {@link RpcTransportContext}; it is wired from the request
 * and is not a data argument. Under {@link CallConvention#SINGLE_PAYLOAD} at most one data
 * argument is accepted. Methods that do not fit are left out of the index without error.
 * Overloaded names are ambiguous on the wire and are left out as well.
 */
public final class MethodScanner {

	private static final Logger logger = LoggerFactory.getLogger(MethodScanner.class);

	private MethodScanner() {
	}

	/**
	 * Index the methods of an instance; every descriptor is bound to it.
	 * @param target the object to expose
	 * @param convention the call convention
	 * @return descriptors by case-preserved method name, sorted by name
	 */
	public static Map<String, MethodDescriptor> scan(Object target, CallConvention convention) {
		Assert.notNull(target, "target must not be null");
		return scan(target.getClass(), target, convention);
	}

	/**
	 * Index the methods of a type. The descriptors are unbound and need a receiver at call
	 * time, typically one created per request by a {@link SessionFactory}.
	 * @param type the type to expose
	 * @param convention the call convention
	 * @return descriptors by case-preserved method name, sorted by name
	 */
	public static Map<String, MethodDescriptor> scan(Class<?> type, CallConvention convention) {
		return scan(type, null, convention);
	}

	private static Map<String, MethodDescriptor> scan(Class<?> type, Object receiver, CallConvention convention) {
		Assert.notNull(type, "type must not be null");
		Assert.notNull(convention, "convention must not be null");

		Method[] methods = type.getMethods();
		Arrays.sort(methods, Comparator.comparing(Method::getName).thenComparing(Method::toGenericString));

		Map<String, List<MethodDescriptor>> candidates = new LinkedHashMap<>();
		for (Method method : methods) {
			MethodDescriptor descriptor = describe(method, receiver, convention);
			if (descriptor != null) {
				candidates.computeIfAbsent(descriptor.name(), k -> new ArrayList<>()).add(descriptor);
			}
		}

		Map<String, MethodDescriptor> index = new TreeMap<>();
		candidates.forEach((name, overloads) -> {
			if (overloads.size() > 1) {
				logger.debug("Skipping {}.{}: {} overloads are ambiguous", type.getName(), name, overloads.size());
				return;
			}
			index.put(name, overloads.get(0));
		});
		return Collections.unmodifiableMap(index);
	}

	private static MethodDescriptor describe(Method method, Object receiver, CallConvention convention) {
		String rejection = rejectionOf(method);
		if (rejection != null) {
			if (method.getDeclaringClass() != Object.class) {
				logger.debug("Skipping {}: {}", method, rejection);
			}
			return null;
		}

		// check output
		Class<?> returnType = method.getReturnType();
		ResultShape shape;
		Type resultType = null;
		if (returnType == void.class || returnType == Void.class) {
			shape = ResultShape.NONE;
		}
		else if (Throwable.class.isAssignableFrom(returnType)) {
			shape = ResultShape.ERROR;
		}
		else if (returnType == Mono.class || CompletionStage.class.isAssignableFrom(returnType)) {
			shape = ResultShape.ASYNC;
			Type element = firstTypeArgument(method.getGenericReturnType());
			Class<?> elementClass = rawClass(element);
			if (Throwable.class.isAssignableFrom(elementClass)) {
				logger.debug("Skipping {}: asynchronous result carries an error as a value", method);
				return null;
			}
			if (elementClass != Void.class) {
				resultType = element;
			}
		}
		else if (Publisher.class.isAssignableFrom(returnType) || BaseStream.class.isAssignableFrom(returnType)) {
			logger.debug("Skipping {}: streaming results are not supported", method);
			return null;
		}
		else {
			shape = ResultShape.VALUE;
			resultType = method.getGenericReturnType();
		}

		boolean producesValue = resultType != null;
		boolean producesError = shape == ResultShape.ERROR || shape == ResultShape.ASYNC
				|| method.getExceptionTypes().length > 0;

		// check input
		Parameter[] parameters = method.getParameters();
		boolean acceptsContext = parameters.length > 0 && parameters[0].getType() == RpcTransportContext.class;
		int offset = acceptsContext ? 1 : 0;

		List<Type> argumentTypes = new ArrayList<>();
		List<String> argumentNames = new ArrayList<>();
		for (int i = offset; i < parameters.length; i++) {
			if (parameters[i].getType() == RpcTransportContext.class) {
				logger.debug("Skipping {}: context is only accepted as the first parameter", method);
				return null;
			}
			argumentTypes.add(parameters[i].getParameterizedType());
			argumentNames.add(parameters[i].getName());
		}

		if (convention == CallConvention.SINGLE_PAYLOAD && argumentTypes.size() > 1) {
			logger.debug("Skipping {}: single payload convention accepts at most one argument", method);
			return null;
		}

		return new MethodDescriptor(method.getName(), method, argumentTypes, argumentNames, acceptsContext,
				producesValue, producesError, resultType, shape, convention, receiver);
	}

	private static String rejectionOf(Method method) {
		int modifiers = method.getModifiers();
		if (!Modifier.isPublic(modifiers)) {
			return "not public";
		}
		if (Modifier.isStatic(modifiers)) {
			return "static";
		}
		if (method.getDeclaringClass() == Object.class || overridesObject(method)) {
			return "declared by java.lang.Object";
		}
		if (method.isBridge() || method.isSynthetic()) {
			return "compiler generated";
		}
		if (method.getTypeParameters().length > 0) {
			return "generic methods cannot decode their arguments";
		}
		if (!Modifier.isPublic(method.getDeclaringClass().getModifiers()) && !method.trySetAccessible()) {
			return "not accessible";
		}
		return null;
	}

	private static boolean overridesObject(Method method) {
		try {
			Object.class.getMethod(method.getName(), method.getParameterTypes());
			return true;
		}
		catch (NoSuchMethodException e) {
			return false;
		}
	}

	private static Type firstTypeArgument(Type type) {
		if (type instanceof ParameterizedType parameterized) {
			Type argument = parameterized.getActualTypeArguments()[0];
			if (argument instanceof WildcardType wildcard) {
				return wildcard.getUpperBounds()[0];
			}
			return argument;
		}
		return Object.class;
	}

	private static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> clazz) {
			return clazz;
		}
		if (type instanceof ParameterizedType parameterized) {
			return (Class<?>) parameterized.getRawType();
		}
		return Object.class;
	}

}
