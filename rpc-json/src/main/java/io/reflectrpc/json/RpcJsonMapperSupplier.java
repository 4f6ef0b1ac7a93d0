/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link RpcJsonMapper}. Implementations are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface RpcJsonMapperSupplier extends Supplier<RpcJsonMapper> {

}
