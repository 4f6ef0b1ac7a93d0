/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import io.reflectrpc.util.Assert;

/**
 * Named components collected during one synthesis pass, keyed by {@link TypeIdentity}.
 * <p>
 * The first type to claim a base name keeps it; later distinct types get an incrementing
 * discriminator ({@code Item}, {@code Item1}, {@code Item2}), skipping names that are
 * already taken. Not thread-safe: create one per pass.
 */
public class ComponentRegistry {

	private final Map<TypeIdentity, NamedSchemaNode> byIdentity = new LinkedHashMap<>();

	private final Map<String, Integer> nameUsage = new HashMap<>();

	private final Set<String> allocated = new HashSet<>();

	public NamedSchemaNode lookup(TypeIdentity identity) {
		return this.byIdentity.get(identity);
	}

	/**
	 * Reserve a collision free name derived from a base name.
	 * @param base the preferred name
	 * @return the reserved name
	 */
	public String allocateName(String base) {
		Assert.hasText(base, "base name must not be empty");
		int usage = this.nameUsage.getOrDefault(base, 0);
		String candidate = usage == 0 ? base : base + usage;
		while (this.allocated.contains(candidate)) {
			usage++;
			candidate = base + usage;
		}
		this.nameUsage.put(base, usage + 1);
		this.allocated.add(candidate);
		return candidate;
	}

	/**
	 * Register a named node under its identity. The name must have been allocated by this
	 * registry.
	 * @param node the node
	 */
	public void register(NamedSchemaNode node) {
		Assert.notNull(node, "node must not be null");
		Assert.notNull(node.identity(), "only identified nodes can be registered");
		Assert.isTrue(this.allocated.contains(node.name()), "name " + node.name() + " was not allocated");
		if (this.byIdentity.putIfAbsent(node.identity(), node) != null) {
			throw new IllegalStateException("Type " + node.identity().typeName() + " is already registered");
		}
	}

	/**
	 * The registered components ordered by name.
	 * @return an unmodifiable view
	 */
	public SortedMap<String, NamedSchemaNode> components() {
		SortedMap<String, NamedSchemaNode> components = new TreeMap<>();
		for (NamedSchemaNode node : this.byIdentity.values()) {
			components.put(node.name(), node);
		}
		return Collections.unmodifiableSortedMap(components);
	}

	public int size() {
		return this.byIdentity.size();
	}

}
