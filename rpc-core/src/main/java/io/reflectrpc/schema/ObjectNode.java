/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.reflectrpc.util.Assert;

/**
 * Object with a fixed set of properties. Named objects are registered before their
 * properties are walked, so a node can be referenced while it is still being populated.
 * Equality is identity.
 */
public final class ObjectNode implements NamedSchemaNode {

	private final String name;

	private final TypeIdentity identity;

	private final Map<String, SchemaProperty> properties = new LinkedHashMap<>();

	private ObjectNode(String name, TypeIdentity identity) {
		this.name = name;
		this.identity = identity;
	}

	public static ObjectNode named(String name, TypeIdentity identity) {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(identity, "identity must not be null");
		return new ObjectNode(name, identity);
	}

	public static ObjectNode anonymous() {
		return new ObjectNode(null, null);
	}

	@Override
	public String name() {
		return this.name;
	}

	@Override
	public TypeIdentity identity() {
		return this.identity;
	}

	public boolean isAnonymous() {
		return this.name == null;
	}

	/**
	 * Add a property. A later property with the same name replaces the earlier one.
	 * @param property the property
	 * @return this node
	 */
	public ObjectNode addProperty(SchemaProperty property) {
		Assert.notNull(property, "property must not be null");
		this.properties.put(property.name(), property);
		return this;
	}

	public List<SchemaProperty> properties() {
		return Collections.unmodifiableList(new ArrayList<>(this.properties.values()));
	}

	public SchemaProperty property(String name) {
		return this.properties.get(name);
	}

	public List<String> requiredNames() {
		List<String> required = new ArrayList<>();
		for (SchemaProperty property : this.properties.values()) {
			if (property.required()) {
				required.add(property.name());
			}
		}
		return required;
	}

	@Override
	public String toString() {
		return "ObjectNode[" + (this.name != null ? this.name : "<anonymous>") + ", properties="
				+ this.properties.keySet() + "]";
	}

}
