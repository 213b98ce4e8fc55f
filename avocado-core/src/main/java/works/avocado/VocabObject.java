package works.avocado;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import works.avocado.schema.PropertyKind;
import works.avocado.schema.ResolvedProperty;
import works.avocado.schema.ResolvedType;

/**
 * A value of a schema type: one slot per {@link ResolvedType#properties() property},
 * each shaped by the property's kind.
 *
 * <table>
 *     <caption>Slot shapes</caption>
 *     <tr><th>Kind</th><th>Simple</th><th>Language container</th></tr>
 *     <tr><td>Required</td><td>{@code T}</td><td>{@code LangContainer<T>}</td></tr>
 *     <tr><td>Functional</td><td>{@code Optional<T>}</td><td>{@code LangContainer<T>}</td></tr>
 *     <tr><td>Normal</td><td>{@code Property<T>}</td><td>{@code LangContainer<Property<T>>}</td></tr>
 * </table>
 *
 * Immutable. Two objects are equal if they have the same type name and equal slots.
 */
public final class VocabObject implements ObjectId {
	private final ResolvedType type;
	private final Map<String, Object> values;

	private VocabObject(ResolvedType type, Map<String, Object> values) {
		this.type = type;
		this.values = values;
	}

	public static Builder builder(ResolvedType type) {
		return new Builder(type);
	}

	public Builder toBuilder() {
		Builder result = new Builder(type);
		result.values.putAll(values);
		return result;
	}

	public String typeName() {
		return type.name();
	}

	public ResolvedType type() {
		return type;
	}

	/**
	 * @return every slot by property name, in property order
	 */
	public Map<String, Object> values() {
		return values;
	}

	/**
	 * @throws IllegalArgumentException if the type has no such property
	 */
	public Object get(String propertyName) {
		type.property(propertyName);
		return values.get(propertyName);
	}

	@SuppressWarnings("unchecked")
	public <T> T required(String propertyName) {
		expectShape(propertyName, PropertyKind.REQUIRED, false);
		return (T) values.get(propertyName);
	}

	@SuppressWarnings("unchecked")
	public <T> Optional<T> functional(String propertyName) {
		expectShape(propertyName, PropertyKind.FUNCTIONAL, false);
		return (Optional<T>) values.get(propertyName);
	}

	@SuppressWarnings("unchecked")
	public <T> Property<T> normal(String propertyName) {
		expectShape(propertyName, PropertyKind.NORMAL, false);
		return (Property<T>) values.get(propertyName);
	}

	/**
	 * @param <V> {@code Property<T>} for a Normal property; otherwise {@code T}
	 */
	@SuppressWarnings("unchecked")
	public <V> LangContainer<V> langContainer(String propertyName) {
		expectShape(propertyName, null, true);
		return (LangContainer<V>) values.get(propertyName);
	}

	/**
	 * @return the identifier held by the property whose wire key is {@code "id"}, if any
	 */
	@Override
	public Optional<URI> objectId() {
		return type.propertyWithTag("id")
			.map(p -> values.get(p.name()))
			.flatMap(ObjectId::of);
	}

	private void expectShape(String propertyName, PropertyKind kind, boolean container) {
		ResolvedProperty property = type.property(propertyName);
		if (property.isLanguageContainer() != container || (kind != null && property.kind() != kind)) {
			throw new IllegalArgumentException("Property " + typeName() + "." + propertyName
				+ " is " + describe(property));
		}
	}

	static String describe(ResolvedProperty property) {
		return property.kind().schemaName() + (property.isLanguageContainer() ? " LangContainer" : " Simple");
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof VocabObject other
			&& typeName().equals(other.typeName())
			&& values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(typeName(), values);
	}

	@Override
	public String toString() {
		return typeName() + values;
	}

	public static final class Builder {
		private final ResolvedType type;
		private final Map<String, Object> values = new LinkedHashMap<>();

		private Builder(ResolvedType type) {
			this.type = type;
		}

		public ResolvedType type() {
			return type;
		}

		public boolean has(String propertyName) {
			return values.containsKey(propertyName);
		}

		/**
		 * Sets a whole slot, which must already have the shape of the property.
		 */
		public Builder set(String propertyName, Object slot) {
			ResolvedProperty property = type.property(propertyName);
			Class<?> expected = slotClass(property);
			if (!expected.isInstance(slot)) {
				throw new IllegalArgumentException("Property " + type.name() + "." + propertyName
					+ " is " + describe(property) + " and cannot hold " + slot.getClass().getSimpleName());
			}
			values.put(propertyName, slot);
			return this;
		}

		/**
		 * Sets a Required or Functional value, or appends a Normal one.
		 * For a language container, this applies to the language-neutral value.
		 */
		@SuppressWarnings("unchecked")
		public Builder value(String propertyName, Object value) {
			Objects.requireNonNull(value);
			ResolvedProperty property = type.property(propertyName);
			if (property.isLanguageContainer()) {
				LangContainer<Object> current = currentContainer(propertyName);
				Object newDefault = (property.kind() == PropertyKind.NORMAL)
					? current.defaultValue().map(p -> ((Property<Object>) p).plus(value)).orElseGet(() -> Property.of(value))
					: value;
				values.put(propertyName, current.withDefault(newDefault));
			} else {
				switch (property.kind()) {
					case REQUIRED:
						values.put(propertyName, value);
						break;
					case FUNCTIONAL:
						values.put(propertyName, Optional.of(value));
						break;
					case NORMAL:
						Property<Object> current = currentProperty(propertyName);
						values.put(propertyName, current.plus(value));
						break;
				}
			}
			return this;
		}

		/**
		 * Sets the value for {@code language} of a language container,
		 * or appends to it if the property is Normal.
		 */
		@SuppressWarnings("unchecked")
		public Builder language(String propertyName, String language, Object value) {
			Objects.requireNonNull(value);
			ResolvedProperty property = type.property(propertyName);
			if (!property.isLanguageContainer()) {
				throw new IllegalArgumentException("Property " + type.name() + "." + propertyName + " is not a language container");
			}
			LangContainer<Object> current = currentContainer(propertyName);
			Object newValue = (property.kind() == PropertyKind.NORMAL)
				? current.get(language).map(p -> ((Property<Object>) p).plus(value)).orElseGet(() -> Property.of(value))
				: value;
			values.put(propertyName, current.withLanguages(Map.of(language, newValue)));
			return this;
		}

		/**
		 * Fills absent optional slots with their empty value.
		 *
		 * @throws IllegalStateException if a Required property has no value
		 */
		public VocabObject build() {
			Map<String, Object> result = new LinkedHashMap<>();
			for (ResolvedProperty property: type.properties().values()) {
				Object value = values.get(property.name());
				if (value == null) {
					value = emptySlot(property);
				}
				if (property.kind() == PropertyKind.REQUIRED
					&& (value == null || (value instanceof LangContainer<?> c && c.isEmpty()))) {
					throw new IllegalStateException("Missing required property " + type.name() + "." + property.name());
				}
				result.put(property.name(), value);
			}
			return new VocabObject(type, Collections.unmodifiableMap(result));
		}

		@SuppressWarnings("unchecked")
		private LangContainer<Object> currentContainer(String propertyName) {
			return (LangContainer<Object>) values.getOrDefault(propertyName, LangContainer.empty());
		}

		@SuppressWarnings("unchecked")
		private Property<Object> currentProperty(String propertyName) {
			return (Property<Object>) values.getOrDefault(propertyName, Property.empty());
		}
	}

	/**
	 * @return the value of an absent property, or null if it must not be absent
	 */
	private static Object emptySlot(ResolvedProperty property) {
		if (property.isLanguageContainer()) {
			return LangContainer.empty();
		}
		switch (property.kind()) {
			case FUNCTIONAL:
				return Optional.empty();
			case NORMAL:
				return Property.empty();
			default:
				return null;
		}
	}

	private static Class<?> slotClass(ResolvedProperty property) {
		if (property.isLanguageContainer()) {
			return LangContainer.class;
		}
		switch (property.kind()) {
			case FUNCTIONAL:
				return Optional.class;
			case NORMAL:
				return Property.class;
			default:
				return Object.class;
		}
	}
}
