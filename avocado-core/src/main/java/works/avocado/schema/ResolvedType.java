package works.avocado.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.avocado.VocabObject;

/**
 * A schema type with its effective properties and its subtypes.
 *
 * @param subtypes this type followed by every type that transitively extends it
 */
public record ResolvedType(
	String name,
	String uri,
	String doc,
	Map<String, ResolvedProperty> properties,
	List<String> subtypes
) {
	public ResolvedType {
		properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		subtypes = List.copyOf(subtypes);
	}

	/**
	 * @throws IllegalArgumentException if this type has no property with the given name
	 */
	public ResolvedProperty property(String propertyName) {
		ResolvedProperty result = properties.get(propertyName);
		if (result == null) {
			throw new IllegalArgumentException("Type " + name + " has no property \"" + propertyName + "\"");
		}
		return result;
	}

	/**
	 * @return the property whose canonical wire key is {@code tag}, if any
	 */
	public Optional<ResolvedProperty> propertyWithTag(String tag) {
		return properties.values().stream()
			.filter(p -> p.tag().equals(tag))
			.findFirst();
	}

	public VocabObject.Builder newObject() {
		return VocabObject.builder(this);
	}

	@Override
	public String toString() {
		return "ResolvedType[" + name + "]";
	}
}
