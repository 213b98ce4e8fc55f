package works.avocado.schema;

import com.fasterxml.jackson.databind.node.NullNode;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import works.avocado.LangContainer;
import works.avocado.Or;
import works.avocado.Remotable;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.xsd.XsdDateTime;
import works.avocado.xsd.XsdDuration;

/**
 * Every type of a schema with its effective properties and subtypes,
 * as produced by {@link SchemaResolver}. Immutable.
 */
public final class ResolvedSchema {
	private final Map<String, ResolvedType> types;

	ResolvedSchema(Map<String, ResolvedType> types) {
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
	}

	public Map<String, ResolvedType> types() {
		return types;
	}

	/**
	 * @throws IllegalArgumentException if there is no such type
	 */
	public ResolvedType type(String name) {
		ResolvedType result = types.get(name);
		if (result == null) {
			throw new IllegalArgumentException("No such type: " + name);
		}
		return result;
	}

	/**
	 * @return true if {@code typeName} is {@code ancestorName} or transitively extends it
	 */
	public boolean isSubtype(String typeName, String ancestorName) {
		return type(ancestorName).subtypes().contains(typeName);
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is not a member of the subtype envelope of {@code baseTypeName}
	 */
	public Variant variant(String baseTypeName, VocabObject value) {
		if (!isSubtype(value.typeName(), baseTypeName)) {
			throw new IllegalArgumentException(value.typeName() + " is not a subtype of " + baseTypeName);
		}
		return new Variant(baseTypeName, value);
	}

	/**
	 * Converts {@code value} to an ancestor type.
	 * Properties of the same name and shape are carried across;
	 * the rest take their empty value, or for Required properties, the {@link #defaultValue default} of their value type.
	 *
	 * @throws IllegalArgumentException if {@code targetTypeName} is not an ancestor of the value's type
	 */
	public VocabObject upcast(VocabObject value, String targetTypeName) {
		if (value.typeName().equals(targetTypeName)) {
			return value;
		}
		if (!isSubtype(value.typeName(), targetTypeName)) {
			throw new IllegalArgumentException("Cannot upcast " + value.typeName() + " to " + targetTypeName);
		}
		ResolvedType target = type(targetTypeName);
		VocabObject.Builder builder = target.newObject();
		for (ResolvedProperty property: target.properties().values()) {
			ResolvedProperty source = value.type().properties().get(property.name());
			if (source != null && sameShape(source, property)) {
				builder.set(property.name(), value.values().get(property.name()));
			} else if (property.kind() == PropertyKind.REQUIRED) {
				builder.set(property.name(), defaultSlot(property, new LinkedHashSet<>()));
			}
		}
		return builder.build();
	}

	/**
	 * Converts a member of a subtype envelope to the envelope's base type.
	 */
	public VocabObject upcast(Variant variant) {
		return upcast(variant.value(), variant.baseTypeName());
	}

	/**
	 * The value used for a Required property that an upcast has no value for.
	 * Zero, empty, or false for scalars; the left side of an either-of; inline for a remotable;
	 * and for schema types, an object whose Required properties all have default values.
	 *
	 * @throws IllegalStateException if the type's Required properties refer back to it,
	 * so no finite default exists
	 */
	public Object defaultValue(ValueType valueType) {
		return defaultValue(valueType, new LinkedHashSet<>());
	}

	public VocabObject defaultObject(String typeName) {
		return defaultObject(typeName, new LinkedHashSet<>());
	}

	private Object defaultValue(ValueType valueType, Set<String> building) {
		if (valueType instanceof ValueType.Scalar scalar) {
			switch (scalar.kind()) {
				case STRING: return "";
				case URI: return URI.create("");
				case BOOLEAN: return false;
				case INTEGER:
				case NON_NEGATIVE_INTEGER: return 0L;
				case FLOAT: return 0.0;
				case DATE_TIME: return new XsdDateTime.Naive(LocalDateTime.of(1970, 1, 1, 0, 0));
				case DURATION: return XsdDuration.ZERO;
				default: return NullNode.getInstance();
			}
		} else if (valueType instanceof ValueType.ObjectRef ref) {
			return defaultObject(ref.typeName(), building);
		} else if (valueType instanceof ValueType.VariantsRef v) {
			return new Variant(v.baseTypeName(), defaultObject(v.baseTypeName(), building));
		} else if (valueType instanceof ValueType.OrType or) {
			return Or.left(defaultValue(or.left(), building));
		} else {
			return Remotable.inline(defaultValue(((ValueType.RemotableType) valueType).inner(), building));
		}
	}

	private VocabObject defaultObject(String typeName, Set<String> building) {
		if (!building.add(typeName)) {
			throw new IllegalStateException("No finite default value for " + typeName + ": required properties form a cycle " + building);
		}
		ResolvedType type = type(typeName);
		VocabObject.Builder builder = type.newObject();
		for (ResolvedProperty property: type.properties().values()) {
			if (property.kind() == PropertyKind.REQUIRED) {
				builder.set(property.name(), defaultSlot(property, building));
			}
		}
		building.remove(typeName);
		return builder.build();
	}

	private Object defaultSlot(ResolvedProperty property, Set<String> building) {
		Object value = defaultValue(property.valueType(), building);
		return property.isLanguageContainer() ? LangContainer.ofDefault(value) : value;
	}

	private static boolean sameShape(ResolvedProperty a, ResolvedProperty b) {
		return a.kind() == b.kind()
			&& a.isLanguageContainer() == b.isLanguageContainer()
			&& a.valueType().equals(b.valueType());
	}
}
