package works.avocado.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avocado.exceptions.SchemaException;
import works.avocado.exceptions.UnknownValueTypeException;

/**
 * Turns a {@link Schema} into a {@link ResolvedSchema}: effective properties,
 * subtype closures, and value types checked against the schema's type names.
 * <p>
 * A value type naming {@code TSubtypes}, where {@code T} is a schema type
 * and {@code TSubtypes} is not, means {@code Variants<T>}.
 */
public final class SchemaResolver {
	static final String SUBTYPES_SUFFIX = "Subtypes";

	private SchemaResolver() {}

	public static ResolvedSchema resolve(Schema schema) throws SchemaException {
		InheritanceResolver inheritance = new InheritanceResolver(schema);
		SubtypeGraph subtypeGraph = new SubtypeGraph(schema);
		Map<String, ResolvedType> types = new LinkedHashMap<>();
		for (Map.Entry<String, TypeDef> entry: schema.types().entrySet()) {
			String typeName = entry.getKey();
			TypeDef def = entry.getValue();
			Map<String, ResolvedProperty> properties = new LinkedHashMap<>();
			for (ResolvedProperty property: inheritance.resolve(typeName).values()) {
				ValueType checked = check(schema, typeName, property.name(), property.valueType());
				properties.put(property.name(), property.withValueType(checked));
			}
			ResolvedType resolved = new ResolvedType(typeName, def.uri(), def.doc(), properties, subtypeGraph.subtypes(typeName));
			LOGGER.debug("Resolved {} with {} properties and {} subtypes",
				typeName, properties.size(), resolved.subtypes().size() - 1);
			types.put(typeName, resolved);
		}
		return new ResolvedSchema(types);
	}

	private static ValueType check(Schema schema, String typeName, String propertyName, ValueType valueType) throws UnknownValueTypeException {
		if (valueType instanceof ValueType.Scalar) {
			return valueType;
		} else if (valueType instanceof ValueType.ObjectRef ref) {
			String name = ref.typeName();
			if (schema.types().containsKey(name)) {
				return valueType;
			}
			if (name.endsWith(SUBTYPES_SUFFIX)) {
				String base = name.substring(0, name.length() - SUBTYPES_SUFFIX.length());
				if (schema.types().containsKey(base)) {
					return ValueType.variants(base);
				}
			}
			throw new UnknownValueTypeException(typeName, propertyName, name);
		} else if (valueType instanceof ValueType.VariantsRef v) {
			if (schema.types().containsKey(v.baseTypeName())) {
				return valueType;
			}
			throw new UnknownValueTypeException(typeName, propertyName, v.toString());
		} else if (valueType instanceof ValueType.OrType or) {
			return ValueType.or(
				check(schema, typeName, propertyName, or.left()),
				check(schema, typeName, propertyName, or.right()));
		} else {
			ValueType.RemotableType r = (ValueType.RemotableType) valueType;
			return ValueType.remotable(check(schema, typeName, propertyName, r.inner()));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaResolver.class);
}
