package works.avocado.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avocado.exceptions.SchemaException;
import works.avocado.schema.ResolvedProperty;
import works.avocado.schema.ResolvedSchema;
import works.avocado.schema.ResolvedType;
import works.avocado.schema.Schema;
import works.avocado.schema.SchemaResolver;
import works.avocado.schema.ValueType;

/**
 * Generates the {@link Bindings} for a schema.
 * <p>
 * Compilation happens once per schema. Every type gets a binding that maps each of its
 * wire keys to a {@link PropertyBinding}, and every property gets a {@link ValueCodec}
 * assembled from its {@link ValueType}. Bindings of schema types are shared,
 * so recursive and mutually recursive types need no special treatment.
 */
public final class BindingCompiler {
	private final BindingSettings settings;
	private final ObjectMapper mapper;

	public BindingCompiler() {
		this(BindingSettings.DEFAULT);
	}

	public BindingCompiler(BindingSettings settings) {
		this(settings, new ObjectMapper());
	}

	/**
	 * @param mapper used to read and write {@code Json} values and inline {@code @context} terms
	 */
	public BindingCompiler(BindingSettings settings, ObjectMapper mapper) {
		this.settings = settings;
		this.mapper = mapper;
	}

	public Bindings compile(Schema schema) throws SchemaException {
		return compile(SchemaResolver.resolve(schema));
	}

	public Bindings compile(ResolvedSchema schema) {
		Map<String, TypeBinding> types = new LinkedHashMap<>();
		schema.types().forEach((name, type) -> types.put(name, new TypeBinding(mapper, type)));

		Map<String, VariantsBinding> variants = new LinkedHashMap<>();
		schema.types().forEach((name, type) -> {
			Map<String, TypeBinding> cases = new LinkedHashMap<>();
			type.subtypes().forEach(sub -> cases.put(sub, types.get(sub)));
			variants.put(name, new VariantsBinding(mapper, settings, name, cases));
		});

		for (ResolvedType type: schema.types().values()) {
			List<PropertyBinding> properties = new ArrayList<>();
			for (ResolvedProperty property: type.properties().values()) {
				properties.add(new PropertyBinding(property, codecFor(property.valueType(), types, variants)));
			}
			types.get(type.name()).initialize(properties);
		}
		LOGGER.debug("Compiled bindings for {} types", types.size());
		return new Bindings(schema, settings, mapper, types, variants);
	}

	private ValueCodec codecFor(ValueType valueType, Map<String, TypeBinding> types, Map<String, VariantsBinding> variants) {
		if (valueType instanceof ValueType.Scalar scalar) {
			return ScalarCodecs.forKind(scalar.kind(), settings, mapper);
		} else if (valueType instanceof ValueType.ObjectRef ref) {
			return new ObjectCodec(lookup(types, ref.typeName()));
		} else if (valueType instanceof ValueType.VariantsRef v) {
			return new ObjectCodec(lookup(variants, v.baseTypeName()));
		} else if (valueType instanceof ValueType.OrType or) {
			return new OrCodec(codecFor(or.left(), types, variants), codecFor(or.right(), types, variants));
		} else {
			return new RemotableCodec(codecFor(((ValueType.RemotableType) valueType).inner(), types, variants));
		}
	}

	private static <B> B lookup(Map<String, B> bindings, String typeName) {
		B result = bindings.get(typeName);
		if (result == null) {
			// SchemaResolver has already checked every type name
			throw new IllegalStateException("No binding for type " + typeName);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BindingCompiler.class);
}
