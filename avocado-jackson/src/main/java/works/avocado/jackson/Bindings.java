package works.avocado.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import works.avocado.Context;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.WithContext;
import works.avocado.schema.ResolvedSchema;

/**
 * The bindings for every type of a schema, as produced by {@link BindingCompiler}.
 * Immutable, and safe to share among threads.
 */
public final class Bindings {
	private final ResolvedSchema schema;
	private final BindingSettings settings;
	private final ObjectMapper mapper;
	private final Map<String, TypeBinding> types;
	private final Map<String, VariantsBinding> variants;
	private final ContextBinding context;

	Bindings(ResolvedSchema schema, BindingSettings settings, ObjectMapper mapper, Map<String, TypeBinding> types, Map<String, VariantsBinding> variants) {
		this.schema = schema;
		this.settings = settings;
		this.mapper = mapper;
		this.types = Map.copyOf(types);
		this.variants = Map.copyOf(variants);
		this.context = new ContextBinding(mapper);
	}

	public ResolvedSchema schema() {
		return schema;
	}

	public BindingSettings settings() {
		return settings;
	}

	/**
	 * The binding for objects of exactly the type {@code typeName}.
	 *
	 * @throws IllegalArgumentException if there is no such type
	 */
	public ObjectBinding<VocabObject> type(String typeName) {
		return typeBinding(typeName);
	}

	/**
	 * The binding for objects of {@code baseTypeName} or any of its subtypes,
	 * distinguished by their {@code "type"} member.
	 *
	 * @throws IllegalArgumentException if there is no such type
	 */
	public ObjectBinding<Variant> variants(String baseTypeName) {
		VariantsBinding result = variants.get(baseTypeName);
		if (result == null) {
			throw new IllegalArgumentException("No such type: " + baseTypeName);
		}
		return result;
	}

	/**
	 * The binding for a document whose body is exactly of the type {@code typeName}.
	 */
	public ObjectBinding<WithContext<VocabObject>> document(String typeName) {
		return new WithContextBinding<>(mapper, context, type(typeName));
	}

	/**
	 * The binding for a document whose body is {@code baseTypeName} or any of its subtypes.
	 */
	public ObjectBinding<WithContext<Variant>> variantsDocument(String baseTypeName) {
		return new WithContextBinding<>(mapper, context, variants(baseTypeName));
	}

	public JsonBinding<Context> context() {
		return context;
	}

	/**
	 * @return a module that lets {@code mapper} serialize the typed values of this schema
	 */
	public AvocadoJacksonModule module() {
		return new AvocadoJacksonModule(this);
	}

	TypeBinding typeBinding(String typeName) {
		TypeBinding result = types.get(typeName);
		if (result == null) {
			throw new IllegalArgumentException("No such type: " + typeName);
		}
		return result;
	}

	ContextBinding contextBinding() {
		return context;
	}
}
