package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avocado.VocabObject;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.MissingRequiredFieldException;
import works.avocado.jackson.PropertyBinding.Half;
import works.avocado.schema.ResolvedType;

import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static works.avocado.jackson.JsonTokens.expect;

/**
 * Decodes and encodes the objects of exactly one schema type.
 * <p>
 * Created empty so that bindings of mutually recursive types can refer to each other,
 * then {@link #initialize initialized} once with its property bindings.
 */
final class TypeBinding extends ObjectBinding<VocabObject> {
	private final ResolvedType type;
	private List<PropertyBinding> properties;
	private Map<String, KeyTarget> keys;

	/**
	 * The property and half that a wire key refers to.
	 */
	record KeyTarget(PropertyBinding binding, Half half) { }

	TypeBinding(ObjectMapper mapper, ResolvedType type) {
		super(mapper);
		this.type = type;
	}

	void initialize(List<PropertyBinding> properties) {
		if (this.properties != null) {
			throw new IllegalStateException("Binding for " + type.name() + " is already initialized");
		}
		Map<String, KeyTarget> keys = new LinkedHashMap<>();
		// Canonical keys first, so that no alias can displace them
		for (PropertyBinding binding: properties) {
			keys.put(binding.property().tag(), new KeyTarget(binding, Half.DEFAULT));
			if (binding.property().isLanguageContainer()) {
				keys.put(binding.property().containerTag(), new KeyTarget(binding, Half.CONTAINER));
			}
		}
		for (PropertyBinding binding: properties) {
			binding.property().defaultKeys().forEach(key -> addAlias(keys, key, new KeyTarget(binding, Half.DEFAULT)));
			binding.property().containerKeys().forEach(key -> addAlias(keys, key, new KeyTarget(binding, Half.CONTAINER)));
		}
		this.properties = List.copyOf(properties);
		this.keys = Map.copyOf(keys);
		LOGGER.debug("{} recognizes keys {}", type.name(), keys.keySet());
	}

	private void addAlias(Map<String, KeyTarget> keys, String key, KeyTarget target) {
		KeyTarget existing = keys.putIfAbsent(key, target);
		if (existing != null && !existing.equals(target)) {
			LOGGER.debug("{}: key \"{}\" of {} is already taken by {}", type.name(), key, target.binding(), existing.binding());
		}
	}

	ResolvedType type() {
		return type;
	}

	@Override
	public String name() {
		return type.name();
	}

	@Override
	VocabObject read(JsonParser p) throws IOException {
		expect(START_OBJECT, "object of type " + type.name(), p);
		Map<PropertyBinding, Object> slots = new HashMap<>();
		Set<KeyTarget> seen = new HashSet<>();
		while (p.nextToken() != END_OBJECT) {
			String key = p.currentName();
			p.nextToken();
			KeyTarget target = keys.get(key);
			if (target == null) {
				LOGGER.trace("{}: ignoring member \"{}\"", type.name(), key);
				p.skipChildren();
				continue;
			}
			PropertyBinding binding = target.binding();
			try {
				slots.put(binding, binding.read(p, target.half(), slots.get(binding), !seen.add(target)));
			} catch (DecodeException e) {
				throw DecodeException.wrap(e, type.name() + "." + key);
			}
		}
		VocabObject.Builder builder = type.newObject();
		for (PropertyBinding binding: properties) {
			Object slot = slots.get(binding);
			if (binding.isMissing(slot)) {
				throw DecodeException.wrap(new MissingRequiredFieldException(binding.name()), type.name());
			}
			if (slot != null) {
				builder.set(binding.name(), slot);
			}
		}
		return builder.build();
	}

	@Override
	void writeMembers(VocabObject value, JsonGenerator gen) throws IOException {
		if (!value.typeName().equals(type.name())) {
			throw new IllegalArgumentException("Binding for " + type.name() + " cannot encode a " + value.typeName());
		}
		for (PropertyBinding binding: properties) {
			binding.write(value.values().get(binding.name()), gen);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeBinding.class);
}
