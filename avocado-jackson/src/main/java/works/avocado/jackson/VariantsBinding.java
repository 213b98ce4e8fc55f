package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avocado.LangContainer;
import works.avocado.Property;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.UnknownDiscriminantException;
import works.avocado.schema.ResolvedProperty;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;
import static works.avocado.jackson.JsonTokens.buffer;
import static works.avocado.jackson.JsonTokens.expect;
import static works.avocado.jackson.JsonTokens.replay;

/**
 * The subtype envelope of a base type: objects of the base type or any of its descendants,
 * told apart by their {@code "type"} member.
 * <p>
 * The {@code "type"} value is a case name, or an array whose first case name is used.
 * If it names no case, or is absent, the object is decoded as the base type.
 */
final class VariantsBinding extends ObjectBinding<Variant> {
	static final String DISCRIMINANT = "type";

	private final String baseTypeName;
	private final TypeBinding baseBinding;
	private final Map<String, TypeBinding> cases;
	private final Map<String, TypeBinding> casesByKey;

	VariantsBinding(ObjectMapper mapper, BindingSettings settings, String baseTypeName, Map<String, TypeBinding> cases) {
		super(mapper);
		this.baseTypeName = baseTypeName;
		this.cases = Collections.unmodifiableMap(new LinkedHashMap<>(cases));
		this.baseBinding = cases.get(baseTypeName);
		Map<String, TypeBinding> byKey = new LinkedHashMap<>(cases);
		if (settings.isAcceptTypeUris()) {
			cases.values().forEach(binding -> {
				String uri = binding.type().uri();
				if (!uri.isEmpty()) {
					byKey.putIfAbsent(uri, binding);
				}
			});
		}
		this.casesByKey = Map.copyOf(byKey);
	}

	@Override
	public String name() {
		return "Variants<" + baseTypeName + ">";
	}

	@Override
	Variant read(JsonParser p) throws IOException {
		expect(START_OBJECT, "object of type " + baseTypeName + " or a subtype", p);
		TokenBuffer object = buffer(p);
		Discriminant discriminant = Discriminant.NONE;
		try (JsonParser scan = replay(object)) {
			while (scan.nextToken() != END_OBJECT) {
				String key = scan.currentName();
				scan.nextToken();
				if (DISCRIMINANT.equals(key)) {
					discriminant = discriminant(scan);
				} else {
					scan.skipChildren();
				}
			}
		}
		if (discriminant.binding() != null) {
			try (JsonParser body = replay(object)) {
				return new Variant(baseTypeName, discriminant.binding().read(body));
			}
		}
		LOGGER.trace("{}: no case for discriminant {}; trying {}", name(), discriminant.text(), baseTypeName);
		try (JsonParser body = replay(object)) {
			return new Variant(baseTypeName, baseBinding.read(body));
		} catch (DecodeException e) {
			throw new UnknownDiscriminantException(discriminant.text(), cases.keySet(), e);
		}
	}

	/**
	 * @param text the discriminant as written, for error messages
	 * @param binding the case it names, if any
	 */
	private record Discriminant(@Nullable String text, @Nullable TypeBinding binding) {
		static final Discriminant NONE = new Discriminant(null, null);
	}

	private Discriminant discriminant(JsonParser p) throws IOException {
		if (p.currentToken() == VALUE_STRING) {
			return new Discriminant(p.getText(), casesByKey.get(p.getText()));
		} else if (p.currentToken() == START_ARRAY) {
			String firstText = null;
			while (p.nextToken() != END_ARRAY) {
				if (p.currentToken() == VALUE_STRING) {
					TypeBinding binding = casesByKey.get(p.getText());
					if (binding != null) {
						Discriminant result = new Discriminant(p.getText(), binding);
						p.skipChildren();
						while (p.nextToken() != END_ARRAY) {
							p.skipChildren();
						}
						return result;
					} else if (firstText == null) {
						firstText = p.getText();
					}
				} else {
					p.skipChildren();
				}
			}
			return new Discriminant(firstText, null);
		} else {
			p.skipChildren();
			return Discriminant.NONE;
		}
	}

	@Override
	void writeMembers(Variant value, JsonGenerator gen) throws IOException {
		TypeBinding binding = cases.get(value.caseName());
		if (binding == null) {
			throw new IllegalArgumentException(value.caseName() + " is not a case of " + name());
		}
		if (!hasOwnDiscriminant(value.value())) {
			gen.writeStringField(DISCRIMINANT, value.caseName());
		}
		binding.writeMembers(value.value(), gen);
	}

	/**
	 * @return true if the object has a property of its own that will be written as {@code "type"}
	 */
	private static boolean hasOwnDiscriminant(VocabObject object) {
		Optional<ResolvedProperty> property = object.type().propertyWithTag(DISCRIMINANT);
		if (property.isEmpty()) {
			return false;
		}
		Object slot = object.values().get(property.get().name());
		if (slot instanceof Optional<?> o) {
			return o.isPresent();
		} else if (slot instanceof Property<?> values) {
			return !values.isEmpty();
		} else if (slot instanceof LangContainer<?> container) {
			return container.hasDefault() && !(container.defaultValue().get() instanceof Property<?> defaults && defaults.isEmpty());
		} else {
			return slot != null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VariantsBinding.class);
}
