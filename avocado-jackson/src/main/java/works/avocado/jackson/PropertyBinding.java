package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.avocado.LangContainer;
import works.avocado.Property;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.DuplicateFieldException;
import works.avocado.schema.PropertyKind;
import works.avocado.schema.ResolvedProperty;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NULL;
import static works.avocado.jackson.JsonTokens.buffer;
import static works.avocado.jackson.JsonTokens.expect;
import static works.avocado.jackson.JsonTokens.replay;
import static works.avocado.schema.PropertyKind.NORMAL;
import static works.avocado.schema.PropertyKind.REQUIRED;

/**
 * The cardinality rules for one property: how the occurrences of its wire keys
 * combine into the property's slot, and how the slot is written back out.
 * The individual values are handled by the {@link ValueCodec}.
 */
final class PropertyBinding {
	private final ResolvedProperty property;
	private final ValueCodec codec;

	/**
	 * Which of a property's wire keys was encountered.
	 */
	enum Half {
		/**
		 * The canonical tag or an alias
		 */
		DEFAULT,

		/**
		 * The container tag or a container alias
		 */
		CONTAINER,
	}

	PropertyBinding(ResolvedProperty property, ValueCodec codec) {
		this.property = property;
		this.codec = codec;
	}

	ResolvedProperty property() {
		return property;
	}

	String name() {
		return property.name();
	}

	/**
	 * @param current the slot built from earlier occurrences, or null if there were none
	 * @param repeated whether a key of this same half has already been read
	 * @return the slot including the value the parser is on
	 */
	Object read(JsonParser p, Half half, @Nullable Object current, boolean repeated) throws IOException {
		PropertyKind kind = property.kind();
		if (repeated && kind != NORMAL) {
			throw new DuplicateFieldException(property.name());
		}
		if (!property.isLanguageContainer()) {
			switch (kind) {
				case REQUIRED:
					return codec.read(p);
				case FUNCTIONAL:
					return (p.currentToken() == VALUE_NULL) ? Optional.empty() : Optional.of(codec.read(p));
				default:
					Property<Object> values = readMany(p);
					return (current == null) ? values : asProperty(current).merge(values);
			}
		}

		@SuppressWarnings("unchecked")
		LangContainer<Object> container = (current == null) ? LangContainer.empty() : (LangContainer<Object>) current;
		if (p.currentToken() == VALUE_NULL) {
			return container;
		}
		if (half == Half.CONTAINER) {
			return container.withLanguages(readLanguages(p));
		} else if (kind == NORMAL) {
			Property<Object> values = readMany(p);
			return container.withDefault(container.defaultValue()
				.map(earlier -> (Object) asProperty(earlier).merge(values))
				.orElse(values));
		} else {
			return container.withDefault(codec.read(p));
		}
	}

	private Map<String, Object> readLanguages(JsonParser p) throws IOException {
		expect(START_OBJECT, "object of language-tagged values", p);
		Map<String, Object> result = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			String language = p.currentName();
			p.nextToken();
			try {
				if (property.kind() == NORMAL) {
					Property<Object> values = readMany(p);
					if (!values.isEmpty()) {
						result.put(language, values);
					}
				} else if (p.currentToken() != VALUE_NULL) {
					result.put(language, codec.read(p));
				}
			} catch (DecodeException e) {
				throw DecodeException.wrap(e, language);
			}
		}
		return result;
	}

	/**
	 * An array is read element by element; if its elements don't fit,
	 * the array as a whole is tried as a single value, which suits value types like {@code Json}.
	 */
	private Property<Object> readMany(JsonParser p) throws IOException {
		if (p.currentToken() == VALUE_NULL) {
			return Property.empty();
		} else if (p.currentToken() != START_ARRAY) {
			return Property.of(codec.read(p));
		}
		TokenBuffer array = buffer(p);
		try (JsonParser elements = replay(array)) {
			List<Object> result = new ArrayList<>();
			while (elements.nextToken() != END_ARRAY) {
				result.add(codec.read(elements));
			}
			return Property.copyOf(result);
		} catch (DecodeException elementFailure) {
			try (JsonParser whole = replay(array)) {
				return Property.of(codec.read(whole));
			} catch (DecodeException wholeFailure) {
				elementFailure.addSuppressed(wholeFailure);
				throw elementFailure;
			}
		}
	}

	/**
	 * @return true if {@code slot} is the value of a Required property that never appeared
	 */
	boolean isMissing(@Nullable Object slot) {
		if (property.kind() != REQUIRED) {
			return false;
		} else if (property.isLanguageContainer()) {
			return slot == null || ((LangContainer<?>) slot).isEmpty();
		} else {
			return slot == null;
		}
	}

	void write(Object slot, JsonGenerator gen) throws IOException {
		if (property.isLanguageContainer()) {
			LangContainer<?> container = (LangContainer<?>) slot;
			Optional<?> defaultValue = container.defaultValue();
			if (defaultValue.isPresent()) {
				writeMember(property.tag(), defaultValue.get(), gen);
			}
			if (!container.perLanguage().isEmpty()) {
				gen.writeFieldName(property.containerTag());
				gen.writeStartObject();
				for (Map.Entry<String, ?> entry: container.perLanguage().entrySet()) {
					gen.writeFieldName(entry.getKey());
					if (property.kind() == NORMAL) {
						writeMany(asProperty(entry.getValue()), gen);
					} else {
						codec.write(entry.getValue(), gen);
					}
				}
				gen.writeEndObject();
			}
		} else {
			switch (property.kind()) {
				case REQUIRED:
					writeMember(property.tag(), slot, gen);
					break;
				case FUNCTIONAL:
					Optional<?> value = (Optional<?>) slot;
					if (value.isPresent()) {
						writeMember(property.tag(), value.get(), gen);
					}
					break;
				default:
					writeMember(property.tag(), slot, gen);
					break;
			}
		}
	}

	/**
	 * Writes nothing for an empty {@link Property} when {@code value} belongs to a Normal property.
	 */
	private void writeMember(String key, Object value, JsonGenerator gen) throws IOException {
		if (property.kind() == NORMAL) {
			Property<Object> values = asProperty(value);
			if (!values.isEmpty()) {
				gen.writeFieldName(key);
				writeMany(values, gen);
			}
		} else {
			gen.writeFieldName(key);
			codec.write(value, gen);
		}
	}

	/**
	 * A single value is written bare; any other number of values is written as an array.
	 */
	private void writeMany(Property<Object> values, JsonGenerator gen) throws IOException {
		if (values.size() == 1) {
			codec.write(values.values().get(0), gen);
		} else {
			gen.writeStartArray();
			for (Object value: values) {
				codec.write(value, gen);
			}
			gen.writeEndArray();
		}
	}

	@SuppressWarnings("unchecked")
	private static Property<Object> asProperty(Object slot) {
		return (Property<Object>) slot;
	}

	@Override
	public String toString() {
		return "PropertyBinding(" + property.name() + ")";
	}
}
