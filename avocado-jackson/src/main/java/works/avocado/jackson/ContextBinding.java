package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import works.avocado.Context;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;
import static works.avocado.jackson.JsonTokens.mismatch;

/**
 * The JSON-LD {@code @context} value: an identifier, an object of term definitions,
 * or an array of both. Written back in the {@link Context.Shape shape} its contents call for.
 */
final class ContextBinding extends JsonBinding<Context> {
	ContextBinding(ObjectMapper mapper) {
		super(mapper);
	}

	@Override
	public String name() {
		return "@context";
	}

	@Override
	Context read(JsonParser p) throws IOException {
		Context.Builder result = Context.builder();
		if (p.currentToken() == START_ARRAY) {
			while (p.nextToken() != END_ARRAY) {
				readElement(p, result);
			}
		} else {
			readElement(p, result);
		}
		return result.build();
	}

	private void readElement(JsonParser p, Context.Builder result) throws IOException {
		if (p.currentToken() == VALUE_STRING) {
			result.identifier(ScalarCodecs.parseAbsoluteUri(p));
		} else if (p.currentToken() == START_OBJECT) {
			result.inline(readTerms(p));
		} else {
			throw mismatch("context identifier or object", p);
		}
	}

	private Map<String, JsonNode> readTerms(JsonParser p) throws IOException {
		Map<String, JsonNode> result = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			String term = p.currentName();
			p.nextToken();
			result.put(term, mapper.readTree(p));
		}
		return result;
	}

	@Override
	void write(Context value, JsonGenerator gen) throws IOException {
		switch (value.shape()) {
			case INLINE:
				writeTerms(value, gen);
				break;
			case SINGLE_IDENTIFIER:
				gen.writeString(value.identifiers().get(0).toString());
				break;
			case IDENTIFIERS:
				writeIdentifiers(value, gen);
				gen.writeEndArray();
				break;
			case MIXED:
				writeIdentifiers(value, gen);
				writeTerms(value, gen);
				gen.writeEndArray();
				break;
		}
	}

	/**
	 * Leaves the array open.
	 */
	private void writeIdentifiers(Context value, JsonGenerator gen) throws IOException {
		gen.writeStartArray();
		for (URI identifier: value.identifiers()) {
			gen.writeString(identifier.toString());
		}
	}

	private void writeTerms(Context value, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		for (Map.Entry<String, JsonNode> entry: value.inline().entrySet()) {
			gen.writeFieldName(entry.getKey());
			mapper.writeTree(gen, entry.getValue());
		}
		gen.writeEndObject();
	}
}
