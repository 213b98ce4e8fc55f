package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.MalformedJsonException;

/**
 * Decodes and encodes one kind of typed value.
 * Instances are immutable and may be used from any number of threads.
 * <p>
 * Decoding from text or from a {@link JsonParser} sees every member of every object,
 * so repeated keys are merged or rejected according to their property's kind.
 * A {@link JsonNode} cannot hold repeated keys, so decoding a tree only sees
 * repetition through aliases.
 *
 * @param <T> the typed value
 */
public abstract class JsonBinding<T> {
	final ObjectMapper mapper;

	JsonBinding(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * A short description for log and error messages.
	 */
	public abstract String name();

	/**
	 * Starts on the first token of the value and finishes on its last token.
	 */
	abstract T read(JsonParser p) throws IOException;

	abstract void write(T value, JsonGenerator gen) throws IOException;

	/**
	 * @throws DecodeException if {@code json} does not describe a valid value
	 */
	public T decode(JsonNode json) {
		try (JsonParser p = json.traverse(mapper)) {
			p.nextToken();
			return read(p);
		} catch (IOException e) {
			throw new MalformedJsonException("Unable to read JSON tree: " + e.getMessage(), e);
		}
	}

	/**
	 * @throws MalformedJsonException if {@code json} is not a single JSON value
	 * @throws DecodeException if it does not describe a valid value
	 */
	public T decode(String json) {
		try (JsonParser p = mapper.createParser(json)) {
			if (p.nextToken() == null) {
				throw new MalformedJsonException("No JSON value found");
			}
			T result = read(p);
			if (p.nextToken() != null) {
				throw new MalformedJsonException("Unexpected " + p.currentToken() + " after the JSON value");
			}
			return result;
		} catch (IOException e) {
			throw new MalformedJsonException("Invalid JSON: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads one value from {@code p}: the value at the parser's current token if it has one,
	 * or else at its next token. Leaves the parser on the value's last token.
	 */
	public T decode(JsonParser p) throws IOException {
		if (p.currentToken() == null && p.nextToken() == null) {
			throw new MalformedJsonException("No JSON value found");
		}
		return read(p);
	}

	public JsonNode encode(T value) {
		try {
			TokenBuffer buffer = new TokenBuffer(mapper, false);
			write(value, buffer);
			buffer.close();
			return mapper.readTree(buffer.asParser());
		} catch (IOException e) {
			throw new UncheckedIOException("Unexpected error encoding " + name(), e);
		}
	}

	public String encodeToString(T value) {
		StringWriter result = new StringWriter();
		try (JsonGenerator gen = mapper.createGenerator(result)) {
			write(value, gen);
		} catch (IOException e) {
			throw new UncheckedIOException("Unexpected error encoding " + name(), e);
		}
		return result.toString();
	}

	public void encode(T value, JsonGenerator gen) throws IOException {
		write(value, gen);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + name() + ")";
	}
}
