package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import works.avocado.exceptions.TypeMismatchException;

/**
 * Streaming helpers shared by the codecs.
 * <p>
 * Every codec reads a value starting with the parser on its first token,
 * and leaves the parser on the value's last token.
 */
final class JsonTokens {
	private JsonTokens() {}

	static void expect(JsonToken expected, String description, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw mismatch(description, p);
		}
	}

	static TypeMismatchException mismatch(String expected, JsonParser p) throws IOException {
		return TypeMismatchException.expected(expected, describe(p));
	}

	static String describe(JsonParser p) throws IOException {
		JsonToken token = p.currentToken();
		if (token == null) {
			return "end of input";
		}
		switch (token) {
			case VALUE_STRING:
				return "string \"" + p.getText() + "\"";
			case VALUE_NUMBER_INT:
			case VALUE_NUMBER_FLOAT:
				return "number " + p.getText();
			case VALUE_TRUE:
			case VALUE_FALSE:
				return "boolean " + p.getText();
			case VALUE_NULL:
				return "null";
			case START_OBJECT:
				return "object";
			case START_ARRAY:
				return "array";
			default:
				return token.toString();
		}
	}

	/**
	 * Copies the current value so that it can be read more than once.
	 * Leaves {@code p} on the value's last token.
	 */
	static TokenBuffer buffer(JsonParser p) throws IOException {
		TokenBuffer result = new TokenBuffer(p);
		result.copyCurrentStructure(p);
		return result;
	}

	/**
	 * @return a parser positioned on the first token of the buffered value
	 */
	static JsonParser replay(TokenBuffer buffer) throws IOException {
		JsonParser result = buffer.asParser();
		result.nextToken();
		return result;
	}
}
