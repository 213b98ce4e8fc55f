package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import works.avocado.exceptions.TypeMismatchException;
import works.avocado.schema.ScalarKind;
import works.avocado.xsd.DurationFormat;
import works.avocado.xsd.XsdDateTime;
import works.avocado.xsd.XsdDuration;

import static com.fasterxml.jackson.core.JsonParser.NumberType.BIG_INTEGER;
import static com.fasterxml.jackson.core.JsonToken.VALUE_FALSE;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NUMBER_FLOAT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NUMBER_INT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;
import static com.fasterxml.jackson.core.JsonToken.VALUE_TRUE;
import static works.avocado.jackson.JsonTokens.expect;
import static works.avocado.jackson.JsonTokens.mismatch;

final class ScalarCodecs {
	private ScalarCodecs() {}

	static ValueCodec forKind(ScalarKind kind, BindingSettings settings, ObjectMapper mapper) {
		switch (kind) {
			case STRING: return STRING;
			case URI: return URI_CODEC;
			case BOOLEAN: return BOOLEAN;
			case INTEGER: return new IntegerCodec(false);
			case NON_NEGATIVE_INTEGER: return new IntegerCodec(true);
			case FLOAT: return FLOAT;
			case DATE_TIME: return DATE_TIME;
			case DURATION: return new DurationCodec(settings.getDurationFormat());
			case JSON: return new RawJsonCodec(mapper);
			default: throw new AssertionError("Unknown scalar kind " + kind);
		}
	}

	static final ValueCodec STRING = new ValueCodec() {
		@Override
		public Object read(JsonParser p) throws IOException {
			expect(VALUE_STRING, "string", p);
			return p.getText();
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeString((String) value);
		}
	};

	static final ValueCodec URI_CODEC = new ValueCodec() {
		@Override
		public Object read(JsonParser p) throws IOException {
			expect(VALUE_STRING, "absolute URI", p);
			return parseAbsoluteUri(p);
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeString(value.toString());
		}
	};

	static URI parseAbsoluteUri(JsonParser p) throws IOException {
		URI result;
		try {
			result = new URI(p.getText());
		} catch (URISyntaxException e) {
			TypeMismatchException mismatch = mismatch("absolute URI", p);
			mismatch.initCause(e);
			throw mismatch;
		}
		if (!result.isAbsolute()) {
			throw mismatch("absolute URI", p);
		}
		return result;
	}

	static final ValueCodec BOOLEAN = new ValueCodec() {
		@Override
		public Object read(JsonParser p) throws IOException {
			if (p.currentToken() == VALUE_TRUE) {
				return true;
			} else if (p.currentToken() == VALUE_FALSE) {
				return false;
			} else {
				throw mismatch("boolean", p);
			}
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeBoolean((Boolean) value);
		}
	};

	private record IntegerCodec(boolean nonNegative) implements ValueCodec {
		@Override
		public Object read(JsonParser p) throws IOException {
			String expected = nonNegative ? "non-negative integer" : "integer";
			if (p.currentToken() != VALUE_NUMBER_INT || p.getNumberType() == BIG_INTEGER) {
				throw mismatch(expected, p);
			}
			long result = p.getLongValue();
			if (nonNegative && result < 0) {
				throw mismatch(expected, p);
			}
			return result;
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			long number = (Long) value;
			// Same number type the parser reports for this value
			if (number == (int) number) {
				gen.writeNumber((int) number);
			} else {
				gen.writeNumber(number);
			}
		}
	}

	static final ValueCodec FLOAT = new ValueCodec() {
		@Override
		public Object read(JsonParser p) throws IOException {
			if (p.currentToken() == VALUE_NUMBER_FLOAT || p.currentToken() == VALUE_NUMBER_INT) {
				return p.getDoubleValue();
			}
			throw mismatch("number", p);
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeNumber((Double) value);
		}
	};

	static final ValueCodec DATE_TIME = new ValueCodec() {
		@Override
		public Object read(JsonParser p) throws IOException {
			expect(VALUE_STRING, "date-time string", p);
			return XsdDateTime.parse(p.getText());
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeString(((XsdDateTime) value).format());
		}
	};

	private record DurationCodec(DurationFormat format) implements ValueCodec {
		@Override
		public Object read(JsonParser p) throws IOException {
			expect(VALUE_STRING, "duration string", p);
			return XsdDuration.parse(p.getText());
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			gen.writeString(((XsdDuration) value).format(format));
		}
	}

	/**
	 * Any JSON at all, kept as a tree.
	 */
	private record RawJsonCodec(ObjectMapper mapper) implements ValueCodec {
		@Override
		public Object read(JsonParser p) throws IOException {
			JsonNode result = mapper.readTree(p);
			if (result == null) {
				throw mismatch("JSON value", p);
			}
			return result;
		}

		@Override
		public void write(Object value, JsonGenerator gen) throws IOException {
			mapper.writeTree(gen, (JsonNode) value);
		}
	}
}
