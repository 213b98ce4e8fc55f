package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import java.io.IOException;

/**
 * Reads and writes one value of a {@link works.avocado.schema.ValueType ValueType},
 * irrespective of the cardinality of the property holding it.
 * <p>
 * {@link #read} starts on the first token of the value and ends on its last token.
 * It signals a value of the wrong shape by throwing a
 * {@link works.avocado.exceptions.DecodeException DecodeException}.
 */
interface ValueCodec {
	Object read(JsonParser p) throws IOException;

	void write(Object value, JsonGenerator gen) throws IOException;
}
