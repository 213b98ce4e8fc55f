package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * A binding whose values are JSON objects, and whose members can therefore
 * be written alongside those of another object, as in a document with an {@code @context}.
 */
public abstract class ObjectBinding<T> extends JsonBinding<T> {
	ObjectBinding(ObjectMapper mapper) {
		super(mapper);
	}

	abstract void writeMembers(T value, JsonGenerator gen) throws IOException;

	@Override
	final void write(T value, JsonGenerator gen) throws IOException {
		gen.writeStartObject();
		writeMembers(value, gen);
		gen.writeEndObject();
	}
}
