package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import java.io.IOException;
import works.avocado.Variant;
import works.avocado.VocabObject;

/**
 * A value whose type is a schema type, or the subtype envelope of one.
 */
record ObjectCodec(ObjectBinding<?> binding) implements ValueCodec {
	@Override
	public Object read(JsonParser p) throws IOException {
		return binding.read(p);
	}

	@Override
	@SuppressWarnings("unchecked")
	public void write(Object value, JsonGenerator gen) throws IOException {
		if (value instanceof VocabObject || value instanceof Variant) {
			((ObjectBinding<Object>) binding).write(value, gen);
		} else {
			throw new IllegalArgumentException("Not a typed object: " + value.getClass().getSimpleName());
		}
	}
}
