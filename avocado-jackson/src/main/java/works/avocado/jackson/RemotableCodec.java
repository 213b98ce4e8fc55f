package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import works.avocado.Remotable;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.TypeMismatchException;

import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;
import static works.avocado.jackson.JsonTokens.buffer;
import static works.avocado.jackson.JsonTokens.mismatch;
import static works.avocado.jackson.JsonTokens.replay;

/**
 * An inline value if {@code inner} can read it, or else an identifier referring to one.
 */
record RemotableCodec(ValueCodec inner) implements ValueCodec {
	@Override
	public Object read(JsonParser p) throws IOException {
		TokenBuffer value = buffer(p);
		DecodeException inlineFailure;
		try (JsonParser attempt = replay(value)) {
			return Remotable.inline(inner.read(attempt));
		} catch (DecodeException e) {
			inlineFailure = e;
		}
		try (JsonParser attempt = replay(value)) {
			if (attempt.currentToken() != VALUE_STRING) {
				throw mismatch("identifier", attempt);
			}
			return Remotable.remote(ScalarCodecs.parseAbsoluteUri(attempt));
		} catch (DecodeException referenceFailure) {
			throw TypeMismatchException.neither(inlineFailure, referenceFailure);
		}
	}

	@Override
	public void write(Object value, JsonGenerator gen) throws IOException {
		Remotable<?> remotable = (Remotable<?>) value;
		if (remotable instanceof Remotable.Inline<?> inline) {
			inner.write(inline.value(), gen);
		} else {
			gen.writeString(((Remotable.Remote<?>) remotable).id().toString());
		}
	}
}
