package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import works.avocado.Or;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.TypeMismatchException;

import static works.avocado.jackson.JsonTokens.buffer;
import static works.avocado.jackson.JsonTokens.replay;

/**
 * Tries {@code left}, then {@code right}, each against its own replay of the value,
 * so a failed attempt leaves nothing behind for the next.
 */
record OrCodec(ValueCodec left, ValueCodec right) implements ValueCodec {
	@Override
	public Object read(JsonParser p) throws IOException {
		TokenBuffer value = buffer(p);
		DecodeException leftFailure;
		try (JsonParser attempt = replay(value)) {
			return Or.left(left.read(attempt));
		} catch (DecodeException e) {
			leftFailure = e;
		}
		try (JsonParser attempt = replay(value)) {
			return Or.right(right.read(attempt));
		} catch (DecodeException rightFailure) {
			throw TypeMismatchException.neither(leftFailure, rightFailure);
		}
	}

	@Override
	public void write(Object value, JsonGenerator gen) throws IOException {
		Or<?, ?> or = (Or<?, ?>) value;
		if (or instanceof Or.Left<?, ?> l) {
			left.write(l.value(), gen);
		} else {
			right.write(or.value(), gen);
		}
	}
}
