package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import java.io.IOException;
import works.avocado.Context;
import works.avocado.WithContext;
import works.avocado.exceptions.DecodeException;
import works.avocado.exceptions.DuplicateFieldException;

import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static works.avocado.jackson.JsonTokens.buffer;
import static works.avocado.jackson.JsonTokens.expect;
import static works.avocado.jackson.JsonTokens.replay;

/**
 * A top-level document: the body's members with an optional {@code @context} alongside them.
 * The body reads the same object and ignores the {@code @context} member.
 */
final class WithContextBinding<T> extends ObjectBinding<WithContext<T>> {
	static final String CONTEXT_KEY = "@context";

	private final ContextBinding contextBinding;
	private final ObjectBinding<T> body;

	WithContextBinding(ObjectMapper mapper, ContextBinding contextBinding, ObjectBinding<T> body) {
		super(mapper);
		this.contextBinding = contextBinding;
		this.body = body;
	}

	@Override
	public String name() {
		return "WithContext<" + body.name() + ">";
	}

	@Override
	WithContext<T> read(JsonParser p) throws IOException {
		expect(START_OBJECT, "document object", p);
		TokenBuffer document = buffer(p);
		Context context = null;
		try (JsonParser scan = replay(document)) {
			while (scan.nextToken() != END_OBJECT) {
				String key = scan.currentName();
				scan.nextToken();
				if (CONTEXT_KEY.equals(key)) {
					if (context != null) {
						throw new DuplicateFieldException(CONTEXT_KEY);
					}
					try {
						context = contextBinding.read(scan);
					} catch (DecodeException e) {
						throw DecodeException.wrap(e, CONTEXT_KEY);
					}
				} else {
					scan.skipChildren();
				}
			}
		}
		try (JsonParser bodyParser = replay(document)) {
			return new WithContext<>(context, body.read(bodyParser));
		}
	}

	@Override
	void writeMembers(WithContext<T> value, JsonGenerator gen) throws IOException {
		if (value.context() != null) {
			gen.writeFieldName(CONTEXT_KEY);
			contextBinding.write(value.context(), gen);
		}
		body.writeMembers(value.body(), gen);
	}
}
