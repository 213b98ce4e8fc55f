package works.avocado.schema;

import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.avocado.schema.ScalarKind.JSON;
import static works.avocado.schema.ScalarKind.NON_NEGATIVE_INTEGER;
import static works.avocado.schema.ScalarKind.STRING;
import static works.avocado.schema.ScalarKind.URI;
import static works.avocado.schema.ValueType.object;
import static works.avocado.schema.ValueType.or;
import static works.avocado.schema.ValueType.remotable;
import static works.avocado.schema.ValueType.scalar;
import static works.avocado.schema.ValueType.untypable;
import static works.avocado.schema.ValueType.variants;

class ValueTypeParserTest {

	@ParameterizedTest
	@MethodSource("expressions")
	void parse(String text, ValueType expected) {
		assertEquals(expected, ValueTypeParser.parse(text));
	}

	static Stream<Arguments> expressions() {
		return Stream.of(
			Arguments.of("String", scalar(STRING)),
			Arguments.of("NonNegativeInteger", scalar(NON_NEGATIVE_INTEGER)),
			Arguments.of("Link", object("Link")),
			Arguments.of("Variants<Object>", variants("Object")),
			Arguments.of("Remotable<ObjectSubtypes>", remotable(object("ObjectSubtypes"))),
			Arguments.of("Or<Uri, LinkSubtypes>", or(scalar(URI), object("LinkSubtypes"))),
			Arguments.of(" Or< Remotable<Object> ,Link > ", or(remotable(object("Object")), object("Link"))),
			Arguments.of("Untypable<String>", or(scalar(STRING), scalar(JSON))),
			Arguments.of("Untypable<String>", untypable(scalar(STRING)))
		);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"Or<String, Uri>",
		"Remotable<Variants<Object>>",
		"Or<Remotable<Link>, Untypable<Json>>",
	})
	void toStringRendersExpression(String text) {
		ValueType parsed = ValueTypeParser.parse(text);
		assertEquals(parsed, ValueTypeParser.parse(parsed.toString()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"",
		"Or<String>",
		"Or<String, Uri",
		"Remotable<>",
		"Frobnicate<String>",
		"Variants<Or<Link, Object>>",
		"String Uri",
		"Or<String, Uri>>",
	})
	void malformedExpressionsAreRejected(String text) {
		assertThrows(IllegalArgumentException.class, () -> ValueTypeParser.parse(text));
	}
}
