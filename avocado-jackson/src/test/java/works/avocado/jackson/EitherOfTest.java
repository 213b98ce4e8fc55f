package works.avocado.jackson;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.net.URI;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.avocado.Or;
import works.avocado.Property;
import works.avocado.Remotable;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.exceptions.SchemaException;
import works.avocado.exceptions.TypeMismatchException;
import works.avocado.schema.PropertyDef;
import works.avocado.schema.ScalarKind;
import works.avocado.schema.Schema;
import works.avocado.schema.TypeDef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.avocado.schema.PropertyKind.FUNCTIONAL;
import static works.avocado.schema.ScalarKind.INTEGER;
import static works.avocado.schema.ScalarKind.STRING;
import static works.avocado.schema.ValueType.or;
import static works.avocado.schema.ValueType.scalar;
import static works.avocado.schema.ValueType.untypable;

/**
 * {@code Or}, {@code Untypable} and {@code Remotable} values.
 */
class EitherOfTest extends AbstractVocabularyTest {
	static final URI EXAMPLE = URI.create("https://ex.org/1");

	@Test
	void orPrefersLeft() throws SchemaException {
		Bindings bindings = new BindingCompiler().compile(Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("value", PropertyDef.Simple.of(or(scalar(ScalarKind.URI), scalar(STRING)), FUNCTIONAL))
				.build())
			.build());
		VocabObject both = bindings.type("Thing").decode(q("{'value': 'https://ex.org/1'}"));
		assertEquals(Optional.of(Or.left(EXAMPLE)), both.functional("value"));

		VocabObject rightOnly = bindings.type("Thing").decode(q("{'value': 'not a uri'}"));
		assertEquals(Optional.of(Or.right("not a uri")), rightOnly.functional("value"));
	}

	@Test
	void orWithSchemaType() {
		VocabObject decoded = BINDINGS.type("Note").decode(q("{'url': ['https://ex.org/1', {'type': 'Link', 'href': 'https://ex.org/2'}]}"));
		Property<Or<URI, Variant>> url = decoded.normal("url");
		assertEquals(Or.left(EXAMPLE), url.values().get(0));
		Variant link = url.values().get(1).right().orElseThrow();
		assertEquals("Link", link.caseName());
		assertEquals(URI.create("https://ex.org/2"), link.value().required("href"));
	}

	@Test
	void orFailureCarriesBothMessages() {
		TypeMismatchException e = assertThrows(TypeMismatchException.class,
			() -> BINDINGS.type("Note").decode(q("{'url': 42}")));
		assertEquals(2, e.alternatives().size());
		assertThat(e.alternatives().get(0), containsString("absolute URI"));
		assertThat(e.alternatives().get(1), containsString("Link"));
		assertThat(e.getMessage(), containsString("Note.url: "));
	}

	@Test
	void untypableKeepsAnythingAsJson() throws SchemaException {
		Bindings bindings = new BindingCompiler().compile(Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("count", PropertyDef.Simple.of(untypable(scalar(INTEGER)), FUNCTIONAL))
				.build())
			.build());
		ObjectBinding<VocabObject> thing = bindings.type("Thing");
		assertEquals(Optional.of(Or.left(5L)), thing.decode(q("{'count': 5}")).functional("count"));
		assertEquals(Optional.of(Or.right(TextNode.valueOf("five"))), thing.decode(q("{'count': 'five'}")).functional("count"));
	}

	@Test
	void untypableRoundTrip() throws Exception {
		ObjectBinding<VocabObject> term = BINDINGS.type("Term");
		String text = q("{'label': 'x', 'definition': {'see': ['a', 1, null]}}");
		VocabObject decoded = term.decode(text);
		assertInstanceOf(Or.Right.class, decoded.<Or<String, ?>>functional("definition").orElseThrow());
		assertEquals(json(text), term.encode(decoded));
	}

	@Test
	void bareIdentifierIsRemote() {
		VocabObject decoded = BINDINGS.type("Note").decode(q("{'attributedTo': 'https://ex.org/1'}"));
		Remotable<Variant> author = decoded.<Remotable<Variant>>normal("attributedTo").first().orElseThrow();
		assertEquals(Remotable.remote(EXAMPLE), author);
		assertEquals(Optional.of(EXAMPLE), author.objectId());
	}

	@Test
	void objectIsInline() {
		VocabObject decoded = BINDINGS.type("Note").decode(q("{'attributedTo': {'type': 'Person', 'id': 'https://ex.org/1', 'name': 'Alice'}}"));
		Remotable<Variant> author = decoded.<Remotable<Variant>>normal("attributedTo").first().orElseThrow();
		assertEquals("Person", author.inlined().orElseThrow().caseName());
		assertEquals(Optional.of(EXAMPLE), author.objectId());
	}

	@Test
	void inlineTakesPrecedenceOverReference() {
		ObjectBinding<VocabObject> term = BINDINGS.type("Term");
		VocabObject decoded = term.decode(q("{'label': 'a', 'seeAlso': ['https://ex.org/1', {'label': 'b'}]}"));
		Property<Remotable<VocabObject>> seeAlso = decoded.normal("seeAlso");
		assertEquals(Remotable.remote(EXAMPLE), seeAlso.values().get(0));
		assertEquals("Term", seeAlso.values().get(1).inlined().orElseThrow().typeName());
	}

	@Test
	void neitherInlineNorReference() {
		TypeMismatchException e = assertThrows(TypeMismatchException.class,
			() -> BINDINGS.type("Note").decode(q("{'attributedTo': 'relative/path'}")));
		assertThat(e.alternatives().get(1), containsString("absolute URI"));
	}

	@Test
	void integersKeepTheirJsonNumberType() throws Exception {
		VocabObject link = newObject("Link")
			.value("href", EXAMPLE)
			.value("height", 480L)
			.build();
		assertEquals(IntNode.valueOf(480), BINDINGS.type("Link").encode(link).get("height"));
	}
}
