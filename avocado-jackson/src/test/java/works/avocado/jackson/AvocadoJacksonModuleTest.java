package works.avocado.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.avocado.Context;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.WithContext;
import works.avocado.xsd.XsdDateTime;
import works.avocado.xsd.XsdDuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AvocadoJacksonModuleTest extends AbstractVocabularyTest {
	ObjectMapper mapper;

	@BeforeEach
	void setupMapper() {
		mapper = new ObjectMapper().registerModule(BINDINGS.module());
	}

	@Test
	void typedObjectsInsideOrdinaryValues() throws Exception {
		VocabObject note = newObject("Note")
			.value("content", "hello")
			.value("published", XsdDateTime.parse("2015-01-25T12:34:56Z"))
			.build();
		Variant mention = SCHEMA.variant("Link", newObject("Mention").value("href", URI.create("https://ex.org/joe")).build());
		Map<String, Object> envelope = new LinkedHashMap<>();
		envelope.put("note", note);
		envelope.put("links", List.of(mention));

		assertEquals(
			json(q("{'note': {'content': 'hello', 'published': '2015-01-25T12:34:56Z'}, 'links': [{'type': 'Mention', 'href': 'https://ex.org/joe'}]}")),
			mapper.valueToTree(envelope));
	}

	@Test
	void documentsAgreeWithTheirBinding() throws Exception {
		WithContext<Variant> document = BINDINGS.variantsDocument("Object").decode(
			q("{'@context': ['https://www.w3.org/ns/activitystreams', {'ex': 'https://example.com/'}], 'type': 'Person', 'name': 'Alice'}"));
		assertEquals(
			BINDINGS.variantsDocument("Object").encodeToString(document),
			mapper.writeValueAsString(document));

		WithContext<VocabObject> exact = new WithContext<>(Context.of(URI.create("https://www.w3.org/ns/activitystreams")), newObject("Person").value("name", "Bob").build());
		assertEquals(
			q("{'@context':'https://www.w3.org/ns/activitystreams','name':'Bob'}"),
			mapper.writeValueAsString(exact));
	}

	@Test
	void scalarsAreReadable() throws Exception {
		assertEquals(new XsdDateTime.Naive(LocalDateTime.of(2015, 1, 25, 12, 34, 56)),
			mapper.readValue(q("'2015-01-25T12:34:56.0000'"), XsdDateTime.class));
		assertEquals(XsdDuration.of(0, 0, 1, 2, 0, 0),
			mapper.readValue(q("'P1DT2H'"), XsdDuration.class));
		assertEquals(q("'P1DT2H'"), mapper.writeValueAsString(XsdDuration.of(0, 0, 1, 2, 0, 0)));
	}

	@Test
	void contextsAreReadable() throws Exception {
		Context context = mapper.readValue(q("['https://www.w3.org/ns/activitystreams', {'ex': 'https://example.com/'}]"), Context.class);
		assertEquals(Context.Shape.MIXED, context.shape());
		assertEquals(q("{'@context':['https://www.w3.org/ns/activitystreams',{'ex':'https://example.com/'}]}"),
			mapper.writeValueAsString(Map.of("@context", context)));
	}

	@Test
	void malformedScalarsAreMismatchedInput() {
		assertThrows(MismatchedInputException.class, () -> mapper.readValue(q("'yesterday'"), XsdDateTime.class));
		assertThrows(MismatchedInputException.class, () -> mapper.readValue("42", XsdDateTime.class));
		assertThrows(MismatchedInputException.class, () -> mapper.readValue(q("'P1X'"), XsdDuration.class));
		assertThrows(MismatchedInputException.class, () -> mapper.readValue("42", Context.class));
	}
}
