package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import works.avocado.VocabObject;
import works.avocado.exceptions.SchemaException;
import works.avocado.schema.ResolvedSchema;

/**
 * Compiles {@code test-vocabulary.yml} once for all tests.
 */
abstract class AbstractVocabularyTest {
	static final ObjectMapper MAPPER = new ObjectMapper();
	static final Bindings BINDINGS = compile(BindingSettings.DEFAULT);
	static final ResolvedSchema SCHEMA = BINDINGS.schema();

	static Bindings compile(BindingSettings settings) {
		try (InputStream in = AbstractVocabularyTest.class.getResourceAsStream("test-vocabulary.yml")) {
			return new BindingCompiler(settings, MAPPER).compile(new SchemaLoader().load(in));
		} catch (IOException | SchemaException e) {
			throw new AssertionError("Test vocabulary should compile", e);
		}
	}

	static VocabObject.Builder newObject(String typeName) {
		return SCHEMA.type(typeName).newObject();
	}

	static JsonNode json(String text) throws JsonProcessingException {
		return MAPPER.readTree(text);
	}

	/**
	 * Lets tests write JSON with single quotes.
	 */
	static String q(String text) {
		return text.replace('\'', '"');
	}
}
