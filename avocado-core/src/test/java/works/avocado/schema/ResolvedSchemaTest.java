package works.avocado.schema;

import java.net.URI;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import works.avocado.LangContainer;
import works.avocado.Or;
import works.avocado.Property;
import works.avocado.Remotable;
import works.avocado.TestSchemas;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.exceptions.SchemaException;
import works.avocado.exceptions.UnknownValueTypeException;
import works.avocado.xsd.XsdDuration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.avocado.schema.PropertyKind.FUNCTIONAL;
import static works.avocado.schema.PropertyKind.NORMAL;
import static works.avocado.schema.PropertyKind.REQUIRED;
import static works.avocado.schema.ScalarKind.BOOLEAN;
import static works.avocado.schema.ScalarKind.DURATION;
import static works.avocado.schema.ScalarKind.STRING;
import static works.avocado.schema.ValueType.object;
import static works.avocado.schema.ValueType.or;
import static works.avocado.schema.ValueType.remotable;
import static works.avocado.schema.ValueType.scalar;
import static works.avocado.schema.ValueType.variants;

class ResolvedSchemaTest {
	final ResolvedSchema schema = TestSchemas.resolvedActivities();

	@Test
	void subtypesSuffixBecomesVariants() {
		assertEquals(remotable(variants("Object")), schema.type("Activity").property("actor").valueType());
	}

	@Test
	void unknownValueTypeIsReported() {
		Schema bad = Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("other", PropertyDef.Simple.of(or(scalar(STRING), object("Nowhere")), NORMAL))
				.build())
			.build();
		UnknownValueTypeException e = assertThrows(UnknownValueTypeException.class, () -> SchemaResolver.resolve(bad));
		assertThat(e.getMessage(), containsString("Nowhere"));
	}

	@Test
	void subtypeSuffixOfUnknownTypeIsReported() {
		Schema bad = Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("other", PropertyDef.Simple.of(object("GhostSubtypes"), NORMAL))
				.build())
			.build();
		assertThrows(UnknownValueTypeException.class, () -> SchemaResolver.resolve(bad));
	}

	@Test
	void isSubtype() {
		assertTrue(schema.isSubtype("Travel", "Object"));
		assertTrue(schema.isSubtype("Object", "Object"));
		assertFalse(schema.isSubtype("Object", "Activity"));
		assertFalse(schema.isSubtype("Link", "Object"));
	}

	@Test
	void variantRequiresSubtype() {
		VocabObject link = schema.type("Link").newObject().value("href", URI.create("https://example.com/")).build();
		assertThrows(IllegalArgumentException.class, () -> schema.variant("Object", link));
		Variant variant = schema.variant("Link", link);
		assertEquals("Link", variant.caseName());
	}

	@Test
	void upcastKeepsCommonProperties() {
		VocabObject note = schema.type("Note").newObject()
			.value("id", URI.create("https://example.com/note/1"))
			.value("name", "A note")
			.language("name", "fr", "Une note")
			.value("content", "Hello")
			.build();

		VocabObject upcast = schema.upcast(schema.variant("Object", note));

		assertEquals("Object", upcast.typeName());
		assertEquals(Optional.of(URI.create("https://example.com/note/1")), upcast.functional("id"));
		assertEquals(note.get("name"), upcast.get("name"));
		assertFalse(upcast.values().containsKey("content"));
	}

	@Test
	void upcastToNonAncestorFails() {
		VocabObject note = schema.type("Note").newObject().build();
		assertThrows(IllegalArgumentException.class, () -> schema.upcast(note, "Activity"));
		assertThrows(IllegalArgumentException.class, () -> schema.upcast(note, "Link"));
	}

	@Test
	void upcastDefaultsRequiredPropertyOfDifferentShape() throws SchemaException {
		Schema relaxed = Schema.builder()
			.type("Link", TypeDef.builder()
				.property("href", PropertyDef.Simple.of(scalar(ScalarKind.URI), REQUIRED))
				.build())
			.type("LooseLink", TypeDef.builder()
				.supertype("Link")
				.property("href", PropertyDef.Simple.of(scalar(ScalarKind.URI), FUNCTIONAL))
				.build())
			.build();
		ResolvedSchema resolved = SchemaResolver.resolve(relaxed);
		VocabObject loose = resolved.type("LooseLink").newObject()
			.value("href", URI.create("https://example.com/"))
			.build();

		VocabObject link = resolved.upcast(loose, "Link");

		assertEquals(URI.create(""), link.required("href"));
	}

	@Test
	void defaultValues() {
		assertEquals("", schema.defaultValue(scalar(STRING)));
		assertEquals(false, schema.defaultValue(scalar(BOOLEAN)));
		assertEquals(XsdDuration.ZERO, schema.defaultValue(scalar(DURATION)));
		assertEquals(Or.left(""), schema.defaultValue(or(scalar(STRING), scalar(ScalarKind.URI))));
		assertEquals(Remotable.inline(URI.create("")), schema.defaultValue(remotable(scalar(ScalarKind.URI))));

		Object link = schema.defaultValue(object("Link"));
		assertEquals(schema.type("Link").newObject().value("href", URI.create("")).build(), link);
		assertEquals(Property.empty(), ((VocabObject) link).normal("rel"));
	}

	@Test
	void requiredLanguageContainerDefaultsToDefaultValue() throws SchemaException {
		ResolvedSchema resolved = SchemaResolver.resolve(Schema.builder()
			.type("Term", TypeDef.builder()
				.property("label", PropertyDef.LangContainer.of(scalar(STRING), "labelMap", REQUIRED))
				.build())
			.build());
		assertEquals(LangContainer.ofDefault(""), resolved.defaultObject("Term").langContainer("label"));
	}

	@Test
	void selfRequiringTypeHasNoDefault() throws SchemaException {
		ResolvedSchema resolved = SchemaResolver.resolve(Schema.builder()
			.type("Loop", TypeDef.builder()
				.property("next", PropertyDef.Simple.of(object("Loop"), REQUIRED))
				.build())
			.build());
		assertThrows(IllegalStateException.class, () -> resolved.defaultObject("Loop"));
	}

	@Test
	void propertyWithTag() {
		ResolvedType person = schema.type("Person");
		assertEquals("name", person.propertyWithTag("displayName").orElseThrow().name());
		assertTrue(person.propertyWithTag("name").isEmpty());
		assertThrows(IllegalArgumentException.class, () -> person.property("displayName"));
	}
}
