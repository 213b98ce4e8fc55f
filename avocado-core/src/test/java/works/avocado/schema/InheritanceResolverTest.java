package works.avocado.schema;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import works.avocado.TestSchemas;
import works.avocado.exceptions.CyclicInheritanceException;
import works.avocado.exceptions.KindMismatchException;
import works.avocado.exceptions.SchemaException;
import works.avocado.exceptions.UnknownSupertypeException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.avocado.schema.PropertyKind.FUNCTIONAL;
import static works.avocado.schema.PropertyKind.NORMAL;
import static works.avocado.schema.PropertyKind.REQUIRED;
import static works.avocado.schema.ScalarKind.INTEGER;
import static works.avocado.schema.ScalarKind.STRING;
import static works.avocado.schema.ValueType.scalar;

class InheritanceResolverTest {

	@Test
	void inheritedPropertiesPrecedeOwnProperties() throws SchemaException {
		Map<String, ResolvedProperty> note = new InheritanceResolver(TestSchemas.activities()).resolve("Note");
		assertThat(note.keySet(), contains("id", "name", "summary", "attributedTo", "published", "content"));
	}

	@Test
	void tagDefaultsToPropertyName() throws SchemaException {
		ResolvedProperty name = new InheritanceResolver(TestSchemas.activities()).resolve("Object").get("name");
		assertEquals("name", name.tag());
		assertEquals("nameMap", name.containerTag());
		assertTrue(name.isLanguageContainer());
	}

	@Test
	void exceptPropertiesAreRemovedAndStayRemovedInSubtypes() throws SchemaException {
		InheritanceResolver resolver = new InheritanceResolver(TestSchemas.activities());
		assertTrue(resolver.resolve("Activity").containsKey("object"));
		assertFalse(resolver.resolve("IntransitiveActivity").containsKey("object"));
		assertFalse(resolver.resolve("Travel").containsKey("object"));
		assertTrue(resolver.resolve("Travel").containsKey("actor"));
	}

	@Test
	void ownPropertyReplacesInheritedOne() throws SchemaException {
		Schema schema = Schema.builder()
			.type("Base", TypeDef.builder()
				.property("count", PropertyDef.Simple.of(scalar(STRING), NORMAL))
				.build())
			.type("Derived", TypeDef.builder()
				.supertype("Base")
				.property("count", PropertyDef.Simple.of(scalar(INTEGER), REQUIRED))
				.build())
			.build();
		ResolvedProperty count = new InheritanceResolver(schema).resolve("Derived").get("count");
		assertEquals(REQUIRED, count.kind());
		assertEquals(scalar(INTEGER), count.valueType());
	}

	@Test
	void preferredLangContainerNameKeepsOldKeysAsAliases() throws SchemaException {
		ResolvedProperty name = new InheritanceResolver(TestSchemas.activities()).resolve("Person").get("name");
		assertEquals("displayName", name.tag());
		assertEquals("displayNameMap", name.containerTag());
		assertEquals(Set.of("name"), name.aliases());
		assertEquals(Set.of("nameMap"), name.containerAliases());
	}

	@Test
	void preferredSimpleNameKeepsExplicitTagAsAlias() throws SchemaException {
		Schema schema = Schema.builder()
			.type("Collection", TypeDef.builder()
				.property("items", PropertyDef.Simple.builder().tag("members").alias("elements").valueType(scalar(STRING)).build())
				.build())
			.type("OrderedCollection", TypeDef.builder()
				.supertype("Collection")
				.preferredName("items", new PreferredName.Simple("orderedItems"))
				.build())
			.build();
		InheritanceResolver resolver = new InheritanceResolver(schema);
		ResolvedProperty items = resolver.resolve("OrderedCollection").get("items");
		assertEquals("orderedItems", items.tag());
		assertThat(items.aliases(), containsInAnyOrder("members", "elements"));
		assertThat(items.defaultKeys().toList(), contains("orderedItems", "elements", "members"));

		assertEquals("members", resolver.resolve("Collection").get("items").tag());
	}

	@Test
	void preferredNameForAbsentPropertyIsIgnored() throws SchemaException {
		Schema schema = Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("label", PropertyDef.Simple.of(scalar(STRING), FUNCTIONAL))
				.preferredName("missing", new PreferredName.Simple("whatever"))
				.build())
			.build();
		Map<String, ResolvedProperty> thing = new InheritanceResolver(schema).resolve("Thing");
		assertThat(thing.keySet(), contains("label"));
		assertNull(thing.get("label").containerTag());
	}

	@Test
	void preferredNameShapeMustMatch() {
		Schema schema = Schema.builder()
			.type("Thing", TypeDef.builder()
				.property("label", PropertyDef.Simple.of(scalar(STRING), FUNCTIONAL))
				.preferredName("label", new PreferredName.LangContainer("title", "titleMap"))
				.build())
			.build();
		KindMismatchException e = assertThrows(KindMismatchException.class, () -> new InheritanceResolver(schema).resolve("Thing"));
		assertEquals("Thing", e.typeName());
		assertEquals("label", e.propertyName());
	}

	@Test
	void unknownSupertypeIsReported() {
		Schema schema = Schema.builder()
			.type("Orphan", TypeDef.builder().supertype("Nobody").build())
			.build();
		UnknownSupertypeException e = assertThrows(UnknownSupertypeException.class, () -> new InheritanceResolver(schema).resolve("Orphan"));
		assertThat(e.getMessage(), containsString("Nobody"));
	}

	@Test
	void cyclesAreReported() {
		Schema schema = Schema.builder()
			.type("A", TypeDef.builder().supertype("B").build())
			.type("B", TypeDef.builder().supertype("C").build())
			.type("C", TypeDef.builder().supertype("A").build())
			.build();
		CyclicInheritanceException e = assertThrows(CyclicInheritanceException.class, () -> new InheritanceResolver(schema).resolve("A"));
		assertEquals(List.of("A", "B", "C", "A"), e.cycle());
	}

	@Test
	void diamondInheritanceIncludesSharedAncestorOnce() throws SchemaException {
		Schema schema = Schema.builder()
			.type("Top", TypeDef.builder().property("id", PropertyDef.Simple.of(scalar(STRING), FUNCTIONAL)).build())
			.type("Left", TypeDef.builder().supertype("Top").property("left", PropertyDef.Simple.of(scalar(STRING), NORMAL)).build())
			.type("Right", TypeDef.builder().supertype("Top").property("right", PropertyDef.Simple.of(scalar(STRING), NORMAL)).build())
			.type("Bottom", TypeDef.builder().supertype("Left").supertype("Right").build())
			.build();
		assertThat(new InheritanceResolver(schema).resolve("Bottom").keySet(), contains("id", "left", "right"));
	}

	@Test
	void unknownTypeIsAnArgumentError() {
		assertThrows(IllegalArgumentException.class, () -> new InheritanceResolver(TestSchemas.activities()).resolve("Nothing"));
	}
}
