package works.avocado;

import works.avocado.exceptions.SchemaException;
import works.avocado.schema.PreferredName;
import works.avocado.schema.PropertyDef;
import works.avocado.schema.ResolvedSchema;
import works.avocado.schema.Schema;
import works.avocado.schema.SchemaResolver;
import works.avocado.schema.TypeDef;

import static works.avocado.schema.PropertyKind.FUNCTIONAL;
import static works.avocado.schema.PropertyKind.NORMAL;
import static works.avocado.schema.PropertyKind.REQUIRED;
import static works.avocado.schema.ScalarKind.DATE_TIME;
import static works.avocado.schema.ScalarKind.STRING;
import static works.avocado.schema.ScalarKind.URI;
import static works.avocado.schema.ValueType.object;
import static works.avocado.schema.ValueType.remotable;
import static works.avocado.schema.ValueType.scalar;

/**
 * A cut-down ActivityStreams vocabulary.
 */
public final class TestSchemas {
	private TestSchemas() {}

	public static final String AS = "https://www.w3.org/ns/activitystreams#";

	public static Schema activities() {
		return Schema.builder()
			.type("Object", TypeDef.builder()
				.uri(AS + "Object")
				.property("id", PropertyDef.Simple.builder().valueType(scalar(URI)).kind(FUNCTIONAL).alias("@id").build())
				.property("name", PropertyDef.LangContainer.of(scalar(STRING), "nameMap", NORMAL))
				.property("summary", PropertyDef.LangContainer.of(scalar(STRING), "summaryMap", FUNCTIONAL))
				.property("attributedTo", PropertyDef.Simple.of(remotable(object("ObjectSubtypes")), NORMAL))
				.property("published", PropertyDef.Simple.of(scalar(DATE_TIME), FUNCTIONAL))
				.build())
			.type("Link", TypeDef.builder()
				.uri(AS + "Link")
				.property("href", PropertyDef.Simple.of(scalar(URI), REQUIRED))
				.property("rel", PropertyDef.Simple.of(scalar(STRING), NORMAL))
				.build())
			.type("Activity", TypeDef.builder()
				.uri(AS + "Activity")
				.supertype("Object")
				.property("actor", PropertyDef.Simple.of(remotable(object("ObjectSubtypes")), NORMAL))
				.property("object", PropertyDef.Simple.of(remotable(object("ObjectSubtypes")), NORMAL))
				.build())
			.type("IntransitiveActivity", TypeDef.builder()
				.uri(AS + "IntransitiveActivity")
				.supertype("Activity")
				.exceptProperty("object")
				.build())
			.type("Travel", TypeDef.builder()
				.uri(AS + "Travel")
				.supertype("IntransitiveActivity")
				.build())
			.type("Note", TypeDef.builder()
				.uri(AS + "Note")
				.supertype("Object")
				.property("content", PropertyDef.LangContainer.of(scalar(STRING), "contentMap", NORMAL))
				.build())
			.type("Person", TypeDef.builder()
				.uri(AS + "Person")
				.supertype("Object")
				.preferredName("name", new PreferredName.LangContainer("displayName", "displayNameMap"))
				.build())
			.build();
	}

	public static ResolvedSchema resolvedActivities() {
		try {
			return SchemaResolver.resolve(activities());
		} catch (SchemaException e) {
			throw new AssertionError("Test schema should resolve", e);
		}
	}
}
