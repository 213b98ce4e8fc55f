/**
 * The schema model and its compilation into resolved types.
 * <p>
 * A {@link works.avocado.schema.Schema} is the declarative description of the vocabulary:
 * types, their supertypes, and their properties with cardinality and value types.
 * {@link works.avocado.schema.SchemaResolver} turns it into a
 * {@link works.avocado.schema.ResolvedSchema} in which every type carries its full set of
 * properties, inheritance and renaming already applied, and its closure of subtypes.
 * A resolved schema is immutable and can be shared freely.
 */
package works.avocado.schema;
