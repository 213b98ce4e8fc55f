/**
 * JSON bindings for vocabulary schemas, built on Jackson.
 * <p>
 * {@link works.avocado.jackson.SchemaLoader} reads a schema document,
 * and {@link works.avocado.jackson.BindingCompiler} compiles it once into
 * {@link works.avocado.jackson.Bindings}, which then decode and encode any number of documents.
 */
package works.avocado.jackson;
