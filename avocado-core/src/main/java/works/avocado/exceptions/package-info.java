/**
 * Exceptions for the two phases of the binding lifecycle:
 * {@link works.avocado.exceptions.SchemaException} while a schema is compiled,
 * and {@link works.avocado.exceptions.DecodeException} while documents are decoded.
 */
package works.avocado.exceptions;
