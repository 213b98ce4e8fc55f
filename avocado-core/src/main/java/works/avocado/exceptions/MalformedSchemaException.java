package works.avocado.exceptions;

/**
 * The schema document is not shaped like a vocabulary schema.
 */
public class MalformedSchemaException extends SchemaException {
	public MalformedSchemaException(String message) {
		super(message);
	}

	public MalformedSchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
