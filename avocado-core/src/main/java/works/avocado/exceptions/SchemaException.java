package works.avocado.exceptions;

/**
 * The vocabulary schema cannot be compiled into bindings.
 * <p>
 * Thrown once, while the schema is being resolved or bindings are being generated,
 * and never while documents are being decoded or encoded.
 */
public abstract class SchemaException extends Exception {
	protected SchemaException(String message) {
		super(message);
	}

	protected SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
