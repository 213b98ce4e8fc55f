package works.avocado.exceptions;

import java.util.List;

/**
 * The JSON value does not have the shape the binding expects.
 * <p>
 * When produced by an either-of or reference-or-inline resolution,
 * {@link #alternatives()} carries the messages of both failed attempts, in the order they were tried.
 */
public final class TypeMismatchException extends DecodeException {
	private final List<String> alternatives;

	public TypeMismatchException(String message) {
		super(message);
		this.alternatives = List.of(message);
	}

	private TypeMismatchException(String message, List<String> alternatives, Throwable cause) {
		super(message, cause);
		this.alternatives = alternatives;
	}

	public static TypeMismatchException expected(String expected, Object actual) {
		return new TypeMismatchException("Expected " + expected + "; found " + actual);
	}

	public static TypeMismatchException neither(DecodeException first, DecodeException second) {
		TypeMismatchException result = new TypeMismatchException(
			first.getMessage() + " and " + second.getMessage(),
			List.of(first.getMessage(), second.getMessage()),
			second);
		result.addSuppressed(first);
		return result;
	}

	public List<String> alternatives() {
		return alternatives;
	}

	@Override
	protected TypeMismatchException withContext(String context) {
		return new TypeMismatchException(prefixed(context, getMessage()), alternatives, this);
	}
}
