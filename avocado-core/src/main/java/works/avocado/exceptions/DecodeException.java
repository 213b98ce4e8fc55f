package works.avocado.exceptions;

/**
 * A JSON value could not be decoded into the requested typed value.
 * <p>
 * Decoding is all-or-nothing: when one of these is thrown,
 * no partially decoded object is available.
 * <p>
 * Exceptions raised while decoding a nested member are {@link #wrap wrapped}
 * with the path of the member, so the message reads outermost-first,
 * while the class of the exception continues to describe the root cause.
 */
public sealed abstract class DecodeException extends RuntimeException permits
	DuplicateFieldException,
	MalformedJsonException,
	MalformedScalarException,
	MissingRequiredFieldException,
	TypeMismatchException,
	UnknownDiscriminantException
{
	protected DecodeException(String message) {
		super(message);
	}

	protected DecodeException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same class as this one, whose message
	 * is prefixed with {@code context}, and whose cause is this exception.
	 */
	protected abstract DecodeException withContext(String context);

	@SuppressWarnings("unchecked")
	public static <T extends DecodeException> T wrap(T exception, String context) {
		return (T) exception.withContext(context);
	}

	static String prefixed(String context, String message) {
		return context + ": " + message;
	}
}
