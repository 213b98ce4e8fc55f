package works.avocado.exceptions;

/**
 * The input text is not valid JSON.
 */
public final class MalformedJsonException extends DecodeException {
	public MalformedJsonException(String message) {
		super(message);
	}

	public MalformedJsonException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	protected MalformedJsonException withContext(String context) {
		return new MalformedJsonException(prefixed(context, getMessage()), this);
	}
}
