package works.avocado.exceptions;

/**
 * A string does not conform to the grammar of an XSD scalar such as a date-time or duration.
 */
public final class MalformedScalarException extends DecodeException {
	public MalformedScalarException(String message) {
		super(message);
	}

	public MalformedScalarException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	protected MalformedScalarException withContext(String context) {
		return new MalformedScalarException(prefixed(context, getMessage()), this);
	}
}
