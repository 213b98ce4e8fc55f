package works.avocado.exceptions;

/**
 * A required or functional property appeared more than once in the same object,
 * either under the same key or under two of its aliases.
 */
public final class DuplicateFieldException extends DecodeException {
	private final String fieldName;

	public DuplicateFieldException(String fieldName) {
		super("Duplicate field \"" + fieldName + "\"");
		this.fieldName = fieldName;
	}

	private DuplicateFieldException(String message, String fieldName, Throwable cause) {
		super(message, cause);
		this.fieldName = fieldName;
	}

	public String fieldName() {
		return fieldName;
	}

	@Override
	protected DuplicateFieldException withContext(String context) {
		return new DuplicateFieldException(prefixed(context, getMessage()), fieldName, this);
	}
}
