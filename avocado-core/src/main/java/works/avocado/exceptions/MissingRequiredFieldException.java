package works.avocado.exceptions;

public final class MissingRequiredFieldException extends DecodeException {
	private final String fieldName;

	public MissingRequiredFieldException(String fieldName) {
		super("Missing required field \"" + fieldName + "\"");
		this.fieldName = fieldName;
	}

	private MissingRequiredFieldException(String message, String fieldName, Throwable cause) {
		super(message, cause);
		this.fieldName = fieldName;
	}

	public String fieldName() {
		return fieldName;
	}

	@Override
	protected MissingRequiredFieldException withContext(String context) {
		return new MissingRequiredFieldException(prefixed(context, getMessage()), fieldName, this);
	}
}
