package works.avocado.exceptions;

/**
 * A preferred property name override does not have the same shape
 * (simple or language container) as the property it renames.
 */
public class KindMismatchException extends SchemaException {
	private final String typeName;
	private final String propertyName;

	public KindMismatchException(String typeName, String propertyName, String message) {
		super("Preferred name for " + typeName + "." + propertyName + ": " + message);
		this.typeName = typeName;
		this.propertyName = propertyName;
	}

	public String typeName() {
		return typeName;
	}

	public String propertyName() {
		return propertyName;
	}
}
