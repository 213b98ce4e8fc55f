package works.avocado.exceptions;

public class UnknownValueTypeException extends SchemaException {
	public UnknownValueTypeException(String typeName, String propertyName, String valueType) {
		super("Property " + typeName + "." + propertyName + " has unknown value type \"" + valueType + "\"");
	}
}
