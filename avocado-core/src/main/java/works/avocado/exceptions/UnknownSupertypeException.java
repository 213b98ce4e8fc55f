package works.avocado.exceptions;

public class UnknownSupertypeException extends SchemaException {
	private final String typeName;
	private final String supertypeName;

	public UnknownSupertypeException(String typeName, String supertypeName) {
		super("Type " + typeName + " extends undefined type " + supertypeName);
		this.typeName = typeName;
		this.supertypeName = supertypeName;
	}

	public String typeName() {
		return typeName;
	}

	public String supertypeName() {
		return supertypeName;
	}
}
