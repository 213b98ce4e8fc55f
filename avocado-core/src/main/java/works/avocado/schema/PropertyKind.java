package works.avocado.schema;

/**
 * The cardinality of a property.
 */
public enum PropertyKind {
	/**
	 * Exactly one value. Absence is a decode error, and a second occurrence is a duplicate.
	 */
	REQUIRED("Required"),

	/**
	 * Zero or one value. A second occurrence is a duplicate.
	 */
	FUNCTIONAL("Functional"),

	/**
	 * Zero or more values, in order.
	 * Further occurrences are merged into the earlier ones.
	 */
	NORMAL("Normal");

	private final String schemaName;

	PropertyKind(String schemaName) {
		this.schemaName = schemaName;
	}

	/**
	 * @return the spelling used in schema documents
	 */
	public String schemaName() {
		return schemaName;
	}

	/**
	 * @throws IllegalArgumentException if {@code name} is not the schema name of any kind
	 */
	public static PropertyKind fromSchemaName(String name) {
		for (PropertyKind kind: values()) {
			if (kind.schemaName.equals(name)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown property kind \"" + name + "\"");
	}
}
