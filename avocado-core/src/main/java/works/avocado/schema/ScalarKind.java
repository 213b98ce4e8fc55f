package works.avocado.schema;

import java.util.Optional;

/**
 * Value types that are not defined by the schema itself.
 */
public enum ScalarKind {
	STRING("String"),
	/**
	 * An absolute URI, represented as a {@link java.net.URI}.
	 */
	URI("Uri"),
	BOOLEAN("Boolean"),
	/**
	 * A 64-bit signed integer, represented as a {@link Long}.
	 */
	INTEGER("Integer"),
	NON_NEGATIVE_INTEGER("NonNegativeInteger"),
	/**
	 * Represented as a {@link Double}.
	 */
	FLOAT("Float"),
	/**
	 * @see works.avocado.xsd.XsdDateTime
	 */
	DATE_TIME("DateTime"),
	/**
	 * @see works.avocado.xsd.XsdDuration
	 */
	DURATION("Duration"),
	/**
	 * Any JSON value at all, kept verbatim as a {@link com.fasterxml.jackson.databind.JsonNode JsonNode}.
	 */
	JSON("Json");

	private final String schemaName;

	ScalarKind(String schemaName) {
		this.schemaName = schemaName;
	}

	public String schemaName() {
		return schemaName;
	}

	public static Optional<ScalarKind> fromSchemaName(String name) {
		for (ScalarKind kind: values()) {
			if (kind.schemaName.equals(name)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
