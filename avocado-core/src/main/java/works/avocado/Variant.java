package works.avocado;

import java.net.URI;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One case of the subtype envelope of {@code baseTypeName}:
 * a value whose type is the base type or one of its descendants.
 *
 * @see works.avocado.schema.ResolvedSchema#variant
 */
public record Variant(String baseTypeName, VocabObject value) implements ObjectId {
	public Variant {
		requireNonNull(baseTypeName);
		requireNonNull(value);
	}

	/**
	 * @return the name of the concrete type of {@link #value()}
	 */
	public String caseName() {
		return value.typeName();
	}

	@Override
	public Optional<URI> objectId() {
		return value.objectId();
	}
}
