package works.avocado;

import java.net.URI;
import java.util.Optional;

/**
 * A value that may identify the object it represents or refers to.
 */
public interface ObjectId {
	Optional<URI> objectId();

	/**
	 * The identifier carried by an arbitrary typed value, looking through
	 * optionals, properties and any {@link ObjectId}.
	 */
	static Optional<URI> of(Object value) {
		if (value instanceof URI uri) {
			return Optional.of(uri);
		} else if (value instanceof ObjectId id) {
			return id.objectId();
		} else if (value instanceof Optional<?> opt) {
			return opt.flatMap(ObjectId::of);
		} else if (value instanceof Property<?> property) {
			return property.first().flatMap(ObjectId::of);
		} else {
			return Optional.empty();
		}
	}
}
