package works.avocado;

import java.net.URI;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A value that is either written out in full, or referred to by its identifier.
 */
public sealed interface Remotable<T> extends ObjectId permits Remotable.Inline, Remotable.Remote {
	record Inline<T>(T value) implements Remotable<T> {
		public Inline {
			requireNonNull(value);
		}

		@Override
		public Optional<URI> objectId() {
			return ObjectId.of(value);
		}
	}

	record Remote<T>(URI id) implements Remotable<T> {
		public Remote {
			requireNonNull(id);
		}

		@Override
		public Optional<URI> objectId() {
			return Optional.of(id);
		}
	}

	static <T> Remotable<T> inline(T value) {
		return new Inline<>(value);
	}

	static <T> Remotable<T> remote(URI id) {
		return new Remote<>(id);
	}

	default Optional<T> inlined() {
		return (this instanceof Inline<T> i) ? Optional.of(i.value()) : Optional.empty();
	}
}
