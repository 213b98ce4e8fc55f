package works.avocado;

import java.net.URI;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Either-of: a value of type {@code L}, or failing that, of type {@code R}.
 * When a value could be either, it is always an {@link Left}.
 */
public sealed interface Or<L, R> extends ObjectId permits Or.Left, Or.Right {
	record Left<L, R>(L value) implements Or<L, R> {
		public Left {
			requireNonNull(value);
		}
	}

	record Right<L, R>(R value) implements Or<L, R> {
		public Right {
			requireNonNull(value);
		}
	}

	static <L, R> Or<L, R> left(L value) {
		return new Left<>(value);
	}

	static <L, R> Or<L, R> right(R value) {
		return new Right<>(value);
	}

	Object value();

	default Optional<L> left() {
		return (this instanceof Left<L, R> l) ? Optional.of(l.value()) : Optional.empty();
	}

	default Optional<R> right() {
		return (this instanceof Right<L, R> r) ? Optional.of(r.value()) : Optional.empty();
	}

	default <T> T fold(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight) {
		if (this instanceof Left<L, R> l) {
			return ifLeft.apply(l.value());
		} else {
			return ifRight.apply(((Right<L, R>) this).value());
		}
	}

	@Override
	default Optional<URI> objectId() {
		return ObjectId.of(value());
	}
}
