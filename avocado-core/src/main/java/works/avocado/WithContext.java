package works.avocado;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A top-level document: an optional {@code @context} and the members of
 * {@code body}, written side by side in the same JSON object.
 *
 * @param <T> {@link VocabObject} or {@link Variant}
 */
public record WithContext<T>(@Nullable Context context, T body) {
	public WithContext {
		requireNonNull(body);
	}

	public static <T> WithContext<T> of(T body) {
		return new WithContext<>(null, body);
	}

	public Optional<Context> optionalContext() {
		return Optional.ofNullable(context);
	}
}
