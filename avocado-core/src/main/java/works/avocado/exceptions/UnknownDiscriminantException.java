package works.avocado.exceptions;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A subtype envelope could not determine which type to decode:
 * the {@code "type"} member was absent or named no known subtype,
 * and the object could not be decoded as the base type either.
 */
public final class UnknownDiscriminantException extends DecodeException {
	@Nullable private final String tag;
	private final Set<String> expected;

	public UnknownDiscriminantException(@Nullable String tag, Set<String> expected, Throwable cause) {
		super(message(tag, expected), cause);
		this.tag = tag;
		this.expected = Set.copyOf(expected);
	}

	private UnknownDiscriminantException(String message, @Nullable String tag, Set<String> expected, Throwable cause) {
		super(message, cause);
		this.tag = tag;
		this.expected = expected;
	}

	/**
	 * @return the discriminant found in the input, or null if there was none
	 */
	public @Nullable String tag() {
		return tag;
	}

	public Set<String> expected() {
		return expected;
	}

	@Override
	protected UnknownDiscriminantException withContext(String context) {
		return new UnknownDiscriminantException(prefixed(context, getMessage()), tag, expected, this);
	}

	private static String message(@Nullable String tag, Set<String> expected) {
		if (tag == null) {
			return "Missing \"type\"; expected one of " + expected;
		} else {
			return "Unknown \"type\" \"" + tag + "\"; expected one of " + expected;
		}
	}
}
