package works.avocado;

/**
 * A value that can absorb a later occurrence of itself,
 * as happens when a wire key, or an equivalent alias, is repeated.
 */
public interface Mergeable<T> {
	/**
	 * @return the combination of this value with {@code later}, which was encountered after it
	 */
	T merge(T later);
}
