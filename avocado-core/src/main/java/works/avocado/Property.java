package works.avocado;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An ordered sequence of zero or more values: the shape of a {@code Normal} property.
 * <p>
 * On the wire, an empty property is omitted, a single value is written bare,
 * and two or more are written as an array.
 */
public final class Property<T> implements Iterable<T>, Mergeable<Property<T>> {
	private static final Property<?> EMPTY = new Property<>(List.of());

	private final List<T> values;

	private Property(List<T> values) {
		this.values = values;
	}

	@SuppressWarnings("unchecked")
	public static <T> Property<T> empty() {
		return (Property<T>) EMPTY;
	}

	@SafeVarargs
	public static <T> Property<T> of(T... values) {
		return new Property<>(List.of(values));
	}

	public static <T> Property<T> copyOf(Collection<? extends T> values) {
		return new Property<>(List.copyOf(values));
	}

	public List<T> values() {
		return values;
	}

	public int size() {
		return values.size();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public Optional<T> first() {
		return values.stream().findFirst();
	}

	public Property<T> plus(T value) {
		List<T> result = new ArrayList<>(values);
		result.add(value);
		return new Property<>(List.copyOf(result));
	}

	/**
	 * @return the values of this followed by the values of {@code later}
	 */
	@Override
	public Property<T> merge(Property<T> later) {
		if (later.isEmpty()) {
			return this;
		} else if (this.isEmpty()) {
			return later;
		}
		List<T> result = new ArrayList<>(values.size() + later.size());
		result.addAll(values);
		result.addAll(later.values);
		return new Property<>(List.copyOf(result));
	}

	@Override
	public Iterator<T> iterator() {
		return values.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Property<?> other && values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
