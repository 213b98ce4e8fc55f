package works.avocado;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A language-neutral value alongside values keyed by language code,
 * such as {@code "name"} and {@code "nameMap"}.
 * <p>
 * For a {@code Normal} property, {@code V} is a {@link Property}.
 */
public final class LangContainer<V> implements Mergeable<LangContainer<V>> {
	private static final LangContainer<?> EMPTY = new LangContainer<>(null, Map.of());

	@Nullable private final V defaultValue;
	private final Map<String, V> perLanguage;

	private LangContainer(@Nullable V defaultValue, Map<String, V> perLanguage) {
		this.defaultValue = defaultValue;
		this.perLanguage = perLanguage;
	}

	@SuppressWarnings("unchecked")
	public static <V> LangContainer<V> empty() {
		return (LangContainer<V>) EMPTY;
	}

	public static <V> LangContainer<V> of(@Nullable V defaultValue, Map<String, ? extends V> perLanguage) {
		return new LangContainer<>(defaultValue, Collections.unmodifiableMap(new LinkedHashMap<>(perLanguage)));
	}

	public static <V> LangContainer<V> ofDefault(V defaultValue) {
		return of(defaultValue, Map.of());
	}

	public static <V> LangContainer<V> ofLanguages(Map<String, ? extends V> perLanguage) {
		return of(null, perLanguage);
	}

	public Optional<V> defaultValue() {
		return Optional.ofNullable(defaultValue);
	}

	public Map<String, V> perLanguage() {
		return perLanguage;
	}

	public Optional<V> get(String language) {
		return Optional.ofNullable(perLanguage.get(language));
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public boolean isEmpty() {
		return defaultValue == null && perLanguage.isEmpty();
	}

	public LangContainer<V> withDefault(@Nullable V newDefault) {
		return new LangContainer<>(newDefault, perLanguage);
	}

	/**
	 * @return a container with the languages of this and {@code more},
	 * the values in {@code more} replacing those of the same language
	 */
	public LangContainer<V> withLanguages(Map<String, ? extends V> more) {
		if (more.isEmpty()) {
			return this;
		}
		Map<String, V> result = new LinkedHashMap<>(perLanguage);
		result.putAll(more);
		return new LangContainer<>(defaultValue, Collections.unmodifiableMap(result));
	}

	/**
	 * Later values replace earlier ones: the default if {@code later} has one,
	 * and each language that {@code later} has.
	 *
	 * @see #deepMerge
	 */
	@Override
	public LangContainer<V> merge(LangContainer<V> later) {
		V mergedDefault = (later.defaultValue == null) ? this.defaultValue : later.defaultValue;
		return new LangContainer<V>(mergedDefault, perLanguage).withLanguages(later.perLanguage);
	}

	/**
	 * Like {@link #merge}, except that where both containers have a value,
	 * the two are {@link Mergeable#merge merged} rather than replaced.
	 */
	public static <V extends Mergeable<V>> LangContainer<V> deepMerge(LangContainer<V> earlier, LangContainer<V> later) {
		V mergedDefault;
		if (earlier.defaultValue == null) {
			mergedDefault = later.defaultValue;
		} else if (later.defaultValue == null) {
			mergedDefault = earlier.defaultValue;
		} else {
			mergedDefault = earlier.defaultValue.merge(later.defaultValue);
		}
		Map<String, V> languages = new LinkedHashMap<>(earlier.perLanguage);
		later.perLanguage.forEach((lang, value) -> languages.merge(lang, value, Mergeable::merge));
		return new LangContainer<>(mergedDefault, Collections.unmodifiableMap(languages));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof LangContainer<?> other
			&& Objects.equals(defaultValue, other.defaultValue)
			&& perLanguage.equals(other.perLanguage);
	}

	@Override
	public int hashCode() {
		return Objects.hash(defaultValue, perLanguage);
	}

	@Override
	public String toString() {
		return "LangContainer(" + defaultValue + ", " + perLanguage + ")";
	}
}
