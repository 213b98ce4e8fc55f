package works.avocado;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The value of a JSON-LD {@code @context} member, reduced to its syntactic parts:
 * the context identifiers in order, and all inline term definitions merged into one map.
 * <p>
 * Inline definitions are merged last-write-wins, so the way they were grouped
 * into separate objects on the wire is not retained.
 */
public final class Context {
	private final List<URI> identifiers;
	private final Map<String, JsonNode> inline;

	private Context(List<URI> identifiers, Map<String, JsonNode> inline) {
		this.identifiers = identifiers;
		this.inline = inline;
	}

	public static Context of(List<URI> identifiers, Map<String, JsonNode> inline) {
		return new Context(List.copyOf(identifiers), Collections.unmodifiableMap(new LinkedHashMap<>(inline)));
	}

	public static Context of(URI... identifiers) {
		return of(List.of(identifiers), Map.of());
	}

	public static Context inline(Map<String, JsonNode> inline) {
		return of(List.of(), inline);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<URI> identifiers() {
		return identifiers;
	}

	public Map<String, JsonNode> inline() {
		return inline;
	}

	/**
	 * How this context is written on the wire.
	 */
	public enum Shape {
		/**
		 * A bare object holding the inline definitions.
		 */
		INLINE,
		/**
		 * A bare identifier string.
		 */
		SINGLE_IDENTIFIER,
		/**
		 * An array of identifier strings; also used when the context is entirely empty.
		 */
		IDENTIFIERS,
		/**
		 * An array of identifier strings followed by one object holding the inline definitions.
		 */
		MIXED,
	}

	public Shape shape() {
		if (inline.isEmpty()) {
			return (identifiers.size() == 1) ? Shape.SINGLE_IDENTIFIER : Shape.IDENTIFIERS;
		} else if (identifiers.isEmpty()) {
			return Shape.INLINE;
		} else {
			return Shape.MIXED;
		}
	}

	/**
	 * Accumulates the elements of a {@code @context} array in wire order.
	 */
	public static final class Builder {
		private final List<URI> identifiers = new ArrayList<>();
		private final Map<String, JsonNode> inline = new LinkedHashMap<>();

		private Builder() {}

		public Builder identifier(URI identifier) {
			identifiers.add(identifier);
			return this;
		}

		/**
		 * Adds term definitions, replacing any earlier definitions of the same terms.
		 */
		public Builder inline(Map<String, JsonNode> terms) {
			inline.putAll(terms);
			return this;
		}

		public Builder term(String term, JsonNode definition) {
			inline.put(term, definition);
			return this;
		}

		public Context build() {
			return Context.of(identifiers, inline);
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Context other
			&& identifiers.equals(other.identifiers)
			&& inline.equals(other.inline);
	}

	@Override
	public int hashCode() {
		return Objects.hash(identifiers, inline);
	}

	@Override
	public String toString() {
		return "Context(" + identifiers + ", " + inline + ")";
	}
}
