package works.avocado.schema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import lombok.Builder;
import lombok.Singular;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A property as declared by one type in the schema,
 * before inheritance and renaming are applied.
 * <p>
 * A null {@code tag} means the wire key is the property's own name.
 */
public sealed interface PropertyDef permits PropertyDef.Simple, PropertyDef.LangContainer {
	@Nullable String tag();
	ValueType valueType();
	Set<String> aliases();
	PropertyKind kind();
	String uri();
	String doc();

	@Builder(toBuilder = true)
	record Simple(
		@Nullable String tag,
		ValueType valueType,
		@Singular("alias") Set<String> aliases,
		PropertyKind kind,
		String uri,
		String doc
	) implements PropertyDef {
		public Simple {
			requireNonNull(valueType);
			aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
			kind = (kind == null) ? PropertyKind.NORMAL : kind;
			uri = (uri == null) ? "" : uri;
			doc = (doc == null) ? "" : doc;
		}

		public static Simple of(ValueType valueType, PropertyKind kind) {
			return builder().valueType(valueType).kind(kind).build();
		}
	}

	/**
	 * A property carried on the wire by two keys:
	 * {@code tag} for the language-neutral value,
	 * and {@code containerTag} for a map from language code to value.
	 */
	@Builder(toBuilder = true)
	record LangContainer(
		@Nullable String tag,
		ValueType valueType,
		String containerTag,
		@Singular("alias") Set<String> aliases,
		@Singular("containerAlias") Set<String> containerAliases,
		PropertyKind kind,
		String uri,
		String doc
	) implements PropertyDef {
		public LangContainer {
			requireNonNull(valueType);
			requireNonNull(containerTag);
			aliases = Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
			containerAliases = Collections.unmodifiableSet(new LinkedHashSet<>(containerAliases));
			kind = (kind == null) ? PropertyKind.NORMAL : kind;
			uri = (uri == null) ? "" : uri;
			doc = (doc == null) ? "" : doc;
		}

		public static LangContainer of(ValueType valueType, String containerTag, PropertyKind kind) {
			return builder().valueType(valueType).containerTag(containerTag).kind(kind).build();
		}
	}

	/**
	 * @return a copy of this with every value type passed through {@code transform}
	 */
	default PropertyDef withValueType(UnaryOperator<ValueType> transform) {
		if (this instanceof Simple s) {
			return s.toBuilder().valueType(transform.apply(s.valueType())).build();
		} else {
			LangContainer l = (LangContainer) this;
			return l.toBuilder().valueType(transform.apply(l.valueType())).build();
		}
	}
}
