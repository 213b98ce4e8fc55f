package works.avocado.schema;

import java.util.Set;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * A property of a type after inheritance, exclusion and renaming:
 * everything a binding needs to know about one slot of a typed value.
 *
 * @param name the property's identifier within its type, independent of any wire key
 * @param tag the canonical wire key of the language-neutral value
 * @param containerTag the canonical wire key of the per-language map,
 *                     or null if this is not a language container
 */
public record ResolvedProperty(
	String name,
	PropertyKind kind,
	ValueType valueType,
	String tag,
	Set<String> aliases,
	@Nullable String containerTag,
	Set<String> containerAliases,
	String uri,
	String doc
) {
	static ResolvedProperty from(String name, PropertyDef def) {
		String tag = (def.tag() == null) ? name : def.tag();
		if (def instanceof PropertyDef.LangContainer l) {
			return new ResolvedProperty(name, l.kind(), l.valueType(), tag, l.aliases(),
				l.containerTag(), l.containerAliases(), l.uri(), l.doc());
		} else {
			return new ResolvedProperty(name, def.kind(), def.valueType(), tag, def.aliases(),
				null, Set.of(), def.uri(), def.doc());
		}
	}

	ResolvedProperty withValueType(ValueType newValueType) {
		return new ResolvedProperty(name, kind, newValueType, tag, aliases, containerTag, containerAliases, uri, doc);
	}

	public boolean isLanguageContainer() {
		return containerTag != null;
	}

	/**
	 * @return the canonical tag followed by the aliases
	 */
	public Stream<String> defaultKeys() {
		return Stream.concat(Stream.of(tag), aliases.stream()).distinct();
	}

	/**
	 * @return the canonical container tag followed by the container aliases;
	 * empty if this is not a language container
	 */
	public Stream<String> containerKeys() {
		if (containerTag == null) {
			return Stream.empty();
		}
		return Stream.concat(Stream.of(containerTag), containerAliases.stream()).distinct();
	}
}
