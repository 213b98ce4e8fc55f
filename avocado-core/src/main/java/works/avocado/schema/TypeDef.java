package works.avocado.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;

/**
 * One type of the schema as written, keyed in {@link Schema} by its name.
 * <p>
 * All collections iterate in document order,
 * which makes the resolved property order deterministic.
 */
@Builder(toBuilder = true)
public record TypeDef(
	String uri,
	@Singular("supertype") Set<String> supertypes,
	@Singular Map<String, PropertyDef> properties,
	@Singular("exceptProperty") Set<String> exceptProperties,
	@Singular("preferredName") Map<String, PreferredName> preferredNames,
	String doc
) {
	public TypeDef {
		uri = (uri == null) ? "" : uri;
		doc = (doc == null) ? "" : doc;
		supertypes = Collections.unmodifiableSet(new LinkedHashSet<>(supertypes));
		properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		exceptProperties = Collections.unmodifiableSet(new LinkedHashSet<>(exceptProperties));
		preferredNames = Collections.unmodifiableMap(new LinkedHashMap<>(preferredNames));
	}
}
