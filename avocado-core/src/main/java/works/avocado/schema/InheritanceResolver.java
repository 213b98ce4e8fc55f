package works.avocado.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.avocado.exceptions.CyclicInheritanceException;
import works.avocado.exceptions.KindMismatchException;
import works.avocado.exceptions.SchemaException;
import works.avocado.exceptions.UnknownSupertypeException;

/**
 * Computes the effective properties of each type of a {@link Schema}.
 * <p>
 * The properties of a type are those of its supertypes, visited in declaration order
 * and each resolved the same way, followed by its own properties, which replace
 * any inherited property of the same name. The type's {@link TypeDef#exceptProperties()}
 * are then removed, and its {@link TypeDef#preferredNames()} applied:
 * the preferred key becomes canonical and the previous key becomes an alias.
 * <p>
 * Results are memoized, so each type is resolved once however many descendants it has.
 */
public final class InheritanceResolver {
	private final Schema schema;
	private final Map<String, Map<String, PropertyDef>> resolved = new HashMap<>();
	private final Set<String> inProgress = new LinkedHashSet<>();

	public InheritanceResolver(Schema schema) {
		this.schema = schema;
	}

	/**
	 * @return the effective properties of {@code typeName}, in a deterministic order
	 * @throws IllegalArgumentException if the schema has no such type
	 */
	public Map<String, ResolvedProperty> resolve(String typeName) throws SchemaException {
		if (!schema.types().containsKey(typeName)) {
			throw new IllegalArgumentException("No such type: " + typeName);
		}
		Map<String, ResolvedProperty> result = new LinkedHashMap<>();
		collect(typeName).forEach((name, def) -> result.put(name, ResolvedProperty.from(name, def)));
		return result;
	}

	private Map<String, PropertyDef> collect(String typeName) throws SchemaException {
		Map<String, PropertyDef> memo = resolved.get(typeName);
		if (memo != null) {
			return memo;
		}
		if (!inProgress.add(typeName)) {
			List<String> cycle = new ArrayList<>();
			boolean inCycle = false;
			for (String t: inProgress) {
				inCycle |= t.equals(typeName);
				if (inCycle) {
					cycle.add(t);
				}
			}
			cycle.add(typeName);
			throw new CyclicInheritanceException(cycle);
		}
		try {
			TypeDef def = schema.types().get(typeName);
			Map<String, PropertyDef> result = new LinkedHashMap<>();
			for (String supertype: def.supertypes()) {
				if (!schema.types().containsKey(supertype)) {
					throw new UnknownSupertypeException(typeName, supertype);
				}
				result.putAll(collect(supertype));
			}
			result.putAll(def.properties());
			result.keySet().removeAll(def.exceptProperties());
			for (Map.Entry<String, PropertyDef> entry: result.entrySet()) {
				PreferredName preferred = def.preferredNames().get(entry.getKey());
				if (preferred != null) {
					entry.setValue(rename(typeName, entry.getKey(), entry.getValue(), preferred));
				}
			}
			resolved.put(typeName, result);
			return result;
		} finally {
			inProgress.remove(typeName);
		}
	}

	private static PropertyDef rename(String typeName, String propertyName, PropertyDef def, PreferredName preferred) throws KindMismatchException {
		String previousTag = (def.tag() == null) ? propertyName : def.tag();
		if (def instanceof PropertyDef.Simple simple) {
			if (preferred instanceof PreferredName.Simple p) {
				return simple.toBuilder()
					.tag(p.tag())
					.alias(previousTag)
					.build();
			}
			throw new KindMismatchException(typeName, propertyName, "language container name given for a simple property");
		} else {
			PropertyDef.LangContainer container = (PropertyDef.LangContainer) def;
			if (preferred instanceof PreferredName.LangContainer p) {
				return container.toBuilder()
					.tag(p.defaultTag())
					.alias(previousTag)
					.containerTag(p.containerTag())
					.containerAlias(container.containerTag())
					.build();
			}
			throw new KindMismatchException(typeName, propertyName, "simple name given for a language container property");
		}
	}
}
