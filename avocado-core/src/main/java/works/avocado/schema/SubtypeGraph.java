package works.avocado.schema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The reverse of the {@code extends} relation.
 */
public final class SubtypeGraph {
	private final Map<String, List<String>> directSubtypes = new LinkedHashMap<>();

	public SubtypeGraph(Schema schema) {
		schema.types().forEach((name, def) -> {
			for (String supertype: def.supertypes()) {
				directSubtypes.computeIfAbsent(supertype, k -> new ArrayList<>()).add(name);
			}
		});
	}

	/**
	 * @return {@code baseType} followed by every type that transitively extends it,
	 * breadth-first, each exactly once
	 */
	public List<String> subtypes(String baseType) {
		Set<String> result = new LinkedHashSet<>();
		Deque<String> queue = new ArrayDeque<>();
		result.add(baseType);
		queue.add(baseType);
		while (!queue.isEmpty()) {
			for (String sub: directSubtypes.getOrDefault(queue.remove(), List.of())) {
				if (result.add(sub)) {
					queue.add(sub);
				}
			}
		}
		return List.copyOf(result);
	}
}
