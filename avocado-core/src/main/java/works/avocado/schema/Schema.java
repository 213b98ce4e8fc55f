package works.avocado.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;

/**
 * The declarative schema: type definitions by name, in document order.
 * Immutable once built.
 *
 * @see SchemaResolver
 */
@Builder
public record Schema(@Singular Map<String, TypeDef> types) {
	public Schema {
		types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
	}
}
