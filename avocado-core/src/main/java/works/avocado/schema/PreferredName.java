package works.avocado.schema;

import static java.util.Objects.requireNonNull;

/**
 * A type's override of the canonical wire key(s) of one of its properties.
 * The shape must match the shape of the property being renamed.
 */
public sealed interface PreferredName permits PreferredName.Simple, PreferredName.LangContainer {
	record Simple(String tag) implements PreferredName {
		public Simple {
			requireNonNull(tag);
		}
	}

	record LangContainer(String defaultTag, String containerTag) implements PreferredName {
		public LangContainer {
			requireNonNull(defaultTag);
			requireNonNull(containerTag);
		}
	}
}
