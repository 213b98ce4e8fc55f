package works.avocado.schema;

import static java.util.Objects.requireNonNull;

/**
 * The type of each individual value of a property,
 * irrespective of the property's {@link PropertyKind cardinality}.
 * <p>
 * Written in schema documents as a small type expression; see {@link ValueTypeParser}.
 * The {@link Object#toString() toString} of each node renders that expression.
 */
public sealed interface ValueType permits
	ValueType.Scalar,
	ValueType.ObjectRef,
	ValueType.VariantsRef,
	ValueType.OrType,
	ValueType.RemotableType
{
	record Scalar(ScalarKind kind) implements ValueType {
		public Scalar {
			requireNonNull(kind);
		}

		@Override
		public String toString() {
			return kind.schemaName();
		}
	}

	/**
	 * A value of exactly the named schema type.
	 */
	record ObjectRef(String typeName) implements ValueType {
		public ObjectRef {
			requireNonNull(typeName);
		}

		@Override
		public String toString() {
			return typeName;
		}
	}

	/**
	 * A value of the named schema type or any type that transitively extends it,
	 * selected by the {@code "type"} discriminant.
	 */
	record VariantsRef(String baseTypeName) implements ValueType {
		public VariantsRef {
			requireNonNull(baseTypeName);
		}

		@Override
		public String toString() {
			return "Variants<" + baseTypeName + ">";
		}
	}

	/**
	 * Either-of: decodes as {@code left} if possible, otherwise as {@code right}.
	 */
	record OrType(ValueType left, ValueType right) implements ValueType {
		public OrType {
			requireNonNull(left);
			requireNonNull(right);
		}

		@Override
		public String toString() {
			return "Or<" + left + ", " + right + ">";
		}
	}

	/**
	 * Either an inlined {@code inner} value or a bare URI referring to one.
	 */
	record RemotableType(ValueType inner) implements ValueType {
		public RemotableType {
			requireNonNull(inner);
		}

		@Override
		public String toString() {
			return "Remotable<" + inner + ">";
		}
	}

	static ValueType scalar(ScalarKind kind) {
		return new Scalar(kind);
	}

	static ValueType object(String typeName) {
		return new ObjectRef(typeName);
	}

	static ValueType variants(String baseTypeName) {
		return new VariantsRef(baseTypeName);
	}

	static ValueType or(ValueType left, ValueType right) {
		return new OrType(left, right);
	}

	static ValueType remotable(ValueType inner) {
		return new RemotableType(inner);
	}

	/**
	 * Either a {@code value} of the given type, or any JSON at all.
	 */
	static ValueType untypable(ValueType value) {
		return new OrType(value, new Scalar(ScalarKind.JSON));
	}
}
