package works.avocado.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the type expressions used for property value types in schema documents.
 *
 * <pre>
 *     type  := name | name '&lt;' type (',' type)* '&gt;'
 * </pre>
 *
 * Names are resolved as follows:
 * <ul>
 *     <li>a {@link ScalarKind#schemaName() scalar name} is that scalar;</li>
 *     <li>{@code Or<L, R>}, {@code Remotable<T>}, {@code Untypable<T>} and {@code Variants<T>}
 *     are the corresponding {@link ValueType}s;</li>
 *     <li>any other name is an {@link ValueType.ObjectRef ObjectRef},
 *     which {@link SchemaResolver} later checks against the schema.</li>
 * </ul>
 */
public final class ValueTypeParser {
	private final String text;
	private int pos = 0;

	private ValueTypeParser(String text) {
		this.text = text;
	}

	/**
	 * @throws IllegalArgumentException if {@code text} is not a well-formed type expression
	 */
	public static ValueType parse(String text) {
		ValueTypeParser parser = new ValueTypeParser(text);
		ValueType result = parser.parseType();
		parser.skipWhitespace();
		if (parser.pos != text.length()) {
			throw parser.error("Unexpected trailing text");
		}
		return result;
	}

	private ValueType parseType() {
		String name = parseName();
		skipWhitespace();
		if (!peek('<')) {
			return ScalarKind.fromSchemaName(name)
				.map(ValueType::scalar)
				.orElseGet(() -> ValueType.object(name));
		}
		pos++;
		List<ValueType> args = new ArrayList<>();
		do {
			skipWhitespace();
			args.add(parseType());
			skipWhitespace();
		} while (consume(','));
		if (!consume('>')) {
			throw error("Expected '>'");
		}
		switch (name) {
			case "Or":
				expectArity(name, args, 2);
				return ValueType.or(args.get(0), args.get(1));
			case "Remotable":
				expectArity(name, args, 1);
				return ValueType.remotable(args.get(0));
			case "Untypable":
				expectArity(name, args, 1);
				return ValueType.untypable(args.get(0));
			case "Variants":
				expectArity(name, args, 1);
				if (args.get(0) instanceof ValueType.ObjectRef ref) {
					return ValueType.variants(ref.typeName());
				} else {
					throw error("Variants requires a schema type name, not " + args.get(0));
				}
			default:
				throw error("Unknown type constructor " + name);
		}
	}

	private String parseName() {
		skipWhitespace();
		int start = pos;
		while (pos < text.length() && isNameChar(text.charAt(pos))) {
			pos++;
		}
		if (start == pos) {
			throw error("Expected a type name");
		}
		return text.substring(start, pos);
	}

	private void expectArity(String name, List<ValueType> args, int arity) {
		if (args.size() != arity) {
			throw error(name + " takes " + arity + " type argument(s), not " + args.size());
		}
	}

	private static boolean isNameChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private boolean peek(char c) {
		return pos < text.length() && text.charAt(pos) == c;
	}

	private boolean consume(char c) {
		if (peek(c)) {
			pos++;
			return true;
		} else {
			return false;
		}
	}

	private void skipWhitespace() {
		while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
			pos++;
		}
	}

	private IllegalArgumentException error(String message) {
		return new IllegalArgumentException(message + " at position " + pos + " of type expression \"" + text + "\"");
	}
}
