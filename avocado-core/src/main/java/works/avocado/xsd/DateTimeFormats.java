package works.avocado.xsd;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;

final class DateTimeFormats {
	private DateTimeFormats() {}

	static final DateTimeFormatter NAIVE_INPUT = new DateTimeFormatterBuilder()
		.parseCaseInsensitive()
		.append(ISO_LOCAL_DATE)
		.appendLiteral('T')
		.appendPattern("HH:mm:ss")
		.optionalStart()
		.appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
		.optionalEnd()
		.toFormatter()
		.withResolverStyle(ResolverStyle.STRICT);

	static final DateTimeFormatter OFFSET_INPUT = new DateTimeFormatterBuilder()
		.append(NAIVE_INPUT)
		.parseCaseInsensitive()
		.appendOffset("+HH:MM", "Z")
		.toFormatter()
		.withResolverStyle(ResolverStyle.STRICT);

	static final DateTimeFormatter OFFSET_OUTPUT = new DateTimeFormatterBuilder()
		.append(ISO_LOCAL_DATE)
		.appendLiteral('T')
		.appendPattern("HH:mm:ss")
		.appendOffset("+HH:MM", "Z")
		.toFormatter();
}
