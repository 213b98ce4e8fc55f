package works.avocado.xsd;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import works.avocado.exceptions.MalformedScalarException;

import static java.util.Objects.requireNonNull;

/**
 * An {@code xsd:dateTime}, remembering whether it was written with a UTC offset,
 * because that determines how it is written back out.
 */
public sealed interface XsdDateTime permits XsdDateTime.WithOffset, XsdDateTime.Naive {
	/**
	 * Written in RFC 3339 form with whole seconds;
	 * a zero offset is written as {@code Z}.
	 * The value is truncated to whole seconds so it equals what it is written as.
	 */
	record WithOffset(OffsetDateTime value) implements XsdDateTime {
		public WithOffset {
			value = requireNonNull(value).truncatedTo(ChronoUnit.SECONDS);
		}

		@Override
		public String format() {
			return DateTimeFormats.OFFSET_OUTPUT.format(value);
		}

		@Override
		public String toString() {
			return format();
		}
	}

	/**
	 * Written with no offset and exactly four fractional-second digits.
	 * The value is truncated to 100 microseconds to match.
	 */
	record Naive(LocalDateTime value) implements XsdDateTime {
		public Naive {
			value = requireNonNull(value).withNano(value.getNano() / 100_000 * 100_000);
		}

		@Override
		public String format() {
			return String.format("%04d-%02d-%02dT%02d:%02d:%02d.%04d",
				value.getYear(), value.getMonthValue(), value.getDayOfMonth(),
				value.getHour(), value.getMinute(), value.getSecond(),
				value.getNano() / 100_000);
		}

		@Override
		public String toString() {
			return format();
		}
	}

	String format();

	/**
	 * Accepts RFC 3339 with an explicit offset, or failing that,
	 * {@code yyyy-MM-ddTHH:mm:ss} with an optional fraction and no offset.
	 */
	static XsdDateTime parse(String text) {
		try {
			return new WithOffset(OffsetDateTime.parse(text, DateTimeFormats.OFFSET_INPUT));
		} catch (DateTimeParseException offsetFailure) {
			try {
				return new Naive(LocalDateTime.parse(text, DateTimeFormats.NAIVE_INPUT));
			} catch (DateTimeParseException e) {
				MalformedScalarException result = new MalformedScalarException("Invalid date-time \"" + text + "\"", e);
				result.addSuppressed(offsetFailure);
				throw result;
			}
		}
	}
}
