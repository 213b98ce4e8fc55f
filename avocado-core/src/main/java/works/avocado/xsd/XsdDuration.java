package works.avocado.xsd;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import works.avocado.exceptions.MalformedScalarException;

/**
 * An {@code xsd:duration} of the form {@code P[-][nY][nM][nD][T[nH][nM][nS]]}.
 * <p>
 * Every component is kept as written, so {@code PT90M} stays ninety minutes
 * rather than becoming {@code PT1H30M}. {@link #time()} gives the combined time part.
 */
public record XsdDuration(boolean negative, long years, long months, long days, long hours, long minutes, long seconds) {
	public static final XsdDuration ZERO = new XsdDuration(false, 0, 0, 0, 0, 0, 0);

	private static final Pattern GRAMMAR = Pattern.compile(
		"P(-)?(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?");

	public XsdDuration {
		if (years < 0 || months < 0 || days < 0 || hours < 0 || minutes < 0 || seconds < 0) {
			throw new IllegalArgumentException("Components must not be negative; use the sign");
		}
	}

	public static XsdDuration of(long years, long months, long days, long hours, long minutes, long seconds) {
		return new XsdDuration(false, years, months, days, hours, minutes, seconds);
	}

	public XsdDuration negated() {
		return new XsdDuration(!negative, years, months, days, hours, minutes, seconds);
	}

	/**
	 * @throws ArithmeticException if the time part overflows a {@link Duration}
	 */
	public Duration time() {
		return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
	}

	public static XsdDuration parse(String text) {
		Matcher m = GRAMMAR.matcher(text);
		if (!m.matches()) {
			throw new MalformedScalarException("Invalid duration \"" + text + "\"");
		}
		try {
			XsdDuration result = new XsdDuration(m.group(1) != null,
				component(m, 2), component(m, 3), component(m, 4),
				component(m, 5), component(m, 6), component(m, 7));
			// Rejects a time part too large for a Duration
			result.time();
			return result;
		} catch (NumberFormatException | ArithmeticException e) {
			throw new MalformedScalarException("Duration out of range \"" + text + "\"", e);
		}
	}

	private static long component(Matcher m, int group) {
		String digits = m.group(group);
		return (digits == null) ? 0 : Long.parseLong(digits);
	}

	public String format(DurationFormat format) {
		StringBuilder sb = new StringBuilder("P");
		if (negative) {
			sb.append('-');
		}
		if (years != 0) {
			sb.append(years).append('Y');
		}
		if (months != 0) {
			sb.append(format == DurationFormat.LEGACY ? years : months).append('M');
		}
		if (days != 0) {
			sb.append(days).append('D');
		}
		if (format == DurationFormat.LEGACY) {
			// Older tools carry the time part into hours, minutes and seconds
			Duration time = time();
			sb.append('T');
			appendNonZero(sb, time.toHours(), 'H');
			appendNonZero(sb, time.toMinutesPart(), 'M');
			appendNonZero(sb, time.toSecondsPart(), 'S');
		} else if (hours != 0 || minutes != 0 || seconds != 0) {
			sb.append('T');
			appendNonZero(sb, hours, 'H');
			appendNonZero(sb, minutes, 'M');
			appendNonZero(sb, seconds, 'S');
		} else if (years == 0 && months == 0 && days == 0) {
			sb.append("T0S");
		}
		return sb.toString();
	}

	private static void appendNonZero(StringBuilder sb, long value, char designator) {
		if (value != 0) {
			sb.append(value).append(designator);
		}
	}

	@Override
	public String toString() {
		return format(DurationFormat.STANDARD);
	}
}
