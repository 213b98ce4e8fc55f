package works.avocado.xsd;

/**
 * How an {@link XsdDuration} is written.
 */
public enum DurationFormat {
	/**
	 * Zero components are omitted, the {@code T} appears only if there is a time component,
	 * and a duration with no non-zero components is written {@code PT0S}.
	 */
	STANDARD,

	/**
	 * Compatible with documents produced by older tools:
	 * the month component is written with the year count,
	 * and the {@code T} is always written.
	 */
	LEGACY,
}
