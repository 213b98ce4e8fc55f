package works.avocado.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.avocado.xsd.DurationFormat;

import static works.avocado.xsd.DurationFormat.STANDARD;

@Value
@Builder(toBuilder = true)
public class BindingSettings {
	public static final BindingSettings DEFAULT = BindingSettings.builder().build();

	/**
	 * How {@code Duration} values are written.
	 * Parsing accepts the same grammar either way.
	 *
	 * @see DurationFormat#LEGACY
	 */
	@Default DurationFormat durationFormat = STANDARD;

	/**
	 * Whether a {@code "type"} discriminant may name a subtype by its URI
	 * as well as by its name.
	 * Subtypes are always written by name.
	 */
	@Default boolean acceptTypeUris = true;
}
