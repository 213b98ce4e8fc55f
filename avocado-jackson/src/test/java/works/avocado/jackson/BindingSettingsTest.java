package works.avocado.jackson;

import org.junit.jupiter.api.Test;
import works.avocado.VocabObject;
import works.avocado.xsd.DurationFormat;
import works.avocado.xsd.XsdDuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BindingSettingsTest extends AbstractVocabularyTest {

	@Test
	void defaults() {
		assertEquals(DurationFormat.STANDARD, BindingSettings.DEFAULT.getDurationFormat());
		assertTrue(BindingSettings.DEFAULT.isAcceptTypeUris());
		assertEquals(BindingSettings.DEFAULT, BindingSettings.builder().build());
	}

	@Test
	void durationFormatAppliesToEncoding() {
		Bindings legacy = compile(BindingSettings.DEFAULT.toBuilder().durationFormat(DurationFormat.LEGACY).build());
		String text = q("{'duration':'P3Y6M4DT12H30M5S'}");

		VocabObject standardNote = BINDINGS.type("Note").decode(text);
		VocabObject legacyNote = legacy.type("Note").decode(text);

		assertEquals(standardNote.values(), legacyNote.values());
		assertEquals(XsdDuration.of(3, 6, 4, 12, 30, 5), standardNote.<XsdDuration>functional("duration").orElseThrow());
		assertEquals(text, BINDINGS.type("Note").encodeToString(standardNote));
		assertEquals(q("{'duration':'P3Y3M4DT12H30M5S'}"), legacy.type("Note").encodeToString(legacyNote));
	}

	@Test
	void standardDurationsOmitEmptyTime() {
		VocabObject note = BINDINGS.type("Note").decode(q("{'duration':'P1D'}"));
		assertEquals(q("{'duration':'P1D'}"), BINDINGS.type("Note").encodeToString(note));
	}

	@Test
	void standardDurationsKeepTheirComponentLayout() {
		VocabObject note = BINDINGS.type("Note").decode(q("{'duration':'PT90M'}"));
		assertEquals(q("{'duration':'PT90M'}"), BINDINGS.type("Note").encodeToString(note));
	}
}
