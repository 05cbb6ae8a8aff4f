package my.companyprofile.app.service;

import my.companyprofile.app.config.ExtractionVocabulary;
import my.companyprofile.app.support.TestVocabulary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectorDetectorTest {
	private final SectorDetector detector = new SectorDetector(TestVocabulary.load());

	@Test
	void picksSectorWithMostKeywordHits() {
		String text = "A specialty chemical maker of polymer additives and surfactant blends, "
				+ "with one manufacturing plant.";

		assertThat(detector.detect(text)).isEqualTo("Chemicals / Specialty");
	}

	@Test
	void matchesWholeWordsOnly() {
		// "aircraft" contains "ai", "database" contains "data"; neither is a Technology keyword hit.
		assertThat(detector.detect("Aircraft database maintenance")).isEqualTo("General Business");
	}

	@Test
	void fallsBackToDefaultSector() {
		assertThat(detector.detect("")).isEqualTo("General Business");
		assertThat(detector.detect(null)).isEqualTo("General Business");
	}

	@Test
	void tiesKeepConfiguredOrder() {
		List<ExtractionVocabulary.MetricVocabulary> metrics = TestVocabulary.load().metrics();
		ExtractionVocabulary vocabulary = new ExtractionVocabulary("test", metrics, List.of(), List.of(), List.of(), "Other",
				List.of(new ExtractionVocabulary.SectorVocabulary("First", List.of("widget")),
						new ExtractionVocabulary.SectorVocabulary("Second", List.of("gadget"))));

		assertThat(new SectorDetector(vocabulary).detect("widget and gadget")).isEqualTo("First");
		assertThat(new SectorDetector(vocabulary).detect("nothing relevant")).isEqualTo("Other");
	}
}
