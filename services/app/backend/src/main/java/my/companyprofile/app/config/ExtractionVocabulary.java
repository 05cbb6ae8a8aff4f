package my.companyprofile.app.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.companyprofile.app.model.MetricKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fixed keyword and pattern lists that drive extraction. Changing them changes extraction behavior,
 * so the resource carries a {@code version}.
 *
 * @param metrics                ordered {@code (metric, keywords)} pairs; earlier entries win
 * @param certificationPatterns  regular expressions, matched case-insensitively unless they switch it off
 * @param exportRegions          region and country names matched as whole words, ignoring case
 * @param exactCaseRegions       export regions that are also ordinary words and only count in their listed case
 * @param sectors                ordered sector keyword sets; earlier entries win ties
 */
public record ExtractionVocabulary(
		@JsonProperty("version") String version,
		@JsonProperty("metrics") List<MetricVocabulary> metrics,
		@JsonProperty("certification_patterns") List<String> certificationPatterns,
		@JsonProperty("export_regions") List<String> exportRegions,
		@JsonProperty("exact_case_regions") List<String> exactCaseRegions,
		@JsonProperty("default_sector") String defaultSector,
		@JsonProperty("sectors") List<SectorVocabulary> sectors
) {
	public ExtractionVocabulary {
		metrics = metrics == null ? List.of() : List.copyOf(metrics);
		certificationPatterns = certificationPatterns == null ? List.of() : List.copyOf(certificationPatterns);
		exportRegions = exportRegions == null ? List.of() : List.copyOf(exportRegions);
		exactCaseRegions = exactCaseRegions == null ? List.of() : List.copyOf(exactCaseRegions);
		sectors = sectors == null ? List.of() : List.copyOf(sectors);
		defaultSector = defaultSector == null || defaultSector.isBlank() ? "General Business" : defaultSector;

		Set<MetricKind> seen = EnumSet.noneOf(MetricKind.class);
		for (MetricVocabulary vocabulary : metrics) {
			if (!seen.add(vocabulary.metric())) {
				throw new IllegalArgumentException("Duplicate metric vocabulary: " + vocabulary.metric().key());
			}
		}
		if (!seen.containsAll(EnumSet.allOf(MetricKind.class))) {
			throw new IllegalArgumentException("Metric vocabularies must cover " + EnumSet.allOf(MetricKind.class));
		}
		for (String pattern : certificationPatterns) {
			try {
				Pattern.compile(pattern);
			} catch (PatternSyntaxException exc) {
				throw new IllegalArgumentException("Invalid certification pattern: " + pattern, exc);
			}
		}
	}

	public record MetricVocabulary(
			@JsonProperty("metric") MetricKind metric,
			@JsonProperty("keywords") List<String> keywords
	) {
		public MetricVocabulary {
			if (metric == null) {
				throw new IllegalArgumentException("Metric vocabulary without metric");
			}
			keywords = keywords == null ? List.of() : List.copyOf(keywords);
		}

		public boolean matches(String lowerText) {
			for (String keyword : keywords) {
				if (lowerText.contains(keyword)) {
					return true;
				}
			}
			return false;
		}
	}

	public record SectorVocabulary(
			@JsonProperty("name") String name,
			@JsonProperty("keywords") List<String> keywords
	) {
		public SectorVocabulary {
			keywords = keywords == null ? List.of() : List.copyOf(keywords);
		}
	}
}
