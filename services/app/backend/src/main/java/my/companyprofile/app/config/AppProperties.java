package my.companyprofile.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Extraction extraction,
		@Valid Llm llm
) {
	public AppProperties {
		extraction = extraction == null ? new Extraction(null, null, null) : extraction;
		llm = llm == null ? new Llm(null) : llm;
	}

	public record Extraction(
			@Positive Integer maxTextChars,
			@Positive Integer maxContextChars,
			@NotBlank String vocabularyResource
	) {
		public static final int DEFAULT_MAX_TEXT_CHARS = 200_000;
		public static final int DEFAULT_MAX_CONTEXT_CHARS = 12_000;
		public static final String DEFAULT_VOCABULARY_RESOURCE = "vocabulary/extraction-vocabulary.json";

		public Extraction {
			maxTextChars = maxTextChars == null ? DEFAULT_MAX_TEXT_CHARS : maxTextChars;
			maxContextChars = maxContextChars == null ? DEFAULT_MAX_CONTEXT_CHARS : maxContextChars;
			vocabularyResource = vocabularyResource == null ? DEFAULT_VOCABULARY_RESOURCE : vocabularyResource;
		}
	}

	public record Llm(
			@NotBlank String provider
	) {
		public Llm {
			provider = provider == null ? "noop" : provider;
		}
	}
}
