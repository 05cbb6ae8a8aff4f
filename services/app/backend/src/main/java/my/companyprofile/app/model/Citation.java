package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Citation(
		@JsonProperty("claim") String claim,
		@JsonProperty("source_type") SourceType sourceType,
		@JsonProperty("ref") String ref,
		@JsonProperty("details") String details
) {
	public static final String INTERNAL_REF = "internal";

	public Citation {
		ref = ref == null ? "" : ref;
		details = details == null ? "" : details;
	}
}
