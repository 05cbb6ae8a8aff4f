package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DocumentIssue(
		@JsonProperty("source_file") String sourceFile,
		@JsonProperty("message") String message
) {
}
