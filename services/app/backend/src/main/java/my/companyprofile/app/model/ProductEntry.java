package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProductEntry(
		@JsonProperty("category") String category,
		@JsonProperty("details") String details
) {
	public ProductEntry {
		details = details == null ? "" : details;
	}
}
