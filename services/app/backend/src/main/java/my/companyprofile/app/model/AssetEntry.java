package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AssetEntry(
		@JsonProperty("label") String label,
		@JsonProperty("value") String value
) {
}
