package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An industry served. {@code share} is a position-based illustration, not a measured share.
 */
public record ApplicationEntry(
		@JsonProperty("industry") String industry,
		@JsonProperty("share") String share
) {
}
