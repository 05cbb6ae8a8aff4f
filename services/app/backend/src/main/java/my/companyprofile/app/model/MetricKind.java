package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MetricKind {
	REVENUE,
	EBITDA,
	PAT;

	@JsonValue
	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static MetricKind fromKey(String key) {
		if (key == null) {
			throw new IllegalArgumentException("Metric key is required");
		}
		return MetricKind.valueOf(key.trim().toUpperCase(Locale.ROOT));
	}
}
