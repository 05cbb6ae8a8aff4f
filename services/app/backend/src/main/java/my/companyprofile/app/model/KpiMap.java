package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Financial and operational indicators found in text. A missing metric key means "not found".
 * Flags are always present. Serialized as one flat object holding metrics and flags side by side.
 */
public record KpiMap(
		@JsonProperty("metrics") Map<String, String> metrics,
		@JsonProperty("flags") Map<String, Boolean> flags
) {
	public static final String EBITDA_MARGIN = "ebitda_margin";
	public static final String PAT_MARGIN = "pat_margin";
	public static final String ROE = "roe";
	public static final String ROCE = "roce";
	public static final String REVENUE_CAGR = "revenue_cagr";
	public static final String EMPLOYEES = "employees";
	public static final String FACILITIES = "facilities";
	public static final String COUNTRIES = "countries";
	public static final String CUSTOMERS = "customers";

	public static final String ZERO_DEBT = "zero_debt";
	public static final String PROFITABLE = "profitable";
	public static final String ISO_CERTIFIED = "iso_certified";
	public static final String WHO_GMP = "who_gmp";
	public static final String FDA_APPROVED = "fda_approved";

	public KpiMap {
		metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
		flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
	}

	public static KpiMap empty() {
		return new KpiMap(Map.of(), Map.of());
	}

	public Optional<String> metric(String key) {
		return Optional.ofNullable(metrics.get(key));
	}

	public boolean flag(String key) {
		return Boolean.TRUE.equals(flags.get(key));
	}

	/**
	 * Metric string or flag value for {@code key}, {@code null} when the key was not found.
	 */
	public Object get(String key) {
		String metric = metrics.get(key);
		return metric != null ? metric : flags.get(key);
	}

	@JsonValue
	public Map<String, Object> asFlatMap() {
		Map<String, Object> flat = new LinkedHashMap<>(metrics);
		flat.putAll(flags);
		return Collections.unmodifiableMap(flat);
	}

	@JsonIgnore
	public boolean isEmpty() {
		return metrics.isEmpty() && flags.values().stream().noneMatch(Boolean.TRUE::equals);
	}
}
