package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The metric series recovered from one grid, all aligned to the same year labels.
 */
public record FinancialTable(
		@JsonProperty("years") List<FiscalYearLabel> years,
		@JsonProperty("series") Map<MetricKind, MetricSeries> series,
		@JsonProperty("orientation") TableOrientation orientation
) {
	public FinancialTable {
		years = years == null ? List.of() : List.copyOf(years);
		EnumMap<MetricKind, MetricSeries> copy = new EnumMap<>(MetricKind.class);
		if (series != null) {
			copy.putAll(series);
		}
		series = Collections.unmodifiableMap(copy);
	}

	public Optional<MetricSeries> get(MetricKind kind) {
		return Optional.ofNullable(series.get(kind));
	}
}
