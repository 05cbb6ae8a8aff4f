package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, year-aligned numeric sequence. Absent cells are stored as zero and listed in
 * {@link Provenance#absentPositions()}.
 */
public record MetricSeries(
		@JsonProperty("metric") MetricKind metric,
		@JsonProperty("years") List<FiscalYearLabel> years,
		@JsonProperty("values") List<BigDecimal> values,
		@JsonProperty("provenance") Provenance provenance
) {
	public MetricSeries {
		Objects.requireNonNull(metric, "metric");
		years = years == null ? List.of() : List.copyOf(years);
		values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
		if (years.size() != values.size()) {
			throw new IllegalArgumentException("Series " + metric.key() + " has " + values.size()
					+ " values for " + years.size() + " years");
		}
	}

	public boolean hasNonZeroValue() {
		return values.stream().anyMatch(value -> value != null && value.signum() != 0);
	}
}
