package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged multi-year series. Each list is chosen independently, so the lists are not guaranteed to
 * share a source or a length; see {@link #isAligned()}.
 */
public record FinancialSeries(
		@JsonProperty("years") List<FiscalYearLabel> years,
		@JsonProperty("revenue") List<BigDecimal> revenue,
		@JsonProperty("ebitda") List<BigDecimal> ebitda,
		@JsonProperty("pat") List<BigDecimal> pat,
		@JsonProperty("provenance") Map<String, Provenance> provenance
) {
	public FinancialSeries {
		years = years == null ? List.of() : List.copyOf(years);
		revenue = copyValues(revenue);
		ebitda = copyValues(ebitda);
		pat = copyValues(pat);
		provenance = provenance == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
	}

	public static FinancialSeries empty() {
		return new FinancialSeries(List.of(), List.of(), List.of(), List.of(), Map.of());
	}

	public List<BigDecimal> values(MetricKind kind) {
		return switch (kind) {
			case REVENUE -> revenue;
			case EBITDA -> ebitda;
			case PAT -> pat;
		};
	}

	/**
	 * True when the value at {@code position} was read from an empty or placeholder cell.
	 */
	public boolean isAbsent(MetricKind kind, int position) {
		Provenance source = provenance.get(kind.key());
		return source != null && source.isAbsent(position);
	}

	@JsonIgnore
	public boolean isEmpty() {
		return years.isEmpty() && revenue.isEmpty() && ebitda.isEmpty() && pat.isEmpty();
	}

	/**
	 * True when every non-empty metric list has exactly one value per year.
	 */
	@JsonIgnore
	public boolean isAligned() {
		for (MetricKind kind : MetricKind.values()) {
			List<BigDecimal> values = values(kind);
			if (!values.isEmpty() && values.size() != years.size()) {
				return false;
			}
		}
		return true;
	}

	private static List<BigDecimal> copyValues(List<BigDecimal> values) {
		return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
	}
}
