package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final merged profile of one company. Built once per processing run and never mutated afterwards.
 */
public record CompanyProfile(
		@JsonProperty("company_name") String companyName,
		@JsonProperty("sector") String sector,
		@JsonProperty("financials") FinancialSeries financials,
		@JsonProperty("kpis") KpiMap kpis,
		@JsonProperty("narrative") NarrativeProfile narrative,
		@JsonProperty("derived_metrics") Map<String, String> derivedMetrics,
		@JsonProperty("citations") List<Citation> citations,
		@JsonProperty("issues") List<DocumentIssue> issues
) {
	public CompanyProfile {
		financials = financials == null ? FinancialSeries.empty() : financials;
		kpis = kpis == null ? KpiMap.empty() : kpis;
		narrative = narrative == null ? NarrativeProfile.empty() : narrative;
		derivedMetrics = derivedMetrics == null ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(derivedMetrics));
		citations = citations == null ? List.of() : List.copyOf(citations);
		issues = issues == null ? List.of() : List.copyOf(issues);
	}
}
