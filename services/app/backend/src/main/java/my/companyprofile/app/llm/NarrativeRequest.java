package my.companyprofile.app.llm;

import my.companyprofile.app.model.FinancialSeries;
import my.companyprofile.app.model.KpiMap;

import java.util.List;

/**
 * @param context       anonymized, length-capped document and public text
 * @param missingFields narrative field names that extraction left empty
 */
public record NarrativeRequest(
		String sector,
		FinancialSeries financials,
		KpiMap kpis,
		String context,
		List<String> missingFields
) {
	public NarrativeRequest {
		context = context == null ? "" : context;
		missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
	}
}
