package my.companyprofile.app.model;

import java.util.Optional;

/**
 * Partial profile recovered from a single document. Any part may be missing.
 */
public record DocumentExtraction(
		String sourceFile,
		DocumentOrigin origin,
		FinancialTable table,
		KpiMap kpis,
		NarrativeProfile narrative
) {
	public DocumentExtraction {
		origin = origin == null ? DocumentOrigin.PRIVATE_FILE : origin;
	}

	public Optional<FinancialTable> financialTable() {
		return Optional.ofNullable(table);
	}

	public Optional<KpiMap> kpiMap() {
		return Optional.ofNullable(kpis);
	}

	public Optional<NarrativeProfile> narrativeProfile() {
		return Optional.ofNullable(narrative);
	}
}
