package my.companyprofile.app.service;

import my.companyprofile.app.model.Citation;
import my.companyprofile.app.model.CompanyProfile;
import my.companyprofile.app.model.DocumentExtraction;
import my.companyprofile.app.model.DocumentIssue;
import my.companyprofile.app.model.FinancialSeries;
import my.companyprofile.app.model.FinancialTable;
import my.companyprofile.app.model.FiscalYearLabel;
import my.companyprofile.app.model.KpiMap;
import my.companyprofile.app.model.MetricKind;
import my.companyprofile.app.model.MetricSeries;
import my.companyprofile.app.model.NarrativeProfile;
import my.companyprofile.app.model.Provenance;
import my.companyprofile.app.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines per-document extractions into one {@link CompanyProfile}.
 * <ul>
 *     <li>financial lists: the longest candidate per list wins, ties keep the earlier document</li>
 *     <li>KPI metrics: first document value wins; flags are OR-ed</li>
 *     <li>narrative: first non-empty document value wins; generated values only fill empty fields</li>
 * </ul>
 * Every accepted fact gets a citation.
 */
@Service
public class SourceMergePolicy {
	private static final Logger logger = LoggerFactory.getLogger(SourceMergePolicy.class);

	public static final String DERIVED_EBITDA_MARGIN = "ebitda_margin";
	public static final String DERIVED_PAT_MARGIN = "pat_margin";
	public static final String DERIVED_REVENUE_CAGR = "revenue_cagr";

	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	public CompanyProfile merge(String companyName,
								String sector,
								List<DocumentExtraction> extractions,
								List<DocumentIssue> issues,
								NarrativeProfile generated) {
		List<DocumentExtraction> sources = extractions == null ? List.of() : extractions;
		List<Citation> citations = new ArrayList<>();

		FinancialSeries financials = mergeFinancials(sources, citations);
		if (!financials.isAligned()) {
			logger.warn("Merged financial lists for {} differ in length (years={}, revenue={}, ebitda={}, pat={}).",
					companyName, financials.years().size(), financials.revenue().size(),
					financials.ebitda().size(), financials.pat().size());
		}
		KpiMap kpis = mergeKpis(sources, citations);
		NarrativeProfile narrative = mergeNarrative(sources, generated, citations);
		Map<String, String> derived = deriveMetrics(financials, citations);
		if (sector != null) {
			citations.add(new Citation("Sector: " + sector, SourceType.GENERATED, Citation.INTERNAL_REF,
					"Keyword scoring over document text"));
		}

		logger.info("Merged {} extractions for {}: years={}, kpis={}, narrativeFields={}, derived={}, citations={}.",
				sources.size(), companyName, financials.years().size(), kpis.metrics().size(),
				narrative.extractedFields().size(), derived.size(), citations.size());
		return new CompanyProfile(companyName, sector, financials, kpis, narrative, derived, citations, issues);
	}

	public FinancialSeries mergeFinancials(List<DocumentExtraction> extractions) {
		return mergeFinancials(extractions, new ArrayList<>());
	}

	public KpiMap mergeKpis(List<DocumentExtraction> extractions) {
		return mergeKpis(extractions, new ArrayList<>());
	}

	/**
	 * Narrative fields supplied by at least one document.
	 */
	public Set<String> documentNarrativeFields(List<DocumentExtraction> extractions) {
		Set<String> fields = new LinkedHashSet<>();
		for (DocumentExtraction extraction : extractions) {
			extraction.narrativeProfile().ifPresent(narrative -> fields.addAll(narrative.extractedFields()));
		}
		return fields;
	}

	private FinancialSeries mergeFinancials(List<DocumentExtraction> extractions, List<Citation> citations) {
		Candidate<List<FiscalYearLabel>> years = null;
		Map<MetricKind, Candidate<MetricSeries>> series = new EnumMap<>(MetricKind.class);
		for (DocumentExtraction extraction : extractions) {
			if (extraction.financialTable().isEmpty()) {
				continue;
			}
			FinancialTable table = extraction.financialTable().get();
			if (years == null || table.years().size() > years.value().size()) {
				years = new Candidate<>(table.years(), extraction, table);
			}
			for (MetricSeries candidate : table.series().values()) {
				Candidate<MetricSeries> current = series.get(candidate.metric());
				if (current == null || candidate.values().size() > current.value().values().size()) {
					series.put(candidate.metric(), new Candidate<>(candidate, extraction, table));
				}
			}
		}
		if (years == null) {
			return FinancialSeries.empty();
		}
		citations.add(new Citation("Fiscal years: " + years.value().stream().map(FiscalYearLabel::label)
				.collect(Collectors.joining(", ")),
				years.source().origin().sourceType(), years.source().sourceFile(),
				"Grid parse (" + years.table().orientation().name().toLowerCase(Locale.ROOT) + ")"));

		Map<String, Provenance> provenance = new LinkedHashMap<>();
		for (Map.Entry<MetricKind, Candidate<MetricSeries>> entry : series.entrySet()) {
			MetricSeries accepted = entry.getValue().value();
			provenance.put(entry.getKey().key(), accepted.provenance());
			citations.add(new Citation("Financial series: " + entry.getKey().key(),
					entry.getValue().source().origin().sourceType(), entry.getValue().source().sourceFile(),
					"Grid parse (" + entry.getValue().table().orientation().name().toLowerCase(Locale.ROOT) + ") "
							+ accepted.provenance().describe()));
		}
		return new FinancialSeries(years.value(),
				valuesOf(series.get(MetricKind.REVENUE)),
				valuesOf(series.get(MetricKind.EBITDA)),
				valuesOf(series.get(MetricKind.PAT)),
				provenance);
	}

	private KpiMap mergeKpis(List<DocumentExtraction> extractions, List<Citation> citations) {
		Map<String, String> metrics = new LinkedHashMap<>();
		Map<String, Boolean> flags = new LinkedHashMap<>();
		for (DocumentExtraction extraction : extractions) {
			if (extraction.kpiMap().isEmpty()) {
				continue;
			}
			KpiMap kpis = extraction.kpiMap().get();
			SourceType sourceType = extraction.origin().sourceType();
			for (Map.Entry<String, String> metric : kpis.metrics().entrySet()) {
				if (metrics.putIfAbsent(metric.getKey(), metric.getValue()) == null) {
					citations.add(new Citation("KPI " + metric.getKey() + " = " + metric.getValue(), sourceType,
							extraction.sourceFile(), "Text pattern"));
				}
			}
			for (Map.Entry<String, Boolean> flag : kpis.flags().entrySet()) {
				boolean before = Boolean.TRUE.equals(flags.get(flag.getKey()));
				boolean after = before || Boolean.TRUE.equals(flag.getValue());
				flags.put(flag.getKey(), after);
				if (after && !before) {
					citations.add(new Citation("KPI flag " + flag.getKey(), sourceType, extraction.sourceFile(),
							"Text pattern"));
				}
			}
		}
		return new KpiMap(metrics, flags);
	}

	private NarrativeProfile mergeNarrative(List<DocumentExtraction> extractions,
											NarrativeProfile generated,
											List<Citation> citations) {
		NarrativeProfile.Builder merged = NarrativeProfile.builder();
		for (String field : NarrativeProfile.fieldNames()) {
			boolean supplied = false;
			for (DocumentExtraction extraction : extractions) {
				NarrativeProfile narrative = extraction.narrativeProfile().orElse(null);
				if (narrative != null && narrative.field(field) != null) {
					merged.copyField(field, narrative);
					citations.add(new Citation("Narrative " + field, extraction.origin().sourceType(),
							extraction.sourceFile(), "Section extraction"));
					supplied = true;
					break;
				}
			}
			if (!supplied && generated != null && generated.field(field) != null) {
				merged.copyField(field, generated);
				citations.add(new Citation("Narrative " + field, SourceType.GENERATED, Citation.INTERNAL_REF,
						"Generative fallback; no document supplied this field"));
			}
		}
		return merged.build();
	}

	Map<String, String> deriveMetrics(FinancialSeries financials, List<Citation> citations) {
		Map<String, String> derived = new LinkedHashMap<>();
		String latest = financials.years().isEmpty() ? ""
				: financials.years().get(financials.years().size() - 1).label();

		String ebitdaMargin = latestAbsent(financials, MetricKind.EBITDA) ? null
				: margin(financials.ebitda(), financials.revenue());
		if (ebitdaMargin != null) {
			derived.put(DERIVED_EBITDA_MARGIN, ebitdaMargin);
			citations.add(derivedCitation(DERIVED_EBITDA_MARGIN, ebitdaMargin, "ebitda / revenue, " + latest));
		}
		String patMargin = latestAbsent(financials, MetricKind.PAT) ? null
				: margin(financials.pat(), financials.revenue());
		if (patMargin != null) {
			derived.put(DERIVED_PAT_MARGIN, patMargin);
			citations.add(derivedCitation(DERIVED_PAT_MARGIN, patMargin, "pat / revenue, " + latest));
		}
		String cagr = cagr(financials.revenue());
		if (cagr != null) {
			derived.put(DERIVED_REVENUE_CAGR, cagr);
			citations.add(derivedCitation(DERIVED_REVENUE_CAGR, cagr,
					"Revenue CAGR over " + (financials.revenue().size() - 1) + " periods"));
		}
		return derived;
	}

	/**
	 * Latest-period ratio in percent with one decimal, {@code null} when the series do not line up.
	 */
	static String margin(List<BigDecimal> numerator, List<BigDecimal> revenue) {
		if (numerator.isEmpty() || numerator.size() != revenue.size()) {
			return null;
		}
		BigDecimal top = numerator.get(numerator.size() - 1);
		BigDecimal bottom = revenue.get(revenue.size() - 1);
		if (top == null || bottom == null || bottom.signum() == 0) {
			return null;
		}
		BigDecimal percent = top.divide(bottom, MathContext.DECIMAL64).multiply(HUNDRED)
				.setScale(1, RoundingMode.HALF_UP);
		return percent.toPlainString() + "%";
	}

	static String cagr(List<BigDecimal> revenue) {
		if (revenue.size() < 2) {
			return null;
		}
		BigDecimal first = revenue.get(0);
		BigDecimal last = revenue.get(revenue.size() - 1);
		if (first == null || last == null || first.signum() <= 0 || last.signum() <= 0) {
			return null;
		}
		double periods = revenue.size() - 1;
		double growth = Math.pow(last.doubleValue() / first.doubleValue(), 1.0 / periods) - 1.0;
		return Math.round(growth * 100.0) + "%";
	}

	private static boolean latestAbsent(FinancialSeries financials, MetricKind kind) {
		List<BigDecimal> values = financials.values(kind);
		return !values.isEmpty() && financials.isAbsent(kind, values.size() - 1);
	}

	private static Citation derivedCitation(String key, String value, String details) {
		return new Citation("Derived " + key + " = " + value, SourceType.GENERATED, Citation.INTERNAL_REF,
				"Computed from " + details);
	}

	private static List<BigDecimal> valuesOf(Candidate<MetricSeries> candidate) {
		return candidate == null ? List.of() : candidate.value().values();
	}

	private record Candidate<T>(T value, DocumentExtraction source, FinancialTable table) {
	}
}
