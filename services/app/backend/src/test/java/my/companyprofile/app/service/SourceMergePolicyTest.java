package my.companyprofile.app.service;

import my.companyprofile.app.model.Citation;
import my.companyprofile.app.model.CompanyProfile;
import my.companyprofile.app.model.DocumentExtraction;
import my.companyprofile.app.model.DocumentIssue;
import my.companyprofile.app.model.DocumentOrigin;
import my.companyprofile.app.model.FinancialTable;
import my.companyprofile.app.model.FiscalYearLabel;
import my.companyprofile.app.model.KpiMap;
import my.companyprofile.app.model.MetricKind;
import my.companyprofile.app.model.MetricSeries;
import my.companyprofile.app.model.NarrativeProfile;
import my.companyprofile.app.model.Provenance;
import my.companyprofile.app.model.SourceType;
import my.companyprofile.app.model.TableOrientation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SourceMergePolicyTest {
	private final SourceMergePolicy policy = new SourceMergePolicy();

	@Test
	void longerRevenueSeriesWinsRegardlessOfOrder() {
		DocumentExtraction shortDoc = tableDoc("a.xlsx", revenue("a.xlsx", 2022, "10", "20"));
		DocumentExtraction longDoc = tableDoc("b.xlsx", revenue("b.xlsx", 2021, "10", "20", "30"));

		CompanyProfile forward = policy.merge("Acme", null, List.of(shortDoc, longDoc), List.of(), null);
		CompanyProfile backward = policy.merge("Acme", null, List.of(longDoc, shortDoc), List.of(), null);

		assertThat(forward.financials().revenue()).hasSize(3);
		assertThat(backward.financials().revenue()).hasSize(3);
		assertThat(forward.financials().years()).extracting(FiscalYearLabel::label)
				.containsExactly("FY21", "FY22", "FY23");
		assertThat(forward.financials().provenance().get("revenue").sourceFile()).isEqualTo("b.xlsx");
	}

	@Test
	void equalLengthKeepsEarlierDocument() {
		DocumentExtraction first = tableDoc("first.xlsx", revenue("first.xlsx", 2022, "1", "2"));
		DocumentExtraction second = tableDoc("second.xlsx", revenue("second.xlsx", 2022, "5", "6"));

		CompanyProfile profile = policy.merge("Acme", null, List.of(first, second), List.of(), null);

		assertThat(profile.financials().revenue().get(0)).isEqualByComparingTo("1");
		assertThat(profile.financials().provenance().get("revenue").sourceFile()).isEqualTo("first.xlsx");
	}

	@Test
	void listsAreMergedIndependentlyAndMayDisagreeInLength() {
		DocumentExtraction revenueDoc = tableDoc("rev.xlsx", revenue("rev.xlsx", 2020, "1", "2", "3", "4"));
		DocumentExtraction ebitdaDoc = tableDoc("ebitda.xlsx", series("ebitda.xlsx", MetricKind.EBITDA, 2023, "7", "8"));

		CompanyProfile profile = policy.merge("Acme", null, List.of(revenueDoc, ebitdaDoc), List.of(), null);

		assertThat(profile.financials().years()).hasSize(4);
		assertThat(profile.financials().ebitda()).hasSize(2);
		assertThat(profile.financials().isAligned()).isFalse();
		assertThat(profile.derivedMetrics()).doesNotContainKey(SourceMergePolicy.DERIVED_EBITDA_MARGIN);
	}

	@Test
	void kpiFirstValueWinsAndFlagsAreCombined() {
		DocumentExtraction first = kpiDoc("report.pdf", DocumentOrigin.PRIVATE_FILE,
				Map.of(KpiMap.ROCE, "22%"), Map.of(KpiMap.ZERO_DEBT, false, KpiMap.PROFITABLE, true));
		DocumentExtraction second = kpiDoc("https://acme.example.com", DocumentOrigin.PUBLIC_URL,
				Map.of(KpiMap.ROCE, "25%", KpiMap.EMPLOYEES, "450"), Map.of(KpiMap.ZERO_DEBT, true));

		CompanyProfile profile = policy.merge("Acme", null, List.of(first, second), List.of(), null);

		assertThat(profile.kpis().metrics()).containsEntry(KpiMap.ROCE, "22%").containsEntry(KpiMap.EMPLOYEES, "450");
		assertThat(profile.kpis().flag(KpiMap.ZERO_DEBT)).isTrue();
		assertThat(profile.kpis().flag(KpiMap.PROFITABLE)).isTrue();
		assertThat(profile.citations())
				.filteredOn(citation -> citation.claim().contains(KpiMap.EMPLOYEES))
				.singleElement()
				.satisfies(citation -> {
					assertThat(citation.sourceType()).isEqualTo(SourceType.PUBLIC_URL);
					assertThat(citation.ref()).isEqualTo("https://acme.example.com");
				});
	}

	@Test
	void generatedNarrativeOnlyFillsFieldsNoDocumentSupplied() {
		DocumentExtraction doc = narrativeDoc("report.pdf", NarrativeProfile.builder()
				.bizDesc("Document description.")
				.build());
		NarrativeProfile generated = NarrativeProfile.builder()
				.bizDesc("Generated description.")
				.customers(List.of("Generated Customer"))
				.build();

		CompanyProfile profile = policy.merge("Acme", null, List.of(doc), List.of(), generated);

		assertThat(profile.narrative().bizDesc()).isEqualTo("Document description.");
		assertThat(profile.narrative().customers()).containsExactly("Generated Customer");
		assertThat(profile.citations())
				.filteredOn(citation -> citation.claim().equals("Narrative customers"))
				.singleElement()
				.extracting(Citation::sourceType)
				.isEqualTo(SourceType.GENERATED);
		assertThat(profile.citations())
				.filteredOn(citation -> citation.claim().equals("Narrative biz_desc"))
				.singleElement()
				.extracting(Citation::sourceType)
				.isEqualTo(SourceType.PRIVATE_FILE);
	}

	@Test
	void firstNonEmptyDocumentNarrativeWins() {
		DocumentExtraction empty = narrativeDoc("a.pdf", NarrativeProfile.empty());
		DocumentExtraction first = narrativeDoc("b.pdf", NarrativeProfile.builder()
				.certifications(List.of("ISO 9001")).build());
		DocumentExtraction second = narrativeDoc("c.pdf", NarrativeProfile.builder()
				.certifications(List.of("FSSAI", "HACCP")).build());

		CompanyProfile profile = policy.merge("Acme", null, List.of(empty, first, second), List.of(), null);

		assertThat(profile.narrative().certifications()).containsExactly("ISO 9001");
	}

	@Test
	void derivedMetricsAreComputedAndCitedAsGenerated() {
		Map<MetricKind, MetricSeries> series = new EnumMap<>(MetricKind.class);
		series.put(MetricKind.REVENUE, series("model.xlsx", MetricKind.REVENUE, 2022, "100", "121").get(MetricKind.REVENUE));
		series.put(MetricKind.EBITDA, series("model.xlsx", MetricKind.EBITDA, 2022, "15", "22.4").get(MetricKind.EBITDA));
		series.put(MetricKind.PAT, series("model.xlsx", MetricKind.PAT, 2022, "8", "12.1").get(MetricKind.PAT));
		DocumentExtraction doc = tableDoc("model.xlsx", series);

		CompanyProfile profile = policy.merge("Acme", "B2B Manufacturing", List.of(doc), List.of(), null);

		assertThat(profile.derivedMetrics())
				.containsEntry(SourceMergePolicy.DERIVED_EBITDA_MARGIN, "18.5%")
				.containsEntry(SourceMergePolicy.DERIVED_PAT_MARGIN, "10.0%")
				.containsEntry(SourceMergePolicy.DERIVED_REVENUE_CAGR, "21%");
		assertThat(profile.citations())
				.filteredOn(citation -> citation.claim().startsWith("Derived "))
				.hasSize(3)
				.allSatisfy(citation -> {
					assertThat(citation.sourceType()).isEqualTo(SourceType.GENERATED);
					assertThat(citation.ref()).isEqualTo(Citation.INTERNAL_REF);
				});
	}

	@Test
	void marginIsSkippedWhenLatestValueWasAbsent() {
		List<FiscalYearLabel> years = List.of(FiscalYearLabel.ofYear(2022, false), FiscalYearLabel.ofYear(2023, false));
		Map<MetricKind, MetricSeries> series = new EnumMap<>(MetricKind.class);
		series.put(MetricKind.REVENUE, new MetricSeries(MetricKind.REVENUE, years, values("100", "120"),
				new Provenance("model.xlsx", null, 1, "revenue")));
		series.put(MetricKind.PAT, new MetricSeries(MetricKind.PAT, years, values("9", "0"),
				new Provenance("model.xlsx", null, 4, "pat", List.of(1))));
		DocumentExtraction doc = tableDoc("model.xlsx", series);

		CompanyProfile profile = policy.merge("Acme", null, List.of(doc), List.of(), null);

		assertThat(profile.financials().pat()).hasSize(2);
		assertThat(profile.financials().isAbsent(MetricKind.PAT, 1)).isTrue();
		assertThat(profile.derivedMetrics()).doesNotContainKey(SourceMergePolicy.DERIVED_PAT_MARGIN)
				.containsEntry(SourceMergePolicy.DERIVED_REVENUE_CAGR, "20%");
	}

	@Test
	void derivedMetricsNeedUsableValues() {
		assertThat(SourceMergePolicy.margin(values("10", "20"), values("100", "0"))).isNull();
		assertThat(SourceMergePolicy.margin(values("10", null), values("100", "200"))).isNull();
		assertThat(SourceMergePolicy.margin(values("10"), values("100", "200"))).isNull();
		assertThat(SourceMergePolicy.cagr(values("100"))).isNull();
		assertThat(SourceMergePolicy.cagr(values("-5", "10"))).isNull();
		assertThat(SourceMergePolicy.cagr(values(null, "10"))).isNull();
		assertThat(SourceMergePolicy.cagr(values("100", "100"))).isEqualTo("0%");
	}

	@Test
	void carriesIssuesAndProducesEmptyProfileWithoutSources() {
		List<DocumentIssue> issues = List.of(new DocumentIssue("broken.xlsx", "Document could not be decoded"));

		CompanyProfile profile = policy.merge("Acme", "General Business", List.of(), issues, null);

		assertThat(profile.financials().isEmpty()).isTrue();
		assertThat(profile.kpis().metrics()).isEmpty();
		assertThat(profile.derivedMetrics()).isEmpty();
		assertThat(profile.issues()).containsExactlyElementsOf(issues);
		assertThat(profile.sector()).isEqualTo("General Business");
	}

	private static DocumentExtraction tableDoc(String file, Map<MetricKind, MetricSeries> series) {
		List<FiscalYearLabel> years = series.values().iterator().next().years();
		FinancialTable table = new FinancialTable(years, series, TableOrientation.HORIZONTAL);
		return new DocumentExtraction(file, DocumentOrigin.PRIVATE_FILE, table, null, null);
	}

	private static DocumentExtraction kpiDoc(String file, DocumentOrigin origin, Map<String, String> metrics,
											 Map<String, Boolean> flags) {
		return new DocumentExtraction(file, origin, null, new KpiMap(metrics, flags), null);
	}

	private static DocumentExtraction narrativeDoc(String file, NarrativeProfile narrative) {
		return new DocumentExtraction(file, DocumentOrigin.PRIVATE_FILE, null, null, narrative);
	}

	private static Map<MetricKind, MetricSeries> revenue(String file, int firstYear, String... values) {
		return series(file, MetricKind.REVENUE, firstYear, values);
	}

	private static Map<MetricKind, MetricSeries> series(String file, MetricKind kind, int firstYear, String... values) {
		List<FiscalYearLabel> years = new ArrayList<>();
		for (int i = 0; i < values.length; i++) {
			years.add(FiscalYearLabel.ofYear(firstYear + i, false));
		}
		Map<MetricKind, MetricSeries> series = new EnumMap<>(MetricKind.class);
		series.put(kind, new MetricSeries(kind, years, values(values), new Provenance(file, null, 1, kind.key())));
		return series;
	}

	private static List<BigDecimal> values(String... raw) {
		List<BigDecimal> values = new ArrayList<>();
		for (String value : raw) {
			values.add(value == null ? null : new BigDecimal(value));
		}
		return values;
	}
}
