package my.companyprofile.app.util;

import my.companyprofile.app.model.FiscalYearLabel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class YearLabelResolverTest {
	@Test
	void resolvesCommonYearSpellings() {
		assertThat(YearLabelResolver.resolve("2023")).contains(new FiscalYearLabel(23, false));
		assertThat(YearLabelResolver.resolve("FY2024")).contains(new FiscalYearLabel(24, false));
		assertThat(YearLabelResolver.resolve("FY 22")).contains(new FiscalYearLabel(22, false));
		assertThat(YearLabelResolver.resolve("fy'21")).contains(new FiscalYearLabel(21, false));
	}

	@Test
	void marksEstimatesOnlyWhenMarkerFollowsYear() {
		assertThat(YearLabelResolver.resolve("2025E")).contains(new FiscalYearLabel(25, true));
		assertThat(YearLabelResolver.resolve("FY26 est")).contains(new FiscalYearLabel(26, true));
		assertThat(YearLabelResolver.resolve("FY24 (E)")).contains(new FiscalYearLabel(24, true));
		assertThat(YearLabelResolver.resolve("FY24 Revenue")).contains(new FiscalYearLabel(24, false));
	}

	@Test
	void firstYearInRangeWins() {
		assertThat(YearLabelResolver.resolve("FY 2023-24")).contains(new FiscalYearLabel(23, false));
	}

	@Test
	void resolvesNumericWorkbookCells() {
		assertThat(YearLabelResolver.resolve(2022.0d)).contains(new FiscalYearLabel(22, false));
		assertThat(YearLabelResolver.resolve(2021)).contains(new FiscalYearLabel(21, false));
	}

	@Test
	void rejectsNonYears() {
		assertThat(YearLabelResolver.resolve(null)).isEmpty();
		assertThat(YearLabelResolver.resolve("Revenue")).isEmpty();
		assertThat(YearLabelResolver.resolve("12345")).isEmpty();
		assertThat(YearLabelResolver.resolve("1450")).isEmpty();
		assertThat(YearLabelResolver.resolve("2019.5")).isEmpty();
		assertThat(YearLabelResolver.looksLikeYear("Particulars")).isFalse();
	}

	@Test
	void labelRendersCanonicalToken() {
		assertThat(FiscalYearLabel.ofYear(2024, false).label()).isEqualTo("FY24");
		assertThat(FiscalYearLabel.ofYear(2025, true).label()).isEqualTo("FY25E");
		assertThat(FiscalYearLabel.ofYear(2005, false).toString()).isEqualTo("FY05");
	}
}
