package my.companyprofile.app.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumericNormalizerTest {
	@Test
	void normalize_readsParenthesesAsNegative() {
		assertThat(NumericNormalizer.normalize("(1,234.5)")).isEqualByComparingTo(new BigDecimal("-1234.5"));
	}

	@Test
	void normalize_stripsCurrencyAndGrouping() {
		assertThat(NumericNormalizer.normalize("₹ 1,20,000")).isEqualByComparingTo(new BigDecimal("120000"));
		assertThat(NumericNormalizer.normalize("$2,500.75")).isEqualByComparingTo(new BigDecimal("2500.75"));
	}

	@Test
	void normalize_dropsUnitSuffixWithoutRescaling() {
		// Known limitation: crore, million and thousand qualifiers are removed, not applied.
		assertThat(NumericNormalizer.normalize("₹45 Cr")).isEqualByComparingTo(new BigDecimal("45"));
		assertThat(NumericNormalizer.normalize("12.5 mn")).isEqualByComparingTo(new BigDecimal("12.5"));
		assertThat(NumericNormalizer.normalize("300K")).isEqualByComparingTo(new BigDecimal("300"));
	}

	@Test
	void normalize_stripsPercentAndMultipleSuffix() {
		assertThat(NumericNormalizer.normalize("18.5%")).isEqualByComparingTo(new BigDecimal("18.5"));
		assertThat(NumericNormalizer.normalize("2.4x")).isEqualByComparingTo(new BigDecimal("2.4"));
	}

	@Test
	void normalize_returnsNullForPlaceholdersAndText() {
		assertThat(NumericNormalizer.normalize(null)).isNull();
		assertThat(NumericNormalizer.normalize("")).isNull();
		assertThat(NumericNormalizer.normalize("  - ")).isNull();
		assertThat(NumericNormalizer.normalize("N/A")).isNull();
		assertThat(NumericNormalizer.normalize("nan")).isNull();
		assertThat(NumericNormalizer.normalize("audited")).isNull();
		assertThat(NumericNormalizer.normalize(Double.NaN)).isNull();
	}

	@Test
	void normalize_acceptsNumericCells() {
		assertThat(NumericNormalizer.normalize(42)).isEqualByComparingTo(new BigDecimal("42"));
		assertThat(NumericNormalizer.normalize(1450.25d)).isEqualByComparingTo(new BigDecimal("1450.25"));
		assertThat(NumericNormalizer.normalize(new BigDecimal("7.10"))).isEqualByComparingTo(new BigDecimal("7.1"));
	}

	@Test
	void normalize_isIdempotentOnItsOwnOutput() {
		for (String raw : new String[]{"(1,234.5)", "₹45 Cr", "18.5%", "1,20,000", "-3.25"}) {
			BigDecimal once = NumericNormalizer.normalize(raw);
			assertThat(NumericNormalizer.normalize(once.toPlainString())).isEqualByComparingTo(once);
		}
	}
}
