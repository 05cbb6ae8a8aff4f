package my.companyprofile.app.util;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw cell value into a number, or {@code null} when the cell is absent or unreadable.
 * <p>
 * A trailing unit qualifier (crore, lakh, mn, k, bn, ...) is removed textually but the magnitude is
 * <b>not</b> rescaled: {@code "45 Cr"} and {@code "45 mn"} both normalize to {@code 45}.
 */
public final class NumericNormalizer {
	private static final Set<String> PLACEHOLDERS = Set.of("", "-", "nan", "none", "null", "n/a", "na");
	private static final Pattern CURRENCY_AND_GROUPING = Pattern.compile("[₹$€£,]");
	private static final Pattern UNIT_SUFFIX = Pattern.compile(
			"\\s*(?:cr|crores?|lakhs?|lacs?|mn|m|k|billion|bn)\\s*$", Pattern.CASE_INSENSITIVE);
	private static final Pattern RATIO_SUFFIX = Pattern.compile("[%x]$");

	private NumericNormalizer() {
	}

	public static BigDecimal normalize(Object raw) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof Number number) {
			return fromNumber(number);
		}
		String value = raw.toString().trim();
		if (PLACEHOLDERS.contains(value.toLowerCase(Locale.ROOT))) {
			return null;
		}
		value = CURRENCY_AND_GROUPING.matcher(value).replaceAll("");
		value = UNIT_SUFFIX.matcher(value).replaceFirst("");

		boolean negative = false;
		if (value.length() >= 2 && value.startsWith("(") && value.endsWith(")")) {
			negative = true;
			value = value.substring(1, value.length() - 1);
		}
		value = RATIO_SUFFIX.matcher(value).replaceFirst("").trim();
		if (value.isEmpty()) {
			return null;
		}
		try {
			BigDecimal number = new BigDecimal(value);
			return negative ? number.negate() : number;
		} catch (NumberFormatException exc) {
			return null;
		}
	}

	private static BigDecimal fromNumber(Number number) {
		if (number instanceof BigDecimal decimal) {
			return decimal;
		}
		if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
			return BigDecimal.valueOf(number.longValue());
		}
		double value = number.doubleValue();
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return null;
		}
		return BigDecimal.valueOf(value);
	}
}
