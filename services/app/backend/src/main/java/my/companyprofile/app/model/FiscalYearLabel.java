package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical fiscal year token such as {@code FY24} or {@code FY25E}.
 * Two labels are equal iff their two-digit year and estimate flag match.
 */
public record FiscalYearLabel(int twoDigitYear, boolean estimate) {
	public FiscalYearLabel {
		if (twoDigitYear < 0 || twoDigitYear > 99) {
			throw new IllegalArgumentException("Two-digit year out of range: " + twoDigitYear);
		}
	}

	public static FiscalYearLabel ofYear(int fullYear, boolean estimate) {
		return new FiscalYearLabel(Math.floorMod(fullYear, 100), estimate);
	}

	@JsonValue
	public String label() {
		return String.format("FY%02d%s", twoDigitYear, estimate ? "E" : "");
	}

	@Override
	public String toString() {
		return label();
	}
}
