package my.companyprofile.app.util;

import my.companyprofile.app.importer.CellGrid;
import my.companyprofile.app.model.FiscalYearLabel;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves fiscal year labels from raw cells: {@code 2023}, {@code FY2024}, {@code FY24},
 * {@code 2025E}, {@code FY26 est}. The first year in the cell wins. Decimals such as {@code 2019.5} are
 * amounts, not years.
 */
public final class YearLabelResolver {
	private static final Pattern YEAR = Pattern.compile(
			"(?<![\\d.])(?:FY\\s?)?((?:19|20)\\d{2})(?!\\.?\\d)|FY\\s?'?(\\d{2})(?!\\.?\\d)",
			Pattern.CASE_INSENSITIVE
	);
	private static final Pattern ESTIMATE_MARKER = Pattern.compile("^\\s*[-(]?\\s*(?:e|est)\\b",
			Pattern.CASE_INSENSITIVE);

	private YearLabelResolver() {
	}

	public static Optional<FiscalYearLabel> resolve(Object raw) {
		String text = CellGrid.cellText(raw);
		if (text.isEmpty()) {
			return Optional.empty();
		}
		Matcher matcher = YEAR.matcher(text);
		if (!matcher.find()) {
			return Optional.empty();
		}
		int year;
		if (matcher.group(1) != null) {
			year = Integer.parseInt(matcher.group(1));
		} else {
			year = 2000 + Integer.parseInt(matcher.group(2));
		}
		boolean estimate = ESTIMATE_MARKER.matcher(text.substring(matcher.end())).find();
		return Optional.of(FiscalYearLabel.ofYear(year, estimate));
	}

	public static boolean looksLikeYear(Object raw) {
		return resolve(raw).isPresent();
	}
}
