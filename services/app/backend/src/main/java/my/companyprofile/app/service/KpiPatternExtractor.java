package my.companyprofile.app.service;

import my.companyprofile.app.model.KpiMap;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls headline KPIs and yes/no flags out of free text with fixed patterns. The first match of each
 * pattern wins.
 */
@Service
public class KpiPatternExtractor {
	private static final String SEPARATOR = "\\s*[:\\-]?\\s*";
	private static final String PERCENT = "~?\\s*(\\d{1,3}(?:\\.\\d{1,2})?\\s*%)";

	private static final Map<String, Pattern> METRIC_PATTERNS = new LinkedHashMap<>();
	private static final Map<String, Pattern> FLAG_PATTERNS = new LinkedHashMap<>();

	static {
		METRIC_PATTERNS.put(KpiMap.EBITDA_MARGIN, compile("EBITDA\\s*Margin" + SEPARATOR + PERCENT));
		METRIC_PATTERNS.put(KpiMap.PAT_MARGIN, compile("(?:PAT|Net\\s+Profit)\\s*Margin" + SEPARATOR + PERCENT));
		METRIC_PATTERNS.put(KpiMap.ROE, compile("\\bRo[EA]\\b" + SEPARATOR + PERCENT));
		METRIC_PATTERNS.put(KpiMap.ROCE, compile("\\bRoCE\\b" + SEPARATOR + PERCENT));
		METRIC_PATTERNS.put(KpiMap.REVENUE_CAGR, compile("Revenue\\s*CAGR" + SEPARATOR + PERCENT));
		METRIC_PATTERNS.put(KpiMap.EMPLOYEES,
				compile("\\b(?:Employees?|Headcount|Team\\s+Size)" + SEPARATOR + "(\\d[\\d,]*\\+?)"));
		METRIC_PATTERNS.put(KpiMap.FACILITIES,
				compile("\\b(?:Facilities|Facility|Plants?|Units?)" + SEPARATOR + "(\\d+)"));
		METRIC_PATTERNS.put(KpiMap.COUNTRIES, compile("\\b(?:Countries|Markets)" + SEPARATOR + "(\\d+\\+?)"));
		METRIC_PATTERNS.put(KpiMap.CUSTOMERS,
				compile("\\b(?:Customers?|Clients?)" + SEPARATOR + "(\\d[\\d,]*\\+?)"));

		FLAG_PATTERNS.put(KpiMap.ZERO_DEBT, compile("\\bzero\\s+debt\\b|\\bdebt[\\s-]free\\b"));
		FLAG_PATTERNS.put(KpiMap.PROFITABLE, compile("\\bprofitable\\b|\\bprofit\\s+making\\b"));
		FLAG_PATTERNS.put(KpiMap.ISO_CERTIFIED, compile("\\bISO\\s*\\d{4,5}\\b"));
		FLAG_PATTERNS.put(KpiMap.WHO_GMP, compile("\\bWHO[\\-\\s]?GMP\\b"));
		FLAG_PATTERNS.put(KpiMap.FDA_APPROVED, compile("\\b(?:US\\s*)?FDA[\\-\\s]*(?:approved|approval)\\b"));
	}

	public KpiMap extract(String text) {
		Map<String, String> metrics = new LinkedHashMap<>();
		Map<String, Boolean> flags = new LinkedHashMap<>();
		String source = text == null ? "" : text;
		for (Map.Entry<String, Pattern> entry : METRIC_PATTERNS.entrySet()) {
			Matcher matcher = entry.getValue().matcher(source);
			if (matcher.find()) {
				String value = cleanValue(matcher.group(1));
				if (!value.isEmpty()) {
					metrics.put(entry.getKey(), value);
				}
			}
		}
		for (Map.Entry<String, Pattern> entry : FLAG_PATTERNS.entrySet()) {
			flags.put(entry.getKey(), entry.getValue().matcher(source).find());
		}
		return new KpiMap(metrics, flags);
	}

	static String cleanValue(String raw) {
		String value = raw.replaceAll("\\s+", "");
		while (value.endsWith(",")) {
			value = value.substring(0, value.length() - 1);
		}
		return value;
	}

	private static Pattern compile(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}
}
