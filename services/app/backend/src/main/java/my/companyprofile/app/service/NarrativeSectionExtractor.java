package my.companyprofile.app.service;

import my.companyprofile.app.config.ExtractionVocabulary;
import my.companyprofile.app.model.ApplicationEntry;
import my.companyprofile.app.model.AssetEntry;
import my.companyprofile.app.model.NarrativeProfile;
import my.companyprofile.app.model.ProductEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link NarrativeProfile} from report text. Sections are located by header phrases followed by a
 * line break; the remaining fields come from patterns over the whole text.
 */
@Service
public class NarrativeSectionExtractor {
	private static final Logger logger = LoggerFactory.getLogger(NarrativeSectionExtractor.class);

	static final int MAX_BIZ_DESC_CHARS = 400;
	static final int BIZ_DESC_SENTENCES = 3;
	static final int FALLBACK_LINE_MIN_CHARS = 100;
	static final int MAX_PRODUCTS = 6;
	static final int MAX_CATEGORY_CHARS = 50;
	static final int MAX_DETAILS_CHARS = 80;
	static final int MAX_APPLICATIONS = 6;
	static final int MAX_INDUSTRY_CHARS = 40;
	static final int MAX_CERTIFICATIONS = 5;
	static final int MAX_ASSETS = 4;
	static final int MAX_MARKETS = 5;
	static final int MAX_CUSTOMERS = 6;
	static final int MAX_OPERATIONAL_BULLETS = 5;
	static final int MAX_BULLET_CHARS = 100;
	static final int REACH_MARKETS = 4;

	private static final String HEADER_END = ")\\s*:?[ \\t]*\\r?\\n";

	enum Section {
		BUSINESS_DESCRIPTION("(?:Business\\s+Description|Company\\s+Overview|About\\s+(?:the\\s+)?Company"),
		PRODUCTS("(?:Products?\\s*(?:&|and)?\\s*Services?|Product\\s+Portfolio|Our\\s+Products"),
		APPLICATIONS("(?:Application\\s+areas?\\s*/?\\s*Industries\\s*served|Application\\s+areas?"
				+ "|Key\\s+Applications?|End\\s+Markets?|Industries?\\s+Served"),
		OPERATIONAL("(?:Key\\s+Operational\\s+Indicators?|Operational\\s+Highlights?|Key\\s+Metrics"),
		WEBSITE("(?:Website|Web");

		private final Pattern header;

		Section(String headerRegex) {
			this.header = Pattern.compile("(?m)^[ \\t]*" + headerRegex + HEADER_END, Pattern.CASE_INSENSITIVE);
		}
	}

	private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
	private static final Pattern URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
	private static final Pattern BULLET = Pattern.compile("^\\s*[•*▪\\-]\\s*(.*)$");
	private static final Pattern BULLET_CHARS = Pattern.compile("[•*▪]");
	private static final Pattern PRODUCT_WITH_PARENS = Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)");
	private static final Pattern PRODUCT_WITH_SEPARATOR = Pattern.compile("^(.+?)\\s*(?::|\\s[-–]\\s)\\s*(.+)$");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final Pattern PLANTS = ci("(\\d+)\\s*(?:plants?|manufacturing\\s+(?:units?|facilities|facility))");
	private static final Pattern FACILITIES = ci("(\\d+)\\s*(?:facilities|facility|factories|factory)\\b");
	private static final Pattern RD_CENTERS =
			ci("(\\d+)\\s*(?:R&D|research|development)\\s*(?:centers?|centres?|labs?|facilities|facility)");
	private static final Pattern EMPLOYEES =
			ci("(\\d[\\d,]*)\\+?\\s*(?:employees?|people|team\\s+members?|staff)\\b");
	private static final Pattern YEARS_IN_BUSINESS = ci("\\bover\\s+(\\d+)\\+?\\s*years?\\b"
			+ "|(\\d+)\\+?\\s*years?\\s+(?:of\\s+)?"
			+ "(?:experience|expertise|legacy|operations|track\\s+record|in\\s+business)");
	private static final Pattern COUNTRIES = ci("(\\d+)\\+?\\s*countries");
	private static final Pattern SUBSIDIARY = ci("subsidiar(?:y|ies)\\s+in\\s+(?:the\\s+)?([A-Za-z]+)");
	private static final Pattern CUSTOMER_LIST =
			ci("(?:customers?|clients?)\\s+(?:include|includes|including|such\\s+as|like)\\s*:?\\s*([^\\n.]+)");
	private static final Pattern MNC_CUSTOMER = ci("(?:new\\s+)?MNC\\s+customers?");
	private static final Pattern EXPORTS_TO =
			ci("export(?:s|ing|ed)?\\s+to\\s+(?:over\\s+|more\\s+than\\s+)?(\\d+)\\+?\\s*countries");
	private static final Pattern FORWARD_LOOKING = ci("\\b(?:upcoming|planned|proposed|new|expansion|capex"
			+ "|under\\s+construction|commissioning)\\b");

	private final List<Pattern> certificationPatterns;
	private final Map<String, Pattern> regionPatterns;

	public NarrativeSectionExtractor(ExtractionVocabulary vocabulary) {
		this.certificationPatterns = vocabulary.certificationPatterns().stream().map(NarrativeSectionExtractor::ci)
				.toList();
		Map<String, Pattern> regions = new LinkedHashMap<>();
		for (String region : vocabulary.exportRegions()) {
			regions.put(region, regionPattern(region, vocabulary.exactCaseRegions().contains(region)));
		}
		this.regionPatterns = regions;
	}

	public NarrativeProfile extract(String text) {
		if (text == null || text.isBlank()) {
			return NarrativeProfile.empty();
		}
		List<String> markets = exportMarkets(text);
		List<String> operationalBullets = operationalBullets(section(text, Section.OPERATIONAL));
		List<String> upcoming = new ArrayList<>();
		List<String> highlights = new ArrayList<>();
		for (String bullet : operationalBullets) {
			if (FORWARD_LOOKING.matcher(bullet).find()) {
				upcoming.add(bullet);
			} else {
				highlights.add(bullet);
			}
		}
		NarrativeProfile profile = NarrativeProfile.builder()
				.bizDesc(businessDescription(text))
				.website(website(text))
				.products(products(section(text, Section.PRODUCTS)))
				.applications(applications(section(text, Section.APPLICATIONS)))
				.certifications(certifications(text))
				.assets(assets(text))
				.exportMarkets(markets)
				.customers(customers(text))
				.globalReach(globalReach(text, markets))
				.upcomingFacilities(upcoming)
				.operationalHighlights(highlights)
				.build();
		logger.debug("Narrative fields found: {}", profile.extractedFields());
		return profile;
	}

	/**
	 * Body of a section: from the end of its header to the start of the nearest later header of any section.
	 * Empty when the header is absent.
	 */
	String section(String text, Section section) {
		Matcher matcher = section.header.matcher(text);
		if (!matcher.find()) {
			return "";
		}
		int start = matcher.end();
		int end = text.length();
		for (Section other : Section.values()) {
			Matcher next = other.header.matcher(text);
			if (next.find(start)) {
				end = Math.min(end, next.start());
			}
		}
		return text.substring(start, end).strip();
	}

	String businessDescription(String text) {
		String body = section(text, Section.BUSINESS_DESCRIPTION);
		if (!body.isEmpty()) {
			String[] sentences = SENTENCE_BREAK.split(body);
			List<String> first = new ArrayList<>();
			for (int i = 0; i < sentences.length && first.size() < BIZ_DESC_SENTENCES; i++) {
				if (!sentences[i].isBlank()) {
					first.add(sentences[i].strip());
				}
			}
			return truncate(collapse(String.join(" ", first)), MAX_BIZ_DESC_CHARS);
		}
		for (String line : text.split("\\r?\\n")) {
			String candidate = line.strip();
			if (candidate.length() > FALLBACK_LINE_MIN_CHARS && !BULLET.matcher(candidate).matches()) {
				return truncate(candidate, MAX_BIZ_DESC_CHARS);
			}
		}
		return null;
	}

	String website(String text) {
		Matcher matcher = URL.matcher(text);
		return matcher.find() ? stripTrailing(matcher.group(), ".,;:") : null;
	}

	List<ProductEntry> products(String body) {
		List<ProductEntry> products = new ArrayList<>();
		if (body.isEmpty()) {
			return products;
		}
		boolean bulletsFound = false;
		for (String line : body.split("\\r?\\n")) {
			Matcher bullet = BULLET.matcher(line);
			if (!bullet.matches()) {
				continue;
			}
			bulletsFound = true;
			if (products.size() >= MAX_PRODUCTS) {
				break;
			}
			String item = bullet.group(1).replace("**", "").strip();
			String category = item;
			String details = "";
			Matcher parens = PRODUCT_WITH_PARENS.matcher(item);
			Matcher separated = PRODUCT_WITH_SEPARATOR.matcher(item);
			if (parens.find()) {
				category = parens.group(1);
				details = parens.group(2);
			} else if (separated.matches()) {
				category = separated.group(1);
				details = separated.group(2);
			}
			category = stripTrailing(category.strip(), ":*").strip();
			if (category.length() > 2) {
				products.add(new ProductEntry(truncate(category, MAX_CATEGORY_CHARS),
						truncate(details.strip(), MAX_DETAILS_CHARS)));
			}
		}
		if (bulletsFound) {
			return products;
		}
		for (String line : body.split("\\r?\\n")) {
			String category = BULLET_CHARS.matcher(line).replaceAll("").strip();
			if (category.length() > 3 && category.length() < 100) {
				products.add(new ProductEntry(truncate(category, MAX_CATEGORY_CHARS), ""));
				if (products.size() >= MAX_PRODUCTS) {
					break;
				}
			}
		}
		return products;
	}

	List<ApplicationEntry> applications(String body) {
		List<ApplicationEntry> applications = new ArrayList<>();
		if (body.isEmpty()) {
			return applications;
		}
		String cleaned = BULLET_CHARS.matcher(body).replaceAll("");
		String[] items = cleaned.contains(",") ? cleaned.split(",") : cleaned.split("\\r?\\n");
		for (String raw : items) {
			String industry = collapse(raw.replaceFirst("^\\s*-\\s*", ""));
			if (industry.length() <= 2) {
				continue;
			}
			int share = Math.max(10, 60 - 10 * applications.size());
			applications.add(new ApplicationEntry(truncate(industry, MAX_INDUSTRY_CHARS), share + "%"));
			if (applications.size() >= MAX_APPLICATIONS) {
				break;
			}
		}
		return applications;
	}

	List<String> certifications(String text) {
		Set<String> found = new LinkedHashSet<>();
		for (Pattern pattern : certificationPatterns) {
			Matcher matcher = pattern.matcher(text);
			while (matcher.find() && found.size() < MAX_CERTIFICATIONS) {
				found.add(collapse(matcher.group()).toUpperCase(Locale.ROOT));
			}
		}
		return new ArrayList<>(found);
	}

	List<AssetEntry> assets(String text) {
		List<AssetEntry> assets = new ArrayList<>();
		String manufacturing = firstGroup(PLANTS, text);
		if (manufacturing == null) {
			manufacturing = firstGroup(FACILITIES, text);
		}
		if (manufacturing != null) {
			assets.add(new AssetEntry("Manufacturing Units", manufacturing));
		}
		String rd = firstGroup(RD_CENTERS, text);
		if (rd != null) {
			assets.add(new AssetEntry("R&D Centers", rd));
		}
		String employees = firstGroup(EMPLOYEES, text);
		if (employees != null) {
			assets.add(new AssetEntry("Employees", employees.replace(",", "") + "+"));
		}
		String years = firstGroup(YEARS_IN_BUSINESS, text);
		if (years != null) {
			assets.add(new AssetEntry("Years in Business", years + "+"));
		}
		String countries = firstGroup(COUNTRIES, text);
		if (countries != null) {
			assets.add(new AssetEntry("Countries Presence", countries + "+"));
		}
		return assets.size() > MAX_ASSETS ? new ArrayList<>(assets.subList(0, MAX_ASSETS)) : assets;
	}

	List<String> exportMarkets(String text) {
		List<String> markets = new ArrayList<>();
		for (Map.Entry<String, Pattern> region : regionPatterns.entrySet()) {
			if (markets.size() >= MAX_MARKETS) {
				return markets;
			}
			if (region.getValue().matcher(text).find()) {
				markets.add(region.getKey());
			}
		}
		Matcher subsidiary = SUBSIDIARY.matcher(text);
		while (subsidiary.find() && markets.size() < MAX_MARKETS) {
			String country = titleCase(subsidiary.group(1));
			if (markets.stream().noneMatch(market -> market.equalsIgnoreCase(country))) {
				markets.add(country);
			}
		}
		return markets;
	}

	List<String> customers(String text) {
		List<String> customers = new ArrayList<>();
		Matcher list = CUSTOMER_LIST.matcher(text);
		if (list.find()) {
			for (String raw : list.group(1).split(",")) {
				String customer = collapse(raw.replaceFirst("(?i)^\\s*and\\s+", ""));
				if (customer.length() > 2) {
					customers.add(customer);
					if (customers.size() >= MAX_CUSTOMERS) {
						break;
					}
				}
			}
		}
		if (customers.isEmpty() && MNC_CUSTOMER.matcher(text).find()) {
			customers.add("Major MNC Customer");
		}
		return customers;
	}

	String globalReach(String text, List<String> markets) {
		Matcher matcher = EXPORTS_TO.matcher(text);
		if (!matcher.find()) {
			return null;
		}
		StringBuilder reach = new StringBuilder("Exports to ").append(matcher.group(1)).append("+ countries");
		if (!markets.isEmpty()) {
			reach.append(" including ")
					.append(String.join(", ", markets.subList(0, Math.min(REACH_MARKETS, markets.size()))));
		}
		return reach.toString();
	}

	List<String> operationalBullets(String body) {
		List<String> bullets = new ArrayList<>();
		if (body.isEmpty()) {
			return bullets;
		}
		for (String line : body.split("\\r?\\n")) {
			Matcher bullet = BULLET.matcher(line);
			if (!bullet.matches()) {
				continue;
			}
			String item = collapse(bullet.group(1).replace("**", ""));
			int colon = item.indexOf(':');
			if (colon > 0) {
				String title = item.substring(0, colon).strip();
				String details = item.substring(colon + 1).strip();
				item = details.isEmpty() ? title : title + ": " + details;
			}
			if (!item.isEmpty()) {
				bullets.add(truncate(item, MAX_BULLET_CHARS));
			}
			if (bullets.size() >= MAX_OPERATIONAL_BULLETS) {
				break;
			}
		}
		return bullets;
	}

	private static Pattern regionPattern(String region, boolean exactCase) {
		String regex = "(?<![A-Za-z])" + Pattern.quote(region) + "(?![A-Za-z])";
		return exactCase ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

	/**
	 * First non-null capture group of the first match.
	 */
	private static String firstGroup(Pattern pattern, String text) {
		Matcher matcher = pattern.matcher(text);
		if (!matcher.find()) {
			return null;
		}
		for (int group = 1; group <= matcher.groupCount(); group++) {
			if (matcher.group(group) != null) {
				return matcher.group(group);
			}
		}
		return null;
	}

	private static String titleCase(String word) {
		if (word.equals(word.toUpperCase(Locale.ROOT))) {
			return word;
		}
		return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
	}

	private static String collapse(String value) {
		return WHITESPACE.matcher(value).replaceAll(" ").strip();
	}

	private static String stripTrailing(String value, String chars) {
		int end = value.length();
		while (end > 0 && chars.indexOf(value.charAt(end - 1)) >= 0) {
			end--;
		}
		return value.substring(0, end);
	}

	private static String truncate(String value, int maxChars) {
		return value.length() <= maxChars ? value : value.substring(0, maxChars).strip();
	}

	private static Pattern ci(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}
}
