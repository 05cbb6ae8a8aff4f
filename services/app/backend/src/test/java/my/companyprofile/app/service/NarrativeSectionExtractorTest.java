package my.companyprofile.app.service;

import my.companyprofile.app.model.ApplicationEntry;
import my.companyprofile.app.model.AssetEntry;
import my.companyprofile.app.model.NarrativeProfile;
import my.companyprofile.app.model.ProductEntry;
import my.companyprofile.app.support.TestVocabulary;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;

class NarrativeSectionExtractorTest {
	private static String report;

	private final NarrativeSectionExtractor extractor = new NarrativeSectionExtractor(TestVocabulary.load());

	@BeforeAll
	static void loadReport() throws IOException {
		try (InputStream in = Objects.requireNonNull(
				NarrativeSectionExtractorTest.class.getResourceAsStream("/text/company-report.txt"))) {
			report = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@Test
	void businessDescriptionTakesFirstThreeSentencesOfSection() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.bizDesc()).isEqualTo("Acme Polymers is a specialty chemical manufacturer serving industrial "
				+ "customers. The company produces polymer additives and surfactant blends. It was founded in 1998 in "
				+ "Pune!");
	}

	@Test
	void businessDescriptionFallsBackToFirstLongLine() {
		String text = "• a bullet that is long enough to qualify but starts with a marker and so it must be ignored here\n"
				+ "Acme Polymers manufactures polymer additives for packaging, automotive and textile customers across "
				+ "three continents.\n";

		NarrativeProfile profile = extractor.extract(text);

		assertThat(profile.bizDesc()).startsWith("Acme Polymers manufactures polymer additives");
	}

	@Test
	void websiteDropsTrailingPunctuation() {
		assertThat(extractor.extract(report).website()).isEqualTo("https://www.acmepolymers.example.com");
	}

	@Test
	void websiteIsFirstUrlAnywhereInText() {
		String text = "Press kit at http://press.example.org, more below.\nWebsite\nhttps://acme.example.com\n";

		assertThat(extractor.extract(text).website()).isEqualTo("http://press.example.org");
	}

	@Test
	void productsSplitCategoryAndDetails() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.products()).containsExactly(
				new ProductEntry("Polymer Additives", "UV stabilisers, antioxidants"),
				new ProductEntry("Surfactants", "nonionic and anionic blends"),
				new ProductEntry("Custom Synthesis", ""));
	}

	@Test
	void productsWithoutBulletsUseLinesAsCategories() {
		String text = "Our Products\nPressure Valves\nFlow Meters\nok\n";

		NarrativeProfile profile = extractor.extract(text);

		assertThat(profile.products()).extracting(ProductEntry::category)
				.containsExactly("Pressure Valves", "Flow Meters");
	}

	@Test
	void fallbackProductCategoriesAreTruncated() {
		String line = "Industrial pressure relief valves for petrochemical and refinery service";
		String text = "Our Products\n" + line + "\n";

		NarrativeProfile profile = extractor.extract(text);

		assertThat(profile.products()).singleElement()
				.satisfies(product -> assertThat(product.category())
						.hasSizeLessThanOrEqualTo(NarrativeSectionExtractor.MAX_CATEGORY_CHARS)
						.isEqualTo(line.substring(0, NarrativeSectionExtractor.MAX_CATEGORY_CHARS).strip()));
	}

	@Test
	void applicationsGetDecreasingIllustrativeShares() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.applications()).containsExactly(
				new ApplicationEntry("Automotive", "60%"),
				new ApplicationEntry("Packaging", "50%"),
				new ApplicationEntry("Agrochemicals", "40%"),
				new ApplicationEntry("Textiles", "30%"));
	}

	@Test
	void applicationSharesAreFlooredAtTenPercent() {
		String text = "Key Applications\nA1 one\nB2 two\nC3 three\nD4 four\nE5 five\nF6 six\nG7 seven\n";

		NarrativeProfile profile = extractor.extract(text);

		assertThat(profile.applications()).hasSize(6);
		assertThat(profile.applications()).extracting(ApplicationEntry::share)
				.containsExactly("60%", "50%", "40%", "30%", "20%", "10%");
	}

	@Test
	void certificationsAreUppercasedAndDeduplicated() {
		String text = "Certified to iso 9001 and ISO  9001. Plant is WHO GMP compliant and holds REACH registration. "
				+ "We reach customers in the GDP era of gdp growth.";

		NarrativeProfile profile = extractor.extract(text);

		assertThat(profile.certifications()).containsExactly("ISO 9001", "WHO GMP", "GDP", "REACH");
	}

	@Test
	void assetsFollowFixedOrderAndCap() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.assets()).containsExactly(
				new AssetEntry("Manufacturing Units", "3"),
				new AssetEntry("R&D Centers", "2"),
				new AssetEntry("Employees", "450+"),
				new AssetEntry("Years in Business", "25+"));
	}

	@Test
	void yearsInBusinessAcceptsOverPrefix() {
		assertThat(extractor.extract("Acme has over 25 years in specialty chemicals.").assets())
				.containsExactly(new AssetEntry("Years in Business", "25+"));
		assertThat(extractor.extract("A legacy of over 25 years.").assets())
				.containsExactly(new AssetEntry("Years in Business", "25+"));
	}

	@Test
	void yearsInBusinessNeedsAQualifier() {
		NarrativeProfile profile = extractor.extract("Revenue grew 3 years in a row.");

		assertThat(profile.assets()).isEmpty();
	}

	@Test
	void exportMarketsMatchWholeWords() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.exportMarkets()).containsExactly("USA", "Europe", "Middle East", "Germany");
	}

	@Test
	void exportMarketsIgnoreCase() {
		NarrativeProfile profile = extractor.extract("We export to the usa and uk, plus the gcc region.");

		assertThat(profile.exportMarkets()).containsExactly("USA", "UK", "GCC");
	}

	@Test
	void seaCountsOnlyAsAcronym() {
		assertThat(extractor.extract("Shipments go by sea to our buyers.").exportMarkets()).isEmpty();
		assertThat(extractor.extract("Growing demand in SEA markets.").exportMarkets()).containsExactly("SEA");
	}

	@Test
	void exportMarketsIncludeSubsidiaryCountries() {
		NarrativeProfile profile = extractor.extract("The group set up a subsidiary in kenya last year.");

		assertThat(profile.exportMarkets()).containsExactly("Kenya");
	}

	@Test
	void globalReachIsBuiltOnlyFromStatedCount() {
		assertThat(extractor.extract(report).globalReach())
				.isEqualTo("Exports to 30+ countries including USA, Europe, Middle East, Germany");
		assertThat(extractor.extract("Strong presence in Europe and Asia.").globalReach()).isNull();
	}

	@Test
	void customersComeFromStatedList() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.customers()).containsExactly("BASF", "Asian Paints", "Pidilite");
	}

	@Test
	void mncCustomerMentionProducesPlaceholder() {
		NarrativeProfile profile = extractor.extract("Onboarded a new MNC customer in Q3.");

		assertThat(profile.customers()).containsExactly("Major MNC Customer");
	}

	@Test
	void operationalBulletsAreSplitByForwardLookingKeywords() {
		NarrativeProfile profile = extractor.extract(report);

		assertThat(profile.upcomingFacilities()).containsExactly("New plant at Dahej under construction");
		assertThat(profile.operationalHighlights()).containsExactly("Capacity utilisation: 78%", "Export share: 42%");
	}

	@Test
	void emptyTextYieldsEmptyProfile() {
		assertThat(extractor.extract("   ").extractedFields()).isEmpty();
		assertThat(extractor.extract(null).extractedFields()).isEmpty();
	}
}
