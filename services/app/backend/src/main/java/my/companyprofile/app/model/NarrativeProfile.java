package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured, non-numeric facts about a company. Every field is optional: {@code null} strings and
 * empty lists mean "not found".
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record NarrativeProfile(
		@JsonProperty("biz_desc") String bizDesc,
		@JsonProperty("website") String website,
		@JsonProperty("products") List<ProductEntry> products,
		@JsonProperty("applications") List<ApplicationEntry> applications,
		@JsonProperty("certifications") List<String> certifications,
		@JsonProperty("assets") List<AssetEntry> assets,
		@JsonProperty("export_markets") List<String> exportMarkets,
		@JsonProperty("customers") List<String> customers,
		@JsonProperty("global_reach") String globalReach,
		@JsonProperty("upcoming_facilities") List<String> upcomingFacilities,
		@JsonProperty("operational_highlights") List<String> operationalHighlights
) {
	public static final String BIZ_DESC = "biz_desc";
	public static final String WEBSITE = "website";
	public static final String PRODUCTS = "products";
	public static final String APPLICATIONS = "applications";
	public static final String CERTIFICATIONS = "certifications";
	public static final String ASSETS = "assets";
	public static final String EXPORT_MARKETS = "export_markets";
	public static final String CUSTOMERS = "customers";
	public static final String GLOBAL_REACH = "global_reach";
	public static final String UPCOMING_FACILITIES = "upcoming_facilities";
	public static final String OPERATIONAL_HIGHLIGHTS = "operational_highlights";

	public NarrativeProfile {
		bizDesc = blankToNull(bizDesc);
		website = blankToNull(website);
		globalReach = blankToNull(globalReach);
		products = copy(products);
		applications = copy(applications);
		certifications = copy(certifications);
		assets = copy(assets);
		exportMarkets = copy(exportMarkets);
		customers = copy(customers);
		upcomingFacilities = copy(upcomingFacilities);
		operationalHighlights = copy(operationalHighlights);
	}

	public static NarrativeProfile empty() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Field value by its JSON name, {@code null} when the field is empty.
	 */
	public Object field(String name) {
		Object value = switch (name) {
			case BIZ_DESC -> bizDesc;
			case WEBSITE -> website;
			case PRODUCTS -> products;
			case APPLICATIONS -> applications;
			case CERTIFICATIONS -> certifications;
			case ASSETS -> assets;
			case EXPORT_MARKETS -> exportMarkets;
			case CUSTOMERS -> customers;
			case GLOBAL_REACH -> globalReach;
			case UPCOMING_FACILITIES -> upcomingFacilities;
			case OPERATIONAL_HIGHLIGHTS -> operationalHighlights;
			default -> throw new IllegalArgumentException("Unknown narrative field: " + name);
		};
		if (value instanceof List<?> list && list.isEmpty()) {
			return null;
		}
		return value;
	}

	@JsonIgnore
	public List<String> extractedFields() {
		List<String> fields = new ArrayList<>();
		for (String name : fieldNames()) {
			if (field(name) != null) {
				fields.add(name);
			}
		}
		return fields;
	}

	@JsonIgnore
	public boolean isComplete() {
		return extractedFields().size() == fieldNames().size();
	}

	public static List<String> fieldNames() {
		return List.of(BIZ_DESC, WEBSITE, PRODUCTS, APPLICATIONS, CERTIFICATIONS, ASSETS, EXPORT_MARKETS,
				CUSTOMERS, GLOBAL_REACH, UPCOMING_FACILITIES, OPERATIONAL_HIGHLIGHTS);
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value;
	}

	private static <T> List<T> copy(List<T> values) {
		return values == null ? List.of() : List.copyOf(values);
	}

	public static final class Builder {
		private String bizDesc;
		private String website;
		private List<ProductEntry> products;
		private List<ApplicationEntry> applications;
		private List<String> certifications;
		private List<AssetEntry> assets;
		private List<String> exportMarkets;
		private List<String> customers;
		private String globalReach;
		private List<String> upcomingFacilities;
		private List<String> operationalHighlights;

		private Builder() {
		}

		public Builder bizDesc(String bizDesc) {
			this.bizDesc = bizDesc;
			return this;
		}

		public Builder website(String website) {
			this.website = website;
			return this;
		}

		public Builder products(List<ProductEntry> products) {
			this.products = products;
			return this;
		}

		public Builder applications(List<ApplicationEntry> applications) {
			this.applications = applications;
			return this;
		}

		public Builder certifications(List<String> certifications) {
			this.certifications = certifications;
			return this;
		}

		public Builder assets(List<AssetEntry> assets) {
			this.assets = assets;
			return this;
		}

		public Builder exportMarkets(List<String> exportMarkets) {
			this.exportMarkets = exportMarkets;
			return this;
		}

		public Builder customers(List<String> customers) {
			this.customers = customers;
			return this;
		}

		public Builder globalReach(String globalReach) {
			this.globalReach = globalReach;
			return this;
		}

		public Builder upcomingFacilities(List<String> upcomingFacilities) {
			this.upcomingFacilities = upcomingFacilities;
			return this;
		}

		public Builder operationalHighlights(List<String> operationalHighlights) {
			this.operationalHighlights = operationalHighlights;
			return this;
		}

		/**
		 * Copies the field named {@code name} from {@code source} into this builder.
		 */
		public Builder copyField(String name, NarrativeProfile source) {
			switch (name) {
				case BIZ_DESC -> bizDesc = source.bizDesc();
				case WEBSITE -> website = source.website();
				case PRODUCTS -> products = source.products();
				case APPLICATIONS -> applications = source.applications();
				case CERTIFICATIONS -> certifications = source.certifications();
				case ASSETS -> assets = source.assets();
				case EXPORT_MARKETS -> exportMarkets = source.exportMarkets();
				case CUSTOMERS -> customers = source.customers();
				case GLOBAL_REACH -> globalReach = source.globalReach();
				case UPCOMING_FACILITIES -> upcomingFacilities = source.upcomingFacilities();
				case OPERATIONAL_HIGHLIGHTS -> operationalHighlights = source.operationalHighlights();
				default -> throw new IllegalArgumentException("Unknown narrative field: " + name);
			}
			return this;
		}

		public NarrativeProfile build() {
			return new NarrativeProfile(bizDesc, website, products, applications, certifications, assets,
					exportMarkets, customers, globalReach, upcomingFacilities, operationalHighlights);
		}
	}
}
