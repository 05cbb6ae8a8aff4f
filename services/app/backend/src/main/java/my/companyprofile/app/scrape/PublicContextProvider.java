package my.companyprofile.app.scrape;

import java.util.List;

/**
 * Scraping collaborator supplying public page text about a company.
 */
public interface PublicContextProvider {
	List<PublicPage> gatherPublicContext(String companyName, String website);
}
