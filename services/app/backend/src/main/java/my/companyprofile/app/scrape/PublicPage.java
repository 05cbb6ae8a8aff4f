package my.companyprofile.app.scrape;

public record PublicPage(String url, String title, String description, String text) {
}
