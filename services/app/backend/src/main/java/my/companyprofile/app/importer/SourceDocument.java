package my.companyprofile.app.importer;

import my.companyprofile.app.model.DocumentOrigin;

import java.util.List;

/**
 * A decoded document as supplied by the storage or scraping collaborator.
 * {@code decodeError} is set when the container could not be decoded.
 */
public record SourceDocument(
		String fileName,
		DocumentOrigin origin,
		List<GridSheet> sheets,
		String text,
		String decodeError
) {
	public SourceDocument {
		fileName = fileName == null ? "" : fileName;
		origin = origin == null ? DocumentOrigin.PRIVATE_FILE : origin;
		sheets = sheets == null ? List.of() : List.copyOf(sheets);
	}

	public static SourceDocument workbook(String fileName, List<GridSheet> sheets) {
		return new SourceDocument(fileName, DocumentOrigin.PRIVATE_FILE, sheets, null, null);
	}

	public static SourceDocument report(String fileName, String text, List<GridSheet> tables) {
		return new SourceDocument(fileName, DocumentOrigin.PRIVATE_FILE, tables, text, null);
	}

	public static SourceDocument publicPage(String url, String text) {
		return new SourceDocument(url, DocumentOrigin.PUBLIC_URL, List.of(), text, null);
	}

	public static SourceDocument failed(String fileName, String decodeError) {
		return new SourceDocument(fileName, DocumentOrigin.PRIVATE_FILE, List.of(), null, decodeError);
	}

	public boolean hasText() {
		return text != null && !text.isBlank();
	}

	public boolean hasContent() {
		return hasText() || sheets.stream().anyMatch(sheet -> !sheet.grid().isEmpty());
	}

	public SourceDocument withText(String replacement) {
		return new SourceDocument(fileName, origin, sheets, replacement, decodeError);
	}
}
