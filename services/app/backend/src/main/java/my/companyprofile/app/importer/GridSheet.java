package my.companyprofile.app.importer;

import java.util.Objects;

/**
 * One named grid of a document: a workbook sheet, or a table found on a report page.
 */
public record GridSheet(String name, Integer page, CellGrid grid) {
	public GridSheet {
		Objects.requireNonNull(grid, "grid");
	}

	public static GridSheet sheet(String name, CellGrid grid) {
		return new GridSheet(name, null, grid);
	}

	public static GridSheet page(int page, CellGrid grid) {
		return new GridSheet(null, page, grid);
	}

	public String location() {
		if (name != null && !name.isBlank()) {
			return name;
		}
		return page == null ? null : "page " + page;
	}
}
