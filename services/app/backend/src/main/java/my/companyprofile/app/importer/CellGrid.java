package my.companyprofile.app.importer;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable 2-D array of raw cell values ({@link String}, {@link Number} or {@code null}).
 * Rows may be ragged; reads outside a row return {@code null}.
 */
public final class CellGrid {
	private final Object[][] cells;
	private final int columnCount;

	private CellGrid(Object[][] cells) {
		this.cells = cells;
		int width = 0;
		for (Object[] row : cells) {
			width = Math.max(width, row.length);
		}
		this.columnCount = width;
	}

	public static CellGrid of(List<? extends List<?>> rows) {
		if (rows == null) {
			return new CellGrid(new Object[0][]);
		}
		Object[][] copy = new Object[rows.size()][];
		for (int r = 0; r < rows.size(); r++) {
			List<?> row = rows.get(r);
			copy[r] = row == null ? new Object[0] : row.toArray();
		}
		return new CellGrid(copy);
	}

	public static CellGrid of(Object[][] rows) {
		if (rows == null) {
			return new CellGrid(new Object[0][]);
		}
		Object[][] copy = new Object[rows.length][];
		for (int r = 0; r < rows.length; r++) {
			copy[r] = rows[r] == null ? new Object[0] : Arrays.copyOf(rows[r], rows[r].length);
		}
		return new CellGrid(copy);
	}

	public int rowCount() {
		return cells.length;
	}

	public int columnCount() {
		return columnCount;
	}

	public boolean isEmpty() {
		return cells.length == 0 || columnCount == 0;
	}

	public Object get(int row, int column) {
		if (row < 0 || row >= cells.length) {
			return null;
		}
		Object[] values = cells[row];
		if (column < 0 || column >= values.length) {
			return null;
		}
		return values[column];
	}

	public String text(int row, int column) {
		return cellText(get(row, column));
	}

	/**
	 * String form of a raw cell. Integral numbers lose their fractional zeros, so a workbook year
	 * stored as {@code 2023.0} reads as {@code "2023"}.
	 */
	public static String cellText(Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof BigDecimal decimal) {
			return plain(decimal);
		}
		if (value instanceof Double || value instanceof Float) {
			double number = ((Number) value).doubleValue();
			if (Double.isNaN(number) || Double.isInfinite(number)) {
				return String.valueOf(number);
			}
			return plain(BigDecimal.valueOf(number));
		}
		return String.valueOf(value).trim();
	}

	private static String plain(BigDecimal decimal) {
		if (decimal.signum() == 0) {
			return "0";
		}
		return decimal.stripTrailingZeros().toPlainString();
	}
}
