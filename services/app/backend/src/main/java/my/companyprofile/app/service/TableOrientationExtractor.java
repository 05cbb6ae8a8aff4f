package my.companyprofile.app.service;

import my.companyprofile.app.config.ExtractionVocabulary;
import my.companyprofile.app.importer.CellGrid;
import my.companyprofile.app.importer.GridSheet;
import my.companyprofile.app.model.FinancialTable;
import my.companyprofile.app.model.FiscalYearLabel;
import my.companyprofile.app.model.MetricKind;
import my.companyprofile.app.model.MetricSeries;
import my.companyprofile.app.model.Provenance;
import my.companyprofile.app.model.TableOrientation;
import my.companyprofile.app.util.NumericNormalizer;
import my.companyprofile.app.util.YearLabelResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recovers revenue/EBITDA/PAT series from an unlabeled grid.
 * <p>
 * Horizontal layouts (years across columns, metrics down rows) are tried first, then vertical layouts
 * (years down a column, metrics across a header row). Year columns of a horizontal layout keep their
 * column order, so a sheet authored right-to-left yields a right-to-left series. Absent cells read as
 * zero; their positions are kept in the series provenance.
 */
@Service
public class TableOrientationExtractor {
	private static final Logger logger = LoggerFactory.getLogger(TableOrientationExtractor.class);

	static final int HORIZONTAL_YEAR_SCAN_ROWS = 10;
	static final int HORIZONTAL_LABEL_COLUMNS = 3;
	static final int VERTICAL_HEADER_SCAN_ROWS = 5;
	static final int MIN_YEAR_LABELS = 2;

	private final List<ExtractionVocabulary.MetricVocabulary> metricVocabularies;

	public TableOrientationExtractor(ExtractionVocabulary vocabulary) {
		this.metricVocabularies = vocabulary.metrics();
	}

	/**
	 * Scans sheets in order and returns the first one that yields financial data.
	 */
	public Optional<FinancialTable> extractWorkbook(String sourceFile, List<GridSheet> sheets) {
		if (sheets == null) {
			return Optional.empty();
		}
		for (GridSheet sheet : sheets) {
			if (sheet.grid().isEmpty()) {
				continue;
			}
			Optional<FinancialTable> table = extract(sheet.grid(), sourceFile, sheet.location());
			if (table.isPresent()) {
				logger.debug("Financial table found in {} ({}, orientation={}).", sourceFile, sheet.location(),
						table.get().orientation());
				return table;
			}
			logger.debug("No financial table in {} ({}).", sourceFile, sheet.location());
		}
		return Optional.empty();
	}

	public Optional<FinancialTable> extract(CellGrid grid, String sourceFile, String sheet) {
		if (grid == null || grid.isEmpty()) {
			return Optional.empty();
		}
		return parseHorizontal(grid, sourceFile, sheet)
				.or(() -> parseVertical(grid, sourceFile, sheet));
	}

	Optional<FinancialTable> parseHorizontal(CellGrid grid, String sourceFile, String sheet) {
		List<YearPosition> yearColumns = new ArrayList<>();
		Set<FiscalYearLabel> seen = new HashSet<>();
		int scanRows = Math.min(HORIZONTAL_YEAR_SCAN_ROWS, grid.rowCount());
		for (int r = 0; r < scanRows; r++) {
			for (int c = 0; c < grid.columnCount(); c++) {
				Optional<FiscalYearLabel> label = YearLabelResolver.resolve(grid.get(r, c));
				if (label.isPresent() && seen.add(label.get())) {
					yearColumns.add(new YearPosition(c, label.get()));
				}
			}
		}
		if (yearColumns.size() < MIN_YEAR_LABELS) {
			return Optional.empty();
		}
		yearColumns.sort(Comparator.comparingInt(YearPosition::index));
		List<FiscalYearLabel> years = yearColumns.stream().map(YearPosition::label).toList();

		Map<MetricKind, MetricSeries> accepted = new EnumMap<>(MetricKind.class);
		for (int r = 0; r < grid.rowCount(); r++) {
			Optional<MetricKind> metric = classify(rowLabel(grid, r));
			if (metric.isEmpty() || accepted.containsKey(metric.get())) {
				continue;
			}
			List<BigDecimal> values = new ArrayList<>(yearColumns.size());
			List<Integer> absent = new ArrayList<>();
			for (YearPosition yearColumn : yearColumns) {
				addValue(values, absent, grid.get(r, yearColumn.index()));
			}
			MetricSeries series = new MetricSeries(metric.get(), years, values,
					new Provenance(sourceFile, sheet, r, metric.get().key(), absent));
			if (series.hasNonZeroValue()) {
				accepted.put(metric.get(), series);
			}
		}
		if (!hasHeadlineMetric(accepted)) {
			return Optional.empty();
		}
		return Optional.of(new FinancialTable(years, accepted, TableOrientation.HORIZONTAL));
	}

	Optional<FinancialTable> parseVertical(CellGrid grid, String sourceFile, String sheet) {
		int yearColumn = findYearColumn(grid);
		if (yearColumn < 0) {
			return Optional.empty();
		}
		List<YearPosition> yearRows = new ArrayList<>();
		for (int r = 0; r < grid.rowCount(); r++) {
			Optional<FiscalYearLabel> label = YearLabelResolver.resolve(grid.get(r, yearColumn));
			if (label.isPresent()) {
				yearRows.add(new YearPosition(r, label.get()));
			}
		}
		if (yearRows.size() < MIN_YEAR_LABELS) {
			return Optional.empty();
		}
		List<FiscalYearLabel> years = yearRows.stream().map(YearPosition::label).toList();

		// later matches in row-major order replace earlier ones
		Map<MetricKind, Integer> columnMap = new EnumMap<>(MetricKind.class);
		int headerRows = Math.min(VERTICAL_HEADER_SCAN_ROWS, grid.rowCount());
		for (int r = 0; r < headerRows; r++) {
			for (int c = 0; c < grid.columnCount(); c++) {
				if (c == yearColumn) {
					continue;
				}
				int column = c;
				classify(grid.text(r, c).toLowerCase(Locale.ROOT))
						.ifPresent(metric -> columnMap.put(metric, column));
			}
		}
		if (!columnMap.containsKey(MetricKind.REVENUE) && !columnMap.containsKey(MetricKind.EBITDA)) {
			return Optional.empty();
		}

		Map<MetricKind, MetricSeries> series = new EnumMap<>(MetricKind.class);
		for (Map.Entry<MetricKind, Integer> entry : columnMap.entrySet()) {
			List<BigDecimal> values = new ArrayList<>(yearRows.size());
			List<Integer> absent = new ArrayList<>();
			for (YearPosition yearRow : yearRows) {
				addValue(values, absent, grid.get(yearRow.index(), entry.getValue()));
			}
			series.put(entry.getKey(), new MetricSeries(entry.getKey(), years, values,
					new Provenance(sourceFile, sheet, entry.getValue(), entry.getKey().key(), absent)));
		}
		return Optional.of(new FinancialTable(years, series, TableOrientation.VERTICAL));
	}

	/**
	 * First metric whose vocabulary matches, in configured priority order.
	 */
	Optional<MetricKind> classify(String lowerText) {
		if (lowerText == null || lowerText.isBlank()) {
			return Optional.empty();
		}
		for (ExtractionVocabulary.MetricVocabulary vocabulary : metricVocabularies) {
			if (vocabulary.matches(lowerText)) {
				return Optional.of(vocabulary.metric());
			}
		}
		return Optional.empty();
	}

	private int findYearColumn(CellGrid grid) {
		for (int c = 0; c < grid.columnCount(); c++) {
			int matches = 0;
			for (int r = 0; r < grid.rowCount(); r++) {
				if (YearLabelResolver.looksLikeYear(grid.get(r, c))) {
					matches++;
				}
			}
			if (matches >= MIN_YEAR_LABELS) {
				return c;
			}
		}
		return -1;
	}

	private static void addValue(List<BigDecimal> values, List<Integer> absent, Object cell) {
		BigDecimal value = NumericNormalizer.normalize(cell);
		if (value == null) {
			absent.add(values.size());
			value = BigDecimal.ZERO;
		}
		values.add(value);
	}

	private String rowLabel(CellGrid grid, int row) {
		int columns = Math.min(HORIZONTAL_LABEL_COLUMNS, grid.columnCount());
		List<String> parts = new ArrayList<>(columns);
		for (int c = 0; c < columns; c++) {
			parts.add(grid.text(row, c));
		}
		return String.join(" ", parts).toLowerCase(Locale.ROOT);
	}

	private boolean hasHeadlineMetric(Map<MetricKind, MetricSeries> series) {
		return series.containsKey(MetricKind.REVENUE) || series.containsKey(MetricKind.EBITDA);
	}

	private record YearPosition(int index, FiscalYearLabel label) {
	}
}
