package my.companyprofile.app.importer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads CSV text into a {@link CellGrid}. Cells stay raw strings; empty cells become {@code null}.
 * Store implementations use {@link #readDocument(String, byte[])} to turn CSV uploads into documents.
 */
@Component
public class CsvGridReader {
	/**
	 * One-sheet workbook for a CSV upload, or a failed document when the payload cannot be parsed.
	 */
	public SourceDocument readDocument(String fileName, byte[] payload) {
		try {
			return SourceDocument.workbook(fileName, List.of(GridSheet.sheet(sheetName(fileName), read(payload))));
		} catch (IllegalArgumentException exc) {
			return SourceDocument.failed(fileName, exc.getMessage());
		}
	}

	public CellGrid read(byte[] payload) {
		return read(decode(payload));
	}

	public CellGrid read(String content) {
		String body = stripBom(content == null ? "" : content);
		List<List<Object>> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(body),
				CSVFormat.DEFAULT.withDelimiter(sniffDelimiter(firstLine(body))).withIgnoreEmptyLines(false)
		)) {
			for (CSVRecord record : parser) {
				List<Object> row = new ArrayList<>(record.size());
				for (String value : record) {
					String trimmed = value == null ? "" : value.trim();
					row.add(trimmed.isEmpty() ? null : trimmed);
				}
				rows.add(row);
			}
		} catch (IOException | UncheckedIOException | IllegalStateException exc) {
			throw new IllegalArgumentException("Failed to read CSV grid: " + exc.getMessage(), exc);
		}
		return CellGrid.of(rows);
	}

	private String decode(byte[] payload) {
		if (payload == null) {
			return "";
		}
		try {
			return StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(payload))
					.toString();
		} catch (CharacterCodingException exc) {
			return new String(payload, StandardCharsets.ISO_8859_1);
		}
	}

	private String stripBom(String value) {
		if (!value.isEmpty() && value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	private String sheetName(String fileName) {
		if (fileName == null) {
			return null;
		}
		int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
		String name = fileName.substring(slash + 1);
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private String firstLine(String content) {
		int end = content.indexOf('\n');
		return end < 0 ? content : content.substring(0, end);
	}

	char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		if (sample.indexOf(';') >= 0) {
			return ';';
		}
		if (sample.indexOf('\t') >= 0 && sample.indexOf(',') < 0) {
			return '\t';
		}
		return ',';
	}
}
