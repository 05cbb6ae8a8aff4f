package my.companyprofile.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pointer back to where a value was read. {@code absentPositions} lists the value positions whose
 * cell was empty or a placeholder; those values are stored as zero.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Provenance(
		@JsonProperty("source_file") String sourceFile,
		@JsonProperty("sheet_or_page") String sheetOrPage,
		@JsonProperty("row_or_col") Integer rowOrCol,
		@JsonProperty("metric") String metric,
		@JsonProperty("absent_positions") List<Integer> absentPositions
) {
	public Provenance {
		absentPositions = absentPositions == null ? List.of() : List.copyOf(absentPositions);
	}

	public Provenance(String sourceFile, String sheetOrPage, Integer rowOrCol, String metric) {
		this(sourceFile, sheetOrPage, rowOrCol, metric, List.of());
	}

	@JsonIgnore
	public boolean isAbsent(int position) {
		return absentPositions.contains(position);
	}

	public String describe() {
		StringBuilder builder = new StringBuilder();
		if (sheetOrPage != null && !sheetOrPage.isBlank()) {
			builder.append("sheet=").append(sheetOrPage);
		}
		if (rowOrCol != null) {
			if (builder.length() > 0) {
				builder.append(", ");
			}
			builder.append("index=").append(rowOrCol);
		}
		if (!absentPositions.isEmpty()) {
			builder.append(", absent=").append(absentPositions);
		}
		return builder.toString();
	}
}
