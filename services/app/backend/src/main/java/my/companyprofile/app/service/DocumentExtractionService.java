package my.companyprofile.app.service;

import my.companyprofile.app.importer.SourceDocument;
import my.companyprofile.app.model.DocumentExtraction;
import my.companyprofile.app.model.DocumentIssue;
import my.companyprofile.app.model.FinancialTable;
import my.companyprofile.app.model.KpiMap;
import my.companyprofile.app.model.NarrativeProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the grid and text extractors over each document. A failing document becomes a
 * {@link DocumentIssue}; the remaining documents are still processed.
 */
@Service
public class DocumentExtractionService {
	private static final Logger logger = LoggerFactory.getLogger(DocumentExtractionService.class);

	private final TableOrientationExtractor tableExtractor;
	private final KpiPatternExtractor kpiExtractor;
	private final NarrativeSectionExtractor narrativeExtractor;

	public DocumentExtractionService(TableOrientationExtractor tableExtractor,
									 KpiPatternExtractor kpiExtractor,
									 NarrativeSectionExtractor narrativeExtractor) {
		this.tableExtractor = tableExtractor;
		this.kpiExtractor = kpiExtractor;
		this.narrativeExtractor = narrativeExtractor;
	}

	public ExtractionBatch extractAll(List<SourceDocument> documents) {
		List<DocumentExtraction> extractions = new ArrayList<>();
		List<DocumentIssue> issues = new ArrayList<>();
		if (documents == null) {
			return new ExtractionBatch(extractions, issues);
		}
		for (SourceDocument document : documents) {
			try {
				extractions.add(extract(document));
			} catch (IllegalArgumentException ex) {
				logger.warn("Skipping {}: {}", document.fileName(), ex.getMessage());
				issues.add(new DocumentIssue(document.fileName(), ex.getMessage()));
			} catch (RuntimeException ex) {
				logger.warn("Extraction failed for {}", document.fileName(), ex);
				issues.add(new DocumentIssue(document.fileName(), "Extraction failed: " + ex.getMessage()));
			}
		}
		logger.debug("Extracted {} documents, {} issues.", extractions.size(), issues.size());
		return new ExtractionBatch(extractions, issues);
	}

	/**
	 * @throws IllegalArgumentException when the document could not be decoded or carries no content
	 */
	public DocumentExtraction extract(SourceDocument document) {
		if (document.decodeError() != null && !document.decodeError().isBlank()) {
			throw new IllegalArgumentException("Document could not be decoded: " + document.decodeError());
		}
		if (!document.hasContent()) {
			throw new IllegalArgumentException("Document has no tables or text");
		}
		FinancialTable table = tableExtractor.extractWorkbook(document.fileName(), document.sheets()).orElse(null);
		KpiMap kpis = null;
		NarrativeProfile narrative = null;
		if (document.hasText()) {
			kpis = kpiExtractor.extract(document.text());
			narrative = narrativeExtractor.extract(document.text());
		}
		logger.debug("Document {}: table={}, kpis={}, narrativeFields={}", document.fileName(), table != null,
				kpis == null ? 0 : kpis.metrics().size(),
				narrative == null ? 0 : narrative.extractedFields().size());
		return new DocumentExtraction(document.fileName(), document.origin(), table, kpis, narrative);
	}

	public record ExtractionBatch(List<DocumentExtraction> extractions, List<DocumentIssue> issues) {
		public ExtractionBatch {
			extractions = List.copyOf(extractions);
			issues = List.copyOf(issues);
		}
	}
}
