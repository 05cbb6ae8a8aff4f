package my.companyprofile.app.service;

import my.companyprofile.app.config.AppProperties;
import my.companyprofile.app.importer.SourceDocument;
import my.companyprofile.app.llm.NarrativeRequest;
import my.companyprofile.app.model.CompanyProfile;
import my.companyprofile.app.model.DocumentExtraction;
import my.companyprofile.app.model.NarrativeProfile;
import my.companyprofile.app.scrape.PublicContextProvider;
import my.companyprofile.app.scrape.PublicPage;
import my.companyprofile.app.store.CompanyDocumentStore;
import my.companyprofile.app.util.TextAnonymizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Processing run for one company: load documents, extract, fill narrative gaps, merge and save.
 */
@Service
public class CompanyProfileService {
	private static final Logger logger = LoggerFactory.getLogger(CompanyProfileService.class);

	private final CompanyDocumentStore documentStore;
	private final ObjectProvider<PublicContextProvider> publicContextProvider;
	private final DocumentExtractionService documentExtractionService;
	private final SectorDetector sectorDetector;
	private final NarrativeFallbackService narrativeFallbackService;
	private final SourceMergePolicy mergePolicy;
	private final int maxTextChars;
	private final int maxContextChars;

	public CompanyProfileService(CompanyDocumentStore documentStore,
								 ObjectProvider<PublicContextProvider> publicContextProvider,
								 DocumentExtractionService documentExtractionService,
								 SectorDetector sectorDetector,
								 NarrativeFallbackService narrativeFallbackService,
								 SourceMergePolicy mergePolicy,
								 AppProperties properties) {
		this.documentStore = documentStore;
		this.publicContextProvider = publicContextProvider;
		this.documentExtractionService = documentExtractionService;
		this.sectorDetector = sectorDetector;
		this.narrativeFallbackService = narrativeFallbackService;
		this.mergePolicy = mergePolicy;
		this.maxTextChars = properties.extraction().maxTextChars();
		this.maxContextChars = properties.extraction().maxContextChars();
	}

	public CompanyProfile process(String projectId, String companyName, String website) {
		List<SourceDocument> documents = documentStore.loadDocuments(projectId);
		logger.info("Processing project {} for {} ({} documents).", projectId, companyName,
				documents == null ? 0 : documents.size());
		List<SourceDocument> all = new ArrayList<>(documents == null ? List.of() : documents);
		all.addAll(publicDocuments(companyName, website));
		CompanyProfile profile = buildProfile(companyName, all);
		documentStore.saveProfile(projectId, profile);
		logger.info("Saved profile for project {} (sector={}, years={}, issues={}).", projectId, profile.sector(),
				profile.financials().years().size(), profile.issues().size());
		return profile;
	}

	public CompanyProfile buildProfile(String companyName, List<SourceDocument> documents) {
		List<SourceDocument> bounded = documents.stream().map(this::truncate).toList();
		DocumentExtractionService.ExtractionBatch batch = documentExtractionService.extractAll(bounded);

		String corpus = corpus(bounded);
		String sector = sectorDetector.detect(corpus.isBlank() ? companyName : corpus);

		NarrativeProfile generated = null;
		List<String> missing = missingNarrativeFields(batch.extractions());
		if (!missing.isEmpty() && narrativeFallbackService.isEnabled()) {
			NarrativeRequest request = new NarrativeRequest(sector,
					mergePolicy.mergeFinancials(batch.extractions()),
					mergePolicy.mergeKpis(batch.extractions()),
					TextAnonymizer.anonymize(cut(corpus, maxContextChars)),
					missing);
			generated = narrativeFallbackService.requestNarrative(request);
		}
		return mergePolicy.merge(companyName, sector, batch.extractions(), batch.issues(), generated);
	}

	private List<SourceDocument> publicDocuments(String companyName, String website) {
		PublicContextProvider provider = publicContextProvider.getIfAvailable();
		if (provider == null) {
			return List.of();
		}
		List<PublicPage> pages;
		try {
			pages = provider.gatherPublicContext(companyName, website);
		} catch (RuntimeException ex) {
			logger.warn("Public context for {} unavailable: {}", companyName, ex.getMessage());
			return List.of();
		}
		List<SourceDocument> documents = new ArrayList<>();
		if (pages == null) {
			return documents;
		}
		for (PublicPage page : pages) {
			if (page == null || page.text() == null || page.text().isBlank()) {
				continue;
			}
			documents.add(SourceDocument.publicPage(page.url(), page.text()));
		}
		logger.debug("Public context for {}: {} pages.", companyName, documents.size());
		return documents;
	}

	private List<String> missingNarrativeFields(List<DocumentExtraction> extractions) {
		Set<String> covered = mergePolicy.documentNarrativeFields(extractions);
		return NarrativeProfile.fieldNames().stream().filter(field -> !covered.contains(field)).toList();
	}

	private SourceDocument truncate(SourceDocument document) {
		if (!document.hasText() || document.text().length() <= maxTextChars) {
			return document;
		}
		logger.debug("Truncating text of {} from {} to {} chars.", document.fileName(), document.text().length(),
				maxTextChars);
		return document.withText(document.text().substring(0, maxTextChars));
	}

	private static String corpus(List<SourceDocument> documents) {
		StringBuilder corpus = new StringBuilder();
		for (SourceDocument document : documents) {
			if (document.hasText()) {
				if (corpus.length() > 0) {
					corpus.append('\n');
				}
				corpus.append(document.text());
			}
		}
		return corpus.toString();
	}

	private static String cut(String value, int maxChars) {
		return value.length() <= maxChars ? value : value.substring(0, maxChars);
	}
}
