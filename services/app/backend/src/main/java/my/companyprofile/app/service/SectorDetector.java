package my.companyprofile.app.service;

import my.companyprofile.app.config.ExtractionVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tags a company with a sector by counting configured keywords present in its text.
 */
@Service
public class SectorDetector {
	private static final Logger logger = LoggerFactory.getLogger(SectorDetector.class);

	private final List<SectorPatterns> sectors;
	private final String defaultSector;

	public SectorDetector(ExtractionVocabulary vocabulary) {
		List<SectorPatterns> compiled = new ArrayList<>();
		for (ExtractionVocabulary.SectorVocabulary sector : vocabulary.sectors()) {
			List<Pattern> patterns = sector.keywords().stream()
					.map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE))
					.toList();
			compiled.add(new SectorPatterns(sector.name(), patterns));
		}
		this.sectors = List.copyOf(compiled);
		this.defaultSector = vocabulary.defaultSector();
	}

	public String detect(String text) {
		if (text == null || text.isBlank()) {
			return defaultSector;
		}
		String best = defaultSector;
		int bestScore = 0;
		for (SectorPatterns sector : sectors) {
			int score = sector.score(text);
			if (score > bestScore) {
				best = sector.name();
				bestScore = score;
			}
		}
		logger.debug("Detected sector {} (score={}).", best, bestScore);
		return best;
	}

	private record SectorPatterns(String name, List<Pattern> keywords) {
		int score(String text) {
			int score = 0;
			for (Pattern keyword : keywords) {
				if (keyword.matcher(text).find()) {
					score++;
				}
			}
			return score;
		}
	}
}
