package my.companyprofile.app.service;

import my.companyprofile.app.llm.NarrativeGenerator;
import my.companyprofile.app.llm.NarrativeRequest;
import my.companyprofile.app.llm.NoopNarrativeGenerator;
import my.companyprofile.app.model.NarrativeProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NarrativeFallbackService {
	private static final Logger logger = LoggerFactory.getLogger(NarrativeFallbackService.class);

	private final NarrativeGenerator generator;
	private final boolean enabled;

	public NarrativeFallbackService(NarrativeGenerator generator) {
		this.generator = generator;
		this.enabled = !(generator instanceof NoopNarrativeGenerator);
	}

	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Asks the generator for the missing narrative fields. Returns {@code null} when disabled, when the
	 * generator fails or when it returns nothing usable.
	 */
	public NarrativeProfile requestNarrative(NarrativeRequest request) {
		if (!enabled || request == null || request.missingFields().isEmpty()) {
			return null;
		}
		try {
			NarrativeProfile generated = generator.generateNarrative(request);
			if (generated == null || generated.extractedFields().isEmpty()) {
				logger.info("Narrative generator returned no fields.");
				return null;
			}
			logger.info("Narrative generator supplied fields {}.", generated.extractedFields());
			return generated;
		} catch (Exception ex) {
			logger.warn("Narrative generation failed: {}", ex.getMessage());
			logger.debug("Narrative generation failure", ex);
			return null;
		}
	}
}
