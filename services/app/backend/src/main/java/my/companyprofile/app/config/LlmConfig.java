package my.companyprofile.app.config;

import my.companyprofile.app.llm.NarrativeGenerator;
import my.companyprofile.app.llm.NoopNarrativeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The generative narrative collaborator is supplied by the embedding application as a
 * {@link NarrativeGenerator} bean. Without one, generation is disabled.
 */
@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);

	@Bean
	@ConditionalOnMissingBean(NarrativeGenerator.class)
	public NarrativeGenerator noopNarrativeGenerator(AppProperties properties) {
		String provider = properties.llm().provider();
		if (!"noop".equalsIgnoreCase(provider)) {
			logger.warn("No narrative generator bean registered for provider={}; generation disabled.", provider);
		} else {
			logger.info("Narrative generator disabled (provider=noop).");
		}
		return new NoopNarrativeGenerator();
	}
}
