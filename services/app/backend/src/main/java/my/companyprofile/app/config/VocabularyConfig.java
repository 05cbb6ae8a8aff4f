package my.companyprofile.app.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class VocabularyConfig {
	private static final Logger logger = LoggerFactory.getLogger(VocabularyConfig.class);

	@Bean
	public ExtractionVocabulary extractionVocabulary(AppProperties properties, ObjectMapper objectMapper) {
		String resource = properties.extraction().vocabularyResource();
		ExtractionVocabulary vocabulary = load(objectMapper, resource);
		logger.info("Extraction vocabulary loaded (resource={}, version={}, sectors={}, certificationPatterns={}).",
				resource, vocabulary.version(), vocabulary.sectors().size(), vocabulary.certificationPatterns().size());
		return vocabulary;
	}

	public static ExtractionVocabulary load(ObjectMapper objectMapper, String resource) {
		ClassPathResource classPathResource = new ClassPathResource(resource);
		if (!classPathResource.exists()) {
			throw new IllegalStateException("Extraction vocabulary not found on classpath: " + resource);
		}
		try (InputStream in = classPathResource.getInputStream()) {
			return objectMapper.readValue(in, ExtractionVocabulary.class);
		} catch (IOException | JacksonException | IllegalArgumentException exc) {
			throw new IllegalStateException("Failed to load extraction vocabulary " + resource + ": " + exc.getMessage(), exc);
		}
	}
}
