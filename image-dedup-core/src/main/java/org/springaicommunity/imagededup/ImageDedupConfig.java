package org.springaicommunity.imagededup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing the duplicate image service and its settings, for
 * applications that embed the library in a Spring context.
 */
@Configuration
public class ImageDedupConfig {

	@Bean
	public DeduplicationProperties deduplicationProperties() {
		return EnvironmentOverrides.apply(new DeduplicationProperties());
	}

	@Bean
	public ObjectMapper imageDedupObjectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public DuplicateImageService duplicateImageService(DeduplicationProperties deduplicationProperties,
			ObjectMapper imageDedupObjectMapper) {
		return ImageDedupBuilder.create()
			.properties(deduplicationProperties)
			.objectMapper(imageDedupObjectMapper)
			.buildService();
	}

}
