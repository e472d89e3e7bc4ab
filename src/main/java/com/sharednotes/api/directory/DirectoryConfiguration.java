package com.sharednotes.api.directory;

import com.sharednotes.api.ApiProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
class DirectoryConfiguration {

	@Bean
	KeycloakDirectoryService keycloakDirectoryService(RestClient.Builder builder, ApiProperties properties) {
		var cache = properties.cache();
		return new KeycloakDirectoryService(builder, properties.directory().keycloak(), cache.maxEntries(),
				cache.ttl());
	}

}
