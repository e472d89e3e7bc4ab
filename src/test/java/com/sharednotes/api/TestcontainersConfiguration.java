package com.sharednotes.api;

import com.sharednotes.api.directory.DirectoryService;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * a throwaway PostgreSQL and an in-memory user directory for the integration tests.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestcontainersConfiguration {

	@Bean
	@ServiceConnection
	PostgreSQLContainer<?> postgresContainer() {
		return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));
	}

	@Bean
	@Primary
	InMemoryDirectoryService inMemoryDirectoryService() {
		return new InMemoryDirectoryService();
	}

	@Bean
	JwtDecoder jwtDecoder() {
		return token -> {
			throw new JwtException("tokens are not decoded in tests");
		};
	}

}
