package com.sharednotes.api;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

@ConfigurationProperties(prefix = "sharednotes")
public record ApiProperties(Cache cache, Directory directory, Search search, Pagination pagination) {

	public record Cache(int maxEntries, Duration ttl) {
	}

	public record Directory(Keycloak keycloak) {

		/**
		 * the admin credentials are used against the {@code master} realm to mint a token
		 * for user lookups in {@code realm}.
		 */
		public record Keycloak(URI url, String realm, String adminClientId, String adminUsername,
				String adminPassword) {
		}

	}

	public record Search(int minimumQueryLength, int maximumTags) {
	}

	public record Pagination(int defaultPageSize) {
	}

}
