package com.sharednotes.api.directory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharednotes.api.ApiProperties;
import com.sharednotes.api.utils.CollectionUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.ImportRuntimeHints;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * looks users up with the Keycloak admin REST API. every lookup first mints an admin
 * token against the {@code master} realm. positive answers are cached for a while;
 * misses never are, so a user who registers after a failed share can be found at once.
 * transport failures are not a "not found" and propagate to the caller.
 */
@ImportRuntimeHints(KeycloakDirectoryService.Hints.class)
class KeycloakDirectoryService implements DirectoryService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final RestClient http;

	private final ApiProperties.Directory.Keycloak keycloak;

	private final Map<String, String> userIdsByEmail;

	private final Map<String, String> emailsByUserId;

	KeycloakDirectoryService(RestClient.Builder builder, ApiProperties.Directory.Keycloak keycloak, int maxEntries,
			Duration ttl) {
		Assert.notNull(keycloak, "the keycloak configuration must not be null");
		Assert.notNull(keycloak.url(), "the keycloak url must not be null");
		this.keycloak = keycloak;
		this.http = builder.baseUrl(keycloak.url().toString()).build();
		this.userIdsByEmail = CollectionUtils.evictingConcurrentMap(maxEntries, ttl);
		this.emailsByUserId = CollectionUtils.evictingConcurrentMap(maxEntries, ttl);
	}

	@Override
	public @Nullable String userIdForEmail(String email) {
		var key = email.trim().toLowerCase(Locale.ROOT);
		var cached = this.userIdsByEmail.get(key);
		if (cached != null)
			return cached;
		var users = this.http.get() //
			.uri("/admin/realms/{realm}/users?email={email}&exact=true", this.keycloak.realm(), key) //
			.headers(headers -> headers.setBearerAuth(this.adminToken())) //
			.retrieve() //
			.body(UserRepresentation[].class);
		if (users == null || users.length == 0) {
			this.log.info("there is no user for the email [{}]", key);
			return null;
		}
		var user = users[0];
		this.log.debug("resolved the email [{}] to the user [{}]", key, user.id());
		this.remember(user);
		return user.id();
	}

	@Override
	public @Nullable String emailForUserId(String userId) {
		var cached = this.emailsByUserId.get(userId);
		if (cached != null)
			return cached;
		try {
			var user = this.http.get() //
				.uri("/admin/realms/{realm}/users/{id}", this.keycloak.realm(), userId) //
				.headers(headers -> headers.setBearerAuth(this.adminToken())) //
				.retrieve() //
				.body(UserRepresentation.class);
			if (user == null || user.email() == null)
				return null;
			this.remember(user);
			return user.email();
		} //
		catch (HttpClientErrorException.NotFound notFound) {
			this.log.info("there is no user with the id [{}]", userId);
			return null;
		}
	}

	private void remember(UserRepresentation user) {
		if (user.id() == null || user.email() == null)
			return;
		this.userIdsByEmail.put(user.email().toLowerCase(Locale.ROOT), user.id());
		this.emailsByUserId.put(user.id(), user.email());
	}

	private String adminToken() {
		var form = new LinkedMultiValueMap<String, String>();
		form.add("grant_type", "password");
		form.add("client_id", this.keycloak.adminClientId());
		form.add("username", this.keycloak.adminUsername());
		form.add("password", this.keycloak.adminPassword());
		var token = this.http.post() //
			.uri("/realms/master/protocol/openid-connect/token") //
			.contentType(MediaType.APPLICATION_FORM_URLENCODED) //
			.body(form) //
			.retrieve() //
			.body(TokenResponse.class);
		Assert.state(token != null && token.accessToken() != null, "keycloak did not issue an admin token");
		return token.accessToken();
	}

	static class Hints implements RuntimeHintsRegistrar {

		@Override
		public void registerHints(RuntimeHints hints, @Nullable ClassLoader classLoader) {
			for (var c : Set.of(TokenResponse.class, UserRepresentation.class, UserRepresentation[].class))
				hints.reflection().registerType(c, MemberCategory.values());
		}

	}

	record TokenResponse(@JsonProperty("access_token") String accessToken,
			@JsonProperty("expires_in") long expiresIn) {
	}

	record UserRepresentation(String id, String username, String email) {
	}

}
