package com.sharednotes.api.directory;

import com.sharednotes.api.ApiProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Duration;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class KeycloakDirectoryServiceTest {

	private static final String KEYCLOAK = "http://keycloak.test";

	private static final String TOKEN = """
			{ "access_token" : "admin-token", "expires_in" : 60 }
			""";

	private MockRestServiceServer server;

	private KeycloakDirectoryService directory;

	@BeforeEach
	void setUp() {
		var builder = RestClient.builder();
		this.server = MockRestServiceServer.bindTo(builder).build();
		var keycloak = new ApiProperties.Directory.Keycloak(URI.create(KEYCLOAK), "sharednotes", "admin-cli", "admin",
				"secret");
		this.directory = new KeycloakDirectoryService(builder, keycloak, 10, Duration.ofMinutes(5));
	}

	@Test
	void resolvesAndCachesEmails() {
		this.expectToken();
		this.server.expect(requestTo(startsWith(KEYCLOAK + "/admin/realms/sharednotes/users?")))
			.andExpect(method(HttpMethod.GET))
			.andExpect(queryParam("email", containsString("example.com")))
			.andExpect(queryParam("exact", "true"))
			.andExpect(header("Authorization", "Bearer admin-token"))
			.andRespond(withSuccess("""
					[ { "id" : "u-1", "username" : "jane", "email" : "jane@example.com" } ]
					""", MediaType.APPLICATION_JSON));

		Assertions.assertEquals("u-1", this.directory.userIdForEmail(" Jane@Example.com "));
		Assertions.assertEquals("u-1", this.directory.userIdForEmail("jane@example.com"), "served from the cache");
		Assertions.assertEquals("jane@example.com", this.directory.emailForUserId("u-1"), "the reverse is cached too");
		this.server.verify();
	}

	@Test
	void unknownEmailsResolveToNull() {
		this.expectToken();
		this.server.expect(requestTo(startsWith(KEYCLOAK + "/admin/realms/sharednotes/users?")))
			.andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));
		Assertions.assertNull(this.directory.userIdForEmail("nobody@example.com"));
		this.server.verify();
	}

	@Test
	void resolvesUserIds() {
		this.expectToken();
		this.server.expect(requestTo(KEYCLOAK + "/admin/realms/sharednotes/users/u-2"))
			.andExpect(method(HttpMethod.GET))
			.andRespond(withSuccess("""
					{ "id" : "u-2", "username" : "john", "email" : "john@example.com" }
					""", MediaType.APPLICATION_JSON));
		Assertions.assertEquals("john@example.com", this.directory.emailForUserId("u-2"));
		this.server.verify();
	}

	@Test
	void unknownUserIdsResolveToNull() {
		this.expectToken();
		this.server.expect(requestTo(KEYCLOAK + "/admin/realms/sharednotes/users/gone"))
			.andRespond(withStatus(HttpStatus.NOT_FOUND));
		Assertions.assertNull(this.directory.emailForUserId("gone"));
		this.server.verify();
	}

	@Test
	void transportFailuresPropagate() {
		this.expectToken();
		this.server.expect(requestTo(startsWith(KEYCLOAK + "/admin/realms/sharednotes/users?")))
			.andRespond(withServerError());
		Assertions.assertThrows(HttpServerErrorException.class,
				() -> this.directory.userIdForEmail("jane@example.com"));
	}

	private void expectToken() {
		this.server.expect(requestTo(KEYCLOAK + "/realms/master/protocol/openid-connect/token"))
			.andExpect(method(HttpMethod.POST))
			.andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
			.andExpect(content().string(containsString("grant_type=password")))
			.andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));
	}

}
