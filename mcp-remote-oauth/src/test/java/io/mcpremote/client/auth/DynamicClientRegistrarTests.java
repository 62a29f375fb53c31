/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.net.http.HttpClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.OAuthMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DynamicClientRegistrar}.
 */
class DynamicClientRegistrarTests {

	private static final String REDIRECT_URI = "http://localhost:8765/callback";

	private final ObjectMapper objectMapper = OAuthObjectMapper.create();

	private FakeAuthorizationServer authServer;

	private DynamicClientRegistrar registrar;

	private OAuthMetadata metadata;

	@BeforeEach
	void setUp() throws IOException {
		authServer = new FakeAuthorizationServer();
		registrar = new DynamicClientRegistrar(HttpClient.newHttpClient(), objectMapper);
		metadata = OAuthMetadataDiscoverer.fallbackMetadata(authServer.baseUrl());
	}

	@AfterEach
	void tearDown() {
		authServer.close();
	}

	@Test
	void testRegisterSendsNativePublicClientRequest() throws IOException {
		authServer.stubJson("/oauth/register", 201, """
				{"client_id": "client-123", "client_id_issued_at": 1700000000,
				 "redirect_uris": ["http://localhost:8765/callback"]}
				""");

		StepVerifier.create(registrar.register(metadata, REDIRECT_URI, "MCP Remote")).assertNext(client -> {
			assertThat(client.getClientId()).isEqualTo("client-123");
			assertThat(client.getClientSecret()).isNull();
			assertThat(client.getClientIdIssuedAt()).isEqualTo(1700000000L);
		}).verifyComplete();

		FakeAuthorizationServer.RecordedRequest request = authServer.requestsTo("/oauth/register").get(0);
		assertThat(request.method()).isEqualTo("POST");
		assertThat(request.contentType()).isEqualTo("application/json");

		JsonNode body = objectMapper.readTree(request.body());
		assertThat(body.get("redirect_uris").get(0).asText()).isEqualTo(REDIRECT_URI);
		assertThat(body.get("client_name").asText()).isEqualTo("MCP Remote");
		assertThat(body.get("scope").asText()).isEqualTo("mcp");
		assertThat(body.get("token_endpoint_auth_method").asText()).isEqualTo("none");
		assertThat(body.get("grant_types")).hasSize(2);
		assertThat(body.get("response_types").get(0).asText()).isEqualTo("code");
		assertThat(body.get("software_id").asText()).isEqualTo("mcp-remote");
		assertThat(body.get("software_version").asText()).isNotBlank();
		assertThat(body.get("mcp_version").asText()).isEqualTo("2024-11-05");
		assertThat(body.get("application_type").asText()).isEqualTo("native");
	}

	@Test
	void testRejectedRegistrationCarriesStatusAndBody() {
		authServer.stubText("/oauth/register", 400, "invalid_redirect_uri");

		StepVerifier.create(registrar.register(metadata, REDIRECT_URI, "MCP Remote")).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(OAuthException.class);
			OAuthException oauthError = (OAuthException) error;
			assertThat(oauthError.getKind()).isEqualTo(OAuthException.Kind.CLIENT_REGISTRATION);
			assertThat(oauthError.getStatusCode()).isEqualTo(400);
			assertThat(oauthError.getResponseBody()).isEqualTo("invalid_redirect_uri");
		}).verify();
	}

	@Test
	void testResponseWithoutClientIdFails() {
		authServer.stubJson("/oauth/register", 200, "{\"client_name\": \"MCP Remote\"}");

		StepVerifier.create(registrar.register(metadata, REDIRECT_URI, "MCP Remote"))
			.expectErrorSatisfies(error -> assertThat(((OAuthException) error).getKind())
				.isEqualTo(OAuthException.Kind.CLIENT_REGISTRATION))
			.verify();
	}

	@Test
	void testMissingRegistrationEndpointFailsWithoutRequest() {
		metadata.setRegistrationEndpoint(null);

		StepVerifier.create(registrar.register(metadata, REDIRECT_URI, "MCP Remote"))
			.expectErrorSatisfies(error -> assertThat(((OAuthException) error).getKind())
				.isEqualTo(OAuthException.Kind.CLIENT_REGISTRATION))
			.verify();
		assertThat(authServer.requests()).isEmpty();
	}

	@Test
	void testUnreachableServerIsHttpError() {
		authServer.close();

		StepVerifier.create(registrar.register(metadata, REDIRECT_URI, "MCP Remote"))
			.expectErrorSatisfies(
					error -> assertThat(((OAuthException) error).getKind()).isEqualTo(OAuthException.Kind.HTTP))
			.verify();
	}

}
