/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.net.http.HttpClient;

import io.mcpremote.auth.OAuthMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OAuthMetadataDiscoverer}.
 */
class OAuthMetadataDiscovererTests {

	private FakeAuthorizationServer authServer;

	private OAuthMetadataDiscoverer discoverer;

	@BeforeEach
	void setUp() throws IOException {
		authServer = new FakeAuthorizationServer();
		discoverer = new OAuthMetadataDiscoverer(HttpClient.newHttpClient(), OAuthObjectMapper.create());
	}

	@AfterEach
	void tearDown() {
		authServer.close();
	}

	@Test
	void testDiscoverParsesMetadataDocument() {
		authServer.stubJson(OAuthMetadataDiscoverer.WELL_KNOWN_PATH, 200, """
				{
				  "issuer": "https://auth.example.com",
				  "authorization_endpoint": "https://auth.example.com/authorize",
				  "token_endpoint": "https://auth.example.com/token",
				  "code_challenge_methods_supported": ["S256"],
				  "service_documentation": "https://auth.example.com/docs"
				}
				""");

		StepVerifier.create(discoverer.discover(authServer.baseUrl() + "/")).assertNext(metadata -> {
			assertThat(metadata.getIssuer()).isEqualTo("https://auth.example.com");
			assertThat(metadata.getAuthorizationEndpoint()).isEqualTo("https://auth.example.com/authorize");
			assertThat(metadata.getTokenEndpoint()).isEqualTo("https://auth.example.com/token");
			assertThat(metadata.getRegistrationEndpoint()).isNull();
			assertThat(metadata.getCodeChallengeMethodsSupported()).containsExactly("S256");
			assertThat(metadata.getExtra()).containsEntry("service_documentation", "https://auth.example.com/docs");
		}).verifyComplete();

		assertThat(authServer.requestsTo(OAuthMetadataDiscoverer.WELL_KNOWN_PATH)).singleElement()
			.satisfies(request -> assertThat(request.method()).isEqualTo("GET"));
	}

	@Test
	void testNotFoundFallsBackToConventionalEndpoints() {
		String base = authServer.baseUrl();

		StepVerifier.create(discoverer.discover(base)).assertNext(metadata -> {
			assertThat(metadata.getIssuer()).isEqualTo(base);
			assertThat(metadata.getAuthorizationEndpoint()).isEqualTo(base + "/oauth/authorize");
			assertThat(metadata.getTokenEndpoint()).isEqualTo(base + "/oauth/token");
			assertThat(metadata.getRegistrationEndpoint()).isEqualTo(base + "/oauth/register");
		}).verifyComplete();
	}

	@Test
	void testMalformedDocumentFallsBack() {
		authServer.stubJson(OAuthMetadataDiscoverer.WELL_KNOWN_PATH, 200, "{not json");

		StepVerifier.create(discoverer.discover(authServer.baseUrl()))
			.assertNext(metadata -> assertThat(metadata.getTokenEndpoint()).isEqualTo(authServer.url("/oauth/token")))
			.verifyComplete();
	}

	@Test
	void testUnreachableServerFallsBack() {
		String base = authServer.baseUrl();
		authServer.close();

		StepVerifier.create(discoverer.discover(base))
			.assertNext(metadata -> assertThat(metadata.getIssuer()).isEqualTo(base))
			.verifyComplete();
	}

	@Test
	void testFallbackMetadataStripsTrailingSlash() {
		OAuthMetadata metadata = OAuthMetadataDiscoverer.fallbackMetadata("https://x.com/auth/");

		assertThat(metadata.getIssuer()).isEqualTo("https://x.com/auth");
		assertThat(metadata.getAuthorizationEndpoint()).isEqualTo("https://x.com/auth/oauth/authorize");
		assertThat(metadata.getTokenEndpoint()).isEqualTo("https://x.com/auth/oauth/token");
		assertThat(metadata.getRegistrationEndpoint()).isEqualTo("https://x.com/auth/oauth/register");
		assertThat(metadata.getJwksUri()).isEqualTo("https://x.com/auth/oauth/jwks");
		assertThat(metadata.getResponseTypesSupported()).containsExactly("code");
		assertThat(metadata.getGrantTypesSupported()).containsExactly("authorization_code", "refresh_token");
		assertThat(metadata.getTokenEndpointAuthMethodsSupported()).containsExactly("client_secret_basic",
				"client_secret_post", "none");
		assertThat(metadata.getScopesSupported()).containsExactly("mcp", "openid");
		assertThat(metadata.getCodeChallengeMethodsSupported()).containsExactly("S256", "plain");
	}

}
