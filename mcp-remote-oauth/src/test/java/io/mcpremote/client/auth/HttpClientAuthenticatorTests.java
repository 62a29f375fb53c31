/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.net.URI;
import java.net.http.HttpRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link HttpClientAuthenticator}.
 */
@ExtendWith(MockitoExtension.class)
class HttpClientAuthenticatorTests {

	@Mock
	private OAuthClient oauthClient;

	private HttpClientAuthenticator authenticator;

	@BeforeEach
	void setUp() {
		authenticator = new HttpClientAuthenticator(oauthClient);
	}

	@Test
	void testAuthenticateAddsBearerHeader() {
		when(oauthClient.getAccessToken()).thenReturn(Mono.just("tok123"));

		StepVerifier
			.create(authenticator.authenticate(HttpRequest.newBuilder(URI.create("https://mcp.example.com/sse"))))
			.assertNext(builder -> assertThat(builder.build().headers().firstValue("Authorization"))
				.hasValue("Bearer tok123"))
			.verifyComplete();
	}

	@Test
	void testAuthenticatePropagatesAuthorizationFailure() {
		when(oauthClient.getAccessToken())
			.thenReturn(Mono.error(new OAuthException(OAuthException.Kind.AUTH_TIMEOUT, "timed out")));

		StepVerifier
			.create(authenticator.authenticate(HttpRequest.newBuilder(URI.create("https://mcp.example.com/sse"))))
			.expectError(OAuthException.class)
			.verify();
	}

	@Test
	void testUnauthorizedResponseClearsStoredToken() {
		when(oauthClient.clearTokens()).thenReturn(Mono.empty());
		when(oauthClient.getServerUrl()).thenReturn("https://mcp.example.com/sse");

		StepVerifier.create(authenticator.handleResponse(401)).verifyComplete();

		verify(oauthClient).clearTokens();
	}

	@Test
	void testOtherResponsesAreIgnored() {
		StepVerifier.create(authenticator.handleResponse(200)).verifyComplete();
		StepVerifier.create(authenticator.handleResponse(403)).verifyComplete();

		verify(oauthClient, never()).clearTokens();
	}

}
