/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.OAuthMetadata;
import io.mcpremote.auth.OAuthToken;
import io.mcpremote.auth.StoredToken;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Token manager for OAuth 2.0 access and refresh tokens.
 *
 * <p>
 * Handles the token endpoint (authorization code exchange and refresh), persists the
 * results through a {@link TokenStorage} and decides when a stored token has to be
 * refreshed.
 */
public class TokenManager {

	private static final Logger logger = LoggerFactory.getLogger(TokenManager.class);

	/** Tokens expiring within this many seconds are refreshed before use. */
	public static final long REFRESH_BUFFER_SECONDS = 60;

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final TokenStorage storage;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final Duration requestTimeout;

	public TokenManager(HttpClient httpClient, TokenStorage storage, ObjectMapper objectMapper, Clock clock) {
		this(httpClient, storage, objectMapper, clock, DEFAULT_REQUEST_TIMEOUT);
	}

	public TokenManager(HttpClient httpClient, TokenStorage storage, ObjectMapper objectMapper, Clock clock,
			Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(storage, "storage must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(clock, "clock must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.storage = storage;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Exchange an authorization code for an access token and persist the result.
	 * @param metadata authorization server metadata with the token endpoint
	 * @param clientId OAuth client ID
	 * @param clientSecret client secret, {@code null} for public clients
	 * @param code authorization code from the callback
	 * @param redirectUri redirect URI used in the authorization request
	 * @param codeVerifier PKCE code verifier
	 * @param serverUrl MCP server URL the token is stored under
	 * @return a Mono emitting the stored token
	 */
	public Mono<StoredToken> exchangeCodeForToken(OAuthMetadata metadata, String clientId, String clientSecret,
			String code, String redirectUri, String codeVerifier, String serverUrl) {
		Assert.notNull(metadata, "metadata must not be null");
		Assert.hasText(clientId, "clientId must not be empty");
		Assert.hasText(code, "code must not be empty");
		Assert.hasText(serverUrl, "serverUrl must not be empty");

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "authorization_code");
		form.put("client_id", clientId);
		form.put("code", code);
		form.put("redirect_uri", redirectUri);
		form.put("code_verifier", codeVerifier);
		if (clientSecret != null) {
			form.put("client_secret", clientSecret);
		}

		return postTokenRequest(metadata, form, OAuthException.Kind.TOKEN_EXCHANGE).flatMap(response -> {
			logger.info("Successfully exchanged authorization code for access token");
			StoredToken token = StoredToken.fromResponse(response, serverUrl, clock.instant());
			return storage.save(token).thenReturn(token);
		});
	}

	/**
	 * Refresh an access token. A response without a new refresh token keeps the previous
	 * one.
	 * @param metadata authorization server metadata with the token endpoint
	 * @param clientId OAuth client ID
	 * @param clientSecret client secret, {@code null} for public clients
	 * @param stored the current token, must carry a refresh token
	 * @return a Mono emitting the updated and persisted token
	 */
	public Mono<StoredToken> refreshToken(OAuthMetadata metadata, String clientId, String clientSecret,
			StoredToken stored) {
		Assert.notNull(metadata, "metadata must not be null");
		Assert.notNull(stored, "stored token must not be null");
		if (!Utils.hasText(stored.getRefreshToken())) {
			return Mono.error(new OAuthException(OAuthException.Kind.TOKEN_REFRESH, "No refresh token available"));
		}
		logger.info("Refreshing access token using refresh token");

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "refresh_token");
		form.put("client_id", clientId);
		form.put("refresh_token", stored.getRefreshToken());
		if (clientSecret != null) {
			form.put("client_secret", clientSecret);
		}
		if (stored.getScope() != null) {
			form.put("scope", stored.getScope());
		}

		return postTokenRequest(metadata, form, OAuthException.Kind.TOKEN_REFRESH).flatMap(response -> {
			logger.info("Successfully refreshed access token");
			Instant now = clock.instant();
			StoredToken refreshed = StoredToken.fromResponse(response, stored.getServerUrl(), now);
			if (refreshed.getRefreshToken() == null) {
				refreshed.setRefreshToken(stored.getRefreshToken());
			}
			if (refreshed.getScope() == null) {
				refreshed.setScope(stored.getScope());
			}
			if (stored.getCreatedAt() != null) {
				refreshed.setCreatedAt(stored.getCreatedAt());
			}
			return storage.save(refreshed).thenReturn(refreshed);
		});
	}

	private Mono<OAuthToken> postTokenRequest(OAuthMetadata metadata, Map<String, String> form,
			OAuthException.Kind failureKind) {
		return Mono.defer(() -> {
			if (!Utils.hasText(metadata.getTokenEndpoint())) {
				return Mono.error(new OAuthException(OAuthException.Kind.INVALID_CONFIGURATION,
						"Server metadata has no token endpoint"));
			}
			logger.debug("Token request (grant_type={}) to {}", form.get("grant_type"), metadata.getTokenEndpoint());
			HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(metadata.getTokenEndpoint()))
				.header("Content-Type", "application/x-www-form-urlencoded")
				.header("Accept", "application/json")
				.timeout(requestTimeout)
				.POST(HttpRequest.BodyPublishers.ofString(Utils.encodeForm(form)))
				.build();
			return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()));
		}).onErrorMap(ex -> !(ex instanceof OAuthException),
				ex -> new OAuthException(OAuthException.Kind.HTTP, "Token endpoint request failed", ex))
			.map(response -> {
				if (response.statusCode() / 100 != 2) {
					logger.error("Token request failed: {} - {}", response.statusCode(), response.body());
					throw new OAuthException(failureKind, "Token request failed", response.statusCode(),
							response.body());
				}
				OAuthToken token;
				try {
					token = objectMapper.readValue(response.body(), OAuthToken.class);
				}
				catch (IOException e) {
					throw new OAuthException(OAuthException.Kind.JSON, "Failed to parse token response", e);
				}
				if (!Utils.hasText(token.getAccessToken())) {
					throw new OAuthException(failureKind, "Token response did not contain an access_token");
				}
				return token;
			});
	}

	/**
	 * Get a valid access token for a server, refreshing it first when it expires within
	 * {@link #REFRESH_BUFFER_SECONDS}.
	 * @param metadata authorization server metadata
	 * @param clientId OAuth client ID
	 * @param clientSecret client secret, {@code null} for public clients
	 * @param serverUrl MCP server URL
	 * @return a Mono emitting the access token; errors with
	 * {@link OAuthException.Kind#TOKEN_STORAGE} when no token is stored
	 */
	public Mono<String> getValidToken(OAuthMetadata metadata, String clientId, String clientSecret,
			String serverUrl) {
		return loadToken(serverUrl)
			.switchIfEmpty(Mono.error(() -> new OAuthException(OAuthException.Kind.TOKEN_STORAGE,
					"No stored token found for " + serverUrl)))
			.flatMap(stored -> {
				if (isTokenExpired(stored, REFRESH_BUFFER_SECONDS)) {
					logger.info("Access token is expired or will expire soon, refreshing...");
					return refreshToken(metadata, clientId, clientSecret, stored);
				}
				return Mono.just(stored);
			})
			.map(StoredToken::getAccessToken);
	}

	/**
	 * Check if a token is expired or will expire soon.
	 * @param token the token to check
	 * @param bufferSeconds treat the token as expired if it expires within this window
	 * @return {@code true} if {@code now + buffer >= expires_at}; always {@code false}
	 * for tokens without expiry
	 */
	public boolean isTokenExpired(StoredToken token, long bufferSeconds) {
		Instant expiresAt = token.getExpiresAt();
		if (expiresAt == null) {
			return false;
		}
		return !clock.instant().plusSeconds(bufferSeconds).isBefore(expiresAt);
	}

	public Mono<StoredToken> loadToken(String serverUrl) {
		return storage.load(serverUrl);
	}

	public Mono<Void> saveToken(StoredToken token) {
		return storage.save(token);
	}

	public Mono<Void> deleteToken(String serverUrl) {
		return storage.delete(serverUrl);
	}

}
