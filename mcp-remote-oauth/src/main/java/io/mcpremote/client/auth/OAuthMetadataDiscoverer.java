/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.OAuthMetadata;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Discovers RFC 8414 authorization server metadata. When the well-known document cannot
 * be fetched or read, metadata is synthesized from the server URL using the
 * conventional {@code /oauth/*} endpoint layout, so discovery itself never fails.
 */
public class OAuthMetadataDiscoverer {

	private static final Logger logger = LoggerFactory.getLogger(OAuthMetadataDiscoverer.class);

	static final String WELL_KNOWN_PATH = "/.well-known/oauth-authorization-server";

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	public OAuthMetadataDiscoverer(HttpClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, DEFAULT_REQUEST_TIMEOUT);
	}

	public OAuthMetadataDiscoverer(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Discover OAuth metadata from the server's well-known endpoint.
	 * @param baseUrl the authorization server base URL
	 * @return a Mono emitting the discovered or synthesized metadata; it never errors
	 * because of connectivity or a malformed document
	 */
	public Mono<OAuthMetadata> discover(String baseUrl) {
		Assert.hasText(baseUrl, "baseUrl must not be empty");
		String base = Utils.stripTrailingSlash(baseUrl);
		String url = base + WELL_KNOWN_PATH;

		return Mono.defer(() -> {
			logger.info("Discovering OAuth server metadata from: {}", url);
			HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.header("Accept", "application/json")
				.timeout(requestTimeout)
				.GET()
				.build();
			return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()));
		}).map(response -> {
			if (response.statusCode() / 100 != 2) {
				throw new OAuthException(OAuthException.Kind.HTTP, "Metadata discovery failed", response.statusCode(),
						response.body());
			}
			try {
				OAuthMetadata metadata = objectMapper.readValue(response.body(), OAuthMetadata.class);
				logger.debug("Discovered OAuth metadata with issuer {}", metadata.getIssuer());
				return metadata;
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.JSON, "Failed to parse OAuth metadata", e);
			}
		}).onErrorResume(ex -> {
			logger.warn("OAuth metadata discovery failed ({}), using fallback metadata", ex.getMessage());
			return Mono.just(fallbackMetadata(base));
		});
	}

	/**
	 * Construct fallback OAuth server metadata for servers without a discovery document.
	 * @param baseUrl the authorization server base URL, trailing slashes are ignored
	 * @return synthesized metadata rooted at {@code baseUrl}
	 */
	public static OAuthMetadata fallbackMetadata(String baseUrl) {
		String base = Utils.stripTrailingSlash(baseUrl);
		logger.info("Constructing fallback OAuth metadata for: {}", base);

		OAuthMetadata metadata = new OAuthMetadata();
		metadata.setIssuer(base);
		metadata.setAuthorizationEndpoint(base + "/oauth/authorize");
		metadata.setTokenEndpoint(base + "/oauth/token");
		metadata.setRegistrationEndpoint(base + "/oauth/register");
		metadata.setJwksUri(base + "/oauth/jwks");
		metadata.setResponseTypesSupported(List.of("code"));
		metadata.setGrantTypesSupported(List.of("authorization_code", "refresh_token"));
		// "none" covers public clients using PKCE
		metadata.setTokenEndpointAuthMethodsSupported(List.of("client_secret_basic", "client_secret_post", "none"));
		metadata.setScopesSupported(List.of("mcp", "openid"));
		metadata.setCodeChallengeMethodsSupported(List.of("S256", "plain"));
		return metadata;
	}

}
