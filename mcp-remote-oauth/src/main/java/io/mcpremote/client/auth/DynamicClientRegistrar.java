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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.OAuthClientInformation;
import io.mcpremote.auth.OAuthClientMetadata;
import io.mcpremote.auth.OAuthMetadata;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * RFC 7591 dynamic client registration. Registers this proxy as a native public client
 * so that no credentials have to be configured up front.
 */
public class DynamicClientRegistrar {

	private static final Logger logger = LoggerFactory.getLogger(DynamicClientRegistrar.class);

	static final String SOFTWARE_ID = "mcp-remote";

	static final String MCP_VERSION = "2024-11-05";

	static final String DEFAULT_SCOPE = "mcp";

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	public DynamicClientRegistrar(HttpClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, DEFAULT_REQUEST_TIMEOUT);
	}

	public DynamicClientRegistrar(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Register a new OAuth client with the authorization server.
	 * @param metadata the authorization server metadata
	 * @param redirectUri the callback URI for the OAuth flow
	 * @param clientName optional human-readable client name
	 * @return a Mono emitting the registered client; errors with
	 * {@link OAuthException.Kind#CLIENT_REGISTRATION} when the server has no registration
	 * endpoint or rejects the request
	 */
	public Mono<OAuthClientInformation> register(OAuthMetadata metadata, String redirectUri, String clientName) {
		Assert.notNull(metadata, "metadata must not be null");
		Assert.hasText(redirectUri, "redirectUri must not be empty");

		return Mono.defer(() -> {
			String registrationEndpoint = metadata.getRegistrationEndpoint();
			if (!Utils.hasText(registrationEndpoint)) {
				return Mono.error(new OAuthException(OAuthException.Kind.CLIENT_REGISTRATION,
						"Server does not support dynamic client registration"));
			}
			logger.info("Registering OAuth client with server at: {}", registrationEndpoint);

			String body;
			try {
				body = objectMapper.writeValueAsString(buildRegistrationRequest(redirectUri, clientName));
			}
			catch (JsonProcessingException e) {
				return Mono.error(new OAuthException(OAuthException.Kind.JSON, "Failed to serialize registration", e));
			}
			logger.debug("Registration request: {}", body);

			HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(registrationEndpoint))
				.header("Content-Type", "application/json")
				.header("Accept", "application/json")
				.timeout(requestTimeout)
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.build();

			return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
				.onErrorMap(ex -> !(ex instanceof OAuthException),
						ex -> new OAuthException(OAuthException.Kind.HTTP, "Client registration request failed", ex))
				.map(this::readRegistrationResponse);
		});
	}

	OAuthClientMetadata buildRegistrationRequest(String redirectUri, String clientName) {
		OAuthClientMetadata request = new OAuthClientMetadata();
		request.setRedirectUris(List.of(redirectUri));
		request.setClientName(clientName);
		request.setScope(DEFAULT_SCOPE);
		request.setGrantTypes(List.of("authorization_code", "refresh_token"));
		request.setResponseTypes(List.of("code"));
		request.setTokenEndpointAuthMethod("none");
		request.setSoftwareId(SOFTWARE_ID);
		request.setSoftwareVersion(softwareVersion());
		request.putAdditionalMetadata("mcp_version", MCP_VERSION);
		request.putAdditionalMetadata("application_type", "native");
		return request;
	}

	private OAuthClientInformation readRegistrationResponse(HttpResponse<String> response) {
		if (response.statusCode() / 100 != 2) {
			logger.warn("Client registration failed: {} - {}", response.statusCode(), response.body());
			throw new OAuthException(OAuthException.Kind.CLIENT_REGISTRATION, "Registration failed",
					response.statusCode(), response.body());
		}
		OAuthClientInformation clientInfo;
		try {
			clientInfo = objectMapper.readValue(response.body(), OAuthClientInformation.class);
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.JSON, "Failed to parse client information", e);
		}
		if (!Utils.hasText(clientInfo.getClientId())) {
			throw new OAuthException(OAuthException.Kind.CLIENT_REGISTRATION,
					"Registration response did not contain a client_id");
		}
		logger.info("Successfully registered OAuth client: {}", clientInfo.getClientId());
		return clientInfo;
	}

	static String softwareVersion() {
		String version = DynamicClientRegistrar.class.getPackage().getImplementationVersion();
		return version != null ? version : "0.1.0";
	}

}
