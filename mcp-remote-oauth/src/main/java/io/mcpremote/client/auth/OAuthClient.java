/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.AuthCallbackResult;
import io.mcpremote.auth.OAuthClientInformation;
import io.mcpremote.auth.OAuthMetadata;
import io.mcpremote.auth.PkceChallenge;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * OAuth 2.1 client for the MCP remote proxy: the single entry point the transport layer
 * uses to obtain a bearer token.
 *
 * <p>
 * {@link #getAccessToken()} runs the whole sequence:
 * <ol>
 * <li>discover the authorization server metadata (unless configured)</li>
 * <li>use the static client credentials, or register a client dynamically</li>
 * <li>return the stored token, refreshing it when it is about to expire</li>
 * <li>if another process is already authorizing against the same server, wait for it and
 * retry the stored token once</li>
 * <li>otherwise run the interactive authorization code flow with PKCE: local callback
 * listener, lock file, browser, state check, code exchange</li>
 * </ol>
 * Every failure is signalled as an {@link OAuthException} and aborts the attempt; a new
 * call starts over from the first step. Discovered metadata and registered credentials
 * are cached for the lifetime of the instance.
 */
public class OAuthClient {

	private static final Logger logger = LoggerFactory.getLogger(OAuthClient.class);

	private final OAuthConfig config;

	private final OAuthMetadataDiscoverer metadataDiscoverer;

	private final DynamicClientRegistrar clientRegistrar;

	private final TokenManager tokenManager;

	private final CoordinationManager coordinationManager;

	private final BrowserLauncher browserLauncher;

	private final AtomicReference<OAuthMetadata> metadata = new AtomicReference<>();

	private final AtomicReference<OAuthClientInformation> registeredClient = new AtomicReference<>();

	/** Port the dynamically registered redirect URI points at. */
	private volatile int registeredCallbackPort;

	OAuthClient(OAuthConfig config, OAuthMetadataDiscoverer metadataDiscoverer, DynamicClientRegistrar clientRegistrar,
			TokenManager tokenManager, CoordinationManager coordinationManager, BrowserLauncher browserLauncher) {
		this.config = config;
		this.metadataDiscoverer = metadataDiscoverer;
		this.clientRegistrar = clientRegistrar;
		this.tokenManager = tokenManager;
		this.coordinationManager = coordinationManager;
		this.browserLauncher = browserLauncher;
		this.metadata.set(config.getServerMetadata());
	}

	/**
	 * Creates a new builder.
	 * @param config the client configuration
	 * @return a new builder instance
	 */
	public static Builder builder(OAuthConfig config) {
		return new Builder(config);
	}

	/**
	 * Get a valid access token for the MCP server, running the interactive authorization
	 * flow when no usable token is stored.
	 * @return a Mono emitting the access token to send as
	 * {@code Authorization: Bearer <token>}
	 */
	public Mono<String> getAccessToken() {
		return Mono.defer(() -> {
			logger.info("Getting access token for server: {}", config.getServerUrl());
			return resolveMetadata().flatMap(serverMetadata -> resolveClient(serverMetadata)
				.flatMap(client -> cachedToken(serverMetadata, client).onErrorResume(ex -> {
					logger.debug("Could not get valid existing token: {}", ex.getMessage());
					logger.info("Starting new OAuth authorization flow...");
					return startOAuthFlow(serverMetadata, client);
				})));
		});
	}

	private Mono<OAuthMetadata> resolveMetadata() {
		OAuthMetadata known = metadata.get();
		if (known != null) {
			return Mono.just(known);
		}
		logger.info("Discovering OAuth server metadata...");
		return metadataDiscoverer.discover(config.getServerUrl()).doOnNext(metadata::set);
	}

	private Mono<OAuthClientInformation> resolveClient(OAuthMetadata serverMetadata) {
		if (config.getStaticClientInfo() != null) {
			logger.debug("Using static OAuth client credentials");
			return Mono.just(config.getStaticClientInfo());
		}
		OAuthClientInformation registered = registeredClient.get();
		if (registered != null) {
			return Mono.just(registered);
		}
		if (!Utils.hasText(serverMetadata.getRegistrationEndpoint())) {
			return Mono.error(new OAuthException(OAuthException.Kind.INVALID_CONFIGURATION,
					"No static client info provided and server does not support dynamic registration"));
		}
		logger.info("Using dynamic client registration");
		return Mono.defer(() -> {
			int provisionalPort = CallbackServer.findAvailablePort(configuredCallbackPort());
			String redirectUri = redirectUri(provisionalPort);
			return clientRegistrar.register(serverMetadata, redirectUri, config.getClientName()).doOnNext(client -> {
				registeredCallbackPort = provisionalPort;
				registeredClient.set(client);
			});
		});
	}

	private Mono<String> cachedToken(OAuthMetadata serverMetadata, OAuthClientInformation client) {
		return tokenManager
			.getValidToken(serverMetadata, client.getClientId(), client.getClientSecret(), config.getServerUrl())
			.doOnNext(token -> logger.info("Using existing valid access token"));
	}

	private Mono<String> startOAuthFlow(OAuthMetadata serverMetadata, OAuthClientInformation client) {
		return coordinationManager.checkLockfile()
			.flatMap(lock -> {
				logger.info("Another instance is handling authentication on port {} (pid: {})", lock.port(),
						lock.pid());
				return coordinationManager.waitForAuthentication(lock.port());
			})
			.filter(Boolean::booleanValue)
			.flatMap(completed -> {
				logger.info("Authentication completed by another instance");
				return cachedToken(serverMetadata, client).onErrorResume(ex -> {
					logger.debug("Failed to load token after coordination: {}", ex.getMessage());
					logger.info("Proceeding with our own auth flow");
					return Mono.empty();
				});
			})
			.switchIfEmpty(Mono.defer(() -> runInteractiveFlow(serverMetadata, client)));
	}

	private Mono<String> runInteractiveFlow(OAuthMetadata serverMetadata, OAuthClientInformation client) {
		return Mono.using(() -> CallbackServer.create(preferredCallbackPort()),
				server -> coordinationManager.createLockfile(server.getPort())
					.then(Mono.defer(() -> authorize(serverMetadata, client, server)))
					.flatMap(token -> coordinationManager.deleteLockfile().thenReturn(token))
					.onErrorResume(ex -> coordinationManager.deleteLockfile().then(Mono.error(ex)))
					.doOnCancel(() -> coordinationManager.deleteLockfile().subscribe()),
				CallbackServer::stop);
	}

	private Mono<String> authorize(OAuthMetadata serverMetadata, OAuthClientInformation client,
			CallbackServer server) {
		String redirectUri = server.callbackUrl(config.getCallbackHost());
		PkceChallenge pkce = PkceUtils.generate();
		String state = PkceUtils.generateState();
		String authorizationUrl = buildAuthorizationUrl(serverMetadata, client.getClientId(), redirectUri, state,
				pkce);
		logger.debug("Authorization URL: {}", authorizationUrl);
		logger.info("Opening browser for OAuth authorization...");

		return browserLauncher.launch(authorizationUrl)
			.onErrorResume(ex -> {
				logger.warn("Browser launch failed ({}), open this URL to authorize: {}", ex.getMessage(),
						authorizationUrl);
				return Mono.empty();
			})
			.then(server.waitForCallback(config.getAuthTimeout()))
			.flatMap(callback -> {
				if (!stateMatches(state, callback)) {
					return Mono.error(new OAuthException(OAuthException.Kind.CSRF,
							"State parameter mismatch - possible CSRF attack"));
				}
				logger.info("Authorization successful, exchanging code for tokens...");
				return tokenManager.exchangeCodeForToken(serverMetadata, client.getClientId(),
						client.getClientSecret(), callback.code(), redirectUri, pkce.codeVerifier(),
						config.getServerUrl());
			})
			.map(token -> {
				logger.info("OAuth flow completed successfully!");
				return token.getAccessToken();
			});
	}

	private static boolean stateMatches(String expected, AuthCallbackResult callback) {
		return callback.state() != null && MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
				callback.state().getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Build the OAuth authorization URL. Parameters are appended to any query the
	 * authorization endpoint already carries.
	 * @param serverMetadata metadata holding the authorization endpoint
	 * @param clientId the OAuth client ID
	 * @param redirectUri the callback URI
	 * @param state the CSRF state value
	 * @param pkce the PKCE challenge
	 * @return the URL to open in the browser
	 */
	public String buildAuthorizationUrl(OAuthMetadata serverMetadata, String clientId, String redirectUri,
			String state, PkceChallenge pkce) {
		String endpoint = serverMetadata.getAuthorizationEndpoint();
		Assert.hasText(endpoint, "authorization_endpoint must not be empty");

		Map<String, String> params = new LinkedHashMap<>();
		params.put("response_type", "code");
		params.put("client_id", clientId);
		params.put("redirect_uri", redirectUri);
		params.put("state", state);
		params.put("code_challenge", pkce.codeChallenge());
		params.put("code_challenge_method", pkce.codeChallengeMethod());
		if (config.getScope() != null) {
			params.put("scope", config.getScope());
		}
		String separator = endpoint.contains("?") ? (endpoint.endsWith("?") || endpoint.endsWith("&") ? "" : "&")
				: "?";
		return endpoint + separator + Utils.encodeForm(params);
	}

	private int configuredCallbackPort() {
		return config.getCallbackPort() != null ? config.getCallbackPort() : 0;
	}

	private int preferredCallbackPort() {
		int configured = configuredCallbackPort();
		return configured != 0 ? configured : registeredCallbackPort;
	}

	private String redirectUri(int port) {
		return "http://" + config.getCallbackHost() + ":" + port + CallbackServer.CALLBACK_PATH;
	}

	/**
	 * Clear the stored token for this server, forcing a new authorization flow on the
	 * next {@link #getAccessToken()}.
	 * @return a Mono completing once the token is deleted
	 */
	public Mono<Void> clearTokens() {
		return tokenManager.deleteToken(config.getServerUrl());
	}

	/**
	 * Check if a token is stored for this server, valid or not.
	 * @return a Mono emitting {@code true} if a token is stored
	 */
	public Mono<Boolean> hasStoredToken() {
		return tokenManager.loadToken(config.getServerUrl()).hasElement().onErrorReturn(false);
	}

	public String getServerUrl() {
		return config.getServerUrl();
	}

	public OAuthConfig getConfig() {
		return config;
	}

	/**
	 * Builder for {@link OAuthClient}. Every collaborator has a production default.
	 */
	public static class Builder {

		private final OAuthConfig config;

		private HttpClient httpClient;

		private ObjectMapper objectMapper;

		private TokenStorage tokenStorage;

		private BrowserLauncher browserLauncher;

		private ProcessLivenessProbe livenessProbe = ProcessLivenessProbe.system();

		private Clock clock = Clock.systemUTC();

		private Duration coordinationPollInterval = CoordinationManager.DEFAULT_POLL_INTERVAL;

		private Duration coordinationMaxWait = CoordinationManager.DEFAULT_MAX_WAIT;

		Builder(OAuthConfig config) {
			Assert.notNull(config, "config must not be null");
			this.config = config;
		}

		public Builder httpClient(HttpClient httpClient) {
			Assert.notNull(httpClient, "httpClient must not be null");
			this.httpClient = httpClient;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Sets the token storage. Defaults to a {@link FileTokenStorage} in the configured
		 * authentication directory.
		 * @param tokenStorage the token storage
		 * @return this builder
		 */
		public Builder tokenStorage(TokenStorage tokenStorage) {
			Assert.notNull(tokenStorage, "tokenStorage must not be null");
			this.tokenStorage = tokenStorage;
			return this;
		}

		public Builder browserLauncher(BrowserLauncher browserLauncher) {
			Assert.notNull(browserLauncher, "browserLauncher must not be null");
			this.browserLauncher = browserLauncher;
			return this;
		}

		public Builder livenessProbe(ProcessLivenessProbe livenessProbe) {
			Assert.notNull(livenessProbe, "livenessProbe must not be null");
			this.livenessProbe = livenessProbe;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		Builder coordinationTiming(Duration pollInterval, Duration maxWait) {
			this.coordinationPollInterval = pollInterval;
			this.coordinationMaxWait = maxWait;
			return this;
		}

		public OAuthClient build() {
			HttpClient client = httpClient != null ? httpClient
					: HttpClient.newBuilder()
						.version(HttpClient.Version.HTTP_1_1)
						.connectTimeout(Duration.ofSeconds(10))
						.followRedirects(HttpClient.Redirect.NORMAL)
						.build();
			ObjectMapper mapper = objectMapper != null ? objectMapper : OAuthObjectMapper.create();
			TokenStorage storage = tokenStorage != null ? tokenStorage
					: new FileTokenStorage(config.getAuthDir(), mapper);
			BrowserLauncher launcher = browserLauncher != null ? browserLauncher : new SystemBrowserLauncher();

			CoordinationManager coordination = new CoordinationManager(config.getAuthDir(),
					CoordinationManager.hashServerUrl(config.getServerUrl()), mapper, livenessProbe, clock,
					coordinationPollInterval, coordinationMaxWait);
			return new OAuthClient(config, new OAuthMetadataDiscoverer(client, mapper),
					new DynamicClientRegistrar(client, mapper), new TokenManager(client, storage, mapper, clock),
					coordination, launcher);
		}

	}

}
