/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import io.mcpremote.auth.OAuthClientInformation;
import io.mcpremote.auth.OAuthMetadata;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;

/**
 * Immutable configuration of an {@link OAuthClient}, validated when built.
 *
 * <p>
 * The authentication directory defaults to {@code ~/.mcp-auth}; it can be moved with the
 * {@value #AUTH_DIR_PROPERTY} system property or the {@value #AUTH_DIR_ENV} environment
 * variable.
 */
public final class OAuthConfig {

	public static final String AUTH_DIR_PROPERTY = "mcp.remote.auth.dir";

	public static final String AUTH_DIR_ENV = "MCP_REMOTE_AUTH_DIR";

	static final String DEFAULT_CALLBACK_HOST = "localhost";

	static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofMinutes(5);

	static final String DEFAULT_CLIENT_NAME = "MCP Remote";

	private final String serverUrl;

	private final Path authDir;

	private final OAuthMetadata serverMetadata;

	private final OAuthClientInformation staticClientInfo;

	private final Integer callbackPort;

	private final String callbackHost;

	private final Duration authTimeout;

	private final String scope;

	private final String clientName;

	private OAuthConfig(Builder builder) {
		this.serverUrl = builder.serverUrl;
		this.authDir = builder.authDir != null ? builder.authDir : defaultAuthDir();
		this.serverMetadata = builder.serverMetadata;
		this.staticClientInfo = builder.staticClientInfo;
		this.callbackPort = builder.callbackPort;
		this.callbackHost = builder.callbackHost;
		this.authTimeout = builder.authTimeout;
		this.scope = builder.scope;
		this.clientName = builder.clientName;
	}

	/**
	 * Creates a new builder.
	 * @param serverUrl the MCP server URL, absolute {@code http} or {@code https}
	 * @return a new builder instance
	 */
	public static Builder builder(String serverUrl) {
		return new Builder(serverUrl);
	}

	static Path defaultAuthDir() {
		String configured = System.getProperty(AUTH_DIR_PROPERTY);
		if (!Utils.hasText(configured)) {
			configured = System.getenv(AUTH_DIR_ENV);
		}
		if (Utils.hasText(configured)) {
			return Paths.get(configured);
		}
		return Paths.get(System.getProperty("user.home"), ".mcp-auth");
	}

	public String getServerUrl() {
		return serverUrl;
	}

	public Path getAuthDir() {
		return authDir;
	}

	/**
	 * @return pre-known server metadata, or {@code null} to discover it
	 */
	public OAuthMetadata getServerMetadata() {
		return serverMetadata;
	}

	/**
	 * @return pre-registered client credentials, or {@code null} to register dynamically
	 */
	public OAuthClientInformation getStaticClientInfo() {
		return staticClientInfo;
	}

	/**
	 * @return the preferred callback port, or {@code null} for an OS-assigned one
	 */
	public Integer getCallbackPort() {
		return callbackPort;
	}

	public String getCallbackHost() {
		return callbackHost;
	}

	public Duration getAuthTimeout() {
		return authTimeout;
	}

	public String getScope() {
		return scope;
	}

	public String getClientName() {
		return clientName;
	}

	/**
	 * Builder for {@link OAuthConfig}.
	 */
	public static final class Builder {

		private final String serverUrl;

		private Path authDir;

		private OAuthMetadata serverMetadata;

		private OAuthClientInformation staticClientInfo;

		private Integer callbackPort;

		private String callbackHost = DEFAULT_CALLBACK_HOST;

		private Duration authTimeout = DEFAULT_AUTH_TIMEOUT;

		private String scope;

		private String clientName = DEFAULT_CLIENT_NAME;

		private Builder(String serverUrl) {
			Assert.hasText(serverUrl, "serverUrl must not be empty");
			URI uri;
			try {
				uri = URI.create(serverUrl);
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid server URL: " + serverUrl, e);
			}
			Assert.isTrue("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()),
					"serverUrl must be an absolute http or https URL");
			Assert.hasText(uri.getHost(), "serverUrl must include a host");
			this.serverUrl = serverUrl;
		}

		/**
		 * Sets the directory holding token and lock files.
		 * @param authDir the directory, created on first write
		 * @return this builder
		 */
		public Builder authDir(Path authDir) {
			Assert.notNull(authDir, "authDir must not be null");
			this.authDir = authDir;
			return this;
		}

		/**
		 * Use pre-discovered server metadata instead of the well-known endpoint.
		 * @param serverMetadata the metadata
		 * @return this builder
		 */
		public Builder serverMetadata(OAuthMetadata serverMetadata) {
			Assert.notNull(serverMetadata, "serverMetadata must not be null");
			Assert.hasText(serverMetadata.getAuthorizationEndpoint(), "authorization_endpoint must not be empty");
			Assert.hasText(serverMetadata.getTokenEndpoint(), "token_endpoint must not be empty");
			this.serverMetadata = serverMetadata;
			return this;
		}

		/**
		 * Use pre-registered OAuth client credentials instead of dynamic registration.
		 * @param clientId the client identifier
		 * @param clientSecret the client secret, {@code null} for public clients
		 * @return this builder
		 */
		public Builder staticClientInfo(String clientId, String clientSecret) {
			Assert.hasText(clientId, "clientId must not be empty");
			this.staticClientInfo = OAuthClientInformation.of(clientId, clientSecret);
			return this;
		}

		/**
		 * Sets the preferred callback port.
		 * @param callbackPort the port, {@code 0} for an OS-assigned one
		 * @return this builder
		 */
		public Builder callbackPort(int callbackPort) {
			Assert.isTrue(callbackPort >= 0 && callbackPort <= 65535, "callbackPort must be between 0 and 65535");
			this.callbackPort = callbackPort;
			return this;
		}

		public Builder callbackHost(String callbackHost) {
			Assert.hasText(callbackHost, "callbackHost must not be empty");
			this.callbackHost = callbackHost;
			return this;
		}

		/**
		 * Sets the maximum time to wait for the user to authorize in the browser.
		 * @param authTimeout a positive duration
		 * @return this builder
		 */
		public Builder authTimeout(Duration authTimeout) {
			Assert.notNull(authTimeout, "authTimeout must not be null");
			Assert.isTrue(!authTimeout.isNegative() && !authTimeout.isZero(), "authTimeout must be positive");
			this.authTimeout = authTimeout;
			return this;
		}

		public Builder scope(String scope) {
			Assert.hasText(scope, "scope must not be empty");
			this.scope = scope;
			return this;
		}

		public Builder clientName(String clientName) {
			Assert.hasText(clientName, "clientName must not be empty");
			this.clientName = clientName;
			return this;
		}

		public OAuthConfig build() {
			return new OAuthConfig(this);
		}

	}

}
