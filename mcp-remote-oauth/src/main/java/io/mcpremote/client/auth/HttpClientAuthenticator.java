package io.mcpremote.client.auth;

import java.net.http.HttpRequest;

import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Authenticator for HTTP requests using OAuth.
 */
public class HttpClientAuthenticator {

	private static final Logger logger = LoggerFactory.getLogger(HttpClientAuthenticator.class);

	private final OAuthClient oauthClient;

	/**
	 * Creates a new HttpClientAuthenticator.
	 * @param oauthClient The OAuth client.
	 */
	public HttpClientAuthenticator(OAuthClient oauthClient) {
		Assert.notNull(oauthClient, "oauthClient must not be null");
		this.oauthClient = oauthClient;
	}

	/**
	 * Authenticate an HTTP request by adding an Authorization header with the OAuth
	 * token.
	 * @param requestBuilder The HTTP request builder.
	 * @return A Mono that emits the authenticated request builder.
	 */
	public Mono<HttpRequest.Builder> authenticate(HttpRequest.Builder requestBuilder) {
		return oauthClient.getAccessToken()
			.map(accessToken -> requestBuilder.header("Authorization", "Bearer " + accessToken));
	}

	/**
	 * Handle an HTTP response. A 401 means the server rejected the token, so the stored
	 * token is dropped and the next {@link #authenticate} call re-authorizes.
	 * @param statusCode The HTTP status code.
	 * @return A Mono that completes when the response is handled.
	 */
	public Mono<Void> handleResponse(int statusCode) {
		if (statusCode == 401) {
			logger.info("Server rejected the access token, clearing stored token for {}",
					oauthClient.getServerUrl());
			return oauthClient.clearTokens();
		}
		return Mono.empty();
	}

}
