package io.mcpremote.client.auth;

import io.mcpremote.auth.StoredToken;
import reactor.core.publisher.Mono;

/**
 * Interface for token storage implementations. Tokens are keyed by the MCP server URL
 * they were issued for.
 */
public interface TokenStorage {

	/**
	 * Get the stored token for a server.
	 * @param serverUrl the MCP server URL
	 * @return a Mono emitting the stored token, or empty if none exists
	 */
	Mono<StoredToken> load(String serverUrl);

	/**
	 * Store a token, replacing any token stored for the same
	 * {@link StoredToken#getServerUrl() server URL}.
	 * @param token the token to store
	 * @return a Mono that completes when the token is stored
	 */
	Mono<Void> save(StoredToken token);

	/**
	 * Delete the stored token for a server. Deleting a missing token is not an error.
	 * @param serverUrl the MCP server URL
	 * @return a Mono that completes when the token is gone
	 */
	Mono<Void> delete(String serverUrl);

}
