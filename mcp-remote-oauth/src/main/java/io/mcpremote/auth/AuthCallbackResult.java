package io.mcpremote.auth;

/**
 * Result of an OAuth authorization callback.
 *
 * @param code the authorization code
 * @param state the state parameter echoed by the authorization server
 */
public record AuthCallbackResult(String code, String state) {
}
