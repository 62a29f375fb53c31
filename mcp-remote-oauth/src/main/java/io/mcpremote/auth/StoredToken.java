package io.mcpremote.auth;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token persisted on disk for one MCP server, together with its bookkeeping timestamps.
 * A {@code null} {@link #getExpiresAt() expiresAt} means the token never expires.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredToken {

	@JsonProperty("access_token")
	private String accessToken;

	@JsonProperty("token_type")
	private String tokenType;

	@JsonProperty("refresh_token")
	private String refreshToken;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("expires_at")
	private Instant expiresAt;

	@JsonProperty("server_url")
	private String serverUrl;

	@JsonProperty("created_at")
	private Instant createdAt;

	@JsonProperty("updated_at")
	private Instant updatedAt;

	public StoredToken() {
	}

	/**
	 * Creates a stored token from a token endpoint response.
	 * @param response the token endpoint response
	 * @param serverUrl the MCP server the token belongs to
	 * @param now the issuing instant, used for both timestamps and as the base of
	 * {@code expires_in}
	 * @return the new stored token
	 */
	public static StoredToken fromResponse(OAuthToken response, String serverUrl, Instant now) {
		StoredToken token = new StoredToken();
		token.setAccessToken(response.getAccessToken());
		token.setTokenType(response.getTokenType());
		token.setRefreshToken(response.getRefreshToken());
		token.setScope(response.getScope());
		token.setExpiresAt(response.getExpiresIn() != null ? now.plusSeconds(response.getExpiresIn()) : null);
		token.setServerUrl(serverUrl);
		token.setCreatedAt(now);
		token.setUpdatedAt(now);
		return token;
	}

	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	public String getTokenType() {
		return tokenType;
	}

	public void setTokenType(String tokenType) {
		this.tokenType = tokenType;
	}

	public String getRefreshToken() {
		return refreshToken;
	}

	public void setRefreshToken(String refreshToken) {
		this.refreshToken = refreshToken;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public Instant getExpiresAt() {
		return expiresAt;
	}

	public void setExpiresAt(Instant expiresAt) {
		this.expiresAt = expiresAt;
	}

	public String getServerUrl() {
		return serverUrl;
	}

	public void setServerUrl(String serverUrl) {
		this.serverUrl = serverUrl;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(Instant createdAt) {
		this.createdAt = createdAt;
	}

	public Instant getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(Instant updatedAt) {
		this.updatedAt = updatedAt;
	}

	@Override
	public String toString() {
		return "StoredToken[serverUrl=" + serverUrl + ", tokenType=" + tokenType + ", scope=" + scope
				+ ", expiresAt=" + expiresAt + ", hasRefreshToken=" + (refreshToken != null) + "]";
	}

}
