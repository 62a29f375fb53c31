package io.mcpremote.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7591 OAuth 2.0 Dynamic Client Registration full response (client information plus
 * metadata). Also used for statically configured client credentials.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthClientInformation extends OAuthClientMetadata {

	@JsonProperty("client_id")
	private String clientId;

	@JsonProperty("client_secret")
	private String clientSecret;

	@JsonProperty("client_id_issued_at")
	private Long clientIdIssuedAt;

	@JsonProperty("client_secret_expires_at")
	private Long clientSecretExpiresAt;

	@JsonProperty("registration_access_token")
	private String registrationAccessToken;

	@JsonProperty("registration_client_uri")
	private String registrationClientUri;

	public OAuthClientInformation() {
		super();
	}

	/**
	 * Creates client credentials for a pre-registered client.
	 * @param clientId the client identifier
	 * @param clientSecret the client secret, {@code null} for public clients
	 * @return the client information
	 */
	public static OAuthClientInformation of(String clientId, String clientSecret) {
		OAuthClientInformation info = new OAuthClientInformation();
		info.setClientId(clientId);
		info.setClientSecret(clientSecret);
		return info;
	}

	public String getClientId() {
		return clientId;
	}

	public void setClientId(String clientId) {
		this.clientId = clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public void setClientSecret(String clientSecret) {
		this.clientSecret = clientSecret;
	}

	public Long getClientIdIssuedAt() {
		return clientIdIssuedAt;
	}

	public void setClientIdIssuedAt(Long clientIdIssuedAt) {
		this.clientIdIssuedAt = clientIdIssuedAt;
	}

	public Long getClientSecretExpiresAt() {
		return clientSecretExpiresAt;
	}

	public void setClientSecretExpiresAt(Long clientSecretExpiresAt) {
		this.clientSecretExpiresAt = clientSecretExpiresAt;
	}

	public String getRegistrationAccessToken() {
		return registrationAccessToken;
	}

	public void setRegistrationAccessToken(String registrationAccessToken) {
		this.registrationAccessToken = registrationAccessToken;
	}

	public String getRegistrationClientUri() {
		return registrationClientUri;
	}

	public void setRegistrationClientUri(String registrationClientUri) {
		this.registrationClientUri = registrationClientUri;
	}

}
