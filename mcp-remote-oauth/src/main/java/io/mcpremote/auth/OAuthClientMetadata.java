package io.mcpremote.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7591 OAuth 2.0 Dynamic Client Registration metadata. See
 * https://datatracker.ietf.org/doc/html/rfc7591#section-2
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthClientMetadata {

	@JsonProperty("redirect_uris")
	private List<String> redirectUris;

	@JsonProperty("token_endpoint_auth_method")
	private String tokenEndpointAuthMethod;

	@JsonProperty("grant_types")
	private List<String> grantTypes;

	@JsonProperty("response_types")
	private List<String> responseTypes;

	@JsonProperty("client_name")
	private String clientName;

	@JsonProperty("client_uri")
	private String clientUri;

	@JsonProperty("logo_uri")
	private String logoUri;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("contacts")
	private List<String> contacts;

	@JsonProperty("tos_uri")
	private String tosUri;

	@JsonProperty("policy_uri")
	private String policyUri;

	@JsonProperty("jwks_uri")
	private String jwksUri;

	@JsonProperty("software_id")
	private String softwareId;

	@JsonProperty("software_version")
	private String softwareVersion;

	private final Map<String, Object> additionalMetadata = new LinkedHashMap<>();

	public OAuthClientMetadata() {
	}

	public List<String> getRedirectUris() {
		return redirectUris;
	}

	public void setRedirectUris(List<String> redirectUris) {
		this.redirectUris = redirectUris;
	}

	public String getTokenEndpointAuthMethod() {
		return tokenEndpointAuthMethod;
	}

	public void setTokenEndpointAuthMethod(String tokenEndpointAuthMethod) {
		this.tokenEndpointAuthMethod = tokenEndpointAuthMethod;
	}

	public List<String> getGrantTypes() {
		return grantTypes;
	}

	public void setGrantTypes(List<String> grantTypes) {
		this.grantTypes = grantTypes;
	}

	public List<String> getResponseTypes() {
		return responseTypes;
	}

	public void setResponseTypes(List<String> responseTypes) {
		this.responseTypes = responseTypes;
	}

	public String getClientName() {
		return clientName;
	}

	public void setClientName(String clientName) {
		this.clientName = clientName;
	}

	public String getClientUri() {
		return clientUri;
	}

	public void setClientUri(String clientUri) {
		this.clientUri = clientUri;
	}

	public String getLogoUri() {
		return logoUri;
	}

	public void setLogoUri(String logoUri) {
		this.logoUri = logoUri;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public List<String> getContacts() {
		return contacts;
	}

	public void setContacts(List<String> contacts) {
		this.contacts = contacts;
	}

	public String getTosUri() {
		return tosUri;
	}

	public void setTosUri(String tosUri) {
		this.tosUri = tosUri;
	}

	public String getPolicyUri() {
		return policyUri;
	}

	public void setPolicyUri(String policyUri) {
		this.policyUri = policyUri;
	}

	public String getJwksUri() {
		return jwksUri;
	}

	public void setJwksUri(String jwksUri) {
		this.jwksUri = jwksUri;
	}

	public String getSoftwareId() {
		return softwareId;
	}

	public void setSoftwareId(String softwareId) {
		this.softwareId = softwareId;
	}

	public String getSoftwareVersion() {
		return softwareVersion;
	}

	public void setSoftwareVersion(String softwareVersion) {
		this.softwareVersion = softwareVersion;
	}

	/**
	 * Extension members sent alongside the registered RFC 7591 fields, for example
	 * {@code mcp_version} and {@code application_type}.
	 */
	@JsonAnyGetter
	public Map<String, Object> getAdditionalMetadata() {
		return additionalMetadata;
	}

	@JsonAnySetter
	public void putAdditionalMetadata(String name, Object value) {
		this.additionalMetadata.put(name, value);
	}

}
