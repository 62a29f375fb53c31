package io.mcpremote.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 8414 OAuth 2.0 Authorization Server Metadata. See
 * https://datatracker.ietf.org/doc/html/rfc8414#section-2
 * <p>
 * Only the fields the authorization engine consumes are modelled explicitly; every other
 * member of the discovery document is kept in {@link #getExtra()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthMetadata {

	@JsonProperty("issuer")
	private String issuer;

	@JsonProperty("authorization_endpoint")
	private String authorizationEndpoint;

	@JsonProperty("token_endpoint")
	private String tokenEndpoint;

	@JsonProperty("registration_endpoint")
	private String registrationEndpoint;

	@JsonProperty("jwks_uri")
	private String jwksUri;

	@JsonProperty("response_types_supported")
	private List<String> responseTypesSupported;

	@JsonProperty("grant_types_supported")
	private List<String> grantTypesSupported;

	@JsonProperty("token_endpoint_auth_methods_supported")
	private List<String> tokenEndpointAuthMethodsSupported;

	@JsonProperty("scopes_supported")
	private List<String> scopesSupported;

	@JsonProperty("code_challenge_methods_supported")
	private List<String> codeChallengeMethodsSupported;

	private final Map<String, Object> extra = new LinkedHashMap<>();

	public OAuthMetadata() {
	}

	public String getIssuer() {
		return issuer;
	}

	public void setIssuer(String issuer) {
		this.issuer = issuer;
	}

	public String getAuthorizationEndpoint() {
		return authorizationEndpoint;
	}

	public void setAuthorizationEndpoint(String authorizationEndpoint) {
		this.authorizationEndpoint = authorizationEndpoint;
	}

	public String getTokenEndpoint() {
		return tokenEndpoint;
	}

	public void setTokenEndpoint(String tokenEndpoint) {
		this.tokenEndpoint = tokenEndpoint;
	}

	public String getRegistrationEndpoint() {
		return registrationEndpoint;
	}

	public void setRegistrationEndpoint(String registrationEndpoint) {
		this.registrationEndpoint = registrationEndpoint;
	}

	public String getJwksUri() {
		return jwksUri;
	}

	public void setJwksUri(String jwksUri) {
		this.jwksUri = jwksUri;
	}

	public List<String> getResponseTypesSupported() {
		return responseTypesSupported;
	}

	public void setResponseTypesSupported(List<String> responseTypesSupported) {
		this.responseTypesSupported = responseTypesSupported;
	}

	public List<String> getGrantTypesSupported() {
		return grantTypesSupported;
	}

	public void setGrantTypesSupported(List<String> grantTypesSupported) {
		this.grantTypesSupported = grantTypesSupported;
	}

	public List<String> getTokenEndpointAuthMethodsSupported() {
		return tokenEndpointAuthMethodsSupported;
	}

	public void setTokenEndpointAuthMethodsSupported(List<String> tokenEndpointAuthMethodsSupported) {
		this.tokenEndpointAuthMethodsSupported = tokenEndpointAuthMethodsSupported;
	}

	public List<String> getScopesSupported() {
		return scopesSupported;
	}

	public void setScopesSupported(List<String> scopesSupported) {
		this.scopesSupported = scopesSupported;
	}

	public List<String> getCodeChallengeMethodsSupported() {
		return codeChallengeMethodsSupported;
	}

	public void setCodeChallengeMethodsSupported(List<String> codeChallengeMethodsSupported) {
		this.codeChallengeMethodsSupported = codeChallengeMethodsSupported;
	}

	/**
	 * Discovery document members without a dedicated property.
	 * @return the unmodelled metadata, never {@code null}
	 */
	@JsonAnyGetter
	public Map<String, Object> getExtra() {
		return extra;
	}

	@JsonAnySetter
	public void putExtra(String name, Object value) {
		this.extra.put(name, value);
	}

}
