package io.mcpremote.auth;

/**
 * PKCE (RFC 7636) verifier and challenge pair for a single authorization attempt.
 *
 * @param codeVerifier the secret verifier sent with the token request
 * @param codeChallenge the derived challenge sent with the authorization request
 * @param codeChallengeMethod the transformation used, always {@code S256}
 */
public record PkceChallenge(String codeVerifier, String codeChallenge, String codeChallengeMethod) {

	@Override
	public String toString() {
		return "PkceChallenge[codeChallenge=" + codeChallenge + ", codeChallengeMethod=" + codeChallengeMethod + "]";
	}

}
