package io.mcpremote.client.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import io.mcpremote.auth.PkceChallenge;

/**
 * Utility class for PKCE (Proof Key for Code Exchange) operations.
 */
public final class PkceUtils {

	/** The only challenge method this client sends. */
	public static final String CODE_CHALLENGE_METHOD = "S256";

	private static final int VERIFIER_BYTES = 32;

	private static final int STATE_BYTES = 32;

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

	private PkceUtils() {
	}

	/**
	 * Generates a fresh verifier and its S256 challenge.
	 * @return a new PKCE challenge
	 */
	public static PkceChallenge generate() {
		String codeVerifier = generateCodeVerifier();
		return new PkceChallenge(codeVerifier, generateCodeChallenge(codeVerifier), CODE_CHALLENGE_METHOD);
	}

	/**
	 * Generates a cryptographically random code verifier for PKCE: 32 random bytes,
	 * base64url encoded without padding, which yields 43 characters.
	 * @return A random code verifier string.
	 */
	public static String generateCodeVerifier() {
		return randomUrlSafe(VERIFIER_BYTES);
	}

	/**
	 * Generates a code challenge from a code verifier using SHA-256.
	 * @param codeVerifier The code verifier to hash.
	 * @return The code challenge string.
	 */
	public static String generateCodeChallenge(String codeVerifier) {
		return BASE64_URL.encodeToString(sha256(codeVerifier.getBytes(StandardCharsets.US_ASCII)));
	}

	/**
	 * Checks that a verifier matches a previously issued challenge.
	 * @param codeVerifier the verifier to check
	 * @param codeChallenge the expected challenge
	 * @return {@code true} when the verifier hashes to the challenge
	 */
	public static boolean verify(String codeVerifier, String codeChallenge) {
		if (codeVerifier == null || codeChallenge == null) {
			return false;
		}
		byte[] computed = generateCodeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(computed, codeChallenge.getBytes(StandardCharsets.US_ASCII));
	}

	/**
	 * Generates an unguessable {@code state} value for CSRF protection.
	 * @return a random URL-safe token
	 */
	public static String generateState() {
		return randomUrlSafe(STATE_BYTES);
	}

	private static String randomUrlSafe(int byteCount) {
		byte[] bytes = new byte[byteCount];
		secureRandom.nextBytes(bytes);
		return BASE64_URL.encodeToString(bytes);
	}

	private static byte[] sha256(byte[] input) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(input);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

}
