/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

/**
 * Exception signalled by the OAuth authorization engine. The {@link Kind} tells callers
 * which step of the authorization attempt failed; HTTP failures additionally carry the
 * status code and the response body returned by the server.
 */
public class OAuthException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Failure categories of an authorization attempt.
	 */
	public enum Kind {

		/** The HTTP request could not be sent or no response was received. */
		HTTP,
		/** A JSON document could not be read or written. */
		JSON,
		/** Local file I/O failed. */
		IO,
		/** A stored token is missing or unreadable. */
		TOKEN_STORAGE,
		BROWSER_LAUNCH,
		/** The local callback listener could not be bound or failed. */
		CALLBACK_SERVER,
		CLIENT_REGISTRATION,
		/** The callback's {@code state} did not match the one sent. */
		CSRF,
		TOKEN_EXCHANGE,
		TOKEN_REFRESH,
		/** No authorization callback arrived in time. */
		AUTH_TIMEOUT,
		INVALID_CONFIGURATION,
		MISSING_PARAMETER,
		/** The authorization server redirected back with an {@code error}. */
		AUTHORIZATION_DENIED

	}

	private final Kind kind;

	private final Integer statusCode;

	private final String responseBody;

	public OAuthException(Kind kind, String message) {
		this(kind, message, null, null, null);
	}

	public OAuthException(Kind kind, String message, Throwable cause) {
		this(kind, message, null, null, cause);
	}

	/**
	 * Creates an exception for a rejected HTTP request.
	 * @param kind the failure category
	 * @param message the error message
	 * @param statusCode the HTTP status returned by the server
	 * @param responseBody the response body returned by the server
	 */
	public OAuthException(Kind kind, String message, int statusCode, String responseBody) {
		this(kind, message + " (HTTP " + statusCode + "): " + responseBody, statusCode, responseBody, null);
	}

	private OAuthException(Kind kind, String message, Integer statusCode, String responseBody, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Gets the HTTP status code associated with this exception.
	 * @return the status code, or {@code null} when no HTTP response was involved
	 */
	public Integer getStatusCode() {
		return statusCode;
	}

	public String getResponseBody() {
		return responseBody;
	}

}
