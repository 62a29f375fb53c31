/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link CallbackServer}.
 */
class CallbackServerTests {

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private CallbackServer callbackServer;

	@AfterEach
	void tearDown() {
		if (callbackServer != null) {
			callbackServer.stop();
		}
	}

	private HttpResponse<String> get(String url) throws IOException, InterruptedException {
		return httpClient.send(HttpRequest.newBuilder(URI.create(url)).GET().build(),
				HttpResponse.BodyHandlers.ofString());
	}

	@Test
	void testCallbackWithCodeAndState() throws Exception {
		callbackServer = CallbackServer.create(0);
		String callbackUrl = callbackServer.callbackUrl("127.0.0.1");
		assertThat(callbackUrl).isEqualTo("http://127.0.0.1:" + callbackServer.getPort() + "/callback");

		HttpResponse<String> response = get(callbackUrl + "?code=auth-code&state=xyz%2F1");
		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
				contentType -> assertThat(contentType).startsWith("text/html"));
		assertThat(response.body()).contains("Authorization Successful")
			.contains("<meta http-equiv=\"refresh\" content=\"2;url=/success\">");

		StepVerifier.create(callbackServer.waitForCallback(Duration.ofSeconds(5))).assertNext(callback -> {
			assertThat(callback.code()).isEqualTo("auth-code");
			assertThat(callback.state()).isEqualTo("xyz/1");
		}).verifyComplete();
	}

	@Test
	void testSuccessPageIsServed() throws Exception {
		callbackServer = CallbackServer.create(0);

		HttpResponse<String> response = get("http://127.0.0.1:" + callbackServer.getPort() + "/success");

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.body()).contains("Authorization Complete!");
	}

	@Test
	void testErrorRedirectIsReportedAsDenied() throws Exception {
		callbackServer = CallbackServer.create(0);

		get(callbackServer.callbackUrl("127.0.0.1") + "?error=access_denied&error_description=User+said+no");

		StepVerifier.create(callbackServer.waitForCallback(Duration.ofSeconds(5))).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(OAuthException.class);
			assertThat(((OAuthException) error).getKind()).isEqualTo(OAuthException.Kind.AUTHORIZATION_DENIED);
			assertThat(error.getMessage()).contains("access_denied").contains("User said no");
		}).verify();
	}

	@Test
	void testMissingCodeIsReported() throws Exception {
		callbackServer = CallbackServer.create(0);

		get(callbackServer.callbackUrl("127.0.0.1") + "?state=abc");

		StepVerifier.create(callbackServer.waitForCallback(Duration.ofSeconds(5)))
			.expectErrorSatisfies(error -> {
				assertThat(((OAuthException) error).getKind()).isEqualTo(OAuthException.Kind.MISSING_PARAMETER);
				assertThat(error.getMessage()).contains("code");
			})
			.verify();
	}

	@Test
	void testTimeoutStopsListener() {
		callbackServer = CallbackServer.create(0);
		String callbackUrl = callbackServer.callbackUrl("127.0.0.1");

		StepVerifier.create(callbackServer.waitForCallback(Duration.ofMillis(200)))
			.expectErrorSatisfies(
					error -> assertThat(((OAuthException) error).getKind()).isEqualTo(OAuthException.Kind.AUTH_TIMEOUT))
			.verify(Duration.ofSeconds(5));

		await().atMost(Duration.ofSeconds(5))
			.untilAsserted(() -> assertThatThrownBy(() -> get(callbackUrl + "?code=late&state=late"))
				.isInstanceOf(ConnectException.class));
	}

	@Test
	void testOnlyFirstCallbackCounts() throws Exception {
		callbackServer = CallbackServer.create(0);
		String callbackUrl = callbackServer.callbackUrl("127.0.0.1");

		get(callbackUrl + "?code=first&state=s");
		get(callbackUrl + "?code=second&state=s");

		StepVerifier.create(callbackServer.waitForCallback(Duration.ofSeconds(5)))
			.assertNext(callback -> assertThat(callback.code()).isEqualTo("first"))
			.verifyComplete();
	}

	@Test
	void testBusyPreferredPortFallsBackToEphemeralPort() throws Exception {
		try (ServerSocket occupied = new ServerSocket(0, 0, InetAddress.getByName("127.0.0.1"))) {
			int busyPort = occupied.getLocalPort();

			callbackServer = CallbackServer.create(busyPort);

			assertThat(callbackServer.getPort()).isNotEqualTo(busyPort).isPositive();
			assertThat(CallbackServer.findAvailablePort(busyPort)).isNotEqualTo(busyPort);
		}
	}

	@Test
	void testFindAvailablePortPrefersFreePort() {
		int free = CallbackServer.findAvailablePort(0);

		assertThat(CallbackServer.findAvailablePort(free)).isEqualTo(free);
	}

	@Test
	void testStopIsIdempotent() {
		callbackServer = CallbackServer.create(0);

		callbackServer.stop();
		callbackServer.close();
	}

}
