/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.mcpremote.auth.AuthCallbackResult;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Ephemeral loopback HTTP listener that captures the authorization redirect.
 *
 * <p>
 * The listener lives for exactly one authorization attempt. The first request to
 * {@code /callback} is turned into either an {@link AuthCallbackResult} or an
 * {@link OAuthException} and published on a single-slot sink, which
 * {@link #waitForCallback(Duration)} consumes once. The browser always receives the
 * static success page; the outcome on the caller side cannot be reported back to it.
 */
public class CallbackServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CallbackServer.class);

	static final String CALLBACK_PATH = "/callback";

	static final String SUCCESS_PATH = "/success";

	private static final String LOOPBACK = "127.0.0.1";

	private final HttpServer server;

	private final ExecutorService executor;

	private final Sinks.One<AuthCallbackResult> result = Sinks.one();

	private final AtomicBoolean stopped = new AtomicBoolean();

	private CallbackServer(HttpServer server, ExecutorService executor) {
		this.server = server;
		this.executor = executor;
	}

	/**
	 * Binds and starts a callback listener on the loopback interface.
	 * @param preferredPort port to try first, or {@code 0} for an OS-assigned port; when
	 * the preferred port is taken an OS-assigned port is used instead
	 * @return the running listener
	 * @throws OAuthException of kind {@link OAuthException.Kind#CALLBACK_SERVER} when no
	 * port can be bound
	 */
	public static CallbackServer create(int preferredPort) {
		Assert.isTrue(preferredPort >= 0 && preferredPort <= 65535, "preferredPort must be between 0 and 65535");
		HttpServer server = bind(preferredPort);
		ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
			Thread thread = new Thread(r, "oauth-callback-" + server.getAddress().getPort());
			thread.setDaemon(true);
			return thread;
		});
		CallbackServer callbackServer = new CallbackServer(server, executor);
		server.createContext(CALLBACK_PATH, callbackServer::handleCallback);
		server.createContext(SUCCESS_PATH, exchange -> respondHtml(exchange, 200, successPage()));
		server.setExecutor(executor);
		server.start();
		logger.info("OAuth callback server listening on {}", server.getAddress());
		return callbackServer;
	}

	private static HttpServer bind(int preferredPort) {
		InetAddress loopback;
		try {
			loopback = InetAddress.getByName(LOOPBACK);
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.CALLBACK_SERVER, "Cannot resolve loopback address", e);
		}
		if (preferredPort != 0) {
			try {
				return HttpServer.create(new InetSocketAddress(loopback, preferredPort), 0);
			}
			catch (BindException e) {
				logger.debug("Preferred callback port {} is in use, using an ephemeral port", preferredPort);
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.CALLBACK_SERVER,
						"Failed to bind to port " + preferredPort, e);
			}
		}
		try {
			return HttpServer.create(new InetSocketAddress(loopback, 0), 0);
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.CALLBACK_SERVER, "Failed to bind callback server", e);
		}
	}

	/**
	 * Finds a free loopback port.
	 * @param preferredPort port to try first, or {@code 0} for any free port
	 * @return the preferred port when it is free, otherwise an OS-assigned one
	 */
	public static int findAvailablePort(int preferredPort) {
		if (preferredPort != 0) {
			try (ServerSocket socket = new ServerSocket(preferredPort, 0, InetAddress.getByName(LOOPBACK))) {
				return socket.getLocalPort();
			}
			catch (IOException e) {
				logger.debug("Preferred port {} is not available: {}", preferredPort, e.getMessage());
			}
		}
		try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getByName(LOOPBACK))) {
			return socket.getLocalPort();
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.CALLBACK_SERVER, "No free port for the callback server", e);
		}
	}

	public int getPort() {
		return server.getAddress().getPort();
	}

	/**
	 * Get the redirect URI served by this listener.
	 * @param host host name the browser uses to reach this machine
	 * @return {@code http://{host}:{port}/callback}
	 */
	public String callbackUrl(String host) {
		return "http://" + host + ":" + getPort() + CALLBACK_PATH;
	}

	/**
	 * Waits for the authorization redirect. The listener is stopped once the returned Mono
	 * terminates or is cancelled, whatever the outcome.
	 * @param timeout maximum time to wait for the browser to come back
	 * @return a Mono emitting the callback, or erroring with
	 * {@link OAuthException.Kind#AUTH_TIMEOUT} on timeout, or with the error the redirect
	 * carried
	 */
	public Mono<AuthCallbackResult> waitForCallback(Duration timeout) {
		Assert.notNull(timeout, "timeout must not be null");
		// hop off the listener thread, stop() shuts its executor down
		return result.asMono()
			.publishOn(Schedulers.boundedElastic())
			.timeout(timeout)
			.onErrorMap(TimeoutException.class, ex -> {
				logger.warn("OAuth authorization timed out after {}", timeout);
				return new OAuthException(OAuthException.Kind.AUTH_TIMEOUT,
						"Authorization timed out after " + timeout.toSeconds() + " seconds");
			})
			.doOnNext(callback -> logger.info("Received OAuth authorization response"))
			.doFinally(signal -> stop());
	}

	void handleCallback(HttpExchange exchange) throws IOException {
		Map<String, String> params = Utils.parseQuery(exchange.getRequestURI().getRawQuery());
		logger.debug("Received OAuth callback with parameters: {}", params.keySet());
		try {
			respondHtml(exchange, 200, callbackPage());
		}
		finally {
			publish(params);
		}
	}

	private void publish(Map<String, String> params) {
		Sinks.EmitResult emitResult;
		String error = params.get("error");
		if (error != null) {
			String description = params.getOrDefault("error_description", "No description provided");
			logger.error("OAuth authorization error: {} - {}", error, description);
			emitResult = result.tryEmitError(new OAuthException(OAuthException.Kind.AUTHORIZATION_DENIED,
					"Authorization error: " + error + " - " + description));
		}
		else if (Utils.hasText(params.get("code")) && params.get("state") != null) {
			emitResult = result.tryEmitValue(new AuthCallbackResult(params.get("code"), params.get("state")));
		}
		else {
			String missing = Utils.hasText(params.get("code")) ? "state" : "code";
			logger.warn("Missing {} parameter in callback", missing);
			emitResult = result.tryEmitError(
					new OAuthException(OAuthException.Kind.MISSING_PARAMETER, "Missing " + missing + " parameter"));
		}
		if (emitResult.isFailure()) {
			logger.debug("Ignoring additional callback request: {}", emitResult);
		}
	}

	private static void respondHtml(HttpExchange exchange, int status, String html) throws IOException {
		byte[] body = html.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
		exchange.getResponseHeaders().set("Cache-Control", "no-store");
		exchange.sendResponseHeaders(status, body.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(body);
		}
	}

	/**
	 * Stops the listener without waiting for in-flight exchanges. Idempotent.
	 */
	public void stop() {
		if (stopped.compareAndSet(false, true)) {
			server.stop(0);
			executor.shutdownNow();
			logger.debug("OAuth callback server on port {} stopped", getPort());
		}
	}

	@Override
	public void close() {
		stop();
	}

	static String callbackPage() {
		return """
				<html>
				<head>
				    <title>Authorization Successful</title>
				    <meta http-equiv="refresh" content="2;url=/success">
				    <style>
				        body { font-family: Arial, sans-serif; text-align: center; margin-top: 50px; }
				        .success { color: #28a745; }
				        .loading { color: #6c757d; }
				    </style>
				</head>
				<body>
				    <h2 class="success">Authorization Successful!</h2>
				    <p class="loading">You can now close this window and return to the MCP Remote application.</p>
				    <p><small>Redirecting to success page...</small></p>
				</body>
				</html>
				""";
	}

	static String successPage() {
		return """
				<html>
				<head>
				    <title>MCP Remote - Authorization Complete</title>
				    <style>
				        body { font-family: Arial, sans-serif; text-align: center; margin-top: 50px; }
				        .success { color: #28a745; }
				        .container { max-width: 500px; margin: 0 auto; }
				    </style>
				</head>
				<body>
				    <div class="container">
				        <h1 class="success">Authorization Complete!</h1>
				        <p>You can now close this browser window and return to your terminal.</p>
				    </div>
				</body>
				</html>
				""";
	}

}
