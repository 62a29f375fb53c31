/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import reactor.core.publisher.Mono;

/**
 * Hands the authorization URL to the user. Implementations recover from their own
 * failures, typically by printing the URL, so the returned Mono never errors.
 */
@FunctionalInterface
public interface BrowserLauncher {

	/**
	 * Open the given URL for the user.
	 * @param url the authorization URL
	 * @return a Mono that completes once the URL was handed over
	 */
	Mono<Void> launch(String url);

}
