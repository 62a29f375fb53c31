package io.mcpremote.client.auth;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpremote.auth.StoredToken;
import reactor.core.publisher.Mono;

/**
 * In-memory implementation of TokenStorage.
 */
public class InMemoryTokenStorage implements TokenStorage {

	private final Map<String, StoredToken> tokens = new ConcurrentHashMap<>();

	@Override
	public Mono<StoredToken> load(String serverUrl) {
		return Mono.fromSupplier(() -> tokens.get(serverUrl));
	}

	@Override
	public Mono<Void> save(StoredToken token) {
		return Mono.fromRunnable(() -> tokens.put(token.getServerUrl(), token));
	}

	@Override
	public Mono<Void> delete(String serverUrl) {
		return Mono.fromRunnable(() -> tokens.remove(serverUrl));
	}

}
