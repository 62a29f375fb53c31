/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.StoredToken;
import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link TokenStorage} that keeps one pretty-printed JSON file per server in a storage
 * directory, typically {@code ~/.mcp-auth}. The file name is the server URL with
 * URL-reserved characters replaced by {@code '_'}.
 */
public class FileTokenStorage implements TokenStorage {

	private static final Logger logger = LoggerFactory.getLogger(FileTokenStorage.class);

	private final Path storageDir;

	private final ObjectMapper objectMapper;

	public FileTokenStorage(Path storageDir, ObjectMapper objectMapper) {
		Assert.notNull(storageDir, "storageDir must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.storageDir = storageDir;
		this.objectMapper = objectMapper;
	}

	@Override
	public Mono<StoredToken> load(String serverUrl) {
		return Mono.fromCallable(() -> {
			Path tokenFile = getTokenFilePath(serverUrl);
			String content;
			try {
				content = Files.readString(tokenFile, StandardCharsets.UTF_8);
			}
			catch (NoSuchFileException e) {
				logger.debug("No stored token found for server: {}", serverUrl);
				return null;
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.IO, "Failed to read token file " + tokenFile, e);
			}
			try {
				StoredToken token = objectMapper.readValue(content, StoredToken.class);
				logger.debug("Loaded token for server: {}", serverUrl);
				return token;
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.JSON, "Invalid token file " + tokenFile, e);
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> save(StoredToken token) {
		return Mono.<Void>fromRunnable(() -> {
			Path tokenFile = getTokenFilePath(token.getServerUrl());
			try {
				String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(token);
				Files.createDirectories(storageDir);
				Files.writeString(tokenFile, json, StandardCharsets.UTF_8);
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.IO, "Failed to write token file " + tokenFile, e);
			}
			logger.info("Token saved successfully for server: {}", token.getServerUrl());
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> delete(String serverUrl) {
		return Mono.<Void>fromRunnable(() -> {
			Path tokenFile = getTokenFilePath(serverUrl);
			try {
				if (Files.deleteIfExists(tokenFile)) {
					logger.info("Deleted stored token for server: {}", serverUrl);
				}
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.IO, "Failed to delete token file " + tokenFile, e);
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Get the file path for storing a token for a given server URL.
	 * @param serverUrl the MCP server URL
	 * @return the token file, e.g. {@code https_api.example.com_oauth.json}
	 */
	public Path getTokenFilePath(String serverUrl) {
		String safeName = serverUrl.replace("://", "_")
			.replace('/', '_')
			.replace(':', '_')
			.replace('?', '_')
			.replace('&', '_');
		return storageDir.resolve(safeName + ".json");
	}

}
