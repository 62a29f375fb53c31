/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.auth.LockfileData;
import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Coordinates interactive authorization between proxy processes that target the same
 * server, so that only one of them opens a browser window.
 *
 * <p>
 * The instance running the flow writes {@code {authDir}/{hash}_lock.json}; other
 * instances find it and poll until it disappears. The lock is advisory: existence plus
 * a staleness check, no exclusive create. Two processes that check at the same moment
 * can both proceed and both open a browser.
 */
public class CoordinationManager {

	private static final Logger logger = LoggerFactory.getLogger(CoordinationManager.class);

	static final Duration MAX_LOCK_AGE = Duration.ofMinutes(30);

	static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

	static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(5);

	private final Path authDir;

	private final String serverUrlHash;

	private final ObjectMapper objectMapper;

	private final ProcessLivenessProbe livenessProbe;

	private final Clock clock;

	private final Duration pollInterval;

	private final Duration maxWait;

	public CoordinationManager(Path authDir, String serverUrlHash, ObjectMapper objectMapper,
			ProcessLivenessProbe livenessProbe, Clock clock) {
		this(authDir, serverUrlHash, objectMapper, livenessProbe, clock, DEFAULT_POLL_INTERVAL, DEFAULT_MAX_WAIT);
	}

	CoordinationManager(Path authDir, String serverUrlHash, ObjectMapper objectMapper,
			ProcessLivenessProbe livenessProbe, Clock clock, Duration pollInterval, Duration maxWait) {
		Assert.notNull(authDir, "authDir must not be null");
		Assert.hasText(serverUrlHash, "serverUrlHash must not be empty");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(livenessProbe, "livenessProbe must not be null");
		Assert.notNull(clock, "clock must not be null");
		Assert.isTrue(!pollInterval.isNegative() && !pollInterval.isZero(), "pollInterval must be positive");
		Assert.isTrue(maxWait.compareTo(pollInterval) >= 0, "maxWait must not be shorter than pollInterval");
		this.authDir = authDir;
		this.serverUrlHash = serverUrlHash;
		this.objectMapper = objectMapper;
		this.livenessProbe = livenessProbe;
		this.clock = clock;
		this.pollInterval = pollInterval;
		this.maxWait = maxWait;
	}

	/**
	 * Hashes a server URL into the hex key used for lock file names.
	 * @param serverUrl the MCP server URL
	 * @return 16 lowercase hex characters
	 */
	public static String hashServerUrl(String serverUrl) {
		try {
			byte[] digest = MessageDigest.getInstance("SHA-256").digest(serverUrl.getBytes(StandardCharsets.UTF_8));
			return HexFormat.of().formatHex(digest, 0, 8);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	public Path getLockFilePath() {
		return authDir.resolve(serverUrlHash + "_lock.json");
	}

	/**
	 * Reads the lock file. A lock that is older than 30 minutes, names a process that is
	 * no longer running, or cannot be parsed is deleted and reported as absent.
	 * @return a Mono emitting the live lock, or empty when there is none
	 */
	public Mono<LockfileData> checkLockfile() {
		return Mono.fromCallable(this::readLockfile)
			.subscribeOn(Schedulers.boundedElastic())
			.flatMap(lock -> {
				if (isLockValid(lock)) {
					return Mono.just(lock);
				}
				logger.info("Lock file exists but is stale, removing it");
				return deleteLockfile().then(Mono.empty());
			});
	}

	private LockfileData readLockfile() {
		Path lockPath = getLockFilePath();
		String content;
		try {
			content = Files.readString(lockPath, StandardCharsets.UTF_8);
		}
		catch (NoSuchFileException e) {
			logger.debug("No lock file found at {}", lockPath);
			return null;
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.IO, "Failed to read lock file " + lockPath, e);
		}
		try {
			return objectMapper.readValue(content, LockfileData.class);
		}
		catch (IOException e) {
			logger.warn("Invalid lock file format at {}: {}", lockPath, e.getMessage());
			// a zero timestamp marks it stale
			return new LockfileData(0, 0, 0, serverUrlHash);
		}
	}

	boolean isLockValid(LockfileData lock) {
		long ageSeconds = clock.instant().getEpochSecond() - lock.timestamp();
		if (ageSeconds > MAX_LOCK_AGE.toSeconds()) {
			logger.debug("Lock file is too old: {} seconds", ageSeconds);
			return false;
		}
		if (!livenessProbe.isAlive(lock.pid())) {
			logger.debug("Process {} from lock file is not running", lock.pid());
			return false;
		}
		return true;
	}

	/**
	 * Writes a lock file naming this process and its callback port.
	 * @param port the port of this instance's callback listener
	 * @return a Mono completing once the file is written
	 */
	public Mono<Void> createLockfile(int port) {
		return Mono.<Void>fromRunnable(() -> {
			LockfileData lock = new LockfileData(ProcessHandle.current().pid(), port,
					clock.instant().getEpochSecond(), serverUrlHash);
			try {
				Files.createDirectories(authDir);
				Files.writeString(getLockFilePath(),
						objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(lock), StandardCharsets.UTF_8);
			}
			catch (IOException e) {
				throw new OAuthException(OAuthException.Kind.IO, "Failed to write lock file " + getLockFilePath(), e);
			}
			logger.info("Created lock file for PID {} on port {}", lock.pid(), port);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Deletes the lock file if present. Failures are logged and swallowed.
	 * @return a Mono that always completes empty
	 */
	public Mono<Void> deleteLockfile() {
		return Mono.<Void>fromRunnable(() -> {
			try {
				if (Files.deleteIfExists(getLockFilePath())) {
					logger.debug("Deleted lock file: {}", getLockFilePath());
				}
			}
			catch (IOException e) {
				logger.warn("Failed to delete lock file {}: {}", getLockFilePath(), e.getMessage());
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Waits for another instance to finish its interactive flow.
	 * @param port the callback port named by the lock this instance is waiting on
	 * @return a Mono emitting {@code true} when the lock disappeared, {@code false} when
	 * the lock now names a different port or the wait timed out
	 */
	public Mono<Boolean> waitForAuthentication(int port) {
		long maxPolls = maxWait.toMillis() / pollInterval.toMillis();
		logger.info("Waiting for authentication to complete on port {}", port);

		return Flux.interval(pollInterval)
			.take(maxPolls)
			.concatMap(tick -> checkLockfile().map(lock -> {
				if (lock.port() == port) {
					logger.debug("Poll {}/{}: authentication still in progress", tick + 1, maxPolls);
					return PollOutcome.WAITING;
				}
				logger.warn("Lock file exists but for a different port, giving up coordination");
				return PollOutcome.OTHER_FLOW;
			}).defaultIfEmpty(PollOutcome.RELEASED))
			.filter(outcome -> outcome != PollOutcome.WAITING)
			.next()
			.map(outcome -> {
				if (outcome == PollOutcome.RELEASED) {
					logger.info("Lock file disappeared, authentication may be complete");
					return true;
				}
				return false;
			})
			.switchIfEmpty(Mono.fromSupplier(() -> {
				logger.warn("Timed out waiting for authentication to complete, proceeding with own auth");
				return false;
			}));
	}

	private enum PollOutcome {

		WAITING, RELEASED, OTHER_FLOW

	}

}
