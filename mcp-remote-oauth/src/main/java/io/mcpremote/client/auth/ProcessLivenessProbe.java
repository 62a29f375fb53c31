/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

/**
 * Tells whether an operating system process is still running. Used to detect lock files
 * left behind by crashed instances.
 */
@FunctionalInterface
public interface ProcessLivenessProbe {

	/**
	 * @param pid the operating system process id
	 * @return {@code true} if the process is running
	 */
	boolean isAlive(long pid);

	/**
	 * Probe backed by {@link ProcessHandle}.
	 * @return the default probe
	 */
	static ProcessLivenessProbe system() {
		return pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
	}

}
