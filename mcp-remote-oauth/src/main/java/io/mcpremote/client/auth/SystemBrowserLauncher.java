/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link BrowserLauncher} that opens the default browser through the platform's URL
 * opener command. When no command succeeds the URL is printed to standard error; standard
 * output is reserved for the STDIO MCP stream.
 */
public class SystemBrowserLauncher implements BrowserLauncher {

	private static final Logger logger = LoggerFactory.getLogger(SystemBrowserLauncher.class);

	private static final List<String> UNIX_LAUNCHERS = List.of("xdg-open", "gnome-open", "kde-open", "firefox",
			"chromium", "chrome");

	private static final long LAUNCH_TIMEOUT_SECONDS = 10;

	private final String osName;

	private final PrintStream console;

	public SystemBrowserLauncher() {
		this(System.getProperty("os.name", ""), System.err);
	}

	SystemBrowserLauncher(String osName, PrintStream console) {
		this.osName = osName.toLowerCase(Locale.ROOT);
		this.console = console;
	}

	@Override
	public Mono<Void> launch(String url) {
		return Mono.<Void>fromRunnable(() -> {
			logger.info("Launching browser for OAuth authorization");
			if (!isAvailable()) {
				logger.warn("No browser launcher found on this system");
				printFallback(url);
				return;
			}
			try {
				openWithPlatformCommand(url);
				logger.info("Browser launched successfully");
			}
			catch (OAuthException e) {
				logger.warn("Failed to launch browser: {}", e.getMessage());
				printFallback(url);
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private void openWithPlatformCommand(String url) {
		if (isWindows()) {
			run(List.of("rundll32", "url.dll,FileProtocolHandler", url));
		}
		else if (isMac()) {
			run(List.of("open", url));
		}
		else {
			for (String launcher : UNIX_LAUNCHERS) {
				try {
					run(List.of(launcher, url));
					logger.debug("Successfully launched browser with: {}", launcher);
					return;
				}
				catch (OAuthException e) {
					logger.debug("Browser launcher {} failed: {}", launcher, e.getMessage());
				}
			}
			throw new OAuthException(OAuthException.Kind.BROWSER_LAUNCH,
					"No suitable browser launcher found on this system");
		}
	}

	private void run(List<String> command) {
		try {
			Process process = new ProcessBuilder(command).redirectErrorStream(true)
				.redirectOutput(ProcessBuilder.Redirect.DISCARD)
				.start();
			if (!process.waitFor(LAUNCH_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				// still running means the browser itself was started in the foreground
				return;
			}
			if (process.exitValue() != 0) {
				throw new OAuthException(OAuthException.Kind.BROWSER_LAUNCH,
						command.get(0) + " exited with status " + process.exitValue());
			}
		}
		catch (IOException e) {
			throw new OAuthException(OAuthException.Kind.BROWSER_LAUNCH, command.get(0) + " could not be started", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new OAuthException(OAuthException.Kind.BROWSER_LAUNCH, "Interrupted while launching browser", e);
		}
	}

	void printFallback(String url) {
		console.println();
		console.println("Please open the following URL in your browser to authorize the application:");
		console.println("   " + url);
		console.println("After authorization, return to this application.");
		console.println();
	}

	/**
	 * Check whether a browser can likely be opened on this system. Windows and macOS
	 * always ship a URL opener; elsewhere one of the known launchers must be on the
	 * {@code PATH}.
	 * @return {@code true} if a launcher is available
	 */
	public boolean isAvailable() {
		if (isWindows() || isMac()) {
			return true;
		}
		return UNIX_LAUNCHERS.stream().anyMatch(launcher -> isOnPath(launcher, System.getenv("PATH")));
	}

	static boolean isOnPath(String command, String path) {
		if (path == null || path.isEmpty()) {
			return false;
		}
		for (String dir : path.split(File.pathSeparator)) {
			if (dir.isEmpty()) {
				continue;
			}
			Path candidate = Paths.get(dir, command);
			if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Get the name of the launcher command that would be tried first.
	 * @return the command name
	 */
	public String getLauncherName() {
		if (isWindows()) {
			return "rundll32 url.dll,FileProtocolHandler";
		}
		if (isMac()) {
			return "open";
		}
		return UNIX_LAUNCHERS.get(0);
	}

	private boolean isWindows() {
		return osName.startsWith("windows");
	}

	private boolean isMac() {
		return osName.startsWith("mac");
	}

}
