package io.mcpremote.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of the lock file an instance writes while it runs an interactive
 * authorization flow.
 *
 * @param pid process id of the instance holding the lock
 * @param port port of its callback listener
 * @param timestamp creation time in unix seconds
 * @param serverUrlHash hash of the MCP server URL the lock is for
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LockfileData( // @formatter:off
	@JsonProperty("pid") long pid,
	@JsonProperty("port") int port,
	@JsonProperty("timestamp") long timestamp,
	@JsonProperty("server_url_hash") String serverUrlHash) { // @formatter:on
}
