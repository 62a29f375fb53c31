/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.client.auth;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import io.mcpremote.auth.OAuthMetadata;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link OAuthConfig}.
 */
class OAuthConfigTests {

	@Test
	void testDefaults() {
		OAuthConfig config = OAuthConfig.builder("https://mcp.example.com/sse").authDir(Path.of("/tmp/auth")).build();

		assertThat(config.getServerUrl()).isEqualTo("https://mcp.example.com/sse");
		assertThat(config.getAuthDir()).isEqualTo(Path.of("/tmp/auth"));
		assertThat(config.getCallbackHost()).isEqualTo("localhost");
		assertThat(config.getCallbackPort()).isNull();
		assertThat(config.getAuthTimeout()).isEqualTo(Duration.ofSeconds(300));
		assertThat(config.getClientName()).isEqualTo("MCP Remote");
		assertThat(config.getScope()).isNull();
		assertThat(config.getServerMetadata()).isNull();
		assertThat(config.getStaticClientInfo()).isNull();
	}

	@Test
	void testCustomValues() {
		OAuthMetadata metadata = OAuthMetadataDiscoverer.fallbackMetadata("https://auth.example.com");

		OAuthConfig config = OAuthConfig.builder("http://localhost:3000/mcp")
			.serverMetadata(metadata)
			.staticClientInfo("client-1", "secret-1")
			.callbackPort(8765)
			.callbackHost("127.0.0.1")
			.authTimeout(Duration.ofSeconds(30))
			.scope("mcp openid")
			.clientName("My Proxy")
			.build();

		assertThat(config.getServerMetadata()).isSameAs(metadata);
		assertThat(config.getStaticClientInfo().getClientId()).isEqualTo("client-1");
		assertThat(config.getStaticClientInfo().getClientSecret()).isEqualTo("secret-1");
		assertThat(config.getCallbackPort()).isEqualTo(8765);
		assertThat(config.getCallbackHost()).isEqualTo("127.0.0.1");
		assertThat(config.getAuthTimeout()).isEqualTo(Duration.ofSeconds(30));
		assertThat(config.getScope()).isEqualTo("mcp openid");
		assertThat(config.getClientName()).isEqualTo("My Proxy");
	}

	@Test
	void testInvalidServerUrl() {
		assertThatThrownBy(() -> OAuthConfig.builder("")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> OAuthConfig.builder("not a url")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> OAuthConfig.builder("ftp://example.com")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> OAuthConfig.builder("/relative/path")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testInvalidValues() {
		OAuthConfig.Builder builder = OAuthConfig.builder("https://mcp.example.com");

		assertThatThrownBy(() -> builder.callbackPort(70000)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> builder.authTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> builder.staticClientInfo(" ", null)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> builder.serverMetadata(new OAuthMetadata()))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("authorization_endpoint");
	}

	@Test
	void testAuthDirFromSystemProperty() {
		String previous = System.getProperty(OAuthConfig.AUTH_DIR_PROPERTY);
		System.setProperty(OAuthConfig.AUTH_DIR_PROPERTY, "/var/lib/mcp-auth");
		try {
			assertThat(OAuthConfig.builder("https://mcp.example.com").build().getAuthDir())
				.isEqualTo(Paths.get("/var/lib/mcp-auth"));
		}
		finally {
			if (previous == null) {
				System.clearProperty(OAuthConfig.AUTH_DIR_PROPERTY);
			}
			else {
				System.setProperty(OAuthConfig.AUTH_DIR_PROPERTY, previous);
			}
		}
	}

	@Test
	void testDefaultAuthDirIsUnderHome() {
		assumeTrue(System.getProperty(OAuthConfig.AUTH_DIR_PROPERTY) == null);
		assumeTrue(System.getenv(OAuthConfig.AUTH_DIR_ENV) == null);

		assertThat(OAuthConfig.defaultAuthDir()).isEqualTo(Paths.get(System.getProperty("user.home"), ".mcp-auth"));
	}

}
