/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.client.auth.OAuthObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JSON mapping of the OAuth model types.
 */
class OAuthModelJsonTests {

	private final ObjectMapper objectMapper = OAuthObjectMapper.create();

	@Test
	void testMetadataKeepsUnknownFieldsAndOmitsNulls() throws Exception {
		OAuthMetadata metadata = objectMapper.readValue("""
				{"issuer": "https://auth.example.com", "token_endpoint": "https://auth.example.com/token",
				 "request_uri_parameter_supported": true}
				""", OAuthMetadata.class);

		assertThat(metadata.getExtra()).containsEntry("request_uri_parameter_supported", true);

		JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(metadata));
		assertThat(json.has("authorization_endpoint")).isFalse();
		assertThat(json.get("request_uri_parameter_supported").asBoolean()).isTrue();
	}

	@Test
	void testTokenResponseDefaultsToBearer() throws Exception {
		OAuthToken token = objectMapper.readValue("{\"access_token\": \"tok\", \"id_token\": \"x\"}",
				OAuthToken.class);

		assertThat(token.getAccessToken()).isEqualTo("tok");
		assertThat(token.getTokenType()).isEqualTo("Bearer");
		assertThat(token.getExpiresIn()).isNull();
	}

	@Test
	void testLockfileDataFieldNames() throws Exception {
		JsonNode json = objectMapper
			.readTree(objectMapper.writeValueAsString(new LockfileData(42, 8765, 1700000000L, "abcd")));

		assertThat(json.get("pid").asLong()).isEqualTo(42);
		assertThat(json.get("port").asInt()).isEqualTo(8765);
		assertThat(json.get("timestamp").asLong()).isEqualTo(1700000000L);
		assertThat(json.get("server_url_hash").asText()).isEqualTo("abcd");
		assertThat(objectMapper.readValue(json.toString(), LockfileData.class))
			.isEqualTo(new LockfileData(42, 8765, 1700000000L, "abcd"));
	}

	@Test
	void testClientInformationCarriesRegistrationExtras() throws Exception {
		OAuthClientInformation info = objectMapper.readValue("""
				{"client_id": "c1", "client_secret_expires_at": 0, "software_id": "mcp-remote",
				 "application_type": "native"}
				""", OAuthClientInformation.class);

		assertThat(info.getClientId()).isEqualTo("c1");
		assertThat(info.getClientSecretExpiresAt()).isZero();
		assertThat(info.getSoftwareId()).isEqualTo("mcp-remote");
		assertThat(info.getAdditionalMetadata()).containsEntry("application_type", "native");
	}

}
