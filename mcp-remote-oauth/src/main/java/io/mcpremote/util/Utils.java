/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.mcpremote.util;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Strips every trailing {@code '/'} from the given URL.
	 * @param url the URL to normalize
	 * @return the URL without trailing slashes
	 */
	public static String stripTrailingSlash(String url) {
		int end = url.length();
		while (end > 0 && url.charAt(end - 1) == '/') {
			end--;
		}
		return url.substring(0, end);
	}

	/**
	 * Format parameters as an {@code application/x-www-form-urlencoded} string, which is
	 * also a valid URL query.
	 * @param params the parameters, in the order they should appear
	 * @return the encoded string
	 */
	public static String encodeForm(Map<String, String> params) {
		StringBuilder result = new StringBuilder();
		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (result.length() > 0) {
				result.append('&');
			}
			result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8));
			result.append('=');
			result.append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
		}
		return result.toString();
	}

	/**
	 * Parses a raw (still percent-encoded) query string into a map. The first occurrence
	 * of a repeated key wins; a key without {@code '='} maps to an empty string.
	 * @param rawQuery the raw query, may be {@code null}
	 * @return the decoded parameters in query order
	 */
	public static Map<String, String> parseQuery(@Nullable String rawQuery) {
		Map<String, String> params = new LinkedHashMap<>();
		if (!hasText(rawQuery)) {
			return params;
		}
		for (String pair : rawQuery.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String key = (idx >= 0) ? pair.substring(0, idx) : pair;
			String value = (idx >= 0) ? pair.substring(idx + 1) : "";
			params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
					URLDecoder.decode(value, StandardCharsets.UTF_8));
		}
		return params;
	}

}
