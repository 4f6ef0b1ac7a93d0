/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.util;

import java.util.Locale;

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
	 * Return {@code true} if the supplied array is {@code null} or has no bytes other than
	 * whitespace.
	 * @param content the raw body
	 * @return whether the body carries no payload
	 */
	public static boolean isBlank(@Nullable byte[] content) {
		if (content == null) {
			return true;
		}
		for (byte b : content) {
			if (!Character.isWhitespace(b)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Lower-case a method name the way the positional convention routes it.
	 * @param name the method name
	 * @return the routing key
	 */
	public static String routingKey(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Extract the last path segment of a request path, ignoring a trailing slash.
	 * @param path the request path, may be {@code null}
	 * @return the last segment or an empty string
	 */
	public static String lastPathSegment(@Nullable String path) {
		if (path == null) {
			return "";
		}
		String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
		int idx = trimmed.lastIndexOf('/');
		return idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
	}

}
