package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts relation URLs from an RFC 8288 {@code Link} header as sent by the GitHub REST
 * API, e.g. {@code <https://api.github.com/user/1/followers?page=2>; rel="next"}.
 */
public final class LinkHeaderParser {

	private static final Pattern LINK_PATTERN = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?([^\";]+)\"?");

	private LinkHeaderParser() {
	}

	/**
	 * Returns the URL of the {@code next} relation.
	 * @param linkHeader the raw header value, may be null
	 * @return the next page URL, or null if the header has no next relation
	 */
	public static @Nullable String nextLink(@Nullable String linkHeader) {
		return findRelation(linkHeader, "next");
	}

	static @Nullable String findRelation(@Nullable String linkHeader, String relation) {
		if (linkHeader == null || linkHeader.isBlank()) {
			return null;
		}
		for (String part : linkHeader.split(",")) {
			Matcher matcher = LINK_PATTERN.matcher(part.trim());
			if (matcher.find()) {
				for (String rel : matcher.group(2).trim().split("\\s+")) {
					if (relation.equals(rel)) {
						return matcher.group(1).trim();
					}
				}
			}
		}
		return null;
	}

}
