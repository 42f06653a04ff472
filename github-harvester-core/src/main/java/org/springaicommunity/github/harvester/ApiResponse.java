package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * A successful GitHub API response.
 *
 * @param body the response body
 * @param rateLimit the rate limit headers, or null if the response carried none
 * @param nextLink absolute URL of the next page from the {@code Link} header, or null on
 * the last page
 */
public record ApiResponse(String body, @Nullable RateLimitInfo rateLimit, @Nullable String nextLink) {
}
