package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GitHub API call fails.
 *
 * <p>
 * Carries the {@link FailureKind} the response was classified as, the rate limit headers
 * when the response had them, and a suggested delay before the next attempt (derived
 * from {@code X-RateLimit-Reset} or {@code Retry-After}), enabling smart retry logic in
 * {@link RetryingGitHubClient}.
 */
public class GitHubApiException extends RuntimeException {

	private final FailureKind kind;

	private final int statusCode;

	private final @Nullable String responseBody;

	private final @Nullable RateLimitInfo rateLimitInfo;

	private final long suggestedDelayMs;

	public GitHubApiException(FailureKind kind, String message, int statusCode, @Nullable String responseBody) {
		this(kind, message, statusCode, responseBody, null, -1);
	}

	public GitHubApiException(FailureKind kind, String message, int statusCode, @Nullable String responseBody,
			@Nullable RateLimitInfo rateLimitInfo, long suggestedDelayMs) {
		super(message);
		this.kind = kind;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitInfo = rateLimitInfo;
		this.suggestedDelayMs = suggestedDelayMs;
	}

	public GitHubApiException(FailureKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitInfo = null;
		this.suggestedDelayMs = -1;
	}

	public FailureKind getKind() {
		return kind;
	}

	public boolean isRetryable() {
		return kind.isRetryable();
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public @Nullable RateLimitInfo getRateLimitInfo() {
		return rateLimitInfo;
	}

	/**
	 * Returns the delay the server asked for before the next attempt.
	 * @return delay in milliseconds, or -1 if the response did not suggest one
	 */
	public long getSuggestedDelayMs() {
		return suggestedDelayMs;
	}

}
