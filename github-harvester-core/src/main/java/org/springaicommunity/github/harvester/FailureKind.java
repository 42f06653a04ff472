package org.springaicommunity.github.harvester;

/**
 * Classification of a failed GitHub API call.
 *
 * <p>
 * Retryable kinds are retried by {@link RetryingGitHubClient}; every other kind is fatal
 * for the page that produced it and therefore for the owning harvest job.
 */
public enum FailureKind {

	/** 5xx responses and I/O errors. */
	TRANSIENT_NETWORK(true),

	/** 429, or 403 with no remaining quota. */
	RATE_LIMIT_EXCEEDED(true),

	/** 401, or 403 with quota left: the credential is invalid or insufficient. */
	AUTHORIZATION(false),

	/** 404 or 410: the user or repository does not exist. */
	NOT_FOUND(false),

	/** Any other 4xx response. */
	CLIENT_ERROR(false),

	/** A 2xx response whose body is not valid JSON. */
	MALFORMED_RESPONSE(false),

	/** A retryable failure that persisted past the attempt bound. */
	RETRIES_EXHAUSTED(false);

	private final boolean retryable;

	FailureKind(boolean retryable) {
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}

	/**
	 * Classify a non-2xx HTTP status.
	 * @param statusCode the HTTP status code
	 * @param rateLimitRemaining the {@code X-RateLimit-Remaining} header value, or -1
	 * @return the failure kind
	 */
	public static FailureKind classify(int statusCode, int rateLimitRemaining) {
		return classify(statusCode, rateLimitRemaining, false);
	}

	/**
	 * Classify a non-2xx HTTP status. A 403 carrying {@code Retry-After} is a secondary
	 * rate limit, even while the primary quota still has requests left.
	 * @param statusCode the HTTP status code
	 * @param rateLimitRemaining the {@code X-RateLimit-Remaining} header value, or -1
	 * @param retryAfter whether the response carried a {@code Retry-After} header
	 * @return the failure kind
	 */
	public static FailureKind classify(int statusCode, int rateLimitRemaining, boolean retryAfter) {
		if (statusCode == 429 || (statusCode == 403 && (rateLimitRemaining == 0 || retryAfter))) {
			return RATE_LIMIT_EXCEEDED;
		}
		if (statusCode == 401 || statusCode == 403) {
			return AUTHORIZATION;
		}
		if (statusCode == 404 || statusCode == 410) {
			return NOT_FOUND;
		}
		if (statusCode >= 500) {
			return TRANSIENT_NETWORK;
		}
		return CLIENT_ERROR;
	}

}
