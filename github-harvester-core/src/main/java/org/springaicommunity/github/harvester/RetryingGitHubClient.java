package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that adds bounded retries with exponential backoff to a {@link GitHubClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Only {@link FailureKind#isRetryable() retryable} failures are retried; fatal ones
 * (authorization, not found, other client errors) are rethrown at once</li>
 * <li>At most {@code maxAttempts} calls per request (default 5); a failure that outlives
 * the bound is rethrown as {@link FailureKind#RETRIES_EXHAUSTED}</li>
 * <li>The wait is seeded by the delay the server suggested (reset time or
 * {@code Retry-After}) or by the base delay, doubles after each attempt and is capped at
 * {@code maxDelay}</li>
 * <li>A rate limit wait until a known reset time may exceed the cap, up to one hour</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new RateGovernedGitHubClient(new GitHubHttpClient(token), governor))
 *     .maxAttempts(5)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	/**
	 * Longest wait accepted for a rate limit reset. Beyond it the capped exponential
	 * delay is used instead.
	 */
	private static final long MAX_RESET_WAIT_MS = 3_600_000;

	private final GitHubClient delegate;

	private final int maxAttempts;

	private final long initialDelayMs;

	private final long maxDelayMs;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxAttempts = builder.maxAttempts;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxDelayMs = builder.maxDelayMs;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ApiResponse get(String path) {
		GitHubApiException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			try {
				return delegate.get(path);
			}
			catch (GitHubApiException e) {
				if (!e.isRetryable()) {
					throw e;
				}
				lastException = e;

				if (attempt < maxAttempts) {
					long waitMs = computeWaitTime(e, delay);
					logger.warn("GET {} failed (attempt {}/{}): {}. Waiting {}ms...", path, attempt, maxAttempts,
							e.getMessage(), waitMs);
					sleep(waitMs);
					delay = Math.min(delay * 2, maxDelayMs);
				}
			}
		}

		logger.error("GET {} failed after {} attempts", path, maxAttempts);
		throw new GitHubApiException(FailureKind.RETRIES_EXHAUSTED,
				"Request failed after " + maxAttempts + " attempts: " + lastException.getMessage(), lastException);
	}

	/**
	 * A rate limit error with a known reset waits until the reset; other suggestions seed
	 * the backoff when they are longer than the current delay.
	 */
	private long computeWaitTime(GitHubApiException e, long currentDelay) {
		long suggested = e.getSuggestedDelayMs();
		if (e.getKind() == FailureKind.RATE_LIMIT_EXCEEDED && suggested > 0) {
			if (suggested <= MAX_RESET_WAIT_MS) {
				logger.info("Rate limit exceeded. Waiting {}ms before retrying", suggested);
				return suggested;
			}
			logger.warn("Rate limit reset is {}ms away (> 1hr), using exponential backoff instead", suggested);
		}
		else if (suggested > currentDelay) {
			return Math.min(suggested, maxDelayMs);
		}
		return currentDelay;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxAttempts: 5</li>
	 * <li>initialDelay: 1 second</li>
	 * <li>maxDelay: 60 seconds</li>
	 * </ul>
	 */
	public static class Builder {

		private GitHubClient delegate;

		private int maxAttempts = 5;

		private long initialDelayMs = 1000;

		private long maxDelayMs = 60_000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the total number of calls made for one request.
		 * @param maxAttempts attempt bound, first call included (default: 5)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		/**
		 * Set the initial delay between attempts.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the initial delay between attempts in milliseconds.
		 * @param delayMs initial delay in milliseconds (default: 1000)
		 * @return this builder
		 */
		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the cap of the exponential delay.
		 * @param delay maximum delay between attempts (default: 60 seconds)
		 * @return this builder
		 */
		public Builder maxDelay(Duration delay) {
			this.maxDelayMs = delay.toMillis();
			return this;
		}

		/**
		 * Set the cap of the exponential delay in milliseconds.
		 * @param delayMs maximum delay in milliseconds (default: 60000)
		 * @return this builder
		 */
		public Builder maxDelayMs(long delayMs) {
			this.maxDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxAttempts < 1) {
				throw new IllegalStateException("maxAttempts must be at least 1");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxDelayMs < initialDelayMs) {
				throw new IllegalStateException("maxDelay must not be smaller than initialDelay");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
