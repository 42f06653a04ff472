package org.springaicommunity.github.harvester;

import java.time.Instant;

/**
 * Rate limit metadata reported by the GitHub API on every response.
 *
 * <p>
 * Values that were absent from the response headers are reported as {@code -1}.
 *
 * @param limit the quota ceiling of the current window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the window resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the quota of the current window is used up.
	 * @return true if no requests remaining
	 */
	public boolean isExhausted() {
		return remaining == 0;
	}

	/**
	 * Returns true if the response carried a usable remaining count.
	 * @return true if {@code remaining} was reported
	 */
	public boolean isKnown() {
		return remaining >= 0;
	}

}
