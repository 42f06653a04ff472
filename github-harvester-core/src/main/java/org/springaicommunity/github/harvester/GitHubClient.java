package org.springaicommunity.github.harvester;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability and decorator
 * implementations ({@link RateGovernedGitHubClient}, {@link RetryingGitHubClient}).
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/users/octocat/followers?per_page=100") or full URL
	 * @return the classified successful response
	 * @throws GitHubApiException if the request fails; its {@link FailureKind} tells
	 * retryable failures from fatal ones
	 */
	ApiResponse get(String path);

}
