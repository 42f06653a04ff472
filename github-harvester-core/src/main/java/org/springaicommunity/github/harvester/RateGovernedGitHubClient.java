package org.springaicommunity.github.harvester;

/**
 * Decorator that routes every request through the shared {@link RateGovernor}: quota is
 * acquired before the call and the rate headers of the outcome, successful or not, are
 * observed afterwards.
 */
public final class RateGovernedGitHubClient implements GitHubClient {

	private final GitHubClient delegate;

	private final RateGovernor governor;

	public RateGovernedGitHubClient(GitHubClient delegate, RateGovernor governor) {
		this.delegate = delegate;
		this.governor = governor;
	}

	@Override
	public ApiResponse get(String path) {
		governor.acquire();
		try {
			ApiResponse response = delegate.get(path);
			governor.observe(response.rateLimit());
			return response;
		}
		catch (GitHubApiException e) {
			governor.observe(e.getRateLimitInfo());
			throw e;
		}
	}

}
