package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Fetches one page of a paginated resource.
 */
public interface PageFetcher {

	/**
	 * Fetch one page.
	 * @param target what to fetch
	 * @param continuationToken token of the page to fetch, or null for the first page
	 * @return the page with its records and the next continuation token
	 * @throws GitHubApiException on a fatal failure, after retryable failures have been
	 * retried by the transport
	 */
	Page fetchPage(FetchTarget target, @Nullable String continuationToken);

}
