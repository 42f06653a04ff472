package org.springaicommunity.github.harvester;

/**
 * Downstream of the {@link ParallelCrawler}. Both callbacks run on the crawl coordinator
 * thread, one at a time, so implementations need no synchronization.
 */
public interface PageConsumer {

	/**
	 * Handle the records of a fetched page. Pages of one target may arrive in any order
	 * relative to pages of other targets.
	 * @param target the target the page belongs to
	 * @param page the fetched page
	 */
	void onPage(FetchTarget target, Page page);

	/**
	 * Decide whether a fatal page failure fails the whole job. The default fails it.
	 * @param target the target whose page failed
	 * @param failure the failure
	 * @return true if the failure was handled and the job continues
	 */
	default boolean onFailure(FetchTarget target, GitHubApiException failure) {
		return false;
	}

}
