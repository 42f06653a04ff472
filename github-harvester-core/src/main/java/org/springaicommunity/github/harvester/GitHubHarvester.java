package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point of the library: harvests followers, contributors or forks into gzip CSV
 * exports. Create one with {@link GitHubHarvesterBuilder}.
 *
 * <p>
 * All harvests of one instance share the HTTP client, the worker pool and the
 * {@link RateGovernor}, so concurrent jobs draw on the same quota. Close the harvester to
 * release the worker threads.
 */
public class GitHubHarvester implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHarvester.class);

	private final RateGovernor rateGovernor;

	private final ParallelCrawler crawler;

	private final ProgressReporter progressReporter;

	private final Map<HarvestKind, BaseHarvestService> services = new EnumMap<>(HarvestKind.class);

	GitHubHarvester(RateGovernor rateGovernor, ParallelCrawler crawler, ProgressReporter progressReporter,
			BaseHarvestService... services) {
		this.rateGovernor = rateGovernor;
		this.crawler = crawler;
		this.progressReporter = progressReporter;
		for (BaseHarvestService service : services) {
			this.services.put(service.getKind(), service);
		}
	}

	/**
	 * Create a job without running it, so the caller can {@link HarvestJob#abandon()} it
	 * from another thread.
	 * @param target a listing target
	 * @return the new job
	 */
	public HarvestJob createJob(FetchTarget target) {
		return new HarvestJob(target, progressReporter);
	}

	/**
	 * Harvest a target and wait for the result.
	 * @param target a listing target
	 * @return the outcome
	 */
	public HarvestResult harvest(FetchTarget target) {
		return harvest(createJob(target));
	}

	/**
	 * Run a job created by {@link #createJob(FetchTarget)} and wait for the result.
	 * @param job the job
	 * @return the outcome
	 */
	public HarvestResult harvest(HarvestJob job) {
		BaseHarvestService service = services.get(job.getTarget().kind());
		if (service == null) {
			throw new IllegalStateException("No harvest service for " + job.getTarget().kind());
		}
		return service.harvest(job);
	}

	public RateGovernor getRateGovernor() {
		return rateGovernor;
	}

	@Override
	public void close() {
		crawler.close();
		progressReporter.close();
		if (progressReporter.droppedUpdates() > 0) {
			logger.debug("{} progress updates were dropped", progressReporter.droppedUpdates());
		}
	}

}
