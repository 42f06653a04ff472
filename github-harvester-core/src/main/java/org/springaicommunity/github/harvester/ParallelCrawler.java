package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives pagination to completion on a bounded pool of workers.
 *
 * <p>
 * Each call to {@link #crawl} runs an explicit work queue, owned by its
 * {@link HarvestJob}, seeded with the first page of every seed target. The calling thread
 * acts as coordinator: it keeps at most {@code workerCount} pages in flight, enqueues the
 * continuation of every fetched page as new work for the same target (pages of one
 * target are therefore fetched one after the other), and hands fetched pages to the
 * {@link PageConsumer}. Independent targets, such as per-follower profile lookups, run
 * concurrently.
 *
 * <p>
 * A fatal failure marks the job failed and clears its queued work; pages already in
 * flight are allowed to finish and their results are discarded. {@link HarvestJob#abandon()}
 * has the same draining effect. {@code crawl} returns once nothing is queued or in flight,
 * which makes it the barrier between the phases of a two-phase harvest. The worker pool
 * may be shared by concurrent jobs: each crawl has its own queue and completion service,
 * so a failing job never cancels another job's work.
 */
public class ParallelCrawler implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ParallelCrawler.class);

	private final PageFetcher pageFetcher;

	private final ExecutorService executor;

	private final int workerCount;

	public ParallelCrawler(PageFetcher pageFetcher, int workerCount) {
		if (workerCount < 1) {
			throw new IllegalArgumentException("workerCount must be positive (got: " + workerCount + ")");
		}
		this.pageFetcher = pageFetcher;
		this.workerCount = workerCount;
		this.executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
	}

	public int getWorkerCount() {
		return workerCount;
	}

	/**
	 * Crawl every seed target to its last page.
	 * @param job the owning job; receives counters, failure and pending work
	 * @param seeds targets whose first page seeds the queue
	 * @param consumer receives every fetched page on the calling thread
	 * @throws RuntimeException rethrown from the consumer, after in-flight work drained
	 * and the job was marked failed
	 */
	public void crawl(HarvestJob job, List<FetchTarget> seeds, PageConsumer consumer) {
		CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(executor);
		for (FetchTarget seed : seeds) {
			job.enqueue(new WorkItem(seed, null));
		}
		logger.debug("Crawling {} seed targets for {} with {} workers", seeds.size(), job.getTarget().displayName(),
				workerCount);

		RuntimeException consumerFailure = null;
		int inFlight = 0;
		while (true) {
			while (inFlight < workerCount && job.isActive() && job.hasPendingWork()) {
				WorkItem item = job.pollWork();
				completion.submit(() -> fetch(job, item));
				inFlight++;
			}
			if (inFlight == 0) {
				break;
			}

			FetchOutcome outcome;
			try {
				outcome = completion.take().get();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				job.abandon();
				logger.warn("Crawl of {} interrupted; {} requests left to drain in the background",
						job.getTarget().displayName(), inFlight - 1);
				break;
			}
			catch (ExecutionException e) {
				inFlight--;
				fail(job, "Unexpected error while fetching: " + e.getCause());
				continue;
			}
			inFlight--;

			if (!job.isActive() || outcome.skipped()) {
				continue;
			}
			if (outcome.failure() != null) {
				handleFailure(job, outcome.item(), outcome.failure(), consumer);
				continue;
			}

			Page page = outcome.page();
			job.pageFetched();
			if (!page.isLast()) {
				job.enqueue(new WorkItem(outcome.item().target(), page.continuationToken()));
			}
			try {
				consumer.onPage(outcome.item().target(), page);
			}
			catch (RuntimeException e) {
				consumerFailure = e;
				fail(job, HarvestJob.describeFailure(e));
			}
		}

		if (!job.isActive()) {
			int cleared = job.clearPendingWork();
			if (cleared > 0) {
				logger.debug("Discarded {} queued work items of {}", cleared, job.getTarget().displayName());
			}
		}
		if (consumerFailure != null) {
			throw consumerFailure;
		}
	}

	private void handleFailure(HarvestJob job, WorkItem item, GitHubApiException failure, PageConsumer consumer) {
		if (consumer.onFailure(item.target(), failure)) {
			logger.debug("Failure of {} handled by consumer: {}", item.target().displayName(), failure.getMessage());
			return;
		}
		fail(job, "Fetching " + item.target().displayName() + " failed: " + failure.getMessage());
	}

	private void fail(HarvestJob job, String reason) {
		int cleared = job.clearPendingWork();
		job.fail(reason);
		logger.error("Harvest of {} failed: {} ({} queued work items cancelled)", job.getTarget().displayName(),
				reason, cleared);
	}

	private FetchOutcome fetch(HarvestJob job, WorkItem item) {
		if (!job.isActive()) {
			return new FetchOutcome(item, null, null, true);
		}
		try {
			return new FetchOutcome(item, pageFetcher.fetchPage(item.target(), item.continuationToken()), null,
					false);
		}
		catch (GitHubApiException e) {
			return new FetchOutcome(item, null, e, false);
		}
	}

	/**
	 * Stop accepting work and wait briefly for running fetches to finish.
	 */
	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
				logger.warn("Crawler workers still busy after 30 seconds; interrupting");
				executor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executor.shutdownNow();
		}
	}

	private record FetchOutcome(WorkItem item, @Nullable Page page, @Nullable GitHubApiException failure,
			boolean skipped) {
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "harvest-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
