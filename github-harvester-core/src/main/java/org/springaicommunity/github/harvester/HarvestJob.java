package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The in-flight aggregate of one harvest: its target, counters, pending work and
 * terminal status.
 *
 * <p>
 * The pending work queue is only touched by the crawl coordinator thread. Status and
 * counters are safe to read from any thread; {@link #abandon()} may be called by an
 * external caller at any time and makes the crawler stop scheduling new work.
 */
public class HarvestJob {

	private static final Logger logger = LoggerFactory.getLogger(HarvestJob.class);

	private final FetchTarget target;

	private final ProgressReporter progress;

	private final Deque<WorkItem> pendingWork = new ArrayDeque<>();

	private final AtomicInteger pagesFetched = new AtomicInteger();

	private final AtomicInteger recordsNormalized = new AtomicInteger();

	private final AtomicInteger recordsDropped = new AtomicInteger();

	private final AtomicBoolean abandoned = new AtomicBoolean();

	private volatile HarvestStatus status = HarvestStatus.RUNNING;

	private volatile HarvestPhase phase = HarvestPhase.LISTING;

	private volatile @Nullable String failureReason;

	public HarvestJob(FetchTarget target) {
		this(target, ProgressReporter.disabled());
	}

	public HarvestJob(FetchTarget target, ProgressReporter progress) {
		this.target = target;
		this.progress = progress;
	}

	public FetchTarget getTarget() {
		return target;
	}

	public HarvestStatus getStatus() {
		return status;
	}

	public HarvestPhase getPhase() {
		return phase;
	}

	public @Nullable String getFailureReason() {
		return failureReason;
	}

	public int getPagesFetched() {
		return pagesFetched.get();
	}

	public int getRecordsNormalized() {
		return recordsNormalized.get();
	}

	public int getRecordsDropped() {
		return recordsDropped.get();
	}

	public boolean isAbandoned() {
		return abandoned.get();
	}

	/**
	 * Returns true while new work may be scheduled for this job.
	 * @return true if running and not abandoned
	 */
	public boolean isActive() {
		return status == HarvestStatus.RUNNING && !abandoned.get();
	}

	/**
	 * Ask the job to stop. Work already in flight drains normally; nothing new is
	 * scheduled and the job ends {@link HarvestStatus#FAILED}.
	 */
	public void abandon() {
		if (abandoned.compareAndSet(false, true)) {
			logger.info("Harvest of {} {} abandoned by caller", target.kind().id(), target.displayName());
		}
	}

	/**
	 * Mark the job failed. Only the first reason is kept.
	 * @param reason human-readable failure reason
	 */
	public synchronized void fail(String reason) {
		if (status != HarvestStatus.RUNNING) {
			return;
		}
		failureReason = reason;
		status = HarvestStatus.FAILED;
		phase = HarvestPhase.FAILED;
		publishProgress();
	}

	/**
	 * Returns the failure reason recorded for an exception that escaped a harvest phase.
	 * @param failure the exception
	 * @return the reason
	 */
	static String describeFailure(RuntimeException failure) {
		String message = failure.getMessage() != null ? failure.getMessage() : failure.toString();
		if (failure instanceof ExportWriteException) {
			return "Export write failed: " + message;
		}
		return "Unexpected error: " + message;
	}

	public synchronized void complete() {
		if (status != HarvestStatus.RUNNING) {
			throw new IllegalStateException("Cannot complete a job that is " + status);
		}
		status = HarvestStatus.COMPLETED;
		phase = HarvestPhase.COMPLETED;
		publishProgress();
	}

	public void enterPhase(HarvestPhase next) {
		phase = next;
		logger.info("Harvest of {} {}: entering {} phase", target.kind().id(), target.displayName(), next);
		publishProgress();
	}

	void enqueue(WorkItem item) {
		pendingWork.addLast(item);
	}

	@Nullable
	WorkItem pollWork() {
		return pendingWork.pollFirst();
	}

	boolean hasPendingWork() {
		return !pendingWork.isEmpty();
	}

	int pendingWorkCount() {
		return pendingWork.size();
	}

	int clearPendingWork() {
		int cleared = pendingWork.size();
		pendingWork.clear();
		return cleared;
	}

	void pageFetched() {
		pagesFetched.incrementAndGet();
		publishProgress();
	}

	public void recordNormalized() {
		recordsNormalized.incrementAndGet();
	}

	public void recordDropped() {
		recordsDropped.incrementAndGet();
	}

	public void publishProgress() {
		progress.publish(new HarvestProgress(target.kind(), target.displayName(), phase, pagesFetched.get(),
				recordsNormalized.get(), recordsDropped.get()));
	}

}
