package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Outcome of a harvest.
 *
 * <p>
 * A completed harvest carries the path of the committed export and its row count; a
 * failed one carries the reason and no export path.
 *
 * @param kind what was harvested
 * @param target display name of the harvested user or repository
 * @param status {@link HarvestStatus#COMPLETED} or {@link HarvestStatus#FAILED}
 * @param exportPath the committed export file, null on failure
 * @param recordCount rows written to the export
 * @param droppedRecords records skipped as malformed or gone
 * @param pagesFetched API pages fetched across all phases
 * @param failureReason why the harvest failed, null on success
 */
public record HarvestResult(HarvestKind kind, String target, HarvestStatus status, @Nullable Path exportPath,
		int recordCount, int droppedRecords, int pagesFetched, @Nullable String failureReason) {

	public static HarvestResult completed(HarvestJob job, Path exportPath, int recordCount) {
		return new HarvestResult(job.getTarget().kind(), job.getTarget().displayName(), HarvestStatus.COMPLETED,
				exportPath, recordCount, job.getRecordsDropped(), job.getPagesFetched(), null);
	}

	public static HarvestResult failed(HarvestJob job, int recordCount, String reason) {
		return new HarvestResult(job.getTarget().kind(), job.getTarget().displayName(), HarvestStatus.FAILED, null,
				recordCount, job.getRecordsDropped(), job.getPagesFetched(), reason);
	}

	public boolean isSuccessful() {
		return status == HarvestStatus.COMPLETED;
	}

}
