package org.springaicommunity.github.harvester;

/**
 * Snapshot of a harvest's progress, published on the {@link ProgressReporter} channel.
 *
 * @param kind the harvest kind
 * @param target display name of the harvested target
 * @param phase current phase
 * @param pagesFetched pages fetched so far, detail lookups included
 * @param recordsNormalized rows normalized and written so far
 * @param recordsDropped records skipped because a required field was missing
 */
public record HarvestProgress(HarvestKind kind, String target, HarvestPhase phase, int pagesFetched,
		int recordsNormalized, int recordsDropped) {
}
