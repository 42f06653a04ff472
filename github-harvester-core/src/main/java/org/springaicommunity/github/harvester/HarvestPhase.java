package org.springaicommunity.github.harvester;

/**
 * Phase of a running harvest, as reported on the progress channel.
 */
public enum HarvestPhase {

	/** Walking the paginated listing. */
	LISTING,

	/** Per-item detail lookups, scheduled only after the listing completed. */
	DETAILS,

	/** Committing the export file. */
	EXPORTING,

	COMPLETED,

	FAILED

}
