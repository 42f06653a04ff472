package org.springaicommunity.github.harvester;

/**
 * Lifecycle status of a harvest job.
 */
public enum HarvestStatus {

	RUNNING, COMPLETED, FAILED

}
