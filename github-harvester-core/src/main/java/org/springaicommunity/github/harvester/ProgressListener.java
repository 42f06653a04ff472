package org.springaicommunity.github.harvester;

/**
 * Receives progress updates of a harvest, e.g. to render them in a user interface.
 *
 * <p>
 * Called from the reporter's dispatcher thread, never from a crawl worker. A slow
 * listener only causes intermediate updates to be dropped.
 */
@FunctionalInterface
public interface ProgressListener {

	void onProgress(HarvestProgress progress);

}
