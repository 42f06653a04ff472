package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * One unit of crawl work: a page of a target.
 *
 * @param target the target to fetch
 * @param continuationToken the page to fetch, null for the first page
 */
public record WorkItem(FetchTarget target, @Nullable String continuationToken) {
}
