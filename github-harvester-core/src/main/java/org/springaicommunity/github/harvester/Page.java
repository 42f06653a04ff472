package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated resource.
 *
 * @param records the raw records of the page, in API order
 * @param continuationToken the opaque pointer to the next page, null on the last page
 */
public record Page(List<JsonNode> records, @Nullable String continuationToken) {

	public Page {
		records = List.copyOf(records);
	}

	/**
	 * Returns true if no page follows this one.
	 * @return true on the last page
	 */
	public boolean isLast() {
		return continuationToken == null;
	}

}
