package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns a raw API record into a fixed-schema row. Implementations are deterministic and
 * perform no I/O.
 *
 * @param <T> the row type
 */
@FunctionalInterface
public interface RecordNormalizer<T extends NormalizedRecord> {

	/**
	 * Normalize one raw record.
	 * @param raw the record exactly as returned by the API
	 * @return the normalized row
	 * @throws MalformedRecordException if a required identity field is missing
	 */
	T normalize(JsonNode raw);

}
