package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * Summary written next to a committed export as {@code <name>.metadata.json}.
 *
 * @param timestamp ISO-8601 time the export was committed
 * @param kind harvest kind identifier
 * @param target harvested user or repository
 * @param exportFile file name of the export
 * @param columns CSV header
 * @param recordCount rows in the export
 * @param droppedRecords records skipped
 * @param pagesFetched API pages fetched
 */
public record HarvestMetadata(String timestamp, String kind, String target, String exportFile, List<String> columns,
		int recordCount, int droppedRecords, int pagesFetched) {
}
