package org.springaicommunity.github.harvester;

import java.nio.file.Path;

/**
 * An open export file. Rows are written in arrival order and are not buffered beyond the
 * sink's flush interval.
 */
public interface ExportWriter extends AutoCloseable {

	/**
	 * Append one row.
	 * @param row the normalized record
	 * @throws ExportWriteException if the row cannot be written
	 */
	void writeRow(NormalizedRecord row);

	/**
	 * Returns the number of data rows written, the header excluded.
	 * @return row count
	 */
	int rowCount();

	Path path();

	/**
	 * Flush and close the file.
	 * @throws ExportWriteException if the file cannot be completed
	 */
	@Override
	void close();

}
