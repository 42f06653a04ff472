package org.springaicommunity.github.harvester;

import java.nio.file.Path;
import java.util.List;

/**
 * Persists normalized records as a tabular export.
 */
public interface ExportSink {

	/**
	 * Create the export file and write its header row.
	 * @param path the file to create, replaced if it exists
	 * @param header column names
	 * @return a writer for the data rows
	 * @throws ExportWriteException if the file cannot be created
	 */
	ExportWriter open(Path path, List<String> header);

}
