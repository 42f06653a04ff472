package org.springaicommunity.github.harvester;

import java.nio.file.Path;

/**
 * The export file could not be written. Fatal to the harvest; rows flushed before the
 * failure stay on disk.
 */
public class ExportWriteException extends RuntimeException {

	private final Path path;

	public ExportWriteException(Path path, String message, Throwable cause) {
		super(message + ": " + path, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
