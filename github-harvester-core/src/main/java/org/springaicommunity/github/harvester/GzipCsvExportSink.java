package org.springaicommunity.github.harvester;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes exports as gzip-compressed UTF-8 CSV.
 *
 * <p>
 * The gzip stream is opened with sync flush and flushed every {@code flushInterval} rows,
 * so a file whose harvest died midway still decompresses up to the last flushed row.
 */
public class GzipCsvExportSink implements ExportSink {

	private static final Logger logger = LoggerFactory.getLogger(GzipCsvExportSink.class);

	private final int flushInterval;

	public GzipCsvExportSink() {
		this(100);
	}

	public GzipCsvExportSink(int flushInterval) {
		if (flushInterval < 1) {
			throw new IllegalArgumentException("flushInterval must be positive (got: " + flushInterval + ")");
		}
		this.flushInterval = flushInterval;
	}

	@Override
	public ExportWriter open(Path path, List<String> header) {
		CSVFormat format = CSVFormat.DEFAULT.builder()
			.setHeader(header.toArray(new String[0]))
			.setRecordSeparator("\n")
			.build();
		@Nullable
		OutputStream out = null;
		try {
			out = new GZIPOutputStream(Files.newOutputStream(path), true);
			CSVPrinter printer = new CSVPrinter(new OutputStreamWriter(out, StandardCharsets.UTF_8), format);
			printer.flush();
			logger.debug("Opened export {} with {} columns", path, header.size());
			return new CsvExportWriter(path, printer, header.size(), flushInterval);
		}
		catch (IOException e) {
			closeQuietly(out, path);
			throw new ExportWriteException(path, "Failed to create export file", e);
		}
	}

	private static void closeQuietly(@Nullable OutputStream out, Path path) {
		if (out == null) {
			return;
		}
		try {
			out.close();
		}
		catch (IOException e) {
			logger.warn("Failed to close export stream {}: {}", path, e.getMessage());
		}
	}

	private static final class CsvExportWriter implements ExportWriter {

		private final Path path;

		private final CSVPrinter printer;

		private final int columnCount;

		private final int flushInterval;

		private int rowCount;

		private boolean closed;

		CsvExportWriter(Path path, CSVPrinter printer, int columnCount, int flushInterval) {
			this.path = path;
			this.printer = printer;
			this.columnCount = columnCount;
			this.flushInterval = flushInterval;
		}

		@Override
		public void writeRow(NormalizedRecord row) {
			if (closed) {
				throw new IllegalStateException("Export " + path + " is already closed");
			}
			List<String> values = row.values();
			if (values.size() != columnCount) {
				throw new IllegalArgumentException(
						"Row has " + values.size() + " values but the export has " + columnCount + " columns");
			}
			try {
				printer.printRecord(values);
				rowCount++;
				if (rowCount % flushInterval == 0) {
					printer.flush();
				}
			}
			catch (IOException e) {
				throw new ExportWriteException(path, "Failed to write row " + (rowCount + 1), e);
			}
		}

		@Override
		public int rowCount() {
			return rowCount;
		}

		@Override
		public Path path() {
			return path;
		}

		@Override
		public void close() {
			if (closed) {
				return;
			}
			closed = true;
			try {
				printer.close(true);
				logger.debug("Closed export {} after {} rows", path, rowCount);
			}
			catch (IOException e) {
				throw new ExportWriteException(path, "Failed to complete export file", e);
			}
		}

	}

}
