package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Base class for harvest services. Runs the kind-specific phases of a job and takes care
 * of the export file around them.
 *
 * <p>
 * Rows are streamed into {@code <name>.csv.gz.part}. The part file becomes
 * {@code <name>.csv.gz} only when every phase succeeded; a fetch failure or an abandoned
 * job removes it. When the export itself cannot be written the part file is left in
 * place, since it holds every row flushed before the failure.
 */
public abstract class BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(BaseHarvestService.class);

	static final String EXPORT_SUFFIX = ".csv.gz";

	static final String PART_SUFFIX = ".part";

	static final String METADATA_SUFFIX = ".metadata.json";

	protected final ParallelCrawler crawler;

	protected final ExportSink exportSink;

	protected final JsonNodeUtils jsonUtils;

	protected final ObjectMapper objectMapper;

	protected final HarvestProperties properties;

	protected BaseHarvestService(ParallelCrawler crawler, ExportSink exportSink, JsonNodeUtils jsonUtils,
			ObjectMapper objectMapper, HarvestProperties properties) {
		this.crawler = crawler;
		this.exportSink = exportSink;
		this.jsonUtils = jsonUtils;
		this.objectMapper = objectMapper;
		this.properties = properties;
	}

	/**
	 * Returns the kind of listing this service harvests.
	 * @return the harvest kind
	 */
	public abstract HarvestKind getKind();

	/**
	 * Returns the export file name without extension, e.g. "github_followers_octocat".
	 * @param target the validated target
	 * @return the base file name
	 */
	protected abstract String exportBaseName(FetchTarget target);

	/**
	 * Fetch everything the target needs and write the normalized rows.
	 * @param job the running job; mark it failed to stop the harvest
	 * @param writer the open export
	 */
	protected abstract void runPhases(HarvestJob job, ExportWriter writer);

	/**
	 * Harvest the job's target into a committed export.
	 * @param job a job created for a listing of this service's kind
	 * @return the outcome; job-level failures are reported here, not thrown
	 * @throws IllegalArgumentException if the target does not belong to this service
	 */
	public HarvestResult harvest(HarvestJob job) {
		FetchTarget target = validateTarget(job.getTarget());
		Path outputDir;
		try {
			outputDir = createOutputDirectory();
		}
		catch (ExportWriteException e) {
			job.fail(HarvestJob.describeFailure(e));
			return HarvestResult.failed(job, 0, requireReason(job));
		}
		String fileName = exportBaseName(target) + EXPORT_SUFFIX;
		Path exportPath = outputDir.resolve(fileName);
		Path partPath = outputDir.resolve(fileName + PART_SUFFIX);

		logger.info("Starting {} harvest for {}", getKind().id(), target.displayName());
		job.publishProgress();

		ExportWriter writer;
		try {
			writer = exportSink.open(partPath, getKind().columns());
		}
		catch (ExportWriteException e) {
			return exportFailed(job, partPath, 0, e);
		}

		try (writer) {
			runPhases(job, writer);
			if (job.isActive()) {
				job.enterPhase(HarvestPhase.EXPORTING);
			}
		}
		catch (ExportWriteException e) {
			return exportFailed(job, partPath, writer.rowCount(), e);
		}
		catch (RuntimeException e) {
			deleteQuietly(partPath);
			job.fail(HarvestJob.describeFailure(e));
			throw e;
		}
		int rowCount = writer.rowCount();

		if (!job.isActive()) {
			if (job.isAbandoned()) {
				job.fail("abandoned");
			}
			deleteQuietly(partPath);
			logger.error("{} harvest for {} failed: {}", capitalize(getKind().id()), target.displayName(),
					job.getFailureReason());
			return HarvestResult.failed(job, rowCount, requireReason(job));
		}

		try {
			commit(partPath, exportPath);
		}
		catch (IOException e) {
			logger.error("Failed to commit export {}", exportPath, e);
			job.fail("Export write failed: could not move " + partPath + " to " + exportPath + ": " + e.getMessage());
			return HarvestResult.failed(job, rowCount, requireReason(job));
		}
		writeMetadata(job, outputDir.resolve(exportBaseName(target) + METADATA_SUFFIX), fileName, rowCount);

		job.complete();
		logger.info("{} harvest for {} completed: {} rows exported to {} ({} dropped, {} pages)",
				capitalize(getKind().id()), target.displayName(), rowCount, exportPath, job.getRecordsDropped(),
				job.getPagesFetched());
		return HarvestResult.completed(job, exportPath, rowCount);
	}

	private HarvestResult exportFailed(HarvestJob job, Path partPath, int rowCount, ExportWriteException e) {
		logger.error("Export of {} failed after {} rows, keeping partial file {}", job.getTarget().displayName(),
				rowCount, partPath, e);
		job.fail(HarvestJob.describeFailure(e));
		return HarvestResult.failed(job, rowCount, requireReason(job));
	}

	/**
	 * Normalize a raw record and append it to the export. Malformed records are logged,
	 * counted as dropped and skipped.
	 * @param job the running job
	 * @param writer the open export
	 * @param normalizer the kind's normalizer
	 * @param raw the raw record
	 */
	protected void writeNormalized(HarvestJob job, ExportWriter writer, RecordNormalizer<?> normalizer,
			JsonNode raw) {
		NormalizedRecord row;
		try {
			row = normalizer.normalize(raw);
		}
		catch (MalformedRecordException e) {
			logger.warn("Skipping malformed record of {}: {}", job.getTarget().displayName(), e.getMessage());
			job.recordDropped();
			return;
		}
		writer.writeRow(row);
		job.recordNormalized();
	}

	/**
	 * Check that the target is a listing of this service's kind.
	 * @param target the target
	 * @return the same target
	 */
	protected FetchTarget validateTarget(FetchTarget target) {
		if (target.kind() != getKind()) {
			throw new IllegalArgumentException(
					"Cannot harvest " + target.kind().id() + " with the " + getKind().id() + " service");
		}
		if (target.resource() != FetchTarget.Resource.LISTING) {
			throw new IllegalArgumentException("Harvest target must be a listing (got: " + target.resource() + ")");
		}
		return target;
	}

	/**
	 * Create the configured output directory.
	 * @return the directory
	 * @throws ExportWriteException if it cannot be created
	 */
	protected Path createOutputDirectory() {
		Path outputDir = Paths.get(properties.getOutputDirectory());
		try {
			Files.createDirectories(outputDir);
			return outputDir;
		}
		catch (IOException e) {
			throw new ExportWriteException(outputDir, "Failed to create output directory", e);
		}
	}

	private void commit(Path partPath, Path exportPath) throws IOException {
		try {
			Files.move(partPath, exportPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(partPath, exportPath, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void writeMetadata(HarvestJob job, Path metadataPath, String exportFile, int rowCount) {
		HarvestMetadata metadata = new HarvestMetadata(
				OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), getKind().id(),
				job.getTarget().displayName(), exportFile, getKind().columns(), rowCount, job.getRecordsDropped(),
				job.getPagesFetched());
		try {
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(metadataPath.toFile(), metadata);
		}
		catch (IOException e) {
			// the export itself is committed at this point
			logger.warn("Failed to write metadata {}: {}", metadataPath, e.getMessage());
		}
	}

	private static void deleteQuietly(Path path) {
		try {
			if (Files.deleteIfExists(path)) {
				logger.debug("Deleted partial export {}", path);
			}
		}
		catch (IOException e) {
			logger.warn("Failed to delete partial export {}: {}", path, e.getMessage());
		}
	}

	private static String requireReason(HarvestJob job) {
		String reason = job.getFailureReason();
		return reason != null ? reason : "unknown failure";
	}

	private static String capitalize(String text) {
		return text.substring(0, 1).toUpperCase() + text.substring(1);
	}

}
