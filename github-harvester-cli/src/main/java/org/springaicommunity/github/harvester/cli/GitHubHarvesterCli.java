package org.springaicommunity.github.harvester.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.harvester.*;

/**
 * GitHub Harvester CLI Application
 *
 * Plain Java command-line application exporting the followers, repository contributors
 * or forks of a GitHub account to gzip-compressed CSV. Uses GitHubHarvesterBuilder for
 * wiring.
 *
 * Usage: java -jar github-harvester-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication;
 * GITHUB_USERNAME - user harvested when --user is not given
 *
 * Examples: java -jar github-harvester-cli.jar --type followers --user octocat java -jar
 * github-harvester-cli.jar --type contributors --repo spring-projects/spring-ai
 */
public class GitHubHarvesterCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHarvesterCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Harvest failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		return run(args, null);
	}

	/**
	 * Run the CLI.
	 * @param args command-line arguments
	 * @param builder pre-configured builder, e.g. with a custom HTTP client; null to read
	 * the token from the environment
	 * @return exit code, 0 on success and 1 when the harvest failed
	 */
	static int run(String[] args, @Nullable GitHubHarvesterBuilder builder) {
		HarvestProperties properties = new HarvestProperties();
		properties.setDefaultUser(EnvironmentSupport.githubUsername());
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		if (config.verbose) {
			enableVerboseLogging();
		}

		GitHubHarvesterBuilder harvesterBuilder = builder;
		if (harvesterBuilder == null) {
			argumentParser.validateEnvironment();
			harvesterBuilder = GitHubHarvesterBuilder.create().tokenFromEnv();
		}

		logConfiguration(config);
		FetchTarget target = config.toFetchTarget();

		try (GitHubHarvester harvester = harvesterBuilder.properties(config.applyTo(properties))
			.progressListener(GitHubHarvesterCli::logProgress)
			.build()) {
			HarvestResult result = harvester.harvest(target);
			logResults(result);
			return result.isSuccessful() ? 0 : 1;
		}
	}

	private static void enableVerboseLogging() {
		Logger root = LoggerFactory.getLogger("org.springaicommunity.github.harvester");
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logProgress(HarvestProgress progress) {
		logger.info("[{}] {} {}: {} pages, {} records, {} dropped", progress.kind().id(), progress.target(),
				progress.phase(), progress.pagesFetched(), progress.recordsNormalized(), progress.recordsDropped());
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Type: {}", config.harvestKind.id());
		if (config.harvestKind == HarvestKind.CONTRIBUTORS) {
			logger.info("  Repository: {}", config.repository);
		}
		else {
			logger.info("  User: {}", config.user);
		}
		logger.info("  Workers: {}", config.workerCount);
		logger.info("  Page size: {}", config.perPage);
		logger.info("  Output directory: {}", config.outputDirectory);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(HarvestResult result) {
		if (!result.isSuccessful()) {
			logger.error("Harvest of {} {} failed: {}", result.kind().id(), result.target(), result.failureReason());
			logger.error("Pages fetched before the failure: {}", result.pagesFetched());
			return;
		}
		logger.info("Harvest completed successfully!");
		logger.info("Records exported: {}", result.recordCount());
		logger.info("Records dropped: {}", result.droppedRecords());
		logger.info("Pages fetched: {}", result.pagesFetched());
		logger.info("Export file: {}", result.exportPath());
	}

}
