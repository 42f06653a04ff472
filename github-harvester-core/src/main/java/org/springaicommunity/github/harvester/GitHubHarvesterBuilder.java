package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;

/**
 * Builder wiring a {@link GitHubHarvester}.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * try (GitHubHarvester harvester = GitHubHarvesterBuilder.create()
 *     .tokenFromEnv()
 *     .progressListener(progress -> System.out.println(progress))
 *     .build()) {
 *     HarvestResult result = harvester.harvest(FetchTarget.followers("octocat"));
 * }
 *
 * // For testing with a mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * GitHubHarvester harvester = GitHubHarvesterBuilder.create()
 *     .httpClient(mockClient)
 *     .build();
 * }
 * </pre>
 *
 * The HTTP client, default or custom, is wrapped by the {@link RateGovernor} and then by
 * the retry policy configured in {@link HarvestProperties}.
 */
public class GitHubHarvesterBuilder {

	private @Nullable String token;

	private HarvestProperties properties = new HarvestProperties();

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable ExportSink exportSink;

	private @Nullable ProgressListener progressListener;

	private Clock clock = Clock.systemUTC();

	private GitHubHarvesterBuilder() {
	}

	public static GitHubHarvesterBuilder create() {
		return new GitHubHarvesterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubHarvesterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} in a {@code .env} file or the
	 * environment.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubHarvesterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.requireToken();
		return this;
	}

	/**
	 * Set harvest properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder properties(@Nullable HarvestProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public GitHubHarvesterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient, e.g. a mock. No token is required then.
	 * @param httpClient custom client (null to use the default HTTP client)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	public GitHubHarvesterBuilder exportSink(@Nullable ExportSink exportSink) {
		this.exportSink = exportSink;
		return this;
	}

	/**
	 * Receive progress updates on a background thread.
	 * @param progressListener the listener (null for none)
	 * @return this builder
	 */
	public GitHubHarvesterBuilder progressListener(@Nullable ProgressListener progressListener) {
		this.progressListener = progressListener;
		return this;
	}

	GitHubHarvesterBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the harvester.
	 * @return a harvester owning its worker pool; close it when done
	 * @throws IllegalStateException if neither a token nor a custom client was given
	 */
	public GitHubHarvester build() {
		GitHubClient baseClient = httpClient != null ? httpClient : createHttpClient();
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();

		RateGovernor governor = new RateGovernor(clock,
				Duration.ofSeconds(properties.getRateLimitWarnThresholdSeconds()),
				properties.getRateLimitResetBufferMs());
		GitHubClient client = RetryingGitHubClient.builder()
			.wrapping(new RateGovernedGitHubClient(baseClient, governor))
			.maxAttempts(properties.getMaxAttempts())
			.initialDelayMs(properties.getInitialRetryDelayMs())
			.maxDelayMs(properties.getMaxRetryDelayMs())
			.build();

		PageFetcher pageFetcher = new GitHubPageFetcher(client, mapper, properties.getPerPage());
		ParallelCrawler crawler = new ParallelCrawler(pageFetcher, properties.getWorkerCount());
		ExportSink sink = exportSink != null ? exportSink : new GzipCsvExportSink(properties.getFlushInterval());
		ProgressReporter reporter = progressListener != null
				? new ProgressReporter(progressListener, properties.getProgressQueueCapacity())
				: ProgressReporter.disabled();
		JsonNodeUtils jsonUtils = new JsonNodeUtils();

		return new GitHubHarvester(governor, crawler, reporter,
				new FollowersHarvestService(crawler, sink, jsonUtils, mapper, properties),
				new ContributorsHarvestService(crawler, sink, jsonUtils, mapper, properties),
				new ForksHarvestService(crawler, sink, jsonUtils, mapper, properties));
	}

	private GitHubClient createHttpClient() {
		String githubToken = token;
		if (githubToken == null || githubToken.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		return new GitHubHttpClient(githubToken, properties.getApiBaseUrl(),
				Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
	}

}
