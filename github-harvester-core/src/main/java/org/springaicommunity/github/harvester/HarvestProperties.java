package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Configuration properties for harvesting.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubHarvesterBuilder}.
 * Defaults suit a personal access token with the standard quota of 5000 requests per
 * hour.
 */
public class HarvestProperties {

	/**
	 * Number of pages fetched concurrently.
	 */
	private int workerCount = 10;

	/**
	 * Maximum number of calls per request, the first one included.
	 */
	private int maxAttempts = 5;

	/**
	 * Delay in milliseconds before the first retry; doubled for every further retry.
	 */
	private long initialRetryDelayMs = 1000;

	/**
	 * Upper bound in milliseconds of a retry delay.
	 */
	private long maxRetryDelayMs = 60000;

	/**
	 * Rate limit waits longer than this many seconds are logged as warnings.
	 */
	private long rateLimitWarnThresholdSeconds = 300;

	/**
	 * Extra wait in milliseconds after a rate limit window resets.
	 */
	private long rateLimitResetBufferMs = 1000;

	/**
	 * Records requested per page (1-100).
	 */
	private int perPage = 100;

	/**
	 * Directory where exports are written.
	 */
	private String outputDirectory = "exports";

	/**
	 * Rows written between two flushes of the export stream.
	 */
	private int flushInterval = 100;

	/**
	 * Progress updates buffered before the oldest is dropped.
	 */
	private int progressQueueCapacity = 64;

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Connect timeout of the HTTP client in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * User harvested when none is given, usually GITHUB_USERNAME.
	 */
	private @Nullable String defaultUser;

	public int getWorkerCount() {
		return workerCount;
	}

	public void setWorkerCount(int workerCount) {
		this.workerCount = workerCount;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public long getInitialRetryDelayMs() {
		return initialRetryDelayMs;
	}

	public void setInitialRetryDelayMs(long initialRetryDelayMs) {
		this.initialRetryDelayMs = initialRetryDelayMs;
	}

	public long getMaxRetryDelayMs() {
		return maxRetryDelayMs;
	}

	public void setMaxRetryDelayMs(long maxRetryDelayMs) {
		this.maxRetryDelayMs = maxRetryDelayMs;
	}

	public long getRateLimitWarnThresholdSeconds() {
		return rateLimitWarnThresholdSeconds;
	}

	public void setRateLimitWarnThresholdSeconds(long rateLimitWarnThresholdSeconds) {
		this.rateLimitWarnThresholdSeconds = rateLimitWarnThresholdSeconds;
	}

	public long getRateLimitResetBufferMs() {
		return rateLimitResetBufferMs;
	}

	public void setRateLimitResetBufferMs(long rateLimitResetBufferMs) {
		this.rateLimitResetBufferMs = rateLimitResetBufferMs;
	}

	public int getPerPage() {
		return perPage;
	}

	public void setPerPage(int perPage) {
		this.perPage = perPage;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public int getFlushInterval() {
		return flushInterval;
	}

	public void setFlushInterval(int flushInterval) {
		this.flushInterval = flushInterval;
	}

	public int getProgressQueueCapacity() {
		return progressQueueCapacity;
	}

	public void setProgressQueueCapacity(int progressQueueCapacity) {
		this.progressQueueCapacity = progressQueueCapacity;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public @Nullable String getDefaultUser() {
		return defaultUser;
	}

	public void setDefaultUser(@Nullable String defaultUser) {
		this.defaultUser = defaultUser;
	}

}
