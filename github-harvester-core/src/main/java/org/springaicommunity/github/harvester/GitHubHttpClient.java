package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * HTTP transport for GitHub REST calls using the Java 11+ {@link HttpClient}.
 *
 * <p>
 * One instance keeps one client, so connections are pooled and reused across all
 * requests issued by the harvest workers. Every response is classified: 2xx bodies are
 * returned as {@link ApiResponse}, everything else is raised as a
 * {@link GitHubApiException} whose {@link FailureKind} tells the retry layer whether to
 * try again.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com";

	private final HttpClient httpClient;

	private final String token;

	private final String apiBaseUrl;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE, Duration.ofSeconds(30));
	}

	public GitHubHttpClient(String token, String apiBaseUrl, Duration connectTimeout) {
		this.token = token;
		this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public ApiResponse get(String path) {
		String url = path.startsWith("http") ? path : apiBaseUrl + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("User-Agent", "github-harvester")
			.GET()
			.build();

		try {
			ApiResponse response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.body().length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private ApiResponse executeRequest(HttpRequest request) {
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.warn("HTTP request to {} failed: {}", request.uri(), e.getMessage());
			throw new GitHubApiException(FailureKind.TRANSIENT_NETWORK, "HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException(FailureKind.TRANSIENT_NETWORK, "HTTP request interrupted", e);
		}

		// Rate limit headers come with every response, 2xx included
		RateLimitInfo rateLimit = extractRateLimit(response);
		if (rateLimit != null) {
			if (rateLimit.remaining() < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", rateLimit.remaining(),
						rateLimit.limit(), rateLimit.reset());
			}
			else {
				logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", rateLimit.remaining(),
						rateLimit.limit(), rateLimit.reset());
			}
		}

		int statusCode = response.statusCode();
		if (statusCode >= 200 && statusCode < 300) {
			String nextLink = LinkHeaderParser.nextLink(response.headers().firstValue("Link").orElse(null));
			return new ApiResponse(response.body() != null ? response.body() : "", rateLimit, nextLink);
		}

		int remaining = rateLimit != null ? rateLimit.remaining() : -1;
		boolean retryAfter = response.headers().firstValue("Retry-After").isPresent();
		FailureKind kind = FailureKind.classify(statusCode, remaining, retryAfter);
		long suggestedDelayMs = suggestedDelay(response, rateLimit);
		throw new GitHubApiException(kind, describe(kind, statusCode, request, rateLimit), statusCode,
				response.body(), rateLimit, suggestedDelayMs);
	}

	private static String describe(FailureKind kind, int statusCode, HttpRequest request,
			@Nullable RateLimitInfo rateLimit) {
		switch (kind) {
			case RATE_LIMIT_EXCEEDED:
				if (rateLimit != null && !rateLimit.isExhausted()) {
					return "Secondary rate limit exceeded (" + statusCode + ") for " + request.uri().getPath();
				}
				return "Rate limit exceeded (" + statusCode + ")"
						+ (rateLimit != null ? ". Resets at epoch: " + rateLimit.reset() : "");
			case AUTHORIZATION:
				return statusCode == 401 ? "Unauthorized: Bad credentials. Check your GITHUB_TOKEN."
						: "Forbidden: token lacks access to " + request.uri().getPath();
			case NOT_FOUND:
				return "Not found: " + request.uri().getPath();
			case TRANSIENT_NETWORK:
				return "GitHub server error: " + statusCode;
			default:
				return "GitHub API error: " + statusCode + " for " + request.uri().getPath();
		}
	}

	/**
	 * Prefer {@code Retry-After} (seconds); otherwise, when the quota is gone, wait until
	 * the reported reset time.
	 */
	private static long suggestedDelay(HttpResponse<?> response, @Nullable RateLimitInfo rateLimit) {
		long retryAfterSeconds = parseLongHeader(response, "Retry-After", -1);
		if (retryAfterSeconds >= 0) {
			return retryAfterSeconds * 1000;
		}
		if (rateLimit != null && rateLimit.isExhausted() && rateLimit.reset() > 0) {
			long waitMs = rateLimit.reset() * 1000 - Instant.now().toEpochMilli();
			return Math.max(waitMs, 0);
		}
		return -1;
	}

	private static @Nullable RateLimitInfo extractRateLimit(HttpResponse<?> response) {
		int remaining = (int) parseLongHeader(response, "X-RateLimit-Remaining", -1);
		if (remaining < 0) {
			return null;
		}
		int limit = (int) parseLongHeader(response, "X-RateLimit-Limit", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		int used = (int) parseLongHeader(response, "X-RateLimit-Used", -1);
		return new RateLimitInfo(limit, remaining, reset, used);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
