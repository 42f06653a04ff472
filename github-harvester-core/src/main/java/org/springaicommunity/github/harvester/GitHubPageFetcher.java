package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PageFetcher} over the GitHub REST API.
 *
 * <p>
 * Continuation tokens are the absolute {@code rel="next"} URLs of the {@code Link}
 * header. A JSON array body becomes the page's records; a JSON object (profile or
 * repository lookups) becomes a single-record page; an empty body (204 on empty
 * repositories) becomes an empty page.
 */
public class GitHubPageFetcher implements PageFetcher {

	private static final Logger logger = LoggerFactory.getLogger(GitHubPageFetcher.class);

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final int perPage;

	public GitHubPageFetcher(GitHubClient client, ObjectMapper objectMapper, int perPage) {
		if (perPage < 1 || perPage > 100) {
			throw new IllegalArgumentException("perPage must be between 1 and 100 (got: " + perPage + ")");
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.perPage = perPage;
	}

	@Override
	public Page fetchPage(FetchTarget target, @Nullable String continuationToken) {
		String path = continuationToken != null ? continuationToken : target.firstPagePath(perPage);
		ApiResponse response = client.get(path);
		List<JsonNode> records = parseRecords(response.body(), path);
		logger.debug("Fetched {} records for {} (last page: {})", records.size(), target.displayName(),
				response.nextLink() == null);
		return new Page(records, response.nextLink());
	}

	private List<JsonNode> parseRecords(String body, String path) {
		if (body.isBlank()) {
			return List.of();
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubApiException(FailureKind.MALFORMED_RESPONSE,
					"Response of " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (root.isArray()) {
			List<JsonNode> records = new ArrayList<>(root.size());
			root.forEach(records::add);
			return records;
		}
		if (root.isObject()) {
			return List.of(root);
		}
		throw new GitHubApiException(FailureKind.MALFORMED_RESPONSE,
				"Response of " + path + " is neither a JSON array nor an object", 200, body);
	}

}
