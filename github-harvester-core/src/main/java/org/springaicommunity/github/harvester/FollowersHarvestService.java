package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Harvests the followers of a user in two phases.
 *
 * <p>
 * The listing phase collects follower logins; once every listing page has been fetched,
 * the detail phase looks up {@code /users/{login}} for each follower in parallel and
 * exports the profiles. A follower whose profile is gone by then (404) is dropped; any
 * other failure fails the harvest.
 */
public class FollowersHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(FollowersHarvestService.class);

	private final FollowerNormalizer normalizer;

	public FollowersHarvestService(ParallelCrawler crawler, ExportSink exportSink, JsonNodeUtils jsonUtils,
			ObjectMapper objectMapper, HarvestProperties properties) {
		super(crawler, exportSink, jsonUtils, objectMapper, properties);
		this.normalizer = new FollowerNormalizer(jsonUtils);
	}

	@Override
	public HarvestKind getKind() {
		return HarvestKind.FOLLOWERS;
	}

	@Override
	protected String exportBaseName(FetchTarget target) {
		return "github_followers_" + target.owner();
	}

	@Override
	protected void runPhases(HarvestJob job, ExportWriter writer) {
		FetchTarget target = job.getTarget();
		Set<String> logins = new LinkedHashSet<>();
		crawler.crawl(job, List.of(target), (listing, page) -> {
			for (JsonNode follower : page.records()) {
				String login = jsonUtils.getText(follower, "login");
				if (login.isEmpty()) {
					logger.warn("Skipping follower entry of {} without login", target.displayName());
					job.recordDropped();
				}
				else {
					logins.add(login);
				}
			}
		});
		if (!job.isActive()) {
			return;
		}
		logger.info("Listed {} followers of {}, fetching profiles", logins.size(), target.displayName());

		job.enterPhase(HarvestPhase.DETAILS);
		List<FetchTarget> profiles = logins.stream().map(target::userProfile).collect(Collectors.toList());
		crawler.crawl(job, profiles, new PageConsumer() {

			@Override
			public void onPage(FetchTarget profile, Page page) {
				for (JsonNode raw : page.records()) {
					writeNormalized(job, writer, normalizer, raw);
				}
			}

			@Override
			public boolean onFailure(FetchTarget profile, GitHubApiException failure) {
				if (failure.getKind() != FailureKind.NOT_FOUND) {
					return false;
				}
				logger.warn("Follower {} no longer exists, dropping", profile.detailLogin());
				job.recordDropped();
				return true;
			}

		});
	}

}
