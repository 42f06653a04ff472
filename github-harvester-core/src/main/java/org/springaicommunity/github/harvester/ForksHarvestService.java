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
 * Harvests the forks among the repositories a user owns.
 *
 * <p>
 * The repository listing does not name the upstream of a fork, so the listing phase only
 * collects the names of the forks; the detail phase then looks up
 * {@code /repos/{owner}/{name}} for each of them and exports the detail record, which
 * carries the {@code parent}. A fork deleted between the phases (404) is dropped.
 */
public class ForksHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(ForksHarvestService.class);

	private final ForkNormalizer normalizer;

	public ForksHarvestService(ParallelCrawler crawler, ExportSink exportSink, JsonNodeUtils jsonUtils,
			ObjectMapper objectMapper, HarvestProperties properties) {
		super(crawler, exportSink, jsonUtils, objectMapper, properties);
		this.normalizer = new ForkNormalizer(jsonUtils);
	}

	@Override
	public HarvestKind getKind() {
		return HarvestKind.FORKS;
	}

	@Override
	protected String exportBaseName(FetchTarget target) {
		return "github_forks_" + target.owner();
	}

	@Override
	protected void runPhases(HarvestJob job, ExportWriter writer) {
		FetchTarget target = job.getTarget();
		Set<String> forkNames = new LinkedHashSet<>();
		crawler.crawl(job, List.of(target), (listing, page) -> {
			for (JsonNode repository : page.records()) {
				if (!normalizer.isFork(repository)) {
					continue;
				}
				String name = jsonUtils.getText(repository, "name");
				if (name.isEmpty()) {
					logger.warn("Skipping fork of {} without name", target.displayName());
					job.recordDropped();
				}
				else {
					forkNames.add(name);
				}
			}
		});
		if (!job.isActive()) {
			return;
		}
		logger.info("Found {} forks of {}, fetching their details", forkNames.size(), target.displayName());

		job.enterPhase(HarvestPhase.DETAILS);
		List<FetchTarget> details = forkNames.stream().map(target::repositoryDetail).collect(Collectors.toList());
		crawler.crawl(job, details, new PageConsumer() {

			@Override
			public void onPage(FetchTarget fork, Page page) {
				for (JsonNode raw : page.records()) {
					writeNormalized(job, writer, normalizer, raw);
				}
			}

			@Override
			public boolean onFailure(FetchTarget fork, GitHubApiException failure) {
				if (failure.getKind() != FailureKind.NOT_FOUND) {
					return false;
				}
				logger.warn("Fork {} no longer exists, dropping", fork.displayName());
				job.recordDropped();
				return true;
			}

		});
	}

}
