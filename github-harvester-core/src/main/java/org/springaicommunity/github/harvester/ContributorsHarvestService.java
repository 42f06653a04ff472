package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Harvests the contributors of a repository. The repository record is fetched first; it
 * confirms the repository exists and supplies the repository columns of every row.
 */
public class ContributorsHarvestService extends BaseHarvestService {

	private static final Logger logger = LoggerFactory.getLogger(ContributorsHarvestService.class);

	public ContributorsHarvestService(ParallelCrawler crawler, ExportSink exportSink, JsonNodeUtils jsonUtils,
			ObjectMapper objectMapper, HarvestProperties properties) {
		super(crawler, exportSink, jsonUtils, objectMapper, properties);
	}

	@Override
	public HarvestKind getKind() {
		return HarvestKind.CONTRIBUTORS;
	}

	@Override
	protected String exportBaseName(FetchTarget target) {
		return "github_repo_contributions_" + target.owner() + "_" + target.repository();
	}

	@Override
	protected void runPhases(HarvestJob job, ExportWriter writer) {
		FetchTarget target = job.getTarget();
		List<JsonNode> repositoryDetail = new ArrayList<>(1);
		crawler.crawl(job, List.of(target.repositoryDetail()), (detail, page) -> repositoryDetail.addAll(page.records()));
		if (!job.isActive()) {
			return;
		}
		if (repositoryDetail.isEmpty()) {
			job.fail("Repository " + target.displayName() + " returned no data");
			return;
		}
		logger.debug("Fetched repository details of {}", target.displayName());

		ContributorNormalizer normalizer = new ContributorNormalizer(jsonUtils, repositoryDetail.get(0));
		crawler.crawl(job, List.of(target), (listing, page) -> {
			for (JsonNode raw : page.records()) {
				writeNormalized(job, writer, normalizer, raw);
			}
		});
	}

}
