package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes entries of {@code /repos/{owner}/{repo}/contributors}. The repository
 * columns come from the repository record fetched before the listing, so they are
 * resolved once, at construction.
 */
public class ContributorNormalizer implements RecordNormalizer<ContributorRecord> {

	private final JsonNodeUtils jsonUtils;

	private final String repository;

	private final String repoDescription;

	private final String repoStars;

	private final String repoForks;

	private final String repoOpenIssues;

	private final String repoCreatedAt;

	public ContributorNormalizer(JsonNodeUtils jsonUtils, JsonNode repositoryDetail) {
		this.jsonUtils = jsonUtils;
		this.repository = jsonUtils.getText(repositoryDetail, "full_name");
		this.repoDescription = jsonUtils.getText(repositoryDetail, "description");
		this.repoStars = jsonUtils.getNumberText(repositoryDetail, "stargazers_count");
		this.repoForks = jsonUtils.getNumberText(repositoryDetail, "forks_count");
		this.repoOpenIssues = jsonUtils.getNumberText(repositoryDetail, "open_issues_count");
		this.repoCreatedAt = jsonUtils.getExportDate(repositoryDetail, "created_at");
	}

	@Override
	public ContributorRecord normalize(JsonNode raw) {
		String login = jsonUtils.getText(raw, "login");
		if (login.isEmpty()) {
			// anonymous contributors (anon=1) have no account
			throw new MalformedRecordException("Contributor", "login");
		}
		return new ContributorRecord(login, jsonUtils.getNumberText(raw, "contributions"),
				jsonUtils.getText(raw, "html_url"), repository, repoDescription, repoStars, repoForks, repoOpenIssues,
				repoCreatedAt);
	}

}
