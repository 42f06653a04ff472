package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * A repository contributor, as exported, with the repository's details repeated on every
 * row.
 *
 * @param login the contributor's GitHub username
 * @param contributions number of contributions
 * @param profileUrl the contributor's profile page
 * @param repository repository full name ("owner/repo")
 * @param repoDescription repository description
 * @param repoStars stargazer count
 * @param repoForks fork count
 * @param repoOpenIssues open issue count
 * @param repoCreatedAt repository creation date, {@code dd/MM/yyyy}
 */
public record ContributorRecord(String login, String contributions, String profileUrl, String repository,
		String repoDescription, String repoStars, String repoForks, String repoOpenIssues,
		String repoCreatedAt) implements NormalizedRecord {

	public static final List<String> COLUMNS = List.of("login", "contributions", "profile_url", "repository",
			"repo_description", "repo_stars", "repo_forks", "repo_open_issues", "repo_created_at");

	@Override
	public HarvestKind kind() {
		return HarvestKind.CONTRIBUTORS;
	}

	@Override
	public List<String> values() {
		return List.of(login, contributions, profileUrl, repository, repoDescription, repoStars, repoForks,
				repoOpenIssues, repoCreatedAt);
	}

}
