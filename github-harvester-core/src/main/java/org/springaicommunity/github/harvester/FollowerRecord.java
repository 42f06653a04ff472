package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * Profile of a follower, as exported.
 *
 * @param login the follower's GitHub username
 * @param name display name
 * @param company company, without {@code @} mentions
 * @param blog website
 * @param email public email
 * @param bio profile bio
 * @param publicRepos number of public repositories
 * @param followers number of followers
 * @param following number of followed users
 * @param createdAt account creation date, {@code dd/MM/yyyy}
 */
public record FollowerRecord(String login, String name, String company, String blog, String email, String bio,
		String publicRepos, String followers, String following, String createdAt) implements NormalizedRecord {

	public static final List<String> COLUMNS = List.of("login", "name", "company", "blog", "email", "bio",
			"public_repos", "followers", "following", "created_at");

	@Override
	public HarvestKind kind() {
		return HarvestKind.FOLLOWERS;
	}

	@Override
	public List<String> values() {
		return List.of(login, name, company, blog, email, bio, publicRepos, followers, following, createdAt);
	}

}
