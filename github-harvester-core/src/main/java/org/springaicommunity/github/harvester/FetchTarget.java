package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Identifies what to harvest. Immutable once a harvest job starts.
 *
 * <p>
 * A target either addresses a paginated {@link Resource#LISTING listing} of its
 * {@link HarvestKind}, or one of the single-object lookups a harvest needs on the side:
 * the profile of a listed user (the secondary identity, {@code detailLogin}) or the
 * repository the contributors belong to.
 *
 * @param kind the harvest kind this target belongs to
 * @param resource which API resource the target addresses
 * @param owner username, or repository owner for contributors
 * @param repository repository name, required for contributors
 * @param detailLogin login of the user whose profile is looked up, only for
 * {@link Resource#USER_PROFILE}
 */
public record FetchTarget(HarvestKind kind, Resource resource, String owner, @Nullable String repository,
		@Nullable String detailLogin) {

	private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

	/**
	 * API resource addressed by a target.
	 */
	public enum Resource {

		LISTING, USER_PROFILE, REPOSITORY

	}

	public FetchTarget {
		requireName(owner, "owner");
		if (kind == HarvestKind.CONTRIBUTORS || resource == Resource.REPOSITORY) {
			requireName(repository, "repository");
		}
		if (resource == Resource.USER_PROFILE) {
			requireName(detailLogin, "detail login");
		}
	}

	/**
	 * Followers of a user.
	 * @param username the user whose followers are harvested
	 * @return the listing target
	 */
	public static FetchTarget followers(String username) {
		return new FetchTarget(HarvestKind.FOLLOWERS, Resource.LISTING, username, null, null);
	}

	/**
	 * Contributors of a repository.
	 * @param owner repository owner
	 * @param repository repository name
	 * @return the listing target
	 */
	public static FetchTarget contributors(String owner, String repository) {
		return new FetchTarget(HarvestKind.CONTRIBUTORS, Resource.LISTING, owner, repository, null);
	}

	/**
	 * Contributors of a repository given as "owner/repo".
	 * @param fullName repository in "owner/repo" format
	 * @return the listing target
	 */
	public static FetchTarget contributors(String fullName) {
		String[] parts = fullName.split("/");
		if (parts.length != 2) {
			throw new IllegalArgumentException("Repository must be in format 'owner/repo' (got: " + fullName + ")");
		}
		return contributors(parts[0], parts[1]);
	}

	/**
	 * Forks among the repositories a user owns.
	 * @param username the owner of the repositories
	 * @return the listing target
	 */
	public static FetchTarget forks(String username) {
		return new FetchTarget(HarvestKind.FORKS, Resource.LISTING, username, null, null);
	}

	/**
	 * The profile of a user discovered while harvesting this target.
	 * @param login the user's login
	 * @return a single-object lookup target
	 */
	public FetchTarget userProfile(String login) {
		return new FetchTarget(kind, Resource.USER_PROFILE, owner, repository, login);
	}

	/**
	 * The repository this contributors target belongs to.
	 * @return a single-object lookup target
	 */
	public FetchTarget repositoryDetail() {
		return new FetchTarget(kind, Resource.REPOSITORY, owner, repository, null);
	}

	/**
	 * Another repository of this target's owner, e.g. one of the owner's forks.
	 * @param repositoryName the repository name
	 * @return a single-object lookup target
	 */
	public FetchTarget repositoryDetail(String repositoryName) {
		return new FetchTarget(kind, Resource.REPOSITORY, owner, repositoryName, null);
	}

	/**
	 * Returns the API path of the first page.
	 * @param perPage page size requested from the API
	 * @return path relative to the API base URL
	 */
	public String firstPagePath(int perPage) {
		switch (resource) {
			case USER_PROFILE:
				return "/users/" + detailLogin;
			case REPOSITORY:
				return "/repos/" + owner + "/" + repository;
			default:
				break;
		}
		switch (kind) {
			case FOLLOWERS:
				return "/users/" + owner + "/followers?per_page=" + perPage;
			case CONTRIBUTORS:
				return "/repos/" + owner + "/" + repository + "/contributors?per_page=" + perPage;
			case FORKS:
				return "/users/" + owner + "/repos?type=owner&per_page=" + perPage;
			default:
				throw new IllegalStateException("Unsupported harvest kind: " + kind);
		}
	}

	/**
	 * Returns a readable name for logs and messages, e.g. "octocat" or "owner/repo".
	 * @return the display name
	 */
	public String displayName() {
		String base = repository != null ? owner + "/" + repository : owner;
		return resource == Resource.USER_PROFILE ? base + " (profile " + detailLogin + ")" : base;
	}

	private static void requireName(@Nullable String value, String what) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Fetch target " + what + " must not be empty");
		}
		if (!NAME_PATTERN.matcher(value).matches()) {
			throw new IllegalArgumentException("Invalid " + what + " '" + value + "'");
		}
	}

}
