package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * The listings this harvester knows how to collect, with the export schema of each.
 */
public enum HarvestKind {

	/** Followers of a user, enriched with each follower's profile. */
	FOLLOWERS("followers", FollowerRecord.COLUMNS),

	/** Contributors of a repository, with the repository's details on every row. */
	CONTRIBUTORS("contributors", ContributorRecord.COLUMNS),

	/** Repositories owned by a user that are forks. */
	FORKS("forks", ForkRecord.COLUMNS);

	private final String id;

	private final List<String> columns;

	HarvestKind(String id, List<String> columns) {
		this.id = id;
		this.columns = columns;
	}

	/**
	 * Returns the lowercase name used on the command line and in file names.
	 * @return the identifier
	 */
	public String id() {
		return id;
	}

	/**
	 * Returns the CSV header of this kind's export.
	 * @return column names in export order
	 */
	public List<String> columns() {
		return columns;
	}

	/**
	 * Look up a kind by its identifier, ignoring case.
	 * @param id the identifier ("followers", "contributors" or "forks")
	 * @return the kind
	 * @throws IllegalArgumentException if no kind has this identifier
	 */
	public static HarvestKind fromId(String id) {
		for (HarvestKind kind : values()) {
			if (kind.id.equalsIgnoreCase(id.trim())) {
				return kind;
			}
		}
		throw new IllegalArgumentException(
				"Unknown harvest type '" + id + "' (must be 'followers', 'contributors', or 'forks')");
	}

}
