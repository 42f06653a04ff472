package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * A fork owned by the harvested user.
 *
 * @param fullName fork full name ("owner/repo")
 * @param name repository name
 * @param description description
 * @param htmlUrl web page of the fork
 * @param parentFullName full name of the forked repository, when the listing includes it
 * @param createdAt creation date, {@code dd/MM/yyyy}
 * @param updatedAt last update date, {@code dd/MM/yyyy}
 */
public record ForkRecord(String fullName, String name, String description, String htmlUrl, String parentFullName,
		String createdAt, String updatedAt) implements NormalizedRecord {

	public static final List<String> COLUMNS = List.of("full_name", "name", "description", "html_url",
			"parent_full_name", "created_at", "updated_at");

	@Override
	public HarvestKind kind() {
		return HarvestKind.FORKS;
	}

	@Override
	public List<String> values() {
		return List.of(fullName, name, description, htmlUrl, parentFullName, createdAt, updatedAt);
	}

}
