package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes {@code /users/{login}} profiles of followers.
 */
public class FollowerNormalizer implements RecordNormalizer<FollowerRecord> {

	private final JsonNodeUtils jsonUtils;

	public FollowerNormalizer(JsonNodeUtils jsonUtils) {
		this.jsonUtils = jsonUtils;
	}

	@Override
	public FollowerRecord normalize(JsonNode raw) {
		String login = jsonUtils.getText(raw, "login");
		if (login.isEmpty()) {
			throw new MalformedRecordException("Follower", "login");
		}
		return new FollowerRecord(login, jsonUtils.getText(raw, "name"),
				jsonUtils.getText(raw, "company").replace("@", "").trim(), jsonUtils.getText(raw, "blog"),
				jsonUtils.getText(raw, "email"), jsonUtils.getText(raw, "bio"),
				jsonUtils.getNumberText(raw, "public_repos"), jsonUtils.getNumberText(raw, "followers"),
				jsonUtils.getNumberText(raw, "following"), jsonUtils.getExportDate(raw, "created_at"));
	}

}
