package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes repositories of {@code /users/{user}/repos} that are forks.
 */
public class ForkNormalizer implements RecordNormalizer<ForkRecord> {

	private final JsonNodeUtils jsonUtils;

	public ForkNormalizer(JsonNodeUtils jsonUtils) {
		this.jsonUtils = jsonUtils;
	}

	/**
	 * Returns true if the repository record is a fork. Other repositories are filtered
	 * out of the export, which is not the same as dropping a malformed record.
	 * @param raw a repository record
	 * @return true for forks
	 */
	public boolean isFork(JsonNode raw) {
		return jsonUtils.getBoolean(raw, "fork");
	}

	@Override
	public ForkRecord normalize(JsonNode raw) {
		String fullName = jsonUtils.getText(raw, "full_name");
		if (fullName.isEmpty()) {
			throw new MalformedRecordException("Fork", "full_name");
		}
		return new ForkRecord(fullName, jsonUtils.getText(raw, "name"), jsonUtils.getText(raw, "description"),
				jsonUtils.getText(raw, "html_url"), jsonUtils.getText(raw, "parent", "full_name"),
				jsonUtils.getExportDate(raw, "created_at"), jsonUtils.getExportDate(raw, "updated_at"));
	}

}
