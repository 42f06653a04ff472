package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * JsonNode navigation helpers used by the record normalizers. JSON {@code null} is
 * treated like a missing field.
 */
public class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	/**
	 * Day/month/year format of dates in the exports.
	 */
	public static final DateTimeFormatter EXPORT_DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	public Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isNumber() ? Optional.of(target.asLong()) : Optional.empty();
	}

	public boolean getBoolean(JsonNode node, String... path) {
		return navigate(node, path).asBoolean(false);
	}

	/**
	 * Returns a sanitized text field, or the empty string when absent.
	 * @param node the record
	 * @param path field path
	 * @return cleaned text, never null
	 */
	public String getText(JsonNode node, String... path) {
		return getString(node, path).map(TextSanitizer::clean).orElse("");
	}

	/**
	 * Returns a numeric field as decimal text, or the empty string when absent.
	 * @param node the record
	 * @param path field path
	 * @return the number as text, never null
	 */
	public String getNumberText(JsonNode node, String... path) {
		return getLong(node, path).map(String::valueOf).orElse("");
	}

	/**
	 * Returns an ISO-8601 timestamp field as a {@code dd/MM/yyyy} date, or the empty
	 * string when absent or unparseable.
	 * @param node the record
	 * @param path field path
	 * @return the formatted date, never null
	 */
	public String getExportDate(JsonNode node, String... path) {
		return getString(node, path).flatMap(JsonNodeUtils::parseDate).map(EXPORT_DATE_FORMAT::format).orElse("");
	}

	private static Optional<LocalDate> parseDate(String value) {
		try {
			return Optional.of(OffsetDateTime.parse(value).toLocalDate());
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", value);
			return Optional.empty();
		}
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
