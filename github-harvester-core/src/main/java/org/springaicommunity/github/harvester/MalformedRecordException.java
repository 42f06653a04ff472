package org.springaicommunity.github.harvester;

/**
 * A raw record lacks a required identity field. The record is skipped and counted; the
 * harvest goes on.
 */
public class MalformedRecordException extends RuntimeException {

	private final String missingField;

	public MalformedRecordException(String recordType, String missingField) {
		super(recordType + " record without required field '" + missingField + "'");
		this.missingField = missingField;
	}

	public String getMissingField() {
		return missingField;
	}

}
