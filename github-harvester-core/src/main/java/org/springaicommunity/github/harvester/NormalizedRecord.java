package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * A cleaned, fixed-schema export row.
 *
 * <p>
 * Every value is non-null; absent optional fields are empty strings, so rows of one kind
 * always have the same number of columns.
 */
public interface NormalizedRecord {

	/**
	 * Returns the harvest kind whose schema this row follows.
	 * @return the kind
	 */
	HarvestKind kind();

	/**
	 * Returns the cell values in the order of {@link HarvestKind#columns()}.
	 * @return the row values
	 */
	List<String> values();

}
