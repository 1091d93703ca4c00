package org.springaicommunity.imagededup;

/**
 * How {@link DuplicateGrouper} turns pairwise verdicts into groups.
 */
public enum GroupingMode {

	/**
	 * Each unclaimed image anchors a group and claims every later unclaimed image that
	 * matches it. Members are only guaranteed to match the anchor, not each other.
	 */
	ANCHOR,

	/**
	 * Every pair is compared and groups are the connected components of the resulting
	 * duplicate graph. Transitive, but costs a comparison for every pair.
	 */
	CONNECTED;

	public static GroupingMode fromValue(String value) {
		return switch (value.trim().toLowerCase()) {
			case "anchor" -> ANCHOR;
			case "connected" -> CONNECTED;
			default -> throw new IllegalArgumentException(
					"Invalid grouping mode '" + value + "': must be 'anchor' or 'connected'");
		};
	}

}
