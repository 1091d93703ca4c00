package org.springaicommunity.imagededup;

import java.util.Arrays;
import java.util.List;

/**
 * Rule deciding which members of a duplicate group are deleted. Chosen once per run.
 */
public enum RetentionPolicy {

	/** Report groups, delete nothing. */
	LIST_ONLY("no", "list-only"),

	/** Ask for each group which member to keep; the rest are deleted. */
	INTERACTIVE("yes", "interactive"),

	/** Keep the first member of every group in discovery order, delete the rest. */
	AUTO_KEEP_FIRST("all", "auto-keep-first");

	private final String shortName;

	private final String longName;

	RetentionPolicy(String shortName, String longName) {
		this.shortName = shortName;
		this.longName = longName;
	}

	public String shortName() {
		return shortName;
	}

	public String longName() {
		return longName;
	}

	/**
	 * Parse a policy from either its short ({@code no}, {@code yes}, {@code all}) or long
	 * ({@code list-only}, {@code interactive}, {@code auto-keep-first}) name.
	 * @param value the name, case-insensitive
	 * @return the matching policy
	 * @throws IllegalArgumentException if the value names no policy
	 */
	public static RetentionPolicy fromValue(String value) {
		String normalized = value.trim().toLowerCase();
		return Arrays.stream(values())
			.filter(p -> p.shortName.equals(normalized) || p.longName.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Invalid delete option '" + value
					+ "': must be one of " + acceptedValues()));
	}

	public static List<String> acceptedValues() {
		return List.of("no", "yes", "all", "list-only", "interactive", "auto-keep-first");
	}

}
