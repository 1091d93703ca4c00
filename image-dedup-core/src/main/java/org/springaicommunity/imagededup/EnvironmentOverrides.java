package org.springaicommunity.imagededup;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Applies deployment-level overrides from the environment to
 * {@link DeduplicationProperties}.
 *
 * <p>
 * Variables are looked up through dotenv-java: the system environment wins, then a
 * {@code .env} file in the working directory. The {@code .env} file is loaded once per
 * process. Command-line options are applied afterwards and take precedence.
 */
public final class EnvironmentOverrides {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentOverrides.class);

	/**
	 * Overrides the default report directory.
	 */
	public static final String REPORT_DIR_VARIABLE = "IMAGE_DEDUP_REPORT_DIR";

	/**
	 * Overrides the default grouping mode ({@code anchor} or {@code connected}).
	 */
	public static final String GROUPING_VARIABLE = "IMAGE_DEDUP_GROUPING";

	private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentOverrides() {
	}

	/**
	 * Apply overrides from the process environment and {@code .env}.
	 * @param properties the properties to update
	 * @return the same properties instance
	 */
	public static DeduplicationProperties apply(DeduplicationProperties properties) {
		return apply(properties, DOTENV::get);
	}

	/**
	 * Apply overrides resolved through the given lookup.
	 * @param properties the properties to update
	 * @param lookup variable name to value, {@code null} when unset
	 * @return the same properties instance
	 * @throws IllegalArgumentException if a variable holds an invalid value
	 */
	static DeduplicationProperties apply(DeduplicationProperties properties,
			Function<String, @Nullable String> lookup) {
		String reportDir = lookup.apply(REPORT_DIR_VARIABLE);
		if (reportDir != null && !reportDir.isBlank()) {
			logger.debug("Report directory overridden by {}: {}", REPORT_DIR_VARIABLE, reportDir);
			properties.setReportDirectory(reportDir.trim());
		}
		String grouping = lookup.apply(GROUPING_VARIABLE);
		if (grouping != null && !grouping.isBlank()) {
			logger.debug("Grouping mode overridden by {}: {}", GROUPING_VARIABLE, grouping);
			properties.setGroupingMode(GroupingMode.fromValue(grouping.trim()));
		}
		return properties;
	}

}
