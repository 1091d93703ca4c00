package org.springaicommunity.imagededup;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the duplicate image finder. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */

public class ArgumentParser {

	private final DeduplicationProperties defaultProperties;

	public ArgumentParser(DeduplicationProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-i", "--input":
					config.inputDirectory = getRequiredValue(args, i, "input");
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--delete":
					config.retentionPolicy = RetentionPolicy.fromValue(getRequiredValue(args, i, "delete"));
					i++;
					break;

				case "-o", "--report-dir":
					config.reportDirectory = getRequiredValue(args, i, "report-dir");
					i++;
					break;

				case "--tolerance":
					String toleranceStr = getRequiredValue(args, i, "tolerance");
					try {
						config.pixelTolerance = Double.parseDouble(toleranceStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid tolerance '" + toleranceStr + "': must be a number between 0 and 1");
					}
					i++;
					break;

				case "--max-diff-pixels":
					config.maxDifferingPixels = parsePositiveInt(getRequiredValue(args, i, "max-diff-pixels"),
							"max diff pixels");
					i++;
					break;

				case "--max-width":
					config.maxWidth = parsePositiveInt(getRequiredValue(args, i, "max-width"), "max width");
					i++;
					break;

				case "--max-height":
					config.maxHeight = parsePositiveInt(getRequiredValue(args, i, "max-height"), "max height");
					i++;
					break;

				case "--grouping":
					config.groupingMode = GroupingMode.fromValue(getRequiredValue(args, i, "grouping"));
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: image-dedup [OPTIONS]\n");
		help.append("\n");
		help.append("Find visually duplicate images in a directory and optionally delete the extra copies.\n");
		help.append("Only .jpg, .jpeg, .png, .webp and .gif files directly inside the directory are compared.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -i, --input DIR         Directory containing images (prompted for when omitted)\n");
		help.append("    -d, --delete MODE       What to do with duplicates (prompted for when omitted):\n");
		help.append("                              no,  list-only        list duplicates only\n");
		help.append("                              yes, interactive      choose one file to keep per group\n");
		help.append("                              all, auto-keep-first  keep the first file of each group\n");
		help.append("    -o, --report-dir DIR    Report directory (default: ")
			.append(defaultProperties.getReportDirectory())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("COMPARISON OPTIONS:\n");
		help.append("    --tolerance T           Per-pixel color tolerance, 0 to 1 (default: ")
			.append(defaultProperties.getPixelTolerance())
			.append(")\n");
		help.append("    --max-diff-pixels N     Images with fewer differing pixels are duplicates (default: ")
			.append(defaultProperties.getMaxDifferingPixels())
			.append(")\n");
		help.append("    --max-width W           Width images are scaled down to before comparing (default: ")
			.append(defaultProperties.getMaxWidth())
			.append(")\n");
		help.append("    --max-height H          Height images are scaled down to before comparing (default: ")
			.append(defaultProperties.getMaxHeight())
			.append(")\n");
		help.append("    --grouping MODE         anchor: members must match the group's first image (default)\n");
		help.append("                            connected: any chain of matching images forms one group\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(EnvironmentOverrides.REPORT_DIR_VARIABLE)
			.append("  Default report directory (also read from .env)\n");
		help.append("    ")
			.append(EnvironmentOverrides.GROUPING_VARIABLE)
			.append("    Default grouping mode (also read from .env)\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  Run completed, with or without duplicates\n");
		help.append("    1  Error\n");
		help.append("    2  Cancelled\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    image-dedup --input ~/Pictures --delete no\n");
		help.append("    image-dedup --input ~/Pictures --delete all --report-dir reports\n");
		help.append("    image-dedup --input ~/Pictures --delete yes --grouping connected\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositiveInt(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException(capitalize(name) + " must be positive: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private static String capitalize(String value) {
		return Character.toUpperCase(value.charAt(0)) + value.substring(1);
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.inputDirectory != null && config.inputDirectory.trim().isEmpty()) {
			errors.add("Input directory cannot be empty");
		}

		if (config.reportDirectory.trim().isEmpty()) {
			errors.add("Report directory cannot be empty");
		}

		if (Double.isNaN(config.pixelTolerance) || config.pixelTolerance < 0 || config.pixelTolerance > 1) {
			errors.add("Tolerance must be between 0 and 1 (got: " + config.pixelTolerance + ")");
		}

		if (config.maxDifferingPixels <= 0) {
			errors.add("Max diff pixels must be positive (got: " + config.maxDifferingPixels + ")");
		}

		if (config.maxWidth <= 0 || config.maxHeight <= 0) {
			errors.add("Normalization envelope must be positive (got: " + config.maxWidth + "x" + config.maxHeight
					+ ")");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
