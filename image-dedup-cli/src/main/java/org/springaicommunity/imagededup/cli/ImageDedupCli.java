package org.springaicommunity.imagededup.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.imagededup.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Image Dedup CLI Application
 *
 * Plain Java command-line application that finds visually duplicate images in a directory,
 * optionally deletes the extra copies and writes a JSON report of the run. Uses
 * ImageDedupBuilder for service wiring.
 *
 * Usage: java -jar image-dedup-cli.jar [OPTIONS]
 *
 * Examples: java -jar image-dedup-cli.jar --input photos --delete no java -jar
 * image-dedup-cli.jar --input photos --delete all --report-dir reports java -jar
 * image-dedup-cli.jar (prompts for directory and delete mode)
 */
public class ImageDedupCli {

	private static final Logger logger = LoggerFactory.getLogger(ImageDedupCli.class);

	static final int EXIT_SUCCESS = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_CANCELLED = 2;

	public static void main(String[] args) {
		DeduplicationProperties properties;
		try {
			properties = EnvironmentOverrides.apply(new DeduplicationProperties());
		}
		catch (IllegalArgumentException e) {
			logger.error("Invalid environment configuration: {}", e.getMessage());
			System.exit(EXIT_ERROR);
			return;
		}
		int exitCode = run(args, ConsolePrompter.system(), properties);
		if (exitCode != EXIT_SUCCESS) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args, ConsolePrompter prompter, DeduplicationProperties properties) {
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_SUCCESS;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			return EXIT_ERROR;
		}

		if (config.verbose) {
			enableDebugLogging();
		}

		String inputDirectory = config.inputDirectory;
		if (inputDirectory == null) {
			logger.debug("Prompting for input directory");
			inputDirectory = prompter.promptText(
					"Enter the directory containing images to check for duplicates (or press Enter to cancel):",
					ImageDedupCli::validateDirectory);
			if (inputDirectory == null || inputDirectory.isEmpty()) {
				logger.info("No input directory provided, cancelling...");
				return EXIT_CANCELLED;
			}
		}

		RetentionPolicy policy = config.retentionPolicy;
		if (policy == null) {
			logger.debug("Prompting for delete option");
			policy = promptForPolicy(prompter);
			if (policy == null) {
				logger.info("No delete option provided, cancelling...");
				return EXIT_CANCELLED;
			}
		}

		logConfiguration(config, inputDirectory, policy);

		try {
			DuplicateImageService service = ImageDedupBuilder.create()
				.properties(config.applyTo(properties))
				.objectMapper(ObjectMapperFactory.create())
				.buildService();
			KeepSelector keepSelector = policy == RetentionPolicy.INTERACTIVE ? new ConsoleKeepSelector(prompter)
					: KeepSelector.KEEP_ALL;

			DeduplicationResult result = service
				.findDuplicates(new DeduplicationRequest(Paths.get(inputDirectory), policy, keepSelector));

			logResults(result, config.verbose);
			return EXIT_SUCCESS;
		}
		catch (Exception e) {
			logger.error("Find Duplicate Images failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return EXIT_ERROR;
		}
	}

	@Nullable
	private static String validateDirectory(String value) {
		return Files.isDirectory(Paths.get(value)) ? null : "Directory not found.";
	}

	@Nullable
	private static RetentionPolicy promptForPolicy(ConsolePrompter prompter) {
		List<RetentionPolicy> options = List.of(RetentionPolicy.LIST_ONLY, RetentionPolicy.INTERACTIVE,
				RetentionPolicy.AUTO_KEEP_FIRST);
		Integer selected = prompter.promptChoice(
				"Do you want to delete duplicate images? (No: List duplicates only, Yes: Prompt to keep one of each duplicate group, All: Keep first image of each group without prompting)",
				List.of("No", "Yes", "All"), 0);
		return selected != null ? options.get(selected) : null;
	}

	private static void enableDebugLogging() {
		Logger appLogger = LoggerFactory.getLogger("org.springaicommunity.imagededup");
		if (appLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config, String inputDirectory, RetentionPolicy policy) {
		logger.info("Configuration:");
		logger.info("  Input directory: {}", inputDirectory);
		logger.info("  Delete mode: {}", policy.longName());
		logger.info("  Report directory: {}", config.reportDirectory);
		logger.info("  Tolerance: {}", config.pixelTolerance);
		logger.info("  Max diff pixels: {}", config.maxDifferingPixels);
		logger.info("  Envelope: {}x{}", config.maxWidth, config.maxHeight);
		logger.info("  Grouping: {}", config.groupingMode.name().toLowerCase());
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(DeduplicationResult result, boolean verbose) {
		logger.info("Find Duplicate Images completed");
		logger.info("Images scanned: {}", result.candidatesScanned());
		logger.info("Duplicate groups: {}", result.groups().size());
		logger.info("Files deleted: {}", result.deletedFiles().size());
		if (!result.failedDeletions().isEmpty()) {
			logger.warn("Deletions failed: {}", result.failedDeletions().size());
		}
		logger.info("Report: {}", result.reportPath());

		if (verbose && !result.groups().isEmpty()) {
			logger.info("Groups:");
			for (DuplicateGroup group : result.groups()) {
				logger.info("  - {}", group.members());
			}
		}
	}

}
