package org.springaicommunity.imagededup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Runs duplicate image detection end to end: discovery, grouping, resolution and
 * reporting.
 *
 * <p>
 * Exactly one report is written per run that gets past input validation, including runs
 * that find no images or no duplicates.
 */
public class DuplicateImageService {

	private static final Logger logger = LoggerFactory.getLogger(DuplicateImageService.class);

	private final ImageRepository repository;

	private final DuplicateGrouper grouper;

	private final ResolutionEngine resolutionEngine;

	private final ReportWriter reportWriter;

	private final Clock clock;

	public DuplicateImageService(ImageRepository repository, DuplicateGrouper grouper,
			ResolutionEngine resolutionEngine, ReportWriter reportWriter, Clock clock) {
		this.repository = repository;
		this.grouper = grouper;
		this.resolutionEngine = resolutionEngine;
		this.reportWriter = reportWriter;
		this.clock = clock;
	}

	/**
	 * Find duplicate images in a directory and apply the request's retention policy.
	 * @param request the run parameters
	 * @return groups, deletions and the report location
	 * @throws InputDirectoryException if the input directory is missing or unreadable
	 * @throws IOException if an image cannot be read or the report cannot be written
	 */
	public DeduplicationResult findDuplicates(DeduplicationRequest request) throws IOException {
		logger.info("Starting Find Duplicate Images");
		Path inputDirectory = request.inputDirectory();
		validateInputDirectory(inputDirectory);

		List<Path> candidates = repository.discoverImages(inputDirectory);
		if (candidates.isEmpty()) {
			logger.info("No image files found in {}", inputDirectory);
			Path reportPath = reportWriter.write(RunReport.empty(clock.instant()));
			return new DeduplicationResult(0, List.of(), List.of(), reportPath);
		}

		List<DuplicateGroup> groups = grouper.groupDuplicates(candidates);
		if (groups.isEmpty()) {
			logger.info("No duplicate images found.");
			Path reportPath = reportWriter.write(RunReport.empty(clock.instant()));
			return new DeduplicationResult(candidates.size(), List.of(), List.of(), reportPath);
		}

		List<ResolutionOutcome> outcomes = resolutionEngine.resolve(groups, request.policy(),
				request.keepSelector());

		Path reportPath = reportWriter.write(RunReport.of(groups, outcomes, clock.instant()));
		DeduplicationResult result = new DeduplicationResult(candidates.size(), groups, outcomes, reportPath);
		logger.debug("Find Duplicate Images completed: {} duplicate groups found, {} deleted", groups.size(),
				result.deletedFiles().size());
		return result;
	}

	private void validateInputDirectory(Path inputDirectory) {
		if (!Files.exists(inputDirectory)) {
			throw new InputDirectoryException(inputDirectory, "Input directory not found");
		}
		if (!Files.isDirectory(inputDirectory)) {
			throw new InputDirectoryException(inputDirectory, "Input path is not a directory");
		}
		if (!Files.isReadable(inputDirectory)) {
			throw new InputDirectoryException(inputDirectory, "Input directory is not readable");
		}
	}

}
