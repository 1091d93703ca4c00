package org.springaicommunity.imagededup;

import java.nio.file.Path;
import java.util.List;

/**
 * Results of a duplicate-detection run.
 *
 * @param candidatesScanned number of image files compared
 * @param groups duplicate groups found, in discovery order
 * @param outcomes per-group resolution, empty for list-only runs
 * @param reportPath where the run report was written
 */
public record DeduplicationResult(int candidatesScanned, List<DuplicateGroup> groups,
		List<ResolutionOutcome> outcomes, Path reportPath) {

	public List<Path> deletedFiles() {
		return outcomes.stream().flatMap(o -> o.deletedPaths().stream()).toList();
	}

	public List<DeletionResult> failedDeletions() {
		return outcomes.stream().flatMap(o -> o.failures().stream()).toList();
	}

}
