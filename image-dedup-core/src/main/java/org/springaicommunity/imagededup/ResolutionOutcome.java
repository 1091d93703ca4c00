package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * What happened to one duplicate group under the run's retention policy.
 *
 * @param group the resolved group
 * @param keep the member that was kept, or null when every member was kept
 * @param deletions one result per deletion attempt, empty when nothing was deleted
 */
public record ResolutionOutcome(DuplicateGroup group, @Nullable Path keep, List<DeletionResult> deletions) {

	public ResolutionOutcome {
		deletions = List.copyOf(deletions);
	}

	public static ResolutionOutcome keepAll(DuplicateGroup group) {
		return new ResolutionOutcome(group, null, List.of());
	}

	public List<Path> deletedPaths() {
		return deletions.stream().filter(DeletionResult::deleted).map(DeletionResult::path).toList();
	}

	public List<DeletionResult> failures() {
		return deletions.stream().filter(d -> !d.deleted()).toList();
	}

}
