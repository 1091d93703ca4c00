package org.springaicommunity.imagededup;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of one run, serialized to JSON once at the end of the run.
 *
 * @param duplicateGroups member paths of every duplicate group, in discovery order
 * @param deletedFiles paths that were actually removed
 * @param failedDeletions deletions that were attempted but failed
 * @param timestamp when the run completed
 */
public record RunReport(List<List<String>> duplicateGroups, List<String> deletedFiles,
		List<FailedDeletion> failedDeletions, Instant timestamp) {

	public RunReport {
		duplicateGroups = duplicateGroups.stream().map(List::copyOf).toList();
		deletedFiles = List.copyOf(deletedFiles);
		failedDeletions = List.copyOf(failedDeletions);
	}

	public static RunReport empty(Instant timestamp) {
		return new RunReport(List.of(), List.of(), List.of(), timestamp);
	}

	public static RunReport of(List<DuplicateGroup> groups, List<ResolutionOutcome> outcomes, Instant timestamp) {
		List<List<String>> groupPaths = groups.stream()
			.map(g -> g.members().stream().map(Object::toString).toList())
			.toList();
		List<String> deleted = outcomes.stream()
			.flatMap(o -> o.deletedPaths().stream())
			.map(Object::toString)
			.toList();
		List<FailedDeletion> failed = outcomes.stream()
			.flatMap(o -> o.failures().stream())
			.map(FailedDeletion::from)
			.toList();
		return new RunReport(groupPaths, deleted, failed, timestamp);
	}

	/**
	 * A deletion that did not succeed.
	 *
	 * @param path the file that was kept against the policy's intent
	 * @param reason failure category
	 * @param message failure detail
	 */
	public record FailedDeletion(String path, String reason, String message) {

		static FailedDeletion from(DeletionResult result) {
			DeletionResult.FailureReason reason = result.reason();
			String message = result.message();
			return new FailedDeletion(result.path().toString(),
					reason != null ? reason.name() : DeletionResult.FailureReason.IO_ERROR.name(),
					message != null ? message : "");
		}

	}

}
