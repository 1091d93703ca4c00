package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a {@link RetentionPolicy} to duplicate groups and deletes the files the policy
 * gives up.
 *
 * <p>
 * Groups are resolved independently, in discovery order. Every deletion is best effort:
 * a failure is logged and recorded in the group's {@link ResolutionOutcome} and does not
 * stop the remaining deletions.
 */
public class ResolutionEngine {

	private static final Logger logger = LoggerFactory.getLogger(ResolutionEngine.class);

	private final ImageRepository repository;

	public ResolutionEngine(ImageRepository repository) {
		this.repository = repository;
	}

	/**
	 * Resolve all groups under one policy.
	 * @param groups duplicate groups in discovery order
	 * @param policy the run's retention policy
	 * @param keepSelector consulted once per group for {@link RetentionPolicy#INTERACTIVE}
	 * @return one outcome per group, or an empty list for
	 * {@link RetentionPolicy#LIST_ONLY}
	 */
	public List<ResolutionOutcome> resolve(List<DuplicateGroup> groups, RetentionPolicy policy,
			KeepSelector keepSelector) {
		if (policy == RetentionPolicy.LIST_ONLY) {
			logger.info("Found {} duplicate image groups. No files deleted as per user selection.", groups.size());
			return List.of();
		}

		List<ResolutionOutcome> outcomes = new ArrayList<>(groups.size());
		for (DuplicateGroup group : groups) {
			Path keep = switch (policy) {
				case INTERACTIVE -> chooseInteractively(group, keepSelector);
				case AUTO_KEEP_FIRST -> group.first();
				case LIST_ONLY -> null;
			};

			if (keep == null) {
				logger.debug("Keeping all files of group {}", group.members());
				outcomes.add(ResolutionOutcome.keepAll(group));
				continue;
			}

			logger.debug("Keeping {} for group {}", keep, group.members());
			List<DeletionResult> deletions = new ArrayList<>();
			for (Path member : group.members()) {
				if (!member.equals(keep)) {
					deletions.add(delete(member));
				}
			}
			outcomes.add(new ResolutionOutcome(group, keep, deletions));
		}

		int deleted = outcomes.stream().mapToInt(o -> o.deletedPaths().size()).sum();
		int failed = outcomes.stream().mapToInt(o -> o.failures().size()).sum();
		if (failed > 0) {
			logger.warn("Found {} duplicate image groups, deleted {} files, {} deletions failed.", groups.size(),
					deleted, failed);
		}
		else {
			logger.info("Found {} duplicate image groups, deleted {} files.", groups.size(), deleted);
		}
		return outcomes;
	}

	@Nullable
	private Path chooseInteractively(DuplicateGroup group, KeepSelector keepSelector) {
		Optional<Path> choice = keepSelector.chooseKeep(group);
		if (choice.isEmpty()) {
			return null;
		}
		if (!group.contains(choice.get())) {
			logger.warn("Selected file {} is not a member of group {}, keeping all", choice.get(), group.members());
			return null;
		}
		return choice.get();
	}

	private DeletionResult delete(Path path) {
		DeletionResult result = repository.delete(path);
		if (result.deleted()) {
			logger.info("Deleted duplicate image: {}", path);
		}
		else {
			logger.error("Failed to delete {}: {} ({})", path, result.message(), result.reason());
		}
		return result;
	}

}
