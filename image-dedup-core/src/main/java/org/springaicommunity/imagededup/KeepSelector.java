package org.springaicommunity.imagededup;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Chooses which member of a duplicate group to keep during an interactive run.
 */
@FunctionalInterface
public interface KeepSelector {

	/**
	 * Selector that keeps every member of every group.
	 */
	KeepSelector KEEP_ALL = group -> Optional.empty();

	/**
	 * Choose the member to keep.
	 * @param group the group being resolved
	 * @return the member to keep, or empty to keep every member
	 */
	Optional<Path> chooseKeep(DuplicateGroup group);

}
