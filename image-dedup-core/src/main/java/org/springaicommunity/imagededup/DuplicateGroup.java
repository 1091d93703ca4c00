package org.springaicommunity.imagededup;

import java.nio.file.Path;
import java.util.List;

/**
 * Images judged to be duplicates of each other, in discovery order.
 *
 * @param members member paths; the first member is the group's anchor
 */
public record DuplicateGroup(List<Path> members) {

	public DuplicateGroup {
		members = List.copyOf(members);
		if (members.size() < 2) {
			throw new IllegalArgumentException("A duplicate group needs at least 2 members, got " + members.size());
		}
	}

	public Path first() {
		return members.get(0);
	}

	public int size() {
		return members.size();
	}

	public boolean contains(Path path) {
		return members.contains(path);
	}

}
