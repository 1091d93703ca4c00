package org.springaicommunity.imagededup.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.imagededup.DuplicateGroup;
import org.springaicommunity.imagededup.KeepSelector;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link KeepSelector} that asks on the console which file of each group to keep. The
 * last choice keeps every file; no response also keeps every file.
 */
public class ConsoleKeepSelector implements KeepSelector {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleKeepSelector.class);

	private final ConsolePrompter prompter;

	public ConsoleKeepSelector(ConsolePrompter prompter) {
		this.prompter = prompter;
	}

	@Override
	public Optional<Path> chooseKeep(DuplicateGroup group) {
		logger.debug("Prompting for deletion of duplicate group: {}", group.members());
		List<String> choices = new ArrayList<>();
		for (Path member : group.members()) {
			choices.add("Keep " + member);
		}
		choices.add("Keep all");

		Integer selected = prompter.promptChoice("Duplicate images found: " + group.members() + ". Choose one to keep:",
				choices, 0);
		if (selected == null || selected == group.size()) {
			logger.debug("User chose to keep all for group {}", group.members());
			return Optional.empty();
		}
		Path keep = group.members().get(selected);
		logger.debug("User chose to keep {} for group {}", keep, group.members());
		return Optional.of(keep);
	}

}
