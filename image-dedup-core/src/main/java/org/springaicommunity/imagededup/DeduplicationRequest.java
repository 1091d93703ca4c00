package org.springaicommunity.imagededup;

import java.nio.file.Path;

/**
 * Parameters for one duplicate-detection run.
 *
 * @param inputDirectory directory whose images are compared
 * @param policy retention policy applied to every group
 * @param keepSelector consulted per group when the policy is
 * {@link RetentionPolicy#INTERACTIVE}
 */
public record DeduplicationRequest(Path inputDirectory, RetentionPolicy policy, KeepSelector keepSelector) {

	/**
	 * Request for a non-interactive policy. An interactive request built this way keeps
	 * every group intact.
	 */
	public DeduplicationRequest(Path inputDirectory, RetentionPolicy policy) {
		this(inputDirectory, policy, KeepSelector.KEEP_ALL);
	}

}
