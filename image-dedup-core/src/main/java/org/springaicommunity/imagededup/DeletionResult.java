package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Outcome of a single best-effort file deletion.
 *
 * @param path the file that was to be deleted
 * @param deleted true if the file was removed
 * @param reason why the deletion failed, null on success
 * @param message failure detail, null on success
 */
public record DeletionResult(Path path, boolean deleted, @Nullable FailureReason reason, @Nullable String message) {

	public static DeletionResult success(Path path) {
		return new DeletionResult(path, true, null, null);
	}

	public static DeletionResult failure(Path path, FailureReason reason, String message) {
		return new DeletionResult(path, false, reason, message);
	}

	/**
	 * Why a deletion did not happen.
	 */
	public enum FailureReason {

		NOT_FOUND, ACCESS_DENIED, IO_ERROR

	}

}
