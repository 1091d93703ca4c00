package org.springaicommunity.imagededup;

import java.nio.file.Path;

/**
 * Thrown when the directory to scan does not exist or cannot be read.
 */
public class InputDirectoryException extends RuntimeException {

	private final Path directory;

	public InputDirectoryException(Path directory, String message) {
		super(message + ": " + directory);
		this.directory = directory;
	}

	public Path getDirectory() {
		return directory;
	}

}
