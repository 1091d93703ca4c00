package org.springaicommunity.imagededup;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File system operations needed by a duplicate-detection run.
 *
 * <p>
 * Abstracts file access to enable testability and keeps deletion failures out of the
 * exception path.
 */
public interface ImageRepository {

	/**
	 * List image files directly inside a directory, in a stable discovery order. Files
	 * whose extension is not an image extension are skipped silently.
	 * @param directory the directory to scan
	 * @return image paths in discovery order
	 * @throws IOException if the directory cannot be listed
	 */
	List<Path> discoverImages(Path directory) throws IOException;

	/**
	 * Read a file completely.
	 * @param path the file
	 * @return its bytes
	 * @throws IOException if the file cannot be read
	 */
	byte[] read(Path path) throws IOException;

	/**
	 * Delete a file. Never throws for I/O problems.
	 * @param path the file
	 * @return success, or the reason the file is still there
	 */
	DeletionResult delete(Path path);

}
