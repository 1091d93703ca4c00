package org.springaicommunity.imagededup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * File system implementation of {@link ImageRepository}.
 *
 * <p>
 * Only regular files directly inside the scanned directory are considered; discovery
 * order is by file name.
 */
public class FileSystemImageRepository implements ImageRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemImageRepository.class);

	private final List<String> imageExtensions;

	public FileSystemImageRepository(List<String> imageExtensions) {
		this.imageExtensions = imageExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
	}

	public FileSystemImageRepository(DeduplicationProperties properties) {
		this(properties.getImageExtensions());
	}

	@Override
	public List<Path> discoverImages(Path directory) throws IOException {
		List<Path> files = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
			for (Path path : stream) {
				if (Files.isRegularFile(path) && isImage(path)) {
					files.add(path);
				}
			}
		}
		files.sort(Comparator.comparing(p -> p.getFileName().toString()));
		logger.debug("Found {} image files in {}: {}", files.size(), directory, files);
		return files;
	}

	boolean isImage(Path path) {
		String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		int dot = name.lastIndexOf('.');
		return dot >= 0 && imageExtensions.contains(name.substring(dot));
	}

	@Override
	public byte[] read(Path path) throws IOException {
		return Files.readAllBytes(path);
	}

	@Override
	public DeletionResult delete(Path path) {
		try {
			Files.delete(path);
			return DeletionResult.success(path);
		}
		catch (NoSuchFileException e) {
			return DeletionResult.failure(path, DeletionResult.FailureReason.NOT_FOUND, "File not found");
		}
		catch (AccessDeniedException e) {
			return DeletionResult.failure(path, DeletionResult.FailureReason.ACCESS_DENIED, "Permission denied");
		}
		catch (IOException | SecurityException e) {
			return DeletionResult.failure(path, DeletionResult.FailureReason.IO_ERROR, String.valueOf(e.getMessage()));
		}
	}

}
