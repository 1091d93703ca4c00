package org.springaicommunity.imagededup;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * A discovered image file together with its raw content, read once per run.
 *
 * <p>
 * Equality compares the content bytes, not the array instance.
 *
 * @param path location of the image; unique within a run
 * @param content raw file bytes
 */
public record Candidate(Path path, byte[] content) {

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Candidate other)) {
			return false;
		}
		return path.equals(other.path) && Arrays.equals(content, other.content);
	}

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + Arrays.hashCode(content);
	}

	@Override
	public String toString() {
		return "Candidate{" + path + ", " + content.length + " bytes}";
	}

}
