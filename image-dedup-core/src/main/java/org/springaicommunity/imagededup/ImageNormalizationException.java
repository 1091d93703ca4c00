package org.springaicommunity.imagededup;

/**
 * Thrown when image bytes cannot be decoded into a {@link NormalizedImage}.
 */
public class ImageNormalizationException extends Exception {

	public ImageNormalizationException(String message) {
		super(message);
	}

	public ImageNormalizationException(String message, Throwable cause) {
		super(message, cause);
	}

}
