package org.springaicommunity.imagededup;

/**
 * Decodes image bytes into a bounded, fixed-layout pixel buffer.
 *
 * <p>
 * Two successful normalizations of visually identical images must produce buffers of the
 * same shape, so that they can be compared byte for byte.
 */
public interface ImageNormalizer {

	/**
	 * Decode and normalize an image.
	 * @param content raw file bytes
	 * @return the normalized image
	 * @throws ImageNormalizationException if the bytes are not a decodable image
	 */
	NormalizedImage normalize(byte[] content) throws ImageNormalizationException;

}
