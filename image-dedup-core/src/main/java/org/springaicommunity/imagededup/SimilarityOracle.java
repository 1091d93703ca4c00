package org.springaicommunity.imagededup;

/**
 * Perceptual pixel-difference function over two equal-shaped images.
 */
public interface SimilarityOracle {

	/**
	 * Count pixels that differ by more than {@code tolerance}.
	 * @param first first image
	 * @param second second image, same shape as {@code first}
	 * @param tolerance per-pixel tolerance in [0, 1]
	 * @return number of differing pixels
	 * @throws IllegalArgumentException if the images differ in shape
	 */
	int countDifferingPixels(NormalizedImage first, NormalizedImage second, double tolerance);

}
