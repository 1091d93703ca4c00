package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two images are visual duplicates.
 *
 * <p>
 * Both images are normalized to the same envelope. Buffers of different shape are never
 * duplicates. Buffers with equal content hashes always are, without consulting the
 * {@link SimilarityOracle}. Anything else is a duplicate when the oracle reports fewer
 * than {@code maxDifferingPixels} differing pixels.
 *
 * <p>
 * The comparator never throws: a decode failure or an oracle failure yields
 * {@code false}. A missed duplicate only leaves a redundant file on disk, while a false
 * match would get a distinct image deleted.
 */
public class DuplicateComparator {

	private static final Logger logger = LoggerFactory.getLogger(DuplicateComparator.class);

	private final ImageNormalizer normalizer;

	@Nullable
	private final SimilarityOracle oracle;

	private final double pixelTolerance;

	private final int maxDifferingPixels;

	/**
	 * @param normalizer decodes image bytes
	 * @param oracle pixel-difference function, or null to rely on content hashes only
	 * @param pixelTolerance per-pixel tolerance passed to the oracle
	 * @param maxDifferingPixels duplicates have fewer differing pixels than this
	 */
	public DuplicateComparator(ImageNormalizer normalizer, @Nullable SimilarityOracle oracle, double pixelTolerance,
			int maxDifferingPixels) {
		this.normalizer = normalizer;
		this.oracle = oracle;
		this.pixelTolerance = pixelTolerance;
		this.maxDifferingPixels = maxDifferingPixels;
	}

	public DuplicateComparator(ImageNormalizer normalizer, @Nullable SimilarityOracle oracle,
			DeduplicationProperties properties) {
		this(normalizer, oracle, properties.getPixelTolerance(), properties.getMaxDifferingPixels());
	}

	/**
	 * Compare two encoded images.
	 * @param first raw bytes of the first image
	 * @param second raw bytes of the second image
	 * @return true if the images are duplicates; false if not or if either cannot be
	 * decoded
	 */
	public boolean areDuplicates(byte[] first, byte[] second) {
		NormalizedImage image1;
		NormalizedImage image2;
		try {
			image1 = normalizer.normalize(first);
			image2 = normalizer.normalize(second);
		}
		catch (ImageNormalizationException | RuntimeException e) {
			logger.warn("Image comparison failed: {}", e.getMessage());
			logger.debug("Comparison error", e);
			return false;
		}
		return areDuplicates(image1, image2);
	}

	/**
	 * Compare two already normalized images.
	 * @return true if the images are duplicates
	 */
	public boolean areDuplicates(NormalizedImage first, NormalizedImage second) {
		logger.debug("Image1: {}, Image2: {}", first, second);

		if (!first.sameShapeAs(second)) {
			logger.debug("Images differ in dimensions or channels");
			return false;
		}

		boolean identical = first.contentHash().equals(second.contentHash());
		if (identical) {
			logger.debug("Images identical by hash");
			return true;
		}

		SimilarityOracle similarityOracle = this.oracle;
		if (similarityOracle == null) {
			logger.debug("No similarity oracle configured, using hash comparison only");
			return identical;
		}

		try {
			int differing = similarityOracle.countDifferingPixels(first, second, pixelTolerance);
			logger.debug("Pixel differences: {}", differing);
			return differing < maxDifferingPixels;
		}
		catch (RuntimeException e) {
			logger.warn("Similarity oracle failed, falling back to hash comparison: {}", e.getMessage());
			logger.debug("Oracle error", e);
			return identical;
		}
	}

	/**
	 * Normalize one image with this comparator's normalizer, so callers can decode each
	 * candidate once and compare the result many times.
	 */
	public NormalizedImage normalize(byte[] content) throws ImageNormalizationException {
		return normalizer.normalize(content);
	}

}
