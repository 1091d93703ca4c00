package org.springaicommunity.imagededup;

/**
 * {@link SimilarityOracle} that compares RGBA pixels by their distance in YIQ color space.
 *
 * <p>
 * A pixel differs when its squared YIQ distance exceeds {@code MAX_YIQ_DELTA * tolerance²}.
 * Pixels that look like anti-aliasing along an edge present in both images are not counted
 * unless the oracle was created with {@code includeAntiAliased}.
 */
public class PixelMatchOracle implements SimilarityOracle {

	// Largest possible squared YIQ distance between two colors.
	static final double MAX_YIQ_DELTA = 35215;

	private final boolean includeAntiAliased;

	public PixelMatchOracle() {
		this(false);
	}

	public PixelMatchOracle(boolean includeAntiAliased) {
		this.includeAntiAliased = includeAntiAliased;
	}

	@Override
	public int countDifferingPixels(NormalizedImage first, NormalizedImage second, double tolerance) {
		if (!first.sameShapeAs(second)) {
			throw new IllegalArgumentException("Images differ in shape: " + first + " vs " + second);
		}
		if (first.channels() != 4) {
			throw new IllegalArgumentException("Expected 4-channel RGBA images, got " + first.channels());
		}
		if (tolerance < 0 || tolerance > 1) {
			throw new IllegalArgumentException("Tolerance must be within [0, 1]: " + tolerance);
		}

		byte[] img1 = first.pixels();
		byte[] img2 = second.pixels();
		int width = first.width();
		int height = first.height();
		double maxDelta = MAX_YIQ_DELTA * tolerance * tolerance;

		int diff = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int pos = (y * width + x) * 4;
				double delta = colorDelta(img1, img2, pos, pos, false);
				if (Math.abs(delta) > maxDelta) {
					if (!includeAntiAliased && (antiAliased(img1, x, y, width, height, img2)
							|| antiAliased(img2, x, y, width, height, img1))) {
						continue;
					}
					diff++;
				}
			}
		}
		return diff;
	}

	/**
	 * Whether the pixel at (x1, y1) sits on an anti-aliased edge: its neighbours include
	 * both a darker and a brighter pixel, and one of those extremes lies in a flat region of
	 * both images.
	 */
	private static boolean antiAliased(byte[] img, int x1, int y1, int width, int height, byte[] img2) {
		int x0 = Math.max(x1 - 1, 0);
		int y0 = Math.max(y1 - 1, 0);
		int x2 = Math.min(x1 + 1, width - 1);
		int y2 = Math.min(y1 + 1, height - 1);
		int pos = (y1 * width + x1) * 4;
		int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;
		double min = 0;
		double max = 0;
		int minX = 0;
		int minY = 0;
		int maxX = 0;
		int maxY = 0;

		for (int x = x0; x <= x2; x++) {
			for (int y = y0; y <= y2; y++) {
				if (x == x1 && y == y1) {
					continue;
				}
				double delta = colorDelta(img, img, pos, (y * width + x) * 4, true);
				if (delta == 0) {
					zeroes++;
					if (zeroes > 2) {
						return false;
					}
				}
				else if (delta < min) {
					min = delta;
					minX = x;
					minY = y;
				}
				else if (delta > max) {
					max = delta;
					maxX = x;
					maxY = y;
				}
			}
		}

		if (min == 0 || max == 0) {
			return false;
		}

		return (hasManySiblings(img, minX, minY, width, height) && hasManySiblings(img2, minX, minY, width, height))
				|| (hasManySiblings(img, maxX, maxY, width, height)
						&& hasManySiblings(img2, maxX, maxY, width, height));
	}

	/**
	 * Whether more than two neighbours of (x1, y1) have exactly its color.
	 */
	private static boolean hasManySiblings(byte[] img, int x1, int y1, int width, int height) {
		int x0 = Math.max(x1 - 1, 0);
		int y0 = Math.max(y1 - 1, 0);
		int x2 = Math.min(x1 + 1, width - 1);
		int y2 = Math.min(y1 + 1, height - 1);
		int pos = (y1 * width + x1) * 4;
		int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;

		for (int x = x0; x <= x2; x++) {
			for (int y = y0; y <= y2; y++) {
				if (x == x1 && y == y1) {
					continue;
				}
				int pos2 = (y * width + x) * 4;
				if (img[pos] == img[pos2] && img[pos + 1] == img[pos2 + 1] && img[pos + 2] == img[pos2 + 2]
						&& img[pos + 3] == img[pos2 + 3]) {
					zeroes++;
				}
				if (zeroes > 2) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Squared YIQ distance between two pixels, negative when the first pixel is brighter.
	 * With {@code yOnly} only the signed brightness difference is returned.
	 */
	static double colorDelta(byte[] img1, byte[] img2, int k, int m, boolean yOnly) {
		double r1 = img1[k] & 0xFF;
		double g1 = img1[k + 1] & 0xFF;
		double b1 = img1[k + 2] & 0xFF;
		double a1 = img1[k + 3] & 0xFF;
		double r2 = img2[m] & 0xFF;
		double g2 = img2[m + 1] & 0xFF;
		double b2 = img2[m + 2] & 0xFF;
		double a2 = img2[m + 3] & 0xFF;

		if (a1 == a2 && r1 == r2 && g1 == g2 && b1 == b2) {
			return 0;
		}

		// Translucent pixels are blended onto white.
		if (a1 < 255) {
			a1 /= 255;
			r1 = blend(r1, a1);
			g1 = blend(g1, a1);
			b1 = blend(b1, a1);
		}
		if (a2 < 255) {
			a2 /= 255;
			r2 = blend(r2, a2);
			g2 = blend(g2, a2);
			b2 = blend(b2, a2);
		}

		double y1 = rgb2y(r1, g1, b1);
		double y2 = rgb2y(r2, g2, b2);
		double y = y1 - y2;

		if (yOnly) {
			return y;
		}

		double i = rgb2i(r1, g1, b1) - rgb2i(r2, g2, b2);
		double q = rgb2q(r1, g1, b1) - rgb2q(r2, g2, b2);
		double delta = 0.5053 * y * y + 0.299 * i * i + 0.1957 * q * q;
		return y1 > y2 ? -delta : delta;
	}

	private static double blend(double c, double a) {
		return 255 + (c - 255) * a;
	}

	private static double rgb2y(double r, double g, double b) {
		return r * 0.29889531 + g * 0.58662247 + b * 0.11448223;
	}

	private static double rgb2i(double r, double g, double b) {
		return r * 0.59597799 - g * 0.27417610 - b * 0.32180189;
	}

	private static double rgb2q(double r, double g, double b) {
		return r * 0.21147017 - g * 0.52261711 + b * 0.31114694;
	}

}
