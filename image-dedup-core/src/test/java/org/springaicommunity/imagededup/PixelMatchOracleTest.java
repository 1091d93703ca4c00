package org.springaicommunity.imagededup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PixelMatchOracle Tests")
class PixelMatchOracleTest {

	private final PixelMatchOracle oracle = new PixelMatchOracle();

	private static NormalizedImage solid(int width, int height, int r, int g, int b) {
		byte[] pixels = new byte[width * height * 4];
		for (int i = 0; i < pixels.length; i += 4) {
			pixels[i] = (byte) r;
			pixels[i + 1] = (byte) g;
			pixels[i + 2] = (byte) b;
			pixels[i + 3] = (byte) 255;
		}
		return new NormalizedImage(width, height, 4, pixels);
	}

	private static NormalizedImage withPixel(NormalizedImage image, int x, int y, int r, int g, int b) {
		byte[] pixels = image.pixels().clone();
		int pos = (y * image.width() + x) * 4;
		pixels[pos] = (byte) r;
		pixels[pos + 1] = (byte) g;
		pixels[pos + 2] = (byte) b;
		return new NormalizedImage(image.width(), image.height(), 4, pixels);
	}

	@Test
	@DisplayName("Should count no differences between identical images")
	void shouldCountNothingForIdenticalImages() {
		assertThat(oracle.countDifferingPixels(solid(10, 10, 30, 60, 90), solid(10, 10, 30, 60, 90), 0.1)).isZero();
	}

	@Test
	@DisplayName("Should count every pixel of completely different images")
	void shouldCountEveryPixelOfDifferentImages() {
		assertThat(oracle.countDifferingPixels(solid(10, 10, 0, 0, 0), solid(10, 10, 255, 255, 255), 0.1))
			.isEqualTo(100);
	}

	@Test
	@DisplayName("Should count a single changed pixel")
	void shouldCountSingleChangedPixel() {
		NormalizedImage base = solid(5, 5, 255, 255, 255);
		NormalizedImage changed = withPixel(base, 2, 2, 0, 0, 0);

		assertThat(oracle.countDifferingPixels(base, changed, 0.1)).isEqualTo(1);
	}

	@Test
	@DisplayName("Should ignore color shifts within the tolerance")
	void shouldIgnoreShiftsWithinTolerance() {
		assertThat(oracle.countDifferingPixels(solid(4, 4, 100, 100, 100), solid(4, 4, 103, 101, 100), 0.1)).isZero();
	}

	@Test
	@DisplayName("Should count small shifts at zero tolerance")
	void shouldCountSmallShiftsAtZeroTolerance() {
		assertThat(oracle.countDifferingPixels(solid(4, 4, 100, 100, 100), solid(4, 4, 103, 101, 100), 0.0))
			.isEqualTo(16);
	}

	@Test
	@DisplayName("Should reject images of different shape")
	void shouldRejectDifferentShapes() {
		assertThatThrownBy(() -> oracle.countDifferingPixels(solid(4, 4, 0, 0, 0), solid(4, 5, 0, 0, 0), 0.1))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("shape");
	}

	@Test
	@DisplayName("Should reject tolerance outside [0, 1]")
	void shouldRejectInvalidTolerance() {
		assertThatThrownBy(() -> oracle.countDifferingPixels(solid(2, 2, 0, 0, 0), solid(2, 2, 0, 0, 0), 1.5))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Should sign the color delta by brightness")
	void shouldSignDeltaByBrightness() {
		byte[] white = { (byte) 255, (byte) 255, (byte) 255, (byte) 255 };
		byte[] black = { 0, 0, 0, (byte) 255 };

		assertThat(PixelMatchOracle.colorDelta(white, black, 0, 0, false)).isNegative();
		assertThat(PixelMatchOracle.colorDelta(black, white, 0, 0, false)).isPositive();
		// brightness only: 0.5053 * 255^2
		assertThat(PixelMatchOracle.colorDelta(black, white, 0, 0, false)).isCloseTo(32857.13, within(0.01));
		assertThat(Math.abs(PixelMatchOracle.colorDelta(black, white, 0, 0, false)))
			.isLessThan(PixelMatchOracle.MAX_YIQ_DELTA);
	}

	@Test
	@DisplayName("Should measure only brightness when asked for luma")
	void shouldMeasureLumaOnly() {
		byte[] white = { (byte) 255, (byte) 255, (byte) 255, (byte) 255 };
		byte[] black = { 0, 0, 0, (byte) 255 };

		assertThat(Math.abs(PixelMatchOracle.colorDelta(black, white, 0, 0, true))).isCloseTo(255.0, within(0.01));
	}

	/**
	 * Black left half, white right half, split at x = 5.
	 */
	private static NormalizedImage edge(int size) {
		byte[] pixels = new byte[size * size * 4];
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++) {
				int pos = (y * size + x) * 4;
				byte value = x < size / 2 ? 0 : (byte) 255;
				pixels[pos] = value;
				pixels[pos + 1] = value;
				pixels[pos + 2] = value;
				pixels[pos + 3] = (byte) 255;
			}
		}
		return new NormalizedImage(size, size, 4, pixels);
	}

	private static NormalizedImage withGrayColumn(NormalizedImage image, int column) {
		NormalizedImage result = image;
		for (int y = 0; y < image.height(); y++) {
			result = withPixel(result, column, y, 128, 128, 128);
		}
		return result;
	}

	@Test
	@DisplayName("Should not count a softened edge as different")
	void shouldIgnoreAntiAliasedEdge() {
		NormalizedImage sharp = edge(10);
		NormalizedImage softened = withGrayColumn(sharp, 5);

		assertThat(oracle.countDifferingPixels(sharp, softened, 0.1)).isZero();
		assertThat(oracle.countDifferingPixels(softened, sharp, 0.1)).isZero();
	}

	@Test
	@DisplayName("Should count a softened edge when anti-aliased pixels are included")
	void shouldCountAntiAliasedEdgeWhenIncluded() {
		NormalizedImage sharp = edge(10);
		NormalizedImage softened = withGrayColumn(sharp, 5);

		assertThat(new PixelMatchOracle(true).countDifferingPixels(sharp, softened, 0.1)).isEqualTo(10);
	}

	@Test
	@DisplayName("Should count a gray column inside a flat area")
	void shouldCountGrayColumnAwayFromEdge() {
		NormalizedImage flat = solid(10, 10, 255, 255, 255);
		NormalizedImage marked = withGrayColumn(flat, 5);

		assertThat(oracle.countDifferingPixels(flat, marked, 0.1)).isEqualTo(10);
	}

}
