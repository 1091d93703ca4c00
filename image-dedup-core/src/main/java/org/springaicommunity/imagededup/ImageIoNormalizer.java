package org.springaicommunity.imagededup;

import org.imgscalr.Scalr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@link ImageNormalizer} backed by {@code javax.imageio} for decoding and imgscalr for
 * resizing.
 *
 * <p>
 * Images are fitted inside the configured envelope preserving aspect ratio and are never
 * enlarged. The result is always 4-channel RGBA, alpha forced to opaque when the source
 * has none. WebP decoding relies on an ImageIO plugin being present on the class path.
 * Animated formats contribute their first frame only.
 */
public class ImageIoNormalizer implements ImageNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(ImageIoNormalizer.class);

	static final int CHANNELS = 4;

	private final int maxWidth;

	private final int maxHeight;

	public ImageIoNormalizer(int maxWidth, int maxHeight) {
		if (maxWidth <= 0 || maxHeight <= 0) {
			throw new IllegalArgumentException("Envelope must be positive, got " + maxWidth + "x" + maxHeight);
		}
		this.maxWidth = maxWidth;
		this.maxHeight = maxHeight;
	}

	public ImageIoNormalizer(DeduplicationProperties properties) {
		this(properties.getMaxWidth(), properties.getMaxHeight());
	}

	@Override
	public NormalizedImage normalize(byte[] content) throws ImageNormalizationException {
		BufferedImage decoded;
		try {
			decoded = ImageIO.read(new ByteArrayInputStream(content));
		}
		catch (IOException e) {
			throw new ImageNormalizationException("Failed to decode image: " + e.getMessage(), e);
		}
		if (decoded == null) {
			throw new ImageNormalizationException("No image reader recognizes the content (" + content.length + " bytes)");
		}

		int[] target = fitInside(decoded.getWidth(), decoded.getHeight(), maxWidth, maxHeight);
		BufferedImage resized = decoded;
		if (target[0] != decoded.getWidth() || target[1] != decoded.getHeight()) {
			resized = Scalr.resize(decoded, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, target[0], target[1]);
			logger.debug("Resized {}x{} to {}x{}", decoded.getWidth(), decoded.getHeight(), target[0], target[1]);
		}

		return toRgba(resized);
	}

	/**
	 * Dimensions of a {@code width x height} image scaled down to fit inside the envelope.
	 * @return {@code [width, height]}, unchanged when the image already fits
	 */
	static int[] fitInside(int width, int height, int maxWidth, int maxHeight) {
		if (width <= maxWidth && height <= maxHeight) {
			return new int[] { width, height };
		}
		double scale = Math.min((double) maxWidth / width, (double) maxHeight / height);
		int scaledWidth = Math.max(1, Math.min(maxWidth, (int) Math.round(width * scale)));
		int scaledHeight = Math.max(1, Math.min(maxHeight, (int) Math.round(height * scale)));
		return new int[] { scaledWidth, scaledHeight };
	}

	private static NormalizedImage toRgba(BufferedImage image) {
		int width = image.getWidth();
		int height = image.getHeight();

		BufferedImage argb = image;
		if (image.getType() != BufferedImage.TYPE_INT_ARGB) {
			argb = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
			Graphics2D graphics = argb.createGraphics();
			try {
				graphics.drawImage(image, 0, 0, null);
			}
			finally {
				graphics.dispose();
			}
		}

		int[] packed = argb.getRGB(0, 0, width, height, null, 0, width);
		byte[] pixels = new byte[packed.length * CHANNELS];
		for (int i = 0; i < packed.length; i++) {
			int p = packed[i];
			int offset = i * CHANNELS;
			pixels[offset] = (byte) (p >> 16);
			pixels[offset + 1] = (byte) (p >> 8);
			pixels[offset + 2] = (byte) p;
			pixels[offset + 3] = (byte) (p >>> 24);
		}
		return new NormalizedImage(width, height, CHANNELS, pixels);
	}

}
