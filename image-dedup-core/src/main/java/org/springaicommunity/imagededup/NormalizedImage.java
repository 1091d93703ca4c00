package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Pixel buffer of a decoded image, fitted to the normalization envelope. Pixels are stored
 * row-major, {@code channels} bytes per pixel.
 */
public final class NormalizedImage {

	private final int width;

	private final int height;

	private final int channels;

	private final byte[] pixels;

	@Nullable
	private String contentHash;

	public NormalizedImage(int width, int height, int channels, byte[] pixels) {
		if (pixels.length != width * height * channels) {
			throw new IllegalArgumentException("Buffer of " + pixels.length + " bytes does not match " + width + "x"
					+ height + "x" + channels);
		}
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.pixels = pixels;
	}

	public int width() {
		return width;
	}

	public int height() {
		return height;
	}

	public int channels() {
		return channels;
	}

	/**
	 * Raw pixel bytes. The array is shared, callers must not modify it.
	 */
	public byte[] pixels() {
		return pixels;
	}

	public boolean sameShapeAs(NormalizedImage other) {
		return width == other.width && height == other.height && channels == other.channels;
	}

	/**
	 * SHA-256 of the pixel buffer as lowercase hex, computed on first use.
	 */
	public String contentHash() {
		String hash = contentHash;
		if (hash == null) {
			hash = HexFormat.of().formatHex(sha256().digest(pixels));
			contentHash = hash;
		}
		return hash;
	}

	private static MessageDigest sha256() {
		try {
			return MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}

	@Override
	public String toString() {
		return "NormalizedImage{" + width + "x" + height + ", channels=" + channels + '}';
	}

}
