package org.springaicommunity.imagededup;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for duplicate image detection.
 *
 * <p>
 * Controls the normalization envelope, the pixel-difference thresholds used by
 * {@link DuplicateComparator}, how groups are formed and where run reports are written.
 * Properties can be set directly via setters or passed to {@link ImageDedupBuilder}.
 *
 * <p>
 * The defaults are the reference values: images are fitted inside 800x533, a pixel
 * differs when its color distance exceeds 10% and two images are duplicates when fewer
 * than 200 pixels differ.
 */
public class DeduplicationProperties {

	/**
	 * Maximum width of a normalized image in pixels.
	 */
	private int maxWidth = 800;

	/**
	 * Maximum height of a normalized image in pixels.
	 */
	private int maxHeight = 533;

	/**
	 * Per-pixel color tolerance in [0, 1]; smaller is stricter.
	 */
	private double pixelTolerance = 0.1;

	/**
	 * Two images are duplicates when fewer than this many pixels differ. Absolute, not a
	 * percentage of the image area.
	 */
	private int maxDifferingPixels = 200;

	/**
	 * Directory that receives run reports.
	 */
	private String reportDirectory = "bin/cleanup-files/duplicate-images";

	/**
	 * File extensions (lowercase, with leading dot) that are considered images.
	 */
	private List<String> imageExtensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".webp", ".gif"));

	/**
	 * Grouping algorithm.
	 */
	private GroupingMode groupingMode = GroupingMode.ANCHOR;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public int getMaxWidth() {
		return maxWidth;
	}

	public void setMaxWidth(int maxWidth) {
		this.maxWidth = maxWidth;
	}

	public int getMaxHeight() {
		return maxHeight;
	}

	public void setMaxHeight(int maxHeight) {
		this.maxHeight = maxHeight;
	}

	public double getPixelTolerance() {
		return pixelTolerance;
	}

	public void setPixelTolerance(double pixelTolerance) {
		this.pixelTolerance = pixelTolerance;
	}

	public int getMaxDifferingPixels() {
		return maxDifferingPixels;
	}

	public void setMaxDifferingPixels(int maxDifferingPixels) {
		this.maxDifferingPixels = maxDifferingPixels;
	}

	public String getReportDirectory() {
		return reportDirectory;
	}

	public void setReportDirectory(String reportDirectory) {
		this.reportDirectory = reportDirectory;
	}

	public List<String> getImageExtensions() {
		return imageExtensions;
	}

	public void setImageExtensions(List<String> imageExtensions) {
		this.imageExtensions = imageExtensions;
	}

	public GroupingMode getGroupingMode() {
		return groupingMode;
	}

	public void setGroupingMode(GroupingMode groupingMode) {
		this.groupingMode = groupingMode;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
