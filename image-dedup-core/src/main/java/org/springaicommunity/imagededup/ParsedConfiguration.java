package org.springaicommunity.imagededup;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Input directory; null means the user has to be asked
	@Nullable
	public String inputDirectory = null;

	// Retention policy; null means the user has to be asked
	@Nullable
	public RetentionPolicy retentionPolicy = null;

	// Report output
	public String reportDirectory;

	// Comparison thresholds
	public double pixelTolerance;

	public int maxDifferingPixels;

	public int maxWidth;

	public int maxHeight;

	public GroupingMode groupingMode;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(DeduplicationProperties defaultProperties) {
		// Initialize with defaults
		this.reportDirectory = defaultProperties.getReportDirectory();
		this.pixelTolerance = defaultProperties.getPixelTolerance();
		this.maxDifferingPixels = defaultProperties.getMaxDifferingPixels();
		this.maxWidth = defaultProperties.getMaxWidth();
		this.maxHeight = defaultProperties.getMaxHeight();
		this.groupingMode = defaultProperties.getGroupingMode();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed settings onto a properties object for {@link ImageDedupBuilder}.
	 * @param base properties supplying everything the command line does not set
	 * @return the updated properties
	 */
	public DeduplicationProperties applyTo(DeduplicationProperties base) {
		base.setReportDirectory(reportDirectory);
		base.setPixelTolerance(pixelTolerance);
		base.setMaxDifferingPixels(maxDifferingPixels);
		base.setMaxWidth(maxWidth);
		base.setMaxHeight(maxHeight);
		base.setGroupingMode(groupingMode);
		base.setVerbose(verbose);
		return base;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "inputDirectory='" + inputDirectory + '\'' + ", retentionPolicy="
				+ retentionPolicy + ", reportDirectory='" + reportDirectory + '\'' + ", pixelTolerance="
				+ pixelTolerance + ", maxDifferingPixels=" + maxDifferingPixels + ", maxWidth=" + maxWidth
				+ ", maxHeight=" + maxHeight + ", groupingMode=" + groupingMode + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
