package org.springaicommunity.imagededup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * {@link ReportWriter} that writes one pretty-printed JSON file per run, named after the
 * run's local completion time.
 */
public class JsonReportWriter implements ReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(JsonReportWriter.class);

	private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

	private final ObjectMapper objectMapper;

	private final Path outputDirectory;

	private final ZoneId zone;

	public JsonReportWriter(ObjectMapper objectMapper, Path outputDirectory, ZoneId zone) {
		this.objectMapper = objectMapper;
		this.outputDirectory = outputDirectory;
		this.zone = zone;
	}

	public JsonReportWriter(ObjectMapper objectMapper, Path outputDirectory) {
		this(objectMapper, outputDirectory, ZoneId.systemDefault());
	}

	@Override
	public Path write(RunReport report) throws IOException {
		String filename = "duplicate-images-report-" + FILE_TIMESTAMP.format(report.timestamp().atZone(zone))
				+ ".json";
		Path reportPath = outputDirectory.resolve(filename);

		logger.debug("Creating output directory: {}", outputDirectory);
		Files.createDirectories(outputDirectory);

		logger.debug("Writing report to {}", reportPath);
		objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
		logger.info("Duplicate images report saved to: {}", reportPath);
		return reportPath;
	}

}
