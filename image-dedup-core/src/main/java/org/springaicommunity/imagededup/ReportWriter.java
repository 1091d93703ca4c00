package org.springaicommunity.imagededup;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists the {@link RunReport} of a run.
 */
public interface ReportWriter {

	/**
	 * Write a report. Failures are fatal to the run.
	 * @param report the report to persist
	 * @return where the report was written
	 * @throws IOException if the report cannot be written
	 */
	Path write(RunReport report) throws IOException;

}
