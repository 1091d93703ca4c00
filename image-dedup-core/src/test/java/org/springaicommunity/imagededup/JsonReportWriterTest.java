package org.springaicommunity.imagededup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonReportWriter Tests")
class JsonReportWriterTest {

	private static final Instant TIMESTAMP = Instant.parse("2024-03-05T10:15:30Z");

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private Path reportDir;

	private JsonReportWriter writer;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		reportDir = tempDir.resolve("bin").resolve("cleanup-files").resolve("duplicate-images");
		writer = new JsonReportWriter(objectMapper, reportDir, ZoneOffset.UTC);
	}

	@Test
	@DisplayName("Should name the report after the local completion time")
	void shouldNameReportAfterTimestamp() throws IOException {
		Path reportPath = writer.write(RunReport.empty(TIMESTAMP));

		assertThat(reportPath.getFileName().toString()).isEqualTo("duplicate-images-report-20240305-101530.json");
		assertThat(reportPath.getParent()).isEqualTo(reportDir);
		assertThat(reportPath).exists();
	}

	@Test
	@DisplayName("Should use the configured zone for the file name")
	void shouldUseConfiguredZone() throws IOException {
		JsonReportWriter tokyoWriter = new JsonReportWriter(objectMapper, reportDir, ZoneOffset.ofHours(9));

		Path reportPath = tokyoWriter.write(RunReport.empty(TIMESTAMP));

		assertThat(reportPath.getFileName().toString()).isEqualTo("duplicate-images-report-20240305-191530.json");
	}

	@Test
	@DisplayName("Should write empty arrays and an ISO timestamp for an empty run")
	void shouldWriteEmptyReport() throws IOException {
		Path reportPath = writer.write(RunReport.empty(TIMESTAMP));

		JsonNode json = objectMapper.readTree(reportPath.toFile());
		assertThat(json.get("duplicateGroups").isArray()).isTrue();
		assertThat(json.get("duplicateGroups")).isEmpty();
		assertThat(json.get("deletedFiles")).isEmpty();
		assertThat(json.get("failedDeletions")).isEmpty();
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-05T10:15:30Z");
	}

	@Test
	@DisplayName("Should write groups, deletions and failures")
	void shouldWriteGroupsAndDeletions() throws IOException {
		Path a = Path.of("photos", "a.png");
		Path b = Path.of("photos", "b.png");
		Path c = Path.of("photos", "c.png");
		DuplicateGroup group = new DuplicateGroup(List.of(a, b, c));
		ResolutionOutcome outcome = new ResolutionOutcome(group, a, List.of(DeletionResult.success(b),
				DeletionResult.failure(c, DeletionResult.FailureReason.ACCESS_DENIED, "Permission denied")));

		Path reportPath = writer.write(RunReport.of(List.of(group), List.of(outcome), TIMESTAMP));

		JsonNode json = objectMapper.readTree(reportPath.toFile());
		assertThat(json.get("duplicateGroups")).hasSize(1);
		assertThat(json.get("duplicateGroups").get(0)).extracting(JsonNode::asText)
			.containsExactly(a.toString(), b.toString(), c.toString());
		assertThat(json.get("deletedFiles")).extracting(JsonNode::asText).containsExactly(b.toString());
		JsonNode failure = json.get("failedDeletions").get(0);
		assertThat(failure.get("path").asText()).isEqualTo(c.toString());
		assertThat(failure.get("reason").asText()).isEqualTo("ACCESS_DENIED");
		assertThat(failure.get("message").asText()).isEqualTo("Permission denied");
	}

	@Test
	@DisplayName("Should tolerate an existing report directory")
	void shouldTolerateExistingDirectory() throws IOException {
		Files.createDirectories(reportDir);

		writer.write(RunReport.empty(TIMESTAMP));
		Path second = writer.write(RunReport.empty(TIMESTAMP.plusSeconds(1)));

		assertThat(second).exists();
		try (var files = Files.list(reportDir)) {
			assertThat(files).hasSize(2);
		}
	}

	@Test
	@DisplayName("Should fail when the report directory cannot be created")
	void shouldFailWhenDirectoryIsAFile() throws IOException {
		Path blocker = Files.write(tempDir.resolve("blocker"), new byte[] { 1 });
		JsonReportWriter blocked = new JsonReportWriter(objectMapper, blocker.resolve("reports"), ZoneOffset.UTC);

		assertThatThrownBy(() -> blocked.write(RunReport.empty(TIMESTAMP))).isInstanceOf(IOException.class);
	}

}
