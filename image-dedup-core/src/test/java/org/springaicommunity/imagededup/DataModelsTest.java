package org.springaicommunity.imagededup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Data Models Tests")
class DataModelsTest {

	private static final Path A = Path.of("a.png");

	private static final Path B = Path.of("b.png");

	private static final Path C = Path.of("c.png");

	@Nested
	@DisplayName("DuplicateGroup")
	class DuplicateGroupTest {

		@Test
		@DisplayName("Should reject groups with fewer than two members")
		void shouldRejectSingletons() {
			assertThatThrownBy(() -> new DuplicateGroup(List.of(A))).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new DuplicateGroup(List.of())).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should copy members and expose the anchor")
		void shouldCopyMembers() {
			List<Path> members = new ArrayList<>(List.of(A, B));
			DuplicateGroup group = new DuplicateGroup(members);
			members.add(C);

			assertThat(group.members()).containsExactly(A, B);
			assertThat(group.first()).isEqualTo(A);
			assertThat(group.size()).isEqualTo(2);
			assertThat(group.contains(B)).isTrue();
			assertThat(group.contains(C)).isFalse();
		}

	}

	@Nested
	@DisplayName("Candidate")
	class CandidateTest {

		@Test
		@DisplayName("Should compare content by value")
		void shouldCompareContentByValue() {
			Candidate first = new Candidate(A, new byte[] { 1, 2, 3 });
			Candidate same = new Candidate(A, new byte[] { 1, 2, 3 });

			assertThat(first).isEqualTo(same).hasSameHashCodeAs(same);
			assertThat(first).isNotEqualTo(new Candidate(A, new byte[] { 1, 2, 4 }));
			assertThat(first).isNotEqualTo(new Candidate(B, new byte[] { 1, 2, 3 }));
			assertThat(first).hasToString("Candidate{a.png, 3 bytes}");
		}

	}

	@Nested
	@DisplayName("RetentionPolicy")
	class RetentionPolicyTest {

		@Test
		@DisplayName("Should expose short and long names")
		void shouldExposeNames() {
			assertThat(RetentionPolicy.LIST_ONLY.shortName()).isEqualTo("no");
			assertThat(RetentionPolicy.INTERACTIVE.longName()).isEqualTo("interactive");
			assertThat(RetentionPolicy.acceptedValues()).contains("all", "auto-keep-first");
		}

		@ParameterizedTest
		@ValueSource(strings = { "", "delete", "keep-first" })
		@DisplayName("Should reject unknown values")
		void shouldRejectUnknownValues(String value) {
			assertThatThrownBy(() -> RetentionPolicy.fromValue(value)).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be one of");
		}

	}

	@Nested
	@DisplayName("RunReport")
	class RunReportTest {

		@Test
		@DisplayName("Should list every group and only successful deletions")
		void shouldCollectGroupsAndDeletions() {
			DuplicateGroup first = new DuplicateGroup(List.of(A, B));
			DuplicateGroup second = new DuplicateGroup(List.of(C, Path.of("d.png")));
			ResolutionOutcome deleted = new ResolutionOutcome(first, A, List.of(DeletionResult.success(B)));
			ResolutionOutcome failed = new ResolutionOutcome(second, C, List.of(DeletionResult
				.failure(Path.of("d.png"), DeletionResult.FailureReason.NOT_FOUND, "File not found")));
			Instant now = Instant.parse("2024-01-01T00:00:00Z");

			RunReport report = RunReport.of(List.of(first, second), List.of(deleted, failed), now);

			assertThat(report.duplicateGroups()).containsExactly(List.of("a.png", "b.png"), List.of("c.png", "d.png"));
			assertThat(report.deletedFiles()).containsExactly("b.png");
			assertThat(report.failedDeletions())
				.containsExactly(new RunReport.FailedDeletion("d.png", "NOT_FOUND", "File not found"));
			assertThat(report.timestamp()).isEqualTo(now);
		}

		@Test
		@DisplayName("Should list groups without deletions for list-only runs")
		void shouldListGroupsWithoutOutcomes() {
			RunReport report = RunReport.of(List.of(new DuplicateGroup(List.of(A, B))), List.of(), Instant.EPOCH);

			assertThat(report.duplicateGroups()).hasSize(1);
			assertThat(report.deletedFiles()).isEmpty();
			assertThat(report.failedDeletions()).isEmpty();
		}

	}

	@Nested
	@DisplayName("ResolutionOutcome")
	class ResolutionOutcomeTest {

		@Test
		@DisplayName("Should split deletions into successes and failures")
		void shouldSplitDeletions() {
			DuplicateGroup group = new DuplicateGroup(List.of(A, B, C));
			DeletionResult failure = DeletionResult.failure(C, DeletionResult.FailureReason.IO_ERROR, "busy");

			ResolutionOutcome outcome = new ResolutionOutcome(group, A, List.of(DeletionResult.success(B), failure));

			assertThat(outcome.deletedPaths()).containsExactly(B);
			assertThat(outcome.failures()).containsExactly(failure);
		}

		@Test
		@DisplayName("Should keep everything for keep-all")
		void shouldKeepAll() {
			ResolutionOutcome outcome = ResolutionOutcome.keepAll(new DuplicateGroup(List.of(A, B)));

			assertThat(outcome.keep()).isNull();
			assertThat(outcome.deletedPaths()).isEmpty();
		}

	}

	@Nested
	@DisplayName("NormalizedImage")
	class NormalizedImageTest {

		@Test
		@DisplayName("Should reject a buffer that does not match its dimensions")
		void shouldRejectMismatchedBuffer() {
			assertThatThrownBy(() -> new NormalizedImage(2, 2, 4, new byte[15]))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should hash equal pixels equally")
		void shouldHashPixels() {
			assertThat(TestImages.gray(10).contentHash()).isEqualTo(TestImages.gray(10).contentHash())
				.isNotEqualTo(TestImages.gray(11).contentHash())
				.hasSize(64);
		}

	}

}
