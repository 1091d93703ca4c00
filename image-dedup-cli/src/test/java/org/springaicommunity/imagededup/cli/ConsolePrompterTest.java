package org.springaicommunity.imagededup.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springaicommunity.imagededup.DuplicateGroup;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Console Prompt Tests")
class ConsolePrompterTest {

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();

	private ConsolePrompter prompter(String input) {
		return new ConsolePrompter(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(output, true, StandardCharsets.UTF_8));
	}

	private String output() {
		return output.toString(StandardCharsets.UTF_8);
	}

	@Nested
	@DisplayName("Text Prompts")
	class TextPromptTest {

		@Test
		@DisplayName("Should return the trimmed answer")
		void shouldReturnTrimmedAnswer() {
			assertThat(prompter("  photos \n").promptText("Directory?", value -> null)).isEqualTo("photos");
		}

		@Test
		@DisplayName("Should return an empty string when the user just presses Enter")
		void shouldReturnEmptyAnswer() {
			assertThat(prompter("\n").promptText("Directory?", value -> "never valid")).isEmpty();
		}

		@Test
		@DisplayName("Should return null at end of input")
		void shouldReturnNullAtEof() {
			assertThat(prompter("").promptText("Directory?", value -> null)).isNull();
		}

		@Test
		@DisplayName("Should repeat the question until the answer is valid")
		void shouldRepeatUntilValid() {
			String answer = prompter("missing\nphotos\n").promptText("Directory?",
					value -> value.equals("photos") ? null : "Directory not found.");

			assertThat(answer).isEqualTo("photos");
			assertThat(output()).contains("Directory not found.");
		}

	}

	@Nested
	@DisplayName("Choice Prompts")
	class ChoicePromptTest {

		@Test
		@DisplayName("Should list numbered choices and return the selected index")
		void shouldReturnSelectedIndex() {
			Integer selected = prompter("3\n").promptChoice("Delete?", List.of("No", "Yes", "All"), 0);

			assertThat(selected).isEqualTo(2);
			assertThat(output()).contains("1) No", "2) Yes", "3) All", "Select 1-3 [1]:");
		}

		@Test
		@DisplayName("Should return the initial choice for an empty answer")
		void shouldReturnInitialChoice() {
			assertThat(prompter("\n").promptChoice("Delete?", List.of("No", "Yes"), 1)).isEqualTo(1);
		}

		@Test
		@DisplayName("Should reject answers outside the range")
		void shouldRejectInvalidAnswers() {
			Integer selected = prompter("0\nabc\n99999999999\n2\n").promptChoice("Delete?", List.of("No", "Yes"), 0);

			assertThat(selected).isEqualTo(1);
			assertThat(output()).contains("Please enter a number between 1 and 2.");
		}

		@Test
		@DisplayName("Should return null at end of input")
		void shouldReturnNullAtEof() {
			assertThat(prompter("7\n").promptChoice("Delete?", List.of("No", "Yes"), 0)).isNull();
		}

	}

	@Nested
	@DisplayName("Keep Selection")
	class KeepSelectionTest {

		private final DuplicateGroup group = new DuplicateGroup(List.of(Path.of("a.png"), Path.of("b.png")));

		@Test
		@DisplayName("Should keep the chosen member")
		void shouldKeepChosenMember() {
			Optional<Path> keep = new ConsoleKeepSelector(prompter("2\n")).chooseKeep(group);

			assertThat(keep).contains(Path.of("b.png"));
			assertThat(output()).contains("Keep a.png", "Keep b.png", "Keep all");
		}

		@Test
		@DisplayName("Should default to the first member")
		void shouldDefaultToFirstMember() {
			assertThat(new ConsoleKeepSelector(prompter("\n")).chooseKeep(group)).contains(Path.of("a.png"));
		}

		@Test
		@DisplayName("Should keep all for the last choice or no response")
		void shouldKeepAll() {
			assertThat(new ConsoleKeepSelector(prompter("3\n")).chooseKeep(group)).isEmpty();
			assertThat(new ConsoleKeepSelector(prompter("")).chooseKeep(group)).isEmpty();
		}

	}

}
