package org.springaicommunity.imagededup.cli;

import org.jspecify.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;

/**
 * Line-based console prompts. End of input is reported as "no response" ({@code null}),
 * which callers treat as cancellation.
 */
public class ConsolePrompter {

	private final BufferedReader in;

	private final PrintStream out;

	public ConsolePrompter(InputStream in, PrintStream out) {
		this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		this.out = out;
	}

	public static ConsolePrompter system() {
		return new ConsolePrompter(System.in, System.out);
	}

	/**
	 * Ask for free text, repeating the question while {@code validator} rejects a
	 * non-empty answer.
	 * @param message the question
	 * @param validator returns an error message for an invalid answer, or null
	 * @return the trimmed answer, an empty string if the user just pressed Enter, or null
	 * at end of input
	 */
	@Nullable
	public String promptText(String message, Function<String, @Nullable String> validator) {
		while (true) {
			out.print(message + " ");
			out.flush();
			String line = readLine();
			if (line == null) {
				return null;
			}
			String answer = line.trim();
			if (answer.isEmpty()) {
				return answer;
			}
			String error = validator.apply(answer);
			if (error == null) {
				return answer;
			}
			out.println(error);
		}
	}

	/**
	 * Ask the user to pick one of several choices by number.
	 * @param message the question
	 * @param choices the choice labels
	 * @param initial index chosen when the user just presses Enter
	 * @return the chosen index, or null at end of input
	 */
	@Nullable
	public Integer promptChoice(String message, List<String> choices, int initial) {
		out.println(message);
		for (int i = 0; i < choices.size(); i++) {
			out.println("  " + (i + 1) + ") " + choices.get(i));
		}
		while (true) {
			out.print("Select 1-" + choices.size() + " [" + (initial + 1) + "]: ");
			out.flush();
			String line = readLine();
			if (line == null) {
				return null;
			}
			String answer = line.trim();
			if (answer.isEmpty()) {
				return initial;
			}
			int selected = parseSelection(answer);
			if (selected >= 1 && selected <= choices.size()) {
				return selected - 1;
			}
			out.println("Please enter a number between 1 and " + choices.size() + ".");
		}
	}

	private static int parseSelection(String answer) {
		if (!answer.matches("\\d{1,9}")) {
			return -1;
		}
		return Integer.parseInt(answer);
	}

	@Nullable
	private String readLine() {
		try {
			return in.readLine();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read console input", e);
		}
	}

}
