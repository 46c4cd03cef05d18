package hu.advjava.crossword;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Puzzles bundled on the classpath under {@code /examples}.
 */
public enum ExampleCrossword {
	NUMBERS("numbers", String.join("\n",
			"█SIX█",
			"█E██F",
			"█V██I",
			"█E██V",
			"█NINE")),
	SQUARE("square", null);

	private final String resourceName;
	private final String solution;

	private ExampleCrossword(String resourceName, String solution) {
		this.resourceName = resourceName;
		this.solution = solution;
	}

	/** Match {@code name} against every example's name mapped through {@code naming}. */
	public static final BiFunction<String, Function<String, String>, Optional<ExampleCrossword>> findByName =
			(name, naming) -> Arrays.stream(values())
					.filter(e -> naming.apply(e.name()).equalsIgnoreCase(name))
					.findFirst();

	public String getStructure() {
		return readResource("/examples/%s-structure.txt".formatted(resourceName));
	}

	public String getWords() {
		return readResource("/examples/%s-words.txt".formatted(resourceName));
	}

	public Crossword getCrossword() {
		return Crossword.parse(getStructure(), getWords());
	}

	/** The rendered grid of the only solution, if the puzzle has exactly one. */
	public Optional<String> getSolution() {
		return Optional.ofNullable(solution);
	}

	private static String readResource(String path) {
		try (InputStream in = ExampleCrossword.class.getResourceAsStream(path)) {
			if (in == null) throw new IllegalStateException("Missing resource " + path);
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read " + path, e);
		}
	}
}
