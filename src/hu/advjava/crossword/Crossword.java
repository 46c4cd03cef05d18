package hu.advjava.crossword;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import hu.advjava.crossword.Variable.Direction;

/**
 * Crossword puzzle built from a structure (one line per row, {@code _} for an open cell,
 * anything else blocked) and a word list (one word per line).
 */
public final class Crossword implements PuzzleModel {
	private static final Logger log = LogManager.getFormatterLogger(Crossword.class);

	public static final char OPEN_CELL = '_';

	private final int height;
	private final int width;
	private final boolean[][] structure;
	private final Set<String> words;
	private final Set<Variable> variables;
	private final Map<Variable, Map<Variable, Overlap>> overlaps;

	public Crossword(List<String> structureLines, Collection<String> wordList) {
		List<String> rows = withoutTrailingBlanks(structureLines);
		if (rows.isEmpty()) throw new IllegalArgumentException("Crossword structure has no rows");

		this.height = rows.size();
		this.width = rows.stream().mapToInt(String::length).max().orElse(0);
		this.structure = new boolean[height][width];
		for (int i = 0; i < height; i++) {
			String line = rows.get(i);
			for (int j = 0; j < line.length(); j++) structure[i][j] = line.charAt(j) == OPEN_CELL;
		}

		this.words = wordList.stream()
				.map(String::trim)
				.filter(w -> !w.isEmpty())
				.map(w -> w.toUpperCase(Locale.ROOT))
				.collect(Collectors.toCollection(LinkedHashSet::new));

		this.variables = Collections.unmodifiableSet(findVariables());
		this.overlaps = findOverlaps();
		log.debug("Parsed %dx%d crossword with %d slots and %d words", height, width, variables.size(), words.size());
	}

	/** Parse a structure and a word list given as text. */
	public static Crossword parse(String structure, String wordList) {
		return new Crossword(structure.lines().toList(), wordList.lines().toList());
	}

	/**
	 * Load a crossword from a structure file and a word list file.
	 * Both files are read as UTF-8; an empty file is rejected.
	 */
	public static Crossword load(File structureFile, File wordsFile) throws IOException {
		List<String> structureLines = readLines(structureFile);
		if (structureLines.stream().allMatch(String::isBlank))
			throw new IOException("Structure file is empty: " + structureFile);
		List<String> wordLines = readLines(wordsFile);
		if (wordLines.stream().allMatch(String::isBlank))
			throw new IOException("Word list is empty: " + wordsFile);
		return new Crossword(structureLines, wordLines);
	}

	private static List<String> readLines(File file) throws IOException {
		List<String> lines = new ArrayList<>();
		try (Scanner scanner = new Scanner(file, StandardCharsets.UTF_8)) {
			while (scanner.hasNextLine()) lines.add(scanner.nextLine());
			if (scanner.ioException() != null) throw scanner.ioException();
		}
		return lines;
	}

	private static List<String> withoutTrailingBlanks(List<String> lines) {
		int end = lines.size();
		while (end > 0 && lines.get(end - 1).isBlank()) end--;
		return lines.subList(0, end);
	}

	// A slot starts at an open cell whose predecessor is blocked or off the grid,
	// and must span at least two cells. Down is checked before across for every cell.
	private Set<Variable> findVariables() {
		Set<Variable> found = new LinkedHashSet<>();
		for (int i = 0; i < height; i++) {
			for (int j = 0; j < width; j++) {
				if (!structure[i][j]) continue;
				if (i == 0 || !structure[i - 1][j]) {
					int length = runLength(i, j, Direction.DOWN);
					if (length > 1) found.add(new Variable(i, j, Direction.DOWN, length));
				}
				if (j == 0 || !structure[i][j - 1]) {
					int length = runLength(i, j, Direction.ACROSS);
					if (length > 1) found.add(new Variable(i, j, Direction.ACROSS, length));
				}
			}
		}
		return found;
	}

	private int runLength(int i, int j, Direction direction) {
		int length = 0;
		while (i < height && j < width && structure[i][j]) {
			length++;
			if (direction == Direction.DOWN) i++; else j++;
		}
		return length;
	}

	private Map<Variable, Map<Variable, Overlap>> findOverlaps() {
		Map<Variable, Map<Variable, Overlap>> result = new LinkedHashMap<>();
		for (Variable x : variables) {
			Map<Variable, Overlap> crossing = new LinkedHashMap<>();
			List<int[]> xCells = x.cells();
			for (Variable y : variables) {
				if (x.equals(y)) continue;
				List<int[]> yCells = y.cells();
				IntStream.range(0, xCells.size()).boxed()
						.flatMap(a -> IntStream.range(0, yCells.size())
								.filter(b -> Arrays.equals(xCells.get(a), yCells.get(b)))
								.mapToObj(b -> new Overlap(a, b)))
						.findFirst()
						.ifPresent(overlap -> crossing.put(y, overlap));
			}
			result.put(x, Collections.unmodifiableMap(crossing));
		}
		return result;
	}

	@Override
	public Set<Variable> variables() {
		return variables;
	}

	@Override
	public Set<Variable> neighbors(Variable variable) {
		return Collections.unmodifiableSet(overlaps.getOrDefault(variable, Map.of()).keySet());
	}

	@Override
	public Optional<Overlap> overlap(Variable x, Variable y) {
		return Optional.ofNullable(overlaps.getOrDefault(x, Map.of()).get(y));
	}

	@Override
	public Collection<String> words() {
		return Collections.unmodifiableSet(words);
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	public boolean isOpen(int row, int column) {
		return structure[row][column];
	}
}
