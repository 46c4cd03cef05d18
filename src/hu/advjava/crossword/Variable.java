package hu.advjava.crossword;

import java.util.List;
import java.util.stream.IntStream;

/**
 * A slot of the crossword: where it starts, which way it runs and how many letters it holds.
 */
public record Variable(int row, int column, Direction direction, int length) {

	public static enum Direction {
		ACROSS, DOWN;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	public Variable {
		if (direction == null) throw new IllegalArgumentException("Direction is required");
		if (length <= 0) throw new IllegalArgumentException("Length must be positive: " + length);
	}

	/** The grid cells covered by this slot, as {row, column} pairs, in letter order. */
	public List<int[]> cells() {
		return IntStream.range(0, length)
				.mapToObj(k -> direction == Direction.DOWN
						? new int[]{row + k, column}
						: new int[]{row, column + k})
				.toList();
	}

	@Override
	public String toString() {
		return "(%d, %d) %s : %d".formatted(row, column, direction, length);
	}
}
