package hu.advjava.crossword;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * What the solver needs to know about a puzzle.
 * Iteration order of {@link #variables()}, {@link #neighbors(Variable)} and {@link #words()}
 * is the order used to break ties, so implementations should return ordered collections.
 */
public interface PuzzleModel {

	Set<Variable> variables();

	/** Variables sharing a cell with {@code variable}. */
	Set<Variable> neighbors(Variable variable);

	/** Where {@code x} and {@code y} cross, or empty if they don't. */
	Optional<Overlap> overlap(Variable x, Variable y);

	/** The candidate words every slot starts with. */
	Collection<String> words();
}
