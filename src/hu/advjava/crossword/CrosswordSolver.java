package hu.advjava.crossword;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fills a crossword as a constraint satisfaction problem: node consistency on word length,
 * AC-3 on the crossing letters, then backtracking search ordered by MRV, degree and LCV.
 */
public class CrosswordSolver {
	private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);

	public static enum State {
		UNSOLVED,
		SOLVED,
		/** A domain ran empty before search started. */
		INFEASIBLE,
		/** Search tried everything reachable from the starting assignment. */
		EXHAUSTED
	}

	private final PuzzleModel puzzle;
	private final List<Variable> variables;
	private final Domains domains;

	private State state = State.UNSOLVED;
	private long assignmentsTried;
	private long backtracks;

	/** Every variable starts with the puzzle's whole word list. */
	public CrosswordSolver(PuzzleModel puzzle) {
		this(puzzle, wholeWordList(puzzle));
	}

	private static Map<Variable, Collection<String>> wholeWordList(PuzzleModel puzzle) {
		Map<Variable, Collection<String>> words = new LinkedHashMap<>();
		puzzle.variables().forEach(v -> words.put(v, puzzle.words()));
		return words;
	}

	public CrosswordSolver(PuzzleModel puzzle, Map<Variable, ? extends Collection<String>> initialWords) {
		this.puzzle = puzzle;
		this.variables = List.copyOf(puzzle.variables());
		checkOverlaps();
		this.domains = new Domains(variables, initialWords);
	}

	private void checkOverlaps() {
		Set<Variable> known = new HashSet<>(variables);
		for (Variable x : variables) {
			for (Variable y : puzzle.neighbors(x)) {
				if (!known.contains(y))
					throw new MalformedOverlapException("Neighbor %s of %s is not a puzzle variable".formatted(y, x));
				Overlap overlap = puzzle.overlap(x, y).orElseThrow(() ->
						new MalformedOverlapException("Neighbors %s and %s have no overlap".formatted(x, y)));
				if (!overlap.fits(x, y))
					throw new MalformedOverlapException("Overlap %s out of range for %s and %s".formatted(overlap, x, y));
				Optional<Overlap> mirror = puzzle.overlap(y, x);
				if (!mirror.equals(Optional.of(overlap.reversed())))
					throw new MalformedOverlapException("Overlap %s of %s and %s is not mirrored, found %s"
							.formatted(overlap, x, y, mirror.map(Overlap::toString).orElse("none")));
			}
		}
	}

	/**
	 * Enforce node and arc consistency, then search.
	 * @return a complete assignment, or empty if the crossword cannot be filled
	 */
	public Optional<Map<Variable, String>> solve() {
		enforceNodeConsistency();
		if (domains.anyEmpty()) {
			log.info("A slot has no word of the right length");
			state = State.INFEASIBLE;
			return Optional.empty();
		}
		if (!ac3()) {
			log.info("Arc consistency emptied a domain, no solution");
			state = State.INFEASIBLE;
			return Optional.empty();
		}
		var result = backtrack(new LinkedHashMap<>());
		log.info("Search %s after %d tentative assignments and %d backtracks",
				state, assignmentsTried, backtracks);
		return result;
	}

	/* ===================== Consistency ===================== */

	/** Remove every word whose length differs from its slot's length. */
	public void enforceNodeConsistency() {
		variables.forEach(v -> domains.removeIf(v, word -> word.length() != v.length()));
	}

	/**
	 * Make {@code x} arc consistent with {@code y}: drop words of {@code x} with no matching word in {@code y}.
	 * @return true if the domain of {@code x} changed
	 */
	public boolean revise(Variable x, Variable y) {
		Overlap overlap = puzzle.overlap(x, y)
				.orElseThrow(() -> new IllegalArgumentException("%s and %s do not cross".formatted(x, y)));
		Set<String> yWords = domains.get(y);
		return domains.removeIf(x, xWord -> yWords.stream().noneMatch(yWord -> overlap.agrees(xWord, yWord)));
	}

	/** Every (variable, neighbor) pair, variables and neighbors in puzzle order. */
	public List<Arc> arcs() {
		return variables.stream()
				.flatMap(x -> puzzle.neighbors(x).stream().map(y -> new Arc(x, y)))
				.toList();
	}

	public boolean ac3() {
		return ac3(null);
	}

	/**
	 * AC-3 starting from {@code initialArcs}, or from all arcs when null or empty.
	 * @return false as soon as some domain becomes empty
	 */
	public boolean ac3(Collection<Arc> initialArcs) {
		Deque<Arc> queue = new ArrayDeque<>();
		Set<Arc> queued = new HashSet<>();
		for (Arc arc : initialArcs == null || initialArcs.isEmpty() ? arcs() : initialArcs) {
			if (queued.add(arc)) queue.add(arc);
		}

		while (!queue.isEmpty()) {
			Arc arc = queue.poll();
			queued.remove(arc);
			if (!revise(arc.x(), arc.y())) continue;
			if (domains.size(arc.x()) == 0) {
				log.debug("Domain of %s emptied against %s", arc.x(), arc.y());
				return false;
			}
			for (Variable z : puzzle.neighbors(arc.x())) {
				if (z.equals(arc.y())) continue;
				Arc back = new Arc(z, arc.x());
				if (queued.add(back)) queue.add(back);
			}
		}
		return true;
	}

	/* ===================== Assignment checks ===================== */

	public boolean assignmentComplete(Map<Variable, String> assignment) {
		return variables.stream().allMatch(assignment::containsKey);
	}

	/** Words are distinct, of the right length, and agree wherever two assigned slots cross. */
	public boolean consistent(Map<Variable, String> assignment) {
		if (new HashSet<>(assignment.values()).size() != assignment.size()) return false;
		if (!assignment.entrySet().stream().allMatch(e -> e.getValue().length() == e.getKey().length())) return false;

		return assignment.entrySet().stream().allMatch(x -> puzzle.neighbors(x.getKey()).stream()
				.filter(assignment::containsKey)
				.allMatch(y -> puzzle.overlap(x.getKey(), y).orElseThrow()
						.agrees(x.getValue(), assignment.get(y))));
	}

	/* ===================== Heuristics ===================== */

	/**
	 * Unassigned variable with the fewest remaining words, then the most neighbors,
	 * then the earliest in puzzle order.
	 */
	public Variable selectUnassignedVariable(Map<Variable, String> assignment) {
		return variables.stream()
				.filter(v -> !assignment.containsKey(v))
				.min(Comparator.<Variable>comparingInt(domains::size)
						.thenComparing(Comparator.<Variable>comparingInt(v -> puzzle.neighbors(v).size()).reversed()))
				.orElseThrow(() -> new IllegalStateException("Every variable is assigned"));
	}

	/**
	 * Words of {@code variable} ordered by how many words they rule out for unassigned neighbors,
	 * fewest first. Equal counts keep domain order.
	 */
	public List<String> orderDomainValues(Variable variable, Map<Variable, String> assignment) {
		List<Variable> open = puzzle.neighbors(variable).stream()
				.filter(n -> !assignment.containsKey(n))
				.toList();

		Map<String, Long> ruledOut = new HashMap<>();
		for (String word : domains.get(variable)) {
			long count = open.stream()
					.mapToLong(n -> {
						Overlap overlap = puzzle.overlap(variable, n).orElseThrow();
						return domains.get(n).stream().filter(other -> !overlap.agrees(word, other)).count();
					})
					.sum();
			ruledOut.put(word, count);
		}

		List<String> ordered = new ArrayList<>(domains.get(variable));
		ordered.sort(Comparator.comparingLong(ruledOut::get));
		return ordered;
	}

	/* ===================== Search ===================== */

	record Remaining(Variable variable, Iterator<String> words) {}

	/**
	 * Depth-first search from {@code partial}. The search works on its own copy, so the given map
	 * is never changed and may be immutable.
	 * @return the completed assignment, or empty if no extension of {@code partial} works
	 */
	public Optional<Map<Variable, String>> backtrack(Map<Variable, String> partial) {
		assignmentsTried = 0;
		backtracks = 0;
		Map<Variable, String> assignment = new LinkedHashMap<>(partial);
		if (assignmentComplete(assignment)) {
			state = State.SOLVED;
			return Optional.of(assignment);
		}

		Deque<Remaining> stack = new ArrayDeque<>();
		stack.push(nextFrame(assignment));
		state = findContent(() -> maybeExtend(assignment, stack));
		return state == State.SOLVED ? Optional.of(assignment) : Optional.empty();
	}

	// Calls the supplier until it decides something.
	private static <R> R findContent(Supplier<Optional<R>> step) {
		return Stream.generate(step).filter(Optional::isPresent).map(Optional::get).findFirst().orElseThrow();
	}

	private Remaining nextFrame(Map<Variable, String> assignment) {
		Variable variable = selectUnassignedVariable(assignment);
		return new Remaining(variable, orderDomainValues(variable, assignment).iterator());
	}

	/*
	 * One step of the search. The top frame's variable holds the word tried last (if any);
	 * take it back and try the next one. Out of words means this branch failed, so drop the
	 * frame and let the frame below move on.
	 */
	private Optional<State> maybeExtend(Map<Variable, String> assignment, Deque<Remaining> stack) {
		if (stack.isEmpty()) return Optional.of(State.EXHAUSTED);

		Remaining top = stack.peek();
		assignment.remove(top.variable());
		if (!top.words().hasNext()) {
			stack.pop();
			backtracks++;
			return Optional.empty();
		}

		assignment.put(top.variable(), top.words().next());
		assignmentsTried++;
		if (!consistent(assignment)) {
			assignment.remove(top.variable());
			return Optional.empty();
		}
		if (assignmentComplete(assignment)) return Optional.of(State.SOLVED);

		stack.push(nextFrame(assignment));
		return Optional.empty();
	}

	/* ===================== Accessors ===================== */

	public Domains getDomains() {
		return domains;
	}

	public PuzzleModel getPuzzle() {
		return puzzle;
	}

	/** How the last solve or search ended. */
	public State getState() {
		return state;
	}

	public long getAssignmentsTried() {
		return assignmentsTried;
	}

	public long getBacktracks() {
		return backtracks;
	}

}
