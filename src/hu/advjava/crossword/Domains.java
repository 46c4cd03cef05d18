package hu.advjava.crossword;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Candidate words of every variable. Words keep the order they were seeded in,
 * and are only ever removed.
 */
public final class Domains {
	private final Map<Variable, Set<String>> candidates = new LinkedHashMap<>();

	Domains(Collection<Variable> variables, Map<Variable, ? extends Collection<String>> initial) {
		for (Variable variable : variables) {
			Collection<String> words = initial.get(variable);
			if (words == null) throw new IllegalArgumentException("No initial words for " + variable);
			candidates.put(variable, new LinkedHashSet<>(words));
		}
	}

	/** Read-only view of the words still possible for {@code variable}. */
	public Set<String> get(Variable variable) {
		Set<String> words = candidates.get(variable);
		if (words == null) throw new IllegalArgumentException("Unknown variable " + variable);
		return Collections.unmodifiableSet(words);
	}

	public int size(Variable variable) {
		return get(variable).size();
	}

	public Set<Variable> variables() {
		return Collections.unmodifiableSet(candidates.keySet());
	}

	public boolean anyEmpty() {
		return candidates.values().stream().anyMatch(Set::isEmpty);
	}

	/** Drop every word of {@code variable} matching {@code filter}; true if anything was dropped. */
	boolean removeIf(Variable variable, Predicate<String> filter) {
		return candidates.get(variable).removeIf(filter);
	}

	/** Copy of the current state, for diagnostics and comparison. */
	public Map<Variable, Set<String>> snapshot() {
		Map<Variable, Set<String>> copy = new LinkedHashMap<>();
		candidates.forEach((variable, words) -> copy.put(variable, Set.copyOf(words)));
		return copy;
	}

	@Override
	public String toString() {
		return candidates.toString();
	}
}
