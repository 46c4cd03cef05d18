package hu.advjava.crossword;

/** Work item of arc consistency: make {@code x} consistent with its neighbor {@code y}. */
public record Arc(Variable x, Variable y) {}
