package hu.advjava.crossword;

/**
 * The i-th letter of the first variable's word must equal the j-th letter of the second variable's word.
 */
public record Overlap(int i, int j) {

	public Overlap reversed() {
		return new Overlap(j, i);
	}

	boolean fits(Variable x, Variable y) {
		return i >= 0 && j >= 0 && i < x.length() && j < y.length();
	}

	boolean agrees(String xWord, String yWord) {
		return i < xWord.length() && j < yWord.length() && xWord.charAt(i) == yWord.charAt(j);
	}
}
