package hu.advjava.crossword;

/**
 * Thrown when a puzzle model reports an overlap that cannot hold for the slots involved,
 * for example one pointing past the end of a word.
 */
public class MalformedOverlapException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public MalformedOverlapException(String message) {
		super(message);
	}
}
