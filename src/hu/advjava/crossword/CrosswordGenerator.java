package hu.advjava.crossword;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class CrosswordGenerator {
	private static final Logger log = LogManager.getFormatterLogger(CrosswordGenerator.class);

	static final int USAGE = 1;
	static final int UNREADABLE = 2;

	// Example usage: CrosswordGenerator data/structure1.txt data/words1.txt out.png
	public static void main(String[] args) {
		int status = run(args, System.out, System.err);
		if (status != 0) System.exit(status);
	}

	/** @return the process exit status */
	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length < 2 || args.length > 3) {
			err.println("Usage: CrosswordGenerator structure words [output]");
			return USAGE;
		}
		File output = args.length == 3 ? new File(args[2]) : null;
		try {
			generate(new File(args[0]), new File(args[1]), output, out);
			return 0;
		} catch (IOException e) {
			log.error("Cannot generate crossword: %s", e.getMessage());
			return UNREADABLE;
		}
	}

	/**
	 * Solve the crossword, print the grid (or "No solution.") and save the image if {@code output} is given.
	 * @return true if the crossword was filled
	 */
	static boolean generate(File structure, File words, File output, PrintStream out) throws IOException {
		var crossword = Crossword.load(structure, words);
		var renderer = new CrosswordRenderer(crossword);
		var assignment = new CrosswordSolver(crossword).solve();

		if (assignment.isEmpty()) {
			out.println("No solution.");
			return false;
		}
		renderer.print(assignment.get(), out);
		if (output != null) {
			renderer.save(assignment.get(), output);
			log.info("Saved crossword image to %s", output);
		}
		return true;
	}
}
