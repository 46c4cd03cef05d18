package hu.advjava.crossword;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import javax.imageio.ImageIO;

/**
 * Draws an assignment onto the crossword grid, as text or as a PNG image.
 */
public class CrosswordRenderer {
	public static final char BLOCK = '█';

	private static final int CELL_SIZE = 100;
	private static final int CELL_BORDER = 2;
	private static final int INTERIOR_SIZE = CELL_SIZE - 2 * CELL_BORDER;

	private final Crossword crossword;

	public CrosswordRenderer(Crossword crossword) {
		this.crossword = crossword;
	}

	/** Letters per cell; {@code null} where no assigned word covers the cell. */
	public Character[][] letterGrid(Map<Variable, String> assignment) {
		Character[][] letters = new Character[crossword.getHeight()][crossword.getWidth()];
		assignment.forEach((variable, word) -> {
			var cells = variable.cells();
			for (int k = 0; k < word.length() && k < cells.size(); k++) {
				int[] cell = cells.get(k);
				letters[cell[0]][cell[1]] = word.charAt(k);
			}
		});
		return letters;
	}

	public String render(Map<Variable, String> assignment) {
		Character[][] letters = letterGrid(assignment);
		return IntStream.range(0, crossword.getHeight())
				.mapToObj(i -> IntStream.range(0, crossword.getWidth())
						.mapToObj(j -> !crossword.isOpen(i, j) ? String.valueOf(BLOCK)
								: letters[i][j] == null ? " " : String.valueOf(letters[i][j]))
						.collect(Collectors.joining()))
				.collect(Collectors.joining("\n"));
	}

	public void print(Map<Variable, String> assignment, PrintStream out) {
		out.println(render(assignment));
	}

	/** Save the filled grid as a PNG image. */
	public void save(Map<Variable, String> assignment, File file) throws IOException {
		Character[][] letters = letterGrid(assignment);
		BufferedImage image = new BufferedImage(crossword.getWidth() * CELL_SIZE, crossword.getHeight() * CELL_SIZE,
				BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = image.createGraphics();
		try {
			g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
			g.setColor(Color.BLACK);
			g.fillRect(0, 0, image.getWidth(), image.getHeight());
			g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80));
			FontMetrics metrics = g.getFontMetrics();

			for (int i = 0; i < crossword.getHeight(); i++) {
				for (int j = 0; j < crossword.getWidth(); j++) {
					if (!crossword.isOpen(i, j)) continue;
					int x = j * CELL_SIZE + CELL_BORDER, y = i * CELL_SIZE + CELL_BORDER;
					g.setColor(Color.WHITE);
					g.fillRect(x, y, INTERIOR_SIZE, INTERIOR_SIZE);
					if (letters[i][j] != null) {
						String letter = String.valueOf(letters[i][j]);
						g.setColor(Color.BLACK);
						g.drawString(letter,
								x + (INTERIOR_SIZE - metrics.stringWidth(letter)) / 2,
								y + (INTERIOR_SIZE - metrics.getHeight()) / 2 + metrics.getAscent());
					}
				}
			}
		} finally {
			g.dispose();
		}
		if (!ImageIO.write(image, "png", file)) throw new IOException("No PNG writer available");
	}
}
