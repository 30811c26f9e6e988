package org.javai.bali.parse;

import org.apache.commons.lang3.StringUtils;

/**
 * Renders the lines surrounding an error position, with a caret marker under the offending text.
 */
public final class SourceExcerpt {

	private SourceExcerpt() {
	}

	/**
	 * @param source the complete source text
	 * @param line the 1-based line of the error
	 * @param column the 1-based column of the error
	 * @param length the number of characters to mark (at least one caret is always drawn)
	 * @return the previous line, the offending line, a marker line and the next line
	 */
	public static String render(String source, int line, int column, int length) {
		String[] lines = source.split("\r?\n", -1);
		int index = Math.min(Math.max(line - 1, 0), lines.length - 1);
		StringBuilder excerpt = new StringBuilder();
		if (index > 0) {
			excerpt.append(lines[index - 1]).append('\n');
		}
		String offending = lines[index];
		excerpt.append(offending).append('\n');
		int start = Math.max(column - 1, 0);
		int width = Math.max(1, Math.min(length, offending.length() - start));
		excerpt.append(StringUtils.repeat(' ', start)).append(StringUtils.repeat('^', width));
		if (index + 1 < lines.length) {
			excerpt.append('\n').append(lines[index + 1]);
		}
		return excerpt.toString();
	}
}
