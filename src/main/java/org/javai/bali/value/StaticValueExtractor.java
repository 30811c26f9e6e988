package org.javai.bali.value;

import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.BdnNodeVisitor;
import org.javai.bali.tree.NodeType;
import org.javai.bali.tree.Terminal;
import org.javai.bali.tree.Tree;

/**
 * Turns literal AST content into plain Java values.
 * <p>
 * Elements, structures and blocks convert; a block becomes {@link Code} without being evaluated.
 * Any expression, statement or clause node raises a {@link BdnConversionException}, including
 * one nested inside a structure.
 *
 * <table>
 * <caption>Element mapping</caption>
 * <tr><th>Node</th><th>Value</th></tr>
 * <tr><td>NUMBER</td><td>{@link Long} ({@link BigInteger} beyond its range), {@link Double} or {@link Complex}</td></tr>
 * <tr><td>TEXT</td><td>{@link String}</td></tr>
 * <tr><td>REFERENCE</td><td>{@link URI}</td></tr>
 * <tr><td>ARRAY / TABLE</td><td>unmodifiable {@link List} / insertion-ordered {@link Map}</td></tr>
 * </table>
 */
public class StaticValueExtractor implements BdnNodeVisitor<Object> {

	/**
	 * Converts the node, or throws {@link BdnConversionException} when it is not literal data.
	 */
	public Object extract(BdnNode node) {
		return node.accept(this);
	}

	@Override
	public Object visitTerminal(Terminal terminal) {
		String value = terminal.value();
		return switch (terminal.type()) {
			case NUMBER -> number(value);
			case PERCENT -> new Percent(real(value.substring(0, value.length() - 1)).doubleValue());
			case PROBABILITY -> Probability.parse(value);
			case TEXT -> text(value);
			case SYMBOL -> Symbol.parse(value);
			case TAG -> Tag.parse(value);
			case VERSION -> Version.parse(value);
			case REFERENCE -> URI.create(value.substring(1, value.length() - 1));
			case MOMENT -> Moment.parse(value);
			case DURATION -> Duration.parse(value);
			case BINARY -> Binary.parse(value);
			case TEMPLATE -> Template.parse(value);
			default -> throw new BdnConversionException(terminal.type());
		};
	}

	@Override
	public Object visitTree(Tree tree) {
		return switch (tree.type()) {
			case COMPONENT -> new Parameterized(extract(tree.child(0)), extract(tree.child(1)));
			case STRUCTURE -> parameterized(tree, extract(tree.child(0)));
			case BLOCK -> parameterized(tree, new Code((Tree) tree.child(0)));
			case PARAMETERS -> extract(tree.child(0));
			case RANGE -> new Range(extract(tree.child(0)), extract(tree.child(1)));
			case ARRAY -> {
				List<Object> items = new ArrayList<>();
				for (BdnNode item : tree.children()) {
					items.add(extract(item));
				}
				yield Collections.unmodifiableList(items);
			}
			case TABLE -> {
				Map<Object, Object> associations = new LinkedHashMap<>();
				for (BdnNode association : tree.children()) {
					Tree pair = (Tree) association;
					associations.put(extract(pair.child(0)), extract(pair.child(1)));
				}
				yield Collections.unmodifiableMap(associations);
			}
			default -> throw new BdnConversionException(tree.type());
		};
	}

	private Object parameterized(Tree tree, Object value) {
		if (tree.children().size() == 1) {
			return value;
		}
		return new Parameterized(value, extract(tree.child(1)));
	}

	// numbers

	private static Object number(String value) {
		if (value.equals("undefined")) {
			return Double.NaN;
		}
		if (value.equals("infinity")) {
			return Double.POSITIVE_INFINITY;
		}
		if (value.startsWith("(")) {
			return complex(value.substring(1, value.length() - 1));
		}
		if (value.endsWith("i")) {
			return Complex.imaginary(imaginary(value));
		}
		return real(value);
	}

	/**
	 * {@code r, bi} or {@code r e^bi}
	 */
	private static Complex complex(String body) {
		int comma = body.indexOf(", ");
		if (comma >= 0) {
			return new Complex(real(body.substring(0, comma)).doubleValue(), imaginary(body.substring(comma + 2)));
		}
		int polar = body.indexOf(" e^");
		return Complex.polar(real(body.substring(0, polar)).doubleValue(), imaginary(body.substring(polar + 3)));
	}

	private static double imaginary(String value) {
		String coefficient = value.substring(0, value.length() - 1).trim();
		if (coefficient.isEmpty()) {
			return 1;
		}
		if (coefficient.equals("-")) {
			return -1;
		}
		return real(coefficient).doubleValue();
	}

	private static Number real(String value) {
		boolean negative = value.startsWith("-");
		String magnitude = negative ? value.substring(1) : value;
		double constant;
		switch (magnitude) {
			case "e" -> constant = Math.E;
			case "pi" -> constant = Math.PI;
			case "phi" -> constant = (1 + Math.sqrt(5)) / 2;
			default -> {
				if (value.matches("-?[0-9]+")) {
					return integer(value);
				}
				return Double.parseDouble(value);
			}
		}
		return negative ? -constant : constant;
	}

	/**
	 * A {@link Long}, or a {@link BigInteger} when the value does not fit.
	 */
	private static Number integer(String value) {
		BigInteger integer = new BigInteger(value);
		return integer.bitLength() < Long.SIZE ? (Number) integer.longValue() : integer;
	}

	// text

	private static String text(String value) {
		String body = value.substring(1, value.length() - 1);
		if (body.startsWith("\n") || body.startsWith("\r\n")) {
			int start = body.indexOf('\n') + 1;
			int end = body.lastIndexOf('\n');
			if (end > 0 && body.charAt(end - 1) == '\r') {
				end--;
			}
			return end >= start ? body.substring(start, end) : "";
		}
		return unescape(body);
	}

	private static String unescape(String body) {
		if (body.indexOf('\\') < 0) {
			return body;
		}
		StringBuilder result = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c != '\\' || i + 1 == body.length()) {
				result.append(c);
				continue;
			}
			char escaped = body.charAt(++i);
			switch (escaped) {
				case 'n' -> result.append('\n');
				case 't' -> result.append('\t');
				case 'r' -> result.append('\r');
				case '"', '\\' -> result.append(escaped);
				default -> result.append('\\').append(escaped);
			}
		}
		return result.toString();
	}
}
