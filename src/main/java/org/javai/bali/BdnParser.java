package org.javai.bali;

import java.util.function.Function;
import org.javai.bali.config.BdnOptions;
import org.javai.bali.format.BdnFormatter;
import org.javai.bali.parse.BdnGrammarParser;
import org.javai.bali.parse.ParseNode;
import org.javai.bali.tree.BdnNode;
import org.javai.bali.tree.ParseTreeToAst;
import org.javai.bali.value.StaticValueExtractor;

/**
 * Entry point for reading and writing Bali Document Notation.
 * <p>
 * Each parse method tokenizes the source, parses it starting at the named rule and converts the
 * parse tree into an AST. Errors surface as {@link org.javai.bali.parse.BdnLexicalException} or
 * {@link org.javai.bali.parse.BdnSyntaxException}; nothing is returned when either is thrown.
 * A {@code BdnParser} holds no parse state and may be shared between threads.
 *
 * <pre>
 * BdnParser parser = new BdnParser();
 * BdnNode document = parser.parseDocument("[$name: \"Alice\", $age: 42]\n");
 * Object value = parser.toValue(document);
 * String source = parser.formatDocument(document);
 * </pre>
 */
public class BdnParser {

	private final BdnOptions options;
	private final BdnFormatter formatter;
	private final StaticValueExtractor extractor = new StaticValueExtractor();

	public BdnParser() {
		this(BdnOptions.defaults());
	}

	public BdnParser(BdnOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("Options cannot be null");
		}
		this.options = options;
		this.formatter = new BdnFormatter(options);
	}

	public BdnOptions options() {
		return options;
	}

	public BdnNode parseDocument(String source) {
		return parse(source, BdnGrammarParser::document);
	}

	public BdnNode parseTask(String source) {
		return parse(source, BdnGrammarParser::task);
	}

	public BdnNode parseComponent(String source) {
		return parse(source, BdnGrammarParser::component);
	}

	public BdnNode parseElement(String source) {
		return parse(source, BdnGrammarParser::element);
	}

	public BdnNode parseStructure(String source) {
		return parse(source, BdnGrammarParser::structure);
	}

	public BdnNode parseBlock(String source) {
		return parse(source, BdnGrammarParser::block);
	}

	public BdnNode parseParameters(String source) {
		return parse(source, BdnGrammarParser::parameters);
	}

	public BdnNode parseRange(String source) {
		return parse(source, BdnGrammarParser::range);
	}

	public BdnNode parseArray(String source) {
		return parse(source, BdnGrammarParser::array);
	}

	public BdnNode parseTable(String source) {
		return parse(source, BdnGrammarParser::table);
	}

	public BdnNode parseAssociation(String source) {
		return parse(source, BdnGrammarParser::association);
	}

	public BdnNode parseProcedure(String source) {
		return parse(source, BdnGrammarParser::procedure);
	}

	public BdnNode parseStatement(String source) {
		return parse(source, BdnGrammarParser::statement);
	}

	public BdnNode parseExpression(String source) {
		return parse(source, BdnGrammarParser::expression);
	}

	public String format(BdnNode node) {
		return formatter.format(node);
	}

	public String formatDocument(BdnNode node) {
		return formatter.formatDocument(node);
	}

	/**
	 * @throws org.javai.bali.value.BdnConversionException if the node holds code rather than data
	 */
	public Object toValue(BdnNode node) {
		return extractor.extract(node);
	}

	private BdnNode parse(String source, Function<BdnGrammarParser, ParseNode> rule) {
		if (source == null) {
			throw new IllegalArgumentException("Source cannot be null");
		}
		ParseNode tree = rule.apply(BdnGrammarParser.forSource(source, options));
		return new ParseTreeToAst(options).convert(tree);
	}
}
