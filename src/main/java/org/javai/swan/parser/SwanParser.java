package org.javai.swan.parser;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.swan.ast.AppDecl;
import org.javai.swan.ast.BinaryExpr;
import org.javai.swan.ast.BinaryOperator;
import org.javai.swan.ast.BooleanLiteral;
import org.javai.swan.ast.ButtonStmt;
import org.javai.swan.ast.ChartPoint;
import org.javai.swan.ast.ChartSeries;
import org.javai.swan.ast.ChartStmt;
import org.javai.swan.ast.ChartType;
import org.javai.swan.ast.ClickStmt;
import org.javai.swan.ast.ComponentDecl;
import org.javai.swan.ast.ConditionalStmt;
import org.javai.swan.ast.Expression;
import org.javai.swan.ast.FieldStmt;
import org.javai.swan.ast.HandlerStmt;
import org.javai.swan.ast.HeaderStmt;
import org.javai.swan.ast.IdentifierExpr;
import org.javai.swan.ast.InputStmt;
import org.javai.swan.ast.LinkStmt;
import org.javai.swan.ast.Literal;
import org.javai.swan.ast.MemberExpr;
import org.javai.swan.ast.NavTarget;
import org.javai.swan.ast.NumberLiteral;
import org.javai.swan.ast.OutcomeClause;
import org.javai.swan.ast.PageDecl;
import org.javai.swan.ast.Program;
import org.javai.swan.ast.QueryArg;
import org.javai.swan.ast.QueryStmt;
import org.javai.swan.ast.QueryType;
import org.javai.swan.ast.Statement;
import org.javai.swan.ast.StringLiteral;
import org.javai.swan.ast.SubmitStmt;
import org.javai.swan.ast.TableRow;
import org.javai.swan.ast.TableStmt;
import org.javai.swan.ast.TextStmt;
import org.javai.swan.ast.UnaryExpr;
import org.javai.swan.ast.UnaryOperator;
import org.javai.swan.ast.UseStmt;
import org.javai.swan.error.SwanSyntaxException;
import org.javai.swan.lexer.SwanToken;
import org.javai.swan.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for SWAN.
 *
 * <pre>
 * Program    := AppDecl (PageDecl | ComponentDecl)*
 * AppDecl    := "app" IDENT "{" "entry" IDENT "}"
 * PageDecl   := "page" IDENT Block
 * CompDecl   := "component" IDENT Block
 * Block      := "{" Statement* "}"
 * Button     := "button" STRING NavTarget?
 * Link       := "link" STRING NavTarget
 * NavTarget  := "->" IDENT ("?" QueryArg ("&amp;" QueryArg)*)?
 * QueryArg   := IDENT "=" Expr
 * Query      := "query" IDENT (":" ("string"|"number"|"boolean"))? ("=" Literal)?
 * Table      := "table" IDENT "{" "columns" "[" STRING ("," STRING)* "]" Row* "}"
 * Row        := "row" "[" Expr ("," Expr)* "]" Block?
 * Chart      := "chart" IDENT ChartType "{" Series+ "}"
 * Series     := "series" STRING "{" Point+ "}"
 * Point      := "point" Expr "," Expr
 * Handler    := "on" IDENT "{" (IDENT "-&gt;" IDENT)* "}"
 * Conditional:= "if" Expr Block
 * </pre>
 *
 * Expressions use precedence climbing, loosest first: {@code ||}, {@code &&},
 * comparison (non-associative), {@code +} (left-associative), unary {@code !}, primary.
 *
 * <p>Parsing stops at the first grammar violation; there is no recovery and no partial
 * program. Cardinality rules on tables and charts (at least one column, row, series or
 * point) are left to the semantic checker so that they are reported with rule codes.
 */
public class SwanParser {

	private static final Logger logger = LoggerFactory.getLogger(SwanParser.class);

	/**
	 * Reserved words that may stand wherever an identifier is expected (names, outcome
	 * labels, member names), because they double as ordinary vocabulary.
	 */
	private static final Set<TokenType> IDENTIFIER_KEYWORDS = EnumSet.of(
		TokenType.APP, TokenType.PAGE, TokenType.COMPONENT, TokenType.ENTRY, TokenType.USE,
		TokenType.HEADER, TokenType.TEXT, TokenType.BUTTON, TokenType.LINK, TokenType.FIELD,
		TokenType.INPUT, TokenType.SUBMIT, TokenType.CLICK, TokenType.ON, TokenType.IF,
		TokenType.QUERY, TokenType.STRING_TYPE, TokenType.NUMBER_TYPE, TokenType.BOOLEAN_TYPE,
		TokenType.TRUE, TokenType.FALSE,
		TokenType.TABLE, TokenType.COLUMNS, TokenType.ROW,
		TokenType.CHART, TokenType.SERIES, TokenType.POINT,
		TokenType.BAR, TokenType.LINE, TokenType.PIE, TokenType.AREA, TokenType.SCATTER);

	private static final Map<TokenType, BinaryOperator> COMPARISON_OPERATORS = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, QueryType> QUERY_TYPES = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, ChartType> CHART_TYPES = new EnumMap<>(TokenType.class);

	static {
		COMPARISON_OPERATORS.put(TokenType.EQ, BinaryOperator.EQ);
		COMPARISON_OPERATORS.put(TokenType.NEQ, BinaryOperator.NEQ);
		COMPARISON_OPERATORS.put(TokenType.LT, BinaryOperator.LT);
		COMPARISON_OPERATORS.put(TokenType.GT, BinaryOperator.GT);
		COMPARISON_OPERATORS.put(TokenType.LTE, BinaryOperator.LTE);
		COMPARISON_OPERATORS.put(TokenType.GTE, BinaryOperator.GTE);

		QUERY_TYPES.put(TokenType.STRING_TYPE, QueryType.STRING);
		QUERY_TYPES.put(TokenType.NUMBER_TYPE, QueryType.NUMBER);
		QUERY_TYPES.put(TokenType.BOOLEAN_TYPE, QueryType.BOOLEAN);

		CHART_TYPES.put(TokenType.BAR, ChartType.BAR);
		CHART_TYPES.put(TokenType.LINE, ChartType.LINE);
		CHART_TYPES.put(TokenType.PIE, ChartType.PIE);
		CHART_TYPES.put(TokenType.AREA, ChartType.AREA);
		CHART_TYPES.put(TokenType.SCATTER, ChartType.SCATTER);
	}

	private final List<SwanToken> tokens;
	private int current = 0;

	/**
	 * @param tokens tokens produced by {@link org.javai.swan.lexer.SwanTokenizer}; an EOF
	 *     token is appended when missing
	 */
	public SwanParser(List<SwanToken> tokens) {
		List<SwanToken> all = new ArrayList<>(tokens != null ? tokens : List.of());
		if (all.isEmpty() || !all.get(all.size() - 1).is(TokenType.EOF)) {
			SwanToken last = all.isEmpty() ? null : all.get(all.size() - 1);
			all.add(new SwanToken(TokenType.EOF, "", last != null ? last.line() : 1, last != null ? last.column() : 1));
		}
		this.tokens = all;
	}

	/**
	 * Parses the whole token stream into a program.
	 *
	 * @throws SwanSyntaxException at the first grammar violation
	 */
	public Program parseProgram() {
		AppDecl app = parseAppDecl();
		List<PageDecl> pages = new ArrayList<>();
		List<ComponentDecl> components = new ArrayList<>();

		while (!isAtEnd()) {
			SwanToken token = peek();
			if (token.is(TokenType.PAGE)) {
				pages.add(parsePageDecl());
			}
			else if (token.is(TokenType.COMPONENT)) {
				components.add(parseComponentDecl());
			}
			else {
				throw unexpected(token, "'page' or 'component'");
			}
		}

		logger.debug("Parsed app '{}' with {} page(s) and {} component(s)", app.name(), pages.size(),
			components.size());
		return new Program(app, pages, components);
	}

	// ---------------------------------------------------------------------
	// Declarations
	// ---------------------------------------------------------------------

	private AppDecl parseAppDecl() {
		SwanToken keyword = expect(TokenType.APP);
		SwanToken name = expectIdentifier();
		expect(TokenType.LBRACE);
		expect(TokenType.ENTRY);
		SwanToken entry = expectIdentifier();
		expect(TokenType.RBRACE);
		return new AppDecl(name.text(), entry.text(), keyword.position());
	}

	private PageDecl parsePageDecl() {
		SwanToken keyword = expect(TokenType.PAGE);
		SwanToken name = expectIdentifier();
		return new PageDecl(name.text(), parseBlock(), keyword.position());
	}

	private ComponentDecl parseComponentDecl() {
		SwanToken keyword = expect(TokenType.COMPONENT);
		SwanToken name = expectIdentifier();
		return new ComponentDecl(name.text(), parseBlock(), keyword.position());
	}

	private List<Statement> parseBlock() {
		expect(TokenType.LBRACE);
		List<Statement> statements = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			statements.add(parseStatement());
		}
		expect(TokenType.RBRACE);
		return statements;
	}

	// ---------------------------------------------------------------------
	// Statements
	// ---------------------------------------------------------------------

	private Statement parseStatement() {
		SwanToken token = peek();
		return switch (token.type()) {
			case HEADER -> new HeaderStmt(expectStringAfter(TokenType.HEADER), token.position());
			case TEXT -> new TextStmt(expectStringAfter(TokenType.TEXT), token.position());
			case BUTTON -> parseButton();
			case LINK -> parseLink();
			case FIELD -> {
				advance();
				yield new FieldStmt(expectIdentifier().text(), token.position());
			}
			case INPUT -> {
				advance();
				yield new InputStmt(expectIdentifier().text(), token.position());
			}
			case USE -> {
				advance();
				yield new UseStmt(expectIdentifier().text(), token.position());
			}
			case SUBMIT -> {
				advance();
				String label = expectString().text();
				expect(TokenType.ARROW);
				yield new SubmitStmt(label, expectIdentifier().text(), token.position());
			}
			case CLICK -> {
				advance();
				String label = expectString().text();
				expect(TokenType.ARROW);
				yield new ClickStmt(label, expectIdentifier().text(), token.position());
			}
			case ON -> parseHandler();
			case IF -> {
				advance();
				Expression condition = parseExpression();
				yield new ConditionalStmt(condition, parseBlock(), token.position());
			}
			case QUERY -> parseQuery();
			case TABLE -> parseTable();
			case CHART -> parseChart();
			default -> throw unexpected(token, "a statement keyword");
		};
	}

	private String expectStringAfter(TokenType keyword) {
		expect(keyword);
		return expectString().text();
	}

	private ButtonStmt parseButton() {
		SwanToken keyword = expect(TokenType.BUTTON);
		String label = expectString().text();
		NavTarget nav = check(TokenType.ARROW) ? parseNavTarget() : null;
		return new ButtonStmt(label, nav, keyword.position());
	}

	private LinkStmt parseLink() {
		SwanToken keyword = expect(TokenType.LINK);
		String label = expectString().text();
		return new LinkStmt(label, parseNavTarget(), keyword.position());
	}

	private HandlerStmt parseHandler() {
		SwanToken keyword = expect(TokenType.ON);
		SwanToken action = expectIdentifier();
		expect(TokenType.LBRACE);

		List<OutcomeClause> outcomes = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			SwanToken outcome = expectIdentifier();
			expect(TokenType.ARROW);
			SwanToken target = expectIdentifier();
			outcomes.add(new OutcomeClause(outcome.text(), target.text(), outcome.position()));
		}
		expect(TokenType.RBRACE);

		return new HandlerStmt(action.text(), outcomes, keyword.position());
	}

	private QueryStmt parseQuery() {
		SwanToken keyword = expect(TokenType.QUERY);
		SwanToken name = expectIdentifier();

		QueryType valueType = null;
		if (match(TokenType.COLON)) {
			SwanToken typeToken = peek();
			valueType = QUERY_TYPES.get(typeToken.type());
			if (valueType == null) {
				throw unexpected(typeToken, "a query type (string | number | boolean)");
			}
			advance();
		}

		Literal defaultValue = null;
		if (match(TokenType.ASSIGN)) {
			defaultValue = parseLiteral();
		}

		return new QueryStmt(name.text(), valueType, defaultValue, keyword.position());
	}

	private TableStmt parseTable() {
		SwanToken keyword = expect(TokenType.TABLE);
		SwanToken name = expectIdentifier();
		expect(TokenType.LBRACE);

		expect(TokenType.COLUMNS);
		expect(TokenType.LBRACKET);
		List<String> columns = new ArrayList<>();
		if (!check(TokenType.RBRACKET)) {
			columns.add(expectString().text());
			while (match(TokenType.COMMA)) {
				// trailing comma before ]
				if (check(TokenType.RBRACKET)) break;
				columns.add(expectString().text());
			}
		}
		expect(TokenType.RBRACKET);

		List<TableRow> rows = new ArrayList<>();
		while (check(TokenType.ROW)) {
			rows.add(parseTableRow());
		}
		expect(TokenType.RBRACE);

		return new TableStmt(name.text(), columns, rows, keyword.position());
	}

	private TableRow parseTableRow() {
		SwanToken keyword = expect(TokenType.ROW);
		expect(TokenType.LBRACKET);
		List<Expression> cells = new ArrayList<>();
		if (!check(TokenType.RBRACKET)) {
			cells.add(parseExpression());
			while (match(TokenType.COMMA)) {
				if (check(TokenType.RBRACKET)) break;
				cells.add(parseExpression());
			}
		}
		expect(TokenType.RBRACKET);

		List<Statement> actions = check(TokenType.LBRACE) ? parseBlock() : null;
		return new TableRow(cells, actions, keyword.position());
	}

	private ChartStmt parseChart() {
		SwanToken keyword = expect(TokenType.CHART);
		SwanToken name = expectIdentifier();

		SwanToken typeToken = peek();
		ChartType chartType = CHART_TYPES.get(typeToken.type());
		if (chartType == null) {
			throw unexpected(typeToken, "a chart type (bar | line | pie | area | scatter)");
		}
		advance();

		expect(TokenType.LBRACE);
		List<ChartSeries> series = new ArrayList<>();
		while (check(TokenType.SERIES)) {
			series.add(parseSeries());
		}
		expect(TokenType.RBRACE);

		return new ChartStmt(name.text(), chartType, series, keyword.position());
	}

	private ChartSeries parseSeries() {
		SwanToken keyword = expect(TokenType.SERIES);
		String label = expectString().text();
		expect(TokenType.LBRACE);
		List<ChartPoint> points = new ArrayList<>();
		while (check(TokenType.POINT)) {
			SwanToken point = advance();
			Expression x = parseExpression();
			expect(TokenType.COMMA);
			Expression y = parseExpression();
			points.add(new ChartPoint(x, y, point.position()));
		}
		expect(TokenType.RBRACE);
		return new ChartSeries(label, points, keyword.position());
	}

	// ---------------------------------------------------------------------
	// Navigation
	// ---------------------------------------------------------------------

	private NavTarget parseNavTarget() {
		SwanToken arrow = expect(TokenType.ARROW);
		SwanToken target = expectIdentifier();

		List<QueryArg> queryArgs = new ArrayList<>();
		if (match(TokenType.QUESTION)) {
			queryArgs.add(parseQueryArg());
			while (match(TokenType.AMPERSAND)) {
				queryArgs.add(parseQueryArg());
			}
		}

		return new NavTarget(target.text(), queryArgs, arrow.position());
	}

	private QueryArg parseQueryArg() {
		SwanToken key = expectIdentifier();
		expect(TokenType.ASSIGN);
		return new QueryArg(key.text(), parseExpression(), key.position());
	}

	// ---------------------------------------------------------------------
	// Expressions
	// ---------------------------------------------------------------------

	/**
	 * Parses one expression starting at the current token.
	 */
	Expression parseExpression() {
		return parseOr();
	}

	private Expression parseOr() {
		Expression left = parseAnd();
		while (check(TokenType.OR)) {
			SwanToken operator = advance();
			left = new BinaryExpr(BinaryOperator.OR, left, parseAnd(), operator.position());
		}
		return left;
	}

	private Expression parseAnd() {
		Expression left = parseComparison();
		while (check(TokenType.AND)) {
			SwanToken operator = advance();
			left = new BinaryExpr(BinaryOperator.AND, left, parseComparison(), operator.position());
		}
		return left;
	}

	// Non-associative: a == b == c does not chain, the second == is left unconsumed
	private Expression parseComparison() {
		Expression left = parseAdditive();
		BinaryOperator operator = COMPARISON_OPERATORS.get(peek().type());
		if (operator == null) {
			return left;
		}
		SwanToken operatorToken = advance();
		return new BinaryExpr(operator, left, parseAdditive(), operatorToken.position());
	}

	private Expression parseAdditive() {
		Expression left = parseUnary();
		while (check(TokenType.PLUS)) {
			SwanToken operator = advance();
			left = new BinaryExpr(BinaryOperator.PLUS, left, parseUnary(), operator.position());
		}
		return left;
	}

	private Expression parseUnary() {
		if (check(TokenType.BANG)) {
			SwanToken bang = advance();
			return new UnaryExpr(UnaryOperator.NOT, parseUnary(), bang.position());
		}
		return parsePrimary();
	}

	private Expression parsePrimary() {
		SwanToken token = peek();
		switch (token.type()) {
			case TRUE, FALSE, STRING, NUMBER:
				return parseLiteral();
			case IDENT, QUERY: {
				advance();
				IdentifierExpr base = new IdentifierExpr(token.text(), token.position());
				if (match(TokenType.DOT)) {
					SwanToken member = expectIdentifier();
					return new MemberExpr(base, member.text(), token.position());
				}
				return base;
			}
			default:
				throw unexpected(token, "an expression");
		}
	}

	private Literal parseLiteral() {
		SwanToken token = peek();
		return switch (token.type()) {
			case STRING -> new StringLiteral(advance().text(), token.position());
			case NUMBER -> NumberLiteral.parse(advance().text(), token.position());
			case TRUE, FALSE -> new BooleanLiteral(advance().is(TokenType.TRUE), token.position());
			default -> throw unexpected(token, "a literal (string, number or boolean)");
		};
	}

	// ---------------------------------------------------------------------
	// Token stream primitives
	// ---------------------------------------------------------------------

	private SwanToken expectIdentifier() {
		SwanToken token = peek();
		if (token.is(TokenType.IDENT) || IDENTIFIER_KEYWORDS.contains(token.type())) {
			return advance();
		}
		throw unexpected(token, "an identifier");
	}

	private SwanToken expectString() {
		SwanToken token = peek();
		if (token.is(TokenType.STRING)) {
			return advance();
		}
		throw unexpected(token, "a string literal");
	}

	private SwanToken expect(TokenType type) {
		SwanToken token = peek();
		if (token.is(type)) {
			return advance();
		}
		throw unexpected(token, "'" + type.text() + "'");
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean check(TokenType type) {
		return peek().is(type);
	}

	private SwanToken peek() {
		return tokens.get(current);
	}

	private SwanToken advance() {
		SwanToken token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean isAtEnd() {
		return peek().is(TokenType.EOF);
	}

	private SwanSyntaxException unexpected(SwanToken found, String expected) {
		return new SwanSyntaxException("Expected " + expected + " but found " + describe(found), found.position());
	}

	private static String describe(SwanToken token) {
		return switch (token.type()) {
			case EOF -> "end of input";
			case STRING -> "string \"" + token.text() + "\"";
			case NUMBER -> "number " + token.text();
			case IDENT -> "identifier '" + token.text() + "'";
			default -> "'" + token.text() + "' (" + token.type() + ")";
		};
	}
}
