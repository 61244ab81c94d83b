package org.javai.swan.print;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.swan.ast.BinaryExpr;
import org.javai.swan.ast.BooleanLiteral;
import org.javai.swan.ast.ButtonStmt;
import org.javai.swan.ast.ChartPoint;
import org.javai.swan.ast.ChartSeries;
import org.javai.swan.ast.ChartStmt;
import org.javai.swan.ast.ClickStmt;
import org.javai.swan.ast.ConditionalStmt;
import org.javai.swan.ast.Expression;
import org.javai.swan.ast.ExpressionVisitor;
import org.javai.swan.ast.FieldStmt;
import org.javai.swan.ast.HandlerStmt;
import org.javai.swan.ast.HeaderStmt;
import org.javai.swan.ast.IdentifierExpr;
import org.javai.swan.ast.InputStmt;
import org.javai.swan.ast.LinkStmt;
import org.javai.swan.ast.MemberExpr;
import org.javai.swan.ast.NavTarget;
import org.javai.swan.ast.NumberLiteral;
import org.javai.swan.ast.OutcomeClause;
import org.javai.swan.ast.Program;
import org.javai.swan.ast.QueryStmt;
import org.javai.swan.ast.ScopeDecl;
import org.javai.swan.ast.Statement;
import org.javai.swan.ast.StatementVisitor;
import org.javai.swan.ast.StringLiteral;
import org.javai.swan.ast.SubmitStmt;
import org.javai.swan.ast.TableRow;
import org.javai.swan.ast.TableStmt;
import org.javai.swan.ast.TextStmt;
import org.javai.swan.ast.UnaryExpr;
import org.javai.swan.ast.UseStmt;

/**
 * Visitor that prints a program back to canonical SWAN source.
 *
 * <p>The output re-parses to a structurally identical program, and printing that
 * program again yields the same text. Literal values are reproduced exactly. The grammar
 * has no parentheses, so expressions are printed infix without them; trees built by hand
 * with nesting the grammar cannot express will not survive a round trip.
 */
public class SwanPrettyPrinter implements StatementVisitor<Void> {

	private static final ExpressionVisitor<String> EXPRESSIONS = new ExpressionVisitor<>() {

		@Override
		public String visitString(StringLiteral literal) {
			return '"' + literal.value() + '"';
		}

		@Override
		public String visitNumber(NumberLiteral literal) {
			return literal.text();
		}

		@Override
		public String visitBoolean(BooleanLiteral literal) {
			return literal.text();
		}

		@Override
		public String visitIdentifier(IdentifierExpr identifier) {
			return identifier.name();
		}

		@Override
		public String visitMember(MemberExpr member) {
			return member.object().name() + "." + member.member();
		}

		@Override
		public String visitBinary(BinaryExpr binary) {
			return binary.left().accept(this) + " " + binary.operator().symbol() + " " + binary.right().accept(this);
		}

		@Override
		public String visitUnary(UnaryExpr unary) {
			return unary.operator().symbol() + unary.operand().accept(this);
		}
	};

	private final StringBuilder output = new StringBuilder();
	private final int indentSize;
	private int indentLevel = 0;

	public SwanPrettyPrinter() {
		this(2);
	}

	public SwanPrettyPrinter(int indentSize) {
		this.indentSize = indentSize;
	}

	/**
	 * Static convenience method to print a whole program.
	 */
	public static String print(Program program) {
		SwanPrettyPrinter printer = new SwanPrettyPrinter();
		printer.printProgram(program);
		return printer.toString();
	}

	/**
	 * Renders a single expression.
	 */
	public static String print(Expression expression) {
		return expression.accept(EXPRESSIONS);
	}

	public void printProgram(Program program) {
		line("app " + program.app().name() + " {");
		indentLevel++;
		line("entry " + program.app().entry());
		indentLevel--;
		line("}");
		program.pages().forEach(this::printScope);
		program.components().forEach(this::printScope);
	}

	private void printScope(ScopeDecl scope) {
		output.append('\n');
		line(scope.kind() + " " + scope.name() + " {");
		printBody(scope.body());
		line("}");
	}

	private void printBody(List<Statement> body) {
		indentLevel++;
		for (Statement statement : body) {
			statement.accept(this);
		}
		indentLevel--;
	}

	@Override
	public Void visitHeader(HeaderStmt header) {
		line("header " + quote(header.text()));
		return null;
	}

	@Override
	public Void visitText(TextStmt text) {
		line("text " + quote(text.text()));
		return null;
	}

	@Override
	public Void visitButton(ButtonStmt button) {
		line("button " + quote(button.label()) + button.navTarget().map(SwanPrettyPrinter::nav).orElse(""));
		return null;
	}

	@Override
	public Void visitLink(LinkStmt link) {
		line("link " + quote(link.label()) + nav(link.nav()));
		return null;
	}

	@Override
	public Void visitField(FieldStmt field) {
		line("field " + field.name());
		return null;
	}

	@Override
	public Void visitInput(InputStmt input) {
		line("input " + input.name());
		return null;
	}

	@Override
	public Void visitUse(UseStmt use) {
		line("use " + use.component());
		return null;
	}

	@Override
	public Void visitSubmit(SubmitStmt submit) {
		line("submit " + quote(submit.label()) + " -> " + submit.action());
		return null;
	}

	@Override
	public Void visitClick(ClickStmt click) {
		line("click " + quote(click.label()) + " -> " + click.action());
		return null;
	}

	@Override
	public Void visitHandler(HandlerStmt handler) {
		line("on " + handler.action() + " {");
		indentLevel++;
		for (OutcomeClause outcome : handler.outcomes()) {
			line(outcome.outcome() + " -> " + outcome.target());
		}
		indentLevel--;
		line("}");
		return null;
	}

	@Override
	public Void visitConditional(ConditionalStmt conditional) {
		line("if " + print(conditional.condition()) + " {");
		printBody(conditional.body());
		line("}");
		return null;
	}

	@Override
	public Void visitQuery(QueryStmt query) {
		StringBuilder text = new StringBuilder("query ").append(query.name());
		query.type().ifPresent(type -> text.append(": ").append(type.keyword()));
		query.defaultLiteral().ifPresent(literal -> text.append(" = ").append(print(literal)));
		line(text.toString());
		return null;
	}

	@Override
	public Void visitTable(TableStmt table) {
		line("table " + table.name() + " {");
		indentLevel++;
		line("columns [" + table.columns().stream().map(SwanPrettyPrinter::quote).collect(Collectors.joining(", ")) + "]");
		for (TableRow row : table.rows()) {
			String cells = row.cells().stream().map(SwanPrettyPrinter::print).collect(Collectors.joining(", "));
			if (row.actionBlock().isEmpty()) {
				line("row [" + cells + "]");
				continue;
			}
			line("row [" + cells + "] {");
			printBody(row.actions());
			line("}");
		}
		indentLevel--;
		line("}");
		return null;
	}

	@Override
	public Void visitChart(ChartStmt chart) {
		line("chart " + chart.name() + " " + chart.chartType().keyword() + " {");
		indentLevel++;
		for (ChartSeries series : chart.series()) {
			line("series " + quote(series.label()) + " {");
			indentLevel++;
			for (ChartPoint point : series.points()) {
				line("point " + print(point.x()) + ", " + print(point.y()));
			}
			indentLevel--;
			line("}");
		}
		indentLevel--;
		line("}");
		return null;
	}

	private static String nav(NavTarget nav) {
		StringBuilder text = new StringBuilder(" -> ").append(nav.target());
		if (nav.hasQueryArgs()) {
			text.append('?').append(nav.queryArgs().stream()
				.map(arg -> arg.key() + "=" + print(arg.value()))
				.collect(Collectors.joining("&")));
		}
		return text.toString();
	}

	// SWAN strings have no escapes
	private static String quote(String value) {
		return '"' + value + '"';
	}

	private void line(String text) {
		output.append(" ".repeat(indentLevel * indentSize)).append(text).append('\n');
	}

	/**
	 * Returns the printed output as a string.
	 */
	@Override
	public String toString() {
		return output.toString();
	}
}
