package org.javai.swan.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import org.javai.swan.ast.AppDecl;
import org.javai.swan.ast.BinaryExpr;
import org.javai.swan.ast.BooleanLiteral;
import org.javai.swan.ast.ButtonStmt;
import org.javai.swan.ast.ChartPoint;
import org.javai.swan.ast.ChartSeries;
import org.javai.swan.ast.ChartStmt;
import org.javai.swan.ast.ClickStmt;
import org.javai.swan.ast.ComponentDecl;
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
import org.javai.swan.ast.PageDecl;
import org.javai.swan.ast.Position;
import org.javai.swan.ast.Program;
import org.javai.swan.ast.QueryArg;
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
 * Serializes a {@link Program} to the JSON shape consumed by code generators.
 *
 * <p>Declarations, statements and expressions carry a {@code "kind"} discriminator
 * named after the node type ({@code "PageDecl"}, {@code "ButtonStmt"},
 * {@code "BinaryExpr"}, ...). Every node below the root carries
 * {@code "pos": {"line", "col"}}.
 * Absent optional members are omitted rather than written as {@code null}. Number
 * literals keep their exact decimal text.
 */
public final class ProgramJsonWriter {

	private static final ObjectMapper mapper = JsonMapper.builder()
		.enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
		.build();

	private ProgramJsonWriter() {
	}

	/**
	 * Renders the program as pretty-printed JSON.
	 */
	public static String toJson(Program program) {
		ObjectNode tree = toTree(program);
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize program: " + program.app().name(), e);
		}
	}

	/**
	 * Builds the JSON tree without rendering it.
	 */
	public static ObjectNode toTree(Program program) {
		Objects.requireNonNull(program, "program must not be null");
		ObjectNode node = node("Program", null);
		node.set("app", app(program.app()));
		ArrayNode pages = node.putArray("pages");
		for (PageDecl page : program.pages()) {
			pages.add(scope("PageDecl", page));
		}
		ArrayNode components = node.putArray("components");
		for (ComponentDecl component : program.components()) {
			components.add(scope("ComponentDecl", component));
		}
		return node;
	}

	private static ObjectNode app(AppDecl app) {
		ObjectNode node = node("AppDecl", app.position());
		node.put("name", app.name());
		node.put("entry", app.entry());
		return node;
	}

	private static ObjectNode scope(String kind, ScopeDecl scope) {
		ObjectNode node = node(kind, scope.position());
		node.put("name", scope.name());
		node.set("body", statements(scope.body()));
		return node;
	}

	private static ArrayNode statements(List<Statement> body) {
		ArrayNode array = mapper.createArrayNode();
		for (Statement statement : body) {
			array.add(statement.accept(STATEMENTS));
		}
		return array;
	}

	private static ObjectNode expression(Expression expression) {
		return expression.accept(EXPRESSIONS);
	}

	// kind is null for helper objects (nav targets, outcomes, rows, series, points)
	private static ObjectNode node(String kind, Position position) {
		ObjectNode node = mapper.createObjectNode();
		if (kind != null) {
			node.put("kind", kind);
		}
		if (position != null) {
			ObjectNode pos = node.putObject("pos");
			pos.put("line", position.line());
			pos.put("col", position.column());
		}
		return node;
	}

	private static ObjectNode nav(NavTarget nav) {
		ObjectNode node = node(null, nav.position());
		node.put("target", nav.target());
		if (nav.hasQueryArgs()) {
			ArrayNode args = node.putArray("queryArgs");
			for (QueryArg arg : nav.queryArgs()) {
				ObjectNode argNode = node(null, arg.position());
				argNode.put("key", arg.key());
				argNode.set("value", expression(arg.value()));
				args.add(argNode);
			}
		}
		return node;
	}

	private static final StatementVisitor<ObjectNode> STATEMENTS = new StatementVisitor<>() {

		@Override
		public ObjectNode visitHeader(HeaderStmt header) {
			ObjectNode node = node("HeaderStmt", header.position());
			node.put("text", header.text());
			return node;
		}

		@Override
		public ObjectNode visitText(TextStmt text) {
			ObjectNode node = node("TextStmt", text.position());
			node.put("text", text.text());
			return node;
		}

		@Override
		public ObjectNode visitButton(ButtonStmt button) {
			ObjectNode node = node("ButtonStmt", button.position());
			node.put("label", button.label());
			button.navTarget().ifPresent(nav -> node.set("nav", nav(nav)));
			return node;
		}

		@Override
		public ObjectNode visitLink(LinkStmt link) {
			ObjectNode node = node("LinkStmt", link.position());
			node.put("label", link.label());
			node.set("nav", nav(link.nav()));
			return node;
		}

		@Override
		public ObjectNode visitField(FieldStmt field) {
			ObjectNode node = node("FieldStmt", field.position());
			node.put("name", field.name());
			return node;
		}

		@Override
		public ObjectNode visitInput(InputStmt input) {
			ObjectNode node = node("InputStmt", input.position());
			node.put("name", input.name());
			return node;
		}

		@Override
		public ObjectNode visitUse(UseStmt use) {
			ObjectNode node = node("UseStmt", use.position());
			node.put("component", use.component());
			return node;
		}

		@Override
		public ObjectNode visitSubmit(SubmitStmt submit) {
			ObjectNode node = node("SubmitStmt", submit.position());
			node.put("label", submit.label());
			node.put("action", submit.action());
			return node;
		}

		@Override
		public ObjectNode visitClick(ClickStmt click) {
			ObjectNode node = node("ClickStmt", click.position());
			node.put("label", click.label());
			node.put("action", click.action());
			return node;
		}

		@Override
		public ObjectNode visitHandler(HandlerStmt handler) {
			ObjectNode node = node("HandlerStmt", handler.position());
			node.put("action", handler.action());
			ArrayNode outcomes = node.putArray("outcomes");
			for (OutcomeClause outcome : handler.outcomes()) {
				ObjectNode outcomeNode = node(null, outcome.position());
				outcomeNode.put("outcome", outcome.outcome());
				outcomeNode.put("target", outcome.target());
				outcomes.add(outcomeNode);
			}
			return node;
		}

		@Override
		public ObjectNode visitConditional(ConditionalStmt conditional) {
			ObjectNode node = node("ConditionalStmt", conditional.position());
			node.set("condition", expression(conditional.condition()));
			node.set("body", statements(conditional.body()));
			return node;
		}

		@Override
		public ObjectNode visitQuery(QueryStmt query) {
			ObjectNode node = node("QueryStmt", query.position());
			node.put("name", query.name());
			query.type().ifPresent(type -> node.put("valueType", type.keyword()));
			query.defaultLiteral().ifPresent(literal -> node.set("defaultValue", expression(literal)));
			return node;
		}

		@Override
		public ObjectNode visitTable(TableStmt table) {
			ObjectNode node = node("TableStmt", table.position());
			node.put("name", table.name());
			ArrayNode columns = node.putArray("columns");
			table.columns().forEach(columns::add);
			ArrayNode rows = node.putArray("rows");
			for (TableRow row : table.rows()) {
				ObjectNode rowNode = node(null, row.position());
				ArrayNode cells = rowNode.putArray("cells");
				row.cells().forEach(cell -> cells.add(expression(cell)));
				row.actionBlock().ifPresent(actions -> rowNode.set("actions", statements(actions)));
				rows.add(rowNode);
			}
			return node;
		}

		@Override
		public ObjectNode visitChart(ChartStmt chart) {
			ObjectNode node = node("ChartStmt", chart.position());
			node.put("name", chart.name());
			node.put("chartType", chart.chartType().keyword());
			ArrayNode seriesArray = node.putArray("series");
			for (ChartSeries series : chart.series()) {
				ObjectNode seriesNode = node(null, series.position());
				seriesNode.put("label", series.label());
				ArrayNode points = seriesNode.putArray("points");
				for (ChartPoint point : series.points()) {
					ObjectNode pointNode = node(null, point.position());
					pointNode.set("x", expression(point.x()));
					pointNode.set("y", expression(point.y()));
					points.add(pointNode);
				}
				seriesArray.add(seriesNode);
			}
			return node;
		}
	};

	private static final ExpressionVisitor<ObjectNode> EXPRESSIONS = new ExpressionVisitor<>() {

		@Override
		public ObjectNode visitString(StringLiteral literal) {
			ObjectNode node = node("StringLiteral", literal.position());
			node.put("value", literal.value());
			return node;
		}

		@Override
		public ObjectNode visitNumber(NumberLiteral literal) {
			ObjectNode node = node("NumberLiteral", literal.position());
			// DecimalNode directly: the node factory may strip trailing zeros
			node.set("value", DecimalNode.valueOf(literal.value()));
			return node;
		}

		@Override
		public ObjectNode visitBoolean(BooleanLiteral literal) {
			ObjectNode node = node("BooleanLiteral", literal.position());
			node.put("value", literal.value());
			return node;
		}

		@Override
		public ObjectNode visitIdentifier(IdentifierExpr identifier) {
			ObjectNode node = node("IdentifierExpr", identifier.position());
			node.put("name", identifier.name());
			return node;
		}

		@Override
		public ObjectNode visitMember(MemberExpr member) {
			ObjectNode node = node("MemberExpr", member.position());
			node.set("object", visitIdentifier(member.object()));
			node.put("member", member.member());
			return node;
		}

		@Override
		public ObjectNode visitBinary(BinaryExpr binary) {
			ObjectNode node = node("BinaryExpr", binary.position());
			node.put("operator", binary.operator().symbol());
			node.set("left", expression(binary.left()));
			node.set("right", expression(binary.right()));
			return node;
		}

		@Override
		public ObjectNode visitUnary(UnaryExpr unary) {
			ObjectNode node = node("UnaryExpr", unary.position());
			node.put("operator", unary.operator().symbol());
			node.set("operand", expression(unary.operand()));
			return node;
		}
	};
}
