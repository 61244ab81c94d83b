package org.javai.swan.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import org.javai.swan.ast.BinaryExpr;
import org.javai.swan.ast.BinaryOperator;
import org.javai.swan.ast.BooleanLiteral;
import org.javai.swan.ast.ButtonStmt;
import org.javai.swan.ast.ChartStmt;
import org.javai.swan.ast.ChartType;
import org.javai.swan.ast.ClickStmt;
import org.javai.swan.ast.ConditionalStmt;
import org.javai.swan.ast.Expression;
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
import org.javai.swan.ast.Position;
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
import org.javai.swan.ast.UseStmt;
import org.javai.swan.error.SwanSyntaxException;
import org.javai.swan.lexer.SwanTokenizer;
import org.junit.jupiter.api.Test;

class SwanParserTest {

	private static final String APP = "app Demo { entry Home }\n";

	private static Program parse(String source) {
		return new SwanParser(new SwanTokenizer(source).tokenize()).parseProgram();
	}

	private static List<Statement> homeBody(String statements) {
		return parse(APP + "page Home {\n" + statements + "\n}").pages().get(0).body();
	}

	private static Expression expression(String source) {
		return new SwanParser(new SwanTokenizer(source).tokenize()).parseExpression();
	}

	@Test
	void parseMinimalProgram() {
		Program program = parse("app A { entry Home } page Home { header \"Hi\" }");

		assertThat(program.app().name()).isEqualTo("A");
		assertThat(program.app().entry()).isEqualTo("Home");
		assertThat(program.app().position()).isEqualTo(new Position(1, 1));
		assertThat(program.pages()).hasSize(1);
		assertThat(program.components()).isEmpty();
		assertThat(program.pages().get(0).body())
			.containsExactly(new HeaderStmt("Hi", new Position(1, 34)));
	}

	@Test
	void pagesAndComponentsKeepSourceOrder() {
		Program program = parse(APP + "page Home {} component Nav {} page About {} component Footer {}");

		assertThat(program.pages()).extracting(p -> p.name()).containsExactly("Home", "About");
		assertThat(program.components()).extracting(c -> c.name()).containsExactly("Nav", "Footer");
	}

	@Test
	void parseSimpleStatements() {
		List<Statement> body = homeBody("""
			text "Body"
			field email
			input search
			use Toolbar
			submit "Save" -> save
			click "Refresh" -> refresh""");

		assertThat(body).hasSize(6);
		assertThat(body.get(0)).isEqualTo(new TextStmt("Body", new Position(3, 1)));
		assertThat(body.get(1)).isEqualTo(new FieldStmt("email", new Position(4, 1)));
		assertThat(body.get(2)).isEqualTo(new InputStmt("search", new Position(5, 1)));
		assertThat(body.get(3)).isEqualTo(new UseStmt("Toolbar", new Position(6, 1)));
		assertThat(body.get(4)).isEqualTo(new SubmitStmt("Save", "save", new Position(7, 1)));
		assertThat(body.get(5)).isEqualTo(new ClickStmt("Refresh", "refresh", new Position(8, 1)));
	}

	@Test
	void buttonWithoutNavigationIsValid() {
		List<Statement> body = homeBody("button \"Info\"");

		ButtonStmt button = (ButtonStmt) body.get(0);
		assertThat(button.label()).isEqualTo("Info");
		assertThat(button.navTarget()).isEmpty();
	}

	@Test
	void buttonWithNavigationAndQueryArguments() {
		List<Statement> body = homeBody("button \"Next\" -> Search?q=query.q&page=query.page+1");

		NavTarget nav = ((ButtonStmt) body.get(0)).navTarget().orElseThrow();
		assertThat(nav.target()).isEqualTo("Search");
		assertThat(nav.position()).isEqualTo(new Position(3, 15));
		assertThat(nav.queryArgs()).extracting(QueryArg::key).containsExactly("q", "page");

		QueryArg q = nav.queryArgs().get(0);
		assertThat(q.position()).isEqualTo(new Position(3, 25));
		assertThat(q.value()).isInstanceOf(MemberExpr.class);

		BinaryExpr next = (BinaryExpr) nav.queryArgs().get(1).value();
		assertThat(next.operator()).isEqualTo(BinaryOperator.PLUS);
		assertThat(next.left()).isEqualTo(new MemberExpr(
			new IdentifierExpr("query", new Position(3, 40)), "page", new Position(3, 40)));
		assertThat(next.right()).isEqualTo(new NumberLiteral(BigDecimal.ONE, new Position(3, 51)));
	}

	@Test
	void linkRequiresNavigation() {
		assertThatThrownBy(() -> homeBody("link \"Back\""))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected '->' but found '}' (RBRACE) at 4:1");
	}

	@Test
	void parseLinkWithSingleQueryArgument() {
		LinkStmt link = (LinkStmt) homeBody("link \"Profile\" -> User?id=\"u1\"").get(0);

		assertThat(link.nav().target()).isEqualTo("User");
		assertThat(link.nav().queryArgs()).singleElement()
			.satisfies(arg -> assertThat(arg.value()).isEqualTo(new StringLiteral("u1", new Position(3, 27))));
	}

	@Test
	void parseQueryDeclarations() {
		List<Statement> body = homeBody("""
			query q : string = ""
			query page : number = 1.50
			query active : boolean
			query sort = "name"
			query raw""");

		QueryStmt q = (QueryStmt) body.get(0);
		assertThat(q.type()).contains(QueryType.STRING);
		assertThat(q.defaultLiteral()).contains(new StringLiteral("", new Position(3, 20)));

		QueryStmt page = (QueryStmt) body.get(1);
		assertThat(page.name()).isEqualTo("page");
		assertThat(page.type()).contains(QueryType.NUMBER);
		assertThat(page.defaultLiteral().orElseThrow().text()).isEqualTo("1.50");

		QueryStmt active = (QueryStmt) body.get(2);
		assertThat(active.type()).contains(QueryType.BOOLEAN);
		assertThat(active.defaultLiteral()).isEmpty();

		QueryStmt sort = (QueryStmt) body.get(3);
		assertThat(sort.type()).isEmpty();
		assertThat(sort.defaultLiteral().orElseThrow().text()).isEqualTo("name");

		QueryStmt raw = (QueryStmt) body.get(4);
		assertThat(raw.type()).isEmpty();
		assertThat(raw.defaultLiteral()).isEmpty();
	}

	@Test
	void queryTypeMustBeKnown() {
		assertThatThrownBy(() -> homeBody("query from : date"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected a query type (string | number | boolean) but found identifier 'date' at 3:14");
	}

	@Test
	void queryDefaultMustBeLiteral() {
		assertThatThrownBy(() -> homeBody("query page = other"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessageContaining("Expected a literal (string, number or boolean) but found identifier 'other'");
	}

	@Test
	void parseHandlerWithOutcomes() {
		HandlerStmt handler = (HandlerStmt) homeBody("""
			on auth {
			  success -> Dashboard
			  error -> LoginError
			}""").get(0);

		assertThat(handler.action()).isEqualTo("auth");
		assertThat(handler.outcomes()).containsExactly(
			new OutcomeClause("success", "Dashboard", new Position(4, 3)),
			new OutcomeClause("error", "LoginError", new Position(5, 3)));
	}

	@Test
	void handlerMayHaveNoOutcomes() {
		HandlerStmt handler = (HandlerStmt) homeBody("on ping { }").get(0);

		assertThat(handler.outcomes()).isEmpty();
	}

	@Test
	void keywordsAreAcceptedWhereIdentifiersAreExpected() {
		Program program = parse("""
			app table { entry page }
			page page {
			  field text
			  use chart
			  on submit { row -> page }
			}
			component chart {}
			""");

		assertThat(program.app().name()).isEqualTo("table");
		assertThat(program.app().entry()).isEqualTo("page");
		List<Statement> body = program.pages().get(0).body();
		assertThat(((FieldStmt) body.get(0)).name()).isEqualTo("text");
		assertThat(((UseStmt) body.get(1)).component()).isEqualTo("chart");
		assertThat(((HandlerStmt) body.get(2)).outcomes().get(0).outcome()).isEqualTo("row");
	}

	@Test
	void parseNestedConditionals() {
		ConditionalStmt outer = (ConditionalStmt) homeBody("""
			if user.admin {
			  text "Admin"
			  if !session.expired {
			    button "Settings" -> Settings
			  }
			}""").get(0);

		assertThat(outer.condition()).isInstanceOf(MemberExpr.class);
		assertThat(outer.body()).hasSize(2);
		ConditionalStmt inner = (ConditionalStmt) outer.body().get(1);
		assertThat(inner.condition()).isInstanceOf(UnaryExpr.class);
		assertThat(inner.body()).singleElement().isInstanceOf(ButtonStmt.class);
	}

	@Test
	void parseTableWithRowActions() {
		TableStmt table = (TableStmt) homeBody("""
			table Users {
			  columns ["Name", "Active",]
			  row ["Alice", true] {
			    button "Edit" -> Edit
			    button "Locked"
			  }
			  row ["Bob", false]
			}""").get(0);

		assertThat(table.name()).isEqualTo("Users");
		assertThat(table.columns()).containsExactly("Name", "Active");
		assertThat(table.rows()).hasSize(2);

		TableRow first = table.rows().get(0);
		assertThat(first.cells()).containsExactly(
			new StringLiteral("Alice", new Position(5, 8)),
			new BooleanLiteral(true, new Position(5, 17)));
		assertThat(first.actionBlock()).hasValueSatisfying(actions -> assertThat(actions).hasSize(2));
		assertThat(table.rows().get(1).actionBlock()).isEmpty();
	}

	@Test
	void tableShapeIsNotCheckedByTheParser() {
		TableStmt table = (TableStmt) homeBody("table Empty { columns [] row [1, 2, 3] }").get(0);

		assertThat(table.columns()).isEmpty();
		assertThat(table.rows().get(0).cells()).hasSize(3);
	}

	@Test
	void tableMustStartWithColumns() {
		assertThatThrownBy(() -> homeBody("table T { row [1] }"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected 'columns' but found 'row' (ROW) at 3:11");
	}

	@Test
	void parseChartWithSeriesAndPoints() {
		ChartStmt chart = (ChartStmt) homeBody("""
			chart Logins line {
			  series "2024" {
			    point "Jan", 320
			    point "Feb", 410.5
			  }
			}""").get(0);

		assertThat(chart.name()).isEqualTo("Logins");
		assertThat(chart.chartType()).isEqualTo(ChartType.LINE);
		assertThat(chart.series()).singleElement().satisfies(series -> {
			assertThat(series.label()).isEqualTo("2024");
			assertThat(series.points()).hasSize(2);
			assertThat(series.points().get(1).y()).isEqualTo(
				new NumberLiteral(new BigDecimal("410.5"), new Position(6, 18)));
		});
	}

	@Test
	void everyChartTypeIsRecognized() {
		for (ChartType type : ChartType.values()) {
			ChartStmt chart = (ChartStmt) homeBody("chart C " + type.keyword() + " { }").get(0);
			assertThat(chart.chartType()).isEqualTo(type);
			assertThat(chart.series()).isEmpty();
		}
	}

	@Test
	void unknownChartTypeIsRejected() {
		assertThatThrownBy(() -> homeBody("chart C donut { }"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessageContaining("Expected a chart type (bar | line | pie | area | scatter) but found identifier 'donut'");
	}

	@Test
	void orBindsLooserThanAnd() {
		BinaryExpr or = (BinaryExpr) expression("a || b && c");

		assertThat(or.operator()).isEqualTo(BinaryOperator.OR);
		assertThat(or.left()).isEqualTo(new IdentifierExpr("a", new Position(1, 1)));
		assertThat(((BinaryExpr) or.right()).operator()).isEqualTo(BinaryOperator.AND);
	}

	@Test
	void comparisonsBindTighterThanAnd() {
		BinaryExpr and = (BinaryExpr) expression("role == \"admin\" && age >= 18");

		assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
		assertThat(((BinaryExpr) and.left()).operator()).isEqualTo(BinaryOperator.EQ);
		assertThat(((BinaryExpr) and.right()).operator()).isEqualTo(BinaryOperator.GTE);
	}

	@Test
	void additionIsLeftAssociativeAndBindsTighterThanComparison() {
		BinaryExpr lt = (BinaryExpr) expression("a + b + c < limit");

		assertThat(lt.operator()).isEqualTo(BinaryOperator.LT);
		BinaryExpr sum = (BinaryExpr) lt.left();
		assertThat(sum.operator()).isEqualTo(BinaryOperator.PLUS);
		assertThat(sum.right()).isEqualTo(new IdentifierExpr("c", new Position(1, 9)));
		assertThat(((BinaryExpr) sum.left()).operator()).isEqualTo(BinaryOperator.PLUS);
	}

	@Test
	void binaryExpressionIsPositionedAtItsOperator() {
		BinaryExpr expr = (BinaryExpr) expression("count != 0");

		assertThat(expr.position()).isEqualTo(new Position(1, 7));
	}

	@Test
	void notAppliesToItsOperandOnly() {
		BinaryExpr eq = (BinaryExpr) expression("!done == flag");

		assertThat(eq.operator()).isEqualTo(BinaryOperator.EQ);
		assertThat(eq.left()).isInstanceOf(UnaryExpr.class);
	}

	@Test
	void doubleNegationNests() {
		UnaryExpr outer = (UnaryExpr) expression("!!visible");

		assertThat(outer.position()).isEqualTo(new Position(1, 1));
		UnaryExpr inner = (UnaryExpr) outer.operand();
		assertThat(inner.position()).isEqualTo(new Position(1, 2));
		assertThat(inner.operand()).isEqualTo(new IdentifierExpr("visible", new Position(1, 3)));
	}

	@Test
	void memberNameMayBeAKeyword() {
		MemberExpr member = (MemberExpr) expression("query.page");

		assertThat(member.object().name()).isEqualTo("query");
		assertThat(member.member()).isEqualTo("page");
	}

	@Test
	void comparisonsDoNotChain() {
		assertThatThrownBy(() -> homeBody("if a == b == c { }"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected '{' but found '==' (EQ) at 3:11");
	}

	@Test
	void programMustStartWithApp() {
		assertThatThrownBy(() -> parse("page Home { }"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected 'app' but found 'page' (PAGE) at 1:1");
	}

	@Test
	void prematureEndOfInputIsPositioned() {
		assertThatThrownBy(() -> parse("app A { entry Home"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected '}' but found end of input at 1:19");
	}

	@Test
	void unknownStatementIsRejected() {
		assertThatThrownBy(() -> homeBody("Home"))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected a statement keyword but found identifier 'Home' at 3:1");
	}

	@Test
	void onlyPagesAndComponentsFollowTheApp() {
		assertThatThrownBy(() -> parse(APP + "header \"Stray\""))
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected 'page' or 'component' but found 'header' (HEADER) at 2:1");
	}

	@Test
	void emptyTokenListFailsAtFirstPosition() {
		assertThatThrownBy(() -> new SwanParser(List.of()).parseProgram())
			.isInstanceOf(SwanSyntaxException.class)
			.hasMessage("Expected 'app' but found end of input at 1:1");
	}

	@Test
	void parsingIsIdempotent() {
		String source = APP + "page Home { button \"Go\" -> Home?x=1 + y if !z { text \"t\" } }";

		assertThat(parse(source)).isEqualTo(parse(source));
	}
}
