package org.javai.swan.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.javai.swan.ast.StatementWalker.Descent;
import org.javai.swan.lexer.SwanTokenizer;
import org.javai.swan.parser.SwanParser;
import org.junit.jupiter.api.Test;

class StatementWalkerTest {

	private static final String SOURCE = """
		app A { entry Home }
		page Home {
		  button "Top" -> Home
		  if a {
		    link "Nested" -> Nested
		    if b {
		      on save { ok -> Deep fail -> Home }
		    }
		  }
		  table T {
		    columns ["x"]
		    row [1] { button "Row" -> RowTarget submit "Go" -> go }
		    row [2]
		  }
		  button "Plain"
		  submit "Save" -> save
		}
		""";

	private static List<Statement> body() {
		return new SwanParser(new SwanTokenizer(SOURCE).tokenize()).parseProgram().pages().get(0).body();
	}

	@Test
	void walkVisitsStatementsInPreOrder() {
		List<String> kinds = new ArrayList<>();

		StatementWalker.walk(body(), Descent.CONDITIONALS, s -> kinds.add(s.getClass().getSimpleName()));

		assertThat(kinds).containsExactly("ButtonStmt", "ConditionalStmt", "LinkStmt", "ConditionalStmt",
			"HandlerStmt", "TableStmt", "ButtonStmt", "SubmitStmt");
	}

	@Test
	void nestedBlocksDescentEntersRowActions() {
		List<SubmitStmt> conditionalsOnly = StatementWalker.collectOfType(body(), Descent.CONDITIONALS, SubmitStmt.class);
		List<SubmitStmt> nested = StatementWalker.collectOfType(body(), Descent.NESTED_BLOCKS, SubmitStmt.class);

		assertThat(conditionalsOnly).extracting(SubmitStmt::action).containsExactly("save");
		assertThat(nested).extracting(SubmitStmt::action).containsExactly("go", "save");
	}

	@Test
	void collectNavigationTargets() {
		List<String> targets = StatementWalker.collect(body(), Descent.NESTED_BLOCKS, StatementWalker::navigationTargets);

		assertThat(targets).containsExactly("Home", "Nested", "Deep", "Home", "RowTarget");
	}

	@Test
	void buttonWithoutTargetContributesNoEdge() {
		ButtonStmt plain = new ButtonStmt("Plain", null, Position.of(1, 1));

		assertThat(StatementWalker.navigationTargets(plain)).isEmpty();
		assertThat(StatementWalker.navigationTargets(new TextStmt("t", Position.of(1, 1)))).isEmpty();
	}

	@Test
	void walkToleratesMissingBody() {
		List<Statement> seen = new ArrayList<>();

		StatementWalker.walk(null, Descent.NESTED_BLOCKS, seen::add);

		assertThat(seen).isEmpty();
	}
}
