package org.javai.swan.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.swan.ParseOptions;
import org.javai.swan.ast.ActionStmt;
import org.javai.swan.ast.AppDecl;
import org.javai.swan.ast.ButtonStmt;
import org.javai.swan.ast.ChartSeries;
import org.javai.swan.ast.ChartStmt;
import org.javai.swan.ast.ChartType;
import org.javai.swan.ast.ComponentDecl;
import org.javai.swan.ast.HandlerStmt;
import org.javai.swan.ast.LinkStmt;
import org.javai.swan.ast.NavTarget;
import org.javai.swan.ast.OutcomeClause;
import org.javai.swan.ast.PageDecl;
import org.javai.swan.ast.Position;
import org.javai.swan.ast.Program;
import org.javai.swan.ast.QueryArg;
import org.javai.swan.ast.QueryStmt;
import org.javai.swan.ast.ScopeDecl;
import org.javai.swan.ast.Statement;
import org.javai.swan.ast.StatementWalker;
import org.javai.swan.ast.StatementWalker.Descent;
import org.javai.swan.ast.TableRow;
import org.javai.swan.ast.TableStmt;
import org.javai.swan.ast.UseStmt;
import org.javai.swan.error.SwanSemanticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static semantic checker for parsed SWAN programs.
 *
 * <p>Checks run in a fixed order and stop at the first violation, which is raised as a
 * {@link SwanSemanticException} tagged with its {@link SemanticRule}. The program is never
 * modified. Cross-references (navigation targets, component uses) are names, resolved
 * here against symbol tables built once per check.
 *
 * <p>Order: SR-1, SR-2, SR-6 (names and actions), SR-7, SR-8, SR-3 with SR-9, SR-6
 * (component uses) with SR-5, SR-11 with SR-10, SR-12 to SR-14, and SR-4 when strict mode
 * is on.
 */
public final class SemanticChecker {

	private static final Logger logger = LoggerFactory.getLogger(SemanticChecker.class);

	private final Program program;
	private final ParseOptions options;
	private final Set<String> pageNames = new LinkedHashSet<>();
	private final Set<String> componentNames = new LinkedHashSet<>();
	private final Map<String, Set<String>> pageQueryParams = new HashMap<>();

	private SemanticChecker(Program program, ParseOptions options) {
		this.program = program;
		this.options = options;
		program.pages().forEach(page -> pageNames.add(page.name()));
		program.components().forEach(component -> componentNames.add(component.name()));
	}

	/**
	 * Validates a program.
	 *
	 * @param program the parsed program
	 * @param options strict mode enables the reachability check
	 * @throws SwanSemanticException at the first violated rule
	 */
	public static void check(Program program, ParseOptions options) {
		Objects.requireNonNull(program, "program must not be null");
		Objects.requireNonNull(options, "options must not be null");
		new SemanticChecker(program, options).run();
	}

	private void run() {
		logger.debug("Checking app '{}': {} page(s), {} component(s), strict mode {}",
			program.app().name(), program.pages().size(), program.components().size(),
			options.strictMode() ? "on" : "off");

		checkEntry();
		checkUniqueNames();
		checkQueriesOnlyInPages();
		checkUniqueQueryParams();
		checkNavigationTargets();
		checkComponentComposition();
		checkTables();
		checkCharts();
		if (options.strictMode()) {
			checkReachability();
		}

		logger.debug("App '{}' passed semantic checks", program.app().name());
	}

	// SR-1, SR-2

	private void checkEntry() {
		AppDecl app = program.app();
		if (app.entry() == null || app.entry().isBlank()) {
			throw new SwanSemanticException(SemanticRule.SR_1, "app must define an entry page", app.position());
		}
		if (!pageNames.contains(app.entry())) {
			throw new SwanSemanticException(SemanticRule.SR_2,
				"entry \"" + app.entry() + "\" must reference a page" + notAPageHint(app.entry()), app.position());
		}
	}

	// SR-6: names and actions

	private void checkUniqueNames() {
		Set<String> seenPages = new HashSet<>();
		for (PageDecl page : program.pages()) {
			if (!seenPages.add(page.name())) {
				throw new SwanSemanticException(SemanticRule.SR_6,
					"Duplicate page name \"" + page.name() + "\"", page.position());
			}
		}

		Set<String> seenComponents = new HashSet<>();
		for (ComponentDecl component : program.components()) {
			if (!seenComponents.add(component.name())) {
				throw new SwanSemanticException(SemanticRule.SR_6,
					"Duplicate component name \"" + component.name() + "\"", component.position());
			}
		}

		for (ScopeDecl scope : scopes()) {
			checkUniqueActions(scope);
		}
	}

	// Counts are summed across conditionals; row action blocks repeat per row and are skipped
	private void checkUniqueActions(ScopeDecl scope) {
		Set<String> seen = new HashSet<>();
		for (ActionStmt action : StatementWalker.collectOfType(scope.body(), Descent.CONDITIONALS, ActionStmt.class)) {
			if (!seen.add(action.action())) {
				throw new SwanSemanticException(SemanticRule.SR_6,
					"Duplicate action \"" + action.action() + "\" in " + scope.kind() + " \"" + scope.name() + "\"",
					action.position());
			}
		}
	}

	// SR-7

	private void checkQueriesOnlyInPages() {
		for (ComponentDecl component : program.components()) {
			List<QueryStmt> queries = StatementWalker.collectOfType(component.body(), Descent.NESTED_BLOCKS,
				QueryStmt.class);
			if (!queries.isEmpty()) {
				throw new SwanSemanticException(SemanticRule.SR_7,
					"\"query\" statement is not allowed inside component \"" + component.name()
						+ "\": only pages may declare query parameters",
					queries.get(0).position());
			}
		}
	}

	// SR-8, and the per-page index of declared parameters used by SR-9

	private void checkUniqueQueryParams() {
		for (PageDecl page : program.pages()) {
			Set<String> params = new LinkedHashSet<>();
			for (QueryStmt query : StatementWalker.collectOfType(page.body(), Descent.CONDITIONALS, QueryStmt.class)) {
				if (!params.add(query.name())) {
					throw new SwanSemanticException(SemanticRule.SR_8,
						"Duplicate query parameter \"" + query.name() + "\" in page \"" + page.name() + "\"",
						query.position());
				}
			}
			pageQueryParams.put(page.name(), params);
		}
	}

	// SR-3, SR-9

	private void checkNavigationTargets() {
		for (ScopeDecl scope : scopes()) {
			StatementWalker.walk(scope.body(), Descent.NESTED_BLOCKS, this::checkNavigation);
		}
	}

	private void checkNavigation(Statement statement) {
		if (statement instanceof ButtonStmt button) {
			button.navTarget().ifPresent(this::checkNavTarget);
		}
		else if (statement instanceof LinkStmt link) {
			checkNavTarget(link.nav());
		}
		else if (statement instanceof HandlerStmt handler) {
			for (OutcomeClause outcome : handler.outcomes()) {
				if (!pageNames.contains(outcome.target())) {
					throw new SwanSemanticException(SemanticRule.SR_3,
						"Handler outcome \"" + outcome.outcome() + "\" targets \"" + outcome.target()
							+ "\" which must be a page" + notAPageHint(outcome.target()),
						outcome.position());
				}
			}
		}
	}

	private void checkNavTarget(NavTarget nav) {
		if (!pageNames.contains(nav.target())) {
			throw new SwanSemanticException(SemanticRule.SR_3,
				"Navigation target \"" + nav.target() + "\" must be a page" + notAPageHint(nav.target()),
				nav.position());
		}
		Set<String> declared = pageQueryParams.getOrDefault(nav.target(), Set.of());
		for (QueryArg arg : nav.queryArgs()) {
			if (!declared.contains(arg.key())) {
				throw new SwanSemanticException(SemanticRule.SR_9,
					"Navigation query argument \"" + arg.key()
						+ "\" is not declared as a query parameter on page \"" + nav.target() + "\"",
					arg.position());
			}
		}
	}

	// SR-6 (component uses), SR-5

	private void checkComponentComposition() {
		Map<String, List<String>> uses = new LinkedHashMap<>();
		for (ComponentDecl component : program.components()) {
			List<UseStmt> used = usesOf(component);
			uses.put(component.name(), used.stream().map(UseStmt::component).toList());
		}
		for (PageDecl page : program.pages()) {
			usesOf(page);
		}

		Set<String> finished = new HashSet<>();
		Deque<String> path = new ArrayDeque<>();
		for (String name : componentNames) {
			detectCycle(name, uses, finished, path);
		}
	}

	private List<UseStmt> usesOf(ScopeDecl scope) {
		List<UseStmt> used = StatementWalker.collectOfType(scope.body(), Descent.NESTED_BLOCKS, UseStmt.class);
		for (UseStmt use : used) {
			if (!componentNames.contains(use.component())) {
				throw new SwanSemanticException(SemanticRule.SR_6,
					capitalize(scope.kind()) + " \"" + scope.name() + "\" uses undefined component \""
						+ use.component() + "\"",
					use.position());
			}
		}
		return used;
	}

	/**
	 * Depth-first search. A node on the current path closes a cycle; a finished node
	 * is skipped without error.
	 */
	private void detectCycle(String name, Map<String, List<String>> uses, Set<String> finished, Deque<String> path) {
		if (path.contains(name)) {
			List<String> cycle = new ArrayList<>();
			boolean inCycle = false;
			for (String onPath : path) {
				inCycle |= onPath.equals(name);
				if (inCycle) {
					cycle.add(onPath);
				}
			}
			cycle.add(name);
			throw new SwanSemanticException(SemanticRule.SR_5,
				"Cyclic component composition detected: " + String.join(" -> ", cycle),
				program.component(name).map(ComponentDecl::position).orElse(null));
		}
		if (finished.contains(name)) {
			return;
		}

		path.addLast(name);
		for (String dependency : uses.getOrDefault(name, List.of())) {
			detectCycle(dependency, uses, finished, path);
		}
		path.removeLast();
		finished.add(name);
	}

	// SR-11, SR-10

	private void checkTables() {
		for (ScopeDecl scope : scopes()) {
			for (TableStmt table : StatementWalker.collectOfType(scope.body(), Descent.NESTED_BLOCKS, TableStmt.class)) {
				checkTable(table);
			}
		}
	}

	private void checkTable(TableStmt table) {
		if (table.columns().isEmpty()) {
			throw new SwanSemanticException(SemanticRule.SR_11,
				"Table \"" + table.name() + "\" must declare at least one column", table.position());
		}
		if (table.rows().isEmpty()) {
			throw new SwanSemanticException(SemanticRule.SR_11,
				"Table \"" + table.name() + "\" must have at least one row", table.position());
		}
		int columns = table.columns().size();
		for (int i = 0; i < table.rows().size(); i++) {
			TableRow row = table.rows().get(i);
			if (row.cells().size() != columns) {
				throw new SwanSemanticException(SemanticRule.SR_10,
					"Row " + (i + 1) + " of table \"" + table.name() + "\" has " + row.cells().size()
						+ " cell(s) but the table declares " + columns + " column(s)",
					row.position());
			}
		}
	}

	// SR-12, SR-13, SR-14

	private void checkCharts() {
		for (ScopeDecl scope : scopes()) {
			for (ChartStmt chart : StatementWalker.collectOfType(scope.body(), Descent.NESTED_BLOCKS, ChartStmt.class)) {
				checkChart(chart);
			}
		}
	}

	private void checkChart(ChartStmt chart) {
		if (chart.series().isEmpty()) {
			throw new SwanSemanticException(SemanticRule.SR_12,
				"Chart \"" + chart.name() + "\" must have at least one series", chart.position());
		}
		for (ChartSeries series : chart.series()) {
			if (series.points().isEmpty()) {
				throw new SwanSemanticException(SemanticRule.SR_13,
					"Series \"" + series.label() + "\" of chart \"" + chart.name() + "\" must have at least one point",
					series.position());
			}
		}
		if (chart.chartType() == ChartType.PIE && chart.series().size() != 1) {
			throw new SwanSemanticException(SemanticRule.SR_14,
				"Pie chart \"" + chart.name() + "\" must have exactly one series (found " + chart.series().size() + ")",
				chart.position());
		}
	}

	// SR-4 (strict mode only)

	/**
	 * Breadth-first search over pages from the entry. A page's edges are its own
	 * navigation targets plus those of the components it uses directly.
	 */
	private void checkReachability() {
		Map<String, List<String>> componentTargets = new HashMap<>();
		for (ComponentDecl component : program.components()) {
			componentTargets.put(component.name(), navigationTargets(component.body()));
		}

		String entry = program.app().entry();
		Set<String> reached = new LinkedHashSet<>();
		Deque<String> queue = new ArrayDeque<>();
		queue.add(entry);

		while (!queue.isEmpty()) {
			String name = queue.poll();
			if (!reached.add(name)) {
				continue;
			}
			PageDecl page = program.page(name).orElse(null);
			if (page == null) {
				continue;
			}
			List<String> edges = new ArrayList<>(navigationTargets(page.body()));
			for (UseStmt use : StatementWalker.collectOfType(page.body(), Descent.NESTED_BLOCKS, UseStmt.class)) {
				edges.addAll(componentTargets.getOrDefault(use.component(), List.of()));
			}
			for (String target : edges) {
				if (!reached.contains(target)) {
					queue.add(target);
				}
			}
		}
		logger.trace("Reached {} of {} page(s) from entry '{}'", reached.size(), pageNames.size(), entry);

		List<PageDecl> unreached = program.pages().stream()
			.filter(page -> !reached.contains(page.name()))
			.toList();
		if (unreached.isEmpty()) {
			return;
		}
		Position position = unreached.get(0).position();
		if (unreached.size() == 1) {
			throw new SwanSemanticException(SemanticRule.SR_4,
				"Page \"" + unreached.get(0).name() + "\" is not reachable from entry \"" + entry + "\"", position);
		}
		String names = unreached.stream().map(page -> "\"" + page.name() + "\"").collect(Collectors.joining(", "));
		throw new SwanSemanticException(SemanticRule.SR_4,
			"Pages " + names + " are not reachable from entry \"" + entry + "\"", position);
	}

	private static List<String> navigationTargets(List<Statement> body) {
		return StatementWalker.collect(body, Descent.NESTED_BLOCKS, StatementWalker::navigationTargets);
	}

	private List<ScopeDecl> scopes() {
		List<ScopeDecl> scopes = new ArrayList<>(program.pages());
		scopes.addAll(program.components());
		return scopes;
	}

	private String notAPageHint(String name) {
		return componentNames.contains(name)
			? " (\"" + name + "\" is a component, not a page)"
			: " (\"" + name + "\" is not defined)";
	}

	private static String capitalize(String word) {
		return Character.toUpperCase(word.charAt(0)) + word.substring(1);
	}
}
