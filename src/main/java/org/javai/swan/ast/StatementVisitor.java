package org.javai.swan.ast;

/**
 * Visitor over the closed set of statement variants.
 *
 * @param <R> the return type of the visitor operations
 */
public interface StatementVisitor<R> {

	R visitHeader(HeaderStmt header);

	R visitText(TextStmt text);

	R visitButton(ButtonStmt button);

	R visitLink(LinkStmt link);

	R visitField(FieldStmt field);

	R visitInput(InputStmt input);

	R visitUse(UseStmt use);

	R visitSubmit(SubmitStmt submit);

	R visitClick(ClickStmt click);

	R visitHandler(HandlerStmt handler);

	R visitConditional(ConditionalStmt conditional);

	R visitQuery(QueryStmt query);

	R visitTable(TableStmt table);

	R visitChart(ChartStmt chart);
}
