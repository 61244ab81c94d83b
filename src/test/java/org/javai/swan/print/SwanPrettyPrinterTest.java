package org.javai.swan.print;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.swan.Swan;
import org.javai.swan.ast.Program;
import org.javai.swan.lexer.SwanTokenizer;
import org.javai.swan.parser.SwanParser;
import org.javai.swan.testsupport.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SwanPrettyPrinterTest {

	private static Program syntax(String source) {
		return new SwanParser(new SwanTokenizer(source).tokenize()).parseProgram();
	}

	@Test
	void printCanonicalLayout() {
		Program program = syntax("app Shop {entry Home} page Home {header \"Hi\" button \"Go\"->Cart?id=1&x=a.b} component Nav {use Logo}");

		assertThat(SwanPrettyPrinter.print(program)).isEqualTo("""
			app Shop {
			  entry Home
			}

			page Home {
			  header "Hi"
			  button "Go" -> Cart?id=1&x=a.b
			}

			component Nav {
			  use Logo
			}
			""");
	}

	@Test
	void printEveryStatementForm() {
		Program program = syntax("""
			app A { entry Home }
			page Home {
			  text "t"
			  field f
			  input i
			  link "L" -> Home
			  submit "S" -> save
			  click "C" -> tap
			  on save { ok -> Home fail -> Home }
			  if x == 1 || !y && z != "q" { query p : number = 2 }
			  query raw
			  query d = false
			  table T { columns ["A", "B"] row [1, "x"] { button "b" } row [2, y + 1] }
			  chart C pie { series "s" { point "a", 10 } }
			}
			""");

		assertThat(SwanPrettyPrinter.print(program)).isEqualTo("""
			app A {
			  entry Home
			}

			page Home {
			  text "t"
			  field f
			  input i
			  link "L" -> Home
			  submit "S" -> save
			  click "C" -> tap
			  on save {
			    ok -> Home
			    fail -> Home
			  }
			  if x == 1 || !y && z != "q" {
			    query p: number = 2
			  }
			  query raw
			  query d = false
			  table T {
			    columns ["A", "B"]
			    row [1, "x"] {
			      button "b"
			    }
			    row [2, y + 1]
			  }
			  chart C pie {
			    series "s" {
			      point "a", 10
			    }
			  }
			}
			""");
	}

	@Test
	void literalsAreReproducedExactly() {
		Program program = syntax("app A { entry H } page H { query n : number = 1.50 query s = \"a\\b\" if flag == true { } }");

		String printed = SwanPrettyPrinter.print(program);

		assertThat(printed).contains("query n: number = 1.50").contains("query s = \"a\\b\"").contains("if flag == true {");
	}

	@ParameterizedTest
	@ValueSource(strings = { "my-app.swan", "admin-console.swan" })
	void printingIsAFixedPoint(String fixture) {
		Program program = Swan.parse(Fixtures.read(fixture));

		String printed = SwanPrettyPrinter.print(program);
		Program reparsed = Swan.parse(printed);

		assertThat(SwanPrettyPrinter.print(reparsed)).isEqualTo(printed);
		assertThat(reparsed.pages()).hasSameSizeAs(program.pages());
		assertThat(reparsed.components()).hasSameSizeAs(program.components());
	}

	@Test
	void expressionPrecedenceSurvivesReprinting() {
		String expression = "a + b + c < d || !e && f";
		Program program = syntax("app A { entry H } page H { if " + expression + " { } }");

		String printed = SwanPrettyPrinter.print(program);
		Program reparsed = syntax(printed);

		assertThat(printed).contains("if " + expression + " {");
		assertThat(reparsed.pages().get(0).body().get(0)).usingRecursiveComparison()
			.ignoringFieldsMatchingRegexes(".*position")
			.isEqualTo(program.pages().get(0).body().get(0));
	}

	@Test
	void customIndentation() {
		Program program = syntax("app A { entry H } page H { header \"x\" }");
		SwanPrettyPrinter printer = new SwanPrettyPrinter(4);

		printer.printProgram(program);

		assertThat(printer.toString()).contains("\n    header \"x\"\n");
	}
}
