package io.jtv.core.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Param;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.Purity;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.error.ProgramLoadException;
import io.jtv.core.types.Type;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ProgramLoaderTest")
class ProgramLoaderTest {

    private final ProgramLoader loader = new ProgramLoader();

    @TempDir
    Path tempDir;

    /** Parses a document whose main block holds a single {@code assign x = <expression>}. */
    private DataExpr parseExpression(String yamlExpression) {
        Program program = loader.parse("main:\n  - assign: { target: x, value: " + yamlExpression + " }\n", "expr");
        return ((ControlStmt.Assign) program.body()).value();
    }

    private Condition parseCondition(String yamlCondition) {
        Program program = loader.parse("main:\n  - while: { cond: " + yamlCondition + ", body: [] }\n", "cond");
        return ((ControlStmt.While) program.body()).condition();
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        void idDefaultsToTheFileName() throws IOException {
            Path file = tempDir.resolve("counter.yaml");
            Files.writeString(file, """
                    main:
                      - assign: { target: n, value: 0 }
                    """);

            Program program = loader.load(file);

            assertThat(program.id()).isEqualTo("counter");
            assertThat(program.body()).isEqualTo(new ControlStmt.Assign("n", DataExpr.integer(0)));
        }

        @Test
        void explicitIdWins() {
            Program program = loader.parse("""
                    id: named
                    main: []
                    """, "inline");

            assertThat(program.id()).isEqualTo("named");
            assertThat(program.body()).isEqualTo(ControlStmt.skip());
        }

        @Test
        void jsonIsAcceptedToo() {
            Program program = loader.parse("""
                    {"main": [{"print": {"rational": [3, 6]}}]}
                    """, "json");

            assertThat(program.body()).isEqualTo(new ControlStmt.Print(DataExpr.rational(3, 6)));
        }

        @Test
        void functionsAreHoistedBeforeMain() {
            Program program = loader.parse("""
                    functions:
                      - name: inc
                        purity: total
                        params:
                          - { name: n, type: rational }
                        returns: rational
                        body:
                          - return: { add: [n, 1] }
                    main:
                      - assign: { target: y, value: { call: { name: inc, args: [2] } } }
                    """, "fns");

            assertThat(program.functions()).singleElement().satisfies(fn -> {
                assertThat(fn.name()).isEqualTo("inc");
                assertThat(fn.purity()).isEqualTo(Purity.TOTAL);
                assertThat(fn.params()).containsExactly(new Param("n", Type.RATIONAL));
                assertThat(fn.returnType()).isEqualTo(Type.RATIONAL);
            });
            assertThat(program.body()).isInstanceOf(ControlStmt.Sequence.class);
        }

        @Test
        void missingPurityMeansImpureAndMissingReturnsMeansUnit() {
            Program program = loader.parse("""
                    main:
                      - function:
                          name: say
                          body:
                            - print: 1
                    """, "defaults");

            assertThat(program.functions()).singleElement().satisfies(fn -> {
                assertThat(fn.purity()).isEqualTo(Purity.IMPURE);
                assertThat(fn.returnType()).isEqualTo(Type.UNIT);
            });
        }

        @Test
        void statementsMapToTheirNodes() {
            Program program = loader.parse("""
                    main:
                      - for:
                          var: i
                          from: 0
                          to: 3
                          body:
                            - print: i
                      - if:
                          cond: i
                          then:
                            - skip: null
                      - reverse:
                          - add: { target: a, value: b }
                          - sub: { target: b, value: 1 }
                      - call: { name: log, args: [a] }
                      - return: a
                    """, "stmts");

            assertThat(program.body()).isEqualTo(ControlStmt.sequence(
                    new ControlStmt.ForRange(
                            "i", DataExpr.integer(0), DataExpr.integer(3), new ControlStmt.Print(DataExpr.var("i"))),
                    new ControlStmt.If(Condition.of(DataExpr.var("i")), ControlStmt.skip(), ControlStmt.skip()),
                    new ControlStmt.ReverseBlock(List.of(
                            new ReversibleOp.AddAssign("a", DataExpr.var("b")),
                            new ReversibleOp.SubAssign("b", DataExpr.integer(1)))),
                    new ControlStmt.CallStmt("log", List.of(DataExpr.var("a"))),
                    new ControlStmt.Return(DataExpr.var("a"))));
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource(delimiter = '|', value = {
            "{ hex: \"0xFF\" }        | 255",
            "{ hex: \"ff\" }          | 255",
            "{ hex: \"-0x10\" }       | -16",
            "{ binary: \"0b1010\" }   | 10",
            "{ binary: \"1111_0000\" }| 240",
            "{ int: \"1_000_000\" }   | 1000000",
            "12345678901234567890123  | 12345678901234567890123"
        })
        void integerSpellingsDecodeToIntegerLiterals(String yaml, String expected) {
            assertThat(parseExpression(yaml)).isEqualTo(new DataExpr.IntegerLiteral(new BigInteger(expected)));
        }

        @Test
        void otherKinds() {
            assertThat(parseExpression("2.5")).isEqualTo(DataExpr.floating(2.5));
            assertThat(parseExpression("{ float: \"1e-3\" }")).isEqualTo(DataExpr.floating(0.001));
            assertThat(parseExpression("{ rational: [2, 4] }")).isEqualTo(DataExpr.rational(2, 4));
            assertThat(parseExpression("{ complex: [1.5, -2] }")).isEqualTo(DataExpr.complex(1.5, -2));
            assertThat(parseExpression("{ symbol: pi }")).isEqualTo(DataExpr.symbol("pi"));
            assertThat(parseExpression("{ var: x1 }")).isEqualTo(DataExpr.var("x1"));
        }

        @Test
        void operatorsBuildTrees() {
            assertThat(parseExpression("{ sub: [a, { neg: b }] }"))
                    .isEqualTo(DataExpr.add(DataExpr.var("a"), DataExpr.negate(DataExpr.negate(DataExpr.var("b")))));
            assertThat(parseExpression("{ call: { name: to_float, args: [{ rational: [1, 3] }] } }"))
                    .isEqualTo(DataExpr.call("to_float", DataExpr.rational(1, 3)));
        }

        @Test
        void badHexIsRejected() {
            assertThatThrownBy(() -> parseExpression("{ hex: \"0xZZ\" }"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("Invalid base-16 integer literal");
        }

        @Test
        void zeroDenominatorIsRejected() {
            assertThatThrownBy(() -> loader.load(Path.of("src/test/resources/programs/invalid/zero-denominator.yaml")))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("zero denominator");
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        void bareExpressionIsTruthy() {
            assertThat(parseCondition("n")).isEqualTo(Condition.of(DataExpr.var("n")));
            assertThat(parseCondition("{ add: [n, 1] }"))
                    .isEqualTo(Condition.of(DataExpr.add(DataExpr.var("n"), DataExpr.integer(1))));
        }

        @ParameterizedTest
        @CsvSource({"==, EQ", "!=, NE", "<, LT", "<=, LE", ">, GT", ">=, GE"})
        void comparisonOperators(String symbol, Condition.Comparator expected) {
            Condition parsed = parseCondition("{ compare: { left: a, op: \"" + symbol + "\", right: 0 } }");

            assertThat(parsed).isEqualTo(Condition.compare(DataExpr.var("a"), expected, DataExpr.integer(0)));
        }

        @Test
        void logicalConnectivesFoldLeft() {
            Condition parsed = parseCondition("{ and: [a, b, { not: c }] }");

            assertThat(parsed).isEqualTo(new Condition.Logical(
                    new Condition.Logical(
                            Condition.of(DataExpr.var("a")), Condition.LogicalOp.AND, Condition.of(DataExpr.var("b"))),
                    Condition.LogicalOp.AND,
                    new Condition.Not(Condition.of(DataExpr.var("c")))));
        }

        @Test
        void connectiveNeedsTwoOperands() {
            assertThatThrownBy(() -> parseCondition("{ or: [a] }"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("at least two conditions");
        }

        @Test
        void unknownOperatorIsRejected() {
            assertThatThrownBy(() -> parseCondition("{ compare: { left: a, op: \"=<\", right: 0 } }"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("Unknown comparison operator '=<'");
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        void unknownKeyInsideStatement() {
            assertThatThrownBy(() -> loader.load(Path.of("src/test/resources/programs/invalid/unknown-statement-key.yaml")))
                    .isInstanceOfSatisfying(ProgramLoadException.class, e -> {
                        assertThat(e.getMessage()).contains("Unknown key in 'assign': [comment]");
                        assertThat(e.source()).endsWith("unknown-statement-key.yaml");
                        assertThat(e.urn()).isEqualTo(ProgramLoadException.URN);
                    });
        }

        @Test
        void unknownTopLevelKeyFailsSchemaValidation() {
            assertThatThrownBy(() -> loader.load(Path.of("src/test/resources/programs/invalid/unknown-top-level-key.yaml")))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("does not match the document schema");
        }

        @Test
        void missingMainFailsSchemaValidation() {
            assertThatThrownBy(() -> loader.parse("id: nothing\n", "nomain"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("does not match the document schema");
        }

        @Test
        void unknownStatementNameFailsSchemaValidation() {
            assertThatThrownBy(() -> loader.parse("main:\n  - goto: 10\n", "goto"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("does not match the document schema");
        }

        @Test
        void unknownExpressionIsRejected() {
            assertThatThrownBy(() -> parseExpression("{ mul: [1, 2] }"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("Unknown expression 'mul'");
        }

        @Test
        void unknownReverseUpdateIsRejected() {
            assertThatThrownBy(() -> loader.parse("""
                    main:
                      - reverse:
                          - mul: { target: a, value: 2 }
                    """, "rev"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("expected 'add' or 'sub'");
        }

        @Test
        void unknownTypeNameIsRejected() {
            assertThatThrownBy(() -> loader.parse("""
                    functions:
                      - name: f
                        params:
                          - { name: n, type: quaternion }
                        body: []
                    main: []
                    """, "types"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("quaternion");
        }

        @Test
        void unknownKeyInNestedFunction() {
            assertThatThrownBy(() -> loader.parse("""
                    main:
                      - function: { name: f, body: [], inline: true }
                    """, "nested"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("Unknown key in 'function': [inline]");
        }

        @Test
        void malformedYamlIsALoadError() {
            assertThatThrownBy(() -> loader.parse("main: [unclosed", "broken"))
                    .isInstanceOfSatisfying(ProgramLoadException.class, e ->
                            assertThat(e.source()).isEqualTo("broken"));
        }

        @Test
        void missingFileIsALoadError() {
            assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("Failed to read or parse program");
        }

        @Test
        void emptyDocumentIsRejected() {
            assertThatThrownBy(() -> loader.parse("", "empty"))
                    .isInstanceOf(ProgramLoadException.class)
                    .hasMessageContaining("empty");
        }
    }
}
