package org.dpll.dimacs;

import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.dpll.support.Literal.negated;
import static org.dpll.support.Literal.positive;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Test di {@link DimacsParser}. */
public class DimacsParserTest {

    private static DimacsParser parser(String text) {
        return new DimacsParser(new BufferedReader(new StringReader(text)));
    }

    private static DimacsFormatException.Kind failure(String text) {
        final DimacsFormatException e =
                assertThrows(DimacsFormatException.class, () -> parser(text).parse());
        return e.getKind();
    }

    @Test void testLoad() throws Exception {
        final Formula formula = DimacsParser.load(
                new BufferedReader(new StringReader("c example\np cnf 3 2\n1 -2 3 0\n-1 -3 0\n")));
        assertThat(formula, is(Formula.of(
                Clause.of(positive(0), negated(1), positive(2)),
                Clause.of(negated(0), negated(2)))));
    }

    @Test void testLoadFromFile() throws Exception {
        final Formula formula = DimacsParser.load(resource("example.cnf"));
        assertThat(formula.size(), is(2));
        assertThat(formula.variableCount(), is(3));
    }

    @Test void testHeaderExposed() throws Exception {
        final DimacsParser parser = parser("p cnf 5 1\n1 0\n");
        parser.parse();
        assertThat(parser.getHeader(), is(new DimacsHeader(5, 1)));
        assertThrows(IllegalStateException.class, parser::parse);
    }

    //region INTESTAZIONE

    @Test void testHeaderValid() throws Exception {
        assertThat(parser("p cnf 3 2\n").parseHeader(), is(new DimacsHeader(3, 2)));
    }

    @Test void testHeaderAfterCommentAndEmptyLines() throws Exception {
        assertThat(parser("c comment\n\n\np cnf 3 2\n").parseHeader(), is(new DimacsHeader(3, 2)));
    }

    @Test void testNoHeader() {
        assertThat(failure("1 2 3 4\n"), is(DimacsFormatException.Kind.NO_HEADER));
        assertThat(failure(""), is(DimacsFormatException.Kind.NO_HEADER));
        assertThat(failure("c only a comment\n"), is(DimacsFormatException.Kind.NO_HEADER));
    }

    @Test void testBadHeader() {
        assertThat(failure("p cnf\n"), is(DimacsFormatException.Kind.BAD_HEADER));
        assertThat(failure("p cnf 3 2 1\n"), is(DimacsFormatException.Kind.BAD_HEADER));
        assertThat(failure("p dnf 3 2\n"), is(DimacsFormatException.Kind.BAD_HEADER));
        assertThat(failure("p cnf -1 2\n"), is(DimacsFormatException.Kind.BAD_HEADER));
        assertThat(failure("p cnf 1 -2\n"), is(DimacsFormatException.Kind.BAD_HEADER));
        assertThat(failure("p cnf x 2\n"), is(DimacsFormatException.Kind.BAD_HEADER));
    }

    //endregion

    //region CLAUSOLE

    @Test void testFormulaEmpty() throws Exception {
        assertThat(parser("").parseFormula(new DimacsHeader(0, 0)), is(new Formula()));
    }

    @Test void testFormulaWithComment() throws Exception {
        final Formula formula =
                parser("1 2 0\nc comment\n-3 -4 -5 0\n").parseFormula(new DimacsHeader(5, 2));
        assertThat(formula, is(Formula.of(
                Clause.of(positive(0), positive(1)),
                Clause.of(negated(2), negated(3), negated(4)))));
    }

    @Test void testClausesCoalescedOnOneLine() throws Exception {
        final Formula formula = parser("1 2 0 -1 -2 0\n").parseFormula(new DimacsHeader(2, 2));
        assertThat(formula, is(Formula.of(
                Clause.of(positive(0), positive(1)),
                Clause.of(negated(0), negated(1)))));
    }

    @Test void testClauseSpanningLines() throws Exception {
        final Formula formula = parser("1\n-2\n0\n").parseFormula(new DimacsHeader(2, 1));
        assertThat(formula, is(Formula.of(Clause.of(positive(0), negated(1)))));
    }

    @Test void testDoubleTerminatorIsEmptyClause() throws Exception {
        final Formula formula = parser("1 0 0\n").parseFormula(new DimacsHeader(1, 2));
        assertThat(formula, is(Formula.of(Clause.of(positive(0)), new Clause())));
    }

    @Test void testTooManyVariables() {
        final DimacsFormatException e = assertThrows(DimacsFormatException.class,
                () -> parser("1 2 3 4 0\n").parseFormula(new DimacsHeader(3, 1)));
        assertThat(e.getKind(), is(DimacsFormatException.Kind.VARIABLE_COUNT));
        assertThat(failure("p cnf 2 1\n-3 0\n"), is(DimacsFormatException.Kind.VARIABLE_COUNT));
    }

    @Test void testTooManyClauses() {
        assertThat(failure("p cnf 2 2\n1 2 0 1 2 0 1 2 0\n"), is(DimacsFormatException.Kind.CLAUSE_COUNT));
    }

    @Test void testTooFewClauses() {
        assertThat(failure("p cnf 2 2\n1 2 0\n"), is(DimacsFormatException.Kind.CLAUSE_COUNT));
    }

    @Test void testUnterminatedLiteralsDropped() {
        assertThat(failure("p cnf 2 2\n1 2 0\n-1 -2\n"), is(DimacsFormatException.Kind.CLAUSE_COUNT));
    }

    @Test void testBadToken() {
        assertThat(failure("p cnf 2 1\n1 x 0\n"), is(DimacsFormatException.Kind.BAD_CLAUSE));
        assertThat(failure("p cnf 2 1\n1 99999999999 0\n"), is(DimacsFormatException.Kind.BAD_CLAUSE));
    }

    /** Un token non numerico prevale su un letterale fuori range in una riga precedente. */
    @Test void testBadTokenReportedFirst() {
        assertThat(failure("p cnf 1 2\n5 0\n1 % 0\n"), is(DimacsFormatException.Kind.BAD_CLAUSE));
    }

    @Test void testMessageNamesLine() {
        final DimacsFormatException e = assertThrows(DimacsFormatException.class,
                () -> parser("p cnf 2 1\n\n1 y 0\n").parse());
        assertThat(e.getMessage(), containsString("clausola non valida"));
        assertThat(e.getMessage(), containsString("riga 3"));
    }

    //endregion

    @Test void testBadHeaderFile() {
        final DimacsFormatException e = assertThrows(DimacsFormatException.class,
                () -> DimacsParser.load(resource("bad-header.cnf")));
        assertThat(e.getKind(), is(DimacsFormatException.Kind.BAD_HEADER));
    }

    static Path resource(String name) throws URISyntaxException {
        return Paths.get(DimacsParserTest.class.getResource("/cnf/" + name).toURI());
    }
}
