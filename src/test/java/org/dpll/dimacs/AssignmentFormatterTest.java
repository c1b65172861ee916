package org.dpll.dimacs;

import org.dpll.support.Assignment;
import org.dpll.support.Literal;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

/** Test di {@link AssignmentFormatter}. */
public class AssignmentFormatterTest {

    @Test void testEmpty() {
        assertThat(AssignmentFormatter.format(new Assignment(0)), is(""));
    }

    @Test void testOneBasedSigned() {
        assertThat(AssignmentFormatter.format(Assignment.of(true, false, true, false)),
                is("1 -2 3 -4"));
    }

    @Test void testMatchesLiteralEncoding() {
        final Assignment assignment = Assignment.of(false, true, false);
        final String[] tokens = AssignmentFormatter.format(assignment).split(" ");
        for (int i = 0; i < tokens.length; i++) {
            assertThat(Integer.parseInt(tokens[i]), is(Literal.of(i, assignment.get(i)).toDimacs()));
        }
    }

    @Test void testSingleVariable() {
        assertThat(AssignmentFormatter.format(Assignment.of(false)), is("-1"));
    }
}
