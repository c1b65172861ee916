package org.dpll.support;

import org.junit.jupiter.api.Test;

import static org.dpll.support.Literal.negated;
import static org.dpll.support.Literal.positive;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Test di {@link Literal}. */
public class LiteralTest {

    @Test void testEqualityOnTagAndIndex() {
        assertThat(positive(3), is(positive(3)));
        assertThat(positive(3), not(negated(3)));
        assertThat(positive(3), not(positive(4)));
        assertThat(positive(3).hashCode(), is(positive(3).hashCode()));
    }

    @Test void testNegate() {
        assertThat(positive(2).negate(), is(negated(2)));
        assertThat(negated(2).negate(), is(positive(2)));
        assertThat(Literal.of(5, false), is(negated(5)));
    }

    @Test void testTruth() {
        assertThat(positive(0).isTrueUnder(true), is(true));
        assertThat(positive(0).isTrueUnder(false), is(false));
        assertThat(negated(0).isTrueUnder(false), is(true));
        assertThat(negated(0).isTrueUnder(true), is(false));
    }

    @Test void testDimacsIsOneBasedSigned() {
        assertThat(positive(0).toDimacs(), is(1));
        assertThat(negated(0).toDimacs(), is(-1));
        assertThat(negated(9).toDimacs(), is(-10));
        assertThat(negated(9), hasToString("-9"));
    }

    @Test void testNegativeIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> positive(-1));
    }
}
