package org.dpll.solver;

import org.dpll.support.Assignment;
import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

import java.util.Random;

/** Generatori di formule e oracolo a forza bruta per i test del solutore. */
final class TestFormulas {

    private TestFormulas() {
    }

    /** Formula casuale con clausole da 1 a {@code maxWidth} letterali. */
    static Formula random(Random random, int variables, int clauses, int maxWidth) {
        final Formula formula = new Formula();
        for (int i = 0; i < clauses; i++) {
            final Clause clause = new Clause();
            final int width = 1 + random.nextInt(maxWidth);
            for (int j = 0; j < width; j++) {
                clause.add(Literal.of(random.nextInt(variables), random.nextBoolean()));
            }
            formula.add(clause);
        }
        return formula;
    }

    /**
     * Principio della piccionaia: {@code holes + 1} piccioni in {@code holes} buchi.
     * La variabile {@code pigeon * holes + hole} indica "il piccione occupa il buco".
     * Sempre insoddisfacibile.
     */
    static Formula pigeonhole(int holes) {
        final Formula formula = new Formula();
        final int pigeons = holes + 1;

        // ogni piccione occupa almeno un buco
        for (int pigeon = 0; pigeon < pigeons; pigeon++) {
            final Clause clause = new Clause();
            for (int hole = 0; hole < holes; hole++) {
                clause.add(Literal.positive(pigeon * holes + hole));
            }
            formula.add(clause);
        }

        // nessun buco ospita due piccioni
        for (int hole = 0; hole < holes; hole++) {
            for (int first = 0; first < pigeons; first++) {
                for (int second = first + 1; second < pigeons; second++) {
                    formula.add(Clause.of(
                            Literal.negated(first * holes + hole),
                            Literal.negated(second * holes + hole)));
                }
            }
        }
        return formula;
    }

    /** Enumera tutti gli assegnamenti: utilizzabile solo con poche variabili. */
    static boolean bruteForceSatisfiable(Formula formula) {
        final int variables = formula.variableCount();
        for (long bits = 0; bits < (1L << variables); bits++) {
            final Assignment assignment = new Assignment(variables);
            for (int v = 0; v < variables; v++) {
                assignment.set(v, (bits & (1L << v)) != 0);
            }
            if (formula.isSatisfiedBy(assignment)) {
                return true;
            }
        }
        return false;
    }
}
