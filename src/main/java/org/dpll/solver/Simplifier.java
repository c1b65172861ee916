package org.dpll.solver;

import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

/**
 * SEMPLIFICATORE - Applicazione di un assegnamento a una formula CNF
 *
 * Un assegnamento {@code variable = truth} rende vero un letterale e falso il
 * suo complementare:
 * • C ∨ y = vero    se y vero  → la clausola viene rimossa
 * • C ∨ x = C       se x falso → il letterale viene rimosso
 *
 * La semplificazione può lasciare clausole vuote: una clausola vuota nasce
 * solo da una clausola unitaria il cui letterale diventa falso, quindi la
 * formula è insoddisfacibile.
 *
 * È il punto più caldo del solutore: opera sulle strutture esistenti con
 * rimozione per scambio e troncamento, senza allocare nuove clausole.
 */
public final class Simplifier {

    private Simplifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Semplifica la formula in place secondo l'assegnamento {@code variable = truth}.
     *
     * @param formula formula da riscrivere
     * @param variable indice della variabile assegnata
     * @param truth valore assegnato
     */
    public static void assign(Formula formula, int variable, boolean truth) {
        Literal truthy = Literal.of(variable, truth);
        Literal falsey = truthy.negate();

        int clauseIndex = 0;
        while (clauseIndex < formula.size()) {
            Clause clause = formula.get(clauseIndex);

            // Clausola soddisfatta: la posizione corrente riceve l'ultima clausola
            if (clause.contains(truthy)) {
                formula.swapRemove(clauseIndex);
                continue;
            }

            int literalIndex = 0;
            while (literalIndex < clause.size()) {
                if (clause.get(literalIndex).equals(falsey)) {
                    clause.swapRemove(literalIndex);
                    continue;
                }
                literalIndex++;
            }

            clauseIndex++;
        }
    }
}
