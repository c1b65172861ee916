package org.dpll.solver;

import org.dpll.support.Assignment;
import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PROPAGATORE UNITARIO - Risoluzione delle clausole unitarie
 *
 * Una clausola unitaria {@code ... ∧ x ∧ ...} impone l'assegnamento che rende
 * vero x. Il propagatore cerca la prima clausola unitaria in ordine di formula,
 * scrive il valore nell'assegnamento condiviso e semplifica, finché non ne
 * restano. Ogni passo rimuove almeno la clausola unitaria stessa, quindi il
 * ciclo termina.
 *
 * I valori scritti non vengono mai annullati: se il ramo fallisce restano
 * nell'assegnamento come residuo privo di significato.
 */
public final class UnitPropagator {

    private static final Logger LOGGER = Logger.getLogger(UnitPropagator.class.getName());

    private UnitPropagator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Propaga tutte le clausole unitarie fino al punto fisso.
     *
     * @param formula formula da semplificare in place
     * @param assignment assegnamento condiviso, aggiornato con i valori forzati
     * @return numero di clausole unitarie risolte
     */
    public static int propagate(Formula formula, Assignment assignment) {
        int propagations = 0;

        Clause unit;
        while ((unit = findUnitClause(formula)) != null) {
            Literal literal = unit.get(0);
            int variable = literal.variable();
            boolean truth = literal.isPositive();

            assignment.set(variable, truth);
            Simplifier.assign(formula, variable, truth);
            propagations++;

            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Propagato " + literal + ", clausole residue: " + formula.size());
            }
        }

        return propagations;
    }

    private static Clause findUnitClause(Formula formula) {
        for (Clause clause : formula) {
            if (clause.isUnit()) {
                return clause;
            }
        }
        return null;
    }
}
