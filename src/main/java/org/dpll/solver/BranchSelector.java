package org.dpll.solver;

import org.dpll.support.Clause;
import org.dpll.support.Formula;
import org.dpll.support.Literal;

/**
 * Euristica di diramazione: sceglie la variabile con più occorrenze nella formula.
 */
public final class BranchSelector {

    private BranchSelector() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Trova la variabile più usata nella formula.
     *
     * Ogni occorrenza conta, positiva o negata, anche ripetuta nella stessa
     * clausola. A parità di frequenza vince l'indice più basso. Senza alcuna
     * occorrenza restituisce 0.
     *
     * @param formula formula corrente (dopo la propagazione)
     * @param variableCount dimensione dell'assegnamento
     * @return indice della variabile dominante
     */
    public static int dominantVariable(Formula formula, int variableCount) {
        int[] frequencies = new int[variableCount];

        for (Clause clause : formula) {
            for (Literal literal : clause) {
                frequencies[literal.variable()]++;
            }
        }

        int max = 0;
        int argmax = 0;
        for (int variable = 0; variable < frequencies.length; variable++) {
            if (frequencies[variable] > max) {
                max = frequencies[variable];
                argmax = variable;
            }
        }

        return argmax;
    }
}
