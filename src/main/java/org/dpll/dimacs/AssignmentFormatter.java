package org.dpll.dimacs;

import org.dpll.support.Assignment;
import org.dpll.support.Literal;

/**
 * Formatta un assegnamento come riga di letterali DIMACS: {@code 1 -2 3 -4}.
 */
public final class AssignmentFormatter {

    private AssignmentFormatter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Ogni variabile in ordine di indice diventa {@code i+1} se vera,
     * {@code -(i+1)} se falsa; separatore singolo spazio, stringa vuota per
     * l'assegnamento vuoto.
     */
    public static String format(Assignment assignment) {
        StringBuilder message = new StringBuilder();
        for (int i = 0; i < assignment.size(); i++) {
            if (i > 0) {
                message.append(' ');
            }
            message.append(Literal.of(i, assignment.get(i)).toDimacs());
        }
        return message.toString();
    }
}
